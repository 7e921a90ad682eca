package io.coldtag.core.metric;

import static io.coldtag.core.metric.Fixtures.at;
import static io.coldtag.core.metric.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.reading.ReadingStore;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.TagType;
import io.coldtag.core.window.DataWindowResolver;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("CenterPointDeviationAlgorithm")
@ExtendWith(MockitoExtension.class)
class CenterPointDeviationAlgorithmTest {

    private final Fixtures fixtures = new Fixtures();

    @Mock private ReadingStore store;

    @BeforeEach
    void setUp() {
        fixtures.readings(at("A", 0, 2.0), at("B", 0, 6.0), at("A", 1, 3.0), at("B", 1, 4.0));
    }

    private FunctionConfig config() {
        return window(FunctionKind.CENTER_POINT_TEMP_DEVIATION).centerPointTagId("cp").build();
    }

    @Test
    void shouldReportDeviationFromSetPoint() {
        // Given: mean 3.75
        fixtures.tag("cp", TagType.NUMBER, "5");

        // When
        FunctionResult result = fixtures.evaluate(config());

        // Then
        assertThat(result.getValue()).isEqualTo(1.3);
        assertThat(result.getDetail())
                .contains("中心点温度设定值: 5")
                .contains("平均温度: 3.8")
                .contains("偏差值: 1.3");
    }

    @Test
    void shouldAcceptSingleElementList() {
        fixtures.tag("cp", TagType.NUMBER, List.of(4));

        FunctionResult result = fixtures.evaluate(config());

        assertThat(result.getValue()).isEqualTo(0.3);
    }

    @Nested
    @DisplayName("invalid center point")
    class InvalidCenterPoint {

        @Test
        void shouldRequireCenterPointTagId() {
            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.CENTER_POINT_TEMP_DEVIATION).build());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.MISSING_INPUT);
            assertThat(result.getMessage()).isEqualTo("请选择中心点布点标签");
        }

        @Test
        void shouldReportMissingTag() {
            FunctionResult result = fixtures.evaluate(config());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TAG_NOT_FOUND);
            assertThat(result.getMessage()).isEqualTo("中心点布点标签不存在");
        }

        @Test
        void shouldRejectDelimitedValues() {
            fixtures.tag("cp", TagType.NUMBER, "5|6");

            FunctionResult result = fixtures.evaluate(config());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.MULTIPLE_VALUES_NOT_ALLOWED);
            assertThat(result.getMessage()).isEqualTo("中心点布点标签只能有一个值，当前有多个值（用 | 或逗号分隔）");
        }

        @Test
        void shouldRejectListWithSeveralValues() {
            fixtures.tag("cp", TagType.NUMBER, List.of("5", "6"));

            FunctionResult result = fixtures.evaluate(config());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.MULTIPLE_VALUES_NOT_ALLOWED);
            assertThat(result.getMessage()).isEqualTo("中心点布点标签只能有一个值，当前有多个值");
        }

        @Test
        void shouldRejectBlankValue() {
            fixtures.tag("cp", TagType.NUMBER, " ");

            FunctionResult result = fixtures.evaluate(config());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_VALUE);
            assertThat(result.getMessage()).isEqualTo("中心点布点标签值不能为空");
        }

        @Test
        void shouldRejectNonNumericValue() {
            fixtures.tag("cp", TagType.NUMBER, "abc");

            FunctionResult result = fixtures.evaluate(config());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_VALUE);
            assertThat(result.getMessage()).isEqualTo("中心点布点标签值不是有效的数字: abc");
        }

        @Test
        void shouldNotQueryStoreForInvalidInput() {
            // Given
            fixtures.tag("cp", TagType.NUMBER, "abc");
            ColdtagConfig config = ColdtagConfig.builder().zone(ZoneOffset.UTC).build();
            FunctionEvaluator evaluator =
                    new FunctionEvaluator(
                            new DefaultMetricRegistry(),
                            config,
                            new DataWindowResolver(store, config.getZone()));

            // When
            FunctionResult result = evaluator.evaluate(config(), Fixtures.TASK, fixtures.roster());

            // Then
            assertThat(result.isSuccess()).isFalse();
            verifyNoInteractions(store);
        }
    }
}

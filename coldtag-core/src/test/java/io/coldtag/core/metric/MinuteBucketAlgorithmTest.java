package io.coldtag.core.metric;

import static io.coldtag.core.metric.Fixtures.at;
import static io.coldtag.core.metric.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.TagType;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MinuteBucketAlgorithm")
class MinuteBucketAlgorithmTest {

    private final Fixtures fixtures = new Fixtures();

    /// Bucket 09:00 spans 2..6, bucket 09:01 spans 3..4; device A spans 2..3, B spans 4..6.
    private void loadSameTimeScenario() {
        fixtures.readings(at("A", 0, 2.0), at("B", 0, 6.0), at("A", 1, 3.0), at("B", 1, 4.0));
    }

    @Nested
    @DisplayName("max temperature difference")
    class MaxDiff {

        @Test
        void shouldReportWidestBucket() {
            // Given
            loadSameTimeScenario();

            // When
            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.MAX_TEMP_DIFF_AT_SAME_TIME).build());

            // Then
            assertThat(result.getValue()).isEqualTo(4.0);
            assertThat(result.getDetail())
                    .contains("对应时间点: 2024-01-15 09:00")
                    .contains("该时间点最高温度: 6.0")
                    .contains("时间点总数: 2");
        }

        @Test
        void shouldReportMinuteOfWidestBucket() {
            loadSameTimeScenario();

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.MAX_TEMP_DIFF_TIME_POINT).build());

            assertThat(result.getValue()).isEqualTo("2024-01-15 09:00");
        }

        @Test
        void shouldKeepEarliestBucketOnTie() {
            fixtures.readings(at("A", 0, 2.0), at("B", 0, 6.0), at("A", 1, 0.0), at("B", 1, 4.0));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.MAX_TEMP_DIFF_TIME_POINT).build());

            assertThat(result.getValue()).isEqualTo("2024-01-15 09:00");
        }
    }

    @Nested
    @DisplayName("device ranges")
    class DeviceRanges {

        @Test
        void shouldDivideRangeSumByWholeMinutes() {
            // Given: ranges 1 + 2 over 60 minutes
            loadSameTimeScenario();

            // When
            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY).build());

            // Then
            assertThat(result.getValue()).isEqualTo(0.05);
            assertThat(result.getDetail())
                    .contains("时间范围: 60 分钟")
                    .contains("A: 2.0~3.0 (范围: 1.0)")
                    .contains("B: 4.0~6.0 (范围: 2.0)");
        }

        @Test
        void shouldRejectZeroLengthWindow() {
            // Given
            fixtures.tag("end", TagType.DATETIME, "2024-01-15 09:00");
            loadSameTimeScenario();

            // When
            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY).build());

            // Then
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_INTERVAL);
            assertThat(result.getMessage()).isEqualTo("时间范围无效，结束时间必须晚于开始时间");
        }

        @Test
        void shouldSumDeviceRanges() {
            loadSameTimeScenario();

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_VARIATION_RANGE_SUM).build());

            assertThat(result.getValue()).isEqualTo(3.0);
        }

        @Test
        void shouldTruncateDeviceDetails() {
            // Given
            fixtures.config(ColdtagConfig.builder().zone(ZoneOffset.UTC).previewLimit(1).build());
            loadSameTimeScenario();

            // When
            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_VARIATION_RANGE_SUM).build());

            // Then
            assertThat(result.getDetail())
                    .contains("A: 2.0~3.0")
                    .doesNotContain("B: 4.0~6.0")
                    .contains("...（共 2 条）");
        }
    }

    @Nested
    @DisplayName("fluctuation")
    class Fluctuation {

        @Test
        void shouldPrefixFluctuationWithPlusMinus() {
            // Given
            loadSameTimeScenario();

            // When
            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_FLUCTUATION).build());

            // Then
            assertThat(result.getValue()).isEqualTo(2.0);
            assertThat(result.getMessage()).isEqualTo("计算完成：±2");
        }

        @Test
        void shouldHonourDecimalPlacesOverride() {
            fixtures.readings(at("A", 0, 2.0), at("B", 0, 6.5));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_FLUCTUATION).decimalPlaces(1).build());

            assertThat(result.getValue()).isEqualTo(2.3);
            assertThat(result.getMessage()).isEqualTo("计算完成：±2.3");
        }

        @Test
        void shouldRejectOutOfRangeDecimalPlaces() {
            loadSameTimeScenario();

            FunctionResult result =
                    fixtures.evaluate(
                            window(FunctionKind.TEMP_FLUCTUATION).decimalPlaces(25).build());

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_VALUE);
        }

        @Test
        void shouldReportCenterPointFluctuation() {
            loadSameTimeScenario();

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.CENTER_POINT_TEMP_FLUCTUATION).build());

            assertThat(result.getValue()).isEqualTo(2.0);
            assertThat(result.getDetail()).contains("温度差: 4.00");
        }

        @Test
        void shouldAverageBucketSpreads() {
            // Given: spreads 4 and 1
            loadSameTimeScenario();

            // When
            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY_AVERAGE).build());

            // Then
            assertThat(result.getValue()).isEqualTo(2.5);
            assertThat(result.getDetail())
                    .contains("1. 2024-01-15 09:00 差值:4.00")
                    .contains("2. 2024-01-15 09:01 差值:1.00");
        }
    }

    @Nested
    @DisplayName("paired uniformity")
    class PairedUniformity {

        private void loadFourBuckets() {
            fixtures.readings(
                    at("A", 0, 10.0), at("B", 0, 2.0),
                    at("A", 1, 12.0), at("B", 1, 3.0),
                    at("A", 2, 9.0), at("B", 2, 1.0),
                    at("A", 3, 11.0), at("B", 3, 4.0));
        }

        @Test
        void shouldSumPairedMaxima() {
            loadFourBuckets();

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY_MAX).build());

            assertThat(result.getValue()).isEqualTo(42.0);
        }

        @Test
        void shouldSumPairedMinima() {
            loadFourBuckets();

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY_MIN).build());

            assertThat(result.getValue()).isEqualTo(10.0);
        }

        @Test
        void shouldReportUniformityValue() {
            // Given
            loadFourBuckets();

            // When
            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY_VALUE).build());

            // Then
            assertThat(result.getValue()).isEqualTo(8.0);
            assertThat(result.getDetail()).contains("0: 2024-01-15 09:00 - 最大:10.0, 最小:2.0, 平均:6.0");
        }

        @Test
        void shouldIncludeMiddleBucketForOddCount() {
            List<Samples.MinuteBucket> buckets =
                    List.of(
                            new Samples.MinuteBucket("a", 10, 2, 6),
                            new Samples.MinuteBucket("b", 12, 3, 7.5),
                            new Samples.MinuteBucket("c", 9, 1, 5));

            double[] sums = MinuteBucketAlgorithm.pairedSums(buckets);

            assertThat(sums).containsExactly(31.0, 6.0);
        }
    }

    @Test
    void shouldIgnoreSamplesOfOtherDevices() {
        // Given: the store returns everything, the filter still applies
        fixtures.tag("loc", TagType.LOCATION, "A");
        fixtures.readings(
                at("A", 0, 2.0), new Reading("B", Fixtures.NINE, 30.0, 50.0), at("A", 1, 3.0));

        // When
        FunctionResult result =
                fixtures.evaluate(window(FunctionKind.TEMP_VARIATION_RANGE_SUM).build());

        // Then
        assertThat(result.getValue()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 11L, 500L})
    void shouldNotDependOnStoreOrderForUniformityValue(long seed) {
        // Given: the four-bucket scenario, once in time order and once shuffled
        List<Reading> ordered =
                List.of(
                        at("A", 0, 10.0), at("B", 0, 2.0),
                        at("A", 1, 12.0), at("B", 1, 3.0),
                        at("A", 2, 9.0), at("B", 2, 1.0),
                        at("A", 3, 11.0), at("B", 3, 4.0));
        List<Reading> shuffled = new ArrayList<>(ordered);
        Collections.shuffle(shuffled, new Random(seed));
        fixtures.readings(ordered.toArray(new Reading[0]));
        Fixtures reordered = new Fixtures().readings(shuffled.toArray(new Reading[0]));

        // When
        FunctionResult first = fixtures.evaluate(window(FunctionKind.TEMP_UNIFORMITY_VALUE).build());
        FunctionResult second =
                reordered.evaluate(window(FunctionKind.TEMP_UNIFORMITY_VALUE).build());

        // Then
        assertThat(second.getValue()).isEqualTo(8.0);
        assertThat(second).isEqualTo(first);
    }
}

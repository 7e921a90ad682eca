package io.coldtag.core.metric;

import static io.coldtag.core.metric.Fixtures.at;
import static io.coldtag.core.metric.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ThresholdAlgorithm")
class ThresholdAlgorithmTest {

    private final Fixtures fixtures = new Fixtures();

    @Nested
    @DisplayName("arrival")
    class Arrival {

        @Test
        void shouldReportDeviceThatReachedUpperThresholdFirst() {
            // Given: B reaches 8 at 09:00, A only at 09:01
            fixtures.readings(at("A", 0, 5.0), at("B", 0, 9.0), at("A", 1, 9.0));

            // When
            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_REACH_UPPER).build());

            // Then
            assertThat(result.getValue()).isEqualTo("B");
            assertThat(result.getMessage()).isEqualTo("计算完成：B");
            assertThat(result.getDetail()).contains("阈值: 8").contains("最快: B");
        }

        @Test
        void shouldJoinDevicesTiedOnEarliestTime() {
            fixtures.readings(at("B", 0, 9.0), at("A", 0, 10.0));

            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_REACH_UPPER).build());

            assertThat(result.getValue()).isEqualTo("A | B");
        }

        @Test
        void shouldCountValueEqualToThreshold() {
            fixtures.readings(at("A", 0, 2.0), at("B", 1, 5.0));

            FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_REACH_LOWER).build());

            assertThat(result.getValue()).isEqualTo("A");
        }

        @Test
        void shouldUseThresholdOverride() {
            fixtures.readings(at("A", 0, 5.0), at("B", 1, 6.0));

            FunctionResult result =
                    fixtures.evaluate(
                            window(FunctionKind.TEMP_REACH_UPPER).threshold(5.5).build());

            assertThat(result.getValue()).isEqualTo("B");
        }

        @Test
        void shouldUseHumidityDefaults() {
            fixtures.readings(at("A", 0, 5.0, 50.0), at("B", 1, 5.0, 15.0));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.HUMIDITY_REACH_LOWER).build());

            assertThat(result.getValue()).isEqualTo("B");
        }
    }

    @Nested
    @DisplayName("exceed")
    class Exceed {

        @Test
        void shouldReportEveryExceedingDeviceInOrderOfFirstExceedance() {
            fixtures.readings(at("B", 0, 5.0), at("A", 1, 9.0), at("B", 2, 10.0));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_EXCEED_UPPER).build());

            assertThat(result.getValue()).isEqualTo("A | B");
        }

        @Test
        void shouldReportHumidityAboveUpperLimit() {
            fixtures.readings(at("A", 0, 5.0, 85.0), at("B", 0, 5.0, 60.0));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.HUMIDITY_EXCEED_UPPER).build());

            assertThat(result.getValue()).isEqualTo("A");
        }
    }

    @Nested
    @DisplayName("first reach time")
    class FirstReachTime {

        @Test
        void shouldReportMinuteOfFirstQualifyingReading() {
            fixtures.readings(at("A", 0, 5.0), at("B", 3, 9.0), at("A", 5, 12.0));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_FIRST_REACH_UPPER_TIME).build());

            assertThat(result.getValue()).isEqualTo("2024-01-15 09:03");
            assertThat(result.getDetail()).contains("第一次到达时间: 2024-01-15 09:03");
        }

        @Test
        void shouldReportLowerThresholdTime() {
            fixtures.readings(at("A", 0, 5.0), at("B", 7, 1.5));

            FunctionResult result =
                    fixtures.evaluate(window(FunctionKind.TEMP_FIRST_REACH_LOWER_TIME).build());

            assertThat(result.getValue()).isEqualTo("2024-01-15 09:07");
        }
    }

    @Test
    void shouldReportNoMatchWhenNothingQualifies() {
        // Given
        fixtures.readings(at("A", 0, 5.0), at("B", 0, 6.0));

        // When
        FunctionResult result = fixtures.evaluate(window(FunctionKind.TEMP_EXCEED_UPPER).build());

        // Then
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NO_MATCH);
        assertThat(result.getMessage()).isEqualTo("未找到满足条件的测点");
        assertThat(result.getDetail()).contains("阈值: 8");
    }

    @Test
    void shouldNeverReportLaterReachTimeForLowerUpperThreshold() {
        // Given: A warms 3 -> 12, B warms 5 -> 11
        fixtures.readings(
                at("A", 0, 3.0), at("B", 2, 5.0),
                at("A", 5, 6.0), at("B", 7, 8.0),
                at("A", 10, 9.0), at("B", 12, 11.0),
                at("A", 15, 12.0));

        // When: the threshold drops from 12 to 3 in half-degree steps
        String previous = null;
        for (double threshold = 12.0; threshold >= 3.0; threshold -= 0.5) {
            FunctionResult result =
                    fixtures.evaluate(
                            window(FunctionKind.TEMP_FIRST_REACH_UPPER_TIME)
                                    .threshold(threshold)
                                    .build());
            String reached = (String) result.getValue();

            // Then
            assertThat(result.isSuccess()).isTrue();
            if (previous != null) {
                assertThat(reached).isLessThanOrEqualTo(previous);
            }
            previous = reached;
        }
        assertThat(previous).isEqualTo("2024-01-15 09:00");
    }
}

package io.coldtag.core.metric;

import static io.coldtag.core.metric.Fixtures.at;
import static io.coldtag.core.metric.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.TagType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CoolingRateAlgorithm")
class CoolingRateAlgorithmTest {

    private final Fixtures fixtures = new Fixtures();

    @Test
    void shouldDivideEndpointDifferenceByMinutes() {
        // Given: 9.0 at 09:00, 3.0 at 10:00
        fixtures.readings(
                at("A", 0, 10.0), at("B", 0, 8.0),
                at("A", 30, 6.0),
                at("A", 60, 4.0), at("B", 60, 2.0));

        // When
        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        // Then
        assertThat(result.getValue()).isEqualTo(0.1);
        assertThat(result.getDetail())
                .contains("开始时间点平均温度: 9℃")
                .contains("结束时间点平均温度: 3℃")
                .contains("温度差: 6.0℃")
                .contains("时间差: 60 分钟")
                .contains("降温速率: 0.1 ℃/分钟");
    }

    @Test
    void shouldAverageDeviceMeansAtEachEndpoint() {
        // Given: start minute means A 10, B 7 -> 8.5
        fixtures.readings(
                at("A", 0, 10.0),
                at("B", 0, 6.0),
                new Reading("B", Fixtures.NINE.plusSeconds(30), 8.0, 50.0),
                at("A", 60, 2.5), at("B", 60, 2.5));

        // When
        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        // Then: |8.5 - 2.5| / 60
        assertThat(result.getValue()).isEqualTo(0.1);
    }

    @Test
    void shouldReportMissingEndMinute() {
        fixtures.readings(at("A", 0, 10.0), at("A", 30, 6.0));

        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NO_DATA);
        assertThat(result.getMessage()).isEqualTo("结束时间点没有数据");
    }

    @Test
    void shouldReportMissingStartMinute() {
        fixtures.readings(at("A", 30, 6.0), at("A", 60, 4.0));

        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        assertThat(result.getMessage()).isEqualTo("开始时间点没有数据");
    }

    @Test
    void shouldRejectZeroLengthWindow() {
        fixtures.tag("end", TagType.DATETIME, "2024-01-15 09:00");
        fixtures.readings(at("A", 0, 6.0));

        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INVALID_INTERVAL);
    }

    @Test
    void shouldIgnoreReadingsAfterWindowEndInEndMinute() {
        // Given: a colder sample 30 seconds past the 10:00 end
        fixtures.readings(
                at("A", 0, 10.0),
                at("A", 60, 4.0),
                new Reading("A", Fixtures.NINE.plusMinutes(60).plusSeconds(30), 2.0, 50.0));

        // When
        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        // Then: |10 - 4| / 60
        assertThat(result.getValue()).isEqualTo(0.1);
        assertThat(result.getDetail()).contains("结束时间点平均温度: 4℃");
    }

    @Test
    void shouldIgnoreReadingsBeforeWindowStartInStartMinute() {
        // Given: window starts at 09:00:30, a warmer sample 20 seconds earlier
        fixtures.tag("start", TagType.DATETIME, "2024-01-15 09:00:30");
        fixtures.readings(
                new Reading("A", Fixtures.NINE.plusSeconds(10), 20.0, 50.0),
                new Reading("A", Fixtures.NINE.plusSeconds(40), 10.0, 50.0),
                at("A", 60, 4.0));

        // When
        FunctionResult result = fixtures.evaluate(window(FunctionKind.AVG_COOLING_RATE).build());

        // Then: |10 - 4| / 59 whole minutes
        assertThat(result.getValue()).isEqualTo(0.102);
        assertThat(result.getDetail()).contains("开始时间点平均温度: 10℃");
    }
}

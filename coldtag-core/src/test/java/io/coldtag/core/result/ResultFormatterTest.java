package io.coldtag.core.result;

import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.exception.EvaluationException;
import org.junit.jupiter.api.Test;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter();

    @Test
    void shouldRoundValueAndRenderMessage() {
        // When
        FunctionResult result = formatter.number(14.996, 2, DetailLog.start("info"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo(15.0);
        assertThat(result.getMessage()).isEqualTo("计算完成：15");
        assertThat(result.getDetail()).isEqualTo("info");
    }

    @Test
    void shouldPassInfiniteValueThrough() {
        FunctionResult result = formatter.number(Double.POSITIVE_INFINITY, 2, DetailLog.start());

        assertThat(result.getValue()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(result.getMessage()).isEqualTo("计算完成：Infinity");
    }

    @Test
    void shouldRenderPrefixInMessageOnly() {
        FunctionResult result = formatter.number(2.25, 1, "±", DetailLog.start());

        assertThat(result.getValue()).isEqualTo(2.3);
        assertThat(result.getMessage()).isEqualTo("计算完成：±2.3");
    }

    @Test
    void shouldCreateTextResult() {
        FunctionResult result = formatter.text("A | B", DetailLog.start());

        assertThat(result.getValue()).isEqualTo("A | B");
        assertThat(result.getMessage()).isEqualTo("计算完成：A | B");
    }

    @Test
    void shouldConvertEvaluationException() {
        // Given
        EvaluationException failure =
                new EvaluationException(ErrorCode.NO_DATA, "时间范围内没有匹配数据", "命中: 0 条");

        // When
        FunctionResult result = formatter.error(failure);

        // Then
        assertThat(result.getStatus()).isEqualTo(FunctionStatus.ERROR);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NO_DATA);
        assertThat(result.getValue()).isNull();
        assertThat(result.logText()).isEqualTo("命中: 0 条");
    }

    @Test
    void shouldFallBackToMessageAsLogText() {
        FunctionResult result = formatter.error(ErrorCode.MISSING_INPUT, "请先配置函数方法", null);

        assertThat(result.logText()).isEqualTo("请先配置函数方法");
    }
}

package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.normalize.TagValues;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.tag.Tag;
import java.util.OptionalDouble;

/// Reads numeric inputs from tags other than the one being evaluated.
///
/// Messages name the input by its label, e.g. `开始电量标签值不能为空`.
final class TagInputs {

    private TagInputs() {}

    /// Reads a tag value as a number.
    ///
    /// @param tag the tag, not null
    /// @param label the input's label, e.g. `最高温度`
    /// @return the number, may be infinite
    /// @throws EvaluationException with {@link ErrorCode#INVALID_VALUE} for an empty or
    ///     non-numeric value
    static double number(Tag tag, String label) throws EvaluationException {
        return number(tag.getValue(), label);
    }

    static double number(Object value, String label) throws EvaluationException {
        if (TagValues.isBlank(value)) {
            throw new EvaluationException(ErrorCode.INVALID_VALUE, label + "标签值不能为空");
        }
        OptionalDouble number = TagValues.parseNumber(value);
        if (number.isEmpty()) {
            throw new EvaluationException(
                    ErrorCode.INVALID_VALUE, label + "标签值不是有效的数字: " + value);
        }
        return number.getAsDouble();
    }
}

package io.coldtag.core.normalize;

import java.util.Collection;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Numeric interpretation of tag values.
///
/// Text is read leniently: the longest leading decimal number is used and trailing text is
/// ignored, so `"8.5℃"` reads as `8.5` while `"abc"` has no numeric value.
public final class TagValues {

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private TagValues() {}

    /// Checks whether a value counts as empty: null, blank text or an empty collection.
    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        return value instanceof CharSequence && value.toString().trim().isEmpty();
    }

    /// Reads a number from a tag value.
    ///
    /// @param value a `Number` or text, may be null
    /// @return the number, or empty when the value has no numeric reading
    public static OptionalDouble parseNumber(Object value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isNaN(number) ? OptionalDouble.empty() : OptionalDouble.of(number);
        }
        String text = value.toString().trim();
        if (text.startsWith("Infinity") || text.startsWith("+Infinity")) {
            return OptionalDouble.of(Double.POSITIVE_INFINITY);
        }
        if (text.startsWith("-Infinity")) {
            return OptionalDouble.of(Double.NEGATIVE_INFINITY);
        }
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(matcher.group()));
    }
}

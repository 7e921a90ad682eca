package io.coldtag.core.result;

import java.math.BigDecimal;
import java.math.RoundingMode;

/// Decimal rounding and rendering shared by every metric.
///
/// Rounding is half away from zero applied to the exact binary value of the double, so
/// `1.005` rounds to `1.00` at two places (its binary value is slightly below `1.005`).
/// Non-finite values are never rounded; they pass through unchanged.
public final class Decimals {

    private static final int MAX_DECIMALS = 20;

    private Decimals() {}

    /// Rounds a value to the given number of decimal places.
    ///
    /// @param value the unrounded value
    /// @param decimals places to keep, between 0 and 20
    /// @return the rounded value, or `value` itself when it is NaN or infinite
    /// @throws IllegalArgumentException if `decimals` is out of range
    public static double round(double value, int decimals) {
        checkDecimals(decimals);
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    /// Renders a value with exactly `decimals` fraction digits, e.g. `fixed(2.0, 1)` is `"2.0"`.
    ///
    /// @param value the value to render
    /// @param decimals fraction digits, between 0 and 20
    /// @return fixed-point text; `NaN`, `Infinity` or `-Infinity` for non-finite values
    public static String fixed(double value, int decimals) {
        checkDecimals(decimals);
        if (!Double.isFinite(value)) {
            return nonFinite(value);
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    /// Renders a value in its shortest form, dropping trailing zeros (`15.0` renders as `"15"`).
    ///
    /// @param value the value to render
    /// @return shortest decimal text; `NaN`, `Infinity` or `-Infinity` for non-finite values
    public static String display(double value) {
        if (!Double.isFinite(value)) {
            return nonFinite(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String nonFinite(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return value > 0 ? "Infinity" : "-Infinity";
    }

    private static void checkDecimals(int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException(
                    "decimals must be between 0 and " + MAX_DECIMALS + ": " + decimals);
        }
    }
}

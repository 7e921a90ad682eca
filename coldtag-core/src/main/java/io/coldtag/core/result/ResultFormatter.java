package io.coldtag.core.result;

import io.coldtag.core.exception.EvaluationException;

/// Turns unrounded algorithm outputs into {@link FunctionResult}s.
///
/// Applies the function kind's canonical precision to numeric values (non-finite values pass
/// through unrounded), renders the `计算完成：<value>` success message and attaches the
/// diagnostic log.
///
/// @implNote Stateless and thread-safe.
public class ResultFormatter {

    private static final String DONE = "计算完成：";

    /// Creates a numeric success result.
    ///
    /// @param raw the unrounded value
    /// @param decimals canonical precision of the function kind
    /// @param log the diagnostic log, not null
    /// @return success result whose value is the rounded `Double`, never null
    public FunctionResult number(double raw, int decimals, DetailLog log) {
        return number(raw, decimals, "", log);
    }

    /// Creates a numeric success result whose message shows `prefix` before the value.
    ///
    /// @param raw the unrounded value
    /// @param decimals canonical precision of the function kind
    /// @param prefix message-only prefix such as `±`, not null
    /// @param log the diagnostic log, not null
    /// @return success result whose value is the rounded `Double`, never null
    public FunctionResult number(double raw, int decimals, String prefix, DetailLog log) {
        double value = Decimals.round(raw, decimals);
        return FunctionResult.success(
                value, DONE + prefix + Decimals.display(value), log.render());
    }

    /// Creates a textual success result (device set or formatted time).
    ///
    /// @param value the derived text, not null
    /// @param log the diagnostic log, not null
    /// @return success result, never null
    public FunctionResult text(String value, DetailLog log) {
        return FunctionResult.success(value, DONE + value, log.render());
    }

    /// Creates an error result.
    ///
    /// @param code the failure classification, not null
    /// @param message the user-facing message, not null
    /// @param log the diagnostic log, may be null
    /// @return error result, never null
    public FunctionResult error(ErrorCode code, String message, DetailLog log) {
        return FunctionResult.error(code, message, log != null ? log.render() : null);
    }

    /// Creates an error result from a classified evaluation failure.
    ///
    /// @param failure the failure, not null
    /// @return error result, never null
    public FunctionResult error(EvaluationException failure) {
        return FunctionResult.error(
                failure.getErrorCode(), failure.getMessage(), failure.getDetail());
    }
}

package io.coldtag.core.exception;

import io.coldtag.core.result.ErrorCode;
import java.io.Serial;
import java.util.Objects;

/// Signals a classified evaluation failure raised while resolving inputs or computing a metric.
///
/// Caught by {@link io.coldtag.core.metric.FunctionEvaluator} and turned into an error
/// {@link io.coldtag.core.result.FunctionResult}; it never escapes the evaluation boundary.
public class EvaluationException extends Exception {
    @Serial private static final long serialVersionUID = 3186045257104628391L;

    private final ErrorCode errorCode;
    private final String detail;

    public EvaluationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public EvaluationException(ErrorCode errorCode, String message, String detail) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode required");
        this.detail = detail;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /// Returns the diagnostic log accumulated before the failure.
    ///
    /// @return detail text, may be null
    public String getDetail() {
        return detail;
    }
}

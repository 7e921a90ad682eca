package io.coldtag.core.result;

import java.util.Objects;

/// Immutable outcome of evaluating one tag function.
///
/// A result is the engine's sole output artifact. It is never partially applied: a success
/// result replaces the tag value, an error result leaves the tag value untouched and only
/// contributes to the run snapshot.
///
/// ### Factory Methods
/// - {@link #success(Object, String, String)} for a computed value
/// - {@link #error(ErrorCode, String, String)} for a classified failure
///
/// @implNote Carries no wall-clock timestamp, so evaluating the same config against the same
/// readings yields results that are `equals`. The run time is recorded by the session.
///
/// @see ResultFormatter for the rounding and message rules applied to values
public final class FunctionResult {

    private final FunctionStatus status;
    private final ErrorCode errorCode;
    private final String message;
    private final Object value;
    private final String detail;

    private FunctionResult(Builder builder) {
        this.status = Objects.requireNonNull(builder.status, "status required");
        this.errorCode = builder.errorCode;
        this.message = Objects.requireNonNull(builder.message, "message required");
        this.value = builder.value;
        this.detail = builder.detail;
    }

    /// Returns the evaluation status.
    ///
    /// @return success or error, never null
    public FunctionStatus getStatus() {
        return status;
    }

    /// Returns the error classification.
    ///
    /// @return the error code, null for successful results
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /// Returns the short human summary.
    ///
    /// @return the message, never null
    public String getMessage() {
        return message;
    }

    /// Returns the derived value.
    ///
    /// @return a `Double` for numeric kinds, a `String` for device-set and time kinds,
    ///     null when evaluation failed
    public Object getValue() {
        return value;
    }

    /// Returns the multi-line diagnostic log.
    ///
    /// @return the detail log, may be null when the failure happened before any query
    public String getDetail() {
        return detail;
    }

    /// Checks whether the evaluation succeeded.
    ///
    /// @return true if status is SUCCESS
    public boolean isSuccess() {
        return status == FunctionStatus.SUCCESS;
    }

    /// Returns the text recorded as the run log: the detail when present, else the message.
    ///
    /// @return log text, never null
    public String logText() {
        return detail != null && !detail.isEmpty() ? detail : message;
    }

    /// Creates a success result.
    ///
    /// @param value the derived value, not null
    /// @param message the summary message, not null
    /// @param detail the diagnostic log, may be null
    /// @return new success result, never null
    public static FunctionResult success(Object value, String message, String detail) {
        return builder()
                .status(FunctionStatus.SUCCESS)
                .value(Objects.requireNonNull(value, "value required"))
                .message(message)
                .detail(detail)
                .build();
    }

    /// Creates an error result.
    ///
    /// @param errorCode the failure classification, not null
    /// @param message the user-facing message, not null
    /// @param detail the diagnostic log, may be null
    /// @return new error result, never null
    public static FunctionResult error(ErrorCode errorCode, String message, String detail) {
        return builder()
                .status(FunctionStatus.ERROR)
                .errorCode(Objects.requireNonNull(errorCode, "errorCode required"))
                .message(message)
                .detail(detail)
                .build();
    }

    /// Creates a new result builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionResult)) {
            return false;
        }
        FunctionResult that = (FunctionResult) o;
        return status == that.status
                && errorCode == that.errorCode
                && message.equals(that.message)
                && Objects.equals(value, that.value)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, errorCode, message, value, detail);
    }

    @Override
    public String toString() {
        return "FunctionResult{status="
                + status
                + (errorCode != null ? ", errorCode=" + errorCode : "")
                + ", message='"
                + message
                + "', value="
                + value
                + '}';
    }

    /// Builder for constructing FunctionResult instances.
    public static final class Builder {
        private FunctionStatus status = FunctionStatus.SUCCESS;
        private ErrorCode errorCode;
        private String message = "";
        private Object value;
        private String detail;

        private Builder() {}

        public Builder status(FunctionStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorCode(ErrorCode errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        /// Builds the immutable FunctionResult.
        ///
        /// @return new FunctionResult instance, never null
        public FunctionResult build() {
            return new FunctionResult(this);
        }
    }
}

package io.coldtag.core.session;

import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.result.FunctionStatus;
import java.time.Instant;
import java.util.Objects;

/// History entry written onto a function config after every run, successful or not.
///
/// @param runAt when the run finished, not null
/// @param status outcome of the run, not null
/// @param message the detail log when present, else the summary message, not null
/// @param result the derived value, or an empty string when the run failed
public record RunSnapshot(Instant runAt, FunctionStatus status, String message, Object result) {

    public RunSnapshot {
        Objects.requireNonNull(runAt, "runAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(message, "message must not be null");
        result = result != null ? result : "";
    }

    /// Creates the snapshot of a result.
    public static RunSnapshot of(FunctionResult result, Instant runAt) {
        return new RunSnapshot(runAt, result.getStatus(), result.logText(), result.getValue());
    }

    /// Copies this snapshot into a config's `last*` fields.
    ///
    /// @param config the config to update, not null
    /// @return updated copy, never null
    public FunctionConfig applyTo(FunctionConfig config) {
        return config.toBuilder()
                .lastRunAt(runAt)
                .lastStatus(status)
                .lastMessage(message)
                .lastResult(result)
                .build();
    }
}

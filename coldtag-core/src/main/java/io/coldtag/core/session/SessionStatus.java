package io.coldtag.core.session;

/// Lifecycle state of an {@link EvaluationSession}.
///
/// `IDLE -> RUNNING -> (SUCCESS | ERROR)`; the next invocation moves back to `RUNNING`.
public enum SessionStatus {
    IDLE,
    RUNNING,
    SUCCESS,
    ERROR
}

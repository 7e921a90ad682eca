package io.coldtag.core.result;

import java.util.Optional;

/// Outcome of one function evaluation.
///
/// The wire identifiers (`"success"`, `"error"`) are the ones stored in a function
/// config's last-run snapshot.
///
/// @see FunctionResult
public enum FunctionStatus {

    /// The function produced a value; the tag value is replaced.
    SUCCESS("success"),

    /// The function failed; the tag value is left untouched.
    ERROR("error");

    private final String id;

    FunctionStatus(String id) {
        this.id = id;
    }

    /// Returns the wire identifier.
    ///
    /// @return lower-case identifier, never null
    public String getId() {
        return id;
    }

    /// Resolves a status from its wire identifier, ignoring case.
    ///
    /// @param id the identifier, may be null
    /// @return the matching status, or empty if unknown
    public static Optional<FunctionStatus> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (FunctionStatus status : values()) {
            if (status.id.equalsIgnoreCase(id.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

package io.coldtag.cli.exception;

import java.io.Serial;

/// Thrown when an input file of a command cannot be read or parsed.
///
/// Common causes:
/// - the roster, readings or config file does not exist or is unreadable
/// - the file is not valid JSON or not the expected shape
///
/// @see io.coldtag.cli.commands.ColdtagCommand
public class InputFileException extends Exception {

    @Serial private static final long serialVersionUID = 4412956094310287215L;

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of the failing file, not null
    /// @param cause the underlying I/O or parse failure, may be null
    public InputFileException(String message, Throwable cause) {
        super(message, cause);
    }
}

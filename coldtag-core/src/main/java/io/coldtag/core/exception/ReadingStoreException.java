package io.coldtag.core.exception;

import java.io.Serial;

/// Raised by a {@link io.coldtag.core.reading.ReadingStore} that cannot answer a query.
public class ReadingStoreException extends Exception {
    @Serial private static final long serialVersionUID = -2290743718815390164L;

    public ReadingStoreException(String message) {
        super(message);
    }

    public ReadingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

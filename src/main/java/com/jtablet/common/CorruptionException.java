package com.jtablet.common;

import java.io.IOException;

/**
 * Thrown when encoded data (such as a row change list) cannot be decoded.
 * A scan that hits this exception must be abandoned; the iterator that threw
 * it cannot be reused.
 */
public class CorruptionException extends IOException {
    public CorruptionException(String message) {
        super(message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

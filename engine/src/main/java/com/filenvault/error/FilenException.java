package com.filenvault.error;

/**
 * Root of every failure raised by the engine. Unchecked so it can travel through
 * {@code Mono.error} without wrapping.
 */
public class FilenException extends RuntimeException {

    public FilenException(String message) {
        super(message);
    }

    public FilenException(String message, Throwable cause) {
        super(message, cause);
    }
}

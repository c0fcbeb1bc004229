package com.filenvault.error;

/**
 * No key available to the caller could decrypt a blob. Never retried: key material does
 * not change within a call.
 */
public class KeyMismatchException extends FilenException {

    public KeyMismatchException(String message) {
        super(message);
    }

    public KeyMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

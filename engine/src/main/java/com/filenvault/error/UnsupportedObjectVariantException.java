package com.filenvault.error;

/** An object reached a code path that only accepts files or directories. Not retried. */
public class UnsupportedObjectVariantException extends FilenException {

    public UnsupportedObjectVariantException(String message) {
        super(message);
    }
}

package com.filenvault.error;

/**
 * A fully downloaded file's plaintext disagrees with its metadata, either in size or in its
 * BLAKE3 hash.
 */
public class ContentMismatchException extends FilenException {

    public ContentMismatchException(String message) {
        super(message);
    }
}

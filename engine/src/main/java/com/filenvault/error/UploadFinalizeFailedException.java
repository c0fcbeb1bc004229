package com.filenvault.error;

/**
 * The server rejected the completion request. Terminal for the session: a retry needs a
 * new session with a new upload key.
 */
public class UploadFinalizeFailedException extends FilenException {

    public UploadFinalizeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.filenvault.error;

/** The upload was cancelled while waiting for a storage assignment. Terminal for the session. */
public class UploadAbortedException extends FilenException {

    public UploadAbortedException(String message) {
        super(message);
    }
}

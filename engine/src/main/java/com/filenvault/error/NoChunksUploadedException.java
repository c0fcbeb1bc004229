package com.filenvault.error;

/** Finalize was requested for a non-empty file although no chunk upload ever succeeded. */
public class NoChunksUploadedException extends FilenException {

    public NoChunksUploadedException(String message) {
        super(message);
    }
}

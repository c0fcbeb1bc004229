package com.filenvault.error;

/**
 * A single chunk's transport call failed. The caller may re-issue the same index on the
 * same session.
 */
public class ChunkUploadFailedException extends FilenException {

    private final int index;

    public ChunkUploadFailedException(int index, Throwable cause) {
        super("upload chunk " + index + " failed", cause);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}

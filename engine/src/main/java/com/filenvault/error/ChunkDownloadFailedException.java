package com.filenvault.error;

/** Fetching or decrypting one chunk of a file failed. */
public class ChunkDownloadFailedException extends FilenException {

    private final int index;

    public ChunkDownloadFailedException(int index, Throwable cause) {
        super("download chunk " + index + " failed", cause);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}

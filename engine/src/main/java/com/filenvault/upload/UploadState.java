package com.filenvault.upload;

/**
 * Lifecycle of a {@link FileUpload}. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum UploadState {
    CREATED,
    STREAMING,
    AWAITING_COMPLETION,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

package com.filenvault.client;

/**
 * Completion of a zero-length file. {@code name}, {@code size} and {@code mime} are encrypted
 * with the file key; {@code metadata} with the account hierarchy.
 */
public record UploadEmptyRequest(
        String uuid,
        String name,
        String nameHashed,
        String size,
        String parent,
        String mime,
        String metadata,
        int version
) {
}

package com.filenvault.client;

/**
 * Completion of a chunked upload: the {@link UploadEmptyRequest} fields plus the chunk
 * count, the removal token {@code rm} and the session's upload key.
 */
public record UploadDoneRequest(
        String uuid,
        String name,
        String nameHashed,
        String size,
        String parent,
        String mime,
        String metadata,
        int version,
        int chunks,
        String rm,
        String uploadKey
) {
}

package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A file entry of a directory listing; {@code metadata} is encrypted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListedFile(
        String uuid,
        String parent,
        String metadata,
        String bucket,
        String region,
        int chunks,
        int version
) {
}

package com.filenvault.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plaintext of a file's metadata blob. Timestamps are epoch milliseconds; {@code key} is the
 * per-object key in its versioned string form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("size") long size,
        @JsonProperty("mime") String mimeType,
        @JsonProperty("key") String key,
        @JsonProperty("lastModified") long lastModified,
        @JsonProperty("creation") long creation,
        @JsonProperty("blake3") String hash
) {

    @Override
    public String toString() {
        return "FileMetadata[redacted]";
    }
}

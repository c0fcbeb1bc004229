package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A folder entry of a directory listing. The wire field {@code name} is the encrypted
 * metadata; {@code timestamp} (epoch seconds) stands in when the metadata has no creation time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListedFolder(
        @JsonProperty("uuid") String uuid,
        @JsonProperty("parent") String parent,
        @JsonProperty("name") String metadata,
        @JsonProperty("timestamp") long timestamp
) {
}

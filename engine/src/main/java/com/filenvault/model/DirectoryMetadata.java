package com.filenvault.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Plaintext of a directory's metadata blob; {@code creation} is in epoch seconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectoryMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("creation") long creation
) {

    @Override
    public String toString() {
        return "DirectoryMetadata[redacted]";
    }
}

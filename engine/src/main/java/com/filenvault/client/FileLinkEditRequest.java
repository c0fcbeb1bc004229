package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Enables or edits the public link of a single file; {@code uuid} is the link UUID. */
public record FileLinkEditRequest(
        @JsonProperty("uuid") String linkUuid,
        @JsonProperty("fileUUID") String fileUuid,
        @JsonProperty("expiration") String expiration,
        @JsonProperty("password") String password,
        @JsonProperty("passwordHashed") String passwordHashed,
        @JsonProperty("downloadBtn") boolean downloadButton,
        @JsonProperty("type") String type,
        @JsonProperty("salt") String salt
) {
}

package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One public link; {@code linkKey} is encrypted under the owner's key hierarchy. */
public record LinkedEntry(@JsonProperty("linkUUID") String linkUuid, @JsonProperty("linkKey") String linkKey) {
}

package com.filenvault.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LinkedInfo(@JsonProperty("link") boolean linked, @JsonProperty("links") List<LinkedEntry> links) {

    public LinkedInfo {
        links = links == null ? List.of() : List.copyOf(links);
    }
}

package com.filenvault.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SharedInfo(@JsonProperty("sharing") boolean sharing, @JsonProperty("users") List<SharedUser> users) {

    public SharedInfo {
        users = users == null ? List.of() : List.copyOf(users);
    }
}

package com.filenvault.client;

public record SharedRenameRequest(String uuid, long receiverId, String metadata) {
}

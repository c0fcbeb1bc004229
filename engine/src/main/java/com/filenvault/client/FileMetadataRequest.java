package com.filenvault.client;

public record FileMetadataRequest(String uuid, String name, String nameHashed, String metadata) {
}

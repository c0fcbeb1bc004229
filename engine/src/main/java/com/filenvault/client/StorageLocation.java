package com.filenvault.client;

/** Where the server stored a file's chunks; reported by every chunk upload response. */
public record StorageLocation(String bucket, String region) {

    public static final StorageLocation NONE = new StorageLocation("", "");
}

package com.filenvault.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Answer of {@code /v3/dir/download}: every file and folder below a directory. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectoryListing(List<ListedFile> files, List<ListedFolder> folders) {

    public DirectoryListing {
        files = files == null ? List.of() : List.copyOf(files);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }
}

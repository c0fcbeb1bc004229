package com.filenvault.share;

import java.util.List;

import com.filenvault.model.Directory;
import com.filenvault.model.File;

/** Every file and directory below a directory, not including the directory itself. */
public record DirectoryTree(List<File> files, List<Directory> directories) {

    public DirectoryTree {
        files = List.copyOf(files);
        directories = List.copyOf(directories);
    }

    public int size() {
        return files.size() + directories.size();
    }
}

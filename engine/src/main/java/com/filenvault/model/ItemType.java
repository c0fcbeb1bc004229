package com.filenvault.model;

import com.filenvault.error.UnsupportedObjectVariantException;

/**
 * Wire names of the two shareable variants. Share and link requests say {@code "folder"},
 * the search index says {@code "directory"}.
 */
public enum ItemType {

    FILE("file", "file"),
    DIRECTORY("folder", "directory");

    private final String shareName;
    private final String searchName;

    ItemType(String shareName, String searchName) {
        this.shareName = shareName;
        this.searchName = searchName;
    }

    public String shareName() {
        return shareName;
    }

    public String searchName() {
        return searchName;
    }

    /**
     * @throws UnsupportedObjectVariantException for the root directory
     */
    public static ItemType of(FileSystemObject item) {
        return item.accept(new FileSystemObjectVisitor<>() {
            @Override
            public ItemType visitFile(File file) {
                return FILE;
            }

            @Override
            public ItemType visitDirectory(Directory directory) {
                return DIRECTORY;
            }

            @Override
            public ItemType visitRoot(RootDirectory root) {
                throw new UnsupportedObjectVariantException("the root directory has no item type");
            }
        });
    }
}

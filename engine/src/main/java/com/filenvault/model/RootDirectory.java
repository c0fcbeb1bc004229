package com.filenvault.model;

public record RootDirectory(String uuid) implements FileSystemObject {

    @Override
    public <R> R accept(FileSystemObjectVisitor<R> visitor) {
        return visitor.visitRoot(this);
    }
}

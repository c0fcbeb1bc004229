package com.filenvault.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A folder. Its metadata blob holds only the name and the creation time (whole seconds).
 */
public record Directory(String uuid, String parentUuid, String name, Instant created) implements NonRootObject {

    /** A directory that does not exist remotely yet, with a fresh UUID. */
    public static Directory create(String name, String parentUuid, Instant created) {
        if (name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("directory name must not contain '/'");
        }
        return new Directory(UUID.randomUUID().toString(), parentUuid, name, created.truncatedTo(ChronoUnit.SECONDS));
    }

    @Override
    public ItemType itemType() {
        return ItemType.DIRECTORY;
    }

    @Override
    public Directory withName(String newName) {
        return new Directory(uuid, parentUuid, newName, created);
    }

    @Override
    public Directory withParent(String newParentUuid) {
        return new Directory(uuid, newParentUuid, name, created);
    }

    @Override
    public <R> R accept(FileSystemObjectVisitor<R> visitor) {
        return visitor.visitDirectory(this);
    }
}

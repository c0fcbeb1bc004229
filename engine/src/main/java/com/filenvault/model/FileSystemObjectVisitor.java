package com.filenvault.model;

/**
 * Exhaustive dispatch over the object variants.
 *
 * @param <R> result of a visit
 */
public interface FileSystemObjectVisitor<R> {

    R visitFile(File file);

    R visitDirectory(Directory directory);

    R visitRoot(RootDirectory root);
}

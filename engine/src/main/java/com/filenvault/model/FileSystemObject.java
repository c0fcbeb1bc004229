package com.filenvault.model;

/**
 * A node of the remote tree: a {@link File}, a {@link Directory} or the account's
 * {@link RootDirectory}.
 *
 * <p>All variants are immutable values owned by whoever holds them; nothing in the engine
 * caches them between calls.
 */
public sealed interface FileSystemObject permits NonRootObject, RootDirectory {

    /** Server-assigned identity, stable for the object's lifetime. */
    String uuid();

    <R> R accept(FileSystemObjectVisitor<R> visitor);
}

package com.filenvault.model;

/**
 * A file or directory: something with a parent, a plaintext name and a metadata blob that
 * can be shared, linked and indexed.
 */
public sealed interface NonRootObject extends FileSystemObject permits File, Directory {

    String parentUuid();

    String name();

    ItemType itemType();

    NonRootObject withName(String newName);

    NonRootObject withParent(String newParentUuid);
}

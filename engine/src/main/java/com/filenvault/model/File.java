package com.filenvault.model;

import java.time.Instant;

import com.filenvault.crypto.EncryptionKey;

/**
 * A file whose content upload has completed.
 *
 * <p>{@code hash} is the hex BLAKE3 digest of the plaintext. An empty file has no chunks and
 * empty {@code bucket} and {@code region}.
 */
public record File(
        String uuid,
        String parentUuid,
        String name,
        String mimeType,
        EncryptionKey encryptionKey,
        Instant created,
        Instant lastModified,
        long size,
        int chunks,
        String hash,
        String bucket,
        String region
) implements NonRootObject {

    @Override
    public ItemType itemType() {
        return ItemType.FILE;
    }

    @Override
    public File withName(String newName) {
        return new File(uuid, parentUuid, newName, mimeType, encryptionKey, created, lastModified,
                size, chunks, hash, bucket, region);
    }

    @Override
    public File withParent(String newParentUuid) {
        return new File(uuid, newParentUuid, name, mimeType, encryptionKey, created, lastModified,
                size, chunks, hash, bucket, region);
    }

    @Override
    public <R> R accept(FileSystemObjectVisitor<R> visitor) {
        return visitor.visitFile(this);
    }
}

package com.filenvault.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import com.filenvault.crypto.EncryptionKey;

/**
 * A file that exists locally but has no uploaded content yet. It becomes a {@link File}
 * only through {@link #complete} once the completion handshake succeeds.
 */
public record IncompleteFile(
        String uuid,
        String parentUuid,
        String name,
        String mimeType,
        EncryptionKey encryptionKey,
        Instant created,
        Instant lastModified
) {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /**
     * Creates a new local file with a fresh UUID and a per-object key for the given
     * file-encryption version.
     *
     * @param mimeType explicit MIME type, or {@code null} to guess from the extension
     */
    public static IncompleteFile create(int fileEncryptionVersion, String name, String mimeType,
                                        Instant created, Instant lastModified, String parentUuid) {
        if (name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("file name must not contain '/'");
        }
        return new IncompleteFile(
                UUID.randomUUID().toString(),
                parentUuid,
                name,
                mimeType == null || mimeType.isEmpty() ? guessMimeType(name) : stripParameters(mimeType),
                EncryptionKey.generate(fileEncryptionVersion),
                created.truncatedTo(ChronoUnit.MILLIS),
                lastModified.truncatedTo(ChronoUnit.MILLIS));
    }

    /** Same name, parent, type and timestamps under a new UUID and key, for a retried upload. */
    public IncompleteFile newFromBase(int fileEncryptionVersion) {
        return new IncompleteFile(UUID.randomUUID().toString(), parentUuid, name, mimeType,
                EncryptionKey.generate(fileEncryptionVersion), created, lastModified);
    }

    public File complete(long size, int chunks, String hash, String bucket, String region) {
        return new File(uuid, parentUuid, name, mimeType, encryptionKey, created, lastModified,
                size, chunks, hash, bucket, region);
    }

    static String guessMimeType(String name) {
        return MediaTypeFactory.getMediaType(name)
                .map(type -> type.getType() + "/" + type.getSubtype())
                .orElse(DEFAULT_MIME_TYPE);
    }

    static String stripParameters(String mimeType) {
        int semicolon = mimeType.indexOf(';');
        return semicolon < 0 ? mimeType : mimeType.substring(0, semicolon);
    }
}

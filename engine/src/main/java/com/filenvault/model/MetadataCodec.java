package com.filenvault.model;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filenvault.error.UnsupportedObjectVariantException;

/**
 * JSON form of the plaintext metadata blobs. The result is always encrypted before it
 * leaves the engine, under the account hierarchy, a recipient's RSA key or a link key.
 */
@Component
public class MetadataCodec {

    private final ObjectMapper objectMapper;

    public MetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Serialized metadata of a file or directory; the root directory has none. */
    public String metadataOf(NonRootObject item, int fileEncryptionVersion) {
        return item.accept(new FileSystemObjectVisitor<>() {
            @Override
            public String visitFile(File file) {
                return fileMetadata(file, fileEncryptionVersion);
            }

            @Override
            public String visitDirectory(Directory directory) {
                return directoryMetadata(directory);
            }

            @Override
            public String visitRoot(RootDirectory root) {
                throw new UnsupportedObjectVariantException("the root directory has no metadata");
            }
        });
    }

    public String fileMetadata(File file, int fileEncryptionVersion) {
        return write(new FileMetadata(
                file.name(),
                file.size(),
                file.mimeType(),
                file.encryptionKey().toStringWithVersion(fileEncryptionVersion),
                file.lastModified().toEpochMilli(),
                file.created().toEpochMilli(),
                file.hash()));
    }

    public String directoryMetadata(Directory directory) {
        long creation = directory.created() == null ? 0L : directory.created().getEpochSecond();
        return write(new DirectoryMetadata(directory.name(), creation));
    }

    public FileMetadata readFileMetadata(String json) {
        return read(json, FileMetadata.class);
    }

    public DirectoryMetadata readDirectoryMetadata(String json) {
        return read(json, DirectoryMetadata.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed " + type.getSimpleName() + " JSON", e);
        }
    }
}

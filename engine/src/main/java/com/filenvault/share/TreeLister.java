package com.filenvault.share;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.DirectoryListing;
import com.filenvault.client.FilenClient;
import com.filenvault.client.ListedFile;
import com.filenvault.client.ListedFolder;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.model.Directory;
import com.filenvault.model.DirectoryMetadata;
import com.filenvault.model.File;
import com.filenvault.model.FileMetadata;
import com.filenvault.model.MetadataCodec;

import reactor.core.publisher.Mono;

/**
 * Lists a directory's whole subtree in one request and decrypts every entry's metadata with
 * the account hierarchy.
 */
@Service
public class TreeLister {

    // The listing includes the listed directory itself under this parent.
    static final String LISTED_ROOT_PARENT = "base";

    private final FilenClient client;
    private final AccountKeysHolder keysHolder;
    private final MetadataCodec codec;

    public TreeLister(FilenClient client, AccountKeysHolder keysHolder, MetadataCodec codec) {
        this.client = client;
        this.keysHolder = keysHolder;
        this.codec = codec;
    }

    public Mono<DirectoryTree> listRecursive(Directory directory) {
        return Mono.defer(() -> {
            AccountKeys keys = keysHolder.current();
            return client.dirDownload(directory.uuid()).map(listing -> decrypt(keys, listing));
        });
    }

    private DirectoryTree decrypt(AccountKeys keys, DirectoryListing listing) {
        List<File> files = new ArrayList<>(listing.files().size());
        for (ListedFile listed : listing.files()) {
            files.add(toFile(keys, listed));
        }
        List<Directory> directories = new ArrayList<>(listing.folders().size());
        for (ListedFolder listed : listing.folders()) {
            if (LISTED_ROOT_PARENT.equals(listed.parent())) {
                continue;
            }
            directories.add(toDirectory(keys, listed));
        }
        return new DirectoryTree(files, directories);
    }

    private File toFile(AccountKeys keys, ListedFile listed) {
        FileMetadata metadata = codec.readFileMetadata(keys.hierarchy().decryptMeta(listed.metadata()));
        return new File(
                listed.uuid(),
                listed.parent(),
                metadata.name(),
                metadata.mimeType(),
                EncryptionKey.fromUnknownString(metadata.key()),
                Instant.ofEpochMilli(metadata.creation()),
                Instant.ofEpochMilli(metadata.lastModified()),
                metadata.size(),
                listed.chunks(),
                metadata.hash(),
                listed.bucket(),
                listed.region());
    }

    private Directory toDirectory(AccountKeys keys, ListedFolder listed) {
        DirectoryMetadata metadata = codec.readDirectoryMetadata(keys.hierarchy().decryptMeta(listed.metadata()));
        long creation = metadata.creation() != 0 ? metadata.creation() : listed.timestamp();
        return new Directory(listed.uuid(), listed.parent(), metadata.name(), Instant.ofEpochSecond(creation));
    }
}

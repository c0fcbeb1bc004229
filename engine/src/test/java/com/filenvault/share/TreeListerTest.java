package com.filenvault.share;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import com.filenvault.TestAccounts;
import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.DirectoryListing;
import com.filenvault.client.FilenClient;
import com.filenvault.client.ListedFile;
import com.filenvault.client.ListedFolder;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.error.KeyMismatchException;
import com.filenvault.model.Directory;
import com.filenvault.model.File;
import com.filenvault.model.MetadataCodec;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TreeListerTest {

    @Mock
    private FilenClient client;

    private AccountKeys keys;
    private MetadataCodec codec;
    private TreeLister lister;
    private Directory docs;

    @BeforeEach
    void setup() {
        keys = TestAccounts.v3();
        codec = new MetadataCodec(Jackson2ObjectMapperBuilder.json().build());
        AccountKeysHolder holder = new AccountKeysHolder();
        holder.set(keys);
        lister = new TreeLister(client, holder, codec);
        docs = new Directory("dir-docs", "root", "docs", Instant.ofEpochSecond(1_700_000_000L));
    }

    private String encrypt(String json) {
        return keys.hierarchy().encryptMeta(json);
    }

    @Test
    void listingIsDecryptedAndListedRootSkipped() {
        EncryptionKey key = EncryptionKey.generate(3);
        File original = new File("file-1", "dir-sub", "inside.txt", "text/plain", key,
                Instant.ofEpochMilli(1_700_000_000_123L), Instant.ofEpochMilli(1_700_000_100_456L),
                99, 1, "cd".repeat(32), "bucket-9", "de-1");
        Directory sub = new Directory("dir-sub", docs.uuid(), "sub", Instant.ofEpochSecond(1_700_000_050L));
        DirectoryListing listing = new DirectoryListing(
                List.of(new ListedFile("file-1", "dir-sub", encrypt(codec.fileMetadata(original, 3)),
                        "bucket-9", "de-1", 1, 2)),
                List.of(new ListedFolder(docs.uuid(), TreeLister.LISTED_ROOT_PARENT,
                                encrypt(codec.directoryMetadata(docs)), 0),
                        new ListedFolder("dir-sub", docs.uuid(), encrypt(codec.directoryMetadata(sub)), 0)));
        when(client.dirDownload(docs.uuid())).thenReturn(Mono.just(listing));

        StepVerifier.create(lister.listRecursive(docs))
                .assertNext(tree -> {
                    assertEquals(2, tree.size());
                    assertEquals(List.of(sub), tree.directories());
                    assertEquals(original, tree.files().get(0));
                })
                .verifyComplete();
    }

    @Test
    void missingCreationFallsBackToListingTimestamp() {
        DirectoryListing listing = new DirectoryListing(List.of(), List.of(new ListedFolder("dir-old", docs.uuid(),
                encrypt("{\"name\":\"old\"}"), 1_600_000_000L)));
        when(client.dirDownload(docs.uuid())).thenReturn(Mono.just(listing));

        StepVerifier.create(lister.listRecursive(docs))
                .assertNext(tree -> assertEquals(Instant.ofEpochSecond(1_600_000_000L), tree.directories().get(0).created()))
                .verifyComplete();
    }

    @Test
    void foreignMetadataFailsListing() {
        DirectoryListing listing = new DirectoryListing(List.of(), List.of(new ListedFolder("dir-x", docs.uuid(),
                EncryptionKey.random().encryptMeta("{\"name\":\"x\"}"), 0)));
        when(client.dirDownload(docs.uuid())).thenReturn(Mono.just(listing));

        StepVerifier.create(lister.listRecursive(docs))
                .expectError(KeyMismatchException.class)
                .verify();
    }
}

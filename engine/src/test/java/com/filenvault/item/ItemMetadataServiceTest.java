package com.filenvault.item;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import com.filenvault.TestAccounts;
import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.DirMetadataRequest;
import com.filenvault.client.FileMetadataRequest;
import com.filenvault.client.FilenClient;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.error.FilenApiException;
import com.filenvault.model.Directory;
import com.filenvault.model.File;
import com.filenvault.model.MetadataCodec;
import com.filenvault.search.SearchIndexer;
import com.filenvault.share.SharePropagator;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ItemMetadataServiceTest {

    @Mock
    private FilenClient client;

    @Mock
    private SharePropagator sharePropagator;

    @Mock
    private SearchIndexer searchIndexer;

    private AccountKeys keys;
    private MetadataCodec codec;
    private ItemMetadataService service;
    private File file;

    @BeforeEach
    void setup() {
        keys = TestAccounts.v3();
        codec = new MetadataCodec(Jackson2ObjectMapperBuilder.json().build());
        AccountKeysHolder holder = new AccountKeysHolder();
        holder.set(keys);
        service = new ItemMetadataService(client, holder, codec, sharePropagator, searchIndexer);
        Instant now = Instant.ofEpochMilli(1_700_000_000_000L);
        file = new File("file-1", "parent-1", "draft.txt", "text/plain", EncryptionKey.generate(3), now, now,
                5, 1, "ef".repeat(32), "bucket", "region");
    }

    @Test
    void renameStoresMetadataAndPropagates() {
        when(client.fileMetadata(any())).thenReturn(Mono.empty());
        when(sharePropagator.updateSharedItem(any())).thenReturn(Mono.empty());
        when(searchIndexer.updateSearchHashes(any())).thenReturn(Mono.empty());

        StepVerifier.create(service.rename(file, "Final.txt"))
                .assertNext(renamed -> {
                    assertEquals("Final.txt", renamed.name());
                    assertEquals(file.uuid(), renamed.uuid());
                })
                .verifyComplete();

        assertEquals("draft.txt", file.name(), "the original value is untouched");
        ArgumentCaptor<FileMetadataRequest> captor = ArgumentCaptor.forClass(FileMetadataRequest.class);
        verify(client).fileMetadata(captor.capture());
        FileMetadataRequest request = captor.getValue();
        assertEquals(keys.hashFileName("final.txt"), request.nameHashed());
        assertEquals("Final.txt", file.encryptionKey().toMasterKey().decryptMeta(request.name()));
        assertEquals("Final.txt", codec.readFileMetadata(keys.hierarchy().decryptMeta(request.metadata())).name());
        verify(sharePropagator).updateSharedItem(file.withName("Final.txt"));
        verify(searchIndexer).updateSearchHashes(file.withName("Final.txt"));
    }

    @Test
    void rejectedRenameSkipsPropagation() {
        when(client.fileMetadata(any()))
                .thenReturn(Mono.error(new FilenApiException("/v3/file/metadata", "Name exists.", "exists")));

        StepVerifier.create(service.rename(file, "taken.txt"))
                .expectError(FilenApiException.class)
                .verify();

        verifyNoInteractions(sharePropagator, searchIndexer);
    }

    @Test
    void renameRejectsSlash() {
        StepVerifier.create(service.rename(file, "a/b"))
                .expectError(IllegalArgumentException.class)
                .verify();

        verifyNoInteractions(client);
    }

    @Test
    void directoryRenameUsesDirectoryEndpoint() {
        Directory docs = new Directory("dir-1", "parent-1", "docs", Instant.ofEpochSecond(1_700_000_000L));
        when(client.dirMetadata(any())).thenReturn(Mono.empty());
        when(sharePropagator.updateSharedItem(any())).thenReturn(Mono.empty());
        when(searchIndexer.updateSearchHashes(any())).thenReturn(Mono.empty());

        StepVerifier.create(service.rename(docs, "papers")).expectNextCount(1).verifyComplete();

        ArgumentCaptor<DirMetadataRequest> captor = ArgumentCaptor.forClass(DirMetadataRequest.class);
        verify(client).dirMetadata(captor.capture());
        assertEquals("papers", codec.readDirectoryMetadata(keys.hierarchy().decryptMeta(captor.getValue().metadata())).name());
    }

    @Test
    void moveJoinsNewParentShares() {
        Directory docs = new Directory("dir-1", "parent-1", "docs", Instant.ofEpochSecond(1_700_000_000L));
        Directory moved = docs.withParent("parent-2");
        when(client.dirMove("dir-1", "parent-2")).thenReturn(Mono.empty());
        when(sharePropagator.updateItemWithMaybeSharedParent(moved)).thenReturn(Mono.empty());

        StepVerifier.create(service.move(docs, "parent-2"))
                .expectNext(moved)
                .verifyComplete();

        verify(client, never()).fileMove(any(), any());
    }
}

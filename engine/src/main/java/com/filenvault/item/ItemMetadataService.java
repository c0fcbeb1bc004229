package com.filenvault.item;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.DirMetadataRequest;
import com.filenvault.client.FileMetadataRequest;
import com.filenvault.client.FilenClient;
import com.filenvault.error.UnsupportedObjectVariantException;
import com.filenvault.model.Directory;
import com.filenvault.model.File;
import com.filenvault.model.FileSystemObjectVisitor;
import com.filenvault.model.MetadataCodec;
import com.filenvault.model.NonRootObject;
import com.filenvault.model.RootDirectory;
import com.filenvault.search.SearchIndexer;
import com.filenvault.share.SharePropagator;

import reactor.core.publisher.Mono;

/**
 * Rename and move, followed by the propagation each change requires. Items are immutable:
 * the changed item is emitted and the caller's copy stays as it was, also on failure.
 */
@Service
public class ItemMetadataService {

    private static final Logger log = LoggerFactory.getLogger(ItemMetadataService.class);

    private final FilenClient client;
    private final AccountKeysHolder keysHolder;
    private final MetadataCodec codec;
    private final SharePropagator sharePropagator;
    private final SearchIndexer searchIndexer;

    public ItemMetadataService(FilenClient client, AccountKeysHolder keysHolder, MetadataCodec codec,
                               SharePropagator sharePropagator, SearchIndexer searchIndexer) {
        this.client = client;
        this.keysHolder = keysHolder;
        this.codec = codec;
        this.sharePropagator = sharePropagator;
        this.searchIndexer = searchIndexer;
    }

    /**
     * Stores the new name, then updates every shared and linked copy and the search index
     * concurrently.
     */
    public Mono<NonRootObject> rename(NonRootObject item, String newName) {
        if (newName.indexOf('/') >= 0) {
            return Mono.error(new IllegalArgumentException("name must not contain '/'"));
        }
        NonRootObject renamed = item.withName(newName);
        return updateMetadata(renamed)
                .then(Mono.defer(() -> Mono.when(sharePropagator.updateSharedItem(renamed),
                        searchIndexer.updateSearchHashes(renamed))))
                .doOnSuccess(ignored -> log.debug("Renamed {}", renamed.uuid()))
                .thenReturn(renamed);
    }

    /** Moves the item, then adds it to the shares and links of its new parent. */
    public Mono<NonRootObject> move(NonRootObject item, String newParentUuid) {
        NonRootObject moved = item.withParent(newParentUuid);
        Mono<Void> request = moved.accept(new FileSystemObjectVisitor<Mono<Void>>() {
            @Override
            public Mono<Void> visitFile(File file) {
                return client.fileMove(file.uuid(), newParentUuid);
            }

            @Override
            public Mono<Void> visitDirectory(Directory directory) {
                return client.dirMove(directory.uuid(), newParentUuid);
            }

            @Override
            public Mono<Void> visitRoot(RootDirectory root) {
                return Mono.error(new UnsupportedObjectVariantException("the root directory cannot be moved"));
            }
        });
        return request
                .then(Mono.defer(() -> sharePropagator.updateItemWithMaybeSharedParent(moved)))
                .doOnSuccess(ignored -> log.debug("Moved {} to {}", moved.uuid(), newParentUuid))
                .thenReturn(moved);
    }

    private Mono<Void> updateMetadata(NonRootObject item) {
        return Mono.defer(() -> {
            AccountKeys keys = keysHolder.current();
            String metadata = keys.hierarchy().encryptMeta(
                    codec.metadataOf(item, keys.hierarchy().fileEncryptionVersion()));
            String nameHashed = keys.hashFileName(item.name());
            return item.accept(new FileSystemObjectVisitor<Mono<Void>>() {
                @Override
                public Mono<Void> visitFile(File file) {
                    String name = file.encryptionKey().toMasterKey().encryptMeta(file.name());
                    return client.fileMetadata(new FileMetadataRequest(file.uuid(), name, nameHashed, metadata));
                }

                @Override
                public Mono<Void> visitDirectory(Directory directory) {
                    return client.dirMetadata(new DirMetadataRequest(directory.uuid(), nameHashed, metadata));
                }

                @Override
                public Mono<Void> visitRoot(RootDirectory root) {
                    return Mono.error(new UnsupportedObjectVariantException("the root directory has no metadata"));
                }
            });
        });
    }
}

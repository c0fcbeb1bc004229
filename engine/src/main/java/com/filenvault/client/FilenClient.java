package com.filenvault.client;

import java.util.List;

import com.filenvault.search.SearchIndexItem;

import reactor.core.publisher.Mono;

/**
 * The authenticated API the engine drives. Every call is lazy and cancellable: nothing is
 * sent until the returned {@link Mono} is subscribed, and disposing the subscription
 * abandons the request. Retry and timeout policy belong to the implementation.
 *
 * <p>A response whose envelope reports failure surfaces as
 * {@link com.filenvault.error.FilenApiException}.
 */
public interface FilenClient {

    // ─── Account keys ─────────────────────────────────────────────────────────

    Mono<AuthInfo> authInfo(String email);

    /**
     * Registers the given encrypted master key with the account and returns every master
     * key of the account as one encrypted, {@code |}-separated string.
     */
    Mono<String> masterKeys(String encryptedMasterKeys);

    /** The DEK, encrypted under the KEK. */
    Mono<String> userDek();

    Mono<KeyPairInfo> keyPairInfo();

    /** Base64 public key of another user, for sharing. */
    Mono<String> userPublicKey(String email);

    // ─── Upload ───────────────────────────────────────────────────────────────

    Mono<StorageLocation> uploadChunk(String uuid, int index, String parentUuid, String uploadKey, byte[] encrypted);

    Mono<Void> uploadDone(UploadDoneRequest request);

    Mono<Void> uploadEmpty(UploadEmptyRequest request);

    // ─── Download ─────────────────────────────────────────────────────────────

    /** The encrypted bytes of one chunk, fetched from the file's storage location. */
    Mono<byte[]> downloadChunk(String uuid, String region, String bucket, int index);

    // ─── Sharing and links ────────────────────────────────────────────────────

    Mono<SharedInfo> itemShared(String uuid);

    Mono<LinkedInfo> itemLinked(String uuid);

    Mono<LinkedInfo> dirLinked(String uuid);

    Mono<Void> itemShare(ItemShareRequest request);

    Mono<Void> itemSharedRename(SharedRenameRequest request);

    Mono<Void> itemLinkedRename(LinkedRenameRequest request);

    Mono<Void> dirLinkAdd(DirLinkAddRequest request);

    Mono<Void> fileLinkEdit(FileLinkEditRequest request);

    // ─── Items ────────────────────────────────────────────────────────────────

    Mono<DirectoryListing> dirDownload(String uuid);

    Mono<Void> fileMetadata(FileMetadataRequest request);

    Mono<Void> dirMetadata(DirMetadataRequest request);

    Mono<Void> fileMove(String uuid, String newParentUuid);

    Mono<Void> dirMove(String uuid, String newParentUuid);

    // ─── Search ───────────────────────────────────────────────────────────────

    Mono<Void> searchAdd(List<SearchIndexItem> items);
}

package com.filenvault.share;

import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.DirLinkAddRequest;
import com.filenvault.client.FileLinkEditRequest;
import com.filenvault.client.FilenClient;
import com.filenvault.client.LinkedEntry;
import com.filenvault.client.LinkedInfo;
import com.filenvault.client.LinkedRenameRequest;
import com.filenvault.client.SharedInfo;
import com.filenvault.client.SharedRenameRequest;
import com.filenvault.client.SharedUser;
import com.filenvault.config.FilenProperties;
import com.filenvault.crypto.Digests;
import com.filenvault.crypto.KeyHierarchy;
import com.filenvault.crypto.MetaCrypter;
import com.filenvault.crypto.RsaKeys;
import com.filenvault.crypto.SecureRandoms;
import com.filenvault.error.PropagationFailureException;
import com.filenvault.error.UnsupportedObjectVariantException;
import com.filenvault.model.Directory;
import com.filenvault.model.File;
import com.filenvault.model.FileSystemObjectVisitor;
import com.filenvault.model.ItemType;
import com.filenvault.model.MetadataCodec;
import com.filenvault.model.NonRootObject;
import com.filenvault.model.RootDirectory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps every shared and linked copy of an item's metadata in step with the item.
 *
 * <p>Each recipient gets the metadata encrypted under their RSA public key; each public
 * link gets it encrypted under the link key. The account hierarchy is never used for
 * these copies.
 *
 * <p>Per-target requests run as one fan-out of at most {@code filen.max-small-callers}
 * requests in flight. The first failing request cancels the rest and surfaces as a
 * {@link PropagationFailureException}; requests that already went through stay applied.
 * Every operation here is safe to re-run.
 */
@Service
public class SharePropagator {

    private static final Logger log = LoggerFactory.getLogger(SharePropagator.class);

    static final int LINK_KEY_LENGTH = 32;
    static final int LINK_SALT_BYTES = 128;
    static final String EMPTY_LINK_PASSWORD = "empty";

    private final FilenClient client;
    private final AccountKeysHolder keysHolder;
    private final MetadataCodec codec;
    private final TreeLister treeLister;
    private final FilenProperties properties;

    public SharePropagator(FilenClient client, AccountKeysHolder keysHolder, MetadataCodec codec,
                           TreeLister treeLister, FilenProperties properties) {
        this.client = client;
        this.keysHolder = keysHolder;
        this.codec = codec;
        this.treeLister = treeLister;
        this.properties = properties;
    }

    // ─── Propagate-on-change ──────────────────────────────────────────────────

    /**
     * Re-encrypts the item's current metadata for every existing recipient and link and
     * sends an update per target. Creates nothing.
     */
    public Mono<Void> updateSharedItem(NonRootObject item) {
        return Mono.defer(() -> {
            AccountKeys keys = keysHolder.current();
            String metadata = codec.metadataOf(item, keys.hierarchy().fileEncryptionVersion());
            return Mono.zip(client.itemShared(item.uuid()), client.itemLinked(item.uuid()))
                    .flatMap(targets -> {
                        List<Mono<Void>> operations = new ArrayList<>();
                        for (SharedUser user : targets.getT1().users()) {
                            RSAPublicKey publicKey = RsaKeys.publicKeyFromString(user.publicKey());
                            operations.add(Mono.defer(() -> client.itemSharedRename(new SharedRenameRequest(
                                    item.uuid(), user.id(), RsaKeys.publicEncrypt(publicKey, metadata)))));
                        }
                        for (LinkedEntry link : targets.getT2().links()) {
                            MetaCrypter linkKey = linkCrypter(keys, link);
                            operations.add(Mono.defer(() -> client.itemLinkedRename(new LinkedRenameRequest(
                                    item.uuid(), link.linkUuid(), linkKey.encryptMeta(metadata)))));
                        }
                        log.debug("Updating {} shared copies of {}", operations.size(), item.uuid());
                        return fanOut("update of shared copies of " + item.uuid(), operations);
                    });
        });
    }

    // ─── Propagate-on-parent ──────────────────────────────────────────────────

    /**
     * Adds a new or moved item, with its whole subtree for a directory, to every share and
     * link of its parent. Does nothing when the parent is neither shared nor linked.
     */
    public Mono<Void> updateItemWithMaybeSharedParent(NonRootObject item) {
        return Mono.defer(() -> {
            AccountKeys keys = keysHolder.current();
            String parentUuid = item.parentUuid();
            return Mono.zip(client.itemShared(parentUuid), client.dirLinked(parentUuid))
                    .flatMap(targets -> {
                        SharedInfo shared = targets.getT1();
                        LinkedInfo linked = targets.getT2();
                        if (!shared.sharing() && !linked.linked()) {
                            return Mono.<Void>empty();
                        }
                        return subtree(item, parentUuid, keys)
                                .flatMap(entries -> fanOut("propagation of " + item.uuid() + " to its parent's shares",
                                        parentShareOperations(keys, entries, shared, linked)));
                    });
        });
    }

    private List<Mono<Void>> parentShareOperations(AccountKeys keys, List<Entry> entries, SharedInfo shared,
                                                   LinkedInfo linked) {
        List<Mono<Void>> operations = new ArrayList<>();
        for (SharedUser user : shared.users()) {
            RSAPublicKey publicKey = RsaKeys.publicKeyFromString(user.publicKey());
            for (Entry entry : entries) {
                operations.add(Mono.defer(() -> client.itemShare(new ShareRecord(entry.uuid(), entry.parentUuid(),
                        user.email(), entry.type(), RsaKeys.publicEncrypt(publicKey, entry.metadata())).toRequest())));
            }
        }
        for (LinkedEntry link : linked.links()) {
            MetaCrypter linkKey = linkCrypter(keys, link);
            for (Entry entry : entries) {
                operations.add(Mono.defer(() -> client.dirLinkAdd(new LinkRecord(entry.uuid(), entry.parentUuid(),
                        link.linkUuid(), entry.type(), linkKey.encryptMeta(entry.metadata()), link.linkKey(),
                        DirLinkAddRequest.NEVER).toRequest())));
            }
        }
        log.debug("Adding {} items to {} shares and {} links", entries.size(), shared.users().size(),
                linked.links().size());
        return operations;
    }

    // ─── Share-to-user ────────────────────────────────────────────────────────

    /** Shares the item, and for a directory its whole subtree, with the user behind {@code email}. */
    public Mono<Void> shareItemToUser(NonRootObject item, String email) {
        return Mono.defer(() -> {
            AccountKeys keys = keysHolder.current();
            return client.userPublicKey(email)
                    .map(RsaKeys::publicKeyFromString)
                    .zipWith(subtree(item, ShareRecord.NO_PARENT, keys))
                    .flatMap(resolved -> {
                        RSAPublicKey publicKey = resolved.getT1();
                        List<Mono<Void>> operations = resolved.getT2().stream()
                                .map(entry -> Mono.defer(() -> client.itemShare(new ShareRecord(entry.uuid(),
                                        entry.parentUuid(), email, entry.type(),
                                        RsaKeys.publicEncrypt(publicKey, entry.metadata())).toRequest())))
                                .toList();
                        return fanOut("share of " + item.uuid(), operations);
                    });
        });
    }

    // ─── Public links ─────────────────────────────────────────────────────────

    /**
     * Creates a public link for the item and emits its link UUID. A directory link gets a
     * fresh link key and covers the whole subtree; a file link is a single request.
     */
    public Mono<String> publicLinkItem(NonRootObject item) {
        return Mono.defer(() -> item.accept(new FileSystemObjectVisitor<Mono<String>>() {
            @Override
            public Mono<String> visitFile(File file) {
                return publicLinkFile(file);
            }

            @Override
            public Mono<String> visitDirectory(Directory directory) {
                return publicLinkDirectory(directory);
            }

            @Override
            public Mono<String> visitRoot(RootDirectory root) {
                return Mono.error(new UnsupportedObjectVariantException("the root directory cannot be linked"));
            }
        }));
    }

    private Mono<String> publicLinkFile(File file) {
        String linkUuid = UUID.randomUUID().toString();
        FileLinkEditRequest request = new FileLinkEditRequest(
                linkUuid,
                file.uuid(),
                DirLinkAddRequest.NEVER,
                EMPTY_LINK_PASSWORD,
                Digests.v2Hash(EMPTY_LINK_PASSWORD),
                false,
                "enable",
                Hex.toHexString(SecureRandoms.bytes(LINK_SALT_BYTES)));
        return client.fileLinkEdit(request)
                .then(Mono.fromCallable(() -> {
                    log.info("Created public link {} for file {}", linkUuid, file.uuid());
                    return linkUuid;
                }));
    }

    private Mono<String> publicLinkDirectory(Directory directory) {
        AccountKeys keys = keysHolder.current();
        String linkUuid = UUID.randomUUID().toString();
        String linkKey = SecureRandoms.alphanumeric(LINK_KEY_LENGTH);
        String encryptedLinkKey = keys.hierarchy().encryptMeta(linkKey);
        MetaCrypter linkCrypter = KeyHierarchy.crypterForKeyString(linkKey);
        return subtree(directory, LinkRecord.LINK_ROOT_PARENT, keys)
                .flatMap(entries -> fanOut("public link of " + directory.uuid(), entries.stream()
                        .map(entry -> Mono.defer(() -> client.dirLinkAdd(new LinkRecord(entry.uuid(),
                                entry.parentUuid(), linkUuid, entry.type(), linkCrypter.encryptMeta(entry.metadata()),
                                encryptedLinkKey, DirLinkAddRequest.NEVER).toRequest())))
                        .toList()))
                .then(Mono.fromCallable(() -> {
                    log.info("Created public link {} for directory {}", linkUuid, directory.uuid());
                    return linkUuid;
                }));
    }

    // ─── Queries ──────────────────────────────────────────────────────────────

    public Mono<Boolean> isItemShared(NonRootObject item) {
        return client.itemShared(item.uuid()).map(SharedInfo::sharing);
    }

    public Mono<Boolean> isItemLinked(NonRootObject item) {
        return client.itemLinked(item.uuid()).map(LinkedInfo::linked);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private MetaCrypter linkCrypter(AccountKeys keys, LinkedEntry link) {
        return KeyHierarchy.crypterForKeyString(keys.hierarchy().decryptMeta(link.linkKey()));
    }

    /**
     * The item itself under {@code rootParent}, followed for a directory by every
     * descendant under its own parent.
     */
    private Mono<List<Entry>> subtree(NonRootObject item, String rootParent, AccountKeys keys) {
        int version = keys.hierarchy().fileEncryptionVersion();
        Entry root = new Entry(item.uuid(), rootParent, item.itemType(), codec.metadataOf(item, version));
        return item.accept(new FileSystemObjectVisitor<Mono<List<Entry>>>() {
            @Override
            public Mono<List<Entry>> visitFile(File file) {
                return Mono.just(List.of(root));
            }

            @Override
            public Mono<List<Entry>> visitDirectory(Directory directory) {
                return treeLister.listRecursive(directory).map(tree -> {
                    List<Entry> entries = new ArrayList<>(tree.size() + 1);
                    entries.add(root);
                    for (File file : tree.files()) {
                        entries.add(new Entry(file.uuid(), file.parentUuid(), ItemType.FILE,
                                codec.fileMetadata(file, version)));
                    }
                    for (Directory child : tree.directories()) {
                        entries.add(new Entry(child.uuid(), child.parentUuid(), ItemType.DIRECTORY,
                                codec.directoryMetadata(child)));
                    }
                    return entries;
                });
            }

            @Override
            public Mono<List<Entry>> visitRoot(RootDirectory rootDirectory) {
                return Mono.error(new UnsupportedObjectVariantException("the root directory cannot be shared"));
            }
        });
    }

    private Mono<Void> fanOut(String what, List<Mono<Void>> operations) {
        return Flux.fromIterable(operations)
                .flatMap(operation -> operation, properties.maxSmallCallers())
                .then()
                .onErrorMap(e -> !(e instanceof PropagationFailureException),
                        e -> new PropagationFailureException(what + " failed", e))
                .doOnError(e -> log.warn("{}: {}", e.getMessage(), e.getCause() == null ? "" : e.getCause().getMessage()));
    }

    // Plaintext metadata of one item, held only for the duration of one propagation call.
    private record Entry(String uuid, String parentUuid, ItemType type, String metadata) {

        @Override
        public String toString() {
            return "Entry[" + uuid + "]";
        }
    }
}

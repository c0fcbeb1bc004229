package com.filenvault.upload;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.FilenClient;
import com.filenvault.client.StorageLocation;
import com.filenvault.client.UploadDoneRequest;
import com.filenvault.client.UploadEmptyRequest;
import com.filenvault.config.FilenProperties;
import com.filenvault.crypto.MasterKey;
import com.filenvault.crypto.SecureRandoms;
import com.filenvault.error.ChunkUploadFailedException;
import com.filenvault.error.NoChunksUploadedException;
import com.filenvault.error.UploadAbortedException;
import com.filenvault.error.UploadFinalizeFailedException;
import com.filenvault.model.File;
import com.filenvault.model.IncompleteFile;
import com.filenvault.model.MetadataCodec;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

/**
 * Streams a file's content to storage in fixed-size encrypted chunks and completes it.
 *
 * Flow:
 *   1. {@link #newUpload} opens a session with a fresh upload key
 *   2. {@link #stream} reads the source chunk by chunk, hashes each chunk in read order and
 *      uploads up to {@code filen.chunk-upload-concurrency} chunks at a time; a caller holding
 *      the chunks itself supplies them in order through {@link #uploadChunk}
 *   3. {@link #finalizeUpload} waits for a storage location and sends the completion request
 *
 * Empty content never sends a chunk and completes through the lighter empty-file request.
 */
@Service
public class UploadPipeline {

    private static final Logger log = LoggerFactory.getLogger(UploadPipeline.class);

    static final int REMOVAL_TOKEN_LENGTH = 32;

    private final FilenClient client;
    private final AccountKeysHolder keysHolder;
    private final MetadataCodec codec;
    private final FilenProperties properties;

    public UploadPipeline(FilenClient client, AccountKeysHolder keysHolder, MetadataCodec codec,
                          FilenProperties properties) {
        this.client = client;
        this.keysHolder = keysHolder;
        this.codec = codec;
        this.properties = properties;
    }

    public FileUpload newUpload(IncompleteFile file) {
        return new FileUpload(file);
    }

    /**
     * Adds one plaintext chunk to the session's content hash, encrypts it under the file key
     * and sends it. Chunks must be supplied in index order; resending an index that was
     * already supplied does not hash it again. The first successful response fixes the
     * session's storage location.
     */
    public Mono<StorageLocation> uploadChunk(FileUpload session, int index, byte[] plaintext) {
        return Mono.fromRunnable(() -> session.hash(index, plaintext))
                .then(sendChunk(session, index, plaintext));
    }

    private Mono<StorageLocation> sendChunk(FileUpload session, int index, byte[] plaintext) {
        IncompleteFile file = session.file();
        return Mono.defer(() -> {
            session.chunkStarted();
            return Mono.fromCallable(() -> file.encryptionKey().encryptData(plaintext))
                    .flatMap(encrypted -> client.uploadChunk(file.uuid(), index, file.parentUuid(),
                            session.uploadKey(), encrypted))
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("chunk upload returned no location")))
                    .doOnNext(location -> {
                        if (session.offerStorage(location)) {
                            log.debug("Upload {} stored in region {}", file.uuid(), location.region());
                        }
                    })
                    .onErrorMap(e -> !(e instanceof ChunkUploadFailedException), e -> new ChunkUploadFailedException(index, e))
                    .doFinally(signal -> session.chunkSettled());
        });
    }

    /**
     * Reads {@code source} to its end and uploads every chunk. Emits the number of bytes read.
     * The stream is read on a blocking-capable scheduler and is not closed here.
     */
    public Mono<Long> stream(FileUpload session, InputStream source) {
        int chunkSize = properties.chunkSize();
        return Flux.<Tuple2<Integer, byte[]>, Integer>generate(() -> 0, (index, sink) -> {
                    try {
                        byte[] chunk = source.readNBytes(chunkSize);
                        if (chunk.length == 0) {
                            sink.complete();
                            return index;
                        }
                        session.hash(index, chunk);
                        sink.next(Tuples.of(index, chunk));
                    } catch (IOException e) {
                        sink.error(new UncheckedIOException("reading upload source failed", e));
                    }
                    return index + 1;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(indexed -> sendChunk(session, indexed.getT1(), indexed.getT2()),
                        properties.chunkUploadConcurrency(), 1)
                .then(Mono.fromCallable(() -> {
                    session.streamingFinished();
                    return session.bytesRead();
                }))
                .doOnSubscribe(s -> session.startStreaming())
                .doOnError(e -> session.fail());
    }

    /**
     * Completes the upload once {@code totalSize} bytes have been supplied. A zero
     * {@code totalSize} takes the empty-file path; otherwise this stops accepting chunks and
     * waits for a storage location, at most {@code filen.storage-wait-timeout}.
     */
    public Mono<File> finalizeUpload(FileUpload session, long totalSize) {
        return Mono.defer(() -> {
            if (session.state().isTerminal()) {
                return Mono.error(new IllegalStateException("upload session is already " + session.state()));
            }
            AccountKeys keys = keysHolder.current();
            if (totalSize != 0 && session.state() == UploadState.CREATED) {
                session.fail();
                return Mono.error(new NoChunksUploadedException("no chunk of " + session.file().uuid() + " was uploaded"));
            }
            if (session.bytesRead() != totalSize) {
                session.fail();
                return Mono.error(new IllegalArgumentException("upload of " + session.file().uuid() + " was given "
                        + session.bytesRead() + " bytes but finalized with " + totalSize));
            }
            String hash = session.contentHash();
            if (totalSize == 0) {
                return completeEmpty(session, keys, hash);
            }
            session.streamingFinished();
            return session.awaitStorage()
                    .timeout(properties.storageWaitTimeout(),
                            Mono.error(() -> new UploadAbortedException("timed out waiting for a storage location")))
                    .switchIfEmpty(Mono.error(() -> new NoChunksUploadedException(
                            "no chunk of " + session.file().uuid() + " was uploaded")))
                    .flatMap(location -> complete(session, keys, location, totalSize, hash))
                    .doOnError(e -> session.fail())
                    .doOnCancel(session::abort);
        });
    }

    /** {@link #stream} then {@link #finalizeUpload}; cancelling aborts the session. */
    public Mono<File> upload(IncompleteFile file, InputStream source) {
        return Mono.defer(() -> {
            FileUpload session = newUpload(file);
            return stream(session, source)
                    .flatMap(size -> finalizeUpload(session, size))
                    .doOnCancel(session::abort);
        });
    }

    private Mono<File> complete(FileUpload session, AccountKeys keys, StorageLocation location, long size, String hash) {
        IncompleteFile incomplete = session.file();
        session.transition(UploadState.STREAMING, UploadState.AWAITING_COMPLETION);
        int chunks = (int) ((size + properties.chunkSize() - 1) / properties.chunkSize());
        File file = incomplete.complete(size, chunks, hash, location.bucket(), location.region());
        MasterKey metaKey = incomplete.encryptionKey().toMasterKey();
        UploadDoneRequest request = new UploadDoneRequest(
                incomplete.uuid(),
                metaKey.encryptMeta(incomplete.name()),
                keys.hashFileName(incomplete.name()),
                metaKey.encryptMeta(Long.toString(size)),
                incomplete.parentUuid(),
                metaKey.encryptMeta(incomplete.mimeType()),
                keys.hierarchy().encryptMeta(codec.fileMetadata(file, keys.hierarchy().fileEncryptionVersion())),
                keys.hierarchy().fileEncryptionVersion(),
                chunks,
                SecureRandoms.alphanumeric(REMOVAL_TOKEN_LENGTH),
                session.uploadKey());
        return send(session, client.uploadDone(request), file);
    }

    private Mono<File> completeEmpty(FileUpload session, AccountKeys keys, String hash) {
        IncompleteFile incomplete = session.file();
        File file = incomplete.complete(0, 0, hash, StorageLocation.NONE.bucket(), StorageLocation.NONE.region());
        MasterKey metaKey = incomplete.encryptionKey().toMasterKey();
        UploadEmptyRequest request = new UploadEmptyRequest(
                incomplete.uuid(),
                metaKey.encryptMeta(incomplete.name()),
                keys.hashFileName(incomplete.name()),
                metaKey.encryptMeta("0"),
                incomplete.parentUuid(),
                metaKey.encryptMeta(incomplete.mimeType()),
                keys.hierarchy().encryptMeta(codec.fileMetadata(file, keys.hierarchy().fileEncryptionVersion())),
                keys.hierarchy().fileEncryptionVersion());
        session.transition(UploadState.CREATED, UploadState.AWAITING_COMPLETION);
        session.transition(UploadState.STREAMING, UploadState.AWAITING_COMPLETION);
        return send(session, client.uploadEmpty(request), file);
    }

    private Mono<File> send(FileUpload session, Mono<Void> request, File file) {
        return request
                .onErrorMap(e -> new UploadFinalizeFailedException("completion of " + file.uuid() + " rejected", e))
                .then(Mono.fromCallable(() -> {
                    session.transition(UploadState.AWAITING_COMPLETION, UploadState.COMPLETED);
                    log.info("Uploaded {} ({} chunks)", file.uuid(), file.chunks());
                    return file;
                }))
                .doOnError(e -> session.fail());
    }
}

package com.filenvault.upload;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.bouncycastle.crypto.digests.Blake3Digest;
import org.bouncycastle.util.encoders.Hex;

import com.filenvault.client.StorageLocation;
import com.filenvault.crypto.SecureRandoms;
import com.filenvault.error.UploadAbortedException;
import com.filenvault.model.IncompleteFile;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One upload session: the file being uploaded, the random upload key that authorizes its
 * chunk writes, and the running BLAKE3 hash of the plaintext.
 *
 * <p>Lives only for the call that created it. The hash is fed in chunk index order;
 * chunk responses may arrive on any thread, and only the first one's storage location
 * is kept.
 */
public final class FileUpload {

    static final int UPLOAD_KEY_LENGTH = 32;

    private final IncompleteFile file;
    private final String uploadKey;
    private final Blake3Digest hasher = new Blake3Digest();
    private final AtomicReference<UploadState> state = new AtomicReference<>(UploadState.CREATED);
    private final AtomicReference<StorageLocation> storage = new AtomicReference<>();
    private final Sinks.One<StorageLocation> storageSink = Sinks.one();
    private final AtomicInteger chunksUploaded = new AtomicInteger();
    private final AtomicInteger chunksInFlight = new AtomicInteger();
    private volatile boolean closed;
    private int chunksHashed;
    private long bytesRead;

    FileUpload(IncompleteFile file) {
        this.file = file;
        this.uploadKey = SecureRandoms.alphanumeric(UPLOAD_KEY_LENGTH);
    }

    public IncompleteFile file() {
        return file;
    }

    public String uploadKey() {
        return uploadKey;
    }

    public UploadState state() {
        return state.get();
    }

    public int chunksUploaded() {
        return chunksUploaded.get();
    }

    /** The retained storage location, or {@code null} before the first chunk response. */
    public StorageLocation storageLocation() {
        return storage.get();
    }

    /**
     * Adds chunk {@code index} to the content hash. Chunks must arrive in index order; an
     * index that is already part of the hash is a resend and leaves the hash unchanged.
     */
    synchronized void hash(int index, byte[] plaintext) {
        if (closed) {
            throw new IllegalStateException("upload of " + file.uuid() + " no longer accepts chunks");
        }
        if (index < chunksHashed) {
            return;
        }
        if (index > chunksHashed) {
            throw new IllegalStateException("chunk " + index + " of " + file.uuid()
                    + " supplied before chunk " + chunksHashed);
        }
        hasher.update(plaintext, 0, plaintext.length);
        bytesRead += plaintext.length;
        chunksHashed++;
    }

    synchronized long bytesRead() {
        return bytesRead;
    }

    synchronized String contentHash() {
        Blake3Digest copy = new Blake3Digest(hasher);
        byte[] out = new byte[copy.getDigestSize()];
        copy.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /** Registers a chunk about to be sent. Fails once the session stopped accepting chunks. */
    void chunkStarted() {
        chunksInFlight.incrementAndGet();
        if (closed) {
            chunkSettled();
            throw new IllegalStateException("upload of " + file.uuid() + " no longer accepts chunks");
        }
        startStreaming();
    }

    /** Called when a sent chunk succeeded, failed or was cancelled. */
    void chunkSettled() {
        if (chunksInFlight.decrementAndGet() == 0 && closed) {
            settleWithoutStorage();
        }
    }

    void startStreaming() {
        state.compareAndSet(UploadState.CREATED, UploadState.STREAMING);
    }

    /** Records a successful chunk response. Returns whether its location was the one kept. */
    boolean offerStorage(StorageLocation location) {
        chunksUploaded.incrementAndGet();
        if (storage.compareAndSet(null, location)) {
            storageSink.tryEmitValue(location);
            return true;
        }
        return false;
    }

    /**
     * Stops accepting chunks. Once no chunk is in flight and none succeeded, the storage
     * wait completes empty.
     */
    void streamingFinished() {
        closed = true;
        state.compareAndSet(UploadState.STREAMING, UploadState.AWAITING_COMPLETION);
        if (chunksInFlight.get() == 0) {
            settleWithoutStorage();
        }
    }

    private void settleWithoutStorage() {
        if (storage.get() == null) {
            storageSink.tryEmitEmpty();
        }
    }

    /** Completes empty when the session is known never to receive a location. */
    Mono<StorageLocation> awaitStorage() {
        return storageSink.asMono();
    }

    boolean transition(UploadState from, UploadState to) {
        return state.compareAndSet(from, to);
    }

    void fail() {
        state.set(UploadState.FAILED);
    }

    /** Cancels the session; a finalize waiting for a storage location fails with {@link UploadAbortedException}. */
    public void abort() {
        UploadState previous = state.getAndUpdate(s -> s.isTerminal() ? s : UploadState.FAILED);
        if (!previous.isTerminal()) {
            storageSink.tryEmitError(new UploadAbortedException("upload of " + file.uuid() + " aborted"));
        }
    }
}

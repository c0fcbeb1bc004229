package com.filenvault.download;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicLong;

import org.bouncycastle.crypto.digests.Blake3Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.client.FilenClient;
import com.filenvault.config.FilenProperties;
import com.filenvault.error.ChunkDownloadFailedException;
import com.filenvault.error.ContentMismatchException;
import com.filenvault.model.File;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reads a file's content back from its storage location.
 *
 * Flow:
 *   1. chunks are fetched from egest, up to {@code filen.chunk-upload-concurrency} at a time
 *   2. each chunk is decrypted under the file key and emitted in index order
 *   3. after the last chunk the plaintext size and BLAKE3 hash are checked against the file
 */
@Service
public class DownloadPipeline {

    private static final Logger log = LoggerFactory.getLogger(DownloadPipeline.class);

    private final FilenClient client;
    private final FilenProperties properties;

    public DownloadPipeline(FilenClient client, FilenProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    /** Fetches and decrypts chunk {@code index} of {@code file}. */
    public Mono<byte[]> downloadChunk(File file, int index) {
        return client.downloadChunk(file.uuid(), file.region(), file.bucket(), index)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("chunk download returned no body")))
                .map(encrypted -> file.encryptionKey().decryptData(encrypted))
                .onErrorMap(e -> !(e instanceof ChunkDownloadFailedException), e -> new ChunkDownloadFailedException(index, e));
    }

    /**
     * The plaintext of {@code file}, one chunk per element in index order. The stream ends
     * with {@link ContentMismatchException} when the content read does not match the file's
     * size or hash; every chunk has been emitted by then.
     */
    public Flux<byte[]> download(File file) {
        return Flux.defer(() -> {
            Blake3Digest hasher = new Blake3Digest();
            AtomicLong bytesRead = new AtomicLong();
            return Flux.range(0, file.chunks())
                    .flatMapSequential(index -> downloadChunk(file, index), properties.chunkUploadConcurrency(), 1)
                    .doOnNext(chunk -> {
                        hasher.update(chunk, 0, chunk.length);
                        bytesRead.addAndGet(chunk.length);
                    })
                    .concatWith(Mono.defer(() -> verify(file, bytesRead.get(), hasher)));
        });
    }

    /**
     * Writes the plaintext of {@code file} to {@code target} and emits the number of bytes
     * written. The target is written on a blocking-capable scheduler and is not closed here.
     */
    public Mono<Long> downloadTo(File file, OutputStream target) {
        return download(file)
                .publishOn(Schedulers.boundedElastic())
                .reduce(0L, (written, chunk) -> {
                    try {
                        target.write(chunk);
                    } catch (IOException e) {
                        throw new UncheckedIOException("writing download target failed", e);
                    }
                    return written + chunk.length;
                });
    }

    private Mono<byte[]> verify(File file, long bytesRead, Blake3Digest hasher) {
        if (bytesRead != file.size()) {
            return Mono.error(new ContentMismatchException("read " + bytesRead + " bytes of " + file.uuid()
                    + ", expected " + file.size()));
        }
        // Files listed without a hash cannot be checked.
        if (file.hash() == null || file.hash().isEmpty()) {
            return Mono.empty();
        }
        byte[] out = new byte[hasher.getDigestSize()];
        hasher.doFinal(out, 0);
        String actual = Hex.toHexString(out);
        if (!actual.equals(file.hash())) {
            return Mono.error(new ContentMismatchException("hash mismatch for " + file.uuid()
                    + ": expected " + file.hash() + ", got " + actual));
        }
        log.debug("Downloaded {} ({} chunks)", file.uuid(), file.chunks());
        return Mono.empty();
    }
}

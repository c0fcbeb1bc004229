package com.filenvault.upload;

import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.error.PropagationFailureException;
import com.filenvault.model.File;
import com.filenvault.model.IncompleteFile;
import com.filenvault.search.SearchIndexer;
import com.filenvault.share.SharePropagator;

import reactor.core.publisher.Mono;

/**
 * Uploads a file and then brings its parent's shares, its parent's links and the search
 * index up to date.
 *
 * <p>The two follow-up steps run concurrently. If either fails the upload itself still
 * stands: the error is a {@link PropagationFailureException} carrying the completed file,
 * so the caller can re-run propagation for it.
 */
@Service
public class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    private final UploadPipeline pipeline;
    private final SharePropagator sharePropagator;
    private final SearchIndexer searchIndexer;

    public UploadService(UploadPipeline pipeline, SharePropagator sharePropagator, SearchIndexer searchIndexer) {
        this.pipeline = pipeline;
        this.sharePropagator = sharePropagator;
        this.searchIndexer = searchIndexer;
    }

    public Mono<File> upload(IncompleteFile file, InputStream source) {
        return pipeline.upload(file, source).flatMap(this::propagate);
    }

    Mono<File> propagate(File file) {
        return Mono.when(sharePropagator.updateItemWithMaybeSharedParent(file), searchIndexer.updateSearchHashes(file))
                .onErrorMap(e -> {
                    log.warn("Uploaded {} but propagation failed", file.uuid());
                    return new PropagationFailureException("propagation after upload of " + file.uuid() + " failed",
                            e, file);
                })
                .thenReturn(file);
    }
}

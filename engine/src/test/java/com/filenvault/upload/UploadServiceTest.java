package com.filenvault.upload;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filenvault.error.FilenApiException;
import com.filenvault.error.PropagationFailureException;
import com.filenvault.error.UploadFinalizeFailedException;
import com.filenvault.model.File;
import com.filenvault.model.IncompleteFile;
import com.filenvault.search.SearchIndexer;
import com.filenvault.share.SharePropagator;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadServiceTest {

    @Mock
    private UploadPipeline pipeline;

    @Mock
    private SharePropagator sharePropagator;

    @Mock
    private SearchIndexer searchIndexer;

    private UploadService service;
    private IncompleteFile incomplete;
    private File uploaded;
    private InputStream source;

    @BeforeEach
    void setup() {
        service = new UploadService(pipeline, sharePropagator, searchIndexer);
        incomplete = IncompleteFile.create(3, "report.pdf", null, Instant.now(), Instant.now(), "parent-1");
        uploaded = incomplete.complete(3, 1, "hash", "bucket", "region");
        source = new ByteArrayInputStream(new byte[]{1, 2, 3});
    }

    @Test
    void uploadPropagatesToParentSharesAndSearchIndex() {
        when(pipeline.upload(incomplete, source)).thenReturn(Mono.just(uploaded));
        when(sharePropagator.updateItemWithMaybeSharedParent(uploaded)).thenReturn(Mono.empty());
        when(searchIndexer.updateSearchHashes(uploaded)).thenReturn(Mono.empty());

        StepVerifier.create(service.upload(incomplete, source))
                .expectNext(uploaded)
                .verifyComplete();

        verify(sharePropagator).updateItemWithMaybeSharedParent(uploaded);
        verify(searchIndexer).updateSearchHashes(uploaded);
    }

    @Test
    void propagationFailureCarriesTheUploadedFile() {
        FilenApiException cause = new FilenApiException("/v3/item/share", "Rate limited.", "rate_limit");
        when(pipeline.upload(incomplete, source)).thenReturn(Mono.just(uploaded));
        when(sharePropagator.updateItemWithMaybeSharedParent(uploaded)).thenReturn(Mono.error(cause));
        when(searchIndexer.updateSearchHashes(uploaded)).thenReturn(Mono.empty());

        StepVerifier.create(service.upload(incomplete, source))
                .expectErrorSatisfies(e -> {
                    PropagationFailureException failure = assertInstanceOf(PropagationFailureException.class, e);
                    assertSame(uploaded, failure.getItem(), "caller must be able to retry propagation");
                    assertSame(cause, failure.getCause());
                })
                .verify();
    }

    @Test
    void failedUploadSkipsPropagation() {
        when(pipeline.upload(incomplete, source))
                .thenReturn(Mono.error(new UploadFinalizeFailedException("rejected", new RuntimeException())));

        StepVerifier.create(service.upload(incomplete, source))
                .expectError(UploadFinalizeFailedException.class)
                .verify();

        verifyNoInteractions(sharePropagator, searchIndexer);
    }
}

package com.filenvault.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings, bound from {@code filen.*}.
 *
 * @param gatewayUrl             base URL of the JSON API
 * @param ingestUrl              base URL chunk uploads are posted to
 * @param egestUrl               base URL chunks are downloaded from
 * @param apiKey                 bearer token of the authenticated session
 * @param chunkSize              plaintext bytes per chunk
 * @param maxSmallCallers        in-flight request ceiling of a propagation fan-out
 * @param chunkUploadConcurrency in-flight chunk uploads or downloads of one file
 * @param storageWaitTimeout     how long finalize waits for a storage location
 */
@ConfigurationProperties("filen")
public record FilenProperties(
        @DefaultValue("https://gateway.filen.io") String gatewayUrl,
        @DefaultValue("https://ingest.filen.io") String ingestUrl,
        @DefaultValue("https://egest.filen.io") String egestUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("1048576") int chunkSize,
        @DefaultValue("64") int maxSmallCallers,
        @DefaultValue("4") int chunkUploadConcurrency,
        @DefaultValue("5m") Duration storageWaitTimeout
) {

    public FilenProperties {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("filen.chunk-size must be positive");
        }
        if (maxSmallCallers <= 0 || chunkUploadConcurrency <= 0) {
            throw new IllegalArgumentException("filen concurrency limits must be positive");
        }
    }
}

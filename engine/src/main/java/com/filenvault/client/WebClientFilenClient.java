package com.filenvault.client;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filenvault.crypto.Digests;
import com.filenvault.error.FilenApiException;
import com.filenvault.search.SearchIndexItem;

import reactor.core.publisher.Mono;

/**
 * {@link FilenClient} over Spring WebFlux.
 *
 * <p>Every response is a JSON envelope {@code {status, message, code, data}}. A false
 * {@code status} becomes a {@link FilenApiException}; otherwise {@code data} is mapped onto
 * the response record.
 */
@Component
public class WebClientFilenClient implements FilenClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientFilenClient.class);

    private final WebClient gateway;
    private final WebClient ingest;
    private final WebClient egest;
    private final ObjectMapper objectMapper;

    public WebClientFilenClient(@Qualifier("gatewayWebClient") WebClient gateway,
                                @Qualifier("ingestWebClient") WebClient ingest,
                                @Qualifier("egestWebClient") WebClient egest,
                                ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.ingest = ingest;
        this.egest = egest;
        this.objectMapper = objectMapper;
    }

    // ─── Account keys ─────────────────────────────────────────────────────────

    @Override
    public Mono<AuthInfo> authInfo(String email) {
        return post("/v3/auth/info", Map.of("email", email), AuthInfo.class);
    }

    @Override
    public Mono<String> masterKeys(String encryptedMasterKeys) {
        return post("/v3/user/masterKeys", Map.of("masterKeys", encryptedMasterKeys), JsonNode.class)
                .map(data -> data.path("keys").asText());
    }

    @Override
    public Mono<String> userDek() {
        return get("/v3/user/dek", JsonNode.class).map(data -> data.path("dek").asText());
    }

    @Override
    public Mono<KeyPairInfo> keyPairInfo() {
        return get("/v3/user/keyPair/info", KeyPairInfo.class);
    }

    @Override
    public Mono<String> userPublicKey(String email) {
        return post("/v3/user/publicKey", Map.of("email", email), JsonNode.class)
                .map(data -> data.path("publicKey").asText());
    }

    // ─── Upload ───────────────────────────────────────────────────────────────

    @Override
    public Mono<StorageLocation> uploadChunk(String uuid, int index, String parentUuid, String uploadKey,
                                             byte[] encrypted) {
        String endpoint = "/v3/upload";
        return ingest.post()
                .uri(builder -> builder.path(endpoint)
                        .queryParam("uuid", uuid)
                        .queryParam("index", index)
                        .queryParam("parent", parentUuid)
                        .queryParam("uploadKey", uploadKey)
                        .queryParam("hash", Digests.sha512Hex(encrypted))
                        .build())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(encrypted)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(envelope -> unwrap(endpoint, envelope, StorageLocation.class))
                .doOnSubscribe(s -> log.debug("Uploading chunk {} of {}", index, uuid));
    }

    @Override
    public Mono<Void> uploadDone(UploadDoneRequest request) {
        return post("/v3/upload/done", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> uploadEmpty(UploadEmptyRequest request) {
        return post("/v3/upload/empty", request, JsonNode.class).then();
    }

    // ─── Download ─────────────────────────────────────────────────────────────

    // Raw bytes, no envelope.
    @Override
    public Mono<byte[]> downloadChunk(String uuid, String region, String bucket, int index) {
        return egest.get()
                .uri("/{region}/{bucket}/{uuid}/{index}", region, bucket, uuid, index)
                .retrieve()
                .bodyToMono(byte[].class)
                .doOnSubscribe(s -> log.debug("Downloading chunk {} of {}", index, uuid));
    }

    // ─── Sharing and links ────────────────────────────────────────────────────

    @Override
    public Mono<SharedInfo> itemShared(String uuid) {
        return post("/v3/item/shared", Map.of("uuid", uuid), SharedInfo.class);
    }

    @Override
    public Mono<LinkedInfo> itemLinked(String uuid) {
        return post("/v3/item/linked", Map.of("uuid", uuid), LinkedInfo.class);
    }

    @Override
    public Mono<LinkedInfo> dirLinked(String uuid) {
        return post("/v3/dir/linked", Map.of("uuid", uuid), LinkedInfo.class);
    }

    @Override
    public Mono<Void> itemShare(ItemShareRequest request) {
        return post("/v3/item/share", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> itemSharedRename(SharedRenameRequest request) {
        return post("/v3/item/shared/rename", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> itemLinkedRename(LinkedRenameRequest request) {
        return post("/v3/item/linked/rename", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> dirLinkAdd(DirLinkAddRequest request) {
        return post("/v3/dir/link/add", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> fileLinkEdit(FileLinkEditRequest request) {
        return post("/v3/file/link/edit", request, JsonNode.class).then();
    }

    // ─── Items ────────────────────────────────────────────────────────────────

    @Override
    public Mono<DirectoryListing> dirDownload(String uuid) {
        return post("/v3/dir/download", Map.of("uuid", uuid), DirectoryListing.class);
    }

    @Override
    public Mono<Void> fileMetadata(FileMetadataRequest request) {
        return post("/v3/file/metadata", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> dirMetadata(DirMetadataRequest request) {
        return post("/v3/dir/metadata", request, JsonNode.class).then();
    }

    @Override
    public Mono<Void> fileMove(String uuid, String newParentUuid) {
        return post("/v3/file/move", Map.of("uuid", uuid, "to", newParentUuid), JsonNode.class).then();
    }

    @Override
    public Mono<Void> dirMove(String uuid, String newParentUuid) {
        return post("/v3/dir/move", Map.of("uuid", uuid, "to", newParentUuid), JsonNode.class).then();
    }

    // ─── Search ───────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> searchAdd(List<SearchIndexItem> items) {
        return post("/v3/search/add", Map.of("items", items), JsonNode.class).then();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private <T> Mono<T> post(String endpoint, Object body, Class<T> type) {
        return gateway.method(HttpMethod.POST)
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(envelope -> unwrap(endpoint, envelope, type));
    }

    private <T> Mono<T> get(String endpoint, Class<T> type) {
        return gateway.get()
                .uri(endpoint)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(envelope -> unwrap(endpoint, envelope, type));
    }

    private <T> Mono<T> unwrap(String endpoint, JsonNode envelope, Class<T> type) {
        if (!envelope.path("status").asBoolean(false)) {
            String message = envelope.path("message").asText("");
            String code = envelope.path("code").asText("");
            log.warn("{} rejected: {} ({})", endpoint, message, code);
            return Mono.error(new FilenApiException(endpoint, message, code));
        }
        JsonNode data = envelope.path("data");
        if (data.isMissingNode() || data.isNull()) {
            return type == JsonNode.class ? Mono.just(type.cast(objectMapper.createObjectNode())) : Mono.empty();
        }
        try {
            return Mono.just(objectMapper.treeToValue(data, type));
        } catch (JsonProcessingException e) {
            return Mono.error(new FilenApiException(endpoint, "malformed response data: " + e.getOriginalMessage(),
                    "invalid_response"));
        }
    }
}

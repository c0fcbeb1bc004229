package com.filenvault.search;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.FilenClient;
import com.filenvault.crypto.HmacKey;
import com.filenvault.model.ItemType;
import com.filenvault.model.NonRootObject;

import reactor.core.publisher.Mono;

/**
 * Blind search tokens for item names.
 *
 * A name is split into every substring of 2 to 16 code points plus the whole name, and each
 * token is sent as an HMAC-SHA256 under the account's HMAC key. The server can match a
 * query hash against the index without learning the name. The same name and key always
 * produce the same tokens, so indexing and querying agree.
 */
@Service
public class SearchIndexer {

    private static final Logger log = LoggerFactory.getLogger(SearchIndexer.class);

    public static final int MIN_TOKEN_LENGTH = 2;
    public static final int MAX_TOKEN_LENGTH = 16;
    public static final int MAX_TOKENS = 4096;

    private final FilenClient client;
    private final AccountKeysHolder keysHolder;

    public SearchIndexer(FilenClient client, AccountKeysHolder keysHolder) {
        this.client = client;
        this.keysHolder = keysHolder;
    }

    /**
     * Normalized (stripped, lowercased) tokens of {@code name}, deduplicated and sorted by
     * length, then English collation, then code point order; at most {@value #MAX_TOKENS}.
     */
    public static List<String> tokenize(String name) {
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        int[] codePoints = normalized.codePoints().toArray();
        int maxLength = Math.min(MAX_TOKEN_LENGTH, codePoints.length);

        Set<String> tokens = new LinkedHashSet<>();
        tokens.add(normalized);
        for (int start = 0; start < codePoints.length; start++) {
            for (int length = MIN_TOKEN_LENGTH; length <= maxLength && start + length <= codePoints.length; length++) {
                tokens.add(new String(codePoints, start, length));
            }
        }

        List<String> sorted = new ArrayList<>(tokens);
        sorted.sort(tokenOrder());
        return sorted.size() > MAX_TOKENS ? List.copyOf(sorted.subList(0, MAX_TOKENS)) : List.copyOf(sorted);
    }

    public static List<String> generateIndexHashes(String name, HmacKey key) {
        return tokenize(name).stream().map(key::hash).toList();
    }

    public static List<SearchIndexItem> indexItems(NonRootObject item, HmacKey key) {
        String type = ItemType.of(item).searchName();
        return generateIndexHashes(item.name(), key).stream()
                .map(hash -> new SearchIndexItem(item.uuid(), hash, type))
                .toList();
    }

    /** Submits the current name's tokens of {@code item} to the search index. */
    public Mono<Void> updateSearchHashes(NonRootObject item) {
        return Mono.fromCallable(() -> indexItems(item, keysHolder.current().hmacKey()))
                .flatMap(items -> {
                    if (items.isEmpty()) {
                        return Mono.empty();
                    }
                    log.debug("Indexing {} tokens for {}", items.size(), item.uuid());
                    return client.searchAdd(items);
                });
    }

    private static Comparator<String> tokenOrder() {
        Collator collator = Collator.getInstance(Locale.ENGLISH);
        return Comparator.<String>comparingInt(token -> token.codePointCount(0, token.length()))
                .thenComparing((a, b) -> collator.compare(a, b))
                .thenComparing(Comparator.naturalOrder());
    }
}

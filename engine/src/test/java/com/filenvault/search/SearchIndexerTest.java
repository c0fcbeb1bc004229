package com.filenvault.search;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filenvault.TestAccounts;
import com.filenvault.account.AccountKeys;
import com.filenvault.account.AccountKeysHolder;
import com.filenvault.client.FilenClient;
import com.filenvault.model.Directory;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SearchIndexerTest {

    @Mock
    private FilenClient client;

    @Captor
    private ArgumentCaptor<List<SearchIndexItem>> captor;

    private AccountKeys keys;
    private SearchIndexer indexer;

    @BeforeEach
    void setup() {
        keys = TestAccounts.v3();
        AccountKeysHolder holder = new AccountKeysHolder();
        holder.set(keys);
        indexer = new SearchIndexer(client, holder);
    }

    // ── Tokenize ────────────────────────────────────────────────────────────

    @Test
    void tokensAreNormalizedSubstringsPlusWholeName() {
        List<String> tokens = SearchIndexer.tokenize("  Report.PDF ");

        assertTrue(tokens.contains("report.pdf"));
        assertTrue(tokens.contains("re"));
        assertTrue(tokens.contains(".pdf"));
        assertFalse(tokens.contains("r"), "single code points are not tokens");
        assertFalse(tokens.stream().anyMatch(t -> !t.equals(t.toLowerCase())));
        assertEquals(tokens.size(), new HashSet<>(tokens).size());
    }

    @Test
    void tokensAreSortedByLengthThenCollation() {
        assertEquals(List.of("ab", "ba", "aba", "bab", "abab"), SearchIndexer.tokenize("abab"));
    }

    @Test
    void longNamesKeepWholeNameAndCapTokenLength() {
        String name = "quarterly-financial-report-final";

        List<String> tokens = SearchIndexer.tokenize(name);

        assertEquals(name, tokens.get(tokens.size() - 1));
        tokens.subList(0, tokens.size() - 1).forEach(t -> assertTrue(t.length() <= SearchIndexer.MAX_TOKEN_LENGTH, t));
    }

    @Test
    void tokenCountIsCapped() {
        Random random = new Random(42);
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            name.append((char) ('a' + random.nextInt(26)));
        }

        assertEquals(SearchIndexer.MAX_TOKENS, SearchIndexer.tokenize(name.toString()).size());
    }

    @Test
    void tokensCountCodePointsNotChars() {
        List<String> tokens = SearchIndexer.tokenize("a\uD83D\uDE00b");

        assertTrue(tokens.contains("a\uD83D\uDE00"));
        assertTrue(tokens.contains("\uD83D\uDE00b"));
        assertTrue(tokens.stream().noneMatch(t -> Character.isHighSurrogate(t.charAt(t.length() - 1))));
    }

    @Test
    void edgeCasesOfShortNames() {
        assertEquals(List.of(), SearchIndexer.tokenize("   "));
        assertEquals(List.of("x"), SearchIndexer.tokenize("X"));
    }

    @Test
    void everyTokenRetokenizesToItself() {
        for (String token : SearchIndexer.tokenize("budget 2024")) {
            if (token.strip().equals(token)) {
                assertTrue(SearchIndexer.tokenize(token).contains(token), token);
            }
        }
    }

    // ── Hashes ──────────────────────────────────────────────────────────────

    @Test
    void hashesAreDeterministicPerKey() {
        List<String> first = SearchIndexer.generateIndexHashes("report", keys.hmacKey());
        List<String> second = SearchIndexer.generateIndexHashes("REPORT", keys.hmacKey());

        assertEquals(first, second);
        assertEquals(keys.hmacKey().hash("report"), first.get(first.size() - 1));
    }

    @Test
    void updateSearchHashesSendsTypedItems() {
        Directory directory = Directory.create("docs", "parent-1", Instant.now());
        when(client.searchAdd(anyList())).thenReturn(Mono.empty());

        StepVerifier.create(indexer.updateSearchHashes(directory)).verifyComplete();

        verify(client).searchAdd(captor.capture());
        List<SearchIndexItem> items = captor.getValue();
        assertEquals(SearchIndexer.tokenize("docs").size(), items.size());
        assertTrue(items.stream().allMatch(i -> i.uuid().equals(directory.uuid()) && i.type().equals("directory")));
    }
}

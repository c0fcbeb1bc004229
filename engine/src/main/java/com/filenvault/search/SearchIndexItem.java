package com.filenvault.search;

/**
 * One search-index entry: the keyed hash of a single name token. {@code type} is
 * {@code "file"} or {@code "directory"}.
 */
public record SearchIndexItem(String uuid, String hash, String type) {
}

package com.localization.catalog.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory form of a PO/POT file: the comments above the header entry, the
 * header fields and the ordered list of entries.
 *
 * <p>Top comments are kept raw (sigil included) since they are never interpreted.
 * Headers keep their declaration order.
 */
@Value
@Builder(toBuilder = true)
public class Catalog {

    @Singular
    List<String> topComments;

    @Singular
    Map<String, String> headers;

    @Singular
    List<Entry> entries;

    public static Catalog empty() {
        return builder().build();
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * Whether a written file needs a header entry: there are headers or top
     * comments, or the first entry would otherwise be taken for the header.
     */
    public boolean hasHeaderBlock() {
        return !headers.isEmpty() || !topComments.isEmpty()
                || (!entries.isEmpty() && entries.get(0).isHeaderCandidate());
    }

    /**
     * Entries that are not marked obsolete, in declaration order.
     */
    public List<Entry> activeEntries() {
        return entries.stream().filter(entry -> !entry.isObsolete()).toList();
    }

    public List<Entry> obsoleteEntries() {
        return entries.stream().filter(Entry::isObsolete).toList();
    }

    public Optional<Entry> find(EntryKey key) {
        return entries.stream()
                .filter(entry -> !entry.isObsolete() && entry.key().equals(key))
                .findFirst();
    }
}

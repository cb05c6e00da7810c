package com.example.waivermerger.domain.model;

import java.util.List;

/**
 * Three-way classification of a roster against a pool of candidate documents.
 * Every identifier lands in exactly one of {@code matched}, {@code missing} or {@code duplicates},
 * each list in roster order. {@code unclaimed} is informational: candidate names that match no identifier.
 */
public record MatchResult(
        List<MatchedDocument> matched,
        List<String> missing,
        List<DuplicateConflict> duplicates,
        List<String> unclaimed
) {

    public MatchResult {
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        duplicates = List.copyOf(duplicates);
        unclaimed = List.copyOf(unclaimed);
    }

    public int classifiedCount() {
        return matched.size() + missing.size() + duplicates.size();
    }

    public boolean isComplete() {
        return missing.isEmpty() && duplicates.isEmpty();
    }
}

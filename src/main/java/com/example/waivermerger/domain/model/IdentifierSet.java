package com.example.waivermerger.domain.model;

import java.util.List;

/**
 * Ordered, duplicate-free list of canonical student identifiers in roster row order.
 */
public record IdentifierSet(List<String> identifiers) {

    public IdentifierSet {
        identifiers = List.copyOf(identifiers);
    }

    public int size() {
        return identifiers.size();
    }

    public boolean isEmpty() {
        return identifiers.isEmpty();
    }
}

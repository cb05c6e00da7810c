package com.example.waivermerger.application.service;

import com.example.waivermerger.domain.model.DuplicateConflict;
import com.example.waivermerger.domain.model.IdentifierSet;
import com.example.waivermerger.domain.model.MatchResult;
import com.example.waivermerger.domain.model.MatchedDocument;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies every roster identifier as matched, missing or duplicate by exact file name prefix
 * {@code "{identifier}_"}. Case-sensitive; {@code "12"} never claims {@code "123_x.pdf"}.
 */
@Component
public class DocumentMatcher {

    /**
     * @param candidates file name to content, iterated in map order
     * @param identifiers roster identifiers
     * @return classification in roster order, plus names no identifier claimed
     */
    public MatchResult match(Map<String, byte[]> candidates, IdentifierSet identifiers) {
        List<MatchedDocument> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<DuplicateConflict> duplicates = new ArrayList<>();
        Set<String> unclaimed = new LinkedHashSet<>(candidates.keySet());

        for (String identifier : identifiers.identifiers()) {
            String prefix = identifier + "_";
            List<String> names = candidates.keySet().stream()
                    .filter(name -> name.startsWith(prefix))
                    .toList();
            unclaimed.removeAll(names);

            if (names.isEmpty()) {
                missing.add(identifier);
            } else if (names.size() > 1) {
                duplicates.add(new DuplicateConflict(identifier, names));
            } else {
                String name = names.get(0);
                matched.add(new MatchedDocument(identifier, name, candidates.get(name)));
            }
        }
        return new MatchResult(matched, missing, duplicates, List.copyOf(unclaimed));
    }
}

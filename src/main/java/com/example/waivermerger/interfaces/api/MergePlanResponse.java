package com.example.waivermerger.interfaces.api;

import com.example.waivermerger.domain.model.DuplicateConflict;
import com.example.waivermerger.domain.model.MatchResult;
import com.example.waivermerger.domain.model.MergePlan;

import java.util.List;

/**
 * API-layer DTO describing a planned merge without the document bytes.
 */
public record MergePlanResponse(
        String summary,
        int identifierCount,
        List<MatchedEntry> matched,
        List<String> missing,
        List<DuplicateConflict> duplicates,
        List<String> unclaimed
) {

    public record MatchedEntry(String identifier, String fileName) {
    }

    public static MergePlanResponse from(MergePlan plan) {
        MatchResult matches = plan.matches();
        return new MergePlanResponse(
                plan.summary(),
                plan.identifiers().size(),
                matches.matched().stream()
                        .map(document -> new MatchedEntry(document.identifier(), document.fileName()))
                        .toList(),
                matches.missing(),
                matches.duplicates(),
                matches.unclaimed()
        );
    }
}

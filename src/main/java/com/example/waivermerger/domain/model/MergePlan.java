package com.example.waivermerger.domain.model;

/**
 * Request-scoped pipeline state produced by the planning phase and consumed by merge execution
 * and report rendering.
 */
public record MergePlan(
        IdentifierSet identifiers,
        MatchResult matches,
        MergePolicy policy
) {

    /**
     * @return one-line match summary shown before the merge is confirmed
     */
    public String summary() {
        return "Matched " + matches.matched().size() + " of " + identifiers.size() + " identifiers ("
                + matches.missing().size() + " missing, "
                + matches.duplicates().size() + " duplicates, "
                + matches.unclaimed().size() + " unclaimed files)";
    }

    public boolean hasMatches() {
        return !matches.matched().isEmpty();
    }
}

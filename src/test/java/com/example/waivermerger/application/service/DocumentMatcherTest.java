package com.example.waivermerger.application.service;

import com.example.waivermerger.domain.model.DuplicateConflict;
import com.example.waivermerger.domain.model.IdentifierSet;
import com.example.waivermerger.domain.model.MatchResult;
import com.example.waivermerger.domain.model.MatchedDocument;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the prefix matching rule and the three-way classification.
 */
class DocumentMatcherTest {

    private final DocumentMatcher matcher = new DocumentMatcher();

    @Test
    void matchClassifiesEveryIdentifierExactlyOnce() {
        Map<String, byte[]> candidates = new LinkedHashMap<>();
        candidates.put("100_Ana Diaz_KCS Records Consent_a.pdf", new byte[]{1});
        candidates.put("200_Ben Cole_KCS Records Consent_a.pdf", new byte[]{2});
        candidates.put("200_Ben Cole_KCS Records Consent_b.pdf", new byte[]{3});
        candidates.put("999_Someone_KCS Records Consent_a.pdf", new byte[]{4});
        IdentifierSet identifiers = new IdentifierSet(List.of("300", "200", "100"));

        MatchResult result = matcher.match(candidates, identifiers);

        assertThat(result.matched()).extracting(MatchedDocument::identifier).containsExactly("100");
        assertThat(result.matched().get(0).content()).containsExactly(1);
        assertThat(result.missing()).containsExactly("300");
        assertThat(result.duplicates()).containsExactly(new DuplicateConflict("200", List.of(
                "200_Ben Cole_KCS Records Consent_a.pdf",
                "200_Ben Cole_KCS Records Consent_b.pdf")));
        assertThat(result.classifiedCount()).isEqualTo(identifiers.size());
        assertThat(result.unclaimed()).containsExactly("999_Someone_KCS Records Consent_a.pdf");
    }

    @Test
    void matchDoesNotConfuseNumericPrefixes() {
        Map<String, byte[]> candidates = Map.of("123_x.pdf", new byte[0]);

        MatchResult result = matcher.match(candidates, new IdentifierSet(List.of("12", "123")));

        assertThat(result.missing()).containsExactly("12");
        assertThat(result.matched()).extracting(MatchedDocument::fileName).containsExactly("123_x.pdf");
    }

    @Test
    void matchRequiresUnderscoreDelimiterAtStart() {
        Map<String, byte[]> candidates = new LinkedHashMap<>();
        candidates.put("12.pdf", new byte[0]);
        candidates.put("x_12_y.pdf", new byte[0]);
        candidates.put("12-form.pdf", new byte[0]);

        MatchResult result = matcher.match(candidates, new IdentifierSet(List.of("12")));

        assertThat(result.missing()).containsExactly("12");
        assertThat(result.unclaimed()).hasSize(3);
    }

    @Test
    void matchPreservesRosterOrderWithinBuckets() {
        Map<String, byte[]> candidates = new LinkedHashMap<>();
        candidates.put("1_a.pdf", new byte[0]);
        candidates.put("3_a.pdf", new byte[0]);
        candidates.put("2_a.pdf", new byte[0]);

        MatchResult result = matcher.match(candidates, new IdentifierSet(List.of("3", "1", "2")));

        assertThat(result.matched()).extracting(MatchedDocument::identifier).containsExactly("3", "1", "2");
    }

    @Test
    void emptyPoolLeavesEveryIdentifierMissing() {
        MatchResult result = matcher.match(Map.of(), new IdentifierSet(List.of("1", "2")));

        assertThat(result.missing()).containsExactly("1", "2");
        assertThat(result.matched()).isEmpty();
        assertThat(result.duplicates()).isEmpty();
    }
}

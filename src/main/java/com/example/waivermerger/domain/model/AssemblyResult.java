package com.example.waivermerger.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one merge run: the serialized PDF (absent when nothing could be decoded) and the
 * per-document errors collected along the way. The document array is not copied; equality compares
 * its bytes.
 *
 * @param document    merged PDF bytes or {@code null} when no matched document decoded
 * @param errors      one {@code "{fileName}: {reason}"} entry per skipped document
 * @param mergedCount number of documents whose pages made it into the output
 * @param pageCount   total number of pages in the output, cover pages included
 */
public record AssemblyResult(
        byte[] document,
        List<String> errors,
        int mergedCount,
        int pageCount
) {

    public AssemblyResult {
        errors = List.copyOf(errors);
    }

    public static AssemblyResult absent(List<String> errors) {
        return new AssemblyResult(null, errors, 0, 0);
    }

    public boolean hasDocument() {
        return document != null;
    }

    public boolean isPartial() {
        return hasDocument() && !errors.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AssemblyResult that)) {
            return false;
        }
        return mergedCount == that.mergedCount
                && pageCount == that.pageCount
                && Arrays.equals(document, that.document)
                && errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(errors, mergedCount, pageCount) + Arrays.hashCode(document);
    }

    @Override
    public String toString() {
        return "AssemblyResult[document=" + (document == null ? "absent" : document.length + " bytes")
                + ", errors=" + errors + ", mergedCount=" + mergedCount + ", pageCount=" + pageCount + "]";
    }
}

package com.example.waivermerger.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * An identifier paired with the single candidate document that claims it.
 * The content array is shared with the caller, not copied; equality compares its bytes.
 */
public record MatchedDocument(
        String identifier,
        String fileName,
        byte[] content
) {

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MatchedDocument that)) {
            return false;
        }
        return Objects.equals(identifier, that.identifier)
                && Objects.equals(fileName, that.fileName)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(identifier, fileName) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "MatchedDocument[identifier=" + identifier + ", fileName=" + fileName
                + ", content=" + (content == null ? "null" : content.length + " bytes") + "]";
    }
}

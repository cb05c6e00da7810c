package com.example.waivermerger.domain.model;

import java.util.regex.Pattern;

/**
 * Policy flags that distinguish the strict command-line run from the lenient upload flow.
 *
 * @param requireFilenamePattern reject the whole run when any document name does not match {@code filenamePattern}
 * @param filenamePattern        expected document file name format
 * @param overwriteExisting      allow replacing an existing output file
 * @param headerFallbackRows     how many rows below the first one may hold the roster header
 * @param includeCoverPage       prepend a summary cover page to the merged output
 */
public record MergePolicy(
        boolean requireFilenamePattern,
        Pattern filenamePattern,
        boolean overwriteExisting,
        int headerFallbackRows,
        boolean includeCoverPage
) {

    public static final String DEFAULT_FILENAME_PATTERN = "^[0-9]+_[A-Za-z ]+_KCS Records Consent_.*\\.pdf$";

    public MergePolicy {
        if (headerFallbackRows < 0) {
            throw new IllegalArgumentException("headerFallbackRows must not be negative");
        }
        if (filenamePattern == null) {
            filenamePattern = Pattern.compile(DEFAULT_FILENAME_PATTERN);
        }
    }

    /**
     * Upload-flow defaults: any file name is accepted, one header fallback row, no cover page.
     *
     * @return lenient policy
     */
    public static MergePolicy lenient() {
        return new MergePolicy(false, null, false, 1, false);
    }

    public MergePolicy withFilenameCheck(boolean required) {
        return new MergePolicy(required, filenamePattern, overwriteExisting, headerFallbackRows, includeCoverPage);
    }
}

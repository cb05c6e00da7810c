package com.example.waivermerger.config;

import com.example.waivermerger.domain.model.MergePolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.regex.Pattern;

/**
 * Settings bound from {@code waiver.*} in {@code application.properties}.
 *
 * @param columnName             roster header holding the student IDs
 * @param headerFallbackRows     extra rows below the first that may hold the header
 * @param filenamePattern        expected waiver file name format
 * @param requireFilenamePattern enforce {@code filenamePattern} for uploads
 * @param overwriteExisting      allow the CLI to replace an existing output file
 * @param includeCoverPage       prepend a summary cover page to merged output
 * @param reportTitle            first line of the status report
 * @param outputTitle            title stamped into the merged PDF
 * @param cli                    command-line runner settings
 */
@ConfigurationProperties(prefix = "waiver")
public record WaiverMergeProperties(
        @DefaultValue("EYFID") String columnName,
        @DefaultValue("1") int headerFallbackRows,
        @DefaultValue(MergePolicy.DEFAULT_FILENAME_PATTERN) String filenamePattern,
        @DefaultValue("false") boolean requireFilenamePattern,
        @DefaultValue("false") boolean overwriteExisting,
        @DefaultValue("false") boolean includeCoverPage,
        @DefaultValue("FERPA Waiver Status Report") String reportTitle,
        @DefaultValue("Student FERPA Records") String outputTitle,
        @DefaultValue Cli cli
) {

    /**
     * @param enabled                run the merge command instead of serving HTTP
     * @param requireFilenamePattern enforce the file name format on the document folder
     */
    public record Cli(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("true") boolean requireFilenamePattern
    ) {
    }

    /**
     * @return policy for the HTTP upload flow
     */
    public MergePolicy uploadPolicy() {
        return new MergePolicy(requireFilenamePattern, Pattern.compile(filenamePattern), overwriteExisting,
                headerFallbackRows, includeCoverPage);
    }

    /**
     * @return policy for the command-line flow
     */
    public MergePolicy cliPolicy() {
        return uploadPolicy().withFilenameCheck(cli.requireFilenamePattern());
    }

    /**
     * Defaults used by unit tests that construct services without Spring.
     *
     * @return properties holding every default value
     */
    public static WaiverMergeProperties defaults() {
        return new WaiverMergeProperties("EYFID", 1, MergePolicy.DEFAULT_FILENAME_PATTERN, false, false, false,
                "FERPA Waiver Status Report", "Student FERPA Records", new Cli(false, true));
    }
}

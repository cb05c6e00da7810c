package com.example.waivermerger.application.service;

import com.example.waivermerger.config.WaiverMergeProperties;
import com.example.waivermerger.domain.model.DuplicateConflict;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Application-layer service that renders the plain-text waiver status report.
 * Sections only appear when they have entries.
 */
@Service
public class StatusReportService {

    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);
    private static final String SECTION_RULE = "-".repeat(30);

    private final WaiverMergeProperties properties;
    private final Clock clock;

    public StatusReportService(WaiverMergeProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param missing    identifiers without a waiver, in roster order
     * @param duplicates identifiers with conflicting waivers, in roster order
     * @return report text
     */
    public String report(List<String> missing, List<DuplicateConflict> duplicates) {
        StringBuilder builder = new StringBuilder();
        builder.append(properties.reportTitle()).append('\n');
        builder.append("Generated: ").append(GENERATED_FORMAT.format(LocalDateTime.now(clock))).append('\n');
        builder.append(RULE).append("\n\n");

        if (!missing.isEmpty()) {
            builder.append("MISSING WAIVERS (").append(missing.size()).append(" students)\n");
            builder.append(SECTION_RULE).append('\n');
            for (String identifier : missing) {
                builder.append("  - EYF ID: ").append(identifier).append('\n');
            }
            builder.append('\n');
        }

        if (!duplicates.isEmpty()) {
            builder.append("DUPLICATE FILES (").append(duplicates.size()).append(" students)\n");
            builder.append(SECTION_RULE).append('\n');
            for (DuplicateConflict conflict : duplicates) {
                builder.append("  - EYF ID ").append(conflict.identifier()).append(":\n");
                for (String fileName : conflict.fileNames()) {
                    builder.append("      ").append(fileName).append('\n');
                }
            }
            builder.append('\n');
        }

        if (missing.isEmpty() && duplicates.isEmpty()) {
            builder.append("All students have exactly one waiver on file.\n");
        }
        return builder.toString();
    }
}

package com.example.waivermerger.domain.model;

import java.util.List;

/**
 * An identifier claimed by two or more candidate documents. Conflicts are excluded from assembly.
 */
public record DuplicateConflict(String identifier, List<String> fileNames) {

    public DuplicateConflict {
        fileNames = List.copyOf(fileNames);
    }
}

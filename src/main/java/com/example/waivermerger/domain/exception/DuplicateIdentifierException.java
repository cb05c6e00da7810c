package com.example.waivermerger.domain.exception;

import java.util.List;

/**
 * Raised when the same identifier occurs on more than one roster row.
 * Carries every offending value so the caller can fix the roster in one pass.
 */
public class DuplicateIdentifierException extends DomainException {

    private final List<String> duplicates;

	/**
	 * Creates the exception listing the distinct duplicated identifiers.
	 *
	 * @param duplicates identifiers that occur more than once
	 */
    public DuplicateIdentifierException(List<String> duplicates) {
        super("Duplicate student IDs found in roster: " + String.join(", ", duplicates));
        this.duplicates = List.copyOf(duplicates);
    }

    public List<String> getDuplicates() {
        return duplicates;
    }
}

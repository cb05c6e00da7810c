package com.example.waivermerger.domain.exception;

import java.util.List;

/**
 * Raised by the strict naming policy when uploaded documents do not follow the expected file name pattern.
 * No matching happens once this is thrown.
 */
public class FilenameFormatException extends DomainException {

    private final List<String> invalidNames;

	/**
	 * Creates the exception listing every non-conforming file name.
	 *
	 * @param pattern      regular expression the names were checked against
	 * @param invalidNames names that did not match
	 */
    public FilenameFormatException(String pattern, List<String> invalidNames) {
        super("Some files do not match the expected format " + pattern + ": " + String.join(", ", invalidNames));
        this.invalidNames = List.copyOf(invalidNames);
    }

    public List<String> getInvalidNames() {
        return invalidNames;
    }
}

package com.example.waivermerger.domain.exception;

/**
 * Raised when a roster cell cannot be coerced into a canonical identifier.
 * Malformed identifiers fail the whole extraction instead of being skipped.
 */
public class IdentifierParseException extends DomainException {

	/**
	 * Creates the exception pointing at the offending row and raw value.
	 *
	 * @param rowNumber one-based row number in the source
	 * @param rawValue  value as it appeared in the source
	 */
    public IdentifierParseException(int rowNumber, String rawValue) {
        super("Row " + rowNumber + " does not contain a valid student ID: '" + rawValue + "'");
    }
}

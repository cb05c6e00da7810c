package com.example.waivermerger.infrastructure.exception;

/**
 * Raised when Apache POI cannot open the roster workbook.
 */
public class SpreadsheetReadException extends InfrastructureException {

	/**
	 * Creates the exception with context about the unreadable file.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level POI exception
	 */
    public SpreadsheetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.waivermerger.domain.exception;

/**
 * Raised when the roster does not look like a supported spreadsheet or identifier list.
 */
public class UnsupportedIdentifierSourceException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedIdentifierSourceException(String fileName) {
        super("Only .xlsx, .xls or .txt rosters are supported" + (fileName != null ? ": " + fileName : "."));
    }
}

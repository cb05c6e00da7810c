package com.example.waivermerger.domain.exception;

/**
 * Raised when the client attempts to run the pipeline without providing a roster.
 */
public class IdentifierSourceRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public IdentifierSourceRequiredException() {
        super("Please choose a roster file to upload.");
    }
}

package com.example.waivermerger.application.exception;

/**
 * Dedicated exception for incomplete merge requests, e.g. no waiver documents were supplied.
 */
public class MergeRequestValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the merge request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public MergeRequestValidationException(String message) {
        super(message);
    }
}

package com.example.waivermerger.domain.exception;

/**
 * Raised when a referenced roster file or document folder does not exist on disk.
 */
public class SourceNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public SourceNotFoundException(String path) {
        super("Path does not exist: " + path);
    }
}

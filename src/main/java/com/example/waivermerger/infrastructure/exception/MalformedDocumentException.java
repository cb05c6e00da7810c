package com.example.waivermerger.infrastructure.exception;

/**
 * Raised when candidate bytes cannot be parsed as a PDF at all.
 * The assembler recovers from it per document.
 */
public class MalformedDocumentException extends InfrastructureException {

	/**
	 * Creates the exception for the named document.
	 *
	 * @param documentName file name of the candidate document
	 * @param cause        parser failure reported by PDFBox
	 */
    public MalformedDocumentException(String documentName, Throwable cause) {
        super("Invalid or corrupted document: " + documentName, cause);
    }
}

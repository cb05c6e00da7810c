package com.example.waivermerger.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while appending or writing PDF content.
 */
public class PdfProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}

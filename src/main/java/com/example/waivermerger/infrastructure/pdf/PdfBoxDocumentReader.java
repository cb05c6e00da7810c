package com.example.waivermerger.infrastructure.pdf;

import com.example.waivermerger.infrastructure.exception.MalformedDocumentException;
import com.example.waivermerger.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Infrastructure adapter that opens candidate bytes as a PDFBox document.
 * Separates "not a PDF at all" from other load failures so the assembler can word its errors.
 */
@Component
public class PdfBoxDocumentReader {

    /**
     * Opens the document. The caller owns the returned instance and must close it.
     *
     * @param bytes        candidate content
     * @param documentName file name used in error messages
     * @return opened document with any owner-password security removed
     * @throws MalformedDocumentException when the bytes cannot be parsed as a PDF
     * @throws PdfProcessingException     when the document requires a user password
     */
    public PDDocument load(byte[] bytes, String documentName) {
        try {
            PDDocument document = Loader.loadPDF(bytes);
            if (document.isEncrypted()) {
                document.setAllSecurityToBeRemoved(true);
            }
            return document;
        } catch (InvalidPasswordException e) {
            throw new PdfProcessingException("document is password protected", e);
        } catch (IOException e) {
            throw new MalformedDocumentException(documentName, e);
        }
    }
}

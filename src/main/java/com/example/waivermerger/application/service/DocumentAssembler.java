package com.example.waivermerger.application.service;

import com.example.waivermerger.config.WaiverMergeProperties;
import com.example.waivermerger.domain.model.AssemblyResult;
import com.example.waivermerger.domain.model.MatchedDocument;
import com.example.waivermerger.infrastructure.exception.MalformedDocumentException;
import com.example.waivermerger.infrastructure.exception.PdfProcessingException;
import com.example.waivermerger.infrastructure.pdf.CoverPageRenderer;
import com.example.waivermerger.infrastructure.pdf.PdfBoxDocumentReader;
import com.example.waivermerger.infrastructure.pdf.PdfBoxMetadataWriter;

import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that concatenates matched waiver PDFs into one document.
 * A document that fails to decode is skipped and reported; the rest of the batch still merges.
 */
@Service
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);
    private static final DateTimeFormatter COVER_TIMESTAMP = DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a");

    private final PdfBoxDocumentReader documentReader;
    private final PdfBoxMetadataWriter metadataWriter;
    private final CoverPageRenderer coverPageRenderer;
    private final WaiverMergeProperties properties;
    private final Clock clock;

    public DocumentAssembler(PdfBoxDocumentReader documentReader,
                             PdfBoxMetadataWriter metadataWriter,
                             CoverPageRenderer coverPageRenderer,
                             WaiverMergeProperties properties,
                             Clock clock) {
        this.documentReader = documentReader;
        this.metadataWriter = metadataWriter;
        this.coverPageRenderer = coverPageRenderer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Merges the documents without a cover page.
     *
     * @param matched matched documents in output order
     * @return merged bytes and per-document errors
     */
    public AssemblyResult assemble(List<MatchedDocument> matched) {
        return assemble(matched, false);
    }

    /**
     * Appends every page of every decodable document, in list order and then in each document's own
     * page order. Returns an absent document when nothing decoded.
     *
     * @param matched          matched documents in output order
     * @param includeCoverPage prepend a summary cover page
     * @return merged bytes and per-document errors
     * @throws PdfProcessingException when the merged output cannot be serialized
     */
    public AssemblyResult assemble(List<MatchedDocument> matched, boolean includeCoverPage) {
        if (matched.isEmpty()) {
            return AssemblyResult.absent(List.of());
        }
        log.info("Starting PDF merge for {} documents", matched.size());

        List<String> errors = new ArrayList<>();
        List<String> mergedIdentifiers = new ArrayList<>();
        List<PDDocument> sources = new ArrayList<>();
        try (PDDocument output = new PDDocument()) {
            PDFMergerUtility merger = new PDFMergerUtility();
            for (MatchedDocument item : matched) {
                int pagesBefore = output.getNumberOfPages();
                try {
                    // sources stay open until the output is saved
                    PDDocument source = documentReader.load(item.content(), item.fileName());
                    sources.add(source);
                    merger.appendDocument(output, source);
                    mergedIdentifiers.add(item.identifier());
                    log.debug("Appended {} ({} pages)", item.fileName(), source.getNumberOfPages());
                } catch (MalformedDocumentException e) {
                    errors.add(item.fileName() + ": invalid or corrupted document");
                    log.warn("Skipped invalid or corrupted PDF {}", item.fileName());
                } catch (IOException | RuntimeException e) {
                    rollback(output, pagesBefore);
                    errors.add(item.fileName() + ": " + describe(e));
                    log.warn("Failed to append {}", item.fileName(), e);
                }
            }

            if (mergedIdentifiers.isEmpty()) {
                log.info("No valid PDF files were appended, merge skipped");
                return AssemblyResult.absent(errors);
            }

            ZonedDateTime now = ZonedDateTime.now(clock);
            if (includeCoverPage) {
                coverPageRenderer.prepend(output, properties.outputTitle(), List.of(
                        "Documents merged: " + mergedIdentifiers.size(),
                        "Documents skipped: " + errors.size(),
                        "Generated: " + COVER_TIMESTAMP.format(now)
                ), mergedIdentifiers);
            }
            metadataWriter.stamp(output, properties.outputTitle(), now);

            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            output.save(bytes);
            log.info("Merged {} of {} documents into {} pages", mergedIdentifiers.size(), matched.size(),
                    output.getNumberOfPages());
            return new AssemblyResult(bytes.toByteArray(), errors, mergedIdentifiers.size(), output.getNumberOfPages());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to write the merged PDF.", e);
        } finally {
            closeAll(sources);
        }
    }

    /**
     * Drops pages a failed append left behind so a skipped document contributes nothing.
     */
    private void rollback(PDDocument output, int pageCount) {
        while (output.getNumberOfPages() > pageCount) {
            output.removePage(output.getNumberOfPages() - 1);
        }
    }

    private String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void closeAll(List<PDDocument> sources) {
        for (PDDocument source : sources) {
            try {
                source.close();
            } catch (IOException e) {
                log.warn("Failed to close a source document", e);
            }
        }
    }
}

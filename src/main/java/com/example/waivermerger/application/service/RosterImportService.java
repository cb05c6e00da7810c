package com.example.waivermerger.application.service;

import com.example.waivermerger.domain.exception.IdentifierSourceRequiredException;
import com.example.waivermerger.domain.exception.SourceNotFoundException;
import com.example.waivermerger.domain.exception.UnsupportedIdentifierSourceException;
import com.example.waivermerger.domain.model.IdentifierSet;
import com.example.waivermerger.infrastructure.exception.SpreadsheetReadException;
import com.example.waivermerger.infrastructure.spreadsheet.PoiWorkbookReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Application-layer service that loads a roster from an upload or from disk and hands it to the
 * {@link IdentifierExtractor}. Workbooks go through Apache POI; {@code .txt} files are read as one
 * identifier per line.
 */
@Service
public class RosterImportService {

    private static final Logger log = LoggerFactory.getLogger(RosterImportService.class);

    private final PoiWorkbookReader workbookReader;
    private final IdentifierExtractor extractor;

    public RosterImportService(PoiWorkbookReader workbookReader, IdentifierExtractor extractor) {
        this.workbookReader = workbookReader;
        this.extractor = extractor;
    }

    /**
     * Extracts identifiers from an uploaded roster.
     *
     * @param file               uploaded workbook or identifier list
     * @param columnName         header of the identifier column
     * @param headerFallbackRows additional rows that may hold the header
     * @return canonical identifiers in roster order
     * @throws IdentifierSourceRequiredException    when the upload is missing or empty
     * @throws UnsupportedIdentifierSourceException when the file type is not supported
     * @throws SpreadsheetReadException             when the upload cannot be read
     */
    public IdentifierSet importRoster(MultipartFile file, String columnName, int headerFallbackRows) {
        if (file == null || file.isEmpty()) {
            throw new IdentifierSourceRequiredException();
        }
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        try {
            return importBytes(file.getBytes(), fileName, columnName, headerFallbackRows);
        } catch (IOException e) {
            throw new SpreadsheetReadException("Unable to read the uploaded roster.", e);
        }
    }

    /**
     * Extracts identifiers from a roster on disk.
     *
     * @param rosterPath         workbook or identifier list path
     * @param columnName         header of the identifier column
     * @param headerFallbackRows additional rows that may hold the header
     * @return canonical identifiers in roster order
     * @throws SourceNotFoundException when the path does not exist
     */
    public IdentifierSet importRoster(Path rosterPath, String columnName, int headerFallbackRows) {
        if (rosterPath == null) {
            throw new IdentifierSourceRequiredException();
        }
        if (!Files.isRegularFile(rosterPath)) {
            throw new SourceNotFoundException(rosterPath.toAbsolutePath().toString());
        }
        try {
            byte[] bytes = Files.readAllBytes(rosterPath);
            return importBytes(bytes, rosterPath.getFileName().toString(), columnName, headerFallbackRows);
        } catch (IOException e) {
            throw new SpreadsheetReadException("Unable to read the roster at " + rosterPath, e);
        }
    }

    private IdentifierSet importBytes(byte[] bytes, String fileName, String columnName, int headerFallbackRows) {
        String lowerName = fileName.toLowerCase(Locale.ROOT);
        IdentifierSet identifiers;
        if (lowerName.endsWith(".xlsx") || lowerName.endsWith(".xls")) {
            identifiers = extractor.extract(workbookReader.readFirstSheet(bytes, fileName), columnName, headerFallbackRows);
        } else if (lowerName.endsWith(".txt")) {
            identifiers = extractor.extractLines(new String(bytes, StandardCharsets.UTF_8).lines().toList());
        } else {
            throw new UnsupportedIdentifierSourceException(fileName);
        }
        log.info("Loaded {} student IDs from {}", identifiers.size(), fileName);
        return identifiers;
    }
}

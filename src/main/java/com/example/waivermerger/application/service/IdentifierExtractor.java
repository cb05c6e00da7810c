package com.example.waivermerger.application.service;

import com.example.waivermerger.domain.exception.DuplicateIdentifierException;
import com.example.waivermerger.domain.exception.IdentifierParseException;
import com.example.waivermerger.domain.exception.SchemaException;
import com.example.waivermerger.domain.model.IdentifierSet;
import com.example.waivermerger.domain.model.SheetCell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns roster rows into a canonical, duplicate-free {@link IdentifierSet}.
 * Works on library-neutral {@link SheetCell} rows so the header and coercion rules stay testable
 * without a workbook.
 */
@Component
public class IdentifierExtractor {

    private static final Logger log = LoggerFactory.getLogger(IdentifierExtractor.class);
    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    /**
     * Locates {@code columnName} in the first row, or in one of the next {@code headerFallbackRows}
     * rows, and extracts the identifiers below it.
     *
     * @param rows               sheet rows, top to bottom
     * @param columnName         header text of the identifier column
     * @param headerFallbackRows number of additional rows that may hold the header
     * @return identifiers in row order
     * @throws SchemaException              when the column header cannot be found
     * @throws IdentifierParseException     when a value is not an integer
     * @throws DuplicateIdentifierException when a value occurs more than once
     */
    public IdentifierSet extract(List<List<SheetCell>> rows, String columnName, int headerFallbackRows) {
        int lastHeaderRow = Math.min(headerFallbackRows, rows.size() - 1);
        for (int headerRow = 0; headerRow <= lastHeaderRow; headerRow++) {
            int column = findColumn(rows.get(headerRow), columnName);
            if (column >= 0) {
                if (headerRow > 0) {
                    log.info("Column '{}' found on row {} after header fallback", columnName, headerRow + 1);
                }
                return collect(rows, headerRow, column);
            }
        }
        throw new SchemaException(columnName);
    }

    /**
     * Extracts identifiers from a header-less list with one identifier per line. Blank lines are skipped.
     *
     * @param lines raw lines of the identifier list
     * @return identifiers in line order
     */
    public IdentifierSet extractLines(List<String> lines) {
        List<String> identifiers = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            identifiers.add(canonicalize(SheetCell.text(line), i + 1));
        }
        return verifyUnique(identifiers);
    }

    private int findColumn(List<SheetCell> headerRow, String columnName) {
        for (int i = 0; i < headerRow.size(); i++) {
            if (headerRow.get(i).headerText().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    private IdentifierSet collect(List<List<SheetCell>> rows, int headerRow, int column) {
        List<String> identifiers = new ArrayList<>();
        for (int rowIndex = headerRow + 1; rowIndex < rows.size(); rowIndex++) {
            List<SheetCell> row = rows.get(rowIndex);
            SheetCell cell = column < row.size() ? row.get(column) : SheetCell.blank();
            if (cell.isBlank()) {
                continue;
            }
            identifiers.add(canonicalize(cell, rowIndex + 1));
        }
        return verifyUnique(identifiers);
    }

    /**
     * Numeric cells are truncated to an integer; text must be an optionally signed run of digits.
     * Either way the result has no leading zeros and no decimal point.
     */
    String canonicalize(SheetCell cell, int rowNumber) {
        switch (cell.kind()) {
            case NUMBER -> {
                double value = cell.number();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    throw new IdentifierParseException(rowNumber, cell.text());
                }
                return BigDecimal.valueOf(value).setScale(0, RoundingMode.DOWN).toBigInteger().toString();
            }
            case TEXT -> {
                String trimmed = cell.text().trim();
                if (!INTEGER_TEXT.matcher(trimmed).matches()) {
                    throw new IdentifierParseException(rowNumber, cell.text());
                }
                return new BigInteger(trimmed).toString();
            }
            default -> throw new IdentifierParseException(rowNumber, cell.text());
        }
    }

    private IdentifierSet verifyUnique(List<String> identifiers) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String identifier : identifiers) {
            counts.merge(identifier, 1, Integer::sum);
        }
        List<String> duplicates = counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (!duplicates.isEmpty()) {
            throw new DuplicateIdentifierException(duplicates);
        }
        return new IdentifierSet(identifiers);
    }
}

package com.example.waivermerger.infrastructure.spreadsheet;

import com.example.waivermerger.domain.model.SheetCell;
import com.example.waivermerger.infrastructure.exception.SpreadsheetReadException;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that turns the first sheet of an {@code .xlsx} or {@code .xls} workbook into
 * plain {@link SheetCell} rows. Hides the Apache POI cell model from the rest of the application.
 */
@Component
public class PoiWorkbookReader {

    private static final Logger log = LoggerFactory.getLogger(PoiWorkbookReader.class);

    private final DataFormatter formatter = new DataFormatter();

    /**
     * Reads every physical row of the first sheet, keeping row positions so header detection can
     * address rows by index. Missing rows come back as empty lists.
     *
     * @param bytes    workbook content
     * @param fileName logical name used in error messages
     * @return rows of cells, top to bottom
     * @throws SpreadsheetReadException when POI cannot open or parse the workbook
     */
    public List<List<SheetCell>> readFirstSheet(byte[] bytes, String fileName) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                return List.of();
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<SheetCell>> rows = new ArrayList<>();
            for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                rows.add(readRow(sheet.getRow(rowIndex)));
            }
            log.debug("Read {} rows from sheet '{}' of {}", rows.size(), sheet.getSheetName(), fileName);
            return rows;
        } catch (IOException | RuntimeException e) {
            // POI reports damaged workbooks with unchecked exceptions as well
            throw new SpreadsheetReadException(
                    "Could not read the roster " + fileName + ". Please check that it's a valid .xlsx or .xls file.", e);
        }
    }

    private List<SheetCell> readRow(Row row) {
        if (row == null || row.getLastCellNum() < 0) {
            return List.of();
        }
        List<SheetCell> cells = new ArrayList<>(row.getLastCellNum());
        for (int cellIndex = 0; cellIndex < row.getLastCellNum(); cellIndex++) {
            cells.add(toSheetCell(row.getCell(cellIndex)));
        }
        return cells;
    }

    /**
     * Maps a POI cell to a {@link SheetCell}; formulas are read through their cached result.
     *
     * @param cell POI cell, possibly {@code null}
     * @return detached cell value
     */
    private SheetCell toSheetCell(Cell cell) {
        if (cell == null) {
            return SheetCell.blank();
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case STRING -> SheetCell.text(cell.getStringCellValue());
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? SheetCell.other(formatter.formatCellValue(cell))
                    : SheetCell.number(cell.getNumericCellValue());
            case BLANK, _NONE -> SheetCell.blank();
            default -> SheetCell.other(formatter.formatCellValue(cell));
        };
    }
}

package com.example.waivermerger.infrastructure.spreadsheet;

import com.example.waivermerger.domain.model.SheetCell;
import com.example.waivermerger.infrastructure.exception.SpreadsheetReadException;
import com.example.waivermerger.support.TestDocuments;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the POI adapter that flattens the first sheet of a workbook into {@link SheetCell} rows.
 */
class PoiWorkbookReaderTest {

    private final PoiWorkbookReader reader = new PoiWorkbookReader();

    /**
     * Verifies that text, numeric, boolean and empty cells map to the matching cell kinds.
     */
    @Test
    void readFirstSheetMapsCellKinds() throws Exception {
        byte[] workbook = TestDocuments.xlsx(
                new Object[]{"EYFID", "Active"},
                new Object[]{123.0, true},
                new Object[]{null, "yes"}
        );

        List<List<SheetCell>> rows = reader.readFirstSheet(workbook, "roster.xlsx");

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).get(0).kind()).isEqualTo(SheetCell.Kind.TEXT);
        assertThat(rows.get(0).get(0).headerText()).isEqualTo("EYFID");
        assertThat(rows.get(1).get(0).kind()).isEqualTo(SheetCell.Kind.NUMBER);
        assertThat(rows.get(1).get(0).number()).isEqualTo(123.0);
        assertThat(rows.get(1).get(1).kind()).isEqualTo(SheetCell.Kind.OTHER);
        assertThat(rows.get(2).get(0).isBlank()).isTrue();
    }

    /**
     * Verifies that a damaged legacy workbook surfaces as a {@link SpreadsheetReadException}
     * rather than a raw POI runtime exception.
     */
    @Test
    void readFirstSheetWrapsDamagedXls() throws Exception {
        byte[] workbook = TestDocuments.truncatedXls(
                new Object[]{"EYFID", "Name"},
                new Object[]{1001, "Ana Diaz"},
                new Object[]{1002, "Ben Cole"}
        );

        SpreadsheetReadException ex = assertThrows(SpreadsheetReadException.class,
                () -> reader.readFirstSheet(workbook, "roster.xls"));

        assertThat(ex.getMessage()).contains("roster.xls");
    }
}

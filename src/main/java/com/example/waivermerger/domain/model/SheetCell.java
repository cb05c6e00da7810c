package com.example.waivermerger.domain.model;

/**
 * Domain DTO for a single spreadsheet cell, already detached from the workbook library.
 * Numeric cells keep their raw value so identifier coercion can drop formatting such as a trailing {@code .0}.
 */
public record SheetCell(Kind kind, String text, double number) {

    public enum Kind {
        BLANK,
        TEXT,
        NUMBER,
        OTHER
    }

    private static final SheetCell BLANK_CELL = new SheetCell(Kind.BLANK, "", 0d);

    public static SheetCell blank() {
        return BLANK_CELL;
    }

    public static SheetCell text(String value) {
        return value == null || value.isBlank() ? BLANK_CELL : new SheetCell(Kind.TEXT, value, 0d);
    }

    public static SheetCell number(double value) {
        return new SheetCell(Kind.NUMBER, String.valueOf(value), value);
    }

    /**
     * Booleans, error cells and anything else that can never be an identifier.
     *
     * @param display formatted value kept for error messages
     * @return cell of kind {@link Kind#OTHER}
     */
    public static SheetCell other(String display) {
        return new SheetCell(Kind.OTHER, display, 0d);
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }

    /**
     * @return the value the header matcher compares against the expected column name
     */
    public String headerText() {
        return kind == Kind.BLANK ? "" : text.trim();
    }
}

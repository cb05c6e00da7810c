package com.example.waivermerger.domain.exception;

/**
 * Raised when the identifier column cannot be located in the roster, even after the header-row fallback.
 */
public class SchemaException extends DomainException {

    private final String columnName;

	/**
	 * Creates the exception and names the column the caller expected.
	 *
	 * @param columnName header text that was searched for
	 */
    public SchemaException(String columnName) {
        super("Could not find '" + columnName + "' column in your roster. "
                + "Please make sure the column is named exactly '" + columnName + "'.");
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}

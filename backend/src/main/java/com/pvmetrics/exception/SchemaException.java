package com.pvmetrics.exception;

import lombok.Getter;

/**
 * A column the evaluation needs is missing from the table. Aborts the evaluation.
 */
@Getter
public class SchemaException extends PvMetricsException {
    private final String column;

    public SchemaException(String column) {
        super("SCHEMA_ERROR", "Required column '" + column + "' is missing from the evaluation table.");
        this.column = column;
    }

    public SchemaException(String column, String detail) {
        super("SCHEMA_ERROR", "Column '" + column + "': " + detail);
        this.column = column;
    }
}

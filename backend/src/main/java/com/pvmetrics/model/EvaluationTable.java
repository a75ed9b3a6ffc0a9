package com.pvmetrics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Rows to evaluate plus the horizon columns they share. Rows of one entity are
 * time-ordered; the table as a whole need not be.
 */
@Value
@Builder
public class EvaluationTable {
    @Singular
    List<Integer> horizons;
    @Singular
    List<EvaluationRow> rows;

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

package com.rowreduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partition of the coefficient columns of a reduced system into pivot
 * (basic) columns and non-pivot (free) columns.
 *
 * <p>{@code pivotColumns().get(k)} is the pivot of row {@code pivotRows().get(k)};
 * both lists follow row order.  Free columns are ascending.
 */
public final class ColumnClassification {
    private final List<Integer> pivotColumns;
    private final List<Integer> pivotRows;
    private final List<Integer> nonPivotColumns;
    private final int coefficientColumns;

    public ColumnClassification(List<Integer> pivotColumns, List<Integer> pivotRows,
                                List<Integer> nonPivotColumns, int coefficientColumns) {
        if (pivotColumns.size() != pivotRows.size()) {
            throw new IllegalArgumentException("Each pivot column needs exactly one owning row");
        }
        boolean[] seen = new boolean[coefficientColumns];
        for (List<Integer> part : List.of(pivotColumns, nonPivotColumns)) {
            for (int c : part) {
                if (c < 0 || c >= coefficientColumns) {
                    throw new IllegalArgumentException("Column " + c + " outside 0.." + (coefficientColumns - 1));
                }
                if (seen[c]) throw new IllegalArgumentException("Column " + c + " classified twice");
                seen[c] = true;
            }
        }
        for (int c = 0; c < coefficientColumns; c++) {
            if (!seen[c]) throw new IllegalArgumentException("Column " + c + " is not classified");
        }
        this.pivotColumns = Collections.unmodifiableList(new ArrayList<>(pivotColumns));
        this.pivotRows = Collections.unmodifiableList(new ArrayList<>(pivotRows));
        this.nonPivotColumns = Collections.unmodifiableList(new ArrayList<>(nonPivotColumns));
        this.coefficientColumns = coefficientColumns;
    }

    public List<Integer> pivotColumns() { return pivotColumns; }
    public List<Integer> pivotRows() { return pivotRows; }
    public List<Integer> nonPivotColumns() { return nonPivotColumns; }
    public int coefficientColumns() { return coefficientColumns; }

    public int rank() { return pivotColumns.size(); }
    public int nullity() { return nonPivotColumns.size(); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnClassification)) return false;
        ColumnClassification o = (ColumnClassification) obj;
        return coefficientColumns == o.coefficientColumns && pivotColumns.equals(o.pivotColumns)
                && pivotRows.equals(o.pivotRows) && nonPivotColumns.equals(o.nonPivotColumns);
    }

    @Override public int hashCode() {
        return ((pivotColumns.hashCode() * 31 + pivotRows.hashCode()) * 31 + nonPivotColumns.hashCode()) * 31
                + coefficientColumns;
    }

    @Override public String toString() {
        return "pivot=" + pivotColumns + " free=" + nonPivotColumns;
    }
}

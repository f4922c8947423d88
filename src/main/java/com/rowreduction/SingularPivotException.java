package com.rowreduction;

/**
 * Raised when the entry chosen as a pivot cannot be divided by, because the
 * quotient would no longer be a finite number.
 */
public final class SingularPivotException extends LinearAlgebraException {

    private final int row;
    private final int column;

    public SingularPivotException(int row, int column, double pivot) {
        super("Pivot " + pivot + " at row " + row + ", column " + column + " is effectively zero");
        this.row = row;
        this.column = column;
    }

    public SingularPivotException(int row, int column, String message) {
        super(message);
        this.row = row;
        this.column = column;
    }

    public int getRow() { return row; }
    public int getColumn() { return column; }

    @Override
    public String kind() {
        return "SingularPivot";
    }
}

package com.rowreduction;

/**
 * The reduced system contains a row {@code 0 0 ... 0 | c} with {@code c != 0},
 * so no vector satisfies it.
 */
public final class InconsistentSystemException extends LinearAlgebraException {

    private final int row;

    /** @param row index of the offending row in the reduced matrix */
    public InconsistentSystemException(int row) {
        super("Row " + row + " reduces to 0 = c with c != 0; the system has no solution");
        this.row = row;
    }

    public int getRow() { return row; }

    @Override
    public String kind() {
        return "InconsistentSystem";
    }
}

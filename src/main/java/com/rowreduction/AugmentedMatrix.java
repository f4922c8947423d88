package com.rowreduction;

import java.util.Objects;

/**
 * A matrix {@code [A | b]} whose last column is the right-hand side.
 * The column count is always the coefficient column count plus one.
 */
public final class AugmentedMatrix {
    private final Matrix M;

    /** Treats the last column of {@code augmented} as the right-hand side. */
    public AugmentedMatrix(Matrix augmented) {
        this.M = Objects.requireNonNull(augmented, "augmented");
        if (M.rows() == 0 || M.cols() < 2) {
            throw new InvalidDimensionsException("Augmented matrix needs at least one row and two columns, got "
                    + M.rows() + "x" + M.cols());
        }
    }

    public Matrix matrix() { return M; }
    public int rows() { return M.rows(); }
    public int cols() { return M.cols(); }
    public double get(int r, int c) { return M.get(r, c); }

    public int coefficientColumns() { return M.cols() - 1; }

    /** Index of the right-hand-side column. */
    public int rightHandSideColumn() { return M.cols() - 1; }

    public Matrix coefficients() {
        return M.submatrix(0, M.rows(), 0, coefficientColumns());
    }

    public Vector rightHandSide() {
        return M.column(rightHandSideColumn());
    }

    @Override public boolean equals(Object obj) {
        return obj instanceof AugmentedMatrix && M.equals(((AugmentedMatrix) obj).M);
    }

    @Override public int hashCode() { return M.hashCode(); }

    @Override public String toString() { return M.toString(); }
}

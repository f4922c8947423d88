package com.rowreduction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gaussian elimination to row-echelon form (REF) and Gauss-Jordan
 * back-elimination to reduced row-echelon form (RREF).
 *
 * <p>The pivot of a row is its first nonzero entry in column order.  This is
 * deliberately not partial pivoting: rows are never swapped and the largest
 * entry is never sought, so results on ill-conditioned matrices can lose
 * precision.  Rows that are entirely zero are left where they are.
 *
 * <p>Input entries are taken as given, however small.  The tolerance only
 * applies to entries produced by a row update: {@code t - f*s} is snapped to
 * exactly zero when its magnitude is at most {@code tolerance} times the
 * larger of {@code |t|} and {@code |f*s|}.  The test is relative, so scaling
 * the whole system by any power of ten does not change which entries vanish.
 *
 * <p>Both passes work on a private copy and return a new matrix; the
 * argument is never modified.  Instances are immutable and may be shared.
 */
public final class Eliminator {

    private static final Logger log = LoggerFactory.getLogger(Eliminator.class);

    public static final double DEFAULT_TOLERANCE = 1e-10;

    private final double tolerance;

    public Eliminator() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance relative cancellation threshold for row updates;
     *        {@code 0} keeps every computed residue
     */
    public Eliminator(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite non-negative number: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public double tolerance() { return tolerance; }

    /**
     * Forward pass.  For each row from the top: find its pivot, divide the
     * row by it, then subtract multiples of it from every lower row so the
     * pivot column is zero below it.
     *
     * @throws SingularPivotException if dividing by the pivot overflows
     */
    public Matrix toRowEchelon(Matrix matrix) {
        double[][] T = matrix.toArray();
        final int m = matrix.rows();
        final int n = matrix.cols();
        for (double[] row : T) clearNegativeZeros(row);

        for (int i = 0; i < m; i++) {
            int p = pivotColumn(T[i], n);
            if (p < 0) {
                log.debug("REF row {} is zero, skipped", i);
                continue;
            }

            double piv = T[i][p];
            double[] scaled = new double[n];
            for (int k = 0; k < n; k++) {
                scaled[k] = T[i][k] / piv + 0.0;
                if (!Double.isFinite(scaled[k])) throw new SingularPivotException(i, p, piv);
            }
            scaled[p] = 1.0;
            T[i] = scaled;
            log.debug("REF row {} pivot column {} (value {})", i, p, piv);

            for (int j = i + 1; j < m; j++) {
                double factor = T[j][p];
                if (factor == 0.0) continue;
                subtractMultiple(T[j], factor, T[i], j, i);
                T[j][p] = 0.0;
            }
        }
        return Matrix.wrap(T);
    }

    /**
     * Backward pass over a matrix already in REF.  For each row from the
     * bottom: find its pivot and clear the pivot column in every row above.
     *
     * @throws IllegalArgumentException if a row's leading entry is not 1
     */
    public Matrix toReducedRowEchelon(Matrix ref) {
        double[][] T = ref.toArray();
        final int m = ref.rows();
        final int n = ref.cols();

        for (int i = m - 1; i >= 0; i--) {
            int p = pivotColumn(T[i], n);
            if (p < 0) continue;
            if (Math.abs(T[i][p] - 1.0) > Math.max(tolerance, 1e-9)) {
                throw new IllegalArgumentException("Matrix is not in row-echelon form: row " + i
                        + " leads with " + T[i][p] + " in column " + p);
            }

            for (int j = i - 1; j >= 0; j--) {
                double factor = T[j][p];
                if (factor == 0.0) continue;
                subtractMultiple(T[j], factor, T[i], j, i);
                T[j][p] = 0.0;
            }
        }
        return Matrix.wrap(T);
    }

    public AugmentedMatrix toRowEchelon(AugmentedMatrix augmented) {
        return new AugmentedMatrix(toRowEchelon(augmented.matrix()));
    }

    public AugmentedMatrix toReducedRowEchelon(AugmentedMatrix ref) {
        return new AugmentedMatrix(toReducedRowEchelon(ref.matrix()));
    }

    /** Shorthand for the forward pass followed by the backward pass. */
    public Matrix reduce(Matrix matrix) {
        return toReducedRowEchelon(toRowEchelon(matrix));
    }

    /**
     * Index of the first nonzero entry among columns {@code 0..limit-1}, or
     * {@code -1} if there is none.
     */
    static int pivotColumn(double[] row, int limit) {
        for (int k = 0; k < limit; k++) {
            if (row[k] != 0.0) return k;
        }
        return -1;
    }

    /** Same scan over a row of a finished matrix. */
    public static int pivotColumn(Matrix matrix, int row, int limit) {
        for (int k = 0; k < limit; k++) {
            if (matrix.get(row, k) != 0.0) return k;
        }
        return -1;
    }

    // target -= factor * source; a result lost to cancellation becomes exactly zero
    private void subtractMultiple(double[] target, double factor, double[] source, int targetRow, int sourceRow) {
        for (int k = 0; k < target.length; k++) {
            if (source[k] == 0.0) continue;
            double product = factor * source[k];
            double result = target[k] - product;
            if (!Double.isFinite(result)) {
                throw new LinearAlgebraException("Overflow in row " + targetRow
                        + " while eliminating with row " + sourceRow);
            }
            if (Math.abs(result) <= tolerance * Math.max(Math.abs(target[k]), Math.abs(product))) {
                result = 0.0;
            }
            target[k] = result + 0.0;
        }
    }

    private static void clearNegativeZeros(double[] row) {
        for (int k = 0; k < row.length; k++) row[k] += 0.0;
    }
}

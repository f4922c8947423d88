package com.rowreduction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** QR factorization by Gram-Schmidt orthogonalization, and a column independence test. */
public final class GramSchmidt {

    private static final Logger log = LoggerFactory.getLogger(GramSchmidt.class);

    private GramSchmidt() {}

    public static QrDecomposition qrDecompose(Matrix a) {
        return qrDecompose(a, Eliminator.DEFAULT_TOLERANCE);
    }

    /**
     * Orthogonalizes the columns of {@code a} left to right, subtracting from
     * each column its projection on the unit vectors already produced
     * (modified Gram-Schmidt).
     *
     * @throws InvalidDimensionsException if {@code a} has more columns than rows
     * @throws SingularPivotException if a column depends on the columns before it
     */
    public static QrDecomposition qrDecompose(Matrix a, double tolerance) {
        final int m = a.rows();
        final int n = a.cols();
        if (m == 0 || n == 0 || n > m) {
            throw new InvalidDimensionsException("QR needs a non-empty matrix with rows >= columns, got "
                    + m + "x" + n);
        }

        Vector[] q = new Vector[n];
        double[][] r = new double[n][n];
        for (int j = 0; j < n; j++) {
            Vector v = a.column(j);
            for (int i = 0; i < j; i++) {
                double proj = v.dot(q[i]);
                r[i][j] = proj;
                v = v.subtract(q[i].scale(proj));
            }
            double len = v.norm();
            if (len <= tolerance * Math.max(1.0, a.column(j).norm())) {
                log.debug("column {} has residual norm {} after orthogonalization", j, len);
                throw new SingularPivotException(j, j,
                        "Column " + j + " is linearly dependent on the columns before it");
            }
            r[j][j] = len;
            q[j] = v.scale(1.0 / len);
        }
        return new QrDecomposition(Matrix.ofColumns(q), Matrix.wrap(r));
    }

    /**
     * True when the columns of {@code a} are linearly independent, i.e. the
     * rank found by row reduction equals the column count.
     */
    public static boolean areColumnsLinearlyIndependent(Matrix a) {
        return areColumnsLinearlyIndependent(a, Eliminator.DEFAULT_TOLERANCE);
    }

    public static boolean areColumnsLinearlyIndependent(Matrix a, double tolerance) {
        if (a.cols() == 0) return true;
        return new LinearSystemSolver(tolerance).rank(a) == a.cols();
    }
}

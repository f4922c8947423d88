package com.rowreduction;

/** Cholesky factorization {@code A = L·Lᵗ} of a symmetric positive definite matrix. */
public final class Cholesky {

    private Cholesky() {}

    public static Matrix decompose(Matrix a) {
        return decompose(a, 0.0);
    }

    /**
     * @param symmetryTolerance largest accepted {@code |a[i][j] - a[j][i]|}
     * @return lower-triangular L with a positive diagonal
     * @throws InvalidDimensionsException if {@code a} is not square
     * @throws NotPositiveDefiniteException if {@code a} is not symmetric or a
     *         diagonal term would be the square root of a non-positive number
     */
    public static Matrix decompose(Matrix a, double symmetryTolerance) {
        if (!a.isSquare() || a.rows() == 0) {
            throw new InvalidDimensionsException("Cholesky needs a non-empty square matrix, got "
                    + a.rows() + "x" + a.cols());
        }
        if (!MatrixChecks.isSymmetric(a, symmetryTolerance)) {
            throw new NotPositiveDefiniteException("Matrix is not symmetric");
        }
        final int n = a.rows();
        double[][] L = new double[n][n];

        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = 0.0;
                for (int k = 0; k < j; k++) sum += L[i][k] * L[j][k];

                if (i == j) {
                    double d = a.get(i, i) - sum;
                    if (!(d > 0.0)) {
                        throw new NotPositiveDefiniteException("Leading minor " + (i + 1)
                                + " is not positive (pivot " + d + ")");
                    }
                    L[i][i] = Math.sqrt(d);
                } else {
                    L[i][j] = (a.get(i, j) - sum) / L[j][j];
                }
            }
        }
        return Matrix.wrap(L);
    }
}

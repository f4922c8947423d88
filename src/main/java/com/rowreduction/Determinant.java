package com.rowreduction;

/** Determinant by cofactor (Laplace) expansion along the first row. */
public final class Determinant {

    private Determinant() {}

    /**
     * Exponential in the matrix size; meant for the small matrices of the
     * positive-definiteness test.  The empty matrix has determinant 1.
     *
     * @throws InvalidDimensionsException if {@code a} is not square
     */
    public static double of(Matrix a) {
        if (!a.isSquare()) {
            throw new InvalidDimensionsException("Determinant needs a square matrix, got "
                    + a.rows() + "x" + a.cols());
        }
        return expand(a.toArray());
    }

    private static double expand(double[][] a) {
        final int n = a.length;
        if (n == 0) return 1.0;
        if (n == 1) return a[0][0];
        if (n == 2) return a[0][0] * a[1][1] - a[0][1] * a[1][0];

        double det = 0.0;
        for (int col = 0; col < n; col++) {
            if (a[0][col] == 0.0) continue;
            double sign = (col % 2 == 0) ? 1.0 : -1.0;
            det += sign * a[0][col] * expand(minor(a, col));
        }
        return det;
    }

    // drop row 0 and column skip
    private static double[][] minor(double[][] a, int skip) {
        final int n = a.length;
        double[][] m = new double[n - 1][n - 1];
        for (int i = 1; i < n; i++) {
            for (int j = 0, k = 0; j < n; j++) {
                if (j == skip) continue;
                m[i - 1][k++] = a[i][j];
            }
        }
        return m;
    }
}

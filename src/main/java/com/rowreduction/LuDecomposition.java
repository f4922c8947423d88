package com.rowreduction;

/**
 * Doolittle factorization {@code A = LU}: L unit lower triangular, U upper
 * triangular.  Without row exchanges every leading minor must be nonzero,
 * so input is restricted to symmetric positive definite matrices.
 */
public final class LuDecomposition {
    private final Matrix l;
    private final Matrix u;

    private LuDecomposition(Matrix l, Matrix u) {
        this.l = l;
        this.u = u;
    }

    public Matrix l() { return l; }
    public Matrix u() { return u; }
    public Matrix product() { return l.multiply(u); }

    /**
     * @throws InvalidDimensionsException if {@code a} is not square
     * @throws NotPositiveDefiniteException if {@code a} is not symmetric positive definite
     */
    public static LuDecomposition decompose(Matrix a) {
        if (!a.isSquare() || a.rows() == 0) {
            throw new InvalidDimensionsException("LU needs a non-empty square matrix, got "
                    + a.rows() + "x" + a.cols());
        }
        if (!MatrixChecks.isPositiveDefinite(a)) {
            throw new NotPositiveDefiniteException("Matrix is not symmetric positive definite");
        }
        final int n = a.rows();
        double[][] L = Matrix.identity(n).toArray();
        double[][] U = new double[n][n];

        for (int k = 0; k < n; k++) {
            for (int i = 0; i <= k; i++) {
                double sum = 0.0;
                for (int j = 0; j < i; j++) sum += L[i][j] * U[j][k];
                U[i][k] = a.get(i, k) - sum;
            }
            for (int i = k + 1; i < n; i++) {
                double sum = 0.0;
                for (int j = 0; j < k; j++) sum += L[i][j] * U[j][k];
                L[i][k] = (a.get(i, k) - sum) / U[k][k];
            }
        }
        return new LuDecomposition(Matrix.wrap(L), Matrix.wrap(U));
    }
}

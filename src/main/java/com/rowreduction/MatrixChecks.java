package com.rowreduction;

/** Structural predicates used to guard the factorizations. */
public final class MatrixChecks {

    private MatrixChecks() {}

    /** Exact symmetry, {@code a[i][j] == a[j][i]} for all {@code i, j}. */
    public static boolean isSymmetric(Matrix a) {
        return isSymmetric(a, 0.0);
    }

    public static boolean isSymmetric(Matrix a, double tolerance) {
        if (!a.isSquare()) return false;
        for (int i = 0; i < a.rows(); i++)
            for (int j = 0; j < i; j++)
                if (Math.abs(a.get(i, j) - a.get(j, i)) > tolerance) return false;
        return true;
    }

    /**
     * Symmetric with every leading principal minor strictly positive
     * (Sylvester's criterion).  Minors are computed by cofactor expansion,
     * so this is only practical for small matrices.
     */
    public static boolean isPositiveDefinite(Matrix a) {
        if (!isSymmetric(a)) return false;
        for (int k = 1; k <= a.rows(); k++) {
            if (Determinant.of(a.submatrix(0, k, 0, k)) <= 0.0) return false;
        }
        return true;
    }
}

package com.rowreduction;

/** Builds the augmented matrix {@code [A | b]}. */
public final class Augmenter {

    private Augmenter() {}

    /**
     * Row {@code i} of the result is row {@code i} of {@code a} followed by
     * {@code b[i]}.  Neither argument is modified.
     *
     * @throws InvalidDimensionsException if {@code a} is empty or its row
     *         count differs from the length of {@code b}
     */
    public static AugmentedMatrix augment(Matrix a, Vector b) {
        if (a == null || b == null) throw new IllegalArgumentException("A and b must not be null");
        if (a.rows() == 0 || a.cols() == 0) {
            throw new InvalidDimensionsException("Coefficient matrix must be non-empty, got "
                    + a.rows() + "x" + a.cols());
        }
        if (a.rows() != b.length()) {
            throw new InvalidDimensionsException("A has " + a.rows() + " rows but b has "
                    + b.length() + " entries");
        }
        final int m = a.rows();
        final int n = a.cols();
        double[][] out = new double[m][n + 1];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) out[i][j] = a.get(i, j);
            out[i][n] = b.get(i);
        }
        return new AugmentedMatrix(Matrix.wrap(out));
    }
}

package com.rowreduction;

/** {@code A = QR} with orthonormal columns in Q and upper-triangular R. */
public final class QrDecomposition {
    private final Matrix q;
    private final Matrix r;

    QrDecomposition(Matrix q, Matrix r) {
        this.q = q;
        this.r = r;
    }

    /** m×n, columns orthonormal. */
    public Matrix q() { return q; }

    /** n×n upper triangular with a positive diagonal. */
    public Matrix r() { return r; }

    public Matrix product() { return q.multiply(r); }
}

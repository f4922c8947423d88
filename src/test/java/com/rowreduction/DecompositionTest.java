package com.rowreduction;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.ejml.simple.SimpleMatrix;
import org.junit.jupiter.api.Test;

/** Gram-Schmidt QR, Cholesky and LU factorizations. */
public class DecompositionTest {

    private static final double EPS = 1e-9;

    private static void assertLowerTriangular(Matrix l) {
        for (int i = 0; i < l.rows(); i++)
            for (int j = i + 1; j < l.cols(); j++)
                assertEquals(0.0, l.get(i, j), "entry (" + i + "," + j + ")");
    }

    private static void assertUpperTriangular(Matrix u) {
        assertLowerTriangular(u.transpose());
    }

    @Test
    public void testQrOfClassicExample() {
        Matrix a = Matrix.of(new double[][] { {12, -51, 4}, {6, 167, -68}, {-4, 24, -41} });
        QrDecomposition qr = GramSchmidt.qrDecompose(a);

        Matrix expectedR = Matrix.of(new double[][] { {14, 21, -14}, {0, 175, -70}, {0, 0, 35} });
        Matrix expectedQ = Matrix.of(new double[][] {
                { 6.0 / 7, -69.0 / 175, -58.0 / 175 },
                { 3.0 / 7, 158.0 / 175,   6.0 / 175 },
                {-2.0 / 7,   6.0 / 35,  -33.0 / 35 } });
        assertTrue(qr.r().approximatelyEquals(expectedR, EPS), qr.r().toString());
        assertTrue(qr.q().approximatelyEquals(expectedQ, EPS), qr.q().toString());
        assertTrue(qr.product().approximatelyEquals(a, EPS));
        assertUpperTriangular(qr.r());
    }

    @Test
    public void testQrOfTallMatrixHasOrthonormalColumns() {
        Matrix a = Matrix.of(new double[][] { {1, 1}, {1, 0}, {0, 1}, {1, 1} });
        QrDecomposition qr = GramSchmidt.qrDecompose(a);
        assertEquals(4, qr.q().rows());
        assertEquals(2, qr.q().cols());
        Matrix gram = qr.q().transpose().multiply(qr.q());
        assertTrue(gram.approximatelyEquals(Matrix.identity(2), EPS));
        assertTrue(qr.product().approximatelyEquals(a, EPS));
    }

    @Test
    public void testQrRejectsDependentColumnsAndWideInput() {
        Matrix dependent = Matrix.of(new double[][] { {1, 2}, {2, 4}, {3, 6} });
        SingularPivotException e = assertThrows(SingularPivotException.class, () -> GramSchmidt.qrDecompose(dependent));
        assertEquals(1, e.getColumn());
        assertThrows(InvalidDimensionsException.class,
                () -> GramSchmidt.qrDecompose(Matrix.of(new double[][] { {1, 2, 3} })));
    }

    @Test
    public void testLinearIndependence() {
        assertTrue(GramSchmidt.areColumnsLinearlyIndependent(
                Matrix.of(new double[][] { {12, -51, 4}, {6, 167, -68}, {-4, 24, -42} })));
        assertFalse(GramSchmidt.areColumnsLinearlyIndependent(
                Matrix.of(new double[][] { {1, 4, 7}, {2, 5, 8}, {3, 6, 9} })));
        // more columns than rows can never be independent
        assertFalse(GramSchmidt.areColumnsLinearlyIndependent(
                Matrix.of(new double[][] { {1, 0, 1}, {0, 1, 1} })));
    }

    @Test
    public void testCholeskyReconstructsInput() {
        Matrix a = Matrix.of(new double[][] { {7, 3, -1, 2}, {3, 8, 1, -4}, {-1, 1, 4, -1}, {2, -4, -1, 6} });
        Matrix l = Cholesky.decompose(a);
        assertLowerTriangular(l);
        for (int i = 0; i < l.rows(); i++) assertTrue(l.get(i, i) > 0);
        assertTrue(l.multiply(l.transpose()).approximatelyEquals(a, EPS));
        assertEquals(Math.sqrt(7), l.get(0, 0), EPS);
    }

    @Test
    public void testCholeskyRejectsNonPositiveDefinite() {
        assertThrows(NotPositiveDefiniteException.class,
                () -> Cholesky.decompose(Matrix.of(new double[][] { {1, 2}, {2, 1} })));
        assertThrows(NotPositiveDefiniteException.class,
                () -> Cholesky.decompose(Matrix.of(new double[][] { {2, 1}, {0, 2} })));
        assertThrows(InvalidDimensionsException.class,
                () -> Cholesky.decompose(Matrix.of(new double[][] { {1, 2, 3} })));
    }

    @Test
    public void testLuOfSymmetricPositiveDefinite() {
        Matrix a = Matrix.of(new double[][] { {4, 2, -2}, {2, 5, 4}, {-2, 4, 8} });
        LuDecomposition lu = LuDecomposition.decompose(a);

        assertTrue(lu.l().approximatelyEquals(
                Matrix.of(new double[][] { {1, 0, 0}, {0.5, 1, 0}, {-0.5, 1.25, 1} }), EPS));
        assertTrue(lu.u().approximatelyEquals(
                Matrix.of(new double[][] { {4, 2, -2}, {0, 4, 5}, {0, 0, 0.75} }), EPS));
        assertTrue(lu.product().approximatelyEquals(a, EPS));
        assertLowerTriangular(lu.l());
        assertUpperTriangular(lu.u());
    }

    @Test
    public void testLuRejectsIndefiniteInput() {
        assertThrows(NotPositiveDefiniteException.class,
                () -> LuDecomposition.decompose(Matrix.of(new double[][] { {1, 2}, {2, 1} })));
    }

    @Test
    public void testRandomSpdMatricesAgainstEjml() {
        Random rnd = new Random(7);
        for (int trial = 0; trial < 10; trial++) {
            int n = 2 + rnd.nextInt(4);
            SimpleMatrix B = SimpleMatrix.random_DDRM(n, n, -1, 1, rnd);
            // BᵗB + nI is symmetric positive definite
            SimpleMatrix spd = B.transpose().mult(B).plus(SimpleMatrix.identity(n).scale(n));
            double[][] rows = new double[n][n];
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    rows[i][j] = spd.get(i, j);
            // symmetrize exactly so the strict symmetry check holds
            for (int i = 0; i < n; i++)
                for (int j = 0; j < i; j++)
                    rows[i][j] = rows[j][i];
            Matrix a = Matrix.of(rows);

            Matrix l = Cholesky.decompose(a);
            assertTrue(l.multiply(l.transpose()).approximatelyEquals(a, EPS));
            assertTrue(LuDecomposition.decompose(a).product().approximatelyEquals(a, EPS));
            double det = new SimpleMatrix(rows).determinant();
            assertEquals(det, Determinant.of(a), 1e-9 * Math.abs(det));
        }
    }
}

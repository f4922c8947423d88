package com.rowreduction;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/** Forward and backward elimination with the first-nonzero pivot rule. */
public class EliminatorTest {

    private static final double EPS = 1e-9;

    private static Matrix m(double[][] rows) { return Matrix.of(rows); }

    private static void assertPivotsNormalized(Matrix a) {
        for (int r = 0; r < a.rows(); r++) {
            int p = Eliminator.pivotColumn(a, r, a.cols());
            if (p >= 0) assertEquals(1.0, a.get(r, p), EPS, "pivot of row " + r);
        }
    }

    @Test
    public void testRowEchelonOfUnderdeterminedSystem() {
        Eliminator e = new Eliminator();
        Matrix ref = e.toRowEchelon(m(new double[][] { {1, 5, 1, 10}, {2, 11, 5, 11} }));
        assertEquals(m(new double[][] { {1, 5, 1, 10}, {0, 1, 3, -9} }), ref);
        assertPivotsNormalized(ref);
    }

    @Test
    public void testReducedRowEchelonHasUniquePivotPerRow() {
        Eliminator e = new Eliminator();
        Matrix rref = e.reduce(m(new double[][] { {1, 5, 1, 10}, {2, 11, 5, 11} }));
        assertEquals(m(new double[][] { {1, 0, -14, 55}, {0, 1, 3, -9} }), rref);
        assertEquals(0, Eliminator.pivotColumn(rref, 0, 4));
        assertEquals(1, Eliminator.pivotColumn(rref, 1, 4));
    }

    @Test
    public void testZeroRowIsSkippedAndStaysInPlace() {
        Eliminator e = new Eliminator();
        Matrix input = m(new double[][] { {0, 0, 0, 0}, {1, 2, 3, 4}, {2, 4, 7, 9} });
        Matrix ref = e.toRowEchelon(input);
        assertEquals(m(new double[][] { {0, 0, 0, 0}, {1, 2, 3, 4}, {0, 0, 1, 1} }), ref);
        Matrix rref = e.toReducedRowEchelon(ref);
        assertEquals(m(new double[][] { {0, 0, 0, 0}, {1, 2, 0, 1}, {0, 0, 1, 1} }), rref);
    }

    @Test
    public void testPivotIsFirstNonzeroNotLargest() {
        // partial pivoting would pick 1000 and swap rows
        Matrix ref = new Eliminator().toRowEchelon(m(new double[][] { {1, 100, 0}, {1000, 1, 0} }));
        assertEquals(m(new double[][] { {1, 100, 0}, {0, 1, 0} }), ref);
    }

    @Test
    public void testRowsAreNeverSwapped() {
        Eliminator e = new Eliminator();
        Matrix rref = e.reduce(m(new double[][] { {0, 2, 4}, {3, 6, 9} }));
        assertEquals(m(new double[][] { {0, 1, 2}, {1, 0, -1} }), rref);
        assertEquals(1, Eliminator.pivotColumn(rref, 0, 3));
        assertEquals(0, Eliminator.pivotColumn(rref, 1, 3));
    }

    @Test
    public void testReducedRowEchelonIsIdempotent() {
        Eliminator e = new Eliminator();
        Matrix rref = e.reduce(m(new double[][] {
                {-2, 4, -2, -1, 4, -3}, {4, -8, 3, -3, 1, 2}, {1, -2, 1, -1, 1, 0}, {1, -2, 0, -3, 4, -1} }));
        assertEquals(rref, e.toReducedRowEchelon(rref));
        assertPivotsNormalized(rref);
    }

    @Test
    public void testTinyInputEntryIsStillAPivot() {
        Matrix ref = new Eliminator().toRowEchelon(m(new double[][] { {1e-9, 2, 4}, {1, 1, 1} }));
        assertEquals(0, Eliminator.pivotColumn(ref, 0, 3));
        assertEquals(1, Eliminator.pivotColumn(ref, 1, 3));
        assertPivotsNormalized(ref);
    }

    @Test
    public void testCancellationResidueBecomesExactZero() {
        // 0.9 - 0.3 * (0.3 / 0.1) leaves a residue near 1e-16
        double[][] rows = { {0.1, 0.3}, {0.3, 0.9} };
        Matrix ref = new Eliminator().toRowEchelon(m(rows));
        assertTrue(ref.row(1).isZero(0.0));

        Matrix kept = new Eliminator(0.0).toRowEchelon(m(rows));
        assertEquals(1, Eliminator.pivotColumn(kept, 1, 2));
    }

    @Test
    public void testZeroPatternDoesNotDependOnScale() {
        for (double scale : new double[] { 1e-15, 1e-12, 1, 1e9 }) {
            Matrix rref = new Eliminator().reduce(m(new double[][] {
                    {scale, 2 * scale, 3 * scale}, {2 * scale, 4 * scale, 6 * scale} }));
            assertEquals(m(new double[][] { {1, 2, 3}, {0, 0, 0} }), rref, "scale " + scale);
        }
    }

    @Test
    public void testSingularPivotWhenDivisionOverflows() {
        // a subnormal pivot is nonzero, but 1e300 / 1e-310 overflows
        Eliminator exact = new Eliminator(0.0);
        SingularPivotException ex = assertThrows(SingularPivotException.class,
                () -> exact.toRowEchelon(m(new double[][] { {1e-310, 1e300}, {1, 1} })));
        assertEquals(0, ex.getRow());
        assertEquals(0, ex.getColumn());
        assertEquals("SingularPivot", ex.kind());
    }

    @Test
    public void testBackwardPassRejectsMatrixNotInRowEchelonForm() {
        assertThrows(IllegalArgumentException.class,
                () -> new Eliminator().toReducedRowEchelon(m(new double[][] { {2, 4}, {0, 1} })));
    }

    @Test
    public void testInputIsNotModified() {
        double[][] rows = { {2, 4, 6}, {1, 3, 5} };
        Matrix input = m(rows);
        new Eliminator().reduce(input);
        assertEquals(m(rows), input);
    }

    @Test
    public void testNegativeToleranceRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Eliminator(-1e-3));
        assertThrows(IllegalArgumentException.class, () -> new Eliminator(Double.NaN));
    }
}

package com.rowreduction;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

public class MatrixTest {

    @Test
    public void testRaggedRowsRejected() {
        double[][] ragged = { {1, 2, 3}, {4, 5} };
        InvalidDimensionsException e = assertThrows(InvalidDimensionsException.class, () -> Matrix.of(ragged));
        assertTrue(e.getMessage().contains("Row 1"));
    }

    @Test
    public void testNonFiniteEntriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> Matrix.of(new double[][] { {1, Double.NaN} }));
        assertThrows(IllegalArgumentException.class, () -> Vector.of(1.0, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testDefensiveCopies() {
        double[][] src = { {1, 2}, {3, 4} };
        Matrix a = Matrix.of(src);
        src[0][0] = 99;                       // caller's array changes
        assertEquals(1.0, a.get(0, 0));
        double[][] out = a.toArray();
        out[1][1] = -1;                       // exported copy changes
        assertEquals(4.0, a.get(1, 1));
    }

    @Test
    public void testMultiplyAndTranspose() {
        Matrix a = Matrix.of(new double[][] { {1, 2, 3}, {4, 5, 6} });
        Matrix b = Matrix.of(new double[][] { {7, 8}, {9, 10}, {11, 12} });
        assertEquals(Matrix.of(new double[][] { {58, 64}, {139, 154} }), a.multiply(b));
        assertEquals(Vector.of(14, 32), a.multiply(Vector.of(1, 2, 3)));
        assertEquals(Matrix.of(new double[][] { {1, 4}, {2, 5}, {3, 6} }), a.transpose());
        assertThrows(InvalidDimensionsException.class, () -> a.multiply(a));
        assertThrows(InvalidDimensionsException.class, () -> a.multiply(Vector.of(1, 2)));
    }

    @Test
    public void testRowColumnAndSubmatrix() {
        Matrix a = Matrix.of(new double[][] { {1, 2, 3}, {4, 5, 6}, {7, 8, 9} });
        assertEquals(Vector.of(4, 5, 6), a.row(1));
        assertEquals(Vector.of(3, 6, 9), a.column(2));
        assertEquals(Matrix.of(new double[][] { {5, 6}, {8, 9} }), a.submatrix(1, 3, 1, 3));
        assertThrows(InvalidDimensionsException.class, () -> a.submatrix(0, 4, 0, 1));
        assertEquals(Matrix.identity(3), Matrix.ofColumns(Vector.of(1, 0, 0), Vector.of(0, 1, 0), Vector.of(0, 0, 1)));
    }

    @Test
    public void testReadDecimalsAndFractions() throws IOException {
        String block = "1 -2.5 3/4\n\n  0 1e-3 -6/3\n";
        Matrix a = Matrix.read(new BufferedReader(new StringReader(block)), 2, 3);
        assertEquals(-2.5, a.get(0, 1));
        assertEquals(0.75, a.get(0, 2));
        assertEquals(0.001, a.get(1, 1));
        assertEquals(-2.0, a.get(1, 2));
    }

    @Test
    public void testReadRejectsBadRows() {
        assertThrows(IOException.class,
                () -> Matrix.read(new BufferedReader(new StringReader("1 2\n")), 1, 3));
        assertThrows(IOException.class,
                () -> Matrix.read(new BufferedReader(new StringReader("1 x 3\n")), 1, 3));
        assertThrows(IOException.class,
                () -> Matrix.read(new BufferedReader(new StringReader("1 2 3\n")), 2, 3));
        assertThrows(IOException.class,
                () -> Matrix.read(new BufferedReader(new StringReader("1 2/0 3\n")), 1, 3));
    }

    @Test
    public void testWriteIntegralEntriesWithoutFraction() throws IOException {
        StringWriter sw = new StringWriter();
        Matrix.of(new double[][] { {1, -0.5}, {0, 3} }).write(sw);
        String[] lines = sw.toString().split("\\R");
        assertEquals("1 -0.5", lines[0]);
        assertEquals("0 3", lines[1]);
    }

    @Test
    public void testVectorArithmetic() {
        Vector v = Vector.of(3, 4);
        assertEquals(5.0, v.norm());
        assertTrue(v.normalize().approximatelyEquals(Vector.of(0.6, 0.8), 1e-15));
        assertEquals(Vector.of(4, 6), v.add(Vector.of(1, 2)));
        assertEquals(Vector.of(2, 2), v.subtract(Vector.of(1, 2)));
        assertEquals(11.0, v.dot(Vector.of(1, 2)));
        assertTrue(Vector.zeros(3).isZero(0.0));
        assertThrows(ArithmeticException.class, () -> Vector.zeros(2).normalize());
        assertThrows(InvalidDimensionsException.class, () -> v.dot(Vector.of(1)));
    }
}

package com.rowreduction;

/**
 * Builders for the three kinds of elementary row-operation matrices.
 * Left-multiplying a matrix by one of them applies the row operation.
 */
public final class ElementaryMatrices {

    private ElementaryMatrices() {}

    /** Type 1: multiply {@code row} by a nonzero {@code scalar}. */
    public static Matrix scaleRow(int size, int row, double scalar) {
        checkIndex(size, row);
        if (scalar == 0.0 || !Double.isFinite(scalar)) {
            throw new IllegalArgumentException("Row scale factor must be finite and nonzero: " + scalar);
        }
        double[][] e = Matrix.identity(size).toArray();
        e[row][row] = scalar;
        return Matrix.wrap(e);
    }

    /** Type 2: add {@code multiplier} times {@code sourceRow} to {@code targetRow}. */
    public static Matrix addMultipleOfRow(int size, int targetRow, int sourceRow, double multiplier) {
        checkIndex(size, targetRow);
        checkIndex(size, sourceRow);
        if (targetRow == sourceRow) {
            throw new IllegalArgumentException("Source and target row must differ: " + targetRow);
        }
        if (!Double.isFinite(multiplier)) {
            throw new IllegalArgumentException("Multiplier must be finite: " + multiplier);
        }
        double[][] e = Matrix.identity(size).toArray();
        e[targetRow][sourceRow] = multiplier;
        return Matrix.wrap(e);
    }

    /** Type 3: exchange rows {@code row1} and {@code row2}. */
    public static Matrix swapRows(int size, int row1, int row2) {
        checkIndex(size, row1);
        checkIndex(size, row2);
        double[][] e = Matrix.identity(size).toArray();
        double[] tmp = e[row1];
        e[row1] = e[row2];
        e[row2] = tmp;
        return Matrix.wrap(e);
    }

    private static void checkIndex(int size, int row) {
        if (size <= 0) throw new InvalidDimensionsException("Size must be positive: " + size);
        if (row < 0 || row >= size) {
            throw new InvalidDimensionsException("Row " + row + " outside 0.." + (size - 1));
        }
    }
}

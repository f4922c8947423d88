package com.rowreduction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;

/**
 * An immutable dense matrix of {@code double} values.  Rows and columns are
 * indexed from zero.  Every operation that changes entries returns a new
 * matrix, so a value can be handed to several pipeline stages safely.
 */
public final class Matrix {
    private final int rows;
    private final int cols;
    private final double[][] data;

    private Matrix(int rows, int cols, double[][] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Copies {@code entries} into a new matrix.  All rows must have the same
     * length and every entry must be finite.
     */
    public static Matrix of(double[][] entries) {
        if (entries == null) throw new IllegalArgumentException("entries must not be null");
        int m = entries.length;
        int n = m == 0 ? 0 : entries[0].length;
        double[][] copy = new double[m][];
        for (int i = 0; i < m; i++) {
            if (entries[i] == null || entries[i].length != n) {
                throw new InvalidDimensionsException("Row " + i + " has "
                        + (entries[i] == null ? 0 : entries[i].length) + " entries, expected " + n);
            }
            for (int j = 0; j < n; j++) {
                if (!Double.isFinite(entries[i][j])) {
                    throw new IllegalArgumentException(
                            "Non-finite entry " + entries[i][j] + " at (" + i + "," + j + ")");
                }
            }
            copy[i] = Arrays.copyOf(entries[i], n);
        }
        return new Matrix(m, n, copy);
    }

    /** Builds a matrix whose rows are the given vectors. */
    public static Matrix ofRows(Vector... rowVectors) {
        double[][] a = new double[rowVectors.length][];
        for (int i = 0; i < rowVectors.length; i++) a[i] = rowVectors[i].toArray();
        return of(a);
    }

    /** Builds a matrix whose columns are the given vectors. */
    public static Matrix ofColumns(Vector... columnVectors) {
        return ofRows(columnVectors).transpose();
    }

    /** Constructs a {@code rows × cols} matrix with all entries set to zero. */
    public static Matrix zeros(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new InvalidDimensionsException("Negative dimensions " + rows + "x" + cols);
        }
        return new Matrix(rows, cols, new double[rows][cols]);
    }

    public static Matrix identity(int n) {
        double[][] a = new double[n][n];
        for (int i = 0; i < n; i++) a[i][i] = 1.0;
        return new Matrix(n, n, a);
    }

    /** Takes ownership of {@code entries}; callers must not keep a reference. */
    static Matrix wrap(double[][] entries) {
        int n = entries.length == 0 ? 0 : entries[0].length;
        return new Matrix(entries.length, n, entries);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }
    public boolean isSquare() { return rows == cols; }

    /** Returns the entry at row {@code r}, column {@code c}. */
    public double get(int r, int c) {
        return data[r][c];
    }

    public Vector row(int r) {
        return Vector.wrap(Arrays.copyOf(data[r], cols));
    }

    public Vector column(int c) {
        double[] out = new double[rows];
        for (int i = 0; i < rows; i++) out[i] = data[i][c];
        return Vector.wrap(out);
    }

    /** Deep copy of the entries, free for the caller to mutate. */
    public double[][] toArray() {
        double[][] a = new double[rows][];
        for (int i = 0; i < rows; i++) a[i] = Arrays.copyOf(data[i], cols);
        return a;
    }

    public Matrix transpose() {
        double[][] t = new double[cols][rows];
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                t[j][i] = data[i][j];
        return new Matrix(cols, rows, t);
    }

    public Matrix multiply(Matrix o) {
        if (cols != o.rows) {
            throw new InvalidDimensionsException("Cannot multiply " + rows + "x" + cols
                    + " by " + o.rows + "x" + o.cols);
        }
        double[][] out = new double[rows][o.cols];
        for (int i = 0; i < rows; i++)
            for (int k = 0; k < cols; k++) {
                double a = data[i][k];
                if (a == 0.0) continue;
                for (int j = 0; j < o.cols; j++) out[i][j] += a * o.data[k][j];
            }
        return new Matrix(rows, o.cols, out);
    }

    public Vector multiply(Vector v) {
        if (cols != v.length()) {
            throw new InvalidDimensionsException("Cannot multiply " + rows + "x" + cols
                    + " by vector of length " + v.length());
        }
        double[] out = new double[rows];
        for (int i = 0; i < rows; i++) {
            double sum = 0.0;
            for (int j = 0; j < cols; j++) sum += data[i][j] * v.get(j);
            out[i] = sum;
        }
        return Vector.wrap(out);
    }

    /** Rows {@code r0..r1-1} and columns {@code c0..c1-1}. */
    public Matrix submatrix(int r0, int r1, int c0, int c1) {
        if (r0 < 0 || c0 < 0 || r1 > rows || c1 > cols || r0 > r1 || c0 > c1) {
            throw new InvalidDimensionsException("Submatrix [" + r0 + "," + r1 + ")x[" + c0 + "," + c1
                    + ") outside " + rows + "x" + cols);
        }
        int m = r1 - r0, n = c1 - c0;
        double[][] s = new double[m][];
        for (int i = 0; i < m; i++) s[i] = Arrays.copyOfRange(data[r0 + i], c0, c1);
        return new Matrix(m, n, s);
    }

    public boolean approximatelyEquals(Matrix o, double tolerance) {
        if (o == null || o.rows != rows || o.cols != cols) return false;
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                if (Math.abs(data[i][j] - o.data[i][j]) > tolerance) return false;
        return true;
    }

    /**
     * Reads {@code m} non-blank lines of {@code n} whitespace-separated
     * numbers.  An entry may be a decimal ({@code 2.5}, {@code -1e-3}) or a
     * fraction {@code numerator/denominator}.  The caller is responsible for
     * the header lines around the block.
     */
    public static Matrix read(BufferedReader reader, int m, int n) throws IOException {
        double[][] a = new double[m][n];
        for (int i = 0; i < m; i++) {
            String line;
            do {
                line = reader.readLine();
                if (line == null) {
                    throw new IOException("Unexpected end of file while reading matrix");
                }
                line = line.trim();
            } while (line.isEmpty());
            String[] tokens = line.split("\\s+");
            if (tokens.length != n) {
                throw new IOException("Expected " + n + " columns on matrix row " + (i + 1)
                        + ", got " + tokens.length);
            }
            for (int j = 0; j < n; j++) {
                a[i][j] = parseEntry(tokens[j], i + 1);
            }
        }
        return new Matrix(m, n, a);
    }

    /** Writes this matrix one row per line, entries separated by a space. */
    public void write(Writer out) throws IOException {
        for (int i = 0; i < rows; i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(formatEntry(data[i][j]));
            }
            out.write(sb.toString());
            out.write(System.lineSeparator());
        }
    }

    /** Integral values print without a fractional part. */
    static String formatEntry(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    private static double parseEntry(String token, int line) throws IOException {
        double value;
        try {
            int slash = token.indexOf('/');
            if (slash < 0) {
                value = Double.parseDouble(token);
            } else {
                double num = Double.parseDouble(token.substring(0, slash));
                double den = Double.parseDouble(token.substring(slash + 1));
                if (den == 0.0) throw new IOException("Zero denominator in '" + token + "' on matrix row " + line);
                value = num / den;
            }
        } catch (NumberFormatException e) {
            throw new IOException("Cannot parse '" + token + "' on matrix row " + line, e);
        }
        if (!Double.isFinite(value)) {
            throw new IOException("Non-finite value '" + token + "' on matrix row " + line);
        }
        return value;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        return rows == o.rows && cols == o.cols && Arrays.deepEquals(data, o.data);
    }

    @Override public int hashCode() { return 31 * (31 * rows + cols) + Arrays.deepHashCode(data); }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (double[] r : data) sb.append(Arrays.toString(r)).append('\n');
        return sb.toString();
    }
}

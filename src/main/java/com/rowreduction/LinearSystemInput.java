package com.rowreduction;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A matrix read from an lrs-style text file.  A {@code linear-system} block
 * holds {@code [A | b]} with b in the last column; a {@code matrix} block is
 * a plain matrix for the factorization modes.
 *
 * <pre>
 * name
 * linear-system
 * begin
 * 2 4 real
 * 1 1 1 3
 * 2 1 1 4
 * end
 * </pre>
 */
public class LinearSystemInput {
    public enum Type { LINEAR_SYSTEM, MATRIX }

    private final Type type;
    private final String name;
    private final int rowCount;
    private final int colCount;
    private final Matrix matrix;

    LinearSystemInput(Type type, String name, Matrix matrix) {
        this.type = type;
        this.name = name;
        this.rowCount = matrix.rows();
        this.colCount = matrix.cols();
        this.matrix = matrix;
    }

    public Type getType() { return type; }
    /** First free-text line before the block, or {@code null}. */
    public String getName() { return name; }
    public int getRowCount() { return rowCount; }
    public int getColCount() { return colCount; }
    public Matrix getMatrix() { return matrix; }

    /** The block as {@code [A | b]}. */
    public AugmentedMatrix toAugmented() {
        if (type != Type.LINEAR_SYSTEM) {
            throw new IllegalStateException("Input is a plain matrix, not a linear system");
        }
        return new AugmentedMatrix(matrix);
    }

    public static LinearSystemInput readFromFile(String filename) throws IOException {
        try (Reader r = new FileReader(filename)) {
            return read(r);
        }
    }

    public static LinearSystemInput read(Reader source) throws IOException {
        BufferedReader br = new BufferedReader(source);
        String line;

        // ---- scan header: optional name line, optional type line, then 'begin' ----
        Type type = Type.LINEAR_SYSTEM;
        String name = null;
        boolean sawBegin = false;

        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("*") || line.startsWith("#")) continue; // comment

            String low = line.toLowerCase(Locale.ROOT);
            if (low.equals("linear-system")) { type = Type.LINEAR_SYSTEM; continue; }
            if (low.equals("matrix")) { type = Type.MATRIX; continue; }
            if (low.equals("begin")) { sawBegin = true; break; }

            if (name == null) name = line;
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        // ---- size line after 'begin' ----
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty());
        String[] header = line.split("\\s+");
        if (header.length < 2)
            throw new IOException("Expected 'm n [real|integer]' or '***** n [real|integer]', got: " + line);
        if (header.length > 2) {
            String kind = header[2].toLowerCase(Locale.ROOT);
            if (!kind.equals("real") && !kind.equals("integer") && !kind.equals("rational"))
                throw new IOException("Unknown number type '" + header[2] + "'");
        }

        final int n = parseCount(header[1], "Column count");
        Matrix matrix;

        if (header[0].equals("*****")) {
            // rows until 'end'
            List<String> rows = new ArrayList<>();
            while (true) {
                line = br.readLine();
                if (line == null) throw new IOException("Missing 'end'");
                String t = line.trim();
                if (t.isEmpty()) continue;
                if (t.equalsIgnoreCase("end")) break;
                rows.add(t);
            }
            StringBuilder sb = new StringBuilder();
            for (String r : rows) sb.append(r).append('\n');
            try (BufferedReader tmp = new BufferedReader(new StringReader(sb.toString()))) {
                matrix = Matrix.read(tmp, rows.size(), n);
            }
        } else {
            final int m = parseCount(header[0], "Row count");
            matrix = Matrix.read(br, m, n);

            do {
                line = br.readLine();
                if (line == null) throw new IOException("Missing 'end'");
                line = line.trim();
            } while (line.isEmpty());
            if (!line.equalsIgnoreCase("end"))
                throw new IOException("Expected 'end', got: " + line);
        }

        if (matrix.rows() == 0) throw new IOException("Matrix block has no rows");
        if (type == Type.LINEAR_SYSTEM && n < 2)
            throw new IOException("A linear system needs at least one coefficient column and a right-hand side");
        return new LinearSystemInput(type, name, matrix);
    }

    public void write(PrintWriter out) throws IOException {
        if (name != null) out.println(name);
        out.println(type == Type.LINEAR_SYSTEM ? "linear-system" : "matrix");
        out.println("begin");
        out.printf("%d %d real%n", rowCount, colCount);
        matrix.write(out);
        out.println("end");
    }

    private static int parseCount(String token, String what) throws IOException {
        if (!token.matches("\\d{1,9}"))
            throw new IOException(what + " must be a non-negative integer, got: " + token);
        return Integer.parseInt(token);
    }
}

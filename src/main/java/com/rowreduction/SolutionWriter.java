package com.rowreduction;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/** Plain-text rendering of matrices and solution sets. */
public final class SolutionWriter {
    private final PrintWriter out;
    private final int precision;

    public SolutionWriter(PrintWriter out, int precision) {
        this.out = out;
        this.precision = precision;
    }

    public void matrix(String title, Matrix m) {
        out.println(title + ":");
        for (int i = 0; i < m.rows(); i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < m.cols(); j++) {
                if (j > 0) sb.append('\t');
                sb.append(format(m.get(i, j)));
            }
            out.println(sb);
        }
        out.println();
    }

    public void vector(String title, Vector v) {
        out.println(title + ": " + format(v));
    }

    public void scalar(String title, double v) {
        out.println(title + ": " + format(v));
    }

    public void solution(SolutionSet s) {
        out.println("Pivot columns: " + variables(s.pivotColumns()));
        out.println("Free columns: " + variables(s.nonPivotColumns()));
        vector("Particular solution", s.particularSolution());
        if (s.isUnique()) {
            out.println("Null space basis: (none)");
        } else {
            out.println("Null space basis:");
            for (int k = 0; k < s.nullity(); k++) {
                out.println("  n" + (k + 1) + " = " + format(s.nullSpaceBasis().get(k)));
            }
        }
        out.println("General solution: " + generalSolution(s));
    }

    /**
     * {@code x = p + x3*n1 + x5*n2}: each free variable scales the basis
     * vector it owns.
     */
    public String generalSolution(SolutionSet s) {
        StringBuilder sb = new StringBuilder("x = ").append(format(s.particularSolution()));
        for (int k = 0; k < s.nullity(); k++) {
            sb.append(" + x").append(s.nonPivotColumns().get(k) + 1)
              .append('*').append(format(s.nullSpaceBasis().get(k)));
        }
        return sb.toString();
    }

    public String format(Vector v) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < v.length(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(format(v.get(i)));
        }
        return sb.append(']').toString();
    }

    public String format(double v) {
        String s = String.format(Locale.ROOT, "%." + precision + "f", v);
        // rounding can leave "-0.00"
        if (s.startsWith("-") && s.matches("-0\\.?0*")) s = s.substring(1);
        return s;
    }

    private static String variables(List<Integer> columns) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('x').append(columns.get(i) + 1);
        }
        return sb.append(']').toString();
    }
}

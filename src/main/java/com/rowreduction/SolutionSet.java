package com.rowreduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The complete solution set of {@code Ax = b}: the affine subspace
 * {@code particular + span(nullSpaceBasis)}.  Free variables are zero in the
 * particular solution; basis vector {@code k} belongs to free column
 * {@code nonPivotColumns().get(k)}.
 */
public final class SolutionSet {
    private final Vector particular;
    private final List<Vector> nullSpaceBasis;
    private final List<Integer> pivotColumns;
    private final List<Integer> nonPivotColumns;

    public SolutionSet(Vector particular, List<Vector> nullSpaceBasis,
                       List<Integer> pivotColumns, List<Integer> nonPivotColumns) {
        this.particular = Objects.requireNonNull(particular, "particular");
        if (nullSpaceBasis.size() != nonPivotColumns.size()) {
            throw new IllegalArgumentException("Expected one basis vector per free column: "
                    + nullSpaceBasis.size() + " vectors, " + nonPivotColumns.size() + " free columns");
        }
        for (Vector v : nullSpaceBasis) {
            if (v.length() != particular.length()) {
                throw new InvalidDimensionsException("Basis vector of length " + v.length()
                        + " does not match solution length " + particular.length());
            }
        }
        this.nullSpaceBasis = Collections.unmodifiableList(new ArrayList<>(nullSpaceBasis));
        this.pivotColumns = Collections.unmodifiableList(new ArrayList<>(pivotColumns));
        this.nonPivotColumns = Collections.unmodifiableList(new ArrayList<>(nonPivotColumns));
    }

    public Vector particularSolution() { return particular; }
    public List<Vector> nullSpaceBasis() { return nullSpaceBasis; }
    public List<Integer> pivotColumns() { return pivotColumns; }
    public List<Integer> nonPivotColumns() { return nonPivotColumns; }

    /** Number of unknowns. */
    public int dimension() { return particular.length(); }
    public int rank() { return pivotColumns.size(); }
    public int nullity() { return nullSpaceBasis.size(); }
    public boolean isUnique() { return nullSpaceBasis.isEmpty(); }

    /**
     * The member of the solution set with free parameters {@code t}:
     * {@code particular + t[0]*basis[0] + t[1]*basis[1] + ...}.
     */
    public Vector pointAt(double... t) {
        if (t.length != nullSpaceBasis.size()) {
            throw new InvalidDimensionsException("Expected " + nullSpaceBasis.size()
                    + " parameters, got " + t.length);
        }
        Vector x = particular;
        for (int k = 0; k < t.length; k++) x = x.add(nullSpaceBasis.get(k).scale(t[k]));
        return x;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SolutionSet)) return false;
        SolutionSet o = (SolutionSet) obj;
        return particular.equals(o.particular) && nullSpaceBasis.equals(o.nullSpaceBasis)
                && pivotColumns.equals(o.pivotColumns) && nonPivotColumns.equals(o.nonPivotColumns);
    }

    @Override public int hashCode() {
        return Objects.hash(particular, nullSpaceBasis, pivotColumns, nonPivotColumns);
    }

    @Override public String toString() {
        return "x = " + particular + " + span" + nullSpaceBasis;
    }
}

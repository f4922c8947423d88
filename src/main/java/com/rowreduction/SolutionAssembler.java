package com.rowreduction;

import java.util.ArrayList;
import java.util.List;

/** Turns an RREF system and its column classification into a {@link SolutionSet}. */
public final class SolutionAssembler {

    private SolutionAssembler() {}

    /**
     * Particular solution: each pivot variable takes its row's right-hand
     * side, free variables are zero.  One null-space basis vector per free
     * column {@code f}: {@code x[f] = 1}, each pivot variable is the negated
     * RREF entry of its row in column {@code f}, other free variables zero.
     *
     * @throws InvalidDimensionsException if the classification was made for
     *         a different column count
     */
    public static SolutionSet assemble(AugmentedMatrix rref, ColumnClassification classification) {
        final int n = rref.coefficientColumns();
        if (classification.coefficientColumns() != n) {
            throw new InvalidDimensionsException("Classification covers " + classification.coefficientColumns()
                    + " columns but the system has " + n);
        }
        final int rhs = rref.rightHandSideColumn();
        final List<Integer> pivotCols = classification.pivotColumns();
        final List<Integer> pivotRows = classification.pivotRows();

        double[] particular = new double[n];
        for (int k = 0; k < pivotCols.size(); k++) {
            particular[pivotCols.get(k)] = rref.get(pivotRows.get(k), rhs);
        }

        List<Vector> basis = new ArrayList<>(classification.nullity());
        for (int free : classification.nonPivotColumns()) {
            double[] v = new double[n];
            v[free] = 1.0;
            for (int k = 0; k < pivotCols.size(); k++) {
                v[pivotCols.get(k)] = -rref.get(pivotRows.get(k), free) + 0.0; // no -0.0
            }
            basis.add(Vector.wrap(v));
        }

        return new SolutionSet(Vector.wrap(particular), basis,
                classification.pivotColumns(), classification.nonPivotColumns());
    }
}

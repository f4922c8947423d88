package com.rowreduction;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads rank, pivot columns and free columns off a matrix in RREF.  An entry
 * counts as nonzero exactly when it is not {@code 0.0}; cancellation residue
 * has already been cleared by {@link Eliminator}.
 */
public final class StructureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    /**
     * Each row's first nonzero coefficient column is a pivot column; rows
     * with no nonzero coefficient contribute nothing.  The right-hand-side
     * column is never a pivot.  Consistency is not checked here, see
     * {@link #requireConsistent(AugmentedMatrix)}.
     */
    public ColumnClassification classifyColumns(AugmentedMatrix rref) {
        final int n = rref.coefficientColumns();
        List<Integer> pivotColumns = new ArrayList<>();
        List<Integer> pivotRows = new ArrayList<>();
        boolean[] isPivot = new boolean[n];

        for (int r = 0; r < rref.rows(); r++) {
            int p = Eliminator.pivotColumn(rref.matrix(), r, n);
            if (p < 0) continue;
            if (isPivot[p]) {
                throw new IllegalArgumentException("Column " + p + " leads two rows; matrix is not in RREF");
            }
            isPivot[p] = true;
            pivotColumns.add(p);
            pivotRows.add(r);
        }

        List<Integer> free = new ArrayList<>();
        for (int c = 0; c < n; c++) if (!isPivot[c]) free.add(c);

        log.debug("rank {} with pivot columns {} and free columns {}", pivotColumns.size(), pivotColumns, free);
        return new ColumnClassification(pivotColumns, pivotRows, free, n);
    }

    /**
     * Rejects a reduced system containing a row whose coefficients are all
     * zero but whose right-hand side is not.
     *
     * @throws InconsistentSystemException naming the first such row
     */
    public void requireConsistent(AugmentedMatrix rref) {
        int r = firstInconsistentRow(rref);
        if (r >= 0) {
            throw new InconsistentSystemException(r);
        }
    }

    public boolean isConsistent(AugmentedMatrix rref) {
        return firstInconsistentRow(rref) < 0;
    }

    private int firstInconsistentRow(AugmentedMatrix rref) {
        final int n = rref.coefficientColumns();
        for (int r = 0; r < rref.rows(); r++) {
            if (Eliminator.pivotColumn(rref.matrix(), r, n) >= 0) continue;
            if (rref.get(r, n) != 0.0) return r;
        }
        return -1;
    }
}

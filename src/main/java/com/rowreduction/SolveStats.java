package com.rowreduction;

public final class SolveStats {
    public int rows;
    public int unknowns;
    public int rank;
    public int free;
    public int zeroRows;

    static SolveStats of(SolveTrace trace) {
        SolveStats st = new SolveStats();
        st.rows = trace.reducedRowEchelon.rows();
        st.unknowns = trace.reducedRowEchelon.coefficientColumns();
        st.rank = trace.classification.rank();
        st.free = trace.classification.nullity();
        st.zeroRows = st.rows - st.rank;
        return st;
    }

    @Override
    public String toString() {
        return "*Totals: rank=" + rank +
                " free=" + free +
                " rows=" + rows +
                " unknowns=" + unknowns +
                " zero_rows=" + zeroRows;
    }
}

package com.rowreduction;

/** Immutable run configuration for the command-line driver. */
public final class SolverOptions {
    public enum Mode { SOLVE, REF, RREF, QR, LU, CHOLESKY, DET, INDEPENDENCE }

    public final Mode mode;
    public final double tolerance;          // relative cancellation threshold
    public final int precision;             // decimal places in printed numbers
    public final boolean steps;             // print augmented/REF/RREF while solving
    public final boolean verbose;           // debug logging

    private SolverOptions(Builder b) {
        this.mode = b.mode;
        this.tolerance = b.tolerance;
        this.precision = b.precision;
        this.steps = b.steps;
        this.verbose = b.verbose;
    }

    public static SolverOptions defaults() { return new Builder().build(); }

    public static final class Builder {
        private Mode mode = Mode.SOLVE;
        private double tolerance = Eliminator.DEFAULT_TOLERANCE;
        private int precision = 4;
        private boolean steps, verbose;

        public Builder mode(Mode m){ this.mode=m; return this; }
        public Builder steps(boolean v){ this.steps=v; return this; }
        public Builder verbose(boolean v){ this.verbose=v; return this; }

        public Builder tolerance(double v){
            if (!(v >= 0.0) || Double.isInfinite(v)) throw new IllegalArgumentException("Bad tolerance: " + v);
            this.tolerance=v; return this;
        }

        public Builder precision(int v){
            if (v < 0 || v > 17) throw new IllegalArgumentException("Precision must be 0..17: " + v);
            this.precision=v; return this;
        }

        public SolverOptions build(){ return new SolverOptions(this); }
    }
}

package com.rowreduction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves {@code Ax = b} by row reduction:
 * augment, REF, RREF, consistency check, column classification, assembly.
 *
 * <p>Every stage returns a new value, so the caller's {@code A} and
 * {@code b} are never touched and one solver can serve concurrent calls.
 */
public final class LinearSystemSolver {

    private static final Logger log = LoggerFactory.getLogger(LinearSystemSolver.class);

    private final Eliminator eliminator;
    private final StructureAnalyzer analyzer;

    public LinearSystemSolver() {
        this(Eliminator.DEFAULT_TOLERANCE);
    }

    public LinearSystemSolver(double tolerance) {
        this.eliminator = new Eliminator(tolerance);
        this.analyzer = new StructureAnalyzer();
    }

    public double tolerance() { return eliminator.tolerance(); }

    /**
     * @throws InvalidDimensionsException if {@code A} and {@code b} disagree in row count
     * @throws SingularPivotException if a pivot cannot be divided by
     * @throws InconsistentSystemException if the system has no solution
     */
    public SolutionSet solveLinearSystem(Matrix a, Vector b) {
        return solveWithSteps(a, b).solution;
    }

    /** Like {@link #solveLinearSystem(Matrix, Vector)} but keeps every stage. */
    public SolveTrace solveWithSteps(Matrix a, Vector b) {
        return solveAugmented(Augmenter.augment(a, b));
    }

    /** Solves a system given directly as {@code [A | b]}. */
    public SolveTrace solveAugmented(AugmentedMatrix augmented) {
        log.debug("solving {}x{} system", augmented.rows(), augmented.coefficientColumns());
        try {
            AugmentedMatrix ref = eliminator.toRowEchelon(augmented);
            AugmentedMatrix rref = eliminator.toReducedRowEchelon(ref);
            analyzer.requireConsistent(rref);
            ColumnClassification classification = analyzer.classifyColumns(rref);
            SolutionSet solution = SolutionAssembler.assemble(rref, classification);
            log.debug("rank {}, {} free variable(s)", solution.rank(), solution.nullity());
            return new SolveTrace(augmented, ref, rref, classification, solution);
        } catch (LinearAlgebraException e) {
            log.warn("{}: {}", e.kind(), e.getMessage());
            throw e;
        }
    }

    /** Rank of {@code a}, the number of pivots left after row reduction. */
    public int rank(Matrix a) {
        if (a.rows() == 0 || a.cols() == 0) return 0;
        Matrix rref = eliminator.reduce(a);
        int rank = 0;
        for (int r = 0; r < rref.rows(); r++) {
            if (Eliminator.pivotColumn(rref, r, rref.cols()) >= 0) rank++;
        }
        return rank;
    }
}

package com.rowreduction;

/** Every intermediate value produced while solving one system. */
public final class SolveTrace {
    public final AugmentedMatrix augmented;
    public final AugmentedMatrix rowEchelon;
    public final AugmentedMatrix reducedRowEchelon;
    public final ColumnClassification classification;
    public final SolutionSet solution;

    SolveTrace(AugmentedMatrix augmented, AugmentedMatrix rowEchelon, AugmentedMatrix reducedRowEchelon,
               ColumnClassification classification, SolutionSet solution) {
        this.augmented = augmented;
        this.rowEchelon = rowEchelon;
        this.reducedRowEchelon = reducedRowEchelon;
        this.classification = classification;
        this.solution = solution;
    }
}

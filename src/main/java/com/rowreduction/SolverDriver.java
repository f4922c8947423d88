package com.rowreduction;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one command-line job: parse options, read the input file, dispatch
 * to the requested mode, print results and totals.
 *
 * <p>Exit codes: 0 success, 1 input could not be read, 2 bad arguments,
 * 3 the computation failed (the error kind and message go to stderr).
 */
public final class SolverDriver {

    static final int OK = 0;
    static final int IO_ERROR = 1;
    static final int USAGE_ERROR = 2;
    static final int MATH_ERROR = 3;

    public int run(String[] args, PrintWriter out, PrintWriter err) {
        try {
            return execute(args, out, err);
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int execute(String[] args, PrintWriter out, PrintWriter err) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(usage());
            err.println("Argument error: " + e.getMessage());
            return USAGE_ERROR;
        }

        final SolverOptions opts = parsed.options;
        final String inputPath = parsed.inputPath;
        final SolutionWriter w = new SolutionWriter(out, opts.precision);

        final Instant t0 = Instant.now();
        try {
            LinearSystemInput input = LinearSystemInput.readFromFile(inputPath);
            if (input.getName() != null) out.println(input.getName());

            if (opts.mode == SolverOptions.Mode.SOLVE && input.getType() != LinearSystemInput.Type.LINEAR_SYSTEM) {
                err.println("Argument error: " + inputPath + " holds a plain matrix; -solve needs a linear-system block");
                return USAGE_ERROR;
            }

            switch (opts.mode) {
                case SOLVE:
                    solve(input, opts, w, out);
                    break;
                case REF: {
                    Matrix ref = new Eliminator(opts.tolerance).toRowEchelon(input.getMatrix());
                    w.matrix("Row Echelon Form", ref);
                    break;
                }
                case RREF: {
                    Matrix rref = new Eliminator(opts.tolerance).reduce(input.getMatrix());
                    w.matrix("Reduced Row Echelon Form", rref);
                    break;
                }
                case QR: {
                    QrDecomposition qr = GramSchmidt.qrDecompose(input.getMatrix(), opts.tolerance);
                    w.matrix("Q", qr.q());
                    w.matrix("R", qr.r());
                    break;
                }
                case LU: {
                    LuDecomposition lu = LuDecomposition.decompose(input.getMatrix());
                    w.matrix("L", lu.l());
                    w.matrix("U", lu.u());
                    break;
                }
                case CHOLESKY:
                    w.matrix("L", Cholesky.decompose(input.getMatrix(), opts.tolerance));
                    break;
                case DET:
                    w.scalar("Determinant", Determinant.of(input.getMatrix()));
                    break;
                case INDEPENDENCE:
                    out.println(GramSchmidt.areColumnsLinearlyIndependent(input.getMatrix(), opts.tolerance)
                            ? "Columns are linearly independent."
                            : "Columns are linearly dependent.");
                    break;
                default:
                    throw new IllegalStateException("Unknown mode: " + opts.mode);
            }

            double secs = Duration.between(t0, Instant.now()).toMillis() / 1000.0;
            out.printf("*Time=%.3fs%n", secs);
            return OK;
        } catch (FileNotFoundException e) {
            err.println("File not found: " + inputPath);
            return IO_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return IO_ERROR;
        } catch (LinearAlgebraException e) {
            err.println("*" + e.kind() + ": " + e.getMessage());
            return MATH_ERROR;
        }
    }

    private static void solve(LinearSystemInput input, SolverOptions opts, SolutionWriter w, PrintWriter out) {
        LinearSystemSolver solver = new LinearSystemSolver(opts.tolerance);
        AugmentedMatrix augmented = input.toAugmented();
        if (opts.steps) w.matrix("Augmented Matrix", augmented.matrix());

        SolveTrace trace = solver.solveAugmented(augmented);
        if (opts.steps) {
            w.matrix("Row Echelon Form", trace.rowEchelon.matrix());
            w.matrix("Reduced Row Echelon Form", trace.reducedRowEchelon.matrix());
        }
        w.solution(trace.solution);
        out.println(SolveStats.of(trace));
    }

    static String usage() {
        return "Usage: rref-java [options] <input-file>\n" +
                "Modes:\n" +
                "  -solve          solve Ax = b given as [A | b]  [default]\n" +
                "  -ref            print the row echelon form\n" +
                "  -rref           print the reduced row echelon form\n" +
                "  -qr             Gram-Schmidt QR factorization\n" +
                "  -lu             LU factorization (symmetric positive definite input)\n" +
                "  -cholesky       Cholesky factorization\n" +
                "  -det            determinant by cofactor expansion\n" +
                "  -independence   test the columns for linear independence\n" +
                "Options:\n" +
                "  -tolerance x    relative cancellation tolerance (default 1e-10)\n" +
                "  -precision n    decimal places in output (default 4)\n" +
                "  -steps          also print augmented, REF and RREF matrices\n" +
                "  -verbose        debug logging on stderr\n";
    }
}

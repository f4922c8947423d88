package com.rowreduction;

public final class OptionsParser {

    public static final class Parsed {
        public final SolverOptions options;
        public final String inputPath;
        private Parsed(SolverOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        SolverOptions.Builder b = new SolverOptions.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-solve": b.mode(SolverOptions.Mode.SOLVE); break;
                case "-ref": b.mode(SolverOptions.Mode.REF); break;
                case "-rref": b.mode(SolverOptions.Mode.RREF); break;
                case "-qr": b.mode(SolverOptions.Mode.QR); break;
                case "-lu": b.mode(SolverOptions.Mode.LU); break;
                case "-cholesky": b.mode(SolverOptions.Mode.CHOLESKY); break;
                case "-det": b.mode(SolverOptions.Mode.DET); break;
                case "-independence": b.mode(SolverOptions.Mode.INDEPENDENCE); break;
                case "-steps": b.steps(true); break;
                case "-verbose": b.verbose(true); break;
                case "-tolerance": b.tolerance(Double.parseDouble(value(args, ++i, a))); break;
                case "-precision": b.precision(Integer.parseInt(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}

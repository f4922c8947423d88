package com.rowreduction;

import java.io.PrintWriter;

public class Main {

    public static void main(String[] args) {
        for (String a : args) {
            if (a.equals("-verbose")) {
                // read by slf4j-simple when the first logger is created
                System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            }
        }
        PrintWriter out = new PrintWriter(System.out, true);
        PrintWriter err = new PrintWriter(System.err, true);
        System.exit(new SolverDriver().run(args, out, err));
    }
}

package com.rowreduction;

/** Base class for every failure raised by the row-reduction pipeline and its peer kernels. */
public class LinearAlgebraException extends RuntimeException {

    public LinearAlgebraException(String message) {
        super(message);
    }

    /** Short machine-friendly name of the failure, printed by the CLI. */
    public String kind() {
        return "LinearAlgebraError";
    }
}

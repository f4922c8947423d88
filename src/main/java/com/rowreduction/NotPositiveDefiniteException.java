package com.rowreduction;

/** A factorization that requires a symmetric positive definite matrix was given something else. */
public final class NotPositiveDefiniteException extends LinearAlgebraException {

    public NotPositiveDefiniteException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "NotPositiveDefinite";
    }
}

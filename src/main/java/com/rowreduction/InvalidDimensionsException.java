package com.rowreduction;

/** Row or column counts of the arguments do not fit the operation. */
public final class InvalidDimensionsException extends LinearAlgebraException {

    public InvalidDimensionsException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "InvalidDimensions";
    }
}

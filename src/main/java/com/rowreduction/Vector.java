package com.rowreduction;

import java.util.Arrays;

/**
 * Immutable dense vector of {@code double} values, indexed from zero.
 * Used for right-hand sides, solutions and null-space basis elements.
 */
public final class Vector {
    private final double[] data;

    private Vector(double[] data) {
        this.data = data;
    }

    /** Copies {@code values}; every entry must be finite. */
    public static Vector of(double... values) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        double[] copy = Arrays.copyOf(values, values.length);
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new IllegalArgumentException("Non-finite entry " + copy[i] + " at index " + i);
            }
        }
        return new Vector(copy);
    }

    public static Vector zeros(int n) {
        if (n < 0) throw new InvalidDimensionsException("Negative length " + n);
        return new Vector(new double[n]);
    }

    /** Takes ownership of {@code values} without copying. */
    static Vector wrap(double[] values) {
        return new Vector(values);
    }

    public int length() { return data.length; }

    public double get(int i) { return data[i]; }

    public double[] toArray() { return Arrays.copyOf(data, data.length); }

    public double dot(Vector o) {
        requireSameLength(o);
        double sum = 0.0;
        for (int i = 0; i < data.length; i++) sum += data[i] * o.data[i];
        return sum;
    }

    public Vector add(Vector o) {
        requireSameLength(o);
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++) out[i] = data[i] + o.data[i];
        return new Vector(out);
    }

    public Vector subtract(Vector o) {
        requireSameLength(o);
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++) out[i] = data[i] - o.data[i];
        return new Vector(out);
    }

    public Vector scale(double k) {
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++) out[i] = data[i] * k;
        return new Vector(out);
    }

    /** Euclidean length. */
    public double norm() {
        return Math.sqrt(dot(this));
    }

    /** Unit vector in the same direction; the zero vector cannot be normalized. */
    public Vector normalize() {
        double len = norm();
        if (len == 0.0) throw new ArithmeticException("Cannot normalize the zero vector");
        return scale(1.0 / len);
    }

    public boolean isZero(double tolerance) {
        for (double v : data) if (Math.abs(v) > tolerance) return false;
        return true;
    }

    public boolean approximatelyEquals(Vector o, double tolerance) {
        if (o == null || o.data.length != data.length) return false;
        for (int i = 0; i < data.length; i++) {
            if (Math.abs(data[i] - o.data[i]) > tolerance) return false;
        }
        return true;
    }

    private void requireSameLength(Vector o) {
        if (o.data.length != data.length) {
            throw new InvalidDimensionsException(
                    "Vector lengths differ: " + data.length + " vs " + o.data.length);
        }
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vector)) return false;
        return Arrays.equals(data, ((Vector) obj).data);
    }

    @Override public int hashCode() { return Arrays.hashCode(data); }

    @Override public String toString() { return Arrays.toString(data); }
}

package com.ventture.credit.engine;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/** Immutable feature vector in model space. */
public final class NormalizedVector {

    private final double[] values;
    private final Set<Integer> degenerate;

    private NormalizedVector(double[] values, Set<Integer> degenerate) {
        this.values = values;
        this.degenerate = degenerate;
    }

    public static NormalizedVector of(double... values) {
        return new NormalizedVector(values.clone(), Set.of());
    }

    static NormalizedVector of(double[] values, Set<Integer> degenerate) {
        return new NormalizedVector(values.clone(), Set.copyOf(degenerate));
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    public boolean isDegenerate(int index) {
        return degenerate.contains(index);
    }

    /** Indices of features whose fitted scale was zero, ascending. */
    public Set<Integer> degenerateIndices() {
        return new TreeSet<>(degenerate);
    }

    /** Copy with one coordinate replaced. */
    public NormalizedVector with(int index, double value) {
        double[] copy = values.clone();
        copy[index] = value;
        return new NormalizedVector(copy, degenerate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedVector other)) return false;
        return Arrays.equals(values, other.values) && degenerate.equals(other.degenerate);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + degenerate.hashCode();
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}

package com.ttennebkram.ftmixer.model;

import java.util.Arrays;

/**
 * Per-slot weights for one spectrum component. Entries are non-negative.
 */
public final class WeightVector {

    /** Relative tolerance used when deciding whether two vectors are the same. */
    public static final double EQUALITY_TOLERANCE = 1e-9;

    private final double[] weights;

    private WeightVector(double[] weights) {
        this.weights = weights;
    }

    public static WeightVector of(double... weights) {
        if (weights == null) {
            throw new MixerException(MixerException.Kind.INVALID_WEIGHT, "Weights must not be null");
        }
        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                    "Weights must be non-negative, got " + w + " at index " + i);
            }
        }
        return new WeightVector(weights.clone());
    }

    public static WeightVector zeros(int size) {
        return new WeightVector(new double[size]);
    }

    public static WeightVector filled(int size, double value) {
        double[] values = new double[size];
        Arrays.fill(values, value);
        return of(values);
    }

    public int size() {
        return weights.length;
    }

    public double get(int index) {
        return weights[index];
    }

    public double sum() {
        double sum = 0;
        for (double w : weights) {
            sum += w;
        }
        return sum;
    }

    public double[] toArray() {
        return weights.clone();
    }

    /**
     * Element-wise comparison within {@link #EQUALITY_TOLERANCE}, relative to the larger entry.
     */
    public boolean approximatelyEquals(WeightVector other) {
        if (other == null || other.weights.length != weights.length) {
            return false;
        }
        for (int i = 0; i < weights.length; i++) {
            double a = weights[i];
            double b = other.weights[i];
            double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
            if (Math.abs(a - b) > EQUALITY_TOLERANCE * scale) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightVector)) return false;
        return Arrays.equals(weights, ((WeightVector) o).weights);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return Arrays.toString(weights);
    }
}

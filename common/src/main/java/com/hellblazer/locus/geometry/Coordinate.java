/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Luciferase.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.locus.geometry;

import java.util.Arrays;

/**
 * Immutable point in d-dimensional world space.
 * <p>
 * Equality is exact and only meant for hashing and tests. Vertex identity inside the locator is always decided with a
 * distance tolerance, never with {@link #equals(Object)}.
 *
 * @author hal.hildebrand
 */
public record Coordinate(double[] values) {

    /**
     * Compact constructor with validation and defensive copying.
     */
    public Coordinate {
        if (values == null) {
            throw new IllegalArgumentException("Coordinate values cannot be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("Coordinate must have at least one dimension");
        }
        values = values.clone();
    }

    public static Coordinate of(double... values) {
        return new Coordinate(values);
    }

    /**
     * Arithmetic mean of the given coordinates
     */
    public static Coordinate centroid(Coordinate... points) {
        if (points.length == 0) {
            throw new IllegalArgumentException("Centroid of an empty point set is undefined");
        }
        var sum = new double[points[0].dimensions()];
        for (var p : points) {
            points[0].checkSameDimensions(p);
            for (int i = 0; i < sum.length; i++) {
                sum[i] += p.values[i];
            }
        }
        for (int i = 0; i < sum.length; i++) {
            sum[i] /= points.length;
        }
        return new Coordinate(sum);
    }

    public int dimensions() {
        return values.length;
    }

    public double get(int dimension) {
        checkDimension(dimension);
        return values[dimension];
    }

    /**
     * @return a copy of the components
     */
    @Override
    public double[] values() {
        return values.clone();
    }

    public Coordinate add(Coordinate other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + other.values[i];
        }
        return new Coordinate(result);
    }

    public Coordinate subtract(Coordinate other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] - other.values[i];
        }
        return new Coordinate(result);
    }

    public Coordinate multiply(double scalar) {
        if (!Double.isFinite(scalar)) {
            throw new IllegalArgumentException("Scalar must be finite: " + scalar);
        }
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] * scalar;
        }
        return new Coordinate(result);
    }

    /**
     * Returns the Euclidean distance between this coordinate and the other coordinate.
     */
    public double distance(Coordinate other) {
        return Math.sqrt(distanceSquared(other));
    }

    /**
     * Returns the squared Euclidean distance (avoids square root computation).
     */
    public double distanceSquared(Coordinate other) {
        checkSameDimensions(other);
        double sumSquares = 0.0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sumSquares += diff * diff;
        }
        return sumSquares;
    }

    /**
     * Linear interpolation, t = 0 yields this coordinate and t = 1 the other one.
     */
    public Coordinate lerp(Coordinate other, double t) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + t * (other.values[i] - values[i]);
        }
        return new Coordinate(result);
    }

    public boolean isFinite() {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Coordinate" + Arrays.toString(values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Coordinate other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    void checkSameDimensions(Coordinate other) {
        if (values.length != other.values.length) {
            throw new IllegalArgumentException(
            String.format("Coordinates must have same dimensions: %d vs %d", values.length, other.values.length));
        }
    }

    private void checkDimension(int dimension) {
        if (dimension < 0 || dimension >= values.length) {
            throw new IllegalArgumentException(
            String.format("Dimension %d out of range [0, %d)", dimension, values.length));
        }
    }
}

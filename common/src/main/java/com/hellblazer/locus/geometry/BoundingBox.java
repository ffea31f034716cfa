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
 * Axis-aligned extent tracker in d dimensions. The box only ever grows: {@link #append(Coordinate)} widens the extent
 * to include a point and nothing shrinks it again.
 * <p>
 * A freshly created box is empty, its minimum is +&infin; and its maximum is -&infin; along every axis, so the first
 * append collapses it onto that point. Containment is inclusive on both ends.
 * <p>
 * Thread Safety: not thread-safe while it is being appended to. Boxes owned by a built locator are never mutated again
 * and may be read concurrently.
 *
 * @author hal.hildebrand
 */
public final class BoundingBox {

    private final double[] min;
    private final double[] max;

    /**
     * Create an empty box of the given dimension
     */
    public BoundingBox(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + dimensions);
        }
        min = new double[dimensions];
        max = new double[dimensions];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
    }

    private BoundingBox(double[] min, double[] max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Create a box spanning the two corners
     *
     * @throws IllegalArgumentException if the dimensions differ or min exceeds max along some axis
     */
    public static BoundingBox of(Coordinate min, Coordinate max) {
        min.checkSameDimensions(max);
        var lo = min.values();
        var hi = max.values();
        for (int i = 0; i < lo.length; i++) {
            if (lo[i] > hi[i]) {
                throw new IllegalArgumentException(
                String.format("Min %f > max %f at dimension %d", lo[i], hi[i], i));
            }
        }
        return new BoundingBox(lo, hi);
    }

    /**
     * Smallest box holding all the given coordinates
     */
    public static BoundingBox enclosing(int dimensions, Iterable<Coordinate> points) {
        var box = new BoundingBox(dimensions);
        for (var p : points) {
            box.append(p);
        }
        return box;
    }

    /**
     * Extend the box so that it contains the coordinate. Appending a contained coordinate changes nothing.
     *
     * @return this box
     */
    public BoundingBox append(Coordinate coordinate) {
        checkDimensions(coordinate);
        for (int i = 0; i < min.length; i++) {
            double v = coordinate.get(i);
            if (v < min[i]) {
                min[i] = v;
            }
            if (v > max[i]) {
                max[i] = v;
            }
        }
        return this;
    }

    /**
     * Inclusive point containment. An empty box contains nothing.
     */
    public boolean contains(Coordinate coordinate) {
        checkDimensions(coordinate);
        for (int i = 0; i < min.length; i++) {
            double v = coordinate.get(i);
            if (!(v >= min[i] && v <= max[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Inclusive box containment. Every box contains an empty box.
     */
    public boolean contains(BoundingBox other) {
        if (other.min.length != min.length) {
            throw new IllegalArgumentException(
            String.format("Box dimensions %d != %d", other.min.length, min.length));
        }
        if (other.isEmpty()) {
            return true;
        }
        for (int i = 0; i < min.length; i++) {
            if (other.min[i] < min[i] || other.max[i] > max[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sub-box obtained by bisecting every axis. Bit {@code d} of the child index selects the upper half along axis
     * {@code d}. Both halves include the midpoint.
     */
    public BoundingBox child(int index) {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot bisect an empty box");
        }
        if (index < 0 || index >= childCount()) {
            throw new IllegalArgumentException("Child index must be in [0, " + childCount() + "): " + index);
        }
        var lo = new double[min.length];
        var hi = new double[min.length];
        for (int d = 0; d < min.length; d++) {
            double mid = midpoint(d);
            if ((index & (1 << d)) == 0) {
                lo[d] = min[d];
                hi[d] = mid;
            } else {
                lo[d] = mid;
                hi[d] = max[d];
            }
        }
        return new BoundingBox(lo, hi);
    }

    /**
     * Index of the bisection child claiming the coordinate: along every axis a value equal to the midpoint belongs to
     * the lower half, which makes this the lowest-indexed child whose box contains the coordinate.
     */
    public int childIndexOf(Coordinate coordinate) {
        checkDimensions(coordinate);
        int index = 0;
        for (int d = 0; d < min.length; d++) {
            if (coordinate.get(d) > midpoint(d)) {
                index |= 1 << d;
            }
        }
        return index;
    }

    public int childCount() {
        return 1 << min.length;
    }

    public int dimensions() {
        return min.length;
    }

    public boolean isEmpty() {
        for (int i = 0; i < min.length; i++) {
            if (min[i] > max[i]) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the minimum corner, components are +&infin; while the box is empty
     */
    public Coordinate min() {
        return new Coordinate(min);
    }

    /**
     * @return the maximum corner, components are -&infin; while the box is empty
     */
    public Coordinate max() {
        return new Coordinate(max);
    }

    public double min(int axis) {
        return min[axis];
    }

    public double max(int axis) {
        return max[axis];
    }

    public double extent(int axis) {
        return isEmpty() ? 0.0 : max[axis] - min[axis];
    }

    public Coordinate center() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty box has no center");
        }
        var c = new double[min.length];
        for (int i = 0; i < c.length; i++) {
            c[i] = midpoint(i);
        }
        return new Coordinate(c);
    }

    /**
     * Length of the box diagonal, 0 for an empty or single point box. The extents are scaled by the largest one before
     * squaring, so the result only overflows when an extent itself does.
     */
    public double diagonal() {
        if (isEmpty()) {
            return 0.0;
        }
        double largest = 0.0;
        for (int i = 0; i < min.length; i++) {
            largest = Math.max(largest, max[i] - min[i]);
        }
        if (largest == 0.0 || Double.isInfinite(largest)) {
            return largest;
        }
        double sum = 0.0;
        for (int i = 0; i < min.length; i++) {
            double e = (max[i] - min[i]) / largest;
            sum += e * e;
        }
        return largest * Math.sqrt(sum);
    }

    public BoundingBox copy() {
        return new BoundingBox(min.clone(), max.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox that)) return false;
        return Arrays.equals(min, that.min) && Arrays.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
    }

    @Override
    public String toString() {
        return "BoundingBox[min=" + Arrays.toString(min) + ", max=" + Arrays.toString(max) + "]";
    }

    private double midpoint(int axis) {
        return min[axis] + 0.5 * (max[axis] - min[axis]);
    }

    private void checkDimensions(Coordinate coordinate) {
        if (coordinate.dimensions() != min.length) {
            throw new IllegalArgumentException(
            String.format("Coordinate dimensions %d != box dimensions %d", coordinate.dimensions(), min.length));
        }
    }
}

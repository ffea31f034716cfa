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
package com.hellblazer.locus.tree;

import com.hellblazer.locus.geometry.BoundingBox;

import java.util.Locale;

/**
 * Configuration of a {@link MeshLocator}: the leaf split policy, the vertex identity tolerance and the point location
 * behavior. The locator copies its configuration when it is created, later changes to this object have no effect on
 * it.
 *
 * @author hal.hildebrand
 */
public class LocatorConfig {

    /**
     * Ten machine epsilons
     */
    public static final double DEFAULT_TOLERANCE_FACTOR = 10.0 * Math.ulp(1.0);

    /**
     * How the vertex identity tolerance relates to the mesh
     */
    public enum ToleranceMode {
        /**
         * The tolerance factor is used as an absolute distance
         */
        ABSOLUTE,
        /**
         * The tolerance factor is multiplied by the diagonal of the domain box
         */
        SCALE_RELATIVE
    }

    private int           leafCapacity    = 10;
    private int           maxDepth        = 21;
    private ToleranceMode toleranceMode   = ToleranceMode.SCALE_RELATIVE;
    private double        toleranceFactor = DEFAULT_TOLERANCE_FACTOR;
    private double        insideTolerance = 1.0e-8;
    private boolean       widenSearch     = true;

    /**
     * Scale-relative identity tolerance, search widening on
     */
    public static LocatorConfig defaults() {
        return new LocatorConfig();
    }

    /**
     * Absolute identity tolerance and leaf-only candidate search
     */
    public static LocatorConfig reference() {
        return new LocatorConfig().withToleranceMode(ToleranceMode.ABSOLUTE).withWidenSearch(false);
    }

    /**
     * Small leaves for meshes queried far more often than they are rebuilt
     */
    public static LocatorConfig fineGrained() {
        return new LocatorConfig().withLeafCapacity(4);
    }

    /**
     * Maximum number of vertices a node holds before it is split
     */
    public int getLeafCapacity() {
        return leafCapacity;
    }

    /**
     * Depth at which nodes become leaves regardless of their population
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public ToleranceMode getToleranceMode() {
        return toleranceMode;
    }

    public double getToleranceFactor() {
        return toleranceFactor;
    }

    /**
     * Slack of the reference element membership test, in local coordinates
     */
    public double getInsideTolerance() {
        return insideTolerance;
    }

    /**
     * Whether point location moves up the tree when no candidate of the reached leaf contains the point
     */
    public boolean isWidenSearch() {
        return widenSearch;
    }

    /**
     * The identity tolerance for a mesh spanning the given box. A scale-relative tolerance falls back to the bare
     * factor when the box has no extent and is capped at {@link Double#MAX_VALUE} when the product overflows.
     */
    public double toleranceFor(BoundingBox domain) {
        if (toleranceMode == ToleranceMode.ABSOLUTE) {
            return toleranceFactor;
        }
        double diagonal = domain.diagonal();
        return diagonal > 0.0 ? Math.min(toleranceFactor * diagonal, Double.MAX_VALUE) : toleranceFactor;
    }

    public LocatorConfig withLeafCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Leaf capacity must be positive");
        }
        this.leafCapacity = capacity;
        return this;
    }

    public LocatorConfig withMaxDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Max depth cannot be negative");
        }
        this.maxDepth = depth;
        return this;
    }

    public LocatorConfig withToleranceMode(ToleranceMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Tolerance mode cannot be null");
        }
        this.toleranceMode = mode;
        return this;
    }

    public LocatorConfig withToleranceFactor(double factor) {
        if (!(factor >= 0.0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Tolerance factor must be finite and non-negative: " + factor);
        }
        this.toleranceFactor = factor;
        return this;
    }

    public LocatorConfig withInsideTolerance(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Inside tolerance must be finite and non-negative: " + tolerance);
        }
        this.insideTolerance = tolerance;
        return this;
    }

    public LocatorConfig withWidenSearch(boolean widen) {
        this.widenSearch = widen;
        return this;
    }

    public LocatorConfig copy() {
        return new LocatorConfig().withLeafCapacity(leafCapacity)
                                  .withMaxDepth(maxDepth)
                                  .withToleranceMode(toleranceMode)
                                  .withToleranceFactor(toleranceFactor)
                                  .withInsideTolerance(insideTolerance)
                                  .withWidenSearch(widenSearch);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
        "LocatorConfig[leafCapacity=%d, maxDepth=%d, toleranceMode=%s, toleranceFactor=%g, insideTolerance=%g, widenSearch=%s]",
        leafCapacity, maxDepth, toleranceMode, toleranceFactor, insideTolerance, widenSearch);
    }
}

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
package com.hellblazer.locus.mesh;

import com.hellblazer.locus.geometry.BoundingBox;
import com.hellblazer.locus.geometry.Coordinate;

import java.util.Objects;

/**
 * Axis-aligned quadrilateral, hexahedron or hypercube cell. Corners are enumerated in lexicographic order: bit
 * {@code d} of the corner number selects the upper bound along axis {@code d}.
 *
 * @param <S> the seed type
 * @author hal.hildebrand
 */
public final class BoxElement<S> implements MeshElement<S> {

    private final S           seed;
    private final BoundingBox box;

    public BoxElement(S seed, Coordinate min, Coordinate max) {
        this.seed = Objects.requireNonNull(seed, "Seed cannot be null");
        this.box = BoundingBox.of(min, max);
        for (int d = 0; d < box.dimensions(); d++) {
            if (box.extent(d) <= 0.0) {
                throw new IllegalArgumentException("Degenerate box element along axis " + d + ": " + box);
            }
        }
    }

    @Override
    public S seed() {
        return seed;
    }

    @Override
    public int cornerCount() {
        return 1 << box.dimensions();
    }

    @Override
    public Coordinate corner(int k) {
        if (k < 0 || k >= cornerCount()) {
            throw new IllegalArgumentException("Corner must be in [0, " + cornerCount() + "): " + k);
        }
        var c = new double[box.dimensions()];
        for (int d = 0; d < c.length; d++) {
            c[d] = (k & (1 << d)) == 0 ? box.min(d) : box.max(d);
        }
        return new Coordinate(c);
    }

    @Override
    public ReferenceElement referenceElement() {
        return ReferenceElement.CUBE;
    }

    @Override
    public Coordinate local(Coordinate global) {
        if (global.dimensions() != box.dimensions()) {
            throw new IllegalArgumentException(
            String.format("Point dimensions %d != element dimensions %d", global.dimensions(), box.dimensions()));
        }
        var l = new double[box.dimensions()];
        for (int d = 0; d < l.length; d++) {
            l[d] = (global.get(d) - box.min(d)) / box.extent(d);
        }
        return new Coordinate(l);
    }

    @Override
    public String toString() {
        return "BoxElement[" + seed + ", " + box + "]";
    }
}

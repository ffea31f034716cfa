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

import com.hellblazer.locus.geometry.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory mesh. Elements are enumerated in insertion order and identified by {@link ElementSeed}s; removing an
 * element compacts the element list but leaves every other seed resolvable.
 * <p>
 * Thread Safety: not thread-safe for mutation. Concurrent readers are fine once the mesh is no longer modified.
 *
 * @author hal.hildebrand
 */
public class ListMesh implements Mesh<ElementSeed> {

    private final int                                         dimension;
    private final List<MeshElement<ElementSeed>>              elements = new ArrayList<>();
    private final Map<ElementSeed, MeshElement<ElementSeed>>  bySeed   = new HashMap<>();
    private final SeedGenerator                               seeds;

    public ListMesh(int dimension) {
        this(dimension, new SeedGenerator());
    }

    public ListMesh(int dimension, SeedGenerator seeds) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.seeds = seeds;
    }

    /**
     * Add a simplex with {@code dimension + 1} corners
     */
    public ElementSeed addSimplex(Coordinate... corners) {
        checkDimensions(corners);
        var seed = seeds.next();
        add(new SimplexElement<>(seed, corners));
        return seed;
    }

    /**
     * Add an axis-aligned box cell
     */
    public ElementSeed addBox(Coordinate min, Coordinate max) {
        checkDimensions(min, max);
        var seed = seeds.next();
        add(new BoxElement<>(seed, min, max));
        return seed;
    }

    /**
     * @return true if the element was present
     */
    public boolean remove(ElementSeed seed) {
        var element = bySeed.remove(seed);
        if (element == null) {
            return false;
        }
        elements.remove(element);
        return true;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<MeshElement<ElementSeed>> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public MeshElement<ElementSeed> resolve(ElementSeed seed) {
        var element = bySeed.get(seed);
        if (element == null) {
            throw new IllegalArgumentException("Unknown element seed: " + seed);
        }
        return element;
    }

    public int size() {
        return elements.size();
    }

    private void add(MeshElement<ElementSeed> element) {
        elements.add(element);
        bySeed.put(element.seed(), element);
    }

    private void checkDimensions(Coordinate... corners) {
        for (var c : corners) {
            if (c.dimensions() != dimension) {
                throw new IllegalArgumentException(
                String.format("Corner dimensions %d != mesh dimension %d", c.dimensions(), dimension));
            }
        }
    }
}

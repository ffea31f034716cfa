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

import com.hellblazer.locus.common.IntArrayList;
import com.hellblazer.locus.geometry.BoundingBox;
import com.hellblazer.locus.geometry.Coordinate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves corner coordinates to canonical vertices. Two coordinates denote the same vertex when they coincide or
 * their distance is below the tolerance; the first registered vertex within tolerance wins.
 * <p>
 * Candidates are looked up in a uniform hash grid whose cells are at least one tolerance wide, so a lookup only visits
 * the 3^d cells around the query. Every new vertex is appended to the domain box.
 * <p>
 * Thread Safety: single-threaded, used only while a locator is being built.
 *
 * @author hal.hildebrand
 */
public class VertexRegistry {

    // Grid resolution floor relative to the mesh extent, keeps cell indices well inside a long
    private static final double MIN_RELATIVE_CELL = 0x1.0p-40;

    private final int                         dimension;
    private final double                      tolerance;
    private final double                      cellSize;
    private final double[]                    origin;
    private final BoundingBox                 domain;
    private final List<Vertex>                vertices = new ArrayList<>();
    private final Map<CellKey, IntArrayList>  grid     = new HashMap<>();
    private       int                         registrations;

    /**
     * @param scale     box enclosing every coordinate that will be registered, sets the grid resolution
     * @param tolerance non-negative identity tolerance
     */
    public VertexRegistry(BoundingBox scale, double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be finite and non-negative: " + tolerance);
        }
        this.dimension = scale.dimensions();
        this.tolerance = tolerance;
        this.domain = new BoundingBox(dimension);
        var cell = Math.max(tolerance, scale.diagonal() * MIN_RELATIVE_CELL);
        this.cellSize = cell > 0.0 ? cell : 1.0;
        this.origin = scale.isEmpty() ? new double[dimension] : scale.min().values();
    }

    /**
     * Register one corner of an element
     *
     * @param coordinate   the corner position
     * @param elementIndex element-arena index of the element owning the corner
     * @return the canonical vertex, existing or new
     */
    public Vertex registerCorner(Coordinate coordinate, int elementIndex) {
        if (coordinate.dimensions() != dimension) {
            throw new IllegalArgumentException(
            String.format("Corner dimensions %d != registry dimensions %d", coordinate.dimensions(), dimension));
        }
        if (!coordinate.isFinite()) {
            throw new IllegalArgumentException("Corner coordinate is not finite: " + coordinate);
        }
        registrations++;
        var key = cellOf(coordinate);
        var vertex = findMatch(coordinate, key);
        if (vertex == null) {
            vertex = new Vertex(vertices.size(), coordinate);
            vertices.add(vertex);
            grid.computeIfAbsent(new CellKey(key), k -> new IntArrayList()).addInt(vertex.index());
            domain.append(coordinate);
        }
        vertex.addIncident(elementIndex);
        return vertex;
    }

    /**
     * Box of all canonical vertex positions
     */
    public BoundingBox domain() {
        return domain;
    }

    public double tolerance() {
        return tolerance;
    }

    /**
     * Number of corners registered so far, duplicates included
     */
    public int registrations() {
        return registrations;
    }

    public int size() {
        return vertices.size();
    }

    /**
     * The canonical vertices in creation order, frozen against further incidence changes
     */
    List<Vertex> freeze() {
        vertices.forEach(Vertex::freeze);
        grid.clear();
        return Collections.unmodifiableList(new ArrayList<>(vertices));
    }

    private Vertex findMatch(Coordinate coordinate, long[] key) {
        double tol2 = tolerance * tolerance;
        var best = -1;
        var neighbor = new long[dimension];
        int combinations = 1;
        for (int d = 0; d < dimension; d++) {
            combinations *= 3;
        }
        for (int n = 0; n < combinations; n++) {
            int rest = n;
            for (int d = 0; d < dimension; d++) {
                neighbor[d] = key[d] + (rest % 3) - 1;
                rest /= 3;
            }
            var bucket = grid.get(new CellKey(neighbor));
            if (bucket == null) {
                continue;
            }
            for (int i = 0; i < bucket.size(); i++) {
                int candidate = bucket.getInt(i);
                if (best != -1 && candidate >= best) {
                    continue;
                }
                double d2 = vertices.get(candidate).global().distanceSquared(coordinate);
                if (d2 == 0.0 || d2 < tol2) {
                    best = candidate;
                }
            }
        }
        return best == -1 ? null : vertices.get(best);
    }

    private long[] cellOf(Coordinate coordinate) {
        var key = new long[dimension];
        for (int d = 0; d < dimension; d++) {
            key[d] = (long) Math.floor((coordinate.get(d) - origin[d]) / cellSize);
        }
        return key;
    }

    private static final class CellKey {
        private final long[] cell;
        private final int    hash;

        CellKey(long[] cell) {
            this.cell = cell.clone();
            this.hash = Arrays.hashCode(this.cell);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CellKey that)) return false;
            return Arrays.equals(cell, that.cell);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}

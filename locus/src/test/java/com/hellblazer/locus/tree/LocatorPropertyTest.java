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
import com.hellblazer.locus.geometry.Coordinate;
import com.hellblazer.locus.mesh.StructuredMeshes;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocatorPropertyTest {

    @Property
    @Label("Registering a corner again returns the same vertex")
    void registrationIsIdempotent(@ForAll @Size(min = 1, max = 40) List<@From("points2D") Coordinate> points) {
        var scale = BoundingBox.enclosing(2, points);
        var registry = new VertexRegistry(scale, LocatorConfig.defaults().toleranceFor(scale));
        var first = new Vertex[points.size()];
        for (int i = 0; i < points.size(); i++) {
            first[i] = registry.registerCorner(points.get(i), i);
        }
        int size = registry.size();
        for (int i = 0; i < points.size(); i++) {
            assertSame(first[i], registry.registerCorner(points.get(i), i));
        }
        assertEquals(size, registry.size());
        assertTrue(scale.contains(registry.domain()));
    }

    @Property(tries = 50)
    @Label("Triangulated rectangles deduplicate to their lattice and partition it over the leaves")
    void latticeIsPartitioned(@ForAll @IntRange(min = 1, max = 8) int nx, @ForAll @IntRange(min = 1, max = 8) int ny,
                              @ForAll @IntRange(min = 1, max = 12) int capacity) {
        var mesh = StructuredMeshes.triangulatedRectangle(nx, ny, Coordinate.of(-1, 2), Coordinate.of(3, 5));
        var locator = MeshLocator.of(mesh, LocatorConfig.defaults().withLeafCapacity(capacity));

        assertEquals((nx + 1) * (ny + 1), locator.vertexCount());
        var held = new BitSet(locator.vertexCount());
        int total = 0;
        for (var leaf : locator.leafView()) {
            for (var vertex : leaf.vertices()) {
                held.set(vertex.index());
                total++;
            }
        }
        assertEquals(locator.vertexCount(), total);
        assertEquals(locator.vertexCount(), held.cardinality());
        assertEquals(total, locator.treeStats().vertexCount());
    }

    @Property(tries = 50)
    @Label("Every element centroid locates its own element")
    void centroidRoundTrip(@ForAll @IntRange(min = 1, max = 6) int nx, @ForAll @IntRange(min = 1, max = 6) int ny,
                           @ForAll @IntRange(min = 1, max = 12) int capacity) throws LocatorException {
        var mesh = StructuredMeshes.triangulatedRectangle(nx, ny, Coordinate.of(0, 0), Coordinate.of(1, 1));
        var locator = MeshLocator.of(mesh, LocatorConfig.defaults().withLeafCapacity(capacity));
        for (var element : mesh.elements()) {
            assertEquals(element.seed(), locator.findEntity(element.centroid()));
        }
    }

    @Property
    @Label("Points inside a box grid are located in a containing cell")
    void boxGridCovers(@ForAll @DoubleRange(min = 0.0, max = 6.0) double x,
                       @ForAll @DoubleRange(min = 0.0, max = 4.0) double y) throws LocatorException {
        var mesh = StructuredMeshes.boxGrid(new int[] { 6, 4 }, Coordinate.of(0, 0), Coordinate.of(6, 4));
        var locator = MeshLocator.of(mesh, LocatorConfig.fineGrained());
        var point = Coordinate.of(x, y);
        var seed = locator.findEntity(point);
        assertTrue(mesh.resolve(seed).checkInside(point, locator.config().getInsideTolerance()));
    }

    @Provide
    Arbitrary<Coordinate> points2D() {
        return Arbitraries.doubles().between(-100.0, 100.0).array(double[].class).ofSize(2).map(Coordinate::new);
    }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundingBox Tests")
class BoundingBoxTest {

    @Nested
    @DisplayName("Empty box")
    class EmptyBoxTests {

        @Test
        @DisplayName("New box is empty with sentinel extent")
        void newBoxIsEmpty() {
            var box = new BoundingBox(3);

            assertTrue(box.isEmpty());
            assertEquals(Double.POSITIVE_INFINITY, box.min(0));
            assertEquals(Double.NEGATIVE_INFINITY, box.max(2));
            assertEquals(0.0, box.diagonal());
            assertFalse(box.contains(Coordinate.of(0, 0, 0)));
        }

        @Test
        @DisplayName("Reject non-positive dimension")
        void rejectNonPositiveDimension() {
            assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0));
        }

        @Test
        @DisplayName("Empty box cannot be bisected")
        void emptyBoxCannotBeBisected() {
            assertThrows(IllegalStateException.class, () -> new BoundingBox(2).child(0));
        }
    }

    @Nested
    @DisplayName("Growth")
    class GrowthTests {

        @Test
        @DisplayName("First append collapses onto the point")
        void firstAppend() {
            var box = new BoundingBox(2).append(Coordinate.of(1.5, -2.0));

            assertFalse(box.isEmpty());
            assertEquals(Coordinate.of(1.5, -2.0), box.min());
            assertEquals(Coordinate.of(1.5, -2.0), box.max());
            assertTrue(box.contains(Coordinate.of(1.5, -2.0)));
        }

        @Test
        @DisplayName("Append grows monotonically and is idempotent for contained points")
        void appendGrowsMonotonically() {
            var box = new BoundingBox(2);
            box.append(Coordinate.of(0, 0)).append(Coordinate.of(2, 1));
            var before = box.copy();

            box.append(Coordinate.of(1, 0.5));
            assertEquals(before, box);

            box.append(Coordinate.of(-1, 3));
            assertEquals(Coordinate.of(-1, 0), box.min());
            assertEquals(Coordinate.of(2, 3), box.max());
            assertTrue(box.contains(before));
        }

        @Test
        @DisplayName("Enclosing box of a point set")
        void enclosing() {
            var box = BoundingBox.enclosing(2, List.of(Coordinate.of(1, 3), Coordinate.of(0, 2),
                                                       Coordinate.of(2, 1)));

            assertEquals(Coordinate.of(0, 1), box.min());
            assertEquals(Coordinate.of(2, 3), box.max());
        }

        @Test
        @DisplayName("Reject mismatched dimensions")
        void rejectMismatchedDimensions() {
            var box = new BoundingBox(2);
            assertThrows(IllegalArgumentException.class, () -> box.append(Coordinate.of(1, 2, 3)));
        }
    }

    @Nested
    @DisplayName("Containment")
    class ContainmentTests {

        @Test
        @DisplayName("Bounds are inclusive")
        void inclusiveBounds() {
            var box = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(1, 1));

            assertTrue(box.contains(Coordinate.of(0, 0)));
            assertTrue(box.contains(Coordinate.of(1, 1)));
            assertTrue(box.contains(Coordinate.of(1, 0.5)));
            assertFalse(box.contains(Coordinate.of(1.0000001, 0.5)));
            assertFalse(box.contains(Coordinate.of(Double.NaN, 0.5)));
        }

        @Test
        @DisplayName("Reject inverted corners")
        void rejectInvertedCorners() {
            assertThrows(IllegalArgumentException.class,
                         () -> BoundingBox.of(Coordinate.of(2, 0), Coordinate.of(1, 1)));
        }
    }

    @Nested
    @DisplayName("Bisection")
    class BisectionTests {

        @Test
        @DisplayName("Children partition the box")
        void childrenPartitionTheBox() {
            var box = BoundingBox.of(Coordinate.of(0, 0, 0), Coordinate.of(2, 4, 8));

            assertEquals(8, box.childCount());
            for (int i = 0; i < box.childCount(); i++) {
                var child = box.child(i);
                assertTrue(box.contains(child));
                assertEquals(1.0, child.extent(0));
                assertEquals(2.0, child.extent(1));
                assertEquals(4.0, child.extent(2));
            }
            assertEquals(Coordinate.of(1, 0, 4), box.child(5).min());
        }

        @Test
        @DisplayName("Midpoint belongs to the lower half")
        void midpointBelongsToLowerHalf() {
            var box = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(2, 2));

            assertEquals(0, box.childIndexOf(Coordinate.of(1, 1)));
            assertEquals(1, box.childIndexOf(Coordinate.of(1.5, 1)));
            assertEquals(2, box.childIndexOf(Coordinate.of(1, 1.5)));
            assertEquals(3, box.childIndexOf(Coordinate.of(2, 2)));
            assertTrue(box.child(0).contains(Coordinate.of(1, 1)));
        }

        @Test
        @DisplayName("Claimed child always contains the coordinate")
        void claimedChildContainsCoordinate() {
            var box = BoundingBox.of(Coordinate.of(-1, 3), Coordinate.of(5, 4));
            var random = new java.util.Random(42L);
            for (int n = 0; n < 1000; n++) {
                var p = Coordinate.of(-1 + 6 * random.nextDouble(), 3 + random.nextDouble());
                assertTrue(box.child(box.childIndexOf(p)).contains(p), p.toString());
            }
        }
    }

    @Test
    @DisplayName("Center and diagonal")
    void centerAndDiagonal() {
        var box = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(3, 4));

        assertEquals(Coordinate.of(1.5, 2), box.center());
        assertEquals(5.0, box.diagonal(), 1e-12);
    }

    @Test
    @DisplayName("Diagonal of huge extents does not overflow")
    void hugeDiagonal() {
        var box = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(3e200, 4e200));
        assertEquals(5e200, box.diagonal(), 1e188);

        var unbounded = BoundingBox.of(Coordinate.of(-Double.MAX_VALUE, 0), Coordinate.of(Double.MAX_VALUE, 1));
        assertEquals(Double.POSITIVE_INFINITY, unbounded.diagonal());
    }
}

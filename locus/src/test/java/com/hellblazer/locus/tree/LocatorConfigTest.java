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
import com.hellblazer.locus.tree.LocatorConfig.ToleranceMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorConfigTest {

    @Test
    void testDefaults() {
        var config = LocatorConfig.defaults();
        assertEquals(10, config.getLeafCapacity());
        assertEquals(21, config.getMaxDepth());
        assertEquals(ToleranceMode.SCALE_RELATIVE, config.getToleranceMode());
        assertEquals(10.0 * Math.ulp(1.0), config.getToleranceFactor());
        assertEquals(1.0e-8, config.getInsideTolerance());
        assertTrue(config.isWidenSearch());
    }

    @Test
    void testPresets() {
        var reference = LocatorConfig.reference();
        assertEquals(ToleranceMode.ABSOLUTE, reference.getToleranceMode());
        assertFalse(reference.isWidenSearch());

        assertEquals(4, LocatorConfig.fineGrained().getLeafCapacity());
    }

    @Test
    void testToleranceFor() {
        var box = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(3, 4));
        var point = BoundingBox.of(Coordinate.of(1, 1), Coordinate.of(1, 1));

        var relative = LocatorConfig.defaults().withToleranceFactor(1e-3);
        assertEquals(5e-3, relative.toleranceFor(box), 1e-15);
        assertEquals(1e-3, relative.toleranceFor(point));
        assertEquals(1e-3, relative.toleranceFor(new BoundingBox(2)));

        var absolute = LocatorConfig.defaults().withToleranceMode(ToleranceMode.ABSOLUTE).withToleranceFactor(1e-3);
        assertEquals(1e-3, absolute.toleranceFor(box));
    }

    @Test
    void testToleranceForHugeDomain() {
        var huge = BoundingBox.of(Coordinate.of(0, 0), Coordinate.of(1e200, 1e200));
        var tolerance = LocatorConfig.defaults().toleranceFor(huge);
        assertTrue(Double.isFinite(tolerance));
        assertEquals(LocatorConfig.DEFAULT_TOLERANCE_FACTOR * Math.sqrt(2.0) * 1e200, tolerance, 1e172);

        var unbounded = BoundingBox.of(Coordinate.of(-Double.MAX_VALUE, 0), Coordinate.of(Double.MAX_VALUE, 1));
        assertEquals(Double.MAX_VALUE, LocatorConfig.defaults().withToleranceFactor(2.0).toleranceFor(unbounded));
    }

    @Test
    void testValidation() {
        var config = LocatorConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.withLeafCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withToleranceMode(null));
        assertThrows(IllegalArgumentException.class, () -> config.withToleranceFactor(-1e-9));
        assertThrows(IllegalArgumentException.class, () -> config.withToleranceFactor(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> config.withInsideTolerance(Double.POSITIVE_INFINITY));

        assertEquals(10, config.getLeafCapacity());
        assertEquals(0, config.withMaxDepth(0).getMaxDepth());
    }

    @Test
    void testCopyIsIndependent() {
        var original = LocatorConfig.defaults().withLeafCapacity(3).withWidenSearch(false);
        var copy = original.copy();
        original.withLeafCapacity(7);

        assertEquals(3, copy.getLeafCapacity());
        assertFalse(copy.isWidenSearch());
        assertTrue(copy.toString().contains("leafCapacity=3"));
    }
}

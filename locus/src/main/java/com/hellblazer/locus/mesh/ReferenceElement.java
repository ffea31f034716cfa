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

/**
 * Reference elements in local coordinates. Membership tests are inclusive, the tolerance widens the element by that
 * amount in local units so that points on shared faces pass for every element touching the face.
 *
 * @author hal.hildebrand
 */
public enum ReferenceElement {
    /**
     * Unit simplex: every local coordinate is non-negative and their sum is at most one.
     */
    SIMPLEX {
        @Override
        public boolean checkInside(Coordinate local, double tolerance) {
            double sum = 0.0;
            for (int i = 0; i < local.dimensions(); i++) {
                double l = local.get(i);
                if (l < -tolerance) {
                    return false;
                }
                sum += l;
            }
            return sum <= 1.0 + tolerance;
        }
    },
    /**
     * Unit hypercube [0,1]^d.
     */
    CUBE {
        @Override
        public boolean checkInside(Coordinate local, double tolerance) {
            for (int i = 0; i < local.dimensions(); i++) {
                double l = local.get(i);
                if (l < -tolerance || l > 1.0 + tolerance) {
                    return false;
                }
            }
            return true;
        }
    };

    /**
     * @param local     point in the local coordinates of this reference element
     * @param tolerance non-negative slack in local units
     */
    public abstract boolean checkInside(Coordinate local, double tolerance);
}

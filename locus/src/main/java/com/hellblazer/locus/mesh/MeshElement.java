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
 * A mesh cell as seen by the locator: its corners in world space, a seed that survives rebinding, and the geometric
 * map into its reference element.
 *
 * @param <S> the seed type of the mesh
 * @author hal.hildebrand
 */
public interface MeshElement<S> {

    S seed();

    int cornerCount();

    /**
     * @param k corner number in [0, cornerCount())
     */
    Coordinate corner(int k);

    ReferenceElement referenceElement();

    /**
     * Map a world-space point into the local coordinates of the reference element
     */
    Coordinate local(Coordinate global);

    /**
     * Inclusive point-in-element test through the reference element
     */
    default boolean checkInside(Coordinate global, double tolerance) {
        return referenceElement().checkInside(local(global), tolerance);
    }

    default Coordinate centroid() {
        var corners = new Coordinate[cornerCount()];
        for (int k = 0; k < corners.length; k++) {
            corners[k] = corner(k);
        }
        return Coordinate.centroid(corners);
    }
}

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

import com.hellblazer.locus.geometry.Coordinate;

/**
 * The query coordinate lies inside the domain box but no candidate element contains it, either because the mesh does
 * not cover the point or because rounding placed it just outside every candidate at a shared boundary.
 *
 * @author hal.hildebrand
 */
public final class PointNotFoundException extends LocatorException {

    private final int candidatesTested;

    public PointNotFoundException(Coordinate coordinate, int candidatesTested) {
        super("No element contains " + coordinate + " (" + candidatesTested + " candidates tested)", coordinate);
        this.candidatesTested = candidatesTested;
    }

    public int getCandidatesTested() {
        return candidatesTested;
    }
}

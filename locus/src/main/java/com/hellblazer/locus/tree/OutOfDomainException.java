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

/**
 * The query coordinate lies outside the bounding box of the indexed mesh.
 *
 * @author hal.hildebrand
 */
public final class OutOfDomainException extends LocatorException {

    private final BoundingBox domain;

    public OutOfDomainException(Coordinate coordinate, BoundingBox domain) {
        super("Coordinate " + coordinate + " is outside of the domain " + domain, coordinate);
        this.domain = domain.copy();
    }

    public BoundingBox getDomain() {
        return domain.copy();
    }
}

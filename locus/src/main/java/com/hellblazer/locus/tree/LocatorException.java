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
 * Base of the recoverable point location failures. The hierarchy is closed: a query point is either outside the
 * domain box or inside it without a containing element.
 *
 * @author hal.hildebrand
 */
public sealed class LocatorException extends Exception permits OutOfDomainException, PointNotFoundException {

    private final Coordinate coordinate;

    protected LocatorException(String message, Coordinate coordinate) {
        super(message);
        this.coordinate = coordinate;
    }

    /**
     * The query coordinate that could not be located
     */
    public Coordinate getCoordinate() {
        return coordinate;
    }
}

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

import java.util.NoSuchElementException;

/**
 * Value form of a point location answer, for callers that branch on the outcome instead of catching
 * {@link LocatorException}s.
 *
 * @param <S> the seed type
 * @author hal.hildebrand
 */
public record LocationResult<S>(Status status, Coordinate coordinate, S seed) {

    public enum Status {
        FOUND, OUT_OF_DOMAIN, POINT_NOT_FOUND
    }

    static <S> LocationResult<S> found(Coordinate coordinate, S seed) {
        return new LocationResult<>(Status.FOUND, coordinate, seed);
    }

    static <S> LocationResult<S> of(LocatorException failure) {
        var status = failure instanceof OutOfDomainException ? Status.OUT_OF_DOMAIN : Status.POINT_NOT_FOUND;
        return new LocationResult<>(status, failure.getCoordinate(), null);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * @throws NoSuchElementException if no element was found
     */
    public S get() {
        if (status != Status.FOUND) {
            throw new NoSuchElementException("No element located at " + coordinate + ": " + status);
        }
        return seed;
    }
}

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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues element seeds in increasing order. Thread-safe, so several meshes may draw from one generator and still get
 * disjoint seeds.
 *
 * @author hal.hildebrand
 */
public class SeedGenerator {
    private final AtomicLong next;

    public SeedGenerator() {
        this(0L);
    }

    /**
     * @param first value of the first seed issued
     */
    public SeedGenerator(long first) {
        this.next = new AtomicLong(first);
    }

    public ElementSeed next() {
        return new ElementSeed(next.getAndIncrement());
    }
}

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

/**
 * Seed of an element in a {@link ListMesh}. Issued by a {@link SeedGenerator} when the element is added and stable for
 * the lifetime of the mesh, so it stays valid however the element storage is reorganized.
 *
 * @param value the issue number of the element
 * @author hal.hildebrand
 */
public record ElementSeed(long value) {

    @Override
    public String toString() {
        return "Element[" + value + "]";
    }
}

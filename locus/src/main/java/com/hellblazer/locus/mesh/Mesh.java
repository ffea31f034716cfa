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
 * The mesh collaborator of the locator. The element sequence must be finite and restartable, every call of
 * {@link #elements()} enumerates the same elements in the same order while the mesh is unchanged.
 *
 * @param <S> the seed type identifying elements
 * @author hal.hildebrand
 */
public interface Mesh<S> {

    /**
     * World dimension of all corner coordinates
     */
    int dimension();

    Iterable<? extends MeshElement<S>> elements();

    /**
     * Rebind a seed to the live element it identifies
     *
     * @throws IllegalArgumentException if the seed is unknown to this mesh
     */
    MeshElement<S> resolve(S seed);
}

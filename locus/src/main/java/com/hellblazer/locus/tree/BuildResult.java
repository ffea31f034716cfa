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

import java.util.Optional;

/**
 * Outcome of {@link MeshLocator#build()}.
 *
 * @param state        the state the locator ended in, BUILT or FAILED
 * @param elementCount number of elements indexed, 0 on failure
 * @param vertexCount  number of canonical vertices, 0 on failure
 * @param cornerCount  number of corners registered before deduplication, 0 on failure
 * @param failure      the cause of a failed build
 * @author hal.hildebrand
 */
public record BuildResult(BuildState state, int elementCount, int vertexCount, int cornerCount,
                          Optional<RuntimeException> failure) {

    static BuildResult built(int elementCount, int vertexCount, int cornerCount) {
        return new BuildResult(BuildState.BUILT, elementCount, vertexCount, cornerCount, Optional.empty());
    }

    static BuildResult failed(RuntimeException cause) {
        return new BuildResult(BuildState.FAILED, 0, 0, 0, Optional.of(cause));
    }

    public boolean isSuccess() {
        return state == BuildState.BUILT;
    }
}

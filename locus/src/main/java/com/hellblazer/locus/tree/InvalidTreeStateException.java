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

/**
 * A query reached a locator that is not built. This is a programming error of the caller, never a recoverable query
 * failure.
 *
 * @author hal.hildebrand
 */
public class InvalidTreeStateException extends IllegalStateException {

    private final BuildState state;

    public InvalidTreeStateException(BuildState state) {
        super("Locator is not built, state: " + state);
        this.state = state;
    }

    public InvalidTreeStateException(String message, BuildState state, Throwable cause) {
        super(message, cause);
        this.state = state;
    }

    public BuildState getState() {
        return state;
    }
}

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

import com.hellblazer.locus.common.IntArrayList;
import com.hellblazer.locus.geometry.Coordinate;

import java.util.stream.IntStream;

/**
 * Canonical mesh vertex. The position is the first coordinate registered for it, later near-duplicates are merged
 * into it without moving it. Incident elements are element-arena indices in discovery order.
 * <p>
 * Thread Safety: mutated only by the {@link VertexRegistry} during a build, read-only afterwards.
 *
 * @author hal.hildebrand
 */
public final class Vertex {

    private final int          index;
    private final Coordinate   global;
    private final IntArrayList incidentElements = new IntArrayList();

    Vertex(int index, Coordinate global) {
        this.index = index;
        this.global = global;
    }

    /**
     * Position in the vertex arena of the owning locator
     */
    public int index() {
        return index;
    }

    public Coordinate global() {
        return global;
    }

    public int incidentCount() {
        return incidentElements.size();
    }

    /**
     * @param i position in the incidence list
     * @return the element-arena index of the i-th incident element
     */
    public int incidentElement(int i) {
        return incidentElements.getInt(i);
    }

    public IntStream incidentElements() {
        return incidentElements.stream();
    }

    boolean addIncident(int elementIndex) {
        return incidentElements.addIfAbsent(elementIndex);
    }

    void freeze() {
        incidentElements.trimToSize();
    }

    @Override
    public String toString() {
        return "Vertex[" + index + ", " + global + ", elements=" + incidentElements + "]";
    }
}

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

import java.util.Iterator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * All leaves of a locator tree in deterministic pre-order. Every iteration walks the tree afresh.
 *
 * @author hal.hildebrand
 */
public final class LeafView implements Iterable<SpatialNode> {

    private final SpatialNode root;

    LeafView(SpatialNode root) {
        this.root = root;
    }

    @Override
    public Iterator<SpatialNode> iterator() {
        return new PreOrderIterator(root, Integer.MAX_VALUE, SpatialNode::isLeaf);
    }

    public Stream<SpatialNode> stream() {
        return StreamSupport.stream(spliterator(), false);
    }
}

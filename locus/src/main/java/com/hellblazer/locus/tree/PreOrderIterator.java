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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Lazy depth-first pre-order walk over a subtree, children visited in slot order. Nodes deeper than the depth limit
 * are pruned, the filter selects which visited nodes are returned.
 *
 * @author hal.hildebrand
 */
final class PreOrderIterator implements Iterator<SpatialNode> {

    private final Deque<SpatialNode>     stack = new ArrayDeque<>();
    private final int                    depthLimit;
    private final Predicate<SpatialNode> filter;
    private       SpatialNode            next;

    PreOrderIterator(SpatialNode root, int depthLimit, Predicate<SpatialNode> filter) {
        this.depthLimit = depthLimit;
        this.filter = filter;
        if (root != null && root.depth() <= depthLimit) {
            stack.push(root);
        }
        advance();
    }

    @Override
    public boolean hasNext() {
        return next != null;
    }

    @Override
    public SpatialNode next() {
        if (next == null) {
            throw new NoSuchElementException();
        }
        var current = next;
        advance();
        return current;
    }

    private void advance() {
        next = null;
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node.depth() < depthLimit) {
                var children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            if (filter.test(node)) {
                next = node;
                return;
            }
        }
    }
}

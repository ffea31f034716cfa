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
import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * Structural statistics of a locator tree, gathered in one traversal. Averages over an empty population are 0.
 *
 * @param nodeCount              all nodes, interior and leaf
 * @param leafCount              leaves only
 * @param vertexCount            canonical vertices held by the leaves
 * @param maxDepth               depth of the deepest node
 * @param averageDepth           mean depth over all nodes
 * @param averageLeafDepth       mean depth over the leaves
 * @param averageVerticesPerNode vertices held directly, averaged over all nodes
 * @param averageEntitiesPerLeaf distinct elements incident to a leaf's vertices, averaged over the leaves
 * @author hal.hildebrand
 */
public record TreeStats(int nodeCount, int leafCount, int vertexCount, int maxDepth, double averageDepth,
                        double averageLeafDepth, double averageVerticesPerNode, double averageEntitiesPerLeaf) {

    /**
     * Walk the tree once and accumulate the counters
     *
     * @param root         the tree root, may be null for no tree
     * @param arena        the vertex arena the leaves index into
     * @param elementCount size of the element arena
     */
    static TreeStats collect(SpatialNode root, List<Vertex> arena, int elementCount) {
        int nodes = 0, leaves = 0, vertices = 0, deepest = 0;
        long depthSum = 0, leafDepthSum = 0, entitySum = 0;
        var seen = new BitSet(elementCount);
        var stack = new ArrayDeque<SpatialNode>();
        if (root != null) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            var node = stack.pop();
            nodes++;
            depthSum += node.depth();
            deepest = Math.max(deepest, node.depth());
            if (node.isLeaf()) {
                leaves++;
                leafDepthSum += node.depth();
                vertices += node.vertexCount();
                seen.clear();
                node.forEachVertexIndex(v -> arena.get(v).incidentElements().forEach(seen::set));
                entitySum += seen.cardinality();
            } else {
                node.children().forEach(stack::push);
            }
        }
        return new TreeStats(nodes, leaves, vertices, deepest, average(depthSum, nodes),
                             average(leafDepthSum, leaves), average(vertices, nodes), average(entitySum, leaves));
    }

    private static double average(long sum, int count) {
        return count == 0 ? 0.0 : (double) sum / count;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append("Locator Tree Statistics\n");
        sb.append("=======================\n");
        sb.append(String.format(Locale.ROOT, "Nodes: %d\n", nodeCount));
        sb.append(String.format(Locale.ROOT, "Leaves: %d\n", leafCount));
        sb.append(String.format(Locale.ROOT, "Average Depth: %.3f\n", averageDepth));
        sb.append(String.format(Locale.ROOT, "Average Leaf Depth: %.3f\n", averageLeafDepth));
        sb.append(String.format(Locale.ROOT, "Average Vertices/Node: %.3f\n", averageVerticesPerNode));
        sb.append(String.format(Locale.ROOT, "Average Entities/Leaf: %.3f\n", averageEntitiesPerLeaf));
        sb.append(String.format(Locale.ROOT, "Vertices: %d (max depth %d)", vertexCount, maxDepth));
        return sb.toString();
    }
}

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
import com.hellblazer.locus.geometry.BoundingBox;
import com.hellblazer.locus.geometry.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Cell of the locator tree. A node is either a leaf holding vertex-arena indices or an interior node whose box is
 * bisected along every axis into {@code 2^d} child slots; slots that received no vertex stay empty.
 * <p>
 * Vertices on a bisection plane belong to the lower half, which is the lowest-indexed child whose inclusive box
 * contains them. Point descent uses the same rule.
 * <p>
 * Thread Safety: immutable once built.
 *
 * @author hal.hildebrand
 */
public final class SpatialNode {

    private final SpatialNode   parent;
    private final BoundingBox   box;
    private final int           depth;
    private final List<Vertex>  arena;
    private final int[]         vertices;
    private final SpatialNode[] children;

    private SpatialNode(SpatialNode parent, BoundingBox box, int depth, IntArrayList indices, List<Vertex> arena,
                        LocatorConfig config) {
        this.parent = parent;
        this.box = box;
        this.depth = depth;
        this.arena = arena;
        if (indices.size() <= config.getLeafCapacity() || depth >= config.getMaxDepth() || box.diagonal() == 0.0) {
            vertices = indices.toArray();
            children = null;
            return;
        }
        var buckets = new IntArrayList[box.childCount()];
        indices.forEach(v -> {
            int slot = box.childIndexOf(arena.get(v).global());
            if (buckets[slot] == null) {
                buckets[slot] = new IntArrayList();
            }
            buckets[slot].addInt(v);
        });
        vertices = null;
        children = new SpatialNode[buckets.length];
        for (int i = 0; i < buckets.length; i++) {
            if (buckets[i] != null) {
                children[i] = new SpatialNode(this, box.child(i), depth + 1, buckets[i], arena, config);
            }
        }
    }

    /**
     * Build the tree over the given vertices
     *
     * @param arena  all vertices of the locator, indexed by {@link Vertex#index()}
     * @param box    the box of the root, must contain every vertex
     * @param config split policy
     * @return the root node, depth 0
     */
    static SpatialNode build(List<Vertex> arena, BoundingBox box, LocatorConfig config) {
        var all = new IntArrayList(arena.size());
        for (var v : arena) {
            all.addInt(v.index());
        }
        return new SpatialNode(null, box.copy(), 0, all, arena, config);
    }

    /**
     * Descend to the leaf responsible for the coordinate. When the child slot selected on the way down is empty the
     * descent stops at the interior node owning that slot.
     *
     * @throws OutOfDomainException if this node's box does not contain the coordinate
     */
    public SpatialNode findLeaf(Coordinate coordinate) throws OutOfDomainException {
        if (!box.contains(coordinate)) {
            throw new OutOfDomainException(coordinate, box);
        }
        var node = this;
        while (!node.isLeaf()) {
            var next = node.children[node.box.childIndexOf(coordinate)];
            if (next == null) {
                break;
            }
            node = next;
        }
        return node;
    }

    public boolean isLeaf() {
        return children == null;
    }

    /**
     * @return a copy of this node's box
     */
    public BoundingBox box() {
        return box.copy();
    }

    public boolean contains(Coordinate coordinate) {
        return box.contains(coordinate);
    }

    /**
     * Depth below the root, which has depth 0
     */
    public int depth() {
        return depth;
    }

    /**
     * @return the parent, null for the root
     */
    public SpatialNode parent() {
        return parent;
    }

    /**
     * @return the child in the given slot, null when the slot is empty or this is a leaf
     */
    public SpatialNode child(int slot) {
        if (children == null) {
            return null;
        }
        if (slot < 0 || slot >= children.length) {
            throw new IllegalArgumentException("Child slot must be in [0, " + children.length + "): " + slot);
        }
        return children[slot];
    }

    /**
     * The non-empty children in slot order, empty for a leaf
     */
    public List<SpatialNode> children() {
        if (children == null) {
            return Collections.emptyList();
        }
        var result = new ArrayList<SpatialNode>(children.length);
        for (var c : children) {
            if (c != null) {
                result.add(c);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Number of vertices held directly, 0 for interior nodes
     */
    public int vertexCount() {
        return vertices == null ? 0 : vertices.length;
    }

    /**
     * The vertices held directly, empty for interior nodes
     */
    public List<Vertex> vertices() {
        if (vertices == null) {
            return Collections.emptyList();
        }
        var result = new ArrayList<Vertex>(vertices.length);
        for (int v : vertices) {
            result.add(arena.get(v));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @param i position among the vertices held directly, in [0, vertexCount())
     * @return the vertex-arena index at that position
     */
    public int vertexIndex(int i) {
        if (vertices == null || i < 0 || i >= vertices.length) {
            throw new IndexOutOfBoundsException("Index:" + i + ", Size:" + vertexCount());
        }
        return vertices[i];
    }

    /**
     * Visit the vertex-arena indices held directly by this node
     */
    public void forEachVertexIndex(IntConsumer action) {
        if (vertices != null) {
            for (int v : vertices) {
                action.accept(v);
            }
        }
    }

    @Override
    public String toString() {
        return (isLeaf() ? "Leaf" : "Node") + "[depth=" + depth + ", " + box + ", vertices=" + vertexCount() + "]";
    }
}

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

import com.hellblazer.locus.geometry.BoundingBox;
import com.hellblazer.locus.geometry.Coordinate;
import com.hellblazer.locus.mesh.Mesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Point locator over a snapshot of an unstructured mesh. Building deduplicates the element corners into canonical
 * vertices, records which elements touch each vertex and partitions the vertices into a bisection tree. A query
 * descends to the leaf owning the point and tests the elements incident to the leaf's vertices.
 * <p>
 * The locator does not follow later changes of the mesh. After the mesh is adapted build a new locator, see
 * {@link LocatorReference}.
 * <p>
 * Thread Safety: {@link #build()} runs once, on one thread. Once the state is {@link BuildState#BUILT} every query and
 * view may be used from any number of threads without locking.
 *
 * @param <S> the seed type of the mesh
 * @author hal.hildebrand
 */
public class MeshLocator<S> {
    private static final Logger log = LoggerFactory.getLogger(MeshLocator.class);

    private final Mesh<S>       mesh;
    private final LocatorConfig config;

    private volatile BuildState state = BuildState.UNBUILT;

    // Written once by build() before the state becomes BUILT
    private List<S>      seeds;
    private List<Vertex> vertices;
    private BoundingBox  domain;
    private SpatialNode  root;
    private double       tolerance;

    public MeshLocator(Mesh<S> mesh) {
        this(mesh, LocatorConfig.defaults());
    }

    public MeshLocator(Mesh<S> mesh, LocatorConfig config) {
        this.mesh = Objects.requireNonNull(mesh, "Mesh cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null").copy();
    }

    /**
     * Create and build a locator in one step
     *
     * @throws InvalidTreeStateException if the build fails, with the failure as cause
     */
    public static <S> MeshLocator<S> of(Mesh<S> mesh, LocatorConfig config) {
        var locator = new MeshLocator<>(mesh, config);
        var result = locator.build();
        if (!result.isSuccess()) {
            throw new InvalidTreeStateException("Locator build failed", result.state(),
                                                result.failure().orElse(null));
        }
        return locator;
    }

    public static <S> MeshLocator<S> of(Mesh<S> mesh) {
        return of(mesh, LocatorConfig.defaults());
    }

    /**
     * Index the mesh. Everything is assembled in locals and published by the final state transition, so a failed
     * build leaves nothing half-visible.
     *
     * @return the outcome; a failure moves the locator to {@link BuildState#FAILED}
     * @throws IllegalStateException if the locator has already been built or a build was attempted
     */
    public synchronized BuildResult build() {
        if (state != BuildState.UNBUILT) {
            throw new IllegalStateException("Locator cannot be rebuilt in place, state: " + state);
        }
        state = BuildState.BUILDING;
        try {
            int dimension = mesh.dimension();

            var scale = new BoundingBox(dimension);
            for (var element : mesh.elements()) {
                for (int k = 0; k < element.cornerCount(); k++) {
                    scale.append(element.corner(k));
                }
            }
            double tol = config.toleranceFor(scale);

            var registry = new VertexRegistry(scale, tol);
            var elementSeeds = new ArrayList<S>();
            for (var element : mesh.elements()) {
                int elementIndex = elementSeeds.size();
                elementSeeds.add(Objects.requireNonNull(element.seed(), "Element seed cannot be null"));
                for (int k = 0; k < element.cornerCount(); k++) {
                    registry.registerCorner(element.corner(k), elementIndex);
                }
            }
            var arena = registry.freeze();
            var box = registry.domain().copy();
            log.info("Bounding box {}", box);
            log.info("Number of vertices {} ({} corners, {} elements, tolerance {})", arena.size(),
                     registry.registrations(), elementSeeds.size(), tol);

            var top = SpatialNode.build(arena, box, config);

            seeds = Collections.unmodifiableList(elementSeeds);
            vertices = arena;
            domain = box;
            root = top;
            tolerance = tol;
            state = BuildState.BUILT;

            if (log.isDebugEnabled()) {
                log.debug("Locator built: {}", treeStats());
            }
            return BuildResult.built(elementSeeds.size(), arena.size(), registry.registrations());
        } catch (RuntimeException e) {
            state = BuildState.FAILED;
            log.error("Locator build failed", e);
            return BuildResult.failed(e);
        }
    }

    /**
     * Find the element containing the coordinate. Candidates are the elements incident to the vertices of the leaf
     * reached by descent, tested in vertex order then incidence order, each element once. On a face shared by several
     * elements the first candidate passing the inclusive test wins. With search widening enabled the remaining
     * elements under each ancestor are tested before giving up.
     *
     * @return the seed of the containing element
     * @throws OutOfDomainException   if the coordinate is outside the domain box
     * @throws PointNotFoundException if no candidate element contains the coordinate
     */
    public S findEntity(Coordinate coordinate) throws LocatorException {
        checkBuilt();
        checkDimensions(coordinate);
        var node = root.findLeaf(coordinate);
        var tested = new BitSet(seeds.size());
        SpatialNode searched = null;
        while (node != null) {
            int found = scan(node, searched, coordinate, tested);
            if (found >= 0) {
                return seeds.get(found);
            }
            if (!config.isWidenSearch()) {
                break;
            }
            searched = node;
            node = node.parent();
        }
        throw new PointNotFoundException(coordinate, tested.cardinality());
    }

    /**
     * {@link #findEntity(Coordinate)} with the failure folded into the result
     */
    public LocationResult<S> locate(Coordinate coordinate) {
        try {
            return LocationResult.found(coordinate, findEntity(coordinate));
        } catch (LocatorException e) {
            return LocationResult.of(e);
        }
    }

    /**
     * Seeds of the elements incident to the vertices of the node reached by descent, in test order
     *
     * @throws OutOfDomainException if the coordinate is outside the domain box
     */
    public List<S> candidates(Coordinate coordinate) throws OutOfDomainException {
        checkBuilt();
        checkDimensions(coordinate);
        var node = root.findLeaf(coordinate);
        var seen = new BitSet(seeds.size());
        var result = new ArrayList<S>();
        var leaves = new PreOrderIterator(node, Integer.MAX_VALUE, SpatialNode::isLeaf);
        while (leaves.hasNext()) {
            var leaf = leaves.next();
            for (int i = 0; i < leaf.vertexCount(); i++) {
                var vertex = vertices.get(leaf.vertexIndex(i));
                for (int j = 0; j < vertex.incidentCount(); j++) {
                    int e = vertex.incidentElement(j);
                    if (!seen.get(e)) {
                        seen.set(e);
                        result.add(seeds.get(e));
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Iterate over all leaves of the tree
     */
    public LeafView leafView() {
        checkBuilt();
        return new LeafView(root);
    }

    /**
     * Iterate over all nodes at the given depth
     */
    public LevelView levelView(int level) {
        checkBuilt();
        return new LevelView(root, level);
    }

    public TreeStats treeStats() {
        checkBuilt();
        return TreeStats.collect(root, vertices, seeds.size());
    }

    public void printStats(PrintStream out) {
        out.println(treeStats());
    }

    public BuildState state() {
        return state;
    }

    public SpatialNode root() {
        checkBuilt();
        return root;
    }

    /**
     * @return a copy of the box spanning all canonical vertices
     */
    public BoundingBox boundingBox() {
        checkBuilt();
        return domain.copy();
    }

    /**
     * The vertex identity tolerance used by the build
     */
    public double tolerance() {
        checkBuilt();
        return tolerance;
    }

    public LocatorConfig config() {
        return config.copy();
    }

    public int vertexCount() {
        checkBuilt();
        return vertices.size();
    }

    public Vertex vertex(int index) {
        checkBuilt();
        return vertices.get(index);
    }

    public List<Vertex> vertices() {
        checkBuilt();
        return vertices;
    }

    public int elementCount() {
        checkBuilt();
        return seeds.size();
    }

    /**
     * @param elementIndex index into the element arena, as stored in {@link Vertex} incidence lists
     */
    public S seed(int elementIndex) {
        checkBuilt();
        return seeds.get(elementIndex);
    }

    /**
     * Test the elements under the node, skipping the subtree already searched, and return the index of the first one
     * containing the coordinate or -1
     */
    private int scan(SpatialNode node, SpatialNode skip, Coordinate coordinate, BitSet tested) {
        if (node == skip) {
            return -1;
        }
        if (node.isLeaf()) {
            for (int i = 0; i < node.vertexCount(); i++) {
                var vertex = vertices.get(node.vertexIndex(i));
                for (int j = 0; j < vertex.incidentCount(); j++) {
                    int e = vertex.incidentElement(j);
                    if (tested.get(e)) {
                        continue;
                    }
                    tested.set(e);
                    if (mesh.resolve(seeds.get(e)).checkInside(coordinate, config.getInsideTolerance())) {
                        return e;
                    }
                }
            }
            return -1;
        }
        for (var child : node.children()) {
            int found = scan(child, skip, coordinate, tested);
            if (found >= 0) {
                return found;
            }
        }
        return -1;
    }

    private void checkBuilt() {
        var current = state;
        if (current != BuildState.BUILT) {
            throw new InvalidTreeStateException(current);
        }
    }

    private void checkDimensions(Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "Coordinate cannot be null");
        if (coordinate.dimensions() != domain.dimensions()) {
            throw new IllegalArgumentException(
            String.format("Coordinate dimensions %d != mesh dimensions %d", coordinate.dimensions(),
                          domain.dimensions()));
        }
    }
}

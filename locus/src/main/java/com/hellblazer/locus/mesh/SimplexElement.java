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

import com.hellblazer.locus.geometry.Coordinate;

import javax.vecmath.GMatrix;
import javax.vecmath.GVector;
import javax.vecmath.SingularMatrixException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Straight-sided simplex (segment, triangle, tetrahedron, ...) whose dimension equals the world dimension. Local
 * coordinates are the barycentric weights of corners 1..d, obtained through the inverse of the affine Jacobian.
 *
 * @param <S> the seed type
 * @author hal.hildebrand
 */
public final class SimplexElement<S> implements MeshElement<S> {

    private final S            seed;
    private final Coordinate[] corners;
    private final GMatrix      inverseJacobian;

    /**
     * @throws IllegalArgumentException if the corner count does not match the dimension or the simplex is degenerate
     */
    public SimplexElement(S seed, Coordinate... corners) {
        this.seed = Objects.requireNonNull(seed, "Seed cannot be null");
        if (corners.length < 2) {
            throw new IllegalArgumentException("A simplex needs at least two corners");
        }
        int dim = corners[0].dimensions();
        if (corners.length != dim + 1) {
            throw new IllegalArgumentException(
            String.format("A %d-dimensional simplex needs %d corners, got %d", dim, dim + 1, corners.length));
        }
        this.corners = corners.clone();

        // Column k holds the edge from corner 0 to corner k + 1
        var jacobian = new GMatrix(dim, dim);
        for (int k = 0; k < dim; k++) {
            var edge = corners[k + 1].subtract(corners[0]);
            for (int row = 0; row < dim; row++) {
                jacobian.setElement(row, k, edge.get(row));
            }
        }
        try {
            jacobian.invert();
        } catch (SingularMatrixException e) {
            throw new IllegalArgumentException("Degenerate simplex: " + Arrays.toString(corners), e);
        }
        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                if (!Double.isFinite(jacobian.getElement(row, col))) {
                    throw new IllegalArgumentException("Degenerate simplex: " + Arrays.toString(corners));
                }
            }
        }
        this.inverseJacobian = jacobian;
    }

    @Override
    public S seed() {
        return seed;
    }

    @Override
    public int cornerCount() {
        return corners.length;
    }

    @Override
    public Coordinate corner(int k) {
        return corners[k];
    }

    @Override
    public ReferenceElement referenceElement() {
        return ReferenceElement.SIMPLEX;
    }

    @Override
    public Coordinate local(Coordinate global) {
        var offset = new GVector(global.subtract(corners[0]).values());
        var result = new GVector(offset.getSize());
        result.mul(inverseJacobian, offset);
        var local = new double[result.getSize()];
        for (int i = 0; i < local.length; i++) {
            local[i] = result.getElement(i);
        }
        return new Coordinate(local);
    }

    @Override
    public String toString() {
        return "SimplexElement[" + seed + ", corners=" + Arrays.toString(corners) + "]";
    }
}

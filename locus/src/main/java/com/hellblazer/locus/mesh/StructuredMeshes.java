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

/**
 * Generators for structured meshes: triangulated rectangles, axis-aligned box grids and the Kuhn decomposition of a
 * cube grid into tetrahedra (six per cube, all sharing the cube's main diagonal).
 *
 * @author hal.hildebrand
 */
public final class StructuredMeshes {

    private static final int[][] PERMUTATIONS = { { 0, 1, 2 }, { 0, 2, 1 }, { 1, 0, 2 }, { 1, 2, 0 }, { 2, 0, 1 },
                                                  { 2, 1, 0 } };

    private StructuredMeshes() {
    }

    /**
     * The unit square cut along the diagonal (0,0)-(1,1) into two triangles
     */
    public static ListMesh unitSquare() {
        var mesh = new ListMesh(2);
        mesh.addSimplex(Coordinate.of(0, 0), Coordinate.of(1, 0), Coordinate.of(1, 1));
        mesh.addSimplex(Coordinate.of(0, 0), Coordinate.of(1, 1), Coordinate.of(0, 1));
        return mesh;
    }

    /**
     * A rectangle split into {@code nx * ny} cells, each cut into two triangles
     */
    public static ListMesh triangulatedRectangle(int nx, int ny, Coordinate min, Coordinate max) {
        checkPositive(nx, ny);
        var mesh = new ListMesh(2);
        double hx = (max.get(0) - min.get(0)) / nx;
        double hy = (max.get(1) - min.get(1)) / ny;
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                double x0 = min.get(0) + i * hx, y0 = min.get(1) + j * hy;
                double x1 = min.get(0) + (i + 1) * hx, y1 = min.get(1) + (j + 1) * hy;
                mesh.addSimplex(Coordinate.of(x0, y0), Coordinate.of(x1, y0), Coordinate.of(x1, y1));
                mesh.addSimplex(Coordinate.of(x0, y0), Coordinate.of(x1, y1), Coordinate.of(x0, y1));
            }
        }
        return mesh;
    }

    /**
     * Axis-aligned box cells, {@code cells[d]} of them along axis {@code d}
     */
    public static ListMesh boxGrid(int[] cells, Coordinate min, Coordinate max) {
        checkPositive(cells);
        int dim = cells.length;
        var mesh = new ListMesh(dim);
        var index = new int[dim];
        int total = 1;
        for (int c : cells) {
            total *= c;
        }
        for (int n = 0; n < total; n++) {
            int rest = n;
            for (int d = 0; d < dim; d++) {
                index[d] = rest % cells[d];
                rest /= cells[d];
            }
            var lo = new double[dim];
            var hi = new double[dim];
            for (int d = 0; d < dim; d++) {
                double h = (max.get(d) - min.get(d)) / cells[d];
                lo[d] = min.get(d) + index[d] * h;
                hi[d] = min.get(d) + (index[d] + 1) * h;
            }
            mesh.addBox(new Coordinate(lo), new Coordinate(hi));
        }
        return mesh;
    }

    /**
     * {@code n^3} cubes between min and max, each decomposed into six tetrahedra
     */
    public static ListMesh kuhnCubeGrid(int n, Coordinate min, Coordinate max) {
        checkPositive(n);
        var mesh = new ListMesh(3);
        var h = new double[3];
        for (int d = 0; d < 3; d++) {
            h[d] = (max.get(d) - min.get(d)) / n;
        }
        for (int k = 0; k < n; k++) {
            for (int j = 0; j < n; j++) {
                for (int i = 0; i < n; i++) {
                    int[] cell = { i, j, k };
                    for (var perm : PERMUTATIONS) {
                        var step = new int[3];
                        var corners = new Coordinate[4];
                        corners[0] = latticePoint(min, h, cell, step);
                        for (int s = 0; s < 3; s++) {
                            step[perm[s]] = 1;
                            corners[s + 1] = latticePoint(min, h, cell, step);
                        }
                        mesh.addSimplex(corners);
                    }
                }
            }
        }
        return mesh;
    }

    private static Coordinate latticePoint(Coordinate min, double[] h, int[] cell, int[] step) {
        var p = new double[3];
        for (int d = 0; d < 3; d++) {
            p[d] = min.get(d) + (cell[d] + step[d]) * h[d];
        }
        return new Coordinate(p);
    }

    private static void checkPositive(int... counts) {
        for (int c : counts) {
            if (c <= 0) {
                throw new IllegalArgumentException("Cell counts must be positive: " + c);
            }
        }
    }
}

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

import com.hellblazer.locus.geometry.Coordinate;
import com.hellblazer.locus.mesh.ElementSeed;
import com.hellblazer.locus.mesh.Mesh;
import com.hellblazer.locus.mesh.MeshElement;
import com.hellblazer.locus.mesh.StructuredMeshes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorReferenceTest {

    @Test
    void testNothingPublishedInitially() {
        var reference = new LocatorReference<ElementSeed>(LocatorConfig.defaults());
        assertFalse(reference.isPublished());
        var e = assertThrows(InvalidTreeStateException.class, reference::get);
        assertEquals(BuildState.UNBUILT, e.getState());
    }

    @Test
    void testRebuildPublishesNewLocator() throws LocatorException {
        var mesh = StructuredMeshes.unitSquare();
        var reference = new LocatorReference<ElementSeed>(LocatorConfig.defaults());

        assertTrue(reference.rebuild(mesh).isSuccess());
        var first = reference.get();
        assertEquals(2, first.elementCount());

        // Adapt the mesh, the old locator keeps answering from its snapshot
        mesh.addSimplex(Coordinate.of(1, 0), Coordinate.of(2, 0), Coordinate.of(1, 1));
        var result = reference.rebuild(mesh);
        assertTrue(result.isSuccess());
        assertEquals(3, result.elementCount());

        var second = reference.get();
        assertNotSame(first, second);
        assertEquals(new ElementSeed(2), second.findEntity(Coordinate.of(1.5, 0.2)));
        assertThrows(OutOfDomainException.class, () -> first.findEntity(Coordinate.of(1.5, 0.2)));
    }

    @Test
    void testFailedRebuildKeepsCurrentLocator() {
        var reference = new LocatorReference<ElementSeed>(LocatorConfig.defaults());
        var failed = reference.rebuild(MeshLocatorTest.corruptMesh(new ElementSeed(0)));
        assertEquals(BuildState.FAILED, failed.state());
        assertFalse(reference.isPublished());

        assertTrue(reference.rebuild(StructuredMeshes.unitSquare()).isSuccess());
        var published = reference.get();

        failed = reference.rebuild(MeshLocatorTest.corruptMesh(new ElementSeed(0)));
        assertFalse(failed.isSuccess());
        assertTrue(failed.failure().isPresent());
        assertSame(published, reference.get());
        assertEquals(BuildState.BUILT, reference.get().state());
    }

    @Test
    void testRebuildsAreSerialized() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var slow = StructuredMeshes.unitSquare();
        var stalled = new Mesh<ElementSeed>() {
            @Override
            public int dimension() {
                return slow.dimension();
            }

            @Override
            public Iterable<MeshElement<ElementSeed>> elements() {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return slow.elements();
            }

            @Override
            public MeshElement<ElementSeed> resolve(ElementSeed seed) {
                return slow.resolve(seed);
            }
        };
        var newer = StructuredMeshes.triangulatedRectangle(2, 2, Coordinate.of(0, 0), Coordinate.of(1, 1));
        var reference = new LocatorReference<ElementSeed>(LocatorConfig.defaults());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            var first = executor.submit(() -> reference.rebuild(stalled));
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            var second = executor.submit(() -> reference.rebuild(newer));

            assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
            assertFalse(reference.isPublished());

            release.countDown();
            assertTrue(first.get(10, TimeUnit.SECONDS).isSuccess());
            assertTrue(second.get(10, TimeUnit.SECONDS).isSuccess());
            assertEquals(8, reference.get().elementCount());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentQueries() throws Exception {
        var mesh = StructuredMeshes.kuhnCubeGrid(3, Coordinate.of(0, 0, 0), Coordinate.of(1, 1, 1));
        var locator = MeshLocator.of(mesh, LocatorConfig.fineGrained());
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<Integer>>();
            for (int t = 0; t < threads; t++) {
                Callable<Integer> task = () -> {
                    start.await();
                    int hits = 0;
                    for (var element : mesh.elements()) {
                        if (element.seed().equals(locator.findEntity(element.centroid()))) {
                            hits++;
                        }
                    }
                    return hits;
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (var future : futures) {
                assertEquals(162, future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}

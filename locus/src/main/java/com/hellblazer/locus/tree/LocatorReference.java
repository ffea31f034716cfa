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

import com.hellblazer.locus.mesh.Mesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder publishing the current locator of an adapting mesh. A rebuild creates and fully builds a new locator before
 * swapping it in; readers that fetched the previous locator keep querying a consistent snapshot.
 * <p>
 * Rebuilds are serialized, so the locator published last is the one built from the latest {@link #rebuild(Mesh)}
 * call to acquire the holder. Readers never block.
 *
 * @param <S> the seed type
 * @author hal.hildebrand
 */
public class LocatorReference<S> {
    private static final Logger log = LoggerFactory.getLogger(LocatorReference.class);

    private final AtomicReference<MeshLocator<S>> current = new AtomicReference<>();
    private final LocatorConfig                   config;

    public LocatorReference(LocatorConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null").copy();
    }

    /**
     * Build a locator for the mesh and publish it if the build succeeds. A failed build leaves the published locator
     * untouched.
     */
    public synchronized BuildResult rebuild(Mesh<S> mesh) {
        var next = new MeshLocator<>(mesh, config);
        var result = next.build();
        if (result.isSuccess()) {
            var previous = current.getAndSet(next);
            log.debug("Published locator over {} elements, replacing {}", result.elementCount(),
                      previous == null ? "nothing" : previous.elementCount() + " elements");
        }
        return result;
    }

    /**
     * @throws InvalidTreeStateException if no locator has been published yet
     */
    public MeshLocator<S> get() {
        var locator = current.get();
        if (locator == null) {
            throw new InvalidTreeStateException(BuildState.UNBUILT);
        }
        return locator;
    }

    public boolean isPublished() {
        return current.get() != null;
    }
}

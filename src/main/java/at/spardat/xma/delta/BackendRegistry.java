/*
 * Copyright (c) 2003, 2007 s IT Solutions AT Spardat GmbH.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a
 * copy of this software and associated documentation files (the "Software"),
 * to deal in the Software without restriction, including without limitation
 * the rights to use, copy, modify, merge, publish, distribute, sublicense,
 * and/or sell copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL
 * THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS
 * IN THE SOFTWARE.
 *
 */
package at.spardat.xma.delta;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import at.spardat.xma.delta.backend.JavaxdeltaBackend;
import at.spardat.xma.delta.backend.LiteralBackend;

/**
 * Decides which {@link Backend} services {@link BinaryDelta#diff(Endpoint, Endpoint, Endpoint) diff}
 * and {@link BinaryDelta#patch(Endpoint, Endpoint, Endpoint) patch}.
 * <p>
 * Backends are registered under a namespaced name together with a {@link BackendFactory}. The
 * registration order is the probing priority. {@link #resolve()} picks the backend as follows, the
 * first rule that applies wins:
 * <ol>
 * <li>If a backend is selected, by {@link #setBackend(String)}, {@link #override(String)} or the
 * {@value #BACKEND_PROPERTY} system property, exactly that backend is loaded. If it cannot be
 * loaded a {@link BackendLoadException} is thrown and nothing else is tried.</li>
 * <li>If backends were already loaded through {@link #load(String)}, the first of them in
 * registration order is selected. Names reserved for the test support code are skipped.</li>
 * <li>Otherwise the registered backends are loaded in registration order and the first one that
 * loads is selected.</li>
 * <li>If none loads, a {@link NoBackendAvailableException} is thrown.</li>
 * </ol>
 * The selection is kept, so later calls resolve to the same backend until another one is selected
 * explicitly. Loaded backends are never unloaded.
 * <p>
 * All methods are synchronized. Backends themselves are called outside the lock.
 */
public class BackendRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BackendRegistry.class);

    /** The namespace of the backends shipped with this library. */
    public static final String NAMESPACE = "delta";

    /** System property naming the backend the default registry starts with. */
    public static final String BACKEND_PROPERTY = "delta.backend";

    /** Names used by the test support code, never adopted or probed. */
    public static final Set<String> INTERNAL_NAMES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(NAMESPACE + "/test")));

    /** The process wide registry. */
    private static BackendRegistry defaultRegistry;

    /** The factories in priority order. */
    private final Map<String, BackendFactory> factories = new LinkedHashMap<>();

    /** The loaded backends. */
    private final Map<String, Backend> loaded = new LinkedHashMap<>();

    /** The selected backend name, or null. */
    private String backend;

    /**
     * Returns the process wide registry, created with {@link #createDefault()} on first use.
     *
     * @return the default registry
     */
    public static synchronized BackendRegistry getDefault() {
        if (defaultRegistry == null) {
            defaultRegistry = createDefault();
        }
        return defaultRegistry;
    }

    /**
     * Creates a registry with the backends shipped with this library, javaxdelta first, and selects
     * the backend named by the {@value #BACKEND_PROPERTY} system property if it is set.
     *
     * @return a new registry
     */
    public static BackendRegistry createDefault() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(JavaxdeltaBackend.NAME, JavaxdeltaBackend.FACTORY);
        registry.register(LiteralBackend.NAME, LiteralBackend.FACTORY);
        String configured = System.getProperty(BACKEND_PROPERTY);
        if (configured != null && !configured.trim().isEmpty()) {
            registry.setBackend(configured.trim());
        }
        return registry;
    }

    /**
     * Registers a backend after all previously registered ones.
     *
     * @param name the namespaced name, e.g. {@code delta/javaxdelta}
     * @param factory the factory
     * @return this registry
     * @throws IllegalArgumentException if the name is already registered
     */
    public synchronized BackendRegistry register(String name, BackendFactory factory) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (factory == null) {
            throw new NullPointerException("factory");
        }
        if (factories.containsKey(name)) {
            throw new IllegalArgumentException("backend " + name + " is already registered");
        }
        factories.put(name, factory);
        return this;
    }

    /**
     * Gets the candidates.
     *
     * @return the names probed by {@link #resolve()}, in priority order
     */
    public synchronized List<String> getCandidates() {
        List<String> candidates = new ArrayList<>();
        for (String name : factories.keySet()) {
            if (!INTERNAL_NAMES.contains(name)) {
                candidates.add(name);
            }
        }
        return candidates;
    }

    /**
     * Gets the loaded names.
     *
     * @return the names of the backends loaded so far, in load order
     */
    public synchronized List<String> getLoadedNames() {
        return new ArrayList<>(loaded.keySet());
    }

    /**
     * Loads a backend without selecting it. Loading an already loaded backend returns the same
     * instance.
     *
     * @param name the name
     * @return the backend
     * @throws BackendLoadException if the name is unknown or the factory fails
     */
    public synchronized Backend load(String name) {
        Backend instance = loaded.get(name);
        if (instance != null) {
            return instance;
        }
        BackendFactory factory = factories.get(name);
        if (factory == null) {
            throw new BackendLoadException(name, "No backend registered under " + name + " (registered: " + factories.keySet() + ")");
        }
        try {
            instance = factory.create(name);
        } catch (Exception | LinkageError e) {
            throw new BackendLoadException(name, "Unable to load backend " + name + ": " + e, e);
        }
        if (instance == null) {
            throw new BackendLoadException(name, "Factory of backend " + name + " returned null");
        }
        loaded.put(name, instance);
        LOG.debug("loaded backend {}", name);
        return instance;
    }

    /**
     * Loads every registered backend that can be loaded. Failures are skipped.
     *
     * @return the installed backends in priority order
     */
    public synchronized List<Backend> loadInstalled() {
        List<Backend> installed = new ArrayList<>();
        for (String name : getCandidates()) {
            try {
                installed.add(load(name));
            } catch (BackendLoadException e) {
                LOG.debug("backend {} is not installed", name, e);
            }
        }
        return installed;
    }

    /**
     * Returns the backend servicing the next call.
     *
     * @return the backend
     * @throws BackendLoadException if the selected backend cannot be loaded
     * @throws NoBackendAvailableException if no backend is selected, loaded or loadable
     */
    public synchronized Backend resolve() {
        if (backend != null) {
            return load(backend);
        }
        for (Map.Entry<String, BackendFactory> entry : factories.entrySet()) {
            String name = entry.getKey();
            Backend instance = loaded.get(name);
            if (instance != null && !INTERNAL_NAMES.contains(name)) {
                LOG.info("using already loaded backend {}", name);
                backend = name;
                return instance;
            }
        }
        List<String> candidates = getCandidates();
        for (String candidate : candidates) {
            try {
                Backend instance = load(candidate);
                LOG.info("using backend {}", candidate);
                backend = candidate;
                return instance;
            } catch (BackendLoadException e) {
                LOG.debug("backend {} not available: {}", candidate, e.getMessage());
            }
        }
        throw new NoBackendAvailableException("Unable to find any delta backend, at least one backend must be installed (tried " + candidates + ")");
    }

    /**
     * Resolves and returns the name of the backend servicing the next call.
     *
     * @return the name
     * @throws BackendLoadException if the selected backend cannot be loaded
     * @throws NoBackendAvailableException if no backend is selected, loaded or loadable
     */
    public synchronized String whichBackend() {
        return resolve().getName();
    }

    /**
     * Gets the selected backend without resolving.
     *
     * @return the selected name, or {@code null} if the next call resolves afresh
     */
    public synchronized String getBackend() {
        return backend;
    }

    /**
     * Selects a backend for all following calls. The backend is loaded by the next call, which
     * fails rather than falling back if it cannot be loaded.
     *
     * @param name the name, or {@code null} to resolve afresh on the next call
     */
    public synchronized void setBackend(String name) {
        if (name == null ? backend != null : !name.equals(backend)) {
            LOG.debug("backend selection changed from {} to {}", backend, name);
        }
        backend = name;
    }

    /**
     * Selects a backend until the returned guard is closed.
     *
     * @param name the name
     * @return the guard restoring the previous selection
     */
    public synchronized BackendOverride override(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        BackendOverride guard = new BackendOverride(this, backend);
        setBackend(name);
        return guard;
    }
}

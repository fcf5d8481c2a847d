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

import java.io.IOException;

/**
 * Diff and patch for binary data, independent of the backend doing the work.
 * <p>
 * Every call resolves the backend through the {@link BackendRegistry} and passes the arguments on
 * unchanged. Errors raised by the backend reach the caller as they are; only the resolution errors
 * ({@link NoBackendAvailableException}, {@link BackendLoadException}) come from here.
 *
 * <pre>
 * BinaryDelta delta = new BinaryDelta();
 * byte[] patch = delta.diff(source, target);
 * byte[] target2 = delta.patch(source, patch);
 * </pre>
 *
 * @see BackendRegistry
 * @see Endpoint
 */
public class BinaryDelta {

    /** The registry. */
    private final BackendRegistry registry;

    /**
     * Uses the process wide {@link BackendRegistry#getDefault() default registry}.
     */
    public BinaryDelta() {
        this(BackendRegistry.getDefault());
    }

    /**
     * Uses the given registry.
     *
     * @param registry the registry
     */
    public BinaryDelta(BackendRegistry registry) {
        if (registry == null) {
            throw new NullPointerException("registry");
        }
        this.registry = registry;
    }

    /**
     * Gets the registry.
     *
     * @return the registry
     */
    public BackendRegistry getRegistry() {
        return registry;
    }

    /**
     * Computes the delta turning source into target, both in memory.
     *
     * @param source the source
     * @param target the target
     * @return the delta
     * @throws IOException if the backend fails
     */
    public byte[] diff(byte[] source, byte[] target) throws IOException {
        return diff(Endpoint.fromBuffer(source), Endpoint.fromBuffer(target), null);
    }

    /**
     * Computes the delta turning source into target and returns it.
     *
     * @param source the source
     * @param target the target
     * @return the delta
     * @throws IOException if the backend fails
     */
    public byte[] diff(Endpoint source, Endpoint target) throws IOException {
        return diff(source, target, null);
    }

    /**
     * Computes the delta turning source into target.
     *
     * @param source the source
     * @param target the target
     * @param output a stream to write the delta to, or {@code null}
     * @return the delta, or {@code null} if it was written to output
     * @throws IOException if the backend fails
     * @see Backend#diff(Endpoint, Endpoint, Endpoint)
     */
    public byte[] diff(Endpoint source, Endpoint target, Endpoint output) throws IOException {
        return registry.resolve().diff(source, target, output);
    }

    /**
     * Applies a delta to source, both in memory.
     *
     * @param source the source
     * @param delta the delta
     * @return the target
     * @throws IOException if the backend fails, e.g. on a malformed delta
     */
    public byte[] patch(byte[] source, byte[] delta) throws IOException {
        return patch(Endpoint.fromBuffer(source), Endpoint.fromBuffer(delta), null);
    }

    /**
     * Applies a delta to source and returns the target.
     *
     * @param source the source
     * @param delta the delta
     * @return the target
     * @throws IOException if the backend fails, e.g. on a malformed delta
     */
    public byte[] patch(Endpoint source, Endpoint delta) throws IOException {
        return patch(source, delta, null);
    }

    /**
     * Applies a delta to source.
     *
     * @param source the source
     * @param delta the delta
     * @param output a stream to write the target to, or {@code null}
     * @return the target, or {@code null} if it was written to output
     * @throws IOException if the backend fails, e.g. on a malformed delta
     * @see Backend#patch(Endpoint, Endpoint, Endpoint)
     */
    public byte[] patch(Endpoint source, Endpoint delta, Endpoint output) throws IOException {
        return registry.resolve().patch(source, delta, output);
    }

    /**
     * Tells which backend the next call will use, resolving it if necessary.
     *
     * @return the backend name
     */
    public String whichBackend() {
        return registry.whichBackend();
    }
}

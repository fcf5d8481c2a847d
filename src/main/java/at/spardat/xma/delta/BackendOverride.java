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

import java.io.Closeable;

/**
 * Forces a backend until closed, then restores whatever was selected before. Use with
 * try-with-resources:
 * <pre>
 * try (BackendOverride o = registry.override("delta/literal")) {
 *     delta = facade.diff(source, target);
 * }
 * </pre>
 * Overrides nest; closing them out of order restores the value each one saw when it was opened.
 */
public final class BackendOverride implements Closeable {

    /** The registry. */
    private final BackendRegistry registry;

    /** The selection to restore. */
    private final String previous;

    /** Whether close was called already. */
    private boolean closed;

    BackendOverride(BackendRegistry registry, String previous) {
        this.registry = registry;
        this.previous = previous;
    }

    /**
     * Gets the previous selection.
     *
     * @return the name selected before this override, or {@code null}
     */
    public String getPrevious() {
        return previous;
    }

    /**
     * Restores the previous selection. Calling it again has no effect.
     */
    public void close() {
        synchronized (registry) {
            if (closed) {
                return;
            }
            closed = true;
            registry.setBackend(previous);
        }
    }
}

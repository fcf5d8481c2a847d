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

/**
 * Thrown when a backend cannot be loaded. When the backend was selected explicitly this is fatal,
 * no other backend is tried in its place.
 */
public class BackendLoadException extends BackendException {

    private static final long serialVersionUID = 1L;

    /** The backend name. */
    private final String backendName;

    public BackendLoadException(String backendName, String message) {
        super(message);
        this.backendName = backendName;
    }

    public BackendLoadException(String backendName, String message, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
    }

    /**
     * Gets the backend name.
     *
     * @return the name of the backend that failed to load
     */
    public String getBackendName() {
        return backendName;
    }
}

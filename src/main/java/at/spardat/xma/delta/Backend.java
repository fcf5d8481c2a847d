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
 * A delta codec. Given source and target, {@link #diff(Endpoint, Endpoint, Endpoint) diff}
 * computes a delta, and given source and delta, {@link #patch(Endpoint, Endpoint, Endpoint) patch}
 * reconstructs the target.
 * <p>
 * Every argument may independently be a buffer or a stream, giving eight combinations per call
 * which all produce the same bytes. When {@code output} is {@code null} the result is returned,
 * otherwise it is written to the output stream and {@code null} is returned.
 * <p>
 * Backends are obtained through a {@link BackendRegistry}; most callers go through
 * {@link BinaryDelta} and never see them.
 */
public interface Backend {

    /**
     * Gets the name.
     *
     * @return the name the backend is registered under, e.g. {@code delta/javaxdelta}
     */
    String getName();

    /**
     * Computes the delta turning source into target.
     *
     * @param source the source, random access when streamed
     * @param target the target
     * @param output a stream in the output role, or {@code null} to return the delta
     * @return the delta, or {@code null} if it was written to {@code output}
     * @throws UnsuitableSourceHandleException if the source stream is not random access
     * @throws IOException if reading the inputs or writing the delta fails
     */
    byte[] diff(Endpoint source, Endpoint target, Endpoint output) throws IOException;

    /**
     * Applies a delta to the source.
     *
     * @param source the source the delta was computed against, random access when streamed
     * @param delta the delta
     * @param output a stream in the output role, or {@code null} to return the target
     * @return the target, or {@code null} if it was written to {@code output}
     * @throws UnsuitableSourceHandleException if the source stream is not random access
     * @throws IOException if the delta is malformed or reading or writing fails
     */
    byte[] patch(Endpoint source, Endpoint delta, Endpoint output) throws IOException;
}

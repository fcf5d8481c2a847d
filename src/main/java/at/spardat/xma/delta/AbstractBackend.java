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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.nothome.delta.SeekableSource;

/**
 * Resolves the endpoints of a call to the source, input and output streams a backend works on.
 * Subclasses only implement {@link #computeDelta(SeekableSource, InputStream, OutputStream)} and
 * {@link #applyDelta(SeekableSource, InputStream, OutputStream)}.
 * <p>
 * The source is opened first, so an unsuitable source handle fails the call before any output is
 * written.
 */
public abstract class AbstractBackend implements Backend {

    /** The name. */
    private final String name;

    /**
     * Instantiates a new backend.
     *
     * @param name the name
     */
    protected AbstractBackend(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public byte[] diff(Endpoint source, Endpoint target, Endpoint output) throws IOException {
        return run(true, source, target, output);
    }

    public byte[] patch(Endpoint source, Endpoint delta, Endpoint output) throws IOException {
        return run(false, source, delta, output);
    }

    /**
     * Computes the delta of target against source and writes it to delta.
     *
     * @param source the source, positioned at 0
     * @param target the target
     * @param delta where the delta goes, closing it is allowed
     * @throws IOException Signals that an I/O exception has occurred.
     */
    protected abstract void computeDelta(SeekableSource source, InputStream target, OutputStream delta) throws IOException;

    /**
     * Applies delta to source and writes the result to target.
     *
     * @param source the source, positioned at 0
     * @param delta the delta
     * @param target where the reconstructed target goes, closing it is allowed
     * @throws IOException Signals that an I/O exception has occurred.
     */
    protected abstract void applyDelta(SeekableSource source, InputStream delta, OutputStream target) throws IOException;

    private byte[] run(boolean diff, Endpoint source, Endpoint input, Endpoint output) throws IOException {
        if (source == null) {
            throw new NullPointerException("source");
        }
        if (input == null) {
            throw new NullPointerException(diff ? "target" : "delta");
        }
        Endpoint.Stream outputStream = null;
        if (output != null) {
            switch (output.getKind()) {
            case STREAM:
                outputStream = (Endpoint.Stream) output;
                break;
            case BUFFER:
            default:
                throw new IllegalArgumentException("output must be a stream, pass null to get a buffer back");
            }
        }
        try (SeekableSource seekable = source.openSource();
             InputStream in = input.openInput()) {
            if (outputStream == null) {
                ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                execute(diff, seekable, in, bytes);
                return bytes.toByteArray();
            }
            try (OutputStream out = outputStream.openOutput()) {
                execute(diff, seekable, in, out);
            }
            return null;
        }
    }

    private void execute(boolean diff, SeekableSource source, InputStream in, OutputStream out) throws IOException {
        if (diff) {
            computeDelta(source, in, out);
        } else {
            applyDelta(source, in, out);
        }
        out.flush();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}

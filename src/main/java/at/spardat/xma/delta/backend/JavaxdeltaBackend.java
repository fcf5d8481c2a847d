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
package at.spardat.xma.delta.backend;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.nothome.delta.Delta;
import com.nothome.delta.GDiffPatcher;
import com.nothome.delta.GDiffWriter;
import com.nothome.delta.SeekableSource;

import at.spardat.xma.delta.AbstractBackend;
import at.spardat.xma.delta.Backend;
import at.spardat.xma.delta.BackendFactory;

/**
 * Computes GDIFF deltas with {@link Delta} and applies them with {@link GDiffPatcher}.
 * The match length is taken from the {@value #CHUNK_SIZE_PROPERTY} system property.
 */
public class JavaxdeltaBackend extends AbstractBackend {

    /** The name. */
    public static final String NAME = "delta/javaxdelta";

    /** System property with the match length used by {@link Delta}. */
    public static final String CHUNK_SIZE_PROPERTY = "delta.javaxdelta.chunkSize";

    /**
     * Loads the backend with the configured chunk size. A value that is not a positive number fails
     * the load.
     */
    public static final BackendFactory FACTORY = new BackendFactory() {
        public Backend create(String name) {
            String value = System.getProperty(CHUNK_SIZE_PROPERTY);
            int chunkSize = value == null ? Delta.DEFAULT_CHUNK_SIZE : Integer.parseInt(value.trim());
            return new JavaxdeltaBackend(name, chunkSize);
        }
    };

    /** The chunk size. */
    private final int chunkSize;

    /**
     * Instantiates a new backend with {@link Delta#DEFAULT_CHUNK_SIZE}.
     */
    public JavaxdeltaBackend() {
        this(NAME, Delta.DEFAULT_CHUNK_SIZE);
    }

    /**
     * Instantiates a new backend.
     *
     * @param name the name
     * @param chunkSize the match length
     * @throws IllegalArgumentException if the chunk size is not positive
     */
    public JavaxdeltaBackend(String name, int chunkSize) {
        super(name);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Gets the chunk size.
     *
     * @return the match length
     */
    public int getChunkSize() {
        return chunkSize;
    }

    @Override
    protected void computeDelta(SeekableSource source, InputStream target, OutputStream delta) throws IOException {
        Delta d = new Delta();
        d.setChunkSize(chunkSize);
        d.compute(source, target, new GDiffWriter(new DataOutputStream(delta)));
    }

    @Override
    protected void applyDelta(SeekableSource source, InputStream delta, OutputStream target) throws IOException {
        new GDiffPatcher().patch(source, delta, target);
    }
}

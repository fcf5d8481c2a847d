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

import com.nothome.delta.DiffWriter;
import com.nothome.delta.GDiffPatcher;
import com.nothome.delta.GDiffWriter;
import com.nothome.delta.SeekableSource;

import at.spardat.xma.delta.AbstractBackend;
import at.spardat.xma.delta.Backend;
import at.spardat.xma.delta.BackendFactory;

/**
 * Ignores the source and writes a GDIFF delta that carries the whole target as data. The delta is
 * larger than the target, but it is produced without looking at the source, which suits content
 * that is mostly replaced anyway. Any GDIFF patcher can apply it.
 */
public class LiteralBackend extends AbstractBackend {

    /** The name. */
    public static final String NAME = "delta/literal";

    /** Loads the backend. */
    public static final BackendFactory FACTORY = new BackendFactory() {
        public Backend create(String name) {
            return new LiteralBackend(name);
        }
    };

    /** The Constant BUFFER_LEN. */
    private static final int BUFFER_LEN = 8 * 1024;

    public LiteralBackend() {
        this(NAME);
    }

    public LiteralBackend(String name) {
        super(name);
    }

    @Override
    protected void computeDelta(SeekableSource source, InputStream target, OutputStream delta) throws IOException {
        DiffWriter writer = new GDiffWriter(new DataOutputStream(delta));
        byte[] buffer = new byte[BUFFER_LEN];
        int read = 0;
        while (-1 < (read = target.read(buffer))) {
            for (int i = 0; i < read; i++) {
                writer.addData(buffer[i]);
            }
        }
        writer.flush();
        writer.close();
    }

    @Override
    protected void applyDelta(SeekableSource source, InputStream delta, OutputStream target) throws IOException {
        new GDiffPatcher().patch(source, delta, target);
    }
}

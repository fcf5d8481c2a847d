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
/**
 * This package contains a backend independent front end for diffing and patching binary data.
 * <p>
 * The entry point is {@link at.spardat.xma.delta.BinaryDelta}. It delegates to a
 * {@link at.spardat.xma.delta.Backend} chosen by a {@link at.spardat.xma.delta.BackendRegistry}.
 * Arguments are {@link at.spardat.xma.delta.Endpoint}s, each either in memory or a stream.
 * <p>
 * Example use:
 <pre>
 byte source[] = ...;
 byte target[] = ...;
 BinaryDelta d = new BinaryDelta();
 byte patch[] = d.diff(source, target);
 byte patchedSource[] = d.patch(source, patch);

 assert java.util.Arrays.equals(target, patchedSource);
 </pre>
 * Streaming, with the source read from a file and the delta written to another one:
 <pre>
 try (RandomAccessFile source = new RandomAccessFile("source.dat", "r");
      InputStream target = new FileInputStream("target.dat");
      OutputStream delta = new FileOutputStream("delta.dat")) {
     d.diff(Endpoint.fromStream(source, Endpoint.Role.SOURCE),
            Endpoint.fromStream(target, Endpoint.Role.INPUT),
            Endpoint.fromStream(delta));
 }
 </pre>
 *
 * @see at.spardat.xma.delta.BinaryDelta
 * @see at.spardat.xma.delta.BackendRegistry
 */
package at.spardat.xma.delta;

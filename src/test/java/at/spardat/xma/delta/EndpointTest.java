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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.Pipe;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

import org.apache.commons.compress.utils.IOUtils;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.nothome.delta.SeekableSource;

import at.spardat.xma.delta.backend.JavaxdeltaBackend;

/**
 * Tests the constraints {@link Endpoint} puts on each role.
 */
public class EndpointTest {

    private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELLO_WORLD = "hello world".getBytes(StandardCharsets.UTF_8);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File file(byte[] content) throws IOException {
        File file = folder.newFile();
        Files.write(file.toPath(), content);
        return file;
    }

    @Test(expected = UnsuitableSourceHandleException.class)
    public void pipeIsNotASource() throws Exception {
        Pipe pipe = Pipe.open();
        try {
            Endpoint.fromStream(pipe.source(), Endpoint.Role.SOURCE);
        } finally {
            pipe.source().close();
            pipe.sink().close();
        }
    }

    @Test
    public void fifoIsNotASource() throws Exception {
        File fifo = new File(folder.getRoot(), "fifo");
        Process mkfifo;
        try {
            mkfifo = new ProcessBuilder("mkfifo", fifo.getPath()).start();
        } catch (IOException e) {
            Assume.assumeNoException(e);
            return;
        }
        Assume.assumeTrue("mkfifo failed", mkfifo.waitFor() == 0);
        try (RandomAccessFile raf = new RandomAccessFile(fifo, "rw")) {
            Endpoint.fromStream(raf, Endpoint.Role.SOURCE);
            fail();
        } catch (UnsuitableSourceHandleException e) {
            assertEquals("source handle cannot seek", e.getMessage());
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test(expected = UnsuitableSourceHandleException.class)
    public void plainInputStreamIsNotASource() throws Exception {
        Endpoint.fromStream(new ByteArrayInputStream(HELLO), Endpoint.Role.SOURCE);
    }

    @Test(expected = UnsuitableSourceHandleException.class)
    public void closedFileIsNotASource() throws Exception {
        RandomAccessFile raf = new RandomAccessFile(file(HELLO), "r");
        raf.close();
        Endpoint.fromStream(raf, Endpoint.Role.SOURCE);
    }

    @Test
    public void fileBackedHandlesAreSources() throws Exception {
        File file = file(HELLO);
        try (RandomAccessFile raf = new RandomAccessFile(file, "r");
             FileInputStream in = new FileInputStream(file);
             FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
            assertEquals(Endpoint.Kind.STREAM, Endpoint.fromStream(raf, Endpoint.Role.SOURCE).getKind());
            assertEquals(Endpoint.Role.SOURCE, Endpoint.fromStream(in, Endpoint.Role.SOURCE).getRole());
            assertEquals(Endpoint.Role.SOURCE, Endpoint.fromStream(channel, Endpoint.Role.SOURCE).getRole());
        }
    }

    @Test
    public void inMemoryChannelIsASource() throws Exception {
        SeekableInMemoryByteChannel channel = new SeekableInMemoryByteChannel(HELLO);
        byte[] delta = new JavaxdeltaBackend().diff(Endpoint.fromStream(channel, Endpoint.Role.SOURCE), Endpoint.fromBuffer(HELLO_WORLD), null);
        byte[] target = new JavaxdeltaBackend().patch(Endpoint.fromBuffer(HELLO), Endpoint.fromBuffer(delta), null);
        assertArrayEquals(HELLO_WORLD, target);
        assertTrue(channel.isOpen());
    }

    @Test
    public void sequentialInputUsedAsSourceFailsBeforeOutput() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Endpoint source = Endpoint.fromStream(new ByteArrayInputStream(HELLO), Endpoint.Role.INPUT);
        try {
            new JavaxdeltaBackend().diff(source, Endpoint.fromBuffer(HELLO_WORLD), Endpoint.fromStream(out));
            fail();
        } catch (UnsuitableSourceHandleException e) {
            assertEquals(0, out.size());
        }
        try {
            new JavaxdeltaBackend().patch(source, Endpoint.fromBuffer(HELLO_WORLD), Endpoint.fromStream(out));
            fail();
        } catch (UnsuitableSourceHandleException e) {
            assertEquals(0, out.size());
        }
    }

    @Test
    public void pipesCarryTargetAndOutput() throws Exception {
        Pipe in = Pipe.open();
        Pipe out = Pipe.open();
        try {
            in.sink().write(ByteBuffer.wrap(HELLO_WORLD));
            in.sink().close();
            new JavaxdeltaBackend().diff(Endpoint.fromBuffer(HELLO), Endpoint.fromStream(in.source(), Endpoint.Role.INPUT),
                    Endpoint.fromStream(out.sink(), Endpoint.Role.OUTPUT));
            assertTrue(out.sink().isOpen());
            out.sink().close();
            byte[] delta;
            try (InputStream deltaIn = Channels.newInputStream(out.source())) {
                delta = IOUtils.toByteArray(deltaIn);
            }
            assertArrayEquals(HELLO_WORLD, new JavaxdeltaBackend().patch(Endpoint.fromBuffer(HELLO), Endpoint.fromBuffer(delta), null));
        } finally {
            in.source().close();
            out.source().close();
        }
    }

    @Test
    public void writeOnlyChannelCannotBeInput() throws Exception {
        Pipe pipe = Pipe.open();
        try {
            Endpoint.fromStream(pipe.sink(), Endpoint.Role.INPUT);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().endsWith("cannot be read from"));
        } finally {
            pipe.source().close();
            pipe.sink().close();
        }
    }

    @Test
    public void outputStreamTakesOutputRole() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Endpoint.Stream endpoint = Endpoint.fromStream(out);
        assertEquals(Endpoint.Role.OUTPUT, endpoint.getRole());
        assertSame(out, endpoint.getHandle());
    }

    @Test
    public void readOnlyChannelCannotBeOutput() throws Exception {
        Pipe pipe = Pipe.open();
        try {
            Endpoint.fromStream(pipe.source(), Endpoint.Role.OUTPUT);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().endsWith("cannot be written to"));
        } finally {
            pipe.source().close();
            pipe.sink().close();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void bufferCannotBeOutput() throws Exception {
        new JavaxdeltaBackend().diff(Endpoint.fromBuffer(HELLO), Endpoint.fromBuffer(HELLO_WORLD), Endpoint.fromBuffer(new byte[16]));
    }

    @Test
    public void mappedFileIsABuffer() throws Exception {
        File source = file(HELLO);
        File target = file(HELLO_WORLD);
        try (FileChannel s = FileChannel.open(source.toPath(), StandardOpenOption.READ);
             FileChannel t = FileChannel.open(target.toPath(), StandardOpenOption.READ)) {
            Endpoint.Buffer mappedSource = Endpoint.fromMappedFile(s);
            Endpoint.Buffer mappedTarget = Endpoint.fromMappedFile(t);
            assertEquals(Endpoint.Kind.BUFFER, mappedSource.getKind());
            assertEquals(HELLO_WORLD.length, mappedTarget.length());
            byte[] delta = new JavaxdeltaBackend().diff(mappedSource, mappedTarget, null);
            assertArrayEquals(HELLO_WORLD, new JavaxdeltaBackend().patch(mappedSource, Endpoint.fromBuffer(delta), null));
        }
    }

    @Test
    public void bufferRespectsPositionOfByteBuffer() throws Exception {
        ByteBuffer buffer = ByteBuffer.allocateDirect(HELLO_WORLD.length);
        buffer.put(HELLO_WORLD);
        buffer.position(6);
        Endpoint.Buffer endpoint = Endpoint.fromBuffer(buffer);
        assertArrayEquals("world".getBytes(StandardCharsets.UTF_8), endpoint.toByteArray());
        assertArrayEquals("world".getBytes(StandardCharsets.UTF_8), IOUtils.toByteArray(endpoint.openInput()));
        assertEquals(6, buffer.position());
    }

    @Test
    public void bufferSourceSeeks() throws Exception {
        SeekableSource source = Endpoint.fromBuffer(HELLO_WORLD).openSource();
        source.seek(6);
        ByteBuffer bb = ByteBuffer.allocate(5);
        assertEquals(5, source.read(bb));
        assertArrayEquals("world".getBytes(StandardCharsets.UTF_8), bb.array());
    }

    @Test
    public void streamInputIsNotClosed() throws Exception {
        File file = file(HELLO_WORLD);
        try (FileInputStream in = new FileInputStream(file)) {
            Endpoint.Stream endpoint = Endpoint.fromStream(in, Endpoint.Role.INPUT);
            try (InputStream opened = endpoint.openInput()) {
                assertArrayEquals(HELLO_WORLD, IOUtils.toByteArray(opened));
            }
            assertTrue(in.getChannel().isOpen());
        }
    }
}

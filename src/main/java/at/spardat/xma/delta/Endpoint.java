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

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.Channel;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;

import org.apache.commons.compress.utils.CloseShieldFilterInputStream;

import com.nothome.delta.ByteBufferSeekableSource;
import com.nothome.delta.SeekableSource;

/**
 * One argument of a {@link Backend#diff(Endpoint, Endpoint, Endpoint) diff} or
 * {@link Backend#patch(Endpoint, Endpoint, Endpoint) patch} call: either a {@link Buffer} held in
 * memory or a {@link Stream} over a handle owned by the caller.
 * <p>
 * A stream endpoint only borrows its handle for the duration of a call. Nothing obtained from an
 * endpoint closes the underlying handle; opening and closing it stays with the caller.
 * <p>
 * Streams used as the source must be random access (a file, not a pipe or socket), since the
 * delta algorithms revisit earlier source offsets. Input and output streams are read or written
 * once from start to finish and may be sequential.
 */
public abstract class Endpoint {

    /**
     * The position an endpoint takes in an operation.
     */
    public enum Role {
        /** The source of a diff or patch, must be random access when streamed. */
        SOURCE,
        /** The target of a diff or the delta of a patch. */
        INPUT,
        /** Where the result is written. */
        OUTPUT
    }

    /**
     * The variant of an endpoint.
     */
    public enum Kind {
        /** In memory, see {@link Buffer}. */
        BUFFER,
        /** Backed by a handle, see {@link Stream}. */
        STREAM
    }

    /** Buffer size used when reading from a mapped or direct buffer. */
    private static final int BUFFER_LEN = 8 * 1024;

    Endpoint() {
    }

    /**
     * Gets the kind.
     *
     * @return the kind of this endpoint
     */
    public abstract Kind getKind();

    /**
     * Opens this endpoint for random access reads as the source of an operation.
     *
     * @return a seekable view of the source, closing it leaves the handle open
     * @throws UnsuitableSourceHandleException if this is a stream without random access
     * @throws IOException Signals that an I/O exception has occurred.
     */
    public abstract SeekableSource openSource() throws IOException;

    /**
     * Opens this endpoint for a single sequential read as target or delta.
     *
     * @return the input stream, closing it leaves the handle open
     * @throws IOException Signals that an I/O exception has occurred.
     */
    public abstract InputStream openInput() throws IOException;

    /**
     * Wraps bytes held in memory. The array is not copied.
     *
     * @param bytes the bytes
     * @return the endpoint
     */
    public static Buffer fromBuffer(byte[] bytes) {
        if (bytes == null) {
            throw new NullPointerException("bytes");
        }
        return new Buffer(ByteBuffer.wrap(bytes));
    }

    /**
     * Wraps the remaining bytes of a buffer, which may be direct or mapped. The buffer's own
     * position and limit are left untouched.
     *
     * @param buffer the buffer
     * @return the endpoint
     */
    public static Buffer fromBuffer(ByteBuffer buffer) {
        if (buffer == null) {
            throw new NullPointerException("buffer");
        }
        return new Buffer(buffer.slice());
    }

    /**
     * Maps the whole file behind the channel into memory and wraps the mapping. This avoids the
     * system calls and the copies of the streaming API, but the file has to fit into the address
     * space.
     *
     * @param channel an open channel on a regular file
     * @return the endpoint
     * @throws IOException if the file cannot be mapped
     */
    public static Buffer fromMappedFile(FileChannel channel) throws IOException {
        return new Buffer(channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size()));
    }

    /**
     * Wraps an input stream. In the source role the stream has to be a {@link FileInputStream}.
     *
     * @param in the input stream
     * @param role {@link Role#SOURCE} or {@link Role#INPUT}
     * @return the endpoint
     * @throws UnsuitableSourceHandleException if the role is source and the stream is not random access
     */
    public static Stream fromStream(InputStream in, Role role) throws UnsuitableSourceHandleException {
        return Stream.create(in, role);
    }

    /**
     * Wraps an output stream in the output role.
     *
     * @param out the output stream
     * @return the endpoint
     */
    public static Stream fromStream(OutputStream out) {
        return new Stream(out, Role.OUTPUT);
    }

    /**
     * Wraps a channel. In the source role the channel has to be a seekable one on a seekable medium.
     *
     * @param channel the channel
     * @param role the role
     * @return the endpoint
     * @throws UnsuitableSourceHandleException if the role is source and the channel is not random access
     */
    public static Stream fromStream(Channel channel, Role role) throws UnsuitableSourceHandleException {
        return Stream.create(channel, role);
    }

    /**
     * Wraps a random access file, read or written from its current position when used as input or
     * output and from its start when used as source.
     *
     * @param file the file
     * @param role the role
     * @return the endpoint
     * @throws UnsuitableSourceHandleException if the role is source and the file cannot seek
     */
    public static Stream fromStream(RandomAccessFile file, Role role) throws UnsuitableSourceHandleException {
        return Stream.create(file, role);
    }

    /**
     * Bytes in memory.
     */
    public static final class Buffer extends Endpoint {

        /** The bytes, position 0 to limit. */
        private final ByteBuffer bytes;

        Buffer(ByteBuffer bytes) {
            this.bytes = bytes;
        }

        @Override
        public Kind getKind() {
            return Kind.BUFFER;
        }

        /**
         * Gets the length.
         *
         * @return the number of bytes
         */
        public int length() {
            return bytes.remaining();
        }

        /**
         * Copies the bytes out.
         *
         * @return a copy of the bytes
         */
        public byte[] toByteArray() {
            byte[] copy = new byte[bytes.remaining()];
            bytes.duplicate().get(copy);
            return copy;
        }

        @Override
        public SeekableSource openSource() {
            return new ByteBufferSeekableSource(bytes.duplicate());
        }

        @Override
        public InputStream openInput() {
            if (bytes.hasArray()) {
                return new ByteArrayInputStream(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
            }
            return new ByteBufferInputStream(bytes.duplicate());
        }

        @Override
        public String toString() {
            return "Buffer[" + bytes.remaining() + " bytes]";
        }
    }

    /**
     * A handle owned by the caller, tagged with the role it was created for.
     */
    public static final class Stream extends Endpoint {

        /** The handle, an input or output stream, a channel or a random access file. */
        private final Object handle;

        /** The role. */
        private final Role role;

        private Stream(Object handle, Role role) {
            if (handle == null) {
                throw new NullPointerException("handle");
            }
            if (role == null) {
                throw new NullPointerException("role");
            }
            this.handle = handle;
            this.role = role;
            switch (role) {
            case SOURCE:
                break;
            case INPUT:
                if (!(handle instanceof InputStream || handle instanceof ReadableByteChannel || handle instanceof RandomAccessFile)) {
                    throw new IllegalArgumentException(handle.getClass().getName() + " cannot be read from");
                }
                break;
            case OUTPUT:
                if (!(handle instanceof OutputStream || handle instanceof WritableByteChannel || handle instanceof RandomAccessFile)) {
                    throw new IllegalArgumentException(handle.getClass().getName() + " cannot be written to");
                }
                break;
            default:
                throw new IllegalArgumentException("role " + role);
            }
        }

        /**
         * Creates a stream, checking a source handle for random access.
         */
        static Stream create(Object handle, Role role) throws UnsuitableSourceHandleException {
            Stream stream = new Stream(handle, role);
            if (role == Role.SOURCE) {
                stream.seekableChannel();
            }
            return stream;
        }

        @Override
        public Kind getKind() {
            return Kind.STREAM;
        }

        /**
         * Gets the role.
         *
         * @return the role this stream was created for
         */
        public Role getRole() {
            return role;
        }

        /**
         * Gets the handle.
         *
         * @return the borrowed handle
         */
        public Object getHandle() {
            return handle;
        }

        @Override
        public SeekableSource openSource() throws IOException {
            return new ChannelSeekableSource(seekableChannel());
        }

        @Override
        public InputStream openInput() throws IOException {
            InputStream in;
            if (handle instanceof InputStream) {
                in = (InputStream) handle;
            } else if (handle instanceof ReadableByteChannel) {
                in = Channels.newInputStream((ReadableByteChannel) handle);
            } else if (handle instanceof RandomAccessFile) {
                in = Channels.newInputStream(((RandomAccessFile) handle).getChannel());
            } else {
                throw new IllegalArgumentException(handle.getClass().getName() + " cannot be read from");
            }
            return new CloseShieldFilterInputStream(in);
        }

        /**
         * Opens this endpoint for sequential writes of the result.
         *
         * @return the output stream, closing it leaves the handle open
         * @throws IOException Signals that an I/O exception has occurred.
         */
        public OutputStream openOutput() throws IOException {
            OutputStream out;
            if (handle instanceof OutputStream) {
                out = (OutputStream) handle;
            } else if (handle instanceof WritableByteChannel) {
                out = Channels.newOutputStream((WritableByteChannel) handle);
            } else if (handle instanceof RandomAccessFile) {
                out = Channels.newOutputStream(((RandomAccessFile) handle).getChannel());
            } else {
                throw new IllegalArgumentException(handle.getClass().getName() + " cannot be written to");
            }
            return new NonClosingOutputStream(out);
        }

        /**
         * Finds the seekable channel behind the handle and makes sure it can actually seek. A
         * {@link FileChannel} on a pipe passes the type check but fails here.
         */
        private SeekableByteChannel seekableChannel() throws UnsuitableSourceHandleException {
            SeekableByteChannel channel;
            if (handle instanceof SeekableByteChannel) {
                channel = (SeekableByteChannel) handle;
            } else if (handle instanceof RandomAccessFile) {
                channel = ((RandomAccessFile) handle).getChannel();
            } else if (handle instanceof FileInputStream) {
                channel = ((FileInputStream) handle).getChannel();
            } else if (handle instanceof FileOutputStream) {
                throw new UnsuitableSourceHandleException("source handle is write only: " + handle.getClass().getName());
            } else {
                throw new UnsuitableSourceHandleException("source handle is not random access: " + handle.getClass().getName());
            }
            if (!channel.isOpen()) {
                throw new UnsuitableSourceHandleException("source handle is closed");
            }
            try {
                long position = channel.position();
                channel.size();
                channel.position(position);
            } catch (IOException e) {
                throw new UnsuitableSourceHandleException("source handle cannot seek", e);
            }
            return channel;
        }

        @Override
        public String toString() {
            return "Stream[" + role + ", " + handle.getClass().getSimpleName() + "]";
        }
    }

    /**
     * Reads a buffer without a backing array.
     */
    private static final class ByteBufferInputStream extends InputStream {

        private final ByteBuffer bytes;

        ByteBufferInputStream(ByteBuffer bytes) {
            this.bytes = bytes;
        }

        @Override
        public int read() {
            return bytes.hasRemaining() ? bytes.get() & 0xff : -1;
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (!bytes.hasRemaining()) {
                return len == 0 ? 0 : -1;
            }
            int n = Math.min(Math.min(len, bytes.remaining()), BUFFER_LEN);
            bytes.get(b, off, n);
            return n;
        }

        @Override
        public int available() {
            return bytes.remaining();
        }
    }
}

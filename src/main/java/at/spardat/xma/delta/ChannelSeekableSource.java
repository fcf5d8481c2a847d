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
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

import com.nothome.delta.SeekableSource;

/**
 * A {@link SeekableSource} over a borrowed {@link SeekableByteChannel}.
 * Closing it leaves the channel open.
 */
class ChannelSeekableSource implements SeekableSource {

    /** The channel. */
    private final SeekableByteChannel channel;

    /**
     * Constructs a new ChannelSeekableSource positioned at the start of the channel.
     *
     * @param channel the channel
     * @throws IOException Signals that an I/O exception has occurred.
     */
    ChannelSeekableSource(SeekableByteChannel channel) throws IOException {
        this.channel = channel;
        channel.position(0);
    }

    /* (non-Javadoc)
     * @see com.nothome.delta.SeekableSource#seek(long)
     */
    public void seek(long pos) throws IOException {
        channel.position(pos);
    }

    /**
     * Reads until the buffer is full or the end of the channel is reached. The checksum pass of
     * {@link com.nothome.delta.Delta} stops at the first short read, so a channel returning fewer
     * bytes than available must not leak through.
     *
     * @param bb the buffer to fill
     * @return the number of bytes read, or -1 at the end of the channel
     * @throws IOException Signals that an I/O exception has occurred.
     */
    public int read(ByteBuffer bb) throws IOException {
        int total = 0;
        while (bb.hasRemaining()) {
            int read = channel.read(bb);
            if (read < 0) {
                return total == 0 ? -1 : total;
            }
            total += read;
        }
        return total;
    }

    /* (non-Javadoc)
     * @see java.io.Closeable#close()
     */
    public void close() {
        // the channel belongs to the caller
    }
}

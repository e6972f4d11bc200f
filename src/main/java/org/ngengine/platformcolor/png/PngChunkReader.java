package org.ngengine.platformcolor.png;

/** Bounds-checked big-endian cursor over a PNG byte stream. */
final class PngChunkReader {
    private final byte[] data;
    private final int limit;
    private int pos;

    PngChunkReader(byte[] data, int off, int len) throws PngDecodeException {
        if (off < 0 || len < 0 || off + len > data.length || off + len < off) {
            throw new PngDecodeException("Invalid PNG buffer bounds");
        }
        this.data = data;
        this.pos = off;
        this.limit = off + len;
    }

    /** Returns current read position relative to the backing byte array. */
    int position() {
        return pos;
    }

    /** Returns remaining unread bytes inside the configured slice. */
    int remaining() {
        return limit - pos;
    }

    /** Reads an unsigned 8-bit value. */
    int readU8() throws PngDecodeException {
        if (pos >= limit) {
            throw new PngDecodeException("Unexpected EOF");
        }
        return data[pos++] & 0xFF;
    }

    /** Reads an unsigned 32-bit big-endian value. */
    long readU32BE() throws PngDecodeException {
        if (remaining() < 4) {
            throw new PngDecodeException("Unexpected EOF");
        }
        long v = ((long) (data[pos] & 0xFF) << 24)
                | ((data[pos + 1] & 0xFF) << 16)
                | ((data[pos + 2] & 0xFF) << 8)
                | (data[pos + 3] & 0xFF);
        pos += 4;
        return v;
    }

    /** Reads a four-character chunk type tag. */
    String readChunkType() throws PngDecodeException {
        if (remaining() < 4) {
            throw new PngDecodeException("Unexpected EOF");
        }
        char[] tag = new char[4];
        for (int i = 0; i < 4; i++) {
            tag[i] = (char) (data[pos + i] & 0xFF);
        }
        pos += 4;
        return new String(tag);
    }

    /** Reads and returns a new byte array of length {@code len}. */
    byte[] readBytes(int len) throws PngDecodeException {
        if (len < 0) {
            throw new PngDecodeException("Invalid read length: " + len);
        }
        if (len > remaining()) {
            throw new PngDecodeException("Unexpected EOF");
        }
        byte[] out = new byte[len];
        System.arraycopy(data, pos, out, 0, len);
        pos += len;
        return out;
    }

    /** Advances the read position by {@code len} bytes. */
    void skip(int len) throws PngDecodeException {
        if (len < 0 || len > remaining()) {
            throw new PngDecodeException("Unexpected EOF");
        }
        pos += len;
    }
}

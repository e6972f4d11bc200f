package org.ngengine.platformcolor.png;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;
import java.util.zip.Deflater;

/** Hand-framed PNG byte streams for decoder tests. */
public final class PngFixtures {
    public static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private PngFixtures() {}

    /** IHDR payload. */
    public static byte[] ihdr(int width, int height, int bitDepth, int colorType, int interlace) {
        ByteBuffer bb = ByteBuffer.allocate(13);
        bb.putInt(width);
        bb.putInt(height);
        bb.put((byte) bitDepth);
        bb.put((byte) colorType);
        bb.put((byte) 0);
        bb.put((byte) 0);
        bb.put((byte) interlace);
        return bb.array();
    }

    /** One chunk: length, type, payload, CRC over type and payload. */
    public static byte[] chunk(String type, byte[] payload) {
        byte[] typeBytes = type.getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(typeBytes);
        crc.update(payload);
        ByteBuffer bb = ByteBuffer.allocate(12 + payload.length);
        bb.putInt(payload.length);
        bb.put(typeBytes);
        bb.put(payload);
        bb.putInt((int) crc.getValue());
        return bb.array();
    }

    public static byte[] zlib(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.write(p, 0, p.length);
        }
        return out.toByteArray();
    }

    /**
     * Complete PNG from an already-filtered scanline stream (each row prefixed by its filter tag).
     */
    public static byte[] fromRawScanlines(int width, int height, int colorType, byte[] rawScanlines) {
        return concat(
                SIGNATURE,
                chunk("IHDR", ihdr(width, height, 8, colorType, 0)),
                chunk("IDAT", zlib(rawScanlines)),
                chunk("IEND", new byte[0]));
    }

    /** Complete PNG whose rows all use filter type 0 over the given samples. */
    public static byte[] unfiltered(int width, int height, int colorType, byte[] samples) {
        int stride = samples.length / height;
        byte[] raw = new byte[height * (stride + 1)];
        for (int y = 0; y < height; y++) {
            raw[y * (stride + 1)] = 0;
            System.arraycopy(samples, y * stride, raw, y * (stride + 1) + 1, stride);
        }
        return fromRawScanlines(width, height, colorType, raw);
    }

    /** Complete RGBA PNG, filter type 0, from a tightly-packed RGBA buffer. */
    public static byte[] rgba(int width, int height, byte[] rgba) {
        return unfiltered(width, height, 6, rgba);
    }
}

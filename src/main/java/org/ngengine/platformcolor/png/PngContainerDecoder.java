package org.ngengine.platformcolor.png;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import org.ngengine.platformcolor.AnalyzerOptions;
import org.ngengine.platformcolor.DecodedImage;
import org.ngengine.platformcolor.SourceFormat;

/** PNG chunk parser that reassembles IDAT, inflates, defilters and expands to RGBA8888. */
final class PngContainerDecoder {
    static final byte[] SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final int INFLATE_CHUNK = 64 * 1024;

    private PngContainerDecoder() {}

    static DecodedImage decode(byte[] bytes, AnalyzerOptions options) throws PngDecodeException {
        if (!hasSignature(bytes)) {
            throw new PngDecodeException("Invalid PNG signature");
        }
        PngChunkReader reader = new PngChunkReader(bytes, SIGNATURE.length, bytes.length - SIGNATURE.length);

        PngHeader header = null;
        List<byte[]> idat = new ArrayList<>();
        int idatLength = 0;

        while (reader.remaining() > 0) {
            long length = reader.readU32BE();
            if (length > Integer.MAX_VALUE) {
                throw new PngDecodeException("Invalid chunk length: " + length);
            }
            String type = reader.readChunkType();
            byte[] payload = reader.readBytes((int) length);
            reader.skip(4); // CRC is not verified

            if ("IHDR".equals(type)) {
                header = PngHeader.parse(payload);
            } else if ("IDAT".equals(type)) {
                idat.add(payload);
                idatLength = Math.addExact(idatLength, payload.length);
            } else if ("IEND".equals(type)) {
                break;
            }
        }

        if (header == null) {
            throw new PngDecodeException("Missing IHDR chunk");
        }
        if (header.interlace != 0) {
            throw new PngDecodeException("Interlaced PNGs are not supported");
        }
        if (header.bitDepth != 8) {
            throw new PngDecodeException("Only 8-bit depth PNGs are supported, got " + header.bitDepth);
        }
        int bpp = header.bytesPerPixel();
        checkBudget(header, options);
        if (idat.isEmpty()) {
            throw new PngDecodeException("Missing IDAT chunk");
        }

        byte[] compressed = new byte[idatLength];
        int off = 0;
        for (byte[] part : idat) {
            System.arraycopy(part, 0, compressed, off, part.length);
            off += part.length;
        }

        int stride = Math.multiplyExact(header.width, bpp);
        int expected = Math.multiplyExact(header.height, stride + 1);
        byte[] raw = inflate(compressed, expected);

        byte[] rgba = new byte[Math.multiplyExact(Math.multiplyExact(header.width, header.height), 4)];
        byte[] prev = new byte[stride];
        byte[] line = new byte[stride];
        int inPos = 0;
        for (int y = 0; y < header.height; y++) {
            int filterType = raw[inPos++] & 0xFF;
            System.arraycopy(raw, inPos, line, 0, stride);
            inPos += stride;
            try {
                PngScanlineFilter.unfilter(filterType, line, prev, bpp);
            } catch (PngDecodeException e) {
                throw new PngDecodeException(e.getMessage() + " at row " + y, e);
            }
            expandRow(header.colorType, line, header.width, rgba, y * header.width * 4);
            byte[] t = prev;
            prev = line;
            line = t;
        }

        return new DecodedImage(header.width, header.height, SourceFormat.PNG, ByteBuffer.wrap(rgba));
    }

    static boolean hasSignature(byte[] bytes) {
        if (bytes == null || bytes.length < SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (bytes[i] != SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    private static void checkBudget(PngHeader header, AnalyzerOptions options) throws PngDecodeException {
        long pixels = (long) header.width * header.height;
        if (pixels > options.maxPixels()) {
            throw new PngDecodeException("Image too large: " + header.width + "x" + header.height);
        }
        int longSide = Math.max(header.width, header.height);
        int shortSide = Math.min(header.width, header.height);
        if ((double) longSide / shortSide > options.maxAspectRatio()) {
            throw new PngDecodeException("Extreme aspect ratio: " + header.width + "x" + header.height);
        }
    }

    /**
     * Inflates the zlib stream, requiring at least {@code expected} bytes of output.
     * The output buffer grows with the inflated data and never exceeds {@code expected}.
     */
    private static byte[] inflate(byte[] compressed, int expected) throws PngDecodeException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            byte[] out = new byte[Math.min(expected, INFLATE_CHUNK)];
            int filled = 0;
            while (filled < expected) {
                if (filled == out.length) {
                    out = Arrays.copyOf(out, (int) Math.min(expected, 2L * out.length));
                }
                int n = inflater.inflate(out, filled, out.length - filled);
                if (n == 0) {
                    if (inflater.needsDictionary()) {
                        throw new PngDecodeException("Preset zlib dictionary is not supported");
                    }
                    break;
                }
                filled += n;
            }
            if (filled < expected) {
                throw new PngDecodeException("Truncated image data: " + filled + " of " + expected + " bytes");
            }
            return out;
        } catch (DataFormatException e) {
            throw new PngDecodeException("Corrupt zlib stream", e);
        } finally {
            inflater.end();
        }
    }

    private static void expandRow(int colorType, byte[] line, int width, byte[] rgba, int outOff) {
        int o = outOff;
        switch (colorType) {
            case PngHeader.COLOR_RGBA:
                System.arraycopy(line, 0, rgba, outOff, width * 4);
                return;
            case PngHeader.COLOR_RGB:
                for (int i = 0; i < width * 3; i += 3) {
                    rgba[o++] = line[i];
                    rgba[o++] = line[i + 1];
                    rgba[o++] = line[i + 2];
                    rgba[o++] = (byte) 0xFF;
                }
                return;
            case PngHeader.COLOR_GRAY:
                for (int i = 0; i < width; i++) {
                    byte v = line[i];
                    rgba[o++] = v;
                    rgba[o++] = v;
                    rgba[o++] = v;
                    rgba[o++] = (byte) 0xFF;
                }
                return;
            default:
                // gray + alpha
                for (int i = 0; i < width * 2; i += 2) {
                    byte v = line[i];
                    rgba[o++] = v;
                    rgba[o++] = v;
                    rgba[o++] = v;
                    rgba[o++] = line[i + 1];
                }
        }
    }
}

package org.ngengine.platformcolor.png;

/** Parsed IHDR fields. */
final class PngHeader {
    static final int COLOR_GRAY = 0;
    static final int COLOR_RGB = 2;
    static final int COLOR_GRAY_ALPHA = 4;
    static final int COLOR_RGBA = 6;

    final int width;
    final int height;
    final int bitDepth;
    final int colorType;
    final int interlace;

    PngHeader(int width, int height, int bitDepth, int colorType, int interlace) {
        this.width = width;
        this.height = height;
        this.bitDepth = bitDepth;
        this.colorType = colorType;
        this.interlace = interlace;
    }

    static PngHeader parse(byte[] ihdr) throws PngDecodeException {
        if (ihdr.length < 13) {
            throw new PngDecodeException("Invalid IHDR chunk");
        }
        PngChunkReader r = new PngChunkReader(ihdr, 0, ihdr.length);
        long w = r.readU32BE();
        long h = r.readU32BE();
        int bitDepth = r.readU8();
        int colorType = r.readU8();
        r.skip(2); // compression, filter method
        int interlace = r.readU8();
        if (w <= 0 || h <= 0 || w > Integer.MAX_VALUE || h > Integer.MAX_VALUE) {
            throw new PngDecodeException("Invalid dimensions: " + w + "x" + h);
        }
        return new PngHeader((int) w, (int) h, bitDepth, colorType, interlace);
    }

    /** Bytes per pixel for the supported 8-bit colour types. */
    int bytesPerPixel() throws PngDecodeException {
        switch (colorType) {
            case COLOR_RGBA:
                return 4;
            case COLOR_RGB:
                return 3;
            case COLOR_GRAY:
                return 1;
            case COLOR_GRAY_ALPHA:
                return 2;
            default:
                throw new PngDecodeException("Unsupported PNG color type: " + colorType);
        }
    }
}

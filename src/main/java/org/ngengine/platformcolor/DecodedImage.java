package org.ngengine.platformcolor;

import java.nio.ByteBuffer;
import java.util.Objects;

/** Decoded screenshot as tightly-packed RGBA8888, row-major. */
public final class DecodedImage {
    private static final ByteBuffer NO_PIXELS = ByteBuffer.allocate(0).asReadOnlyBuffer();

    /** Image width in pixels. */
    public final int width;
    /** Image height in pixels. */
    public final int height;
    /** Format the pixels were decoded from. */
    public final SourceFormat format;

    /** Tightly-packed RGBA8888, read-only. Use absolute gets. */
    public final ByteBuffer rgba;

    /**
     * Creates a decoded image container.
     *
     * @param width image width in pixels
     * @param height image height in pixels
     * @param format source format tag
     * @param rgba tightly-packed RGBA8888 buffer with size {@code width * height * 4}
     */
    public DecodedImage(int width, int height, SourceFormat format, ByteBuffer rgba) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + width + "x" + height);
        }
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(rgba, "rgba");
        long expected = (long) width * height * 4;
        if (rgba.remaining() != expected) {
            throw new IllegalArgumentException("RGBA buffer holds " + rgba.remaining() + " bytes, expected " + expected);
        }
        this.width = width;
        this.height = height;
        this.format = format;
        this.rgba = rgba.slice().asReadOnlyBuffer();
    }

    /** The "could not decode" sentinel: zero area, empty buffer. */
    public static DecodedImage empty(SourceFormat format) {
        return new DecodedImage(0, 0, format, NO_PIXELS);
    }

    /** True for zero-area images, including the {@link #empty} sentinel. */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}

package org.ngengine.platformcolor.png;

import java.util.Objects;

import org.ngengine.platformcolor.AnalyzerOptions;
import org.ngengine.platformcolor.DecodedImage;

/** Pure-Java decoder for the 8-bit, non-interlaced, non-palette PNG subset. */
public final class PngDecoder {
    private PngDecoder() {}

    /**
     * Decodes a PNG image from complete file bytes using default resource limits.
     *
     * @param pngBytes full PNG file bytes
     * @return decoded image in RGBA8888 format
     * @throws PngDecodeException if the input is invalid, unsupported, or truncated
     */
    public static DecodedImage decode(byte[] pngBytes) throws PngDecodeException {
        return decode(pngBytes, AnalyzerOptions.defaults());
    }

    /**
     * Decodes a PNG image from complete file bytes.
     *
     * @param pngBytes full PNG file bytes
     * @param options pixel budget and aspect-ratio limits checked before inflating
     * @return decoded image in RGBA8888 format
     * @throws PngDecodeException if the input is invalid, unsupported, truncated, or exceeds the limits
     */
    public static DecodedImage decode(byte[] pngBytes, AnalyzerOptions options) throws PngDecodeException {
        Objects.requireNonNull(options, "options");
        if (pngBytes == null) {
            throw new PngDecodeException("Input is null");
        }
        try {
            return PngContainerDecoder.decode(pngBytes, options);
        } catch (RuntimeException e) {
            // e.g. ArithmeticException from hostile header sizes
            throw new PngDecodeException("Invalid or corrupt PNG", e);
        }
    }

    /** Returns true when {@code bytes} starts with the 8-byte PNG signature. */
    public static boolean isPng(byte[] bytes) {
        return PngContainerDecoder.hasSignature(bytes);
    }
}

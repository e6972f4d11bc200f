package org.ngengine.platformcolor;

import java.util.Objects;

import org.ngengine.platformcolor.png.PngDecodeException;
import org.ngengine.platformcolor.png.PngDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sniffs the container format and decodes what this library supports (PNG only). */
public final class ScreenshotDecoder {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotDecoder.class);

    private ScreenshotDecoder() {}

    /**
     * Decodes screenshot bytes.
     *
     * @return decoded PNG pixels, or an {@linkplain DecodedImage#empty empty sentinel} tagged
     *         {@link SourceFormat#JPEG} or {@link SourceFormat#UNKNOWN} for anything that is not PNG
     * @throws PngDecodeException if the bytes carry a PNG signature but cannot be decoded
     */
    public static DecodedImage decode(byte[] bytes, AnalyzerOptions options) throws PngDecodeException {
        Objects.requireNonNull(options, "options");
        if (PngDecoder.isPng(bytes)) {
            return PngDecoder.decode(bytes, options);
        }
        if (isJpeg(bytes)) {
            log.debug("JPEG input is recognised but not decoded");
            return DecodedImage.empty(SourceFormat.JPEG);
        }
        return DecodedImage.empty(SourceFormat.UNKNOWN);
    }

    /** True when {@code bytes} starts with the JPEG start-of-image marker {@code FF D8 FF}. */
    static boolean isJpeg(byte[] bytes) {
        return bytes != null
                && bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xFF
                && (bytes[1] & 0xFF) == 0xD8
                && (bytes[2] & 0xFF) == 0xFF;
    }
}

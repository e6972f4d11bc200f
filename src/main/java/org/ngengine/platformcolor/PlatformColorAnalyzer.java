package org.ngengine.platformcolor;

import java.util.Objects;

import org.ngengine.platformcolor.png.PngDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: screenshot bytes in, {@link ColorAnalysis} out.
 *
 * <p>Never throws for bad input. Decode failures are logged and reported as
 * {@link ColorAnalysis#NONE}. Instances are immutable and safe to share between threads.</p>
 */
public final class PlatformColorAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PlatformColorAnalyzer.class);

    private static final PlatformColorAnalyzer DEFAULT = new PlatformColorAnalyzer(AnalyzerOptions.defaults());

    private final AnalyzerOptions options;

    public PlatformColorAnalyzer(AnalyzerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Shared analyzer using {@link AnalyzerOptions#defaults()}. */
    public static PlatformColorAnalyzer withDefaults() {
        return DEFAULT;
    }

    /**
     * Detects the dashboard platform from screenshot colours.
     *
     * @param bytes full image file bytes; PNG is decoded, everything else yields no decision
     * @param originalWidth width of the screenshot before any client-side scaling; {@code 0}
     *                      means unknown and the decoded width is used, negative values
     *                      are passed through and disable the small-capture tolerance
     * @return colour analysis, {@link ColorAnalysis#NONE} when the input cannot be decoded
     */
    public ColorAnalysis analyze(byte[] bytes, int originalWidth) {
        try {
            DecodedImage decoded = ScreenshotDecoder.decode(bytes, options);
            if (decoded.isEmpty()) {
                log.debug("No pixels to analyze (format={})", decoded.format);
                return RegionClassifier.classify(decoded, originalWidth);
            }
            int widthHint = originalWidth == 0 ? decoded.width : originalWidth;
            ColorAnalysis analysis = RegionClassifier.classify(decoded, widthHint);
            if (log.isDebugEnabled()) {
                log.debug("Analyzed {}x{} screenshot: {}", decoded.width, decoded.height, analysis);
            }
            return analysis;
        } catch (PngDecodeException e) {
            log.warn("Color analysis failed: {}", e.getMessage());
            return ColorAnalysis.NONE;
        } catch (RuntimeException e) {
            log.warn("Color analysis failed unexpectedly", e);
            return ColorAnalysis.NONE;
        }
    }
}

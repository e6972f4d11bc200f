package org.ngengine.platformcolor;

/**
 * Resource limits applied before a screenshot is inflated.
 *
 * <p>Width is bounded later by the resizer, but height and total area are not, so a hostile
 * header could otherwise request an arbitrarily large buffer.</p>
 */
public final class AnalyzerOptions {
    public static final long DEFAULT_MAX_PIXELS = 40_000_000L;
    public static final double DEFAULT_MAX_ASPECT_RATIO = 16.0;

    private static final AnalyzerOptions DEFAULTS = new AnalyzerOptions(DEFAULT_MAX_PIXELS, DEFAULT_MAX_ASPECT_RATIO);

    private final long maxPixels;
    private final double maxAspectRatio;

    private AnalyzerOptions(long maxPixels, double maxAspectRatio) {
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("maxPixels must be positive: " + maxPixels);
        }
        if (!(maxAspectRatio >= 1.0)) {
            throw new IllegalArgumentException("maxAspectRatio must be >= 1: " + maxAspectRatio);
        }
        this.maxPixels = maxPixels;
        this.maxAspectRatio = maxAspectRatio;
    }

    public static AnalyzerOptions defaults() {
        return DEFAULTS;
    }

    /** Largest {@code width * height} accepted by the decoder. */
    public long maxPixels() {
        return maxPixels;
    }

    /** Largest long-side to short-side ratio accepted by the decoder. */
    public double maxAspectRatio() {
        return maxAspectRatio;
    }

    public AnalyzerOptions withMaxPixels(long maxPixels) {
        return new AnalyzerOptions(maxPixels, maxAspectRatio);
    }

    public AnalyzerOptions withMaxAspectRatio(double maxAspectRatio) {
        return new AnalyzerOptions(maxPixels, maxAspectRatio);
    }

    @Override
    public String toString() {
        return "AnalyzerOptions{maxPixels=" + maxPixels + ", maxAspectRatio=" + maxAspectRatio + "}";
    }
}

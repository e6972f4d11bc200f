package org.ngengine.platformcolor;

import java.util.Objects;
import java.util.Optional;

/** Outcome of colour-based platform detection for one screenshot. */
public final class ColorAnalysis {
    /** Result for undecodable or unsupported input: zero metrics, no pass, no decision. */
    public static final ColorAnalysis NONE = new ColorAnalysis(ColorMetrics.EMPTY, false, false, null);

    public final ColorMetrics metrics;
    public final boolean tiktokColorPass;
    public final boolean shopeeColorPass;
    private final Platform colorDecision;

    /**
     * @param colorDecision chosen platform, or {@code null} when colours are inconclusive
     */
    public ColorAnalysis(ColorMetrics metrics, boolean tiktokColorPass, boolean shopeeColorPass, Platform colorDecision) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tiktokColorPass = tiktokColorPass;
        this.shopeeColorPass = shopeeColorPass;
        this.colorDecision = colorDecision;
    }

    public Optional<Platform> colorDecision() {
        return Optional.ofNullable(colorDecision);
    }

    @Override
    public String toString() {
        return "ColorAnalysis{tiktokColorPass=" + tiktokColorPass
                + ", shopeeColorPass=" + shopeeColorPass
                + ", colorDecision=" + (colorDecision == null ? "none" : colorDecision.id())
                + ", metrics=" + metrics
                + "}";
    }
}

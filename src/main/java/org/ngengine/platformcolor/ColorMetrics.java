package org.ngengine.platformcolor;

/** Region-weighted colour ratios gathered from one screenshot. All ratios lie in [0, 1]. */
public final class ColorMetrics {
    /** All-zero metrics with an invalid panel. */
    public static final ColorMetrics EMPTY = new ColorMetrics(0, 0, 0, 0, 0, 0, 0, false);

    /** Share of header pixels close to the dark background colour. */
    public final double headerDark;
    public final double overallDark;
    /** Share of panel pixels close to the accent colour. */
    public final double panelAccent;
    public final double overallAccent;
    public final double headerAccent;
    /** Share of panel pixels in the saturated orange band. */
    public final double panelOrange;
    public final double overallOrange;
    /** True when the panel holds at least 5% of counted pixels; otherwise panel ratios use the total. */
    public final boolean panelValid;

    public ColorMetrics(
            double headerDark,
            double overallDark,
            double panelAccent,
            double overallAccent,
            double headerAccent,
            double panelOrange,
            double overallOrange,
            boolean panelValid
    ) {
        this.headerDark = headerDark;
        this.overallDark = overallDark;
        this.panelAccent = panelAccent;
        this.overallAccent = overallAccent;
        this.headerAccent = headerAccent;
        this.panelOrange = panelOrange;
        this.overallOrange = overallOrange;
        this.panelValid = panelValid;
    }

    @Override
    public String toString() {
        return "ColorMetrics{headerDark=" + headerDark
                + ", overallDark=" + overallDark
                + ", panelAccent=" + panelAccent
                + ", overallAccent=" + overallAccent
                + ", headerAccent=" + headerAccent
                + ", panelOrange=" + panelOrange
                + ", overallOrange=" + overallOrange
                + ", panelValid=" + panelValid
                + "}";
    }
}

package org.ngengine.platformcolor;

import java.nio.ByteBuffer;

/**
 * Scores region-weighted colour statistics of a decoded screenshot and decides between the
 * TikTok live dashboard (dark background, crimson accent) and the Shopee live dashboard
 * (saturated orange panel).
 *
 * <p>Regions are fractions of the resized frame: a 3% margin is ignored on every edge, the
 * header is the top 15% of rows, and the panel spans rows 30%..70% and columns 20%..80%.</p>
 */
public final class RegionClassifier {
    static final Lab DARK_TARGET = ColorScience.rgbToLab(32, 32, 34);
    static final Lab ACCENT_TARGET = ColorScience.rgbToLab(149, 48, 68);

    static final double DARK_DELTA = 11;
    static final double ACCENT_DELTA = 21;
    static final int SMALL_IMAGE_WIDTH = 800;
    static final double TOLERANCE_BOOST = 1.2;

    static final int MIN_ALPHA = 32;
    static final double ORANGE_MIN_SATURATION = 0.7;
    static final double ORANGE_MIN_VALUE = 0.7;
    static final double ORANGE_HUE_MIN = 5;
    static final double ORANGE_HUE_MAX = 35;

    private RegionClassifier() {}

    /**
     * Classifies a decoded screenshot.
     *
     * @param img decoded image, possibly the empty sentinel
     * @param originalWidth width of the screenshot as uploaded, used only to widen tolerances
     *                      for small captures; values {@code <= 0} disable that boost
     * @return colour analysis, {@link ColorAnalysis#NONE} for zero-area input
     */
    public static ColorAnalysis classify(DecodedImage img, int originalWidth) {
        DecodedImage target = NearestNeighborResizer.resize(img);
        if (target.isEmpty()) {
            return ColorAnalysis.NONE;
        }
        ColorMetrics metrics = measure(target, toleranceMultiplier(img.format, originalWidth));
        return decide(metrics);
    }

    static double toleranceMultiplier(SourceFormat format, int originalWidth) {
        boolean smallImage = originalWidth > 0 && originalWidth < SMALL_IMAGE_WIDTH;
        double m = smallImage ? TOLERANCE_BOOST : 1;
        // JPEG never decodes to pixels today, so this branch cannot fire yet.
        if (format == SourceFormat.JPEG) {
            m *= TOLERANCE_BOOST;
        }
        return m;
    }

    static ColorMetrics measure(DecodedImage img, double toleranceMultiplier) {
        int width = img.width;
        int height = img.height;
        ByteBuffer data = img.rgba;

        double darkDelta = DARK_DELTA * toleranceMultiplier;
        double accentDelta = ACCENT_DELTA * toleranceMultiplier;

        int marginX = Math.max(1, (int) Math.round(width * 0.03));
        int marginY = Math.max(1, (int) Math.round(height * 0.03));
        int headerY = (int) Math.round(height * 0.15);
        int panelY0 = (int) Math.round(height * 0.3);
        int panelY1 = (int) Math.round(height * 0.7);
        int panelX0 = (int) Math.round(width * 0.2);
        int panelX1 = (int) Math.round(width * 0.8);

        int total = 0;
        int headerCount = 0;
        int panelCount = 0;

        int darkTotal = 0;
        int darkHeader = 0;
        int accentTotal = 0;
        int accentPanel = 0;
        int accentHeader = 0;
        int orangeTotal = 0;
        int orangePanel = 0;

        for (int y = marginY; y < height - marginY; y++) {
            boolean inHeader = y < headerY;
            boolean inPanelY = y >= panelY0 && y <= panelY1;
            for (int x = marginX; x < width - marginX; x++) {
                int idx = (y * width + x) * 4;
                int a = data.get(idx + 3) & 0xFF;
                if (a < MIN_ALPHA) {
                    continue;
                }
                int r = data.get(idx) & 0xFF;
                int g = data.get(idx + 1) & 0xFF;
                int b = data.get(idx + 2) & 0xFF;
                boolean inPanel = inPanelY && x >= panelX0 && x <= panelX1;

                total++;
                if (inHeader) headerCount++;
                if (inPanel) panelCount++;

                Lab lab = ColorScience.rgbToLab(r, g, b);
                if (lab.deltaE(DARK_TARGET) <= darkDelta) {
                    darkTotal++;
                    if (inHeader) darkHeader++;
                }
                if (lab.deltaE(ACCENT_TARGET) <= accentDelta) {
                    accentTotal++;
                    if (inPanel) accentPanel++;
                    if (inHeader) accentHeader++;
                }
                if (isOrange(ColorScience.rgbToHsv(r, g, b))) {
                    orangeTotal++;
                    if (inPanel) orangePanel++;
                }
            }
        }

        boolean panelValid = panelCount >= total * 0.05;
        double totalDen = Math.max(total, 1);
        double headerDen = Math.max(headerCount, 1);
        double panelDen = panelValid ? panelCount : totalDen;
        if (panelDen == 0) {
            // nothing counted: every ratio is 0 and panelValid stays true
            panelDen = 1;
        }

        return new ColorMetrics(
                darkHeader / headerDen,
                darkTotal / totalDen,
                accentPanel / panelDen,
                accentTotal / totalDen,
                accentHeader / headerDen,
                orangePanel / panelDen,
                orangeTotal / totalDen,
                panelValid);
    }

    static boolean isOrange(Hsv hsv) {
        if (hsv.s < ORANGE_MIN_SATURATION || hsv.v < ORANGE_MIN_VALUE) {
            return false;
        }
        double hue = hsv.h < 0 ? hsv.h + 360 : hsv.h;
        return hue >= ORANGE_HUE_MIN && hue <= ORANGE_HUE_MAX;
    }

    static ColorAnalysis decide(ColorMetrics m) {
        boolean tiktokColorPass = false;
        boolean darkPass = m.headerDark >= 0.35 || m.overallDark >= 0.28;
        if (darkPass) {
            boolean accentPass = m.panelAccent >= 0.04 || m.overallAccent >= 0.02;
            if (!accentPass && m.headerDark >= 0.45 && m.overallAccent >= 0.015) {
                accentPass = true;
            }
            if (m.headerAccent > 0.08 && m.headerDark < 0.28) {
                accentPass = false;
            }
            tiktokColorPass = accentPass;
        }

        boolean shopeeColorPass = m.panelOrange >= 0.18 || m.overallOrange >= 0.08 || m.panelOrange >= 0.12;

        Platform decision = null;
        if (tiktokColorPass && !shopeeColorPass) {
            decision = Platform.TIKTOK;
        } else if (!tiktokColorPass && shopeeColorPass) {
            decision = Platform.SHOPEE;
        } else if (tiktokColorPass) {
            decision = breakTie(m);
        }
        return new ColorAnalysis(m, tiktokColorPass, shopeeColorPass, decision);
    }

    private static Platform breakTie(ColorMetrics m) {
        if (m.headerDark - m.panelOrange > 0.15) {
            return Platform.TIKTOK;
        }
        if (m.panelOrange - m.panelAccent > 0.08 && m.overallAccent < 0.02) {
            return Platform.SHOPEE;
        }
        double tiktokScore = m.headerDark * 0.6 + Math.max(m.panelAccent, m.overallAccent) * 0.4;
        double shopeeScore = Math.max(m.panelOrange, m.overallOrange);
        return tiktokScore >= shopeeScore ? Platform.TIKTOK : Platform.SHOPEE;
    }
}

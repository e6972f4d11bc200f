package org.ngengine.platformcolor;

/** sRGB to CIE Lab and HSV conversions on 8-bit channels. */
public final class ColorScience {
    // D65 reference white, Y normalised to 100
    static final double REF_X = 95.047;
    static final double REF_Y = 100.0;
    static final double REF_Z = 108.883;

    private static final double DELTA = 6.0 / 29.0;
    private static final double DELTA_CUBED = DELTA * DELTA * DELTA;

    private ColorScience() {}

    /** Linearises one 8-bit sRGB channel to [0, 1]. */
    public static double srgbToLinear(int v) {
        double c = v / 255.0;
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    /** Converts 8-bit sRGB to XYZ scaled so that white has Y = 100. Returns {x, y, z}. */
    public static double[] rgbToXyz(int r, int g, int b) {
        double rl = srgbToLinear(r);
        double gl = srgbToLinear(g);
        double bl = srgbToLinear(b);

        double x = rl * 0.4124564 + gl * 0.3575761 + bl * 0.1804375;
        double y = rl * 0.2126729 + gl * 0.7151522 + bl * 0.0721750;
        double z = rl * 0.0193339 + gl * 0.1191920 + bl * 0.9503041;
        return new double[] {x * 100, y * 100, z * 100};
    }

    public static Lab xyzToLab(double x, double y, double z) {
        double fx = labPivot(x / REF_X);
        double fy = labPivot(y / REF_Y);
        double fz = labPivot(z / REF_Z);

        double l = Math.max(0, 116 * fy - 16);
        double a = 500 * (fx - fy);
        double b = 200 * (fy - fz);
        return new Lab(l, a, b);
    }

    static double labPivot(double t) {
        if (t > DELTA_CUBED) {
            return Math.cbrt(t);
        }
        return t / (3 * DELTA * DELTA) + 4.0 / 29.0;
    }

    public static Lab rgbToLab(int r, int g, int b) {
        double[] xyz = rgbToXyz(r, g, b);
        return xyzToLab(xyz[0], xyz[1], xyz[2]);
    }

    public static double deltaE(Lab c1, Lab c2) {
        return c1.deltaE(c2);
    }

    public static Hsv rgbToHsv(int r, int g, int b) {
        double rn = r / 255.0;
        double gn = g / 255.0;
        double bn = b / 255.0;
        double max = Math.max(rn, Math.max(gn, bn));
        double min = Math.min(rn, Math.min(gn, bn));
        double delta = max - min;

        double h = 0;
        if (delta != 0) {
            if (max == rn) {
                h = ((gn - bn) / delta) % 6;
            } else if (max == gn) {
                h = (bn - rn) / delta + 2;
            } else {
                h = (rn - gn) / delta + 4;
            }
            h *= 60;
            if (h < 0) {
                h += 360;
            }
        }

        double s = max == 0 ? 0 : delta / max;
        return new Hsv(h, s, max);
    }
}

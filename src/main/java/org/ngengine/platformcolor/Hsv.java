package org.ngengine.platformcolor;

/** Hue in degrees [0, 360), saturation and value in [0, 1]. */
public final class Hsv {
    public final double h;
    public final double s;
    public final double v;

    public Hsv(double h, double s, double v) {
        this.h = h;
        this.s = s;
        this.v = v;
    }

    @Override
    public String toString() {
        return "Hsv(" + h + ", " + s + ", " + v + ")";
    }
}

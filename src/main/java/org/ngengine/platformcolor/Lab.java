package org.ngengine.platformcolor;

/** CIE L*a*b* triple (D65 white). */
public final class Lab {
    public final double l;
    public final double a;
    public final double b;

    public Lab(double l, double a, double b) {
        this.l = l;
        this.a = a;
        this.b = b;
    }

    /** Euclidean distance (CIE76 delta E) to {@code other}. */
    public double deltaE(Lab other) {
        double dl = l - other.l;
        double da = a - other.a;
        double db = b - other.b;
        return Math.sqrt(dl * dl + da * da + db * db);
    }

    @Override
    public String toString() {
        return "Lab(" + l + ", " + a + ", " + b + ")";
    }
}

package org.ngengine.platformcolor.png;

/** Reverses the per-scanline PNG prediction filters (None, Sub, Up, Average, Paeth). */
final class PngScanlineFilter {
    static final int NONE = 0;
    static final int SUB = 1;
    static final int UP = 2;
    static final int AVERAGE = 3;
    static final int PAETH = 4;

    private PngScanlineFilter() {}

    /**
     * Reconstructs one scanline in place.
     *
     * @param filterType tag byte that preceded the scanline
     * @param line filtered bytes, overwritten with reconstructed bytes
     * @param prev previous reconstructed scanline (all zeros for the first row)
     * @param bpp bytes per complete pixel
     */
    static void unfilter(int filterType, byte[] line, byte[] prev, int bpp) throws PngDecodeException {
        int len = line.length;
        switch (filterType) {
            case NONE:
                return;
            case SUB:
                for (int i = bpp; i < len; i++) {
                    line[i] = (byte) (line[i] + line[i - bpp]);
                }
                return;
            case UP:
                for (int i = 0; i < len; i++) {
                    line[i] = (byte) (line[i] + prev[i]);
                }
                return;
            case AVERAGE:
                for (int i = 0; i < len; i++) {
                    int left = i >= bpp ? line[i - bpp] & 0xFF : 0;
                    int up = prev[i] & 0xFF;
                    line[i] = (byte) (line[i] + ((left + up) >>> 1));
                }
                return;
            case PAETH:
                for (int i = 0; i < len; i++) {
                    int left = i >= bpp ? line[i - bpp] & 0xFF : 0;
                    int up = prev[i] & 0xFF;
                    int upLeft = i >= bpp ? prev[i - bpp] & 0xFF : 0;
                    line[i] = (byte) (line[i] + paeth(left, up, upLeft));
                }
                return;
            default:
                throw new PngDecodeException("Unsupported PNG filter type: " + filterType);
        }
    }

    /** Paeth predictor; ties prefer {@code a}, then {@code b}. */
    static int paeth(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) return a;
        if (pb <= pc) return b;
        return c;
    }
}

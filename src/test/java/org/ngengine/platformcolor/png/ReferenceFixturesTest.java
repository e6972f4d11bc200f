package org.ngengine.platformcolor.png;

import ar.com.hjg.pngj.FilterType;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.ngengine.platformcolor.DecodedImage;

import java.io.ByteArrayOutputStream;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/** Cross-checks the decoder against PNGs written by an independent encoder (PNGJ). */
final class ReferenceFixturesTest {
    private static final int WIDTH = 37;
    private static final int HEIGHT = 23;

    enum Layout {
        RGBA(4, true, false),
        RGB(3, false, false),
        GRAY(1, false, true),
        GRAY_ALPHA(2, true, true);

        final int channels;
        final boolean alpha;
        final boolean gray;

        Layout(int channels, boolean alpha, boolean gray) {
            this.channels = channels;
            this.alpha = alpha;
            this.gray = gray;
        }
    }

    @ParameterizedTest
    @EnumSource(value = FilterType.class, names = {
            "FILTER_NONE",
            "FILTER_SUB",
            "FILTER_UP",
            "FILTER_AVERAGE",
            "FILTER_PAETH",
    })
    void everyFilterDecodesToSourceSamples(FilterType filter) throws Exception {
        for (Layout layout : Layout.values()) {
            int[] samples = noisyGradient(layout.channels, filter.ordinal() * 31 + layout.ordinal());
            byte[] png = encode(layout, filter, samples);

            DecodedImage decoded = PngDecoder.decode(png);
            assertEquals(WIDTH, decoded.width);
            assertEquals(HEIGHT, decoded.height);
            assertEquals(WIDTH * HEIGHT * 4, decoded.rgba.remaining());

            for (int p = 0; p < WIDTH * HEIGHT; p++) {
                int[] expected = expectedRgba(layout, samples, p);
                for (int c = 0; c < 4; c++) {
                    assertEquals(expected[c], decoded.rgba.get(p * 4 + c) & 0xFF,
                            layout + " " + filter + " pixel " + p + " channel " + c);
                }
            }
        }
    }

    private static int[] expectedRgba(Layout layout, int[] samples, int p) {
        int s = p * layout.channels;
        switch (layout) {
            case RGBA:
                return new int[] {samples[s], samples[s + 1], samples[s + 2], samples[s + 3]};
            case RGB:
                return new int[] {samples[s], samples[s + 1], samples[s + 2], 255};
            case GRAY:
                return new int[] {samples[s], samples[s], samples[s], 255};
            default:
                return new int[] {samples[s], samples[s], samples[s], samples[s + 1]};
        }
    }

    /** Smooth gradient plus noise so that every predictor produces non-trivial residuals. */
    private static int[] noisyGradient(int channels, long seed) {
        Random rnd = new Random(seed);
        int[] out = new int[WIDTH * HEIGHT * channels];
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH; x++) {
                for (int c = 0; c < channels; c++) {
                    int base = (x * 7 + y * 5 + c * 60) & 0xFF;
                    out[(y * WIDTH + x) * channels + c] = (base + rnd.nextInt(9)) & 0xFF;
                }
            }
        }
        return out;
    }

    private static byte[] encode(Layout layout, FilterType filter, int[] samples) {
        ImageInfo info = new ImageInfo(WIDTH, HEIGHT, 8, layout.alpha, layout.gray, false);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PngWriter writer = new PngWriter(out, info);
        try {
            writer.setFilterType(filter);
            int rowLen = WIDTH * layout.channels;
            for (int y = 0; y < HEIGHT; y++) {
                ImageLineInt line = new ImageLineInt(info);
                System.arraycopy(samples, y * rowLen, line.getScanline(), 0, rowLen);
                writer.writeRow(line);
            }
        } finally {
            writer.end();
        }
        return out.toByteArray();
    }
}

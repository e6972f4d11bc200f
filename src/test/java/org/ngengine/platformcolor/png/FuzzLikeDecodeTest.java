package org.ngengine.platformcolor.png;

import org.junit.jupiter.api.Test;
import org.ngengine.platformcolor.DecodedImage;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fuzz-like robustness tests.
 *
 * The goal is not to assert decoding success, but that only {@link PngDecodeException} escapes.
 */
final class FuzzLikeDecodeTest {
    @Test
    void randomBytesDoNotCrash() {
        Random rnd = new Random(0xC0FFEE);
        for (int i = 0; i < 500; i++) {
            byte[] data = new byte[rnd.nextInt(2048)];
            rnd.nextBytes(data);
            if (rnd.nextBoolean() && data.length >= 8) {
                System.arraycopy(PngFixtures.SIGNATURE, 0, data, 0, 8);
            }

            try {
                PngDecoder.decode(data);
            } catch (PngDecodeException expected) {
                // ok
            } catch (OutOfMemoryError oom) {
                fail("OOM while decoding random bytes (should fail fast): " + oom);
            }
        }
    }

    @Test
    void corruptedValidImagesDoNotCrash() {
        Random rnd = new Random(0xBADC0DE);
        for (int i = 0; i < 300; i++) {
            int w = 1 + rnd.nextInt(32);
            int h = 1 + rnd.nextInt(16);
            byte[] samples = new byte[w * h * 4];
            rnd.nextBytes(samples);
            byte[] png = PngFixtures.rgba(w, h, samples);

            int flips = 1 + rnd.nextInt(4);
            for (int f = 0; f < flips; f++) {
                int pos = 8 + rnd.nextInt(png.length - 8);
                png[pos] = (byte) rnd.nextInt(256);
            }

            try {
                DecodedImage decoded = PngDecoder.decode(png);
                assertEquals((long) decoded.width * decoded.height * 4, decoded.rgba.remaining());
            } catch (PngDecodeException expected) {
                // ok
            } catch (OutOfMemoryError oom) {
                fail("OOM while decoding corrupted image: " + oom);
            }
        }
    }
}

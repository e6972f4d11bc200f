package org.ngengine.platformcolor;

import java.nio.ByteBuffer;

/** Nearest-neighbour downsampling that bounds classification cost on wide screenshots. */
public final class NearestNeighborResizer {
    static final int MIN_WIDTH = 480;
    static final int MAX_WIDTH = 640;

    private NearestNeighborResizer() {}

    /**
     * Shrinks images wider than {@value #MAX_WIDTH} pixels to a width in
     * [{@value #MIN_WIDTH}, {@value #MAX_WIDTH}]. Narrower or zero-area images are returned as is.
     */
    public static DecodedImage resize(DecodedImage img) {
        int width = img.width;
        int height = img.height;
        if (img.isEmpty()) {
            return img;
        }
        int desiredWidth = Math.min(Math.max(width, MIN_WIDTH), MAX_WIDTH);
        if (width <= desiredWidth) {
            return img;
        }
        double scale = (double) desiredWidth / width;
        int newWidth = (int) Math.round(width * scale);
        int newHeight = Math.max(1, (int) Math.round(height * scale));

        ByteBuffer src = img.rgba;
        byte[] dst = new byte[newWidth * newHeight * 4];
        for (int y = 0; y < newHeight; y++) {
            int srcY = Math.min(height - 1, (int) Math.floor(y / scale));
            for (int x = 0; x < newWidth; x++) {
                int srcX = Math.min(width - 1, (int) Math.floor(x / scale));
                int srcIdx = (srcY * width + srcX) * 4;
                int dstIdx = (y * newWidth + x) * 4;
                dst[dstIdx] = src.get(srcIdx);
                dst[dstIdx + 1] = src.get(srcIdx + 1);
                dst[dstIdx + 2] = src.get(srcIdx + 2);
                dst[dstIdx + 3] = src.get(srcIdx + 3);
            }
        }
        return new DecodedImage(newWidth, newHeight, img.format, ByteBuffer.wrap(dst));
    }
}

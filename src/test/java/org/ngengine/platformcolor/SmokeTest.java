package org.ngengine.platformcolor;

import org.junit.jupiter.api.Test;
import org.ngengine.platformcolor.png.PngDecodeException;
import org.ngengine.platformcolor.png.PngDecoder;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

public class SmokeTest {
    @Test
    void decoderRejectsInvalidInput() {
        assertThrows(PngDecodeException.class, () -> PngDecoder.decode(new byte[] {1, 2, 3}));
    }

    @Test
    void decodedImageChecksBufferLength() {
        assertThrows(IllegalArgumentException.class,
                () -> new DecodedImage(2, 2, SourceFormat.PNG, ByteBuffer.allocate(15)));
        assertThrows(IllegalArgumentException.class,
                () -> new DecodedImage(-1, 2, SourceFormat.PNG, ByteBuffer.allocate(0)));
        assertEquals(0, DecodedImage.empty(SourceFormat.UNKNOWN).rgba.remaining());
    }
}

package com.traneptora.lightlevel.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PixelBufferTest {

    @Test
    void testCallerWritesDoNotShowThrough() {
        short[] samples = new short[2 * 1 * PixelBuffer.CHANNELS];
        samples[0] = (short)40000;
        PixelBuffer buffer = new PixelBuffer(2, 1, samples);
        samples[0] = 7;
        samples[5] = 9;
        assertEquals(40000, buffer.getSample(0, 0, 0));
        assertEquals(0, buffer.getSample(1, 0, 2));
    }

    @Test
    void testOwnedArrayIsNotCopied() {
        short[] samples = new short[PixelBuffer.CHANNELS];
        PixelBuffer buffer = new PixelBuffer(1, 1, samples, false);
        samples[1] = (short)65535;
        assertEquals(65535, buffer.getSample(0, 0, 1));
    }

    @Test
    void testLayout() {
        PixelBuffer buffer = PixelBuffer.filled(3, 2, 0xFFFF);
        assertEquals(9, buffer.getRowStride());
        assertEquals(9, buffer.rowStart(1));
        assertEquals(18, buffer.getSampleCount());
        assertEquals(PixelBuffer.MAX_VALUE, buffer.getSample(17));
    }

    @Test
    void testWrongLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(2, 2, new short[11]));
        assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(-1, 2, new short[0]));
        assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(1, 1, null));
    }
}

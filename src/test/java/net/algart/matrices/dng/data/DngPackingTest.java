/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.dng.data;

import net.algart.matrices.dng.UnsupportedBitDepthException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DngPackingTest {

    @Provide
    Arbitrary<Integer> packedBitDepths() {
        return Arbitraries.of(10, 12, 14);
    }

    @Property
    void unpackingRestoresPackedSamples(
            @ForAll("packedBitDepths") int bitDepth,
            @ForAll @IntRange(min = 4, max = 300) int width,
            @ForAll @IntRange(min = 1, max = 4) int numberOfRows,
            @ForAll long seed) {
        short[] samples = randomSamples(new Random(seed), width * numberOfRows, bitDepth);

        byte[] packed = DngPacking.packRows(samples, width, numberOfRows, bitDepth);
        short[] unpacked = DngUnpacking.unpackRows(packed, width, numberOfRows, bitDepth);

        assertArrayEquals(samples, unpacked, "Round trip failed for " + width + "x" + numberOfRows +
                ", " + bitDepth + " bits");
    }

    @Property
    void packedRowLengthIsExact(
            @ForAll("packedBitDepths") int bitDepth,
            @ForAll @IntRange(min = 1, max = 1000) int width) {
        byte[] packed = DngPacking.packRows(new short[width], width, 1, bitDepth);

        assertEquals((width * bitDepth + 7) / 8, packed.length);
        assertEquals(packed.length, DngPacking.packedRowLength(width, bitDepth));
    }

    @Property
    void noPaddingForWholeGroups(
            @ForAll("packedBitDepths") int bitDepth,
            @ForAll @IntRange(min = 1, max = 100) int numberOfGroups,
            @ForAll @IntRange(min = 1, max = 3) int numberOfRows) {
        int width = numberOfGroups * DngPacking.groupSize(bitDepth);
        byte[] packed = DngPacking.packRows(new short[width * numberOfRows], width, numberOfRows, bitDepth);

        assertEquals(numberOfGroups * DngPacking.groupLength(bitDepth) * numberOfRows, packed.length);
    }

    @Property
    void samplesAreMaskedBeforePacking(
            @ForAll("packedBitDepths") int bitDepth,
            @ForAll @IntRange(min = 1, max = 64) int width,
            @ForAll long seed) {
        short[] samples = randomSamples(new Random(seed), width, 16);
        short[] masked = new short[width];
        for (int i = 0; i < width; i++) {
            masked[i] = (short) (samples[i] & ((1 << bitDepth) - 1));
        }

        assertArrayEquals(
                DngPacking.packRows(masked, width, 1, bitDepth),
                DngPacking.packRows(samples, width, 1, bitDepth));
    }

    @Test
    void fourteenBitsWidth100() {
        byte[] strip = DngPacking.packRows(new short[100 * 100], 100, 100, 14);

        assertEquals(175, DngPacking.packedRowLength(100, 14));
        assertEquals(17500, strip.length);
    }

    @Test
    void fourteenBitsWidth101IsTruncatedAfterPadding() {
        short[] row = new short[101];
        Arrays.fill(row, (short) 0x3FFF);

        byte[] packed = DngPacking.packRows(row, 101, 1, 14);

        assertEquals(177, packed.length);
        // 101 * 14 = 1414 bits: the last byte contains 6 real bits and 2 zero bits
        for (int i = 0; i < 176; i++) {
            assertEquals((byte) 0xFF, packed[i], "byte " + i);
        }
        assertEquals((byte) 0xFC, packed[176]);
        assertArrayEquals(row, DngUnpacking.unpackRows(packed, 101, 1, 14));
    }

    @Test
    void twelveBitsWidth2IsOneGroup() {
        byte[] packed = DngPacking.packRows(new short[]{0xABC, 0x123}, 2, 1, 12);

        assertArrayEquals(new byte[]{(byte) 0xAB, (byte) 0xC1, 0x23}, packed);
    }

    @Test
    void tenBitsGroupLayout() {
        byte[] packed = DngPacking.packRows(new short[]{0x3FF, 0, 0x155, 0x2AA}, 4, 1, 10);

        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xC0, 0x05, 0x56, (byte) 0xAA}, packed);
    }

    @Test
    void fourteenBitsGroupLayout() {
        byte[] packed = DngPacking.packRows(new short[]{0x3FFF, 0, 0, 0x2001}, 4, 1, 14);

        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xFC, 0, 0, 0, 0x20, 0x01}, packed);
    }

    @Test
    void nonPackedPaths() throws UnsupportedBitDepthException {
        short[] samples = {0x1234, (short) 0xABFF};

        assertArrayEquals(new byte[]{0x34, (byte) 0xFF},
                DngPacking.packSamples(samples, 2, 8, ByteOrder.LITTLE_ENDIAN));
        assertArrayEquals(new byte[]{0x34, 0x12, (byte) 0xFF, (byte) 0xAB},
                DngPacking.packSamples(samples, 2, 16, ByteOrder.LITTLE_ENDIAN));
        assertArrayEquals(new byte[]{0x12, 0x34, (byte) 0xAB, (byte) 0xFF},
                DngPacking.packSamples(samples, 2, 16, ByteOrder.BIG_ENDIAN));
        assertArrayEquals(new byte[]{0, 0, (byte) 0x80, 0x3F},
                DngPacking.packSamples(new float[]{1.0f}, 1, 32, ByteOrder.LITTLE_ENDIAN));
    }

    @Test
    void unsupportedBitDepths() {
        assertThrows(UnsupportedBitDepthException.class,
                () -> DngPacking.packSamples(new short[4], 4, 11, ByteOrder.LITTLE_ENDIAN));
        assertThrows(UnsupportedBitDepthException.class,
                () -> DngPacking.packSamples(new short[4], 4, 32, ByteOrder.LITTLE_ENDIAN));
        assertThrows(UnsupportedBitDepthException.class,
                () -> DngPacking.packSamples(new float[4], 4, 16, ByteOrder.LITTLE_ENDIAN));
        assertThrows(IllegalArgumentException.class,
                () -> DngPacking.packSamples(new int[4], 4, 16, ByteOrder.LITTLE_ENDIAN));
        assertFalse(DngPacking.isSupportedBitDepth(24));
        assertTrue(DngPacking.isSupportedBitDepth(14));
    }

    @Test
    void samplesNotDivisibleByWidth() {
        assertThrows(IllegalArgumentException.class,
                () -> DngPacking.packSamples(new short[7], 2, 12, ByteOrder.LITTLE_ENDIAN));
    }

    private static short[] randomSamples(Random random, int count, int bitDepth) {
        short[] result = new short[count];
        for (int i = 0; i < count; i++) {
            result[i] = (short) random.nextInt(1 << bitDepth);
        }
        return result;
    }
}

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

import net.algart.arrays.TooLargeArrayException;

import java.util.Objects;

/**
 * Inverse operation to {@link DngPacking#packRows(short[], int, int, int)}:
 * restores 10-, 12- or 14-bit samples from the packed strip.
 */
public class DngUnpacking {
    private DngUnpacking() {
    }

    public static short[] unpackRows(byte[] packed, int width, int numberOfRows, int bitDepth) {
        Objects.requireNonNull(packed, "Null packed data");
        if (!DngPacking.isPackedBitDepth(bitDepth)) {
            throw new IllegalArgumentException("Bit depth " + bitDepth + " is not packed");
        }
        if (width < 0 || numberOfRows < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or numberOfRows = " + numberOfRows);
        }
        final int rowLength = DngPacking.packedRowLength(width, bitDepth);
        if ((long) rowLength * (long) numberOfRows > packed.length) {
            throw new IllegalArgumentException("Too short packed data: " + packed.length + " bytes < " +
                    rowLength + "*" + numberOfRows);
        }
        final long numberOfSamples = (long) width * (long) numberOfRows;
        if (numberOfSamples > Integer.MAX_VALUE) {
            throw new TooLargeArrayException("Too large unpacked image: " + numberOfSamples + " samples >= 2^31");
        }
        final short[] result = new short[(int) numberOfSamples];
        for (int y = 0, disp = 0; y < numberOfRows; y++) {
            final int offset = y * rowLength;
            final BitsUnpacker unpacker = new BitsUnpacker(packed, offset, offset + rowLength);
            for (int x = 0; x < width; x++, disp++) {
                result[disp] = (short) unpacker.getBits(bitDepth);
            }
        }
        return result;
    }
}

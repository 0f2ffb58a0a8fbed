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

/**
 * Reads unsigned fields of arbitrary bit length from a byte array, the high bit of every byte first.
 */
final class BitsUnpacker {
    private final byte[] bytes;
    private final int fromIndex;
    private final int toIndex;

    private int currentByteIndex;
    private int currentBitIndex;

    BitsUnpacker(byte[] bytes, int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > bytes.length || fromIndex > toIndex) {
            throw new IndexOutOfBoundsException("Illegal range " + fromIndex + ".." + toIndex +
                    " in array of " + bytes.length + " bytes");
        }
        this.bytes = bytes;
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
        this.currentByteIndex = fromIndex;
        this.currentBitIndex = 0;
    }

    /**
     * Returns the next <code>bitsToRead</code> bits as a non-negative integer.
     * Bits after the end of the range are read as zeros.
     *
     * @param bitsToRead number of bits, 0..31.
     * @return value of the read bits.
     */
    int getBits(int bitsToRead) {
        if (bitsToRead < 0 || bitsToRead > 31) {
            throw new IllegalArgumentException("Number of bits to read " + bitsToRead + " is out of range 0..31");
        }
        int result = 0;
        while (bitsToRead > 0) {
            final int current = currentByteIndex < toIndex ? bytes[currentByteIndex] & 0xFF : 0;
            final int bitsLeft = 8 - currentBitIndex;
            final int n = Math.min(bitsLeft, bitsToRead);
            final int field = (current >>> (bitsLeft - n)) & ((1 << n) - 1);
            result = (result << n) | field;
            bitsToRead -= n;
            currentBitIndex += n;
            if (currentBitIndex == 8) {
                currentBitIndex = 0;
                currentByteIndex++;
            }
        }
        return result;
    }
}

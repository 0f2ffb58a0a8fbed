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
import net.algart.matrices.dng.UnsupportedBitDepthException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Conversion of unsigned 16-bit or 32-bit float samples into the bytes of a DNG strip.
 *
 * <p>10-, 12- and 14-bit samples are packed without gaps, the high bit first: groups of
 * {@link #groupSize(int) g} samples occupy {@link #groupLength(int) b} whole bytes.
 * Every row starts from a new byte and occupies exactly {@link #packedRowLength(int, int)} bytes.
 * 8-bit samples are stored as one byte; 16-bit and 32-bit samples are stored as is,
 * in the byte order of the file.</p>
 */
public class DngPacking {
    private DngPacking() {
    }

    public static boolean isPackedBitDepth(int bitDepth) {
        return bitDepth == 10 || bitDepth == 12 || bitDepth == 14;
    }

    public static boolean isSupportedBitDepth(int bitDepth) {
        return bitDepth == 8 || isPackedBitDepth(bitDepth) || bitDepth == 16 || bitDepth == 32;
    }

    /**
     * Returns the number of samples g, which are packed into whole number of bytes:
     * 4 for 10 and 14 bits, 2 for 12 bits.
     *
     * @param bitDepth 10, 12 or 14.
     * @return number of samples in one group.
     */
    public static int groupSize(int bitDepth) {
        return switch (bitDepth) {
            case 10, 14 -> 4;
            case 12 -> 2;
            default -> throw new IllegalArgumentException("Bit depth " + bitDepth + " is not packed");
        };
    }

    /**
     * Returns the number of bytes in one packed group: 5 for 10 bits, 3 for 12 bits, 7 for 14 bits.
     *
     * @param bitDepth 10, 12 or 14.
     * @return <code>groupSize(bitDepth) * bitDepth / 8</code>.
     */
    public static int groupLength(int bitDepth) {
        return groupSize(bitDepth) * bitDepth / 8;
    }

    public static int packedRowLength(int width, int bitDepth) {
        if (width < 0) {
            throw new IllegalArgumentException("Negative width = " + width);
        }
        final long result = ((long) width * (long) bitDepth + 7) >>> 3;
        if (result > Integer.MAX_VALUE) {
            throw new TooLargeArrayException("Too large row: " + width + " samples, " + bitDepth + " bits/sample");
        }
        return (int) result;
    }

    /**
     * Converts samples of the frame into the bytes of one strip.
     *
     * @param samples   <code>short[]</code> (unsigned 16-bit samples) or <code>float[]</code>.
     * @param width     number of samples in every row; <code>samples.length</code> must be divisible by it.
     * @param bitDepth  number of bits per sample: 8, 10, 12, 14, 16 for <code>short[]</code>, 32 for
     *                  <code>float[]</code>.
     * @param byteOrder byte order of the file, used for 16- and 32-bit samples.
     * @return strip data.
     * @throws UnsupportedBitDepthException if the bit depth is not supported for this element type.
     */
    public static byte[] packSamples(Object samples, int width, int bitDepth, ByteOrder byteOrder)
            throws UnsupportedBitDepthException {
        Objects.requireNonNull(samples, "Null samples");
        Objects.requireNonNull(byteOrder, "Null byteOrder");
        if (samples instanceof short[] a) {
            return switch (bitDepth) {
                case 8 -> toBytes8(a);
                case 10, 12, 14 -> packRows(a, width, numberOfRows(a.length, width), bitDepth);
                case 16 -> toBytes16(a, byteOrder);
                default -> throw new UnsupportedBitDepthException("Bit depth " + bitDepth +
                        " is not supported for 16-bit integer samples (8, 10, 12, 14 or 16 allowed)");
            };
        } else if (samples instanceof float[] a) {
            if (bitDepth != 32) {
                throw new UnsupportedBitDepthException("Bit depth " + bitDepth +
                        " is not supported for 32-bit floating-point samples (only 32 allowed)");
            }
            return toBytes32(a, byteOrder);
        } else {
            throw new IllegalArgumentException("Unsupported samples array " + samples.getClass().getSimpleName()
                    + ": short[] or float[] expected");
        }
    }

    /**
     * Packs 10-, 12- or 14-bit samples. Every sample is masked by <code>(1 &lt;&lt; bitDepth) - 1</code>
     * before packing, so values out of range never corrupt neighbouring samples.
     *
     * @param samples      source samples, row by row.
     * @param width        number of samples in a row.
     * @param numberOfRows number of rows.
     * @param bitDepth     10, 12 or 14.
     * @return <code>numberOfRows * packedRowLength(width, bitDepth)</code> bytes.
     */
    public static byte[] packRows(short[] samples, int width, int numberOfRows, int bitDepth) {
        Objects.requireNonNull(samples, "Null samples");
        if (width < 0 || numberOfRows < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or numberOfRows = " + numberOfRows);
        }
        if ((long) width * (long) numberOfRows > samples.length) {
            throw new IllegalArgumentException("Too short samples array: " + samples.length + " < " +
                    width + "*" + numberOfRows);
        }
        final int groupSize = groupSize(bitDepth);
        final int rowLength = packedRowLength(width, bitDepth);
        final long length = (long) rowLength * (long) numberOfRows;
        if (length > Integer.MAX_VALUE) {
            throw new TooLargeArrayException("Too large packed image: " + length + " bytes >= 2^31");
        }
        final byte[] result = new byte[(int) length];
        final int paddedWidth = (width + groupSize - 1) / groupSize * groupSize;
        final int[] padded = new int[paddedWidth];
        final byte[] packedRow = new byte[paddedWidth / groupSize * groupLength(bitDepth)];
        final int mask = (1 << bitDepth) - 1;
        for (int y = 0, disp = 0; y < numberOfRows; y++, disp += width) {
            for (int x = 0; x < width; x++) {
                padded[x] = samples[disp + x] & mask;
            }
            // padded[width..paddedWidth-1] stay zero
            switch (bitDepth) {
                case 10 -> pack10(padded, packedRow);
                case 12 -> pack12(padded, packedRow);
                case 14 -> pack14(padded, packedRow);
            }
            System.arraycopy(packedRow, 0, result, y * rowLength, rowLength);
        }
        return result;
    }

    public static byte[] toBytes8(short[] samples) {
        Objects.requireNonNull(samples, "Null samples");
        final byte[] result = new byte[samples.length];
        for (int k = 0; k < result.length; k++) {
            result[k] = (byte) samples[k];
        }
        return result;
    }

    public static byte[] toBytes16(short[] samples, ByteOrder byteOrder) {
        Objects.requireNonNull(samples, "Null samples");
        checkArrayLength(samples.length, 2);
        final ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(byteOrder);
        buffer.asShortBuffer().put(samples);
        return buffer.array();
    }

    public static byte[] toBytes32(float[] samples, ByteOrder byteOrder) {
        Objects.requireNonNull(samples, "Null samples");
        checkArrayLength(samples.length, 4);
        final ByteBuffer buffer = ByteBuffer.allocate(samples.length * 4).order(byteOrder);
        buffer.asFloatBuffer().put(samples);
        return buffer.array();
    }

    private static void pack10(int[] s, byte[] out) {
        for (int i = 0, o = 0; i < s.length; i += 4, o += 5) {
            final int s0 = s[i], s1 = s[i + 1], s2 = s[i + 2], s3 = s[i + 3];
            out[o] = (byte) (s0 >> 2);
            out[o + 1] = (byte) (((s0 & 0x03) << 6) | (s1 >> 4));
            out[o + 2] = (byte) (((s1 & 0x0F) << 4) | (s2 >> 6));
            out[o + 3] = (byte) (((s2 & 0x3F) << 2) | (s3 >> 8));
            out[o + 4] = (byte) s3;
        }
    }

    private static void pack12(int[] s, byte[] out) {
        for (int i = 0, o = 0; i < s.length; i += 2, o += 3) {
            final int s0 = s[i], s1 = s[i + 1];
            out[o] = (byte) (s0 >> 4);
            out[o + 1] = (byte) (((s0 & 0x0F) << 4) | (s1 >> 8));
            out[o + 2] = (byte) s1;
        }
    }

    private static void pack14(int[] s, byte[] out) {
        for (int i = 0, o = 0; i < s.length; i += 4, o += 7) {
            final int s0 = s[i], s1 = s[i + 1], s2 = s[i + 2], s3 = s[i + 3];
            out[o] = (byte) (s0 >> 6);
            out[o + 1] = (byte) (((s0 & 0x3F) << 2) | (s1 >> 12));
            out[o + 2] = (byte) (s1 >> 4);
            out[o + 3] = (byte) (((s1 & 0x0F) << 4) | (s2 >> 10));
            out[o + 4] = (byte) (s2 >> 2);
            out[o + 5] = (byte) (((s2 & 0x03) << 6) | (s3 >> 8));
            out[o + 6] = (byte) s3;
        }
    }

    private static int numberOfRows(int numberOfSamples, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Zero or negative width = " + width);
        }
        if (numberOfSamples % width != 0) {
            throw new IllegalArgumentException("Number of samples " + numberOfSamples +
                    " is not divisible by width " + width);
        }
        return numberOfSamples / width;
    }

    private static void checkArrayLength(int numberOfSamples, int bytesPerSample) {
        if ((long) numberOfSamples * bytesPerSample > Integer.MAX_VALUE) {
            throw new TooLargeArrayException("Too large image: " + numberOfSamples + " samples, " +
                    bytesPerSample + " bytes/sample >= 2^31 bytes");
        }
    }
}

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

package net.algart.matrices.dng.tags;

/**
 * Standard 2x2 Bayer patterns for CFAPattern tag (33422).
 * Color indexes are 0 = red, 1 = green, 2 = blue, listed row by row.
 */
public enum TagCfaPattern {
    RGGB(0, 1, 1, 2),
    BGGR(2, 1, 1, 0),
    GRBG(1, 0, 2, 1),
    GBRG(1, 2, 0, 1);

    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;

    private final byte[] colors;

    TagCfaPattern(int... colors) {
        this.colors = new byte[colors.length];
        for (int i = 0; i < colors.length; i++) {
            this.colors[i] = (byte) colors[i];
        }
    }

    public int repeatRows() {
        return 2;
    }

    public int repeatColumns() {
        return 2;
    }

    public byte[] colors() {
        return colors.clone();
    }

    public int colorAt(int row, int column) {
        return colors[(row % 2) * 2 + column % 2];
    }
}

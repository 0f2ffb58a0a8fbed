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

package net.algart.matrices.dng;

/**
 * Thrown if the number of bytes, actually produced while writing DNG, differs from the length,
 * calculated beforehand by {@link DngLayout}. It is an internal error of this library, not a problem of the data.
 */
public class LayoutSizeMismatchException extends IllegalStateException {
    private final long expectedLength;
    private final long actualLength;

    public LayoutSizeMismatchException(String stage, long expectedLength, long actualLength) {
        super("Internal error while writing DNG (" + stage + "): " + actualLength +
                " bytes produced instead of " + expectedLength + " bytes, calculated by layout");
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public long expectedLength() {
        return expectedLength;
    }

    public long actualLength() {
        return actualLength;
    }
}

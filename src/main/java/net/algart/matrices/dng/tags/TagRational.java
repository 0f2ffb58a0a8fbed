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
 * A rational number (numerator over denominator), stored in TIFF as RATIONAL (two unsigned 32-bit integers)
 * or SRATIONAL (two signed 32-bit integers).
 *
 * <p>The components are stored as <code>long</code> to represent both ranges;
 * the check, whether the number fits the required TIFF type, is performed by
 * {@link #isUnsigned32()} and {@link #isSigned32()} while creating {@link TagValue.Rationals}.</p>
 */
public final class TagRational extends Number implements Comparable<TagRational> {
    private final long numerator;
    private final long denominator;

    public TagRational(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static TagRational of(long numerator, long denominator) {
        return new TagRational(numerator, denominator);
    }

    public static TagRational ofInteger(long value) {
        return new TagRational(value, 1);
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    public boolean isUnsigned32() {
        return numerator >= 0 && numerator <= 0xFFFFFFFFL && denominator >= 0 && denominator <= 0xFFFFFFFFL;
    }

    public boolean isSigned32() {
        return numerator == (int) numerator && denominator == (int) denominator;
    }

    @Override
    public double doubleValue() {
        return denominator == 0 ? Double.MAX_VALUE : ((double) numerator / (double) denominator);
    }

    @Override
    public float floatValue() {
        return (float) doubleValue();
    }

    @Override
    public int intValue() {
        return (int) longValue();
    }

    @Override
    public long longValue() {
        return denominator == 0 ? Long.MAX_VALUE : (numerator / denominator);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TagRational that && numerator == that.numerator && denominator == that.denominator;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }

    @Override
    public int compareTo(TagRational o) {
        return Double.compare(doubleValue(), o.doubleValue());
    }
}

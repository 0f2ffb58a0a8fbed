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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Typed value of an IFD entry.
 *
 * <p>Every variant knows its TIFF {@link TagType type}, the number of elements (the "count" field
 * of the IFD entry) and, so, its length in bytes inside the file, before any layout is performed.
 * All variants are immutable: arrays are cloned on creation and on access.</p>
 */
public sealed interface TagValue permits TagValue.Shorts, TagValue.Longs, TagValue.Rationals,
        TagValue.Ascii, TagValue.Bytes {

    TagType type();

    int count();

    /**
     * Returns <code>count() * type().elementLength()</code>.
     *
     * @return number of bytes occupied by this value in the file.
     */
    default long lengthInBytes() {
        return (long) count() * type().elementLength();
    }

    /**
     * Writes all elements of this value into the buffer from its current position,
     * in the byte order of the buffer.
     *
     * @param buffer destination.
     */
    void write(ByteBuffer buffer);

    static Shorts shorts(int... values) {
        return new Shorts(values);
    }

    static Longs longs(long... values) {
        return new Longs(values);
    }

    static Rationals rationals(TagRational... values) {
        return new Rationals(TagType.RATIONAL, values);
    }

    static Rationals signedRationals(TagRational... values) {
        return new Rationals(TagType.SRATIONAL, values);
    }

    static Ascii ascii(String value) {
        return new Ascii(value);
    }

    static Bytes bytes(byte... values) {
        return new Bytes(TagType.BYTE, values);
    }

    static Bytes undefined(byte... values) {
        return new Bytes(TagType.UNDEFINED, values);
    }

    /**
     * Array of unsigned 16-bit integers (TIFF SHORT).
     */
    record Shorts(int[] values) implements TagValue {
        public Shorts {
            Objects.requireNonNull(values, "Null SHORT values");
            values = values.clone();
            for (int v : values) {
                if (v < 0 || v > 0xFFFF) {
                    throw new IllegalArgumentException("SHORT value " + v + " is out of range 0..65535");
                }
            }
        }

        @Override
        public int[] values() {
            return values.clone();
        }

        public int value(int index) {
            return values[index];
        }

        @Override
        public TagType type() {
            return TagType.SHORT;
        }

        @Override
        public int count() {
            return values.length;
        }

        @Override
        public void write(ByteBuffer buffer) {
            for (int v : values) {
                buffer.putShort((short) v);
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Shorts that && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return Arrays.toString(values);
        }
    }

    /**
     * Array of unsigned 32-bit integers (TIFF LONG).
     */
    record Longs(long[] values) implements TagValue {
        public Longs {
            Objects.requireNonNull(values, "Null LONG values");
            values = values.clone();
            for (long v : values) {
                if (v < 0 || v > 0xFFFFFFFFL) {
                    throw new IllegalArgumentException("LONG value " + v + " is out of range 0..2^32-1");
                }
            }
        }

        @Override
        public long[] values() {
            return values.clone();
        }

        public long value(int index) {
            return values[index];
        }

        @Override
        public TagType type() {
            return TagType.LONG;
        }

        @Override
        public int count() {
            return values.length;
        }

        @Override
        public void write(ByteBuffer buffer) {
            for (long v : values) {
                buffer.putInt((int) v);
                // - cast to (int) works properly also for 32-bit unsigned values
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Longs that && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return Arrays.toString(values);
        }
    }

    /**
     * Array of rationals: unsigned (TIFF RATIONAL) or signed (TIFF SRATIONAL).
     */
    record Rationals(TagType type, TagRational[] values) implements TagValue {
        public Rationals {
            Objects.requireNonNull(type, "Null rational type");
            Objects.requireNonNull(values, "Null rational values");
            if (!type.isRational()) {
                throw new IllegalArgumentException("Type " + type + " is not RATIONAL or SRATIONAL");
            }
            values = values.clone();
            for (TagRational v : values) {
                Objects.requireNonNull(v, "Null rational element");
                if (type == TagType.RATIONAL ? !v.isUnsigned32() : !v.isSigned32()) {
                    throw new IllegalArgumentException("Rational " + v + " does not fit " + type);
                }
            }
        }

        @Override
        public TagRational[] values() {
            return values.clone();
        }

        public TagRational value(int index) {
            return values[index];
        }

        @Override
        public int count() {
            return values.length;
        }

        @Override
        public void write(ByteBuffer buffer) {
            for (TagRational v : values) {
                buffer.putInt((int) v.getNumerator());
                buffer.putInt((int) v.getDenominator());
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Rationals that && type == that.type && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return Arrays.toString(values);
        }
    }

    /**
     * ASCII string; in the file it is followed by the concluding zero byte, included into {@link #count()}.
     */
    record Ascii(String value) implements TagValue {
        public Ascii {
            Objects.requireNonNull(value, "Null ASCII value");
            for (int i = 0, n = value.length(); i < n; i++) {
                final char c = value.charAt(i);
                if (c == 0 || c > 0x7F) {
                    throw new IllegalArgumentException("Character \\u%04X at position %d is not allowed in TIFF ASCII"
                            .formatted((int) c, i));
                }
            }
        }

        @Override
        public TagType type() {
            return TagType.ASCII;
        }

        @Override
        public int count() {
            return value.length() + 1;
        }

        @Override
        public void write(ByteBuffer buffer) {
            buffer.put(value.getBytes(StandardCharsets.US_ASCII));
            buffer.put((byte) 0);
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    /**
     * Raw bytes: TIFF BYTE (unsigned 8-bit integers) or UNDEFINED (opaque data).
     */
    record Bytes(TagType type, byte[] values) implements TagValue {
        public Bytes {
            Objects.requireNonNull(type, "Null byte array type");
            Objects.requireNonNull(values, "Null byte values");
            if (!type.isByteArray()) {
                throw new IllegalArgumentException("Type " + type + " is not BYTE or UNDEFINED");
            }
            values = values.clone();
        }

        @Override
        public byte[] values() {
            return values.clone();
        }

        public int value(int index) {
            return values[index] & 0xFF;
        }

        @Override
        public int count() {
            return values.length;
        }

        @Override
        public void write(ByteBuffer buffer) {
            buffer.put(values);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes that && type == that.type && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < values.length; i++) {
                sb.append(i > 0 ? ", " : "").append(values[i] & 0xFF);
            }
            return sb.append("]").toString();
        }
    }
}

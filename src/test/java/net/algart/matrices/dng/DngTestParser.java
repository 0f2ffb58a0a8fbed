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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Minimal independent reader of the first IFD of a TIFF/DNG container, used for checking written files.
 */
final class DngTestParser {
    record Entry(int tag, int type, long count, long entryPosition, byte[] valueBytes, long valueOffset) {
        boolean isInline() {
            return valueOffset < 0;
        }
    }

    private final byte[] bytes;
    private final ByteOrder byteOrder;
    private final long ifdOffset;
    private final List<Entry> entries = new ArrayList<>();
    private final long nextIfdOffset;

    private DngTestParser(byte[] bytes) {
        this.bytes = bytes;
        if (bytes[0] == 'I' && bytes[1] == 'I') {
            byteOrder = ByteOrder.LITTLE_ENDIAN;
        } else if (bytes[0] == 'M' && bytes[1] == 'M') {
            byteOrder = ByteOrder.BIG_ENDIAN;
        } else {
            throw new IllegalArgumentException("Not a TIFF: invalid byte order mark");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(byteOrder);
        if (buffer.getShort(2) != 42) {
            throw new IllegalArgumentException("Not a TIFF: invalid magic number " + buffer.getShort(2));
        }
        ifdOffset = Integer.toUnsignedLong(buffer.getInt(4));
        final int numberOfEntries = Short.toUnsignedInt(buffer.getShort((int) ifdOffset));
        int position = (int) ifdOffset + 2;
        for (int k = 0; k < numberOfEntries; k++, position += 12) {
            final int tag = Short.toUnsignedInt(buffer.getShort(position));
            final int type = Short.toUnsignedInt(buffer.getShort(position + 2));
            final long count = Integer.toUnsignedLong(buffer.getInt(position + 4));
            final int length = (int) (count * elementLength(type));
            final long valueOffset = length <= 4 ? -1 : Integer.toUnsignedLong(buffer.getInt(position + 8));
            final int from = valueOffset < 0 ? position + 8 : (int) valueOffset;
            entries.add(new Entry(tag, type, count, position, Arrays.copyOfRange(bytes, from, from + length),
                    valueOffset));
        }
        nextIfdOffset = Integer.toUnsignedLong(buffer.getInt(position));
    }

    static DngTestParser parse(byte[] bytes) {
        return new DngTestParser(bytes);
    }

    ByteOrder byteOrder() {
        return byteOrder;
    }

    long ifdOffset() {
        return ifdOffset;
    }

    long nextIfdOffset() {
        return nextIfdOffset;
    }

    List<Entry> entries() {
        return entries;
    }

    boolean contains(int tag) {
        return entries.stream().anyMatch(e -> e.tag() == tag);
    }

    Entry entry(int tag) {
        return entries.stream().filter(e -> e.tag() == tag).findFirst()
                .orElseThrow(() -> new NoSuchElementException("No tag " + tag));
    }

    long[] integers(int tag) {
        final Entry entry = entry(tag);
        final ByteBuffer buffer = ByteBuffer.wrap(entry.valueBytes()).order(byteOrder);
        final long[] result = new long[(int) entry.count()];
        for (int k = 0; k < result.length; k++) {
            result[k] = switch (entry.type()) {
                case 1, 7 -> Byte.toUnsignedLong(buffer.get());
                case 3 -> Short.toUnsignedLong(buffer.getShort());
                case 4 -> Integer.toUnsignedLong(buffer.getInt());
                default -> throw new IllegalArgumentException("Not an integer type " + entry.type());
            };
        }
        return result;
    }

    long[] rationals(int tag) {
        final Entry entry = entry(tag);
        final ByteBuffer buffer = ByteBuffer.wrap(entry.valueBytes()).order(byteOrder);
        final long[] result = new long[(int) entry.count() * 2];
        for (int k = 0; k < result.length; k++) {
            result[k] = entry.type() == 5 ? Integer.toUnsignedLong(buffer.getInt()) : buffer.getInt();
        }
        return result;
    }

    String ascii(int tag) {
        final byte[] value = entry(tag).valueBytes();
        if (value.length == 0 || value[value.length - 1] != 0) {
            throw new IllegalArgumentException("ASCII value is not terminated by zero");
        }
        return new String(value, 0, value.length - 1, StandardCharsets.US_ASCII);
    }

    byte[] strip(int index) {
        final long offset = integers(273)[index];
        final long length = integers(279)[index];
        return Arrays.copyOfRange(bytes, (int) offset, (int) (offset + length));
    }

    private static int elementLength(int type) {
        return switch (type) {
            case 1, 2, 6, 7 -> 1;
            case 3, 8 -> 2;
            case 4, 9, 11 -> 4;
            case 5, 10, 12 -> 8;
            default -> throw new IllegalArgumentException("Unknown TIFF type " + type);
        };
    }
}

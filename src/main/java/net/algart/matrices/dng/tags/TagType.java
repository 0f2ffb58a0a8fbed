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

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * TIFF field types, which can appear in IFD entries written by this library.
 */
public enum TagType {
    BYTE(1, "BYTE", 1),
    ASCII(2, "ASCII", 1),
    SHORT(3, "SHORT", 2),
    LONG(4, "LONG", 4),
    RATIONAL(5, "RATIONAL", 8),
    UNDEFINED(7, "UNDEFINED", 1),
    SRATIONAL(10, "SRATIONAL", 8);

    private final int code;
    private final String prettyName;
    private final int elementLength;

    private static final Map<Integer, TagType> LOOKUP =
            Arrays.stream(values()).collect(Collectors.toMap(TagType::code, v -> v));

    TagType(int code, String prettyName, int elementLength) {
        this.code = code;
        this.prettyName = prettyName;
        this.elementLength = elementLength;
    }

    /**
     * Returns the type code, stored in bytes 2-3 of the 12-byte IFD entry.
     *
     * @return TIFF type code.
     */
    public int code() {
        return code;
    }

    public String prettyName() {
        return prettyName;
    }

    /**
     * Returns the size of one element of this type in bytes: 1 for BYTE, ASCII and UNDEFINED,
     * 2 for SHORT, 4 for LONG, 8 for RATIONAL and SRATIONAL.
     *
     * @return size of one value of this type.
     */
    public int elementLength() {
        return elementLength;
    }

    public boolean isByteArray() {
        return this == BYTE || this == UNDEFINED;
    }

    public boolean isRational() {
        return this == RATIONAL || this == SRATIONAL;
    }

    public static TagType valueOfCode(int code) {
        final TagType result = LOOKUP.get(code);
        if (result == null) {
            throw new IllegalArgumentException("TIFF type " + code + " is not supported for writing");
        }
        return result;
    }

    @Override
    public String toString() {
        return prettyName;
    }
}

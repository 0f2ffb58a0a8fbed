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
 * Values of PhotometricInterpretation tag (262), which are meaningful for raw DNG images.
 */
public enum TagPhotometricInterpretation {
    BLACK_IS_ZERO(1, "Black-is-zero"),
    RGB(2, "RGB"),
    Y_CB_CR(6, "YCbCr"),
    CFA_ARRAY(32803, "Color filter array"),
    LINEAR_RAW(34892, "Linear raw"),
    UNKNOWN(-1, "unknown");

    private final int code;
    private final String name;

    private static final Map<Integer, TagPhotometricInterpretation> LOOKUP =
            Arrays.stream(values()).filter(v -> v.code >= 0)
                    .collect(Collectors.toMap(TagPhotometricInterpretation::code, v -> v));

    TagPhotometricInterpretation(int code, String name) {
        this.code = code;
        this.name = name;
    }

    public static TagPhotometricInterpretation valueOfCodeOrUnknown(int code) {
        return LOOKUP.getOrDefault(code, UNKNOWN);
    }

    public int code() {
        if (this == UNKNOWN) {
            throw new IllegalArgumentException("Unknown photometric interpretation has no code");
        }
        return code;
    }

    public String prettyName() {
        return name;
    }

    /**
     * Returns <code>true</code> for {@link #CFA_ARRAY}: such images also require CFARepeatPatternDim
     * and CFAPattern tags.
     *
     * @return whether this is a mosaic (Bayer-like) sensor image.
     */
    public boolean isMosaic() {
        return this == CFA_ARRAY;
    }
}

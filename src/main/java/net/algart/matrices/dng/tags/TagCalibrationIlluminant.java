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
 * EXIF LightSource values, used by CalibrationIlluminant1 (50778) and CalibrationIlluminant2 (50779) tags.
 */
public enum TagCalibrationIlluminant {
    UNKNOWN(0, "Unknown"),
    DAYLIGHT(1, "Daylight"),
    FLUORESCENT(2, "Fluorescent"),
    TUNGSTEN(3, "Tungsten (incandescent light)"),
    FLASH(4, "Flash"),
    FINE_WEATHER(9, "Fine weather"),
    CLOUDY_WEATHER(10, "Cloudy weather"),
    SHADE(11, "Shade"),
    DAYLIGHT_FLUORESCENT(12, "Daylight fluorescent (D 5700 - 7100K)"),
    DAY_WHITE_FLUORESCENT(13, "Day white fluorescent (N 4600 - 5400K)"),
    COOL_WHITE_FLUORESCENT(14, "Cool white fluorescent (W 3900 - 4500K)"),
    WHITE_FLUORESCENT(15, "White fluorescent (WW 3200 - 3700K)"),
    STANDARD_LIGHT_A(17, "Standard light A"),
    STANDARD_LIGHT_B(18, "Standard light B"),
    STANDARD_LIGHT_C(19, "Standard light C"),
    D55(20, "D55"),
    D65(21, "D65"),
    D75(22, "D75"),
    D50(23, "D50"),
    ISO_STUDIO_TUNGSTEN(24, "ISO studio tungsten"),
    OTHER(255, "Other light source");

    private final int code;
    private final String name;

    private static final Map<Integer, TagCalibrationIlluminant> LOOKUP =
            Arrays.stream(values()).collect(Collectors.toMap(TagCalibrationIlluminant::code, v -> v));

    TagCalibrationIlluminant(int code, String name) {
        this.code = code;
        this.name = name;
    }

    public static TagCalibrationIlluminant valueOfCodeOrUnknown(int code) {
        return LOOKUP.getOrDefault(code, UNKNOWN);
    }

    public int code() {
        return code;
    }

    public String prettyName() {
        return name;
    }
}

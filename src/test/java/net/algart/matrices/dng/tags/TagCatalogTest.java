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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TagCatalogTest {

    @Test
    void integerValuesGetDeclaredType() {
        assertEquals(TagType.LONG, TagCatalog.get(Tags.IMAGE_WIDTH).valueOf(4000).type());
        assertEquals(TagType.SHORT, TagCatalog.get(Tags.BITS_PER_SAMPLE).valueOf(14).type());
        assertEquals(TagType.BYTE, TagCatalog.get(Tags.CFA_PATTERN).valueOf(0, 1, 1, 2).type());
        assertEquals(TagType.SRATIONAL, TagCatalog.get(Tags.COLOR_MATRIX_1)
                .valueOf(TagRational.of(-448, 1000)).type());
    }

    @Test
    void declaredCountIsChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.IMAGE_WIDTH).valueOf(100, 200));
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.CFA_REPEAT_PATTERN_DIM).valueOf(2));
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.BLACK_LEVEL).valueOf(new long[0]));
        assertDoesNotThrow(() -> TagCatalog.get(Tags.BLACK_LEVEL).valueOf(512, 512, 512, 512));
    }

    @Test
    void declaredTypeIsChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.AS_SHOT_NEUTRAL).valueOf(1, 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.SOFTWARE).valueOf(1));
        assertThrows(IllegalArgumentException.class,
                () -> TagCatalog.get(Tags.BITS_PER_SAMPLE).valueOf(70000));
        assertThrows(IllegalArgumentException.class,
                () -> new TagEntry(Tags.IMAGE_WIDTH, TagValue.shorts(100)));
    }

    @Test
    void unknownTags() {
        assertFalse(TagCatalog.isKnown(65000));
        assertThrows(IllegalArgumentException.class, () -> TagCatalog.get(65000));
        assertEquals("UnknownTag65000", Tags.tagName(65000, false));
        assertDoesNotThrow(() -> new TagEntry(65000, TagValue.ascii("private")));
        assertThrows(IllegalArgumentException.class, () -> new TagEntry(70000, TagValue.shorts(1)));
    }

    @Test
    void tagNames() {
        assertEquals("ImageWidth", Tags.tagName(Tags.IMAGE_WIDTH, false));
        assertEquals("DNGVersion (50706 or 0xC612)", Tags.tagName(Tags.DNG_VERSION, true));
        for (TagCatalog.Entry entry : TagCatalog.entries()) {
            assertEquals(entry, TagCatalog.get(entry.tag()));
        }
    }

    @Test
    void helperEnums() {
        assertArrayEquals(new byte[]{1, 4, 0, 0}, DngVersion.V1_4.bytes());
        assertEquals("1.4.0.0", DngVersion.V1_4.toString());
        assertEquals(TagCfaPattern.BLUE, TagCfaPattern.RGGB.colorAt(1, 1));
        assertEquals(TagCfaPattern.RED, TagCfaPattern.BGGR.colorAt(3, 5));
        assertEquals(32803, TagPhotometricInterpretation.CFA_ARRAY.code());
        assertTrue(TagPhotometricInterpretation.CFA_ARRAY.isMosaic());
        assertEquals(TagCalibrationIlluminant.D65, TagCalibrationIlluminant.valueOfCodeOrUnknown(21));
    }
}

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

import net.algart.matrices.dng.tags.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DngIFDTest {

    @Test
    void entriesAreSortedByTag() {
        DngIFD ifd = new DngIFD()
                .put(Tags.UNIQUE_CAMERA_MODEL, "Camera")
                .putBitsPerSample(12)
                .putImageDimensions(640, 480);

        List<TagEntry> entries = ifd.entries();

        assertEquals(List.of(Tags.IMAGE_WIDTH, Tags.IMAGE_LENGTH, Tags.BITS_PER_SAMPLE, Tags.UNIQUE_CAMERA_MODEL),
                entries.stream().map(TagEntry::tag).toList());
        assertEquals(4, ifd.numberOfEntries());
    }

    @Test
    void copyIsIndependent() throws DngException {
        DngIFD ifd = new DngIFD().putImageDimensions(640, 480);
        DngIFD copy = new DngIFD(ifd);
        copy.putImageDimensions(100, 200);
        copy.putBitsPerSample(14);

        assertEquals(640, ifd.getImageDimX());
        assertFalse(ifd.containsKey(Tags.BITS_PER_SAMPLE));
        assertEquals(100, copy.getImageDimX());
        assertThrows(UnsupportedOperationException.class, () -> ifd.map().remove(Tags.IMAGE_WIDTH));
    }

    @Test
    void requiredValues() throws DngException {
        DngIFD ifd = new DngIFD().putBitsPerSample(10).put(Tags.SOFTWARE, "x");

        assertEquals(10, ifd.getBitsPerSample());
        assertEquals(10, ifd.reqLong(Tags.BITS_PER_SAMPLE));
        assertTrue(ifd.optLong(Tags.IMAGE_WIDTH).isEmpty());
        assertThrows(MissingRequiredTagException.class, ifd::getImageDimX);
        assertThrows(MissingRequiredTagException.class, () -> ifd.reqLong(Tags.IMAGE_LENGTH));
        assertThrows(DngException.class, () -> ifd.reqLong(Tags.SOFTWARE));
        assertThrows(DngException.class, () -> new DngIFD().putBitsPerSample(0).getBitsPerSample());
        assertThrows(IllegalArgumentException.class, () -> ifd.putImageDimensions(0, 10));
    }

    @Test
    void helperSetters() {
        DngIFD ifd = new DngIFD()
                .putCfaPattern(TagCfaPattern.GRBG)
                .putCalibrationIlluminant(2, TagCalibrationIlluminant.D65)
                .putPhotometricInterpretation(TagPhotometricInterpretation.LINEAR_RAW);

        assertEquals(TagValue.shorts(2, 2), ifd.optValue(Tags.CFA_REPEAT_PATTERN_DIM).orElseThrow());
        assertEquals(TagValue.bytes((byte) 1, (byte) 0, (byte) 2, (byte) 1),
                ifd.optValue(Tags.CFA_PATTERN).orElseThrow());
        assertEquals(TagValue.shorts(21), ifd.optValue(Tags.CALIBRATION_ILLUMINANT_2).orElseThrow());
        assertFalse(ifd.containsKey(Tags.CALIBRATION_ILLUMINANT_1));
        assertEquals(TagValue.shorts(34892), ifd.optValue(Tags.PHOTOMETRIC_INTERPRETATION).orElseThrow());
    }

    @Test
    void illegalHelperArguments() {
        DngIFD ifd = new DngIFD();
        TagRational one = TagRational.of(1, 1);

        assertThrows(IllegalArgumentException.class, () -> ifd.putColorMatrix(1, one, one, one, one));
        assertThrows(IllegalArgumentException.class, () -> ifd.putColorMatrix(3, one, one, one));
        assertThrows(IllegalArgumentException.class,
                () -> ifd.putCalibrationIlluminant(0, TagCalibrationIlluminant.D50));
        assertThrows(IllegalArgumentException.class,
                () -> ifd.putResolution(one, one, DngIFD.RESOLUTION_UNIT_CENTIMETER + 1));
        assertDoesNotThrow(() -> ifd.putColorMatrix(2, one, one, one));
        assertEquals(1, ifd.numberOfEntries());
        ifd.putResolution(one, one, DngIFD.RESOLUTION_UNIT_NONE);
        assertEquals(TagValue.shorts(1), ifd.optValue(Tags.RESOLUTION_UNIT).orElseThrow());
    }

    @Test
    void valueOfRejectsDuplicates() {
        TagEntry width = new TagEntry(Tags.IMAGE_WIDTH, TagValue.longs(100));
        TagEntry length = new TagEntry(Tags.IMAGE_LENGTH, TagValue.longs(100));

        assertEquals(2, DngIFD.valueOf(List.of(length, width)).numberOfEntries());
        assertThrows(IllegalArgumentException.class, () -> DngIFD.valueOf(List.of(width, length, width)));
    }

    @Test
    void removeAndClear() {
        DngIFD ifd = new DngIFD().putImageDimensions(4, 4);

        assertEquals(TagValue.longs(4), ifd.remove(Tags.IMAGE_WIDTH));
        assertNull(ifd.remove(Tags.IMAGE_WIDTH));
        ifd.clear();
        assertEquals(0, ifd.numberOfEntries());
        assertTrue(ifd.toString().startsWith("DNG IFD, 0 entries"));
    }
}

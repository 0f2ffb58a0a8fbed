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

import java.util.*;

/**
 * DNG Image File Directory: a set of tags with unique identifiers and their typed values.
 *
 * <p>The entries are stored in the order of adding; {@link #entries()} returns them sorted by tag identifier,
 * as required for writing. Values of the tags, registered in {@link TagCatalog}, may be specified
 * by simple Java values (<code>long...</code>, {@link TagRational}..., <code>String</code>, <code>byte[]</code>):
 * they are converted to the declared TIFF type automatically.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public class DngIFD {
    public static final int LAST_IFD_OFFSET = 0;

    public static final int NEW_SUBFILE_TYPE_MAIN_IMAGE = 0;

    /**
     * Compression code "uncompressed", the only compression supported by this library.
     */
    public static final int COMPRESSION_NONE = 1;

    public static final int SAMPLE_FORMAT_UINT = 1;
    public static final int SAMPLE_FORMAT_IEEEFP = 3;

    public static final int RESOLUTION_UNIT_NONE = 1;
    public static final int RESOLUTION_UNIT_INCH = 2;
    public static final int RESOLUTION_UNIT_CENTIMETER = 3;

    private final Map<Integer, TagEntry> map;

    public DngIFD() {
        this.map = new LinkedHashMap<>();
    }

    public DngIFD(DngIFD ifd) {
        Objects.requireNonNull(ifd, "Null IFD");
        this.map = new LinkedHashMap<>(ifd.map);
    }

    public static DngIFD valueOf(Collection<TagEntry> entries) {
        Objects.requireNonNull(entries, "Null entries");
        final DngIFD result = new DngIFD();
        for (TagEntry entry : entries) {
            if (result.map.containsKey(entry.tag())) {
                throw new IllegalArgumentException("Duplicate tag " + Tags.tagName(entry.tag(), true));
            }
            result.put(entry);
        }
        return result;
    }

    public Map<Integer, TagEntry> map() {
        return Collections.unmodifiableMap(map);
    }

    public int numberOfEntries() {
        return map.size();
    }

    public boolean containsKey(int tag) {
        return map.containsKey(tag);
    }

    public Optional<TagValue> optValue(int tag) {
        final TagEntry entry = map.get(tag);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    /**
     * Returns all entries, sorted by increasing tag identifiers.
     *
     * @return sorted list of entries (new list).
     */
    public List<TagEntry> entries() {
        final List<TagEntry> result = new ArrayList<>(map.values());
        Collections.sort(result);
        return result;
    }

    public long reqLong(int tag) throws MissingRequiredTagException, DngException {
        final TagValue value = optValue(tag).orElseThrow(() -> new MissingRequiredTagException(
                "Tag " + Tags.tagName(tag, true) + " is required, but it is absent"));
        return firstInteger(tag, value);
    }

    public OptionalLong optLong(int tag) throws DngException {
        final Optional<TagValue> value = optValue(tag);
        return value.isEmpty() ? OptionalLong.empty() : OptionalLong.of(firstInteger(tag, value.get()));
    }

    public long getImageDimX() throws DngException {
        return reqPositive(Tags.IMAGE_WIDTH);
    }

    public long getImageDimY() throws DngException {
        return reqPositive(Tags.IMAGE_LENGTH);
    }

    public int getBitsPerSample() throws DngException {
        return (int) reqPositive(Tags.BITS_PER_SAMPLE);
    }

    public DngIFD put(TagEntry entry) {
        Objects.requireNonNull(entry, "Null entry");
        map.put(entry.tag(), entry);
        return this;
    }

    public DngIFD put(int tag, TagValue value) {
        return put(new TagEntry(tag, value));
    }

    /**
     * Puts integer values of the tag, registered in {@link TagCatalog} as BYTE, SHORT or LONG.
     *
     * @param tag    tag identifier.
     * @param values values.
     * @return a reference to this object.
     * @throws IllegalArgumentException if the tag is unknown, is not integer or the values are out of range.
     */
    public DngIFD put(int tag, long... values) {
        return put(tag, TagCatalog.get(tag).valueOf(values));
    }

    public DngIFD put(int tag, TagRational... values) {
        return put(tag, TagCatalog.get(tag).valueOf(values));
    }

    public DngIFD put(int tag, String value) {
        return put(tag, TagCatalog.get(tag).valueOf(value));
    }

    public DngIFD put(int tag, byte[] values) {
        return put(tag, TagCatalog.get(tag).valueOf(values));
    }

    public DngIFD putImageDimensions(long dimX, long dimY) {
        if (dimX <= 0 || dimY <= 0) {
            throw new IllegalArgumentException("Zero or negative image dimensions " + dimX + "x" + dimY);
        }
        put(Tags.IMAGE_WIDTH, dimX);
        put(Tags.IMAGE_LENGTH, dimY);
        return this;
    }

    public DngIFD putBitsPerSample(int bitsPerSample) {
        return put(Tags.BITS_PER_SAMPLE, bitsPerSample);
    }

    public DngIFD putSamplesPerPixel(int samplesPerPixel) {
        return put(Tags.SAMPLES_PER_PIXEL, samplesPerPixel);
    }

    public DngIFD putPhotometricInterpretation(TagPhotometricInterpretation photometricInterpretation) {
        Objects.requireNonNull(photometricInterpretation, "Null photometricInterpretation");
        return put(Tags.PHOTOMETRIC_INTERPRETATION, photometricInterpretation.code());
    }

    public DngIFD putRowsPerStrip(long rowsPerStrip) {
        return put(Tags.ROWS_PER_STRIP, rowsPerStrip);
    }

    /**
     * Puts CFARepeatPatternDim and CFAPattern tags, describing the given Bayer pattern.
     *
     * @param pattern Bayer pattern of the sensor.
     * @return a reference to this object.
     */
    public DngIFD putCfaPattern(TagCfaPattern pattern) {
        Objects.requireNonNull(pattern, "Null CFA pattern");
        put(Tags.CFA_REPEAT_PATTERN_DIM, pattern.repeatRows(), pattern.repeatColumns());
        put(Tags.CFA_PATTERN, pattern.colors());
        return this;
    }

    public DngIFD putCalibrationIlluminant(int index, TagCalibrationIlluminant illuminant) {
        Objects.requireNonNull(illuminant, "Null illuminant");
        return put(calibrationTag(index, Tags.CALIBRATION_ILLUMINANT_1, Tags.CALIBRATION_ILLUMINANT_2),
                illuminant.code());
    }

    public DngIFD putColorMatrix(int index, TagRational... matrix) {
        Objects.requireNonNull(matrix, "Null color matrix");
        if (matrix.length % 3 != 0) {
            throw new IllegalArgumentException("Color matrix must contain 3*N elements, but it contains "
                    + matrix.length);
        }
        return put(calibrationTag(index, Tags.COLOR_MATRIX_1, Tags.COLOR_MATRIX_2), matrix);
    }

    public DngIFD putAsShotNeutral(TagRational... neutral) {
        return put(Tags.AS_SHOT_NEUTRAL, neutral);
    }

    public DngIFD putBlackLevel(long... blackLevel) {
        return put(Tags.BLACK_LEVEL, blackLevel);
    }

    public DngIFD putWhiteLevel(long... whiteLevel) {
        return put(Tags.WHITE_LEVEL, whiteLevel);
    }

    public DngIFD putResolution(TagRational xResolution, TagRational yResolution, int resolutionUnit) {
        if (resolutionUnit < RESOLUTION_UNIT_NONE || resolutionUnit > RESOLUTION_UNIT_CENTIMETER) {
            throw new IllegalArgumentException("Illegal resolution unit " + resolutionUnit +
                    ": 1 (none), 2 (inch) or 3 (centimeter) expected");
        }
        put(Tags.X_RESOLUTION, xResolution);
        put(Tags.Y_RESOLUTION, yResolution);
        put(Tags.RESOLUTION_UNIT, resolutionUnit);
        return this;
    }

    public DngIFD putUniqueCameraModel(String uniqueCameraModel) {
        return put(Tags.UNIQUE_CAMERA_MODEL, uniqueCameraModel);
    }

    public TagValue remove(int tag) {
        final TagEntry removed = map.remove(tag);
        return removed == null ? null : removed.value();
    }

    public void clear() {
        map.clear();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("DNG IFD, " + map.size() + " entries");
        for (TagEntry entry : entries()) {
            sb.append(String.format("%n    %s", entry));
        }
        return sb.toString();
    }

    private long reqPositive(int tag) throws DngException {
        final long result = reqLong(tag);
        if (result <= 0) {
            throw new DngException("Zero value of tag " + Tags.tagName(tag, true) + " is not allowed");
        }
        return result;
    }

    private static long firstInteger(int tag, TagValue value) throws DngException {
        if (value instanceof TagValue.Shorts v && v.count() > 0) {
            return v.value(0);
        } else if (value instanceof TagValue.Longs v && v.count() > 0) {
            return v.value(0);
        } else if (value instanceof TagValue.Bytes v && v.count() > 0) {
            return v.value(0);
        }
        throw new DngException("Tag " + Tags.tagName(tag, true) + " has wrong type " + value.type() +
                " or is empty: integer value expected");
    }

    private static int calibrationTag(int index, int first, int second) {
        return switch (index) {
            case 1 -> first;
            case 2 -> second;
            default -> throw new IllegalArgumentException("Illegal calibration index " + index + ": 1 or 2 expected");
        };
    }
}

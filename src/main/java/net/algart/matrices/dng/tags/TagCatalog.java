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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static net.algart.matrices.dng.tags.TagType.*;

/**
 * Static table of known tags: the TIFF type and the number of elements, declared for every tag
 * by TIFF 6.0, TIFF/EP, EXIF and DNG 1.4 specifications.
 *
 * <p>The table is used to choose the TIFF type of a value, passed to {@link TagEntry} as a simple Java array,
 * and to check values, passed as ready {@link TagValue} objects.
 * Tags, absent in this table (private tags), can be written only as explicit {@link TagValue}.</p>
 */
public final class TagCatalog {
    /**
     * Special value for {@link Entry#count()}: the tag allows any positive number of elements.
     */
    public static final int ANY_COUNT = -1;

    public record Entry(int tag, String name, TagType type, int count) {
        public Entry {
            Objects.requireNonNull(name, "Null tag name");
            Objects.requireNonNull(type, "Null tag type");
        }

        public boolean hasFixedCount() {
            return count != ANY_COUNT;
        }

        /**
         * Builds a value of the declared type from integer elements.
         * Allowed for SHORT, LONG and BYTE tags.
         *
         * @param values elements.
         * @return new value.
         * @throws IllegalArgumentException if the declared type is not integer or some element is out of range.
         */
        public TagValue valueOf(long... values) {
            Objects.requireNonNull(values, "Null values");
            final TagValue result = switch (type) {
                case SHORT -> {
                    final int[] shorts = new int[values.length];
                    for (int i = 0; i < shorts.length; i++) {
                        shorts[i] = toUnsigned(values[i], 0xFFFF);
                    }
                    yield new TagValue.Shorts(shorts);
                }
                case LONG -> new TagValue.Longs(values);
                case BYTE, UNDEFINED -> {
                    final byte[] bytes = new byte[values.length];
                    for (int i = 0; i < bytes.length; i++) {
                        bytes[i] = (byte) toUnsigned(values[i], 0xFF);
                    }
                    yield new TagValue.Bytes(type, bytes);
                }
                default -> throw new IllegalArgumentException("Tag " + this +
                        " cannot be set to integer values");
            };
            return checked(result);
        }

        public TagValue valueOf(TagRational... values) {
            if (!type.isRational()) {
                throw new IllegalArgumentException("Tag " + this + " cannot be set to rational values");
            }
            return checked(new TagValue.Rationals(type, values));
        }

        public TagValue valueOf(String value) {
            if (type != ASCII) {
                throw new IllegalArgumentException("Tag " + this + " cannot be set to a string");
            }
            return checked(new TagValue.Ascii(value));
        }

        public TagValue valueOf(byte[] values) {
            if (!type.isByteArray()) {
                throw new IllegalArgumentException("Tag " + this + " cannot be set to a byte array");
            }
            return checked(new TagValue.Bytes(type, values));
        }

        /**
         * Checks that the given value has the declared type and, if {@link #hasFixedCount()}, the declared count.
         *
         * @param value value of this tag.
         * @return the same value.
         * @throws IllegalArgumentException if the value does not match this entry.
         */
        public TagValue checked(TagValue value) {
            Objects.requireNonNull(value, "Null value");
            if (value.type() != type) {
                throw new IllegalArgumentException("Tag " + this + " requires " + type +
                        " value, but " + value.type() + " value is specified: " + value);
            }
            if (hasFixedCount() ? value.count() != count : value.count() == 0) {
                throw new IllegalArgumentException("Tag " + this + " requires " +
                        (hasFixedCount() ? count + " elements" : "at least 1 element") +
                        ", but " + value.count() + " elements are specified: " + value);
            }
            return value;
        }

        @Override
        public String toString() {
            return "%s (%d, %s%s)".formatted(name, tag, type, hasFixedCount() ? "[" + count + "]" : "[]");
        }

        private int toUnsigned(long value, int max) {
            if (value < 0 || value > max) {
                throw new IllegalArgumentException("Value " + value + " is out of range 0.." + max +
                        " for tag " + this);
            }
            return (int) value;
        }
    }

    private static final Map<Integer, Entry> ENTRIES = buildEntries();

    private TagCatalog() {
    }

    public static Optional<Entry> find(int tag) {
        return Optional.ofNullable(ENTRIES.get(tag));
    }

    public static Entry get(int tag) {
        final Entry result = ENTRIES.get(tag);
        if (result == null) {
            throw new IllegalArgumentException("Unknown tag " + tag +
                    ": its value must be specified as explicit TagValue");
        }
        return result;
    }

    public static boolean isKnown(int tag) {
        return ENTRIES.containsKey(tag);
    }

    public static Collection<Entry> entries() {
        return Collections.unmodifiableCollection(ENTRIES.values());
    }

    private static Map<Integer, Entry> buildEntries() {
        final Map<Integer, Entry> m = new LinkedHashMap<>();
        add(m, Tags.NEW_SUBFILE_TYPE, "NewSubfileType", LONG, 1);
        add(m, Tags.IMAGE_WIDTH, "ImageWidth", LONG, 1);
        add(m, Tags.IMAGE_LENGTH, "ImageLength", LONG, 1);
        add(m, Tags.BITS_PER_SAMPLE, "BitsPerSample", SHORT, ANY_COUNT);
        add(m, Tags.COMPRESSION, "Compression", SHORT, 1);
        add(m, Tags.PHOTOMETRIC_INTERPRETATION, "PhotometricInterpretation", SHORT, 1);
        add(m, Tags.IMAGE_DESCRIPTION, "ImageDescription", ASCII, ANY_COUNT);
        add(m, Tags.MAKE, "Make", ASCII, ANY_COUNT);
        add(m, Tags.MODEL, "Model", ASCII, ANY_COUNT);
        add(m, Tags.STRIP_OFFSETS, "StripOffsets", LONG, ANY_COUNT);
        add(m, Tags.ORIENTATION, "Orientation", SHORT, 1);
        add(m, Tags.SAMPLES_PER_PIXEL, "SamplesPerPixel", SHORT, 1);
        add(m, Tags.ROWS_PER_STRIP, "RowsPerStrip", LONG, 1);
        add(m, Tags.STRIP_BYTE_COUNTS, "StripByteCounts", LONG, ANY_COUNT);
        add(m, Tags.X_RESOLUTION, "XResolution", RATIONAL, 1);
        add(m, Tags.Y_RESOLUTION, "YResolution", RATIONAL, 1);
        add(m, Tags.PLANAR_CONFIGURATION, "PlanarConfiguration", SHORT, 1);
        add(m, Tags.RESOLUTION_UNIT, "ResolutionUnit", SHORT, 1);
        add(m, Tags.SOFTWARE, "Software", ASCII, ANY_COUNT);
        add(m, Tags.DATE_TIME, "DateTime", ASCII, 20);
        add(m, Tags.ARTIST, "Artist", ASCII, ANY_COUNT);
        add(m, Tags.SAMPLE_FORMAT, "SampleFormat", SHORT, ANY_COUNT);
        add(m, Tags.XMP, "XMP", BYTE, ANY_COUNT);
        add(m, Tags.COPYRIGHT, "Copyright", ASCII, ANY_COUNT);

        add(m, Tags.CFA_REPEAT_PATTERN_DIM, "CFARepeatPatternDim", SHORT, 2);
        add(m, Tags.CFA_PATTERN, "CFAPattern", BYTE, ANY_COUNT);
        add(m, Tags.EXPOSURE_TIME, "ExposureTime", RATIONAL, 1);
        add(m, Tags.F_NUMBER, "FNumber", RATIONAL, 1);
        add(m, Tags.EXPOSURE_PROGRAM, "ExposureProgram", SHORT, 1);
        add(m, Tags.ISO_SPEED_RATINGS, "ISOSpeedRatings", SHORT, ANY_COUNT);
        add(m, Tags.EXIF_VERSION, "ExifVersion", UNDEFINED, 4);
        add(m, Tags.DATE_TIME_ORIGINAL, "DateTimeOriginal", ASCII, 20);
        add(m, Tags.SHUTTER_SPEED_VALUE, "ShutterSpeedValue", SRATIONAL, 1);
        add(m, Tags.APERTURE_VALUE, "ApertureValue", RATIONAL, 1);
        add(m, Tags.EXPOSURE_BIAS_VALUE, "ExposureBiasValue", SRATIONAL, 1);
        add(m, Tags.MAX_APERTURE_VALUE, "MaxApertureValue", RATIONAL, 1);
        add(m, Tags.METERING_MODE, "MeteringMode", SHORT, 1);
        add(m, Tags.FLASH, "Flash", SHORT, 1);
        add(m, Tags.FOCAL_LENGTH, "FocalLength", RATIONAL, 1);
        add(m, Tags.TIFF_EP_STANDARD_ID, "TIFF-EPStandardID", BYTE, 4);
        add(m, Tags.FOCAL_LENGTH_35MM_FILM, "FocalLengthIn35mmFilm", SHORT, 1);
        add(m, Tags.BODY_SERIAL_NUMBER, "BodySerialNumber", ASCII, ANY_COUNT);
        add(m, Tags.LENS_MODEL, "LensModel", ASCII, ANY_COUNT);

        add(m, Tags.DNG_VERSION, "DNGVersion", BYTE, 4);
        add(m, Tags.DNG_BACKWARD_VERSION, "DNGBackwardVersion", BYTE, 4);
        add(m, Tags.UNIQUE_CAMERA_MODEL, "UniqueCameraModel", ASCII, ANY_COUNT);
        add(m, Tags.LOCALIZED_CAMERA_MODEL, "LocalizedCameraModel", ASCII, ANY_COUNT);
        add(m, Tags.CFA_PLANE_COLOR, "CFAPlaneColor", BYTE, ANY_COUNT);
        add(m, Tags.CFA_LAYOUT, "CFALayout", SHORT, 1);
        add(m, Tags.LINEARIZATION_TABLE, "LinearizationTable", SHORT, ANY_COUNT);
        add(m, Tags.BLACK_LEVEL_REPEAT_DIM, "BlackLevelRepeatDim", SHORT, 2);
        add(m, Tags.BLACK_LEVEL, "BlackLevel", LONG, ANY_COUNT);
        add(m, Tags.WHITE_LEVEL, "WhiteLevel", LONG, ANY_COUNT);
        add(m, Tags.DEFAULT_SCALE, "DefaultScale", RATIONAL, 2);
        add(m, Tags.DEFAULT_CROP_ORIGIN, "DefaultCropOrigin", LONG, 2);
        add(m, Tags.DEFAULT_CROP_SIZE, "DefaultCropSize", LONG, 2);
        add(m, Tags.COLOR_MATRIX_1, "ColorMatrix1", SRATIONAL, ANY_COUNT);
        add(m, Tags.COLOR_MATRIX_2, "ColorMatrix2", SRATIONAL, ANY_COUNT);
        add(m, Tags.CAMERA_CALIBRATION_1, "CameraCalibration1", SRATIONAL, ANY_COUNT);
        add(m, Tags.CAMERA_CALIBRATION_2, "CameraCalibration2", SRATIONAL, ANY_COUNT);
        add(m, Tags.REDUCTION_MATRIX_1, "ReductionMatrix1", SRATIONAL, ANY_COUNT);
        add(m, Tags.REDUCTION_MATRIX_2, "ReductionMatrix2", SRATIONAL, ANY_COUNT);
        add(m, Tags.ANALOG_BALANCE, "AnalogBalance", RATIONAL, ANY_COUNT);
        add(m, Tags.AS_SHOT_NEUTRAL, "AsShotNeutral", RATIONAL, ANY_COUNT);
        add(m, Tags.AS_SHOT_WHITE_XY, "AsShotWhiteXY", RATIONAL, 2);
        add(m, Tags.BASELINE_EXPOSURE, "BaselineExposure", SRATIONAL, 1);
        add(m, Tags.BASELINE_NOISE, "BaselineNoise", RATIONAL, 1);
        add(m, Tags.BASELINE_SHARPNESS, "BaselineSharpness", RATIONAL, 1);
        add(m, Tags.BAYER_GREEN_SPLIT, "BayerGreenSplit", LONG, 1);
        add(m, Tags.LINEAR_RESPONSE_LIMIT, "LinearResponseLimit", RATIONAL, 1);
        add(m, Tags.CAMERA_SERIAL_NUMBER, "CameraSerialNumber", ASCII, ANY_COUNT);
        add(m, Tags.LENS_INFO, "LensInfo", RATIONAL, 4);
        add(m, Tags.CHROMA_BLUR_RADIUS, "ChromaBlurRadius", RATIONAL, 1);
        add(m, Tags.ANTI_ALIAS_STRENGTH, "AntiAliasStrength", RATIONAL, 1);
        add(m, Tags.SHADOW_SCALE, "ShadowScale", RATIONAL, 1);
        add(m, Tags.DNG_PRIVATE_DATA, "DNGPrivateData", BYTE, ANY_COUNT);
        add(m, Tags.MAKER_NOTE_SAFETY, "MakerNoteSafety", SHORT, 1);
        add(m, Tags.CALIBRATION_ILLUMINANT_1, "CalibrationIlluminant1", SHORT, 1);
        add(m, Tags.CALIBRATION_ILLUMINANT_2, "CalibrationIlluminant2", SHORT, 1);
        add(m, Tags.BEST_QUALITY_SCALE, "BestQualityScale", RATIONAL, 1);
        add(m, Tags.RAW_DATA_UNIQUE_ID, "RawDataUniqueID", BYTE, 16);
        add(m, Tags.ORIGINAL_RAW_FILE_NAME, "OriginalRawFileName", ASCII, ANY_COUNT);
        add(m, Tags.ACTIVE_AREA, "ActiveArea", LONG, 4);
        add(m, Tags.MASKED_AREAS, "MaskedAreas", LONG, ANY_COUNT);
        add(m, Tags.COLORIMETRIC_REFERENCE, "ColorimetricReference", SHORT, 1);
        add(m, Tags.CAMERA_CALIBRATION_SIGNATURE, "CameraCalibrationSignature", ASCII, ANY_COUNT);
        add(m, Tags.PROFILE_CALIBRATION_SIGNATURE, "ProfileCalibrationSignature", ASCII, ANY_COUNT);
        add(m, Tags.AS_SHOT_PROFILE_NAME, "AsShotProfileName", ASCII, ANY_COUNT);
        add(m, Tags.NOISE_REDUCTION_APPLIED, "NoiseReductionApplied", RATIONAL, 1);
        add(m, Tags.PROFILE_NAME, "ProfileName", ASCII, ANY_COUNT);
        add(m, Tags.PROFILE_EMBED_POLICY, "ProfileEmbedPolicy", LONG, 1);
        add(m, Tags.PROFILE_COPYRIGHT, "ProfileCopyright", ASCII, ANY_COUNT);
        add(m, Tags.FORWARD_MATRIX_1, "ForwardMatrix1", SRATIONAL, ANY_COUNT);
        add(m, Tags.FORWARD_MATRIX_2, "ForwardMatrix2", SRATIONAL, ANY_COUNT);
        add(m, Tags.PREVIEW_APPLICATION_NAME, "PreviewApplicationName", ASCII, ANY_COUNT);
        add(m, Tags.PREVIEW_APPLICATION_VERSION, "PreviewApplicationVersion", ASCII, ANY_COUNT);
        add(m, Tags.PREVIEW_SETTINGS_DIGEST, "PreviewSettingsDigest", BYTE, 16);
        add(m, Tags.PREVIEW_COLOR_SPACE, "PreviewColorSpace", LONG, 1);
        add(m, Tags.PREVIEW_DATE_TIME, "PreviewDateTime", ASCII, ANY_COUNT);
        add(m, Tags.OPCODE_LIST_1, "OpcodeList1", UNDEFINED, ANY_COUNT);
        add(m, Tags.OPCODE_LIST_2, "OpcodeList2", UNDEFINED, ANY_COUNT);
        add(m, Tags.OPCODE_LIST_3, "OpcodeList3", UNDEFINED, ANY_COUNT);
        add(m, Tags.TIME_CODES, "TimeCodes", BYTE, ANY_COUNT);
        add(m, Tags.FRAME_RATE, "FrameRate", SRATIONAL, 1);
        add(m, Tags.T_STOP, "TStop", SRATIONAL, ANY_COUNT);
        add(m, Tags.REEL_NAME, "ReelName", ASCII, ANY_COUNT);
        add(m, Tags.CAMERA_LABEL, "CameraLabel", ASCII, ANY_COUNT);
        add(m, Tags.BASELINE_EXPOSURE_OFFSET, "BaselineExposureOffset", SRATIONAL, 1);
        add(m, Tags.DEFAULT_BLACK_RENDER, "DefaultBlackRender", LONG, 1);
        add(m, Tags.NEW_RAW_IMAGE_DIGEST, "NewRawImageDigest", BYTE, 16);
        return m;
    }

    private static void add(Map<Integer, Entry> map, int tag, String name, TagType type, int count) {
        if (map.put(tag, new Entry(tag, name, type, count)) != null) {
            throw new AssertionError("Duplicate tag " + tag);
        }
    }
}

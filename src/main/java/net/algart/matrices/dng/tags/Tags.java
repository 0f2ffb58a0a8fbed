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
 * Numeric identifiers of TIFF, EXIF and DNG tags, which can be written by this library.
 *
 * <p>The declared type and count of every tag are stored in {@link TagCatalog}.</p>
 */
public class Tags {
    private Tags() {
    }

    /*
     * Baseline TIFF tags.
     */
    public static final int NEW_SUBFILE_TYPE = 254;
    public static final int IMAGE_WIDTH = 256;
    public static final int IMAGE_LENGTH = 257;
    public static final int BITS_PER_SAMPLE = 258;
    public static final int COMPRESSION = 259;
    public static final int PHOTOMETRIC_INTERPRETATION = 262;
    public static final int IMAGE_DESCRIPTION = 270;
    public static final int MAKE = 271;
    public static final int MODEL = 272;
    public static final int STRIP_OFFSETS = 273;
    public static final int ORIENTATION = 274;
    public static final int SAMPLES_PER_PIXEL = 277;
    public static final int ROWS_PER_STRIP = 278;
    public static final int STRIP_BYTE_COUNTS = 279;
    public static final int X_RESOLUTION = 282;
    public static final int Y_RESOLUTION = 283;
    public static final int PLANAR_CONFIGURATION = 284;
    public static final int RESOLUTION_UNIT = 296;
    public static final int SOFTWARE = 305;
    public static final int DATE_TIME = 306;
    public static final int ARTIST = 315;
    public static final int SAMPLE_FORMAT = 339;
    public static final int XMP = 700;
    public static final int COPYRIGHT = 33432;

    /*
     * TIFF/EP and EXIF tags.
     */
    public static final int CFA_REPEAT_PATTERN_DIM = 33421;
    public static final int CFA_PATTERN = 33422;
    public static final int EXPOSURE_TIME = 33434;
    public static final int F_NUMBER = 33437;
    public static final int EXPOSURE_PROGRAM = 34850;
    public static final int ISO_SPEED_RATINGS = 34855;
    public static final int EXIF_VERSION = 36864;
    public static final int DATE_TIME_ORIGINAL = 36867;
    public static final int SHUTTER_SPEED_VALUE = 37377;
    public static final int APERTURE_VALUE = 37378;
    public static final int EXPOSURE_BIAS_VALUE = 37380;
    public static final int MAX_APERTURE_VALUE = 37381;
    public static final int METERING_MODE = 37383;
    public static final int FLASH = 37385;
    public static final int FOCAL_LENGTH = 37386;
    public static final int TIFF_EP_STANDARD_ID = 37398;
    public static final int FOCAL_LENGTH_35MM_FILM = 41989;
    public static final int BODY_SERIAL_NUMBER = 42033;
    public static final int LENS_MODEL = 42036;

    /*
     * DNG tags.
     */
    public static final int DNG_VERSION = 50706;
    public static final int DNG_BACKWARD_VERSION = 50707;
    public static final int UNIQUE_CAMERA_MODEL = 50708;
    public static final int LOCALIZED_CAMERA_MODEL = 50709;
    public static final int CFA_PLANE_COLOR = 50710;
    public static final int CFA_LAYOUT = 50711;
    public static final int LINEARIZATION_TABLE = 50712;
    public static final int BLACK_LEVEL_REPEAT_DIM = 50713;
    public static final int BLACK_LEVEL = 50714;
    public static final int WHITE_LEVEL = 50717;
    public static final int DEFAULT_SCALE = 50718;
    public static final int DEFAULT_CROP_ORIGIN = 50719;
    public static final int DEFAULT_CROP_SIZE = 50720;
    public static final int COLOR_MATRIX_1 = 50721;
    public static final int COLOR_MATRIX_2 = 50722;
    public static final int CAMERA_CALIBRATION_1 = 50723;
    public static final int CAMERA_CALIBRATION_2 = 50724;
    public static final int REDUCTION_MATRIX_1 = 50725;
    public static final int REDUCTION_MATRIX_2 = 50726;
    public static final int ANALOG_BALANCE = 50727;
    public static final int AS_SHOT_NEUTRAL = 50728;
    public static final int AS_SHOT_WHITE_XY = 50729;
    public static final int BASELINE_EXPOSURE = 50730;
    public static final int BASELINE_NOISE = 50731;
    public static final int BASELINE_SHARPNESS = 50732;
    public static final int BAYER_GREEN_SPLIT = 50733;
    public static final int LINEAR_RESPONSE_LIMIT = 50734;
    public static final int CAMERA_SERIAL_NUMBER = 50735;
    public static final int LENS_INFO = 50736;
    public static final int CHROMA_BLUR_RADIUS = 50737;
    public static final int ANTI_ALIAS_STRENGTH = 50738;
    public static final int SHADOW_SCALE = 50739;
    public static final int DNG_PRIVATE_DATA = 50740;
    public static final int MAKER_NOTE_SAFETY = 50741;
    public static final int CALIBRATION_ILLUMINANT_1 = 50778;
    public static final int CALIBRATION_ILLUMINANT_2 = 50779;
    public static final int BEST_QUALITY_SCALE = 50780;
    public static final int RAW_DATA_UNIQUE_ID = 50781;
    public static final int ORIGINAL_RAW_FILE_NAME = 50827;
    public static final int ACTIVE_AREA = 50829;
    public static final int MASKED_AREAS = 50830;
    public static final int COLORIMETRIC_REFERENCE = 50879;
    public static final int CAMERA_CALIBRATION_SIGNATURE = 50931;
    public static final int PROFILE_CALIBRATION_SIGNATURE = 50932;
    public static final int AS_SHOT_PROFILE_NAME = 50934;
    public static final int NOISE_REDUCTION_APPLIED = 50935;
    public static final int PROFILE_NAME = 50936;
    public static final int PROFILE_EMBED_POLICY = 50941;
    public static final int PROFILE_COPYRIGHT = 50942;
    public static final int FORWARD_MATRIX_1 = 50964;
    public static final int FORWARD_MATRIX_2 = 50965;
    public static final int PREVIEW_APPLICATION_NAME = 50966;
    public static final int PREVIEW_APPLICATION_VERSION = 50967;
    public static final int PREVIEW_SETTINGS_DIGEST = 50969;
    public static final int PREVIEW_COLOR_SPACE = 50970;
    public static final int PREVIEW_DATE_TIME = 50971;
    public static final int OPCODE_LIST_1 = 51008;
    public static final int OPCODE_LIST_2 = 51009;
    public static final int OPCODE_LIST_3 = 51022;
    public static final int TIME_CODES = 51043;
    public static final int FRAME_RATE = 51044;
    public static final int T_STOP = 51058;
    public static final int REEL_NAME = 51081;
    public static final int CAMERA_LABEL = 51105;
    public static final int BASELINE_EXPOSURE_OFFSET = 51109;
    public static final int DEFAULT_BLACK_RENDER = 51110;
    public static final int NEW_RAW_IMAGE_DIGEST = 51111;

    /**
     * Returns user-friendly name of the given tag, for example, "ImageWidth" for {@link #IMAGE_WIDTH}.
     *
     * @param tag            entry tag value.
     * @param includeNumeric include numeric value into the result.
     * @return user-friendly name in the style of the DNG specification.
     */
    public static String tagName(int tag, boolean includeNumeric) {
        final String name = TagCatalog.find(tag).map(TagCatalog.Entry::name).orElse("UnknownTag" + tag);
        if (!includeNumeric) {
            return name;
        }
        return "%s (%d or 0x%X)".formatted(name, tag, tag);
    }
}

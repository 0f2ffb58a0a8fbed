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

import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.matrices.dng.data.DngPacking;
import net.algart.matrices.dng.tags.DngVersion;
import net.algart.matrices.dng.tags.Tags;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.FileHandle;
import org.scijava.io.location.FileLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Converter of raw sensor frames into DNG.
 *
 * <p>Usage: configure the metadata once by one of <code>options</code> methods, then call one of
 * <code>convert</code> methods for every frame. The frame is an AlgART matrix with
 * <code>dimX()</code> = image width and <code>dimY()</code> = image height
 * (further dimensions are allowed only if they are all equal to 1: one frame is one plane of samples).
 * Its elements must be <code>short</code> (unsigned 16-bit samples) or <code>float</code>.</p>
 *
 * <p>For every frame the converter adds the tags NewSubfileType, Compression (always uncompressed),
 * Software, DNGVersion, DNGBackwardVersion (1.0 for integer samples, 1.4 for floating-point) and SampleFormat;
 * the {@link DngWriter writer} adds StripOffsets and StripByteCounts. The configured metadata must not
 * contain any of these {@link #RESERVED_TAGS reserved tags}. The whole image is stored in one strip.</p>
 *
 * <p>This class is not thread-safe, but it is immutable while converting: you may call
 * <code>convert</code> methods from several threads if nobody changes the configuration at the same time.</p>
 */
public class DngConverter {
    public static final String SOFTWARE = "AlgART DNG";
    public static final String DNG_FILE_EXTENSION = ".dng";
    public static final DngVersion DNG_VERSION = DngVersion.V1_4;
    public static final DngVersion INTEGER_BACKWARD_VERSION = DngVersion.V1_0;
    public static final DngVersion FLOATING_POINT_BACKWARD_VERSION = DngVersion.V1_4;

    /**
     * Tags, written by this converter and {@link DngWriter} automatically.
     */
    public static final Set<Integer> RESERVED_TAGS = Set.of(
            Tags.NEW_SUBFILE_TYPE,
            Tags.COMPRESSION,
            Tags.STRIP_OFFSETS,
            Tags.STRIP_BYTE_COUNTS,
            Tags.SOFTWARE,
            Tags.SAMPLE_FORMAT,
            Tags.DNG_VERSION,
            Tags.DNG_BACKWARD_VERSION);

    private static final System.Logger LOG = System.getLogger(DngConverter.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private DngIFD tags = null;
    private Path outputDirectory = null;
    private UnaryOperator<Matrix<? extends PArray>> filter = null;
    private final DngWriter writer = new DngWriter();

    public DngConverter() {
    }

    /**
     * Sets the metadata of all further frames and the directory for {@link #convert(Matrix, String)}.
     * The metadata are copied and checked immediately.
     *
     * @param tags            metadata; must contain ImageWidth, ImageLength and BitsPerSample.
     * @param outputDirectory directory for created files; may be <code>null</code> if you are not going
     *                        to create files by name.
     * @return a reference to this object.
     * @throws MissingRequiredTagException  if ImageWidth, ImageLength or BitsPerSample is absent.
     * @throws UnsupportedBitDepthException if BitsPerSample is not 8, 10, 12, 14, 16 or 32.
     * @throws ReservedTagConflictException if the metadata contain one of {@link #RESERVED_TAGS}.
     * @throws DngException                 if the image sizes are zero or too large.
     */
    public DngConverter options(DngIFD tags, Path outputDirectory) throws DngException {
        Objects.requireNonNull(tags, "Null tags");
        final DngIFD copy = new DngIFD(tags);
        checkTags(copy);
        this.tags = copy;
        this.outputDirectory = outputDirectory;
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> "DNG converter configured: " + copy);
        }
        return this;
    }

    public DngConverter options(CameraModel model, Path outputDirectory) throws DngException {
        Objects.requireNonNull(model, "Null camera model");
        final DngIFD tags = model.tags();
        if (tags == null) {
            throw new IllegalArgumentException("Camera model " + model + " returned null tags");
        }
        return options(tags, outputDirectory);
    }

    public boolean isConfigured() {
        return tags != null;
    }

    /**
     * Returns a copy of the configured metadata.
     *
     * @return configured metadata.
     * @throws IllegalStateException if no <code>options</code> method was called.
     */
    public DngIFD tags() {
        return new DngIFD(requireTags());
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public DngConverter setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public UnaryOperator<Matrix<? extends PArray>> getFilter() {
        return filter;
    }

    /**
     * Sets the pixel filter, applied to every integer frame before packing; <code>null</code> means no filter.
     * The filter must return a new or the same matrix with the same dimensions and <code>short</code> elements.
     * Floating-point frames are never filtered.
     *
     * @param filter pixel filter; may be <code>null</code>.
     * @return a reference to this object.
     */
    public DngConverter setFilter(UnaryOperator<Matrix<? extends PArray>> filter) {
        this.filter = filter;
        return this;
    }

    public ByteOrder getByteOrder() {
        return writer.getByteOrder();
    }

    public DngConverter setByteOrder(ByteOrder byteOrder) {
        writer.setByteOrder(byteOrder);
        return this;
    }

    /**
     * Converts the frame into DNG in memory.
     *
     * @param frame raw frame.
     * @return full DNG content.
     * @throws DngException          if the frame does not match the configuration.
     * @throws IllegalStateException if no <code>options</code> method was called.
     */
    public byte[] convert(Matrix<? extends PArray> frame) throws DngException {
        final long t1 = DngWriter.debugTime();
        final Conversion conversion = prepare(frame);
        final long t2 = DngWriter.debugTime();
        final byte[] result = writer.writeToBytes(conversion.ifd(), conversion.strips());
        logConversion(conversion, "memory", result.length, t1, t2, DngWriter.debugTime());
        return result;
    }

    /**
     * Converts the frame into DNG file with the given name inside the {@link #getOutputDirectory()
     * output directory}; ".dng" extension is added if the name does not end with it.
     * The file is written completely into a temporary file in the same directory
     * and then renamed; in a case of any error the existing file is not changed.
     *
     * @param frame    raw frame.
     * @param fileName file name.
     * @return path of the created file.
     * @throws IOException           in a case of I/O error or if the frame does not match the configuration.
     * @throws IllegalStateException if no <code>options</code> method was called or the output directory
     *                               is not set.
     */
    public Path convert(Matrix<? extends PArray> frame, String fileName) throws IOException {
        Objects.requireNonNull(fileName, "Null file name");
        if (fileName.isEmpty()) {
            throw new IllegalArgumentException("Empty file name");
        }
        final Path directory = outputDirectory;
        requireTags();
        if (directory == null) {
            throw new IllegalStateException("Output directory is not set: cannot write \"" + fileName + "\"");
        }
        final long t1 = DngWriter.debugTime();
        final Conversion conversion = prepare(frame);
        final long t2 = DngWriter.debugTime();
        final Path result = directory.resolve(
                fileName.endsWith(DNG_FILE_EXTENSION) ? fileName : fileName + DNG_FILE_EXTENSION);
        final Path parent = result.toAbsolutePath().getParent();
        final Path temp = Files.createTempFile(parent, result.getFileName() + ".", ".tmp");
        final long length;
        try {
            try (DataHandle<FileLocation> out = new FileHandle(new FileLocation(temp.toFile()))) {
                length = writer.write(conversion.ifd(), conversion.strips(), out);
            }
            moveReplacing(temp, result);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        logConversion(conversion, result.toString(), length, t1, t2, DngWriter.debugTime());
        return result;
    }

    /**
     * Writes DNG into the output stream, starting from its current position.
     *
     * @param frame raw frame.
     * @param out   output stream.
     * @throws IOException           in a case of I/O error or if the frame does not match the configuration.
     * @throws IllegalStateException if no <code>options</code> method was called.
     */
    public void convert(Matrix<? extends PArray> frame, DataHandle<? extends Location> out) throws IOException {
        Objects.requireNonNull(out, "Null output stream");
        final long t1 = DngWriter.debugTime();
        final Conversion conversion = prepare(frame);
        final long t2 = DngWriter.debugTime();
        final long length = writer.write(conversion.ifd(), conversion.strips(), out);
        logConversion(conversion, "stream", length, t1, t2, DngWriter.debugTime());
    }

    @Override
    public String toString() {
        return "DNG converter" + (tags == null ?
                " (not configured)" :
                " for " + tags.map().size() + " tags" +
                        (outputDirectory == null ? "" : ", output directory " + outputDirectory) +
                        (filter == null ? "" : ", with filter"));
    }

    static void checkTags(DngIFD tags) throws DngException {
        final long dimX = tags.getImageDimX();
        final long dimY = tags.getImageDimY();
        final int bitsPerSample = tags.getBitsPerSample();
        if (dimX > Integer.MAX_VALUE || dimY > Integer.MAX_VALUE) {
            throw new DngException("Too large image " + dimX + "x" + dimY + " (>= 2^31)");
        }
        if (!DngPacking.isSupportedBitDepth(bitsPerSample)) {
            throw new UnsupportedBitDepthException("Unsupported BitsPerSample = " + bitsPerSample +
                    ": only 8, 10, 12, 14, 16 or 32 bits/sample allowed");
        }
        for (int tag : new TreeSet<>(RESERVED_TAGS)) {
            if (tags.containsKey(tag)) {
                throw new ReservedTagConflictException("Tag " + Tags.tagName(tag, true) +
                        " is written automatically and must not be specified in DNG options");
            }
        }
    }

    private Conversion prepare(Matrix<? extends PArray> frame) throws DngException {
        Objects.requireNonNull(frame, "Null frame");
        final DngIFD tags = requireTags();
        final UnaryOperator<Matrix<? extends PArray>> filter = this.filter;
        final Class<?> elementType = frame.elementType();
        final boolean floatingPoint = elementType == float.class;
        if (elementType != short.class && !floatingPoint) {
            throw new InvalidInputFormatException("Raw frame must contain unsigned 16-bit (short) or 32-bit " +
                    "floating-point (float) elements, but it contains " + elementType + " elements");
        }
        final long dimX = tags.getImageDimX();
        final long dimY = tags.getImageDimY();
        if (frame.dimCount() < 2) {
            throw new ShapeMismatchException("Raw frame must be at least 2-dimensional, but it is " +
                    dimensionsToString(frame));
        }
        if (frame.dimX() != dimX || frame.dimY() != dimY) {
            throw new ShapeMismatchException("Raw frame " + dimensionsToString(frame) +
                    " does not match DNG tags: expected " + dimX + "x" + dimY);
        }
        if (frame.size() != dimX * dimY) {
            throw new ShapeMismatchException("Raw frame " + dimensionsToString(frame) +
                    " contains several planes, but DNG image " + dimX + "x" + dimY + " is a single plane");
        }
        final long t1 = DngWriter.debugTime();
        Matrix<? extends PArray> data = frame;
        if (filter != null && !floatingPoint) {
            data = applyFilter(filter, frame);
        }
        final long t2 = DngWriter.debugTime();
        final int bitsPerSample = tags.getBitsPerSample();
        final Object samples = net.algart.arrays.Arrays.toJavaArray(data.array());
        final byte[] strip = DngPacking.packSamples(samples, (int) dimX, bitsPerSample, writer.getByteOrder());
        final long t3 = DngWriter.debugTime();

        final DngIFD ifd = new DngIFD(tags);
        ifd.put(Tags.NEW_SUBFILE_TYPE, DngIFD.NEW_SUBFILE_TYPE_MAIN_IMAGE);
        ifd.put(Tags.COMPRESSION, DngIFD.COMPRESSION_NONE);
        ifd.put(Tags.SOFTWARE, SOFTWARE);
        ifd.put(Tags.DNG_VERSION, DNG_VERSION.value());
        ifd.put(Tags.DNG_BACKWARD_VERSION,
                (floatingPoint ? FLOATING_POINT_BACKWARD_VERSION : INTEGER_BACKWARD_VERSION).value());
        ifd.put(Tags.SAMPLE_FORMAT, floatingPoint ? DngIFD.SAMPLE_FORMAT_IEEEFP : DngIFD.SAMPLE_FORMAT_UINT);
        return new Conversion(frame, ifd, List.of(strip), bitsPerSample, t2 - t1, t3 - t2);
    }

    private DngIFD requireTags() {
        final DngIFD tags = this.tags;
        if (tags == null) {
            throw new IllegalStateException("DNG options have not been set: " +
                    "please call options(...) method before converting");
        }
        return tags;
    }

    private static Matrix<? extends PArray> applyFilter(
            UnaryOperator<Matrix<? extends PArray>> filter,
            Matrix<? extends PArray> frame)
            throws FilterContractViolationException {
        final Matrix<? extends PArray> result = filter.apply(frame);
        if (result == null) {
            throw new FilterContractViolationException("Filter returned null instead of a matrix");
        }
        if (!result.dimEquals(frame)) {
            throw new FilterContractViolationException("Filter changed the matrix dimensions: " +
                    dimensionsToString(frame) + " was transformed to " + dimensionsToString(result));
        }
        if (result.elementType() != short.class) {
            throw new FilterContractViolationException("Filter returned a matrix with " +
                    result.elementType() + " elements, but short elements (unsigned 16-bit) are required");
        }
        return result;
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String dimensionsToString(Matrix<?> matrix) {
        final long[] dimensions = matrix.dimensions();
        final StringBuilder sb = new StringBuilder();
        for (int k = 0; k < dimensions.length; k++) {
            sb.append(k > 0 ? "x" : "").append(dimensions[k]);
        }
        return sb.toString();
    }

    private static void logConversion(
            Conversion conversion,
            String destination,
            long length,
            long t1,
            long t2,
            long t3) {
        if (DngWriter.BUILT_IN_TIMING && LOGGABLE_DEBUG) {
            final Matrix<? extends PArray> frame = conversion.frame();
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s converted %s %s frame, %d bits/sample, to %s (%d bytes) in %.3f ms = " +
                            "%.3f filter + %.3f packing + %.3f other preparing + %.3f writing, %.3f MB/s",
                    DngConverter.class.getSimpleName(),
                    dimensionsToString(frame), frame.elementType().getSimpleName(),
                    conversion.bitsPerSample(),
                    destination, length,
                    (t3 - t1) * 1e-6,
                    conversion.filterTime() * 1e-6,
                    conversion.packingTime() * 1e-6,
                    (t2 - t1 - conversion.filterTime() - conversion.packingTime()) * 1e-6,
                    (t3 - t2) * 1e-6,
                    length / 1048576.0 / ((t3 - t1) * 1e-9)));
        }
    }

    private record Conversion(
            Matrix<? extends PArray> frame,
            DngIFD ifd,
            List<byte[]> strips,
            int bitsPerSample,
            long filterTime,
            long packingTime) {
    }
}

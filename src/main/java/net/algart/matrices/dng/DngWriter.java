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

import net.algart.arrays.TooLargeArrayException;
import net.algart.matrices.dng.tags.TagEntry;
import net.algart.matrices.dng.tags.TagValue;
import org.scijava.io.handle.BytesHandle;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.Location;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writer of DNG containers: one IFD with uncompressed strips.
 *
 * <p>Writing is performed in two passes. The sizing pass ({@link DngLayout#of(DngIFD, List)}) places every
 * IFD entry, every out-of-line value and every strip. The emission pass writes the header, the sorted IFD
 * entries, the out-of-line values in the order of tags and the strips, recording the actual offset of every
 * strip; then the reserved StripOffsets slot is filled by these offsets. If the actually written data
 * disagree with the layout, {@link LayoutSizeMismatchException} is thrown.</p>
 *
 * <p>{@link #writeToBytes(DngIFD, List)} and {@link #write(DngIFD, List, DataHandle)} produce identical
 * bytes for identical arguments.</p>
 *
 * <p>This class is not thread-safe, but it has no state besides the byte order.</p>
 */
public class DngWriter {
    public static final int FILE_PREFIX_LITTLE_ENDIAN = 0x49;
    public static final int FILE_PREFIX_BIG_ENDIAN = 0x4d;
    public static final int FILE_MAGIC_NUMBER = 42;

    static final System.Logger LOG = System.getLogger(DngWriter.class.getName());
    static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    static final boolean BUILT_IN_TIMING = getBooleanProperty("net.algart.matrices.dng.timing");

    private ByteOrder byteOrder = ByteOrder.LITTLE_ENDIAN;

    public DngWriter() {
    }

    public ByteOrder getByteOrder() {
        return byteOrder;
    }

    public DngWriter setByteOrder(ByteOrder byteOrder) {
        this.byteOrder = Objects.requireNonNull(byteOrder, "Null byte order");
        return this;
    }

    public boolean isLittleEndian() {
        return byteOrder == ByteOrder.LITTLE_ENDIAN;
    }

    public DngWriter setLittleEndian(boolean littleEndian) {
        return setByteOrder(littleEndian ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
    }

    /**
     * Writes the container into a new byte array.
     *
     * @param ifd    IFD; must not contain StripOffsets and StripByteCounts tags.
     * @param strips data of the strips.
     * @return the full container.
     * @throws DngException           if the IFD contains StripOffsets/StripByteCounts
     *                                or the container is too large for 32-bit offsets.
     * @throws TooLargeArrayException if the container is larger than a Java array.
     */
    public byte[] writeToBytes(DngIFD ifd, List<byte[]> strips) throws DngException {
        final DngLayout layout = DngLayout.of(ifd, strips);
        final long length = layout.totalLength();
        if (length > Integer.MAX_VALUE - 16) {
            throw new TooLargeArrayException("Too large DNG container for Java array: " + length + " bytes");
        }
        final byte[] result = new byte[(int) length];
        try (DataHandle<BytesLocation> buffer = new BytesHandle(new BytesLocation(result, "memory-buffer"))) {
            emit(layout, strips, buffer);
            // - emit() checks the total length, so all bytes were written into "result" in place
        } catch (DngException e) {
            throw e;
        } catch (IOException e) {
            // - in-memory handle: should not occur
            throw new DngException("Cannot write DNG into memory buffer", e);
        }
        return result;
    }

    /**
     * Writes the container into the output stream from its current position.
     * All offsets inside the container are counted from this position.
     * The byte order of the stream is set to {@link #getByteOrder()}.
     *
     * @param ifd    IFD; must not contain StripOffsets and StripByteCounts tags.
     * @param strips data of the strips.
     * @param out    output stream; must support seeking backwards.
     * @return number of written bytes.
     * @throws IOException in a case of I/O error or if the arguments are incorrect (see
     *                     {@link #writeToBytes(DngIFD, List)}).
     */
    public long write(DngIFD ifd, List<byte[]> strips, DataHandle<? extends Location> out) throws IOException {
        Objects.requireNonNull(out, "Null output stream");
        final DngLayout layout = DngLayout.of(ifd, strips);
        emit(layout, strips, out);
        return layout.totalLength();
    }

    private void emit(DngLayout layout, List<byte[]> strips, DataHandle<? extends Location> out)
            throws IOException {
        final long t1 = debugTime();
        out.setLittleEndian(isLittleEndian());
        final long base = out.offset();
        final int prefix = isLittleEndian() ? FILE_PREFIX_LITTLE_ENDIAN : FILE_PREFIX_BIG_ENDIAN;
        out.writeByte(prefix);
        out.writeByte(prefix);
        out.writeShort(FILE_MAGIC_NUMBER);
        out.writeInt((int) layout.ifdOffset());

        out.writeShort(layout.numberOfEntries());
        for (DngLayout.Slot slot : layout.slots()) {
            checkPosition("IFD entry " + slot.entry().tagName(), slot.entryPosition(), out.offset() - base);
            writeEntry(out, slot);
        }
        checkPosition("next IFD offset", layout.nextIfdOffsetPosition(), out.offset() - base);
        out.writeInt(DngIFD.LAST_IFD_OFFSET);

        for (DngLayout.Slot slot : layout.slots()) {
            if (!slot.isInline()) {
                checkPosition("value of " + slot.entry().tagName(), slot.valueOffset(), out.offset() - base);
                out.write(toBytes(slot.entry().value()));
                appendUntilEvenPosition(out, base);
            }
        }
        final long t2 = debugTime();

        final long[] actualStripOffsets = new long[strips.size()];
        for (int k = 0; k < actualStripOffsets.length; k++) {
            appendUntilEvenPosition(out, base);
            final byte[] strip = strips.get(k);
            checkPosition("length of strip #" + k, layout.stripByteCount(k), strip.length);
            actualStripOffsets[k] = out.offset() - base;
            out.write(strip);
        }
        final long end = out.offset();
        checkPosition("container", layout.totalLength(), end - base);
        final long t3 = debugTime();

        for (int k = 0; k < actualStripOffsets.length; k++) {
            checkPosition("strip #" + k, layout.stripOffset(k), actualStripOffsets[k]);
        }
        final DngLayout.Slot slot = layout.stripOffsetsSlot();
        out.seek(base + slot.valuePosition());
        out.write(toBytes(TagValue.longs(actualStripOffsets)));
        out.seek(end);
        final long t4 = debugTime();
        if (BUILT_IN_TIMING && LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                    "%s wrote %d IFD entries and %d strip(s), %d bytes, in %.3f ms = " +
                            "%.3f IFD + %.3f strips + %.3f patching StripOffsets",
                    getClass().getSimpleName(),
                    layout.numberOfEntries(), layout.numberOfStrips(), layout.totalLength(),
                    (t4 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6, (t4 - t3) * 1e-6));
        }
    }

    private void writeEntry(DataHandle<? extends Location> out, DngLayout.Slot slot) throws IOException {
        final TagEntry entry = slot.entry();
        out.writeShort(entry.tag());
        out.writeShort(entry.type().code());
        out.writeInt(entry.count());
        if (slot.isInline()) {
            final byte[] field = new byte[DngLayout.MAX_INLINE_LENGTH];
            final byte[] value = toBytes(entry.value());
            System.arraycopy(value, 0, field, 0, value.length);
            // - inline value is left-justified, the rest is filled by zeros
            out.write(field);
        } else {
            out.writeInt((int) slot.valueOffset());
        }
    }

    private byte[] toBytes(TagValue value) {
        final ByteBuffer buffer = ByteBuffer.allocate((int) value.lengthInBytes()).order(byteOrder);
        value.write(buffer);
        assert !buffer.hasRemaining();
        return buffer.array();
    }

    private static void appendUntilEvenPosition(DataHandle<? extends Location> handle, long base)
            throws IOException {
        if (((handle.offset() - base) & 0x1) != 0) {
            handle.writeByte(0);
            // - Well-formed IFD requires even offsets
        }
    }

    private static void checkPosition(String what, long expected, long actual) {
        if (expected != actual) {
            throw new LayoutSizeMismatchException(what, expected, actual);
        }
    }

    static long debugTime() {
        return BUILT_IN_TIMING && LOGGABLE_DEBUG ? System.nanoTime() : 0;
    }

    static boolean getBooleanProperty(String propertyName) {
        try {
            return Boolean.getBoolean(propertyName);
        } catch (Exception e) {
            return false;
        }
    }
}

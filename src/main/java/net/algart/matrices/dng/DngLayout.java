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

import net.algart.matrices.dng.tags.TagEntry;
import net.algart.matrices.dng.tags.TagValue;
import net.algart.matrices.dng.tags.Tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of the sizing pass: absolute positions of all parts of a DNG container with one IFD.
 *
 * <p>The container consists of the 8-byte header, the IFD (2-byte number of entries,
 * 12-byte entries sorted by tag, 4-byte zero offset of the next IFD), out-of-line values ("blobs")
 * in the order of tags and, finally, the strips. Every blob and every strip starts at an even offset.
 * A value occupying 4 bytes or less is stored inline in its IFD entry.</p>
 *
 * <p>StripOffsets and StripByteCounts entries are added by this class: StripByteCounts is fully known,
 * but StripOffsets is only a reserved slot of <code>4 * numberOfStrips</code> bytes, which should be filled
 * by {@link DngWriter} after placing the strips.</p>
 *
 * <p>This class is immutable.</p>
 */
public final class DngLayout {
    public static final int HEADER_LENGTH = 8;
    public static final int ENTRY_LENGTH = 12;
    public static final int MAX_INLINE_LENGTH = 4;
    public static final long MAX_CONTAINER_LENGTH = 0xFFFFFFFFL;

    /**
     * Placement of one IFD entry.
     *
     * @param entry         the entry.
     * @param entryPosition absolute position of the 12-byte IFD record.
     * @param valueOffset   absolute position of the out-of-line value, or -1 if the value is inline.
     */
    public record Slot(TagEntry entry, long entryPosition, long valueOffset) {
        public boolean isInline() {
            return valueOffset < 0;
        }

        /**
         * Returns the absolute position of the first byte of the value: inside the IFD record for inline
         * values, or the out-of-line offset.
         *
         * @return position of the value.
         */
        public long valuePosition() {
            return isInline() ? entryPosition + 8 : valueOffset;
        }
    }

    private final List<Slot> slots;
    private final long ifdOffset;
    private final long blobsOffset;
    private final long[] stripOffsets;
    private final long[] stripByteCounts;
    private final long totalLength;
    private final Slot stripOffsetsSlot;

    private DngLayout(
            List<Slot> slots,
            long blobsOffset,
            long[] stripOffsets,
            long[] stripByteCounts,
            long totalLength) {
        this.slots = Collections.unmodifiableList(slots);
        this.ifdOffset = HEADER_LENGTH;
        this.blobsOffset = blobsOffset;
        this.stripOffsets = stripOffsets;
        this.stripByteCounts = stripByteCounts;
        this.totalLength = totalLength;
        this.stripOffsetsSlot = slots.stream()
                .filter(slot -> slot.entry().tag() == Tags.STRIP_OFFSETS)
                .findFirst()
                .orElseThrow(AssertionError::new);
    }

    /**
     * Performs the sizing pass for the given IFD and strips.
     *
     * @param ifd    IFD without StripOffsets and StripByteCounts tags.
     * @param strips data of all strips.
     * @return the layout.
     * @throws ReservedTagConflictException if the IFD already contains StripOffsets or StripByteCounts.
     * @throws DngException                 if the container is too large for 32-bit offsets.
     */
    public static DngLayout of(DngIFD ifd, List<byte[]> strips) throws DngException {
        Objects.requireNonNull(ifd, "Null IFD");
        Objects.requireNonNull(strips, "Null strips");
        if (strips.isEmpty()) {
            throw new IllegalArgumentException("Empty list of strips");
        }
        for (int tag : new int[]{Tags.STRIP_OFFSETS, Tags.STRIP_BYTE_COUNTS}) {
            if (ifd.containsKey(tag)) {
                throw new ReservedTagConflictException("Tag " + Tags.tagName(tag, true) +
                        " is written automatically and must not be specified in IFD");
            }
        }
        final long[] stripByteCounts = new long[strips.size()];
        for (int k = 0; k < stripByteCounts.length; k++) {
            final byte[] strip = Objects.requireNonNull(strips.get(k), "Null strip #" + k);
            stripByteCounts[k] = strip.length;
        }
        final DngIFD full = new DngIFD(ifd);
        full.put(Tags.STRIP_BYTE_COUNTS, TagValue.longs(stripByteCounts));
        full.put(Tags.STRIP_OFFSETS, TagValue.longs(new long[stripByteCounts.length]));
        // - placeholder: only the length of StripOffsets is important here

        final List<TagEntry> entries = full.entries();
        final long ifdLength = 2 + (long) ENTRY_LENGTH * entries.size() + 4;
        final long blobsOffset = HEADER_LENGTH + ifdLength;
        assert (blobsOffset & 1) == 0;
        final List<Slot> slots = new ArrayList<>(entries.size());
        long position = blobsOffset;
        long entryPosition = HEADER_LENGTH + 2;
        for (TagEntry entry : entries) {
            final long length = entry.value().lengthInBytes();
            if (length <= MAX_INLINE_LENGTH) {
                slots.add(new Slot(entry, entryPosition, -1));
            } else {
                slots.add(new Slot(entry, entryPosition, position));
                position = evenLength(position + length);
            }
            entryPosition += ENTRY_LENGTH;
        }
        final long[] stripOffsets = new long[stripByteCounts.length];
        for (int k = 0; k < stripOffsets.length; k++) {
            position = evenLength(position);
            stripOffsets[k] = position;
            position += stripByteCounts[k];
        }
        if (position > MAX_CONTAINER_LENGTH) {
            throw new DngException("Too large DNG container: " + position +
                    " bytes, but 32-bit offsets allow only " + MAX_CONTAINER_LENGTH + " bytes");
        }
        return new DngLayout(slots, blobsOffset, stripOffsets, stripByteCounts, position);
    }

    /**
     * Returns all slots, sorted by tag, including StripOffsets and StripByteCounts.
     *
     * @return list of slots.
     */
    public List<Slot> slots() {
        return slots;
    }

    public int numberOfEntries() {
        return slots.size();
    }

    public long ifdOffset() {
        return ifdOffset;
    }

    /**
     * Returns the position of the 4-byte offset of the next IFD (which is always 0).
     *
     * @return position after the last IFD entry.
     */
    public long nextIfdOffsetPosition() {
        return ifdOffset + 2 + (long) ENTRY_LENGTH * slots.size();
    }

    public long blobsOffset() {
        return blobsOffset;
    }

    public int numberOfStrips() {
        return stripOffsets.length;
    }

    public long stripOffset(int index) {
        return stripOffsets[index];
    }

    public long[] stripOffsets() {
        return stripOffsets.clone();
    }

    public long stripByteCount(int index) {
        return stripByteCounts[index];
    }

    /**
     * Returns the reserved slot of StripOffsets tag.
     * If there is only 1 strip, this slot is the value field of the IFD entry.
     *
     * @return StripOffsets slot.
     */
    public Slot stripOffsetsSlot() {
        return stripOffsetsSlot;
    }

    /**
     * Returns the number of bytes, which must be written into the container.
     *
     * @return total length of the container.
     */
    public long totalLength() {
        return totalLength;
    }

    @Override
    public String toString() {
        return "DNG layout: " + slots.size() + " IFD entries, blobs at " + blobsOffset +
                ", " + stripOffsets.length + " strip(s) at " + stripOffsets[0] +
                ", total " + totalLength + " bytes";
    }

    private static long evenLength(long position) {
        return position + (position & 1);
    }
}

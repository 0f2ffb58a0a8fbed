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

import java.util.Objects;

/**
 * IFD entry: tag identifier (unsigned 16-bit) with its typed value.
 *
 * <p>If the tag is present in {@link TagCatalog}, the value must have the declared type and count.</p>
 *
 * @param tag   tag identifier, 0..65535.
 * @param value value of the tag.
 */
public record TagEntry(int tag, TagValue value) implements Comparable<TagEntry> {
    public TagEntry {
        if (tag < 0 || tag > 0xFFFF) {
            throw new IllegalArgumentException("Tag " + tag + " is out of range 0..65535");
        }
        Objects.requireNonNull(value, "Null value of tag " + tag);
        final TagCatalog.Entry declared = TagCatalog.find(tag).orElse(null);
        if (declared != null) {
            declared.checked(value);
        }
    }

    public static TagEntry of(int tag, TagValue value) {
        return new TagEntry(tag, value);
    }

    public TagType type() {
        return value.type();
    }

    public int count() {
        return value.count();
    }

    public String tagName() {
        return Tags.tagName(tag, false);
    }

    @Override
    public int compareTo(TagEntry o) {
        return Integer.compare(tag, o.tag);
    }

    @Override
    public String toString() {
        return Tags.tagName(tag, true) + " = " + value.type() + "[" + value.count() + "] " + value;
    }
}

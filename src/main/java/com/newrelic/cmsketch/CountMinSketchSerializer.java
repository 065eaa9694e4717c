// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static com.newrelic.cmsketch.CountMinSketchException.Kind.INVALID_FORMAT;
import static com.newrelic.cmsketch.CountMinSketchException.Kind.TABLE_LENGTH_MISMATCH;

// Not implemented as member functions of the sketch classes so that multiple "third party" serializers and
// deserializers can be written and they are all created equal (no one has more privileged access to the classes)
//
// Two formats are supported:
//
// 1. Record format, a JSON object: {"width": w, "depth": d, "table": [c0, c1, ...]}
//    The table holds width * depth counters, row major, as unsigned integers. Array order must be preserved.
//
// 2. Binary format, in default Java byte order of big endian:
//    short version, int width, int depth, then width * depth counters written as varint.
//    This serializer uses a 2 pass method. The 1st pass computes buffer size. The 2nd pass writes to the buffer.
//
// Deserialization always goes through the CountMinSketch constructor, so seeds are regenerated and
// width is normalized the same way as for a new sketch.

public class CountMinSketchSerializer {
    // Each binary blob has a 2 byte version number at the beginning.
    // Given a serialized blob, the deserializer can restore the original object type.
    private static final short COUNT_MIN_SKETCH_VERSION = 0x100;            // CountMinSketch:            0x100 to 0x1FF
    private static final short CONCURRENT_COUNT_MIN_SKETCH_VERSION = 0x200; // ConcurrentCountMinSketch:  0x200 to 0x2FF

    public static final String WIDTH_FIELD = "width";
    public static final String DEPTH_FIELD = "depth";
    public static final String TABLE_FIELD = "table";

    private static final long MAX_COUNTER = 0xFFFFFFFFL;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    // ---------------- Record format ----------------

    @NotNull
    public static ObjectNode serialize(final FrequencySketch sketch) {
        if (sketch instanceof CountMinSketch) {
            return serializeCountMinSketch((CountMinSketch) sketch);
        } else if (sketch instanceof ConcurrentCountMinSketch) {
            synchronized (sketch) {
                return serialize(((ConcurrentCountMinSketch) sketch).getSketch());
            }
        } else {
            throw new IllegalArgumentException("Unknown FrequencySketch class " + sketch.getClass().getName());
        }
    }

    private static ObjectNode serializeCountMinSketch(final CountMinSketch sketch) {
        final ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put(WIDTH_FIELD, sketch.getWidth());
        node.put(DEPTH_FIELD, sketch.getDepth());

        final ArrayNode tableNode = node.putArray(TABLE_FIELD);
        for (final int counter : sketch.getTable()) {
            tableNode.add(Integer.toUnsignedLong(counter));
        }
        return node;
    }

    public static CountMinSketch deserialize(final JsonNode data) {
        return deserialize(data, LoggingSketchEventListener.INSTANCE);
    }

    public static CountMinSketch deserialize(final JsonNode data, final SketchEventListener listener) {
        if (data == null || !data.isObject()) {
            throw new CountMinSketchException(INVALID_FORMAT, "Invalid data format for CountMinSketch reconstruction: not an object");
        }
        final int width = readDimension(data, WIDTH_FIELD);
        final int depth = readDimension(data, DEPTH_FIELD);

        final JsonNode tableNode = data.get(TABLE_FIELD);
        if (tableNode == null || !tableNode.isArray()) {
            throw new CountMinSketchException(INVALID_FORMAT, "Invalid data format for CountMinSketch reconstruction: missing " + TABLE_FIELD + " array");
        }

        // Check length before allocating the table. Invalid dimensions are left to the constructor.
        if (width > 0 && depth > 0 && width <= SketchDimensions.MAX_WIDTH
                && (long) SketchDimensions.nextPowerOfTwo(width) * depth != tableNode.size()) {
            throw new CountMinSketchException(TABLE_LENGTH_MISMATCH, "Table length mismatch: expected "
                    + (long) SketchDimensions.nextPowerOfTwo(width) * depth + ", got " + tableNode.size());
        }

        final CountMinSketch sketch = new CountMinSketch(width, depth, listener);
        final int[] table = sketch.getTable();
        if (table.length != tableNode.size()) {
            throw new CountMinSketchException(TABLE_LENGTH_MISMATCH,
                    "Table length mismatch: expected " + table.length + ", got " + tableNode.size());
        }

        for (int i = 0; i < table.length; i++) {
            final JsonNode counter = tableNode.get(i);
            if (!counter.isIntegralNumber() || !counter.canConvertToLong()
                    || counter.longValue() < 0 || counter.longValue() > MAX_COUNTER) {
                throw new CountMinSketchException(INVALID_FORMAT, "Invalid counter at table index " + i + ": " + counter);
            }
            table[i] = (int) counter.longValue();
        }
        return sketch;
    }

    private static int readDimension(final JsonNode data, final String field) {
        final JsonNode node = data.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new CountMinSketchException(INVALID_FORMAT, "Invalid data format for CountMinSketch reconstruction: missing integer " + field);
        }
        return node.intValue();
    }

    public static String toJson(final FrequencySketch sketch) {
        try {
            return OBJECT_MAPPER.writeValueAsString(serialize(sketch));
        } catch (final JsonProcessingException e) {
            throw new RuntimeException("Failed to write sketch as JSON", e);
        }
    }

    public static CountMinSketch fromJson(final String json) {
        return fromJson(json, LoggingSketchEventListener.INSTANCE);
    }

    public static CountMinSketch fromJson(final String json, final SketchEventListener listener) {
        final JsonNode data;
        try {
            data = OBJECT_MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new CountMinSketchException(INVALID_FORMAT, "Malformed sketch JSON: " + e.getOriginalMessage(), e);
        }
        return deserialize(data, listener);
    }

    // ---------------- Binary format ----------------

    public static ByteBuffer serializeSketch(final FrequencySketch sketch) {
        final ByteBuffer buffer = ByteBuffer.allocate(getSerializeBufferSize(sketch));
        serializeSketch(sketch, buffer);
        buffer.flip(); // Flip position to 0 to be reader ready.
        return buffer;
    }

    public static void serializeSketch(final FrequencySketch sketch, final ByteBuffer buffer) {
        if (sketch instanceof CountMinSketch) {
            serializeCountMinSketch((CountMinSketch) sketch, buffer);
        } else if (sketch instanceof ConcurrentCountMinSketch) {
            serializeConcurrentCountMinSketch((ConcurrentCountMinSketch) sketch, buffer);
        } else {
            throw new IllegalArgumentException("Unknown FrequencySketch class " + sketch.getClass().getName());
        }
    }

    public static int getSerializeBufferSize(final FrequencySketch sketch) {
        if (sketch instanceof CountMinSketch) {
            return getCountMinSketchSerializeBufferSize((CountMinSketch) sketch);
        } else if (sketch instanceof ConcurrentCountMinSketch) {
            return Short.BYTES // Version
                    + getWrappedSerializeBufferSize((ConcurrentCountMinSketch) sketch);
        } else {
            throw new IllegalArgumentException("Unknown FrequencySketch class " + sketch.getClass().getName());
        }
    }

    public static FrequencySketch deserializeSketch(final ByteBuffer buffer) {
        return deserializeSketch(buffer, LoggingSketchEventListener.INSTANCE);
    }

    public static FrequencySketch deserializeSketch(final ByteBuffer buffer, final SketchEventListener listener) {
        try {
            return readSketch(buffer, listener);
        } catch (final BufferUnderflowException e) {
            throw new CountMinSketchException(INVALID_FORMAT, "Truncated sketch buffer", e);
        }
    }

    private static FrequencySketch readSketch(final ByteBuffer buffer, final SketchEventListener listener) {
        final short version = buffer.getShort();

        switch (version) {
            case COUNT_MIN_SKETCH_VERSION:
                return readCountMinSketch(buffer, listener);
            case CONCURRENT_COUNT_MIN_SKETCH_VERSION:
                // A wrapper always holds a plain sketch. Writer flattens nested wrappers.
                final short wrappedVersion = buffer.getShort();
                if (wrappedVersion != COUNT_MIN_SKETCH_VERSION) {
                    throw new CountMinSketchException(INVALID_FORMAT, "Unexpected wrapped sketch version " + wrappedVersion);
                }
                return new ConcurrentCountMinSketch(readCountMinSketch(buffer, listener));
            default:
                throw new CountMinSketchException(INVALID_FORMAT, "Unknown sketch version " + version);
        }
    }

    private static void serializeCountMinSketch(final CountMinSketch sketch, final ByteBuffer buffer) {
        buffer.putShort(COUNT_MIN_SKETCH_VERSION);
        buffer.putInt(sketch.getWidth());
        buffer.putInt(sketch.getDepth());

        for (final int counter : sketch.getTable()) {
            writeVarint64(buffer, Integer.toUnsignedLong(counter));
        }
    }

    private static int getCountMinSketchSerializeBufferSize(final CountMinSketch sketch) {
        int size = Short.BYTES  // Version
                + Integer.BYTES // width
                + Integer.BYTES; // depth

        for (final int counter : sketch.getTable()) {
            size += varint64EncodedLength(Integer.toUnsignedLong(counter));
        }
        return size;
    }

    private static CountMinSketch readCountMinSketch(final ByteBuffer buffer, final SketchEventListener listener) {
        final int width = buffer.getInt();
        final int depth = buffer.getInt();

        // Every counter takes at least one byte. Check before allocating the table.
        if (width > 0 && depth > 0 && (long) width * depth > buffer.remaining()) {
            throw new CountMinSketchException(INVALID_FORMAT, "Truncated sketch buffer: " + buffer.remaining()
                    + " bytes left for " + width + " * " + depth + " counters");
        }

        // Writer always writes a normalized width. Non-positive values are left to the constructor.
        if (width > 0 && !SketchDimensions.isPowerOfTwo(width)) {
            throw new CountMinSketchException(INVALID_FORMAT, "Serialized width " + width + " is not a power of 2");
        }

        final CountMinSketch sketch = new CountMinSketch(width, depth, listener);

        final int[] table = sketch.getTable();
        for (int i = 0; i < table.length; i++) {
            final long counter = readVarint64(buffer);
            if (counter < 0 || counter > MAX_COUNTER) {
                throw new CountMinSketchException(INVALID_FORMAT, "Counter " + counter + " at table index " + i + " exceeds 32 bits");
            }
            table[i] = (int) counter;
        }
        return sketch;
    }

    private static void serializeConcurrentCountMinSketch(final ConcurrentCountMinSketch sketch, final ByteBuffer buffer) {
        buffer.putShort(CONCURRENT_COUNT_MIN_SKETCH_VERSION);
        serializeWrappedSketch(sketch, buffer);
    }

    // Nested wrappers are written as one wrapper around the innermost sketch.
    private static void serializeWrappedSketch(final ConcurrentCountMinSketch sketch, final ByteBuffer buffer) {
        synchronized (sketch) {
            final FrequencySketch wrapped = sketch.getSketch();
            if (wrapped instanceof ConcurrentCountMinSketch) {
                serializeWrappedSketch((ConcurrentCountMinSketch) wrapped, buffer);
            } else {
                serializeSketch(wrapped, buffer);
            }
        }
    }

    private static int getWrappedSerializeBufferSize(final ConcurrentCountMinSketch sketch) {
        synchronized (sketch) {
            final FrequencySketch wrapped = sketch.getSketch();
            if (wrapped instanceof ConcurrentCountMinSketch) {
                return getWrappedSerializeBufferSize((ConcurrentCountMinSketch) wrapped);
            }
            return getSerializeBufferSize(wrapped);
        }
    }

    public static void writeVarint64(final ByteBuffer buffer, long value) {
        while ((value & -128L) != 0L) {
            buffer.put((byte) (value | 128L));
            value >>>= 7;
        }
        buffer.put((byte) value);
    }

    public static int varint64EncodedLength(long value) {
        int length = 0;
        while ((value & -128L) != 0L) {
            length++;
            value >>>= 7;
        }
        length++;
        return length;
    }

    public static long readVarint64(final ByteBuffer buffer) {
        int shift = 0;
        long result = 0L;

        while (true) {
            final byte b1 = buffer.get();
            result |= (long) (b1 & 127) << shift;
            if ((b1 & 128) != 128) {
                break;
            }
            shift += 7;
            if (shift >= 64) {
                throw new CountMinSketchException(INVALID_FORMAT, "Exceeded max length of varint64");
            }
        }
        return result;
    }
}

// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import com.newrelic.cmsketch.hash.Fnv1aHash;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

import static com.newrelic.cmsketch.CountMinSketchException.Kind.DIMENSION_MISMATCH;
import static com.newrelic.cmsketch.CountMinSketchException.Kind.INVALID_DIMENSION;

// Count-Min Sketch over a flat counter table of "depth" rows by "width" columns, row major.
// A key maps to one counter per row, at column (hash(key, row) & (width - 1)).
//
// Counters are 32 bit unsigned and wrap around on overflow. They are not saturated: a counter that wrapped
// reads low, which may break the "never underestimate" guarantee once a single counter passes 2^32 - 1.
//
// Hash values go into a per-thread scratch buffer, so hashing never allocates. The counter table itself is
// not thread safe. Use ConcurrentCountMinSketch for multi-thread access.

public class CountMinSketch implements FrequencySketch {
    public static final int DEFAULT_WIDTH = 4096;  // epsilon 0.00066
    public static final int DEFAULT_DEPTH = 5;     // delta 0.0067
    public static final int UNROLLED_DEPTH = 5;    // Depth with a hand unrolled update and query path

    private static final long MAX_TABLE_SIZE = Integer.MAX_VALUE - 8; // Conservative max java array length

    private final int width;
    private final int depth;
    private final int bitmask;
    private final int[] table;
    private final int[] seeds;
    private final ThreadLocal<int[]> scratchHashes;

    public CountMinSketch() {
        this(DEFAULT_WIDTH, DEFAULT_DEPTH);
    }

    public CountMinSketch(final int width, final int depth) {
        this(width, depth, LoggingSketchEventListener.INSTANCE);
    }

    // Width is rounded up to a power of 2. The listener is told when that happens.
    public CountMinSketch(final int width, final int depth, final SketchEventListener listener) {
        if (width <= 0 || depth <= 0) {
            throw new CountMinSketchException(INVALID_DIMENSION, "Width and depth must be positive integers: width=" + width + ", depth=" + depth);
        }
        if (width > SketchDimensions.MAX_WIDTH) {
            throw new CountMinSketchException(INVALID_DIMENSION, "Width " + width + " exceeds max width " + SketchDimensions.MAX_WIDTH);
        }
        this.width = SketchDimensions.nextPowerOfTwo(width);
        this.depth = depth;
        if ((long) this.width * depth > MAX_TABLE_SIZE) {
            throw new CountMinSketchException(INVALID_DIMENSION, "Table size " + this.width + " * " + depth + " is too large");
        }
        if (this.width != width) {
            listener.onWidthAdjusted(width, this.width);
        }

        this.bitmask = this.width - 1;
        this.table = new int[this.width * depth];
        this.seeds = Fnv1aHash.rowSeeds(depth);
        this.scratchHashes = newScratchHashes(depth);
    }

    // For deepCopy only. Takes ownership of "table".
    private CountMinSketch(final int width, final int depth, final int[] table) {
        this.width = width;
        this.depth = depth;
        this.bitmask = width - 1;
        this.table = table;
        this.seeds = Fnv1aHash.rowSeeds(depth);
        this.scratchHashes = newScratchHashes(depth);
    }

    private static ThreadLocal<int[]> newScratchHashes(final int depth) {
        return ThreadLocal.withInitial(() -> new int[depth]);
    }

    public static CountMinSketch createEstimate(final double epsilon, final double delta) {
        return createEstimate(epsilon, delta, LoggingSketchEventListener.INSTANCE);
    }

    // Creates a sketch sized for error bounds. See SketchDimensions.
    public static CountMinSketch createEstimate(final double epsilon, final double delta, final SketchEventListener listener) {
        final SketchDimensions dimensions = SketchDimensions.fromErrorBounds(epsilon, delta);
        listener.onDimensionsEstimated(epsilon, delta, dimensions);
        return new CountMinSketch(dimensions.getWidth(), dimensions.getDepth(), listener);
    }

    @Override
    public FrequencySketch deepCopy() {
        return new CountMinSketch(width, depth, table.clone());
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    @NotNull
    int[] getTable() {
        return table;
    }

    int[] getSeeds() {
        return seeds.clone();
    }

    @Override
    public long getTotalCount() {
        // Every update adds to exactly one counter per row. So any row sums up to the total.
        long total = 0;
        for (int i = 0; i < width; i++) {
            total += Integer.toUnsignedLong(table[i]);
        }
        return total;
    }

    @Override
    public double getRelativeError() {
        return SketchDimensions.relativeError(width);
    }

    @Override
    public double getConfidence() {
        return SketchDimensions.confidence(depth);
    }

    @Override
    public void update(final CharSequence key, final long count) {
        if (count <= 0) {
            return; // Only increment
        }
        final int[] hashes = scratchHashes.get();
        Fnv1aHash.populateHashes(key, seeds, hashes);
        add(hashes, (int) count);
    }

    @Override
    public void update(final byte[] key, final long count) {
        if (count <= 0) {
            return;
        }
        final int[] hashes = scratchHashes.get();
        Fnv1aHash.populateHashes(key, seeds, hashes);
        add(hashes, (int) count);
    }

    @Override
    public long query(final CharSequence key) {
        final int[] hashes = scratchHashes.get();
        Fnv1aHash.populateHashes(key, seeds, hashes);
        return min(hashes);
    }

    @Override
    public long query(final byte[] key) {
        final int[] hashes = scratchHashes.get();
        Fnv1aHash.populateHashes(key, seeds, hashes);
        return min(hashes);
    }

    // "count" holds the low 32 bits of the update count. Addition wraps modulo 2^32.
    private void add(final int[] hashes, final int count) {
        if (depth == UNROLLED_DEPTH) {
            addUnrolled(hashes, count);
        } else {
            addGeneric(hashes, count);
        }
    }

    private long min(final int[] hashes) {
        return depth == UNROLLED_DEPTH ? minUnrolled(hashes) : minGeneric(hashes);
    }

    void addGeneric(final int[] hashes, final int count) {
        for (int i = 0; i < depth; i++) {
            table[(hashes[i] & bitmask) + i * width] += count;
        }
    }

    void addUnrolled(final int[] hashes, final int count) {
        final int w = width;
        table[(hashes[0] & bitmask)] += count;
        table[(hashes[1] & bitmask) + w] += count;
        table[(hashes[2] & bitmask) + 2 * w] += count;
        table[(hashes[3] & bitmask) + 3 * w] += count;
        table[(hashes[4] & bitmask) + 4 * w] += count;
    }

    long minGeneric(final int[] hashes) {
        long min = Long.MAX_VALUE;
        for (int i = 0; i < depth; i++) {
            min = Math.min(min, Integer.toUnsignedLong(table[(hashes[i] & bitmask) + i * width]));
        }
        return min;
    }

    long minUnrolled(final int[] hashes) {
        final int w = width;
        long min = Integer.toUnsignedLong(table[(hashes[0] & bitmask)]);
        min = Math.min(min, Integer.toUnsignedLong(table[(hashes[1] & bitmask) + w]));
        min = Math.min(min, Integer.toUnsignedLong(table[(hashes[2] & bitmask) + 2 * w]));
        min = Math.min(min, Integer.toUnsignedLong(table[(hashes[3] & bitmask) + 3 * w]));
        min = Math.min(min, Integer.toUnsignedLong(table[(hashes[4] & bitmask) + 4 * w]));
        return min;
    }

    @Override
    public FrequencySketch merge(final FrequencySketch other) {
        if (other instanceof ConcurrentCountMinSketch) {
            return merge(((ConcurrentCountMinSketch) other).getSketch());
        }
        if (!(other instanceof CountMinSketch)) {
            throw new IllegalArgumentException("CountMinSketch cannot merge with " + other.getClass().getName());
        }
        return merge(this, (CountMinSketch) other);
    }

    // Merge 2 sketches. Output in "a". Does not modify "b". Returns a.
    // a and b must have the same width and depth.
    public static CountMinSketch merge(final CountMinSketch a, final CountMinSketch b) {
        if (a.width != b.width || a.depth != b.depth) {
            throw new CountMinSketchException(DIMENSION_MISMATCH, "Cannot merge sketches with different dimensions: "
                    + a.width + "x" + a.depth + " and " + b.width + "x" + b.depth);
        }
        for (int i = 0; i < a.table.length; i++) {
            a.table[i] += b.table[i];
        }
        return a;
    }

    @Override
    public void clear() {
        Arrays.fill(table, 0);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof CountMinSketch)) {
            return false;
        }
        final CountMinSketch other = (CountMinSketch) obj;
        return width == other.width && depth == other.depth && Arrays.equals(table, other.table);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(depth);
        result = 31 * result + Arrays.hashCode(table);
        return result;
    }

    @Override
    public String toString() {
        return "width=" + width + ", depth=" + depth + ", totalCount=" + getTotalCount();
    }
}

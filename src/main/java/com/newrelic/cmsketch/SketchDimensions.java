// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import static com.newrelic.cmsketch.CountMinSketchException.Kind.INVALID_PARAMETER;

// Width and depth of a sketch derived from error bounds.
//
// For a key with true frequency f and a total inserted count N, a sketch of these dimensions returns an
// estimate in [f, f + epsilon * N] with probability at least 1 - delta.
//   width = nextPowerOfTwo(ceil(e / epsilon))
//   depth = ceil(ln(1 / delta)), at least 1

public final class SketchDimensions {
    public static final int MAX_WIDTH = 1 << 30; // Largest power of 2 in int range

    private final int rawWidth;
    private final int width;
    private final int depth;

    private SketchDimensions(final int rawWidth, final int width, final int depth) {
        this.rawWidth = rawWidth;
        this.width = width;
        this.depth = depth;
    }

    // Epsilon and delta must both be in the exclusive range (0, 1). Otherwise throws INVALID_PARAMETER.
    public static SketchDimensions fromErrorBounds(final double epsilon, final double delta) {
        if (!(epsilon > 0 && epsilon < 1) || !(delta > 0 && delta < 1)) { // Negated form also rejects NaN
            throw new CountMinSketchException(INVALID_PARAMETER,
                    "Epsilon and delta must be between 0 and 1 (exclusive): epsilon=" + epsilon + ", delta=" + delta);
        }
        final double widthEstimate = Math.ceil(Math.E / epsilon);
        if (widthEstimate > MAX_WIDTH) {
            throw new CountMinSketchException(INVALID_PARAMETER, "Epsilon " + epsilon + " requires a width above " + MAX_WIDTH);
        }
        final int rawWidth = (int) widthEstimate;
        final int depth = Math.max(1, (int) Math.ceil(Math.log(1 / delta)));
        return new SketchDimensions(rawWidth, nextPowerOfTwo(rawWidth), depth);
    }

    // Smallest power of 2 >= n. Returns 1 for n <= 0. Input must not exceed 2^30.
    public static int nextPowerOfTwo(final int n) {
        if (n <= 1) {
            return 1;
        }
        return Integer.highestOneBit(n - 1) << 1;
    }

    public static boolean isPowerOfTwo(final int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    // Width before rounding up to a power of 2.
    public int getRawWidth() {
        return rawWidth;
    }

    public int getWidth() {
        return width;
    }

    public int getDepth() {
        return depth;
    }

    // Epsilon actually achieved with the rounded width. Never larger than the requested epsilon.
    public double getRelativeError() {
        return relativeError(width);
    }

    // 1 - delta actually achieved with this depth.
    public double getConfidence() {
        return confidence(depth);
    }

    static double relativeError(final int width) {
        return Math.E / width;
    }

    static double confidence(final int depth) {
        return 1 - Math.exp(-depth);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof SketchDimensions)) {
            return false;
        }
        final SketchDimensions other = (SketchDimensions) obj;
        return rawWidth == other.rawWidth && width == other.width && depth == other.depth;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(rawWidth);
        result = 31 * result + Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(depth);
        return result;
    }

    @Override
    public String toString() {
        return "{rawWidth=" + rawWidth + ", width=" + width + ", depth=" + depth + "}";
    }
}

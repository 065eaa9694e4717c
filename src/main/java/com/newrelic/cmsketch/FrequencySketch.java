// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

public interface FrequencySketch {

    // Record a single occurrence of key. ie. increment its count by 1.
    default void update(final CharSequence key) {
        update(key, 1);
    }

    // Record "count" occurrences of key. A count <= 0 is ignored; the sketch only accumulates.
    void update(final CharSequence key, final long count);

    default void update(final byte[] key) {
        update(key, 1);
    }

    void update(final byte[] key, final long count);

    // Returns estimated count of key. The estimate is never lower than the true count,
    // and may be higher because of hash collisions.
    long query(final CharSequence key);

    long query(final byte[] key);

    // Merge two sketches. Merge result goes into "this". Always returns "this".
    // An implementation should not modify "other".
    FrequencySketch merge(final FrequencySketch other);

    // Reset all counters to 0. Dimensions are unchanged.
    void clear();

    // Returns a deep copy of the sketch.
    FrequencySketch deepCopy();

    // Number of counters per row. Always a power of 2.
    int getWidth();

    // Number of rows, ie. number of hash functions.
    int getDepth();

    // Returns total count inserted, modulo 2^32 per counter.
    long getTotalCount();

    // Returns epsilon: with probability getConfidence(), an estimate exceeds the true count by
    // at most getRelativeError() * getTotalCount().
    double getRelativeError();

    // Returns 1 - delta.
    double getConfidence();
}

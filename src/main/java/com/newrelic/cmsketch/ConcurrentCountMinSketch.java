// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

// A concurrency wrapper for FrequencySketch. Methods are defined as "synchronized" for multi-thread access.
// NOTES:
// 1. When calling merge(), caller must ensure that "other" is also protected from concurrent modification.
// 2. Code holding getSketch() directly bypasses the lock. Synchronize on the wrapper when doing so.
//
public class ConcurrentCountMinSketch implements FrequencySketch {
    protected final FrequencySketch sketch;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    public ConcurrentCountMinSketch(final FrequencySketch sketch) {
        this.sketch = sketch;
    }

    @Override
    public synchronized FrequencySketch deepCopy() {
        return new ConcurrentCountMinSketch(sketch.deepCopy());
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public FrequencySketch getSketch() {
        return sketch;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof ConcurrentCountMinSketch)) {
            return false;
        }
        return sketch.equals(((ConcurrentCountMinSketch) obj).sketch);
    }

    @Override
    public int hashCode() {
        return sketch.hashCode(); // Hash code collision between "this" and "this.sketch" is acceptable.
    }

    @Override
    public synchronized void update(final CharSequence key, final long count) {
        sketch.update(key, count);
    }

    @Override
    public synchronized void update(final byte[] key, final long count) {
        sketch.update(key, count);
    }

    @Override
    public synchronized long query(final CharSequence key) {
        return sketch.query(key);
    }

    @Override
    public synchronized long query(final byte[] key) {
        return sketch.query(key);
    }

    // Caller must ensure that "other" is also protected from concurrent modification.
    // Returns "this", not the wrapped sketch.
    @Override
    public synchronized FrequencySketch merge(final FrequencySketch other) {
        if (other instanceof ConcurrentCountMinSketch) {
            sketch.merge(((ConcurrentCountMinSketch) other).sketch);
        } else {
            sketch.merge(other);
        }
        return this;
    }

    @Override
    public synchronized void clear() {
        sketch.clear();
    }

    @Override
    public synchronized int getWidth() {
        return sketch.getWidth();
    }

    @Override
    public synchronized int getDepth() {
        return sketch.getDepth();
    }

    @Override
    public synchronized long getTotalCount() {
        return sketch.getTotalCount();
    }

    @Override
    public synchronized double getRelativeError() {
        return sketch.getRelativeError();
    }

    @Override
    public synchronized double getConfidence() {
        return sketch.getConfidence();
    }

    @Override
    public synchronized String toString() {
        return "concurrent{" + sketch + "}";
    }
}

// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

// Receives diagnostic events from sketch construction. Events are informational; they never signal an error.
// Implementations are called on the constructing thread and must not throw.
public interface SketchEventListener {
    SketchEventListener NONE = new SketchEventListener() {
    };

    // Requested width was not a power of 2 and has been rounded up.
    default void onWidthAdjusted(final int requestedWidth, final int adjustedWidth) {
    }

    // Dimensions were derived from error bounds, before the sketch is constructed.
    default void onDimensionsEstimated(final double epsilon, final double delta, final SketchDimensions dimensions) {
    }
}

// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Default event listener. Writes sketch construction events to the SLF4J logger of this class.
public final class LoggingSketchEventListener implements SketchEventListener {
    public static final LoggingSketchEventListener INSTANCE = new LoggingSketchEventListener();

    private static final Logger logger = LoggerFactory.getLogger(LoggingSketchEventListener.class);

    private LoggingSketchEventListener() {
    }

    @Override
    public void onWidthAdjusted(final int requestedWidth, final int adjustedWidth) {
        logger.info("Adjusted sketch width from {} to next power of 2: {}", requestedWidth, adjustedWidth);
    }

    @Override
    public void onDimensionsEstimated(final double epsilon, final double delta, final SketchDimensions dimensions) {
        logger.info("Creating sketch with estimated width={} (adjusted to {}), depth={} for epsilon={}, delta={}",
                dimensions.getRawWidth(), dimensions.getWidth(), dimensions.getDepth(), epsilon, delta);
    }
}

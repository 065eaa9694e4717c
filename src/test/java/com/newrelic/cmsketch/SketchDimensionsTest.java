// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import org.junit.Test;

import static com.newrelic.cmsketch.CountMinSketchTest.assertThrowsKind;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SketchDimensionsTest {
    @Test
    public void testFromErrorBounds() {
        SketchDimensions dimensions = SketchDimensions.fromErrorBounds(0.01, 0.01);
        assertEquals(272, dimensions.getRawWidth()); // ceil(e / 0.01) = ceil(271.83)
        assertEquals(512, dimensions.getWidth());
        assertEquals(5, dimensions.getDepth());      // ceil(ln(100)) = ceil(4.605)

        dimensions = SketchDimensions.fromErrorBounds(0.001, 0.01);
        assertEquals(2719, dimensions.getRawWidth());
        assertEquals(4096, dimensions.getWidth());
        assertEquals(5, dimensions.getDepth());

        dimensions = SketchDimensions.fromErrorBounds(0.5, 0.5);
        assertEquals(6, dimensions.getRawWidth());
        assertEquals(8, dimensions.getWidth());
        assertEquals(1, dimensions.getDepth());

        // ln(1 / 0.99) is tiny but still rounds up to 1.
        assertEquals(1, SketchDimensions.fromErrorBounds(0.1, 0.99).getDepth());
        assertEquals(10, SketchDimensions.fromErrorBounds(0.1, 0.0001).getDepth());
    }

    @Test
    public void testAchievedBounds() {
        final SketchDimensions dimensions = SketchDimensions.fromErrorBounds(0.01, 0.01);
        assertEquals(Math.E / 512, dimensions.getRelativeError(), 0);
        assertTrue(dimensions.getRelativeError() <= 0.01);
        assertEquals(1 - Math.exp(-5), dimensions.getConfidence(), 0);
        assertTrue(dimensions.getConfidence() >= 0.99);
    }

    @Test
    public void testInvalidParameters() {
        final double[] invalid = new double[]{0, 1, -0.1, 1.5, Double.NaN, Double.POSITIVE_INFINITY};
        for (final double value : invalid) {
            assertThrowsKind(CountMinSketchException.Kind.INVALID_PARAMETER, () -> SketchDimensions.fromErrorBounds(value, 0.01));
            assertThrowsKind(CountMinSketchException.Kind.INVALID_PARAMETER, () -> SketchDimensions.fromErrorBounds(0.01, value));
        }
        // Width would not fit in an int.
        assertThrowsKind(CountMinSketchException.Kind.INVALID_PARAMETER, () -> SketchDimensions.fromErrorBounds(1e-12, 0.01));
    }

    @Test
    public void testNextPowerOfTwo() {
        assertEquals(1, SketchDimensions.nextPowerOfTwo(-5));
        assertEquals(1, SketchDimensions.nextPowerOfTwo(0));
        assertEquals(1, SketchDimensions.nextPowerOfTwo(1));
        assertEquals(2, SketchDimensions.nextPowerOfTwo(2));
        assertEquals(4, SketchDimensions.nextPowerOfTwo(3));
        assertEquals(512, SketchDimensions.nextPowerOfTwo(272));
        assertEquals(1024, SketchDimensions.nextPowerOfTwo(1000));
        assertEquals(1024, SketchDimensions.nextPowerOfTwo(1024));
        assertEquals(2048, SketchDimensions.nextPowerOfTwo(1025));
        assertEquals(1 << 30, SketchDimensions.nextPowerOfTwo((1 << 29) + 1));
        assertEquals(1 << 30, SketchDimensions.nextPowerOfTwo(1 << 30));

        assertTrue(SketchDimensions.isPowerOfTwo(1));
        assertTrue(SketchDimensions.isPowerOfTwo(1024));
        assertFalse(SketchDimensions.isPowerOfTwo(0));
        assertFalse(SketchDimensions.isPowerOfTwo(1000));
        assertFalse(SketchDimensions.isPowerOfTwo(Integer.MIN_VALUE));
    }

    @Test
    public void testEqualAndHash() {
        assertEquals(SketchDimensions.fromErrorBounds(0.01, 0.01), SketchDimensions.fromErrorBounds(0.01, 0.01));
        assertEquals(SketchDimensions.fromErrorBounds(0.01, 0.01).hashCode(), SketchDimensions.fromErrorBounds(0.01, 0.01).hashCode());
        assertEquals("{rawWidth=272, width=512, depth=5}", SketchDimensions.fromErrorBounds(0.01, 0.01).toString());
    }
}

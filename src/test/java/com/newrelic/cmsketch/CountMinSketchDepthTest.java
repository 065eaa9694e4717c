// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

import com.newrelic.cmsketch.hash.Fnv1aHash;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Random;

import static com.newrelic.cmsketch.CountMinSketchTest.generateRandomString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assume.assumeTrue;

// The depth 5 fast path must behave exactly like the generic loop. Other depths only use the generic loop.
@RunWith(Parameterized.class)
public class CountMinSketchDepthTest {
    @Parameterized.Parameters(name = "depth {0}")
    public static Collection<Object[]> data() {
        final Collection<Object[]> collection = new ArrayList<>();
        for (int depth : new int[]{1, 2, 4, 5, 6, 10}) {
            collection.add(new Object[]{depth});
        }
        return collection;
    }

    @Parameterized.Parameter()
    public int depth;

    @Test
    public void testPublicPathMatchesGenericLoop() {
        final Random random = new Random(depth);
        final CountMinSketch sketch = new CountMinSketch(128, depth, SketchEventListener.NONE);
        final CountMinSketch generic = new CountMinSketch(128, depth, SketchEventListener.NONE);
        final int[] seeds = Fnv1aHash.rowSeeds(depth);
        final int[] hashes = new int[depth];

        for (int i = 0; i < 3000; i++) {
            final String key = generateRandomString(random, 1 + random.nextInt(16));
            final int count = 1 + random.nextInt(50);
            sketch.update(key, count);
            Fnv1aHash.populateHashes(key, seeds, hashes);
            generic.addGeneric(hashes, count);
        }
        assertArrayEquals(generic.getTable(), sketch.getTable());

        for (int i = 0; i < 500; i++) {
            final String key = generateRandomString(random, 1 + random.nextInt(16));
            Fnv1aHash.populateHashes(key, seeds, hashes);
            assertEquals(generic.minGeneric(hashes), sketch.query(key));
        }
    }

    @Test
    public void testUnrolledMatchesGenericLoop() {
        assumeTrue(depth == CountMinSketch.UNROLLED_DEPTH);
        final Random random = new Random(99);
        final CountMinSketch unrolled = new CountMinSketch(64, depth, SketchEventListener.NONE);
        final CountMinSketch generic = new CountMinSketch(64, depth, SketchEventListener.NONE);
        final int[] seeds = Fnv1aHash.rowSeeds(depth);
        final int[] hashes = new int[depth];

        for (int i = 0; i < 2000; i++) {
            final String key = generateRandomString(random, 8);
            final int count = 1 + random.nextInt(10);
            Fnv1aHash.populateHashes(key, seeds, hashes);
            unrolled.addUnrolled(hashes, count);
            generic.addGeneric(hashes, count);
        }
        assertArrayEquals(generic.getTable(), unrolled.getTable());

        for (int i = 0; i < 500; i++) {
            Fnv1aHash.populateHashes(generateRandomString(random, 8), seeds, hashes);
            assertEquals(generic.minGeneric(hashes), unrolled.minUnrolled(hashes));
        }
    }
}

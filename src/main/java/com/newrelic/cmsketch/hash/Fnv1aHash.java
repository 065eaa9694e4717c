// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch.hash;

// 32 bit FNV-1a hash, with a seed XORed into the offset basis.
//
// A sketch derives one hash per row by calling this function with seeds 0 to depth - 1.
// XOR seeding of a single base hash is cheaper than a family of independently keyed hash functions,
// at the cost of some correlation between rows. Changing the seeding changes which counters a key maps to,
// so serialized sketches are only compatible across versions using the same seeds.
//
// Returned values are raw 32 bit patterns. Callers mask them, so the sign bit carries no meaning.

public final class Fnv1aHash {
    public static final int OFFSET_BASIS = 0x811C9DC5; // 2166136261
    public static final int PRIME = 0x01000193;        // 16777619

    private Fnv1aHash() {
    }

    // Hashes UTF-16 code units, one per char.
    public static int hash(final CharSequence key, final int seed) {
        int hash = OFFSET_BASIS ^ seed;
        final int length = key.length();
        for (int i = 0; i < length; i++) {
            hash = (hash ^ key.charAt(i)) * PRIME;
        }
        return hash;
    }

    // Hashes bytes as unsigned values. For ASCII content this matches hash(CharSequence, int).
    public static int hash(final byte[] key, final int seed) {
        int hash = OFFSET_BASIS ^ seed;
        for (final byte b : key) {
            hash = (hash ^ (b & 0xFF)) * PRIME;
        }
        return hash;
    }

    // Writes one hash per seed into "out". "out" must be at least seeds.length long.
    public static void populateHashes(final CharSequence key, final int[] seeds, final int[] out) {
        for (int i = 0; i < seeds.length; i++) {
            out[i] = hash(key, seeds[i]);
        }
    }

    public static void populateHashes(final byte[] key, final int[] seeds, final int[] out) {
        for (int i = 0; i < seeds.length; i++) {
            out[i] = hash(key, seeds[i]);
        }
    }

    // Seeds used by a sketch of the given depth.
    public static int[] rowSeeds(final int depth) {
        final int[] seeds = new int[depth];
        for (int i = 0; i < depth; i++) {
            seeds[i] = i;
        }
        return seeds;
    }
}

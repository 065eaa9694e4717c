// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the CmSketch project.

package com.newrelic.cmsketch;

// Thrown when a sketch operation rejects its input. The operation has not modified any sketch when this is thrown.
public class CountMinSketchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_DIMENSION,      // Constructor called with width or depth out of range
        INVALID_PARAMETER,      // Epsilon or delta outside of (0, 1)
        DIMENSION_MISMATCH,     // Merging sketches of different width or depth
        INVALID_FORMAT,         // Serialized data is not a well formed sketch
        TABLE_LENGTH_MISMATCH   // Serialized table length disagrees with width * depth
    }

    private final Kind kind;

    public CountMinSketchException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CountMinSketchException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

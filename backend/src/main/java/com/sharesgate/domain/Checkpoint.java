package com.sharesgate.domain;

/**
 * Resume point for a chain. Block-height chains advance {@code position}; cursor chains carry an
 * opaque {@code cursorToken} and a numeric surrogate in {@code position} for display only.
 */
public record Checkpoint(long position, String cursorToken) {

    public static Checkpoint ofBlock(long block) {
        return new Checkpoint(block, null);
    }

    public static Checkpoint ofCursor(long surrogate, String cursorToken) {
        return new Checkpoint(surrogate, cursorToken);
    }

    public boolean hasCursor() {
        return cursorToken != null;
    }

    /** Log form: "block 123" or "cursor {...}". */
    public String describe() {
        return hasCursor() ? "cursor " + cursorToken : "block " + position;
    }
}

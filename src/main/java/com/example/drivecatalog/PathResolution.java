package com.example.drivecatalog;

/**
 * Outcome of an ancestor walk: the path built so far and why the walk stopped.
 */
public record PathResolution(String path, Outcome outcome) {

    public enum Outcome {
        /** Reached an ancestor without a parent. */
        COMPLETE,
        /** An ancestor id repeated within the walk. */
        CYCLE_DETECTED,
        /** The configured maximum number of ancestors was exceeded. */
        DEPTH_LIMIT,
        /** An ancestor no longer exists or is not visible. */
        NOT_FOUND,
        /** Any other lookup failure. */
        LOOKUP_FAILED
    }

    public boolean isComplete() {
        return outcome == Outcome.COMPLETE;
    }
}

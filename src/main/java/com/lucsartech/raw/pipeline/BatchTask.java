package com.lucsartech.raw.pipeline;

import java.nio.file.Path;

/**
 * Unit of work on the batch queue.
 * Uses sealed interface for type-safe poison pill pattern.
 */
public sealed interface BatchTask {

    /**
     * One source to convert into {@code output}.
     */
    record Input(int index, Path source, Path output) implements BatchTask {}

    /**
     * Poison pill to signal a worker to stop.
     */
    record Poison() implements BatchTask {
        public static final Poison INSTANCE = new Poison();
    }

    default boolean isPoison() {
        return this instanceof Poison;
    }
}

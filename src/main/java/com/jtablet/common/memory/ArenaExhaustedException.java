package com.jtablet.common.memory;

import java.io.IOException;

/**
 * Thrown when an arena allocation would exceed the arena's memory limit.
 */
public class ArenaExhaustedException extends IOException {
    public ArenaExhaustedException(String message) {
        super(message);
    }
}

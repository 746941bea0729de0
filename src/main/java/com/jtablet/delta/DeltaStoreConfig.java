package com.jtablet.delta;

import com.jtablet.common.memory.Arena;

/**
 * Configuration for a {@link DeltaMemStore}.
 */
public class DeltaStoreConfig {
    private final int arenaInitialBlockSize;
    private final int arenaMaxBlockSize;
    private final long memoryLimitBytes;

    private DeltaStoreConfig(Builder builder) {
        this.arenaInitialBlockSize = builder.arenaInitialBlockSize;
        this.arenaMaxBlockSize = builder.arenaMaxBlockSize;
        this.memoryLimitBytes = builder.memoryLimitBytes;
    }

    public static DeltaStoreConfig defaults() {
        return new Builder().build();
    }

    public int getArenaInitialBlockSize() {
        return arenaInitialBlockSize;
    }

    public int getArenaMaxBlockSize() {
        return arenaMaxBlockSize;
    }

    public long getMemoryLimitBytes() {
        return memoryLimitBytes;
    }

    public static class Builder {
        private int arenaInitialBlockSize = 1024;
        private int arenaMaxBlockSize = 1024 * 1024; // Default to 1MB
        private long memoryLimitBytes = Arena.UNLIMITED;

        public Builder setArenaInitialBlockSize(int arenaInitialBlockSize) {
            this.arenaInitialBlockSize = arenaInitialBlockSize;
            return this;
        }

        public Builder setArenaMaxBlockSize(int arenaMaxBlockSize) {
            this.arenaMaxBlockSize = arenaMaxBlockSize;
            return this;
        }

        public Builder setMemoryLimitBytes(long memoryLimitBytes) {
            this.memoryLimitBytes = memoryLimitBytes;
            return this;
        }

        public DeltaStoreConfig build() {
            if (arenaInitialBlockSize <= 0) {
                throw new IllegalStateException("Arena initial block size must be positive");
            }
            if (arenaMaxBlockSize < arenaInitialBlockSize) {
                throw new IllegalStateException("Arena max block size must be at least the initial block size");
            }
            if (memoryLimitBytes <= 0) {
                throw new IllegalStateException("Memory limit must be positive");
            }
            return new DeltaStoreConfig(this);
        }
    }
}

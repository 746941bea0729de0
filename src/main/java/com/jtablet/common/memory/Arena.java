package com.jtablet.common.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A bump allocator that owns copies of variable-length values.
 *
 * <p>Memory is carved out of byte array blocks. Blocks start at the initial size
 * and double up to the maximum block size; a value larger than the maximum block
 * size gets a block of its own. Nothing is freed individually: {@link #reset()}
 * releases every allocation at once, so slices handed out before a reset must
 * no longer be used.</p>
 *
 * <p>Allocation is synchronized, so one arena may be shared by concurrent writers.</p>
 */
public class Arena {
    private static final Logger LOG = LoggerFactory.getLogger(Arena.class);

    public static final long UNLIMITED = Long.MAX_VALUE;

    private final int initialBlockSize;
    private final int maxBlockSize;
    private final long memoryLimit;

    private final List<byte[]> blocks = new ArrayList<>();
    private byte[] currentBlock;
    private int currentOffset;
    private long memoryFootprint;
    private long allocatedBytes;

    public Arena(int initialBlockSize, int maxBlockSize) {
        this(initialBlockSize, maxBlockSize, UNLIMITED);
    }

    /**
     * Creates an arena.
     *
     * @param initialBlockSize Size of the first block
     * @param maxBlockSize Upper bound for the size of regular blocks
     * @param memoryLimit Upper bound for the total size of all blocks
     */
    public Arena(int initialBlockSize, int maxBlockSize, long memoryLimit) {
        if (initialBlockSize <= 0) {
            throw new IllegalArgumentException("Initial block size must be positive: " + initialBlockSize);
        }
        if (maxBlockSize < initialBlockSize) {
            throw new IllegalArgumentException("Max block size " + maxBlockSize
                + " is smaller than initial block size " + initialBlockSize);
        }
        if (memoryLimit <= 0) {
            throw new IllegalArgumentException("Memory limit must be positive: " + memoryLimit);
        }
        this.initialBlockSize = initialBlockSize;
        this.maxBlockSize = maxBlockSize;
        this.memoryLimit = memoryLimit;
    }

    /**
     * Copies the given bytes into memory owned by this arena.
     *
     * @param source The bytes to copy
     * @return A slice over the arena-owned copy
     * @throws ArenaExhaustedException If the copy would exceed the memory limit
     */
    public synchronized Slice allocateCopy(Slice source) throws ArenaExhaustedException {
        int size = source.size();
        if (size == 0) {
            return Slice.EMPTY;
        }
        if (size > maxBlockSize) {
            byte[] dedicated = newBlock(size);
            source.copyTo(dedicated, 0);
            allocatedBytes += size;
            return Slice.wrap(dedicated, 0, size);
        }
        if (currentBlock == null || currentBlock.length - currentOffset < size) {
            int nextSize = currentBlock == null
                ? initialBlockSize
                : (int) Math.min(maxBlockSize, currentBlock.length * 2L);
            nextSize = Math.max(nextSize, size);
            if (memoryFootprint + nextSize > memoryLimit) {
                // Fall back to an exact fit before giving up.
                nextSize = size;
            }
            currentBlock = newBlock(nextSize);
            currentOffset = 0;
        }
        source.copyTo(currentBlock, currentOffset);
        Slice copy = Slice.wrap(currentBlock, currentOffset, size);
        currentOffset += size;
        allocatedBytes += size;
        return copy;
    }

    public Slice allocateCopy(byte[] source) throws ArenaExhaustedException {
        return allocateCopy(Slice.wrap(source));
    }

    /**
     * Releases every allocation made so far.
     */
    public synchronized void reset() {
        blocks.clear();
        currentBlock = null;
        currentOffset = 0;
        memoryFootprint = 0;
        allocatedBytes = 0;
    }

    /**
     * Returns the total size of the blocks held by this arena.
     */
    public synchronized long getMemoryFootprint() {
        return memoryFootprint;
    }

    /**
     * Returns the number of bytes handed out since creation or the last reset.
     */
    public synchronized long getAllocatedBytes() {
        return allocatedBytes;
    }

    private byte[] newBlock(int size) throws ArenaExhaustedException {
        if (memoryFootprint + size > memoryLimit) {
            throw new ArenaExhaustedException("Allocating " + size + " bytes would exceed the arena limit of "
                + memoryLimit + " bytes (" + memoryFootprint + " in use)");
        }
        byte[] block = new byte[size];
        blocks.add(block);
        memoryFootprint += size;
        LOG.trace("Arena grew by a block of {} bytes, footprint now {}", size, memoryFootprint);
        return block;
    }
}

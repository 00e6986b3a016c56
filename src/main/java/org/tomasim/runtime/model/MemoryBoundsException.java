package org.tomasim.runtime.model;

/**
 * Thrown when a load or store addresses a word outside the configured memory.
 */
public class MemoryBoundsException extends RuntimeException {

    private final int address;
    private final int memorySize;

    /**
     * @param address The offending effective address.
     * @param memorySize The number of words in memory.
     */
    public MemoryBoundsException(int address, int memorySize) {
        super(String.format("Address %d out of bounds (memory has %d words)", address, memorySize));
        this.address = address;
        this.memorySize = memorySize;
    }

    public int getAddress() {
        return address;
    }

    public int getMemorySize() {
        return memorySize;
    }
}

package org.tomasim.runtime.model;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Flat, word-addressable data memory. Every access is bounds checked; out-of-range
 * addresses are never clamped or wrapped.
 */
public class Memory {

    private final int[] words;

    /**
     * Creates a zero-filled memory.
     * @param size The number of words.
     */
    public Memory(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Memory size must be positive: " + size);
        }
        this.words = new int[size];
    }

    public int size() {
        return words.length;
    }

    /**
     * @param address An effective address.
     * @return true if the address lies inside this memory.
     */
    public boolean contains(int address) {
        return address >= 0 && address < words.length;
    }

    /**
     * Reads a word.
     * @param address The effective address.
     * @return The stored word.
     * @throws MemoryBoundsException if the address is outside the memory.
     */
    public int load(int address) {
        checkBounds(address);
        return words[address];
    }

    /**
     * Writes a word.
     * @param address The effective address.
     * @param value The value, truncated to a word.
     * @throws MemoryBoundsException if the address is outside the memory.
     */
    public void store(int address, int value) {
        checkBounds(address);
        words[address] = Word.wrap(value);
    }

    /**
     * Presets memory contents before a run.
     * @param contents Address to value pairs.
     * @throws MemoryBoundsException if any address is outside the memory.
     */
    public void initialize(Map<Integer, Integer> contents) {
        contents.forEach(this::store);
    }

    /**
     * @return All words that differ from zero, keyed by address in ascending order.
     */
    public SortedMap<Integer, Integer> nonZeroWords() {
        SortedMap<Integer, Integer> result = new TreeMap<>();
        for (int address = 0; address < words.length; address++) {
            if (words[address] != 0) {
                result.put(address, words[address]);
            }
        }
        return result;
    }

    private void checkBounds(int address) {
        if (!contains(address)) {
            throw new MemoryBoundsException(address, words.length);
        }
    }
}

package org.tomasim.runtime.model;

/**
 * Helpers for the simulated machine word.
 * <p>
 * Registers and memory cells hold 16-bit two's complement words. They are carried around
 * in Java {@code int}s that are always kept in the range {@link #MIN_VALUE}..{@link #MAX_VALUE}.
 */
public final class Word {

    /**
     * The number of bits in a machine word.
     */
    public static final int BITS = 16;

    /**
     * The smallest representable word value.
     */
    public static final int MIN_VALUE = Short.MIN_VALUE;

    /**
     * The largest representable word value.
     */
    public static final int MAX_VALUE = Short.MAX_VALUE;

    private Word() {}

    /**
     * Truncates an arbitrary integer to its low {@link #BITS} bits and sign extends the result.
     * @param value The raw value, e.g. the full product of a multiplication.
     * @return The value as the machine would hold it.
     */
    public static int wrap(long value) {
        return (short) value;
    }

    /**
     * Bitwise NAND of two words.
     * @param a The first operand.
     * @param b The second operand.
     * @return {@code ~(a & b)} truncated to a word.
     */
    public static int nand(int a, int b) {
        return wrap(~(a & b));
    }
}

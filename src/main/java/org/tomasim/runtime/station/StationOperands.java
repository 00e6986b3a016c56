package org.tomasim.runtime.station;

import org.tomasim.runtime.model.OperandValue;

/**
 * Source operands of an instruction at dispatch time.
 *
 * @param j The first source (Vj/Qj).
 * @param k The second source (Vk/Qk); ADDI carries its immediate here.
 * @param base The base register of a memory reference; the effective address is pending until it is ready.
 * @param displacement The displacement added to {@code base}.
 */
public record StationOperands(OperandValue j, OperandValue k, OperandValue base, int displacement) {

    public static StationOperands of(OperandValue j, OperandValue k) {
        return new StationOperands(j, k, OperandValue.UNUSED, 0);
    }

    public static StationOperands memory(OperandValue data, OperandValue base, int displacement) {
        return new StationOperands(data, OperandValue.UNUSED, base, displacement);
    }

    public static StationOperands none() {
        return of(OperandValue.UNUSED, OperandValue.UNUSED);
    }

    public boolean isReady() {
        return j.isReady() && k.isReady() && base.isReady();
    }

    /**
     * @return {@code base + displacement}; only meaningful once the base is ready.
     */
    public int effectiveAddress() {
        return OperandValue.valueOf(base) + displacement;
    }
}

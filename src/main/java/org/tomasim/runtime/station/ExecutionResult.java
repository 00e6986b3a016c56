package org.tomasim.runtime.station;

import org.tomasim.runtime.model.MemoryBoundsException;

/**
 * The outcome of executing one instruction, carried over the common data bus into the reorder buffer.
 * Which fields are meaningful depends on the opcode: {@code address} for LOAD/STORE,
 * {@code nextPc} for BEQ/CALL/RET.
 *
 * @param value The broadcast value (ALU result, loaded word, store data, link address).
 * @param address The effective memory address, or -1.
 * @param nextPc The resolved successor PC of a control transfer, or -1.
 * @param fault A memory fault detected during execution, raised only if the instruction commits.
 */
public record ExecutionResult(int value, int address, int nextPc, MemoryBoundsException fault) {

    public static ExecutionResult ofValue(int value) {
        return new ExecutionResult(value, -1, -1, null);
    }

    public static ExecutionResult ofMemory(int address, int value) {
        return new ExecutionResult(value, address, -1, null);
    }

    public static ExecutionResult ofControl(int value, int nextPc) {
        return new ExecutionResult(value, -1, nextPc, null);
    }

    public static ExecutionResult ofFault(int address, MemoryBoundsException fault) {
        return new ExecutionResult(0, address, -1, fault);
    }

    public boolean isFaulted() {
        return fault != null;
    }
}

package org.tomasim.runtime.rob;

import org.tomasim.runtime.isa.Instruction;

/**
 * What a single commit retired.
 *
 * @param sequence The allocation order of the retired entry.
 * @param instruction The retired instruction.
 * @param destination The register written, or -1.
 * @param value The committed value (register value or stored word).
 * @param address The memory address written by a STORE, or -1.
 */
public record CommittedEntry(long sequence, Instruction instruction, int destination, int value, int address) {
}

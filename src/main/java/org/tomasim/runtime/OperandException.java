package org.tomasim.runtime;

/**
 * Thrown when an instruction's operands do not fit its opcode or name a register the
 * machine does not have. The program is expected to be well formed, so this ends the run.
 */
public class OperandException extends RuntimeException {

    private final int instructionIndex;

    /**
     * @param instructionIndex The program-order index of the offending instruction.
     * @param message What is wrong with the operand.
     */
    public OperandException(int instructionIndex, String message) {
        super(String.format("Instruction %d: %s", instructionIndex, message));
        this.instructionIndex = instructionIndex;
    }

    public int getInstructionIndex() {
        return instructionIndex;
    }
}

package org.tomasim.runtime.station;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Operand;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.MemoryBoundsException;
import org.tomasim.runtime.model.OperandValue;
import org.tomasim.runtime.model.Word;

/**
 * Computes the result of an instruction once all of its operands are literal values.
 * Nothing here touches architectural state: a STORE only produces its address and data,
 * and a LOAD that would leave the memory records a fault instead of throwing.
 */
public final class OperationSemantics {

    private OperationSemantics() {}

    /**
     * @param instruction The instruction that finished executing.
     * @param operands Its fully resolved operands.
     * @param memory The data memory, read by LOAD only.
     * @return The result to broadcast.
     */
    public static ExecutionResult compute(Instruction instruction, StationOperands operands, Memory memory) {
        int pc = instruction.index();
        return switch (instruction.opcode()) {
            case ADD, ADDI -> ExecutionResult.ofValue(Word.wrap((long) j(operands) + k(operands)));
            case NAND -> ExecutionResult.ofValue(Word.nand(j(operands), k(operands)));
            case MUL -> ExecutionResult.ofValue(Word.wrap((long) j(operands) * k(operands)));
            case LOAD -> {
                int address = operands.effectiveAddress();
                if (!memory.contains(address)) {
                    yield ExecutionResult.ofFault(address, new MemoryBoundsException(address, memory.size()));
                }
                yield ExecutionResult.ofMemory(address, memory.load(address));
            }
            case STORE -> ExecutionResult.ofMemory(operands.effectiveAddress(), j(operands));
            case BEQ -> {
                boolean taken = j(operands) == k(operands);
                yield ExecutionResult.ofControl(taken ? 1 : 0, taken ? branchTarget(instruction) : pc + 1);
            }
            case CALL -> ExecutionResult.ofControl(pc + 1, branchTarget(instruction));
            case RET -> ExecutionResult.ofControl(j(operands), j(operands));
        };
    }

    /**
     * Target of a BEQ or CALL: the offset is relative to the following instruction.
     * @param instruction A BEQ or CALL.
     * @return {@code PC + 1 + offset}.
     */
    public static int branchTarget(Instruction instruction) {
        Operand last = instruction.operands().get(instruction.operands().size() - 1);
        return instruction.index() + 1 + ((Operand.Immediate) last).value();
    }

    private static int j(StationOperands operands) {
        return OperandValue.valueOf(operands.j());
    }

    private static int k(StationOperands operands) {
        return OperandValue.valueOf(operands.k());
    }
}

package org.tomasim.runtime.station;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.isa.Operand;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.OperandValue;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OperationSemanticsTest {

    private final Memory memory = new Memory(16);

    private static StationOperands ready(int j, int k) {
        return StationOperands.of(new OperandValue.Ready(j), new OperandValue.Ready(k));
    }

    private static Instruction alu(Opcode opcode) {
        return Instruction.of(0, opcode, new Operand.Register(1), new Operand.Register(2), new Operand.Register(3));
    }

    @Test
    void arithmeticWrapsToWords() {
        assertThat(OperationSemantics.compute(alu(Opcode.ADD), ready(32767, 1), memory).value()).isEqualTo(-32768);
        assertThat(OperationSemantics.compute(alu(Opcode.MUL), ready(300, 300), memory).value()).isEqualTo(90000 - 65536);
        assertThat(OperationSemantics.compute(alu(Opcode.NAND), ready(-1, 5), memory).value()).isEqualTo(~5);
    }

    @Test
    void beqTargetsAreRelativeToTheNextInstruction() {
        Instruction beq = Instruction.of(4, Opcode.BEQ, new Operand.Register(1), new Operand.Register(2),
                new Operand.Immediate(-3));

        assertThat(OperationSemantics.compute(beq, ready(7, 7), memory).nextPc()).isEqualTo(2);
        assertThat(OperationSemantics.compute(beq, ready(7, 8), memory).nextPc()).isEqualTo(5);
    }

    @Test
    void callLinksAndRetReturns() {
        Instruction call = Instruction.of(1, Opcode.CALL, new Operand.Immediate(2));
        Instruction ret = Instruction.of(5, Opcode.RET);

        ExecutionResult called = OperationSemantics.compute(call, StationOperands.none(), memory);
        assertThat(called.value()).isEqualTo(2);
        assertThat(called.nextPc()).isEqualTo(4);

        ExecutionResult returned = OperationSemantics.compute(ret, ready(2, 0), memory);
        assertThat(returned.nextPc()).isEqualTo(2);
    }

    @Test
    void storeProducesAddressAndDataOnly() {
        Instruction store = Instruction.of(0, Opcode.STORE, new Operand.Register(1), new Operand.MemoryReference(2, 3));

        ExecutionResult result = OperationSemantics.compute(store,
                StationOperands.memory(new OperandValue.Ready(9), new OperandValue.Ready(4), 2), memory);

        assertThat(result.address()).isEqualTo(6);
        assertThat(result.value()).isEqualTo(9);
        assertThat(memory.load(6)).isZero();
    }
}

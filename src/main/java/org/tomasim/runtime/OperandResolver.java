package org.tomasim.runtime;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.isa.Operand;
import org.tomasim.runtime.model.OperandValue;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.model.RegisterFile;
import org.tomasim.runtime.model.Word;
import org.tomasim.runtime.rob.ReorderBuffer;
import org.tomasim.runtime.rob.RobEntry;
import org.tomasim.runtime.rob.RobState;
import org.tomasim.runtime.station.StationOperands;

import java.util.List;
import java.util.Optional;

/**
 * Turns an instruction's source operands into what a reservation station holds at issue.
 * <p>
 * A register without a producer tag yields its committed value. A tagged register whose
 * producer has already broadcast yields the producer's result from the reorder buffer.
 * Any other tagged register yields the tag, to be filled in by a later broadcast.
 * The base of a memory reference is treated the same way, so an address whose base is
 * still in flight stays pending instead of being computed from a stale value.
 */
public class OperandResolver {

    private final RegisterFile registers;
    private final ReorderBuffer reorderBuffer;

    /**
     * @param registers The register file holding values and tags.
     * @param reorderBuffer The reorder buffer used for forwarding written results.
     */
    public OperandResolver(RegisterFile registers, ReorderBuffer reorderBuffer) {
        this.registers = registers;
        this.reorderBuffer = reorderBuffer;
    }

    /**
     * The dispatch view of one instruction.
     *
     * @param operands The station operands.
     * @param destination The register written at commit, or -1.
     */
    public record Resolution(StationOperands operands, int destination) {}

    /**
     * Checks the operand form and resolves the sources of an instruction.
     * Must be called before the instruction renames its own destination.
     *
     * @param instruction The instruction to issue.
     * @return Its station operands and destination.
     * @throws OperandException if the operands do not match the opcode or name an unknown register.
     */
    public Resolution resolve(Instruction instruction) {
        validateForm(instruction);
        List<Operand> ops = instruction.operands();
        return switch (instruction.opcode()) {
            case ADD, NAND, MUL -> new Resolution(
                    StationOperands.of(register(instruction, ops.get(1)), register(instruction, ops.get(2))),
                    registerIndex(instruction, ops.get(0)));
            case ADDI -> new Resolution(
                    StationOperands.of(register(instruction, ops.get(1)),
                            new OperandValue.Ready(Word.wrap(((Operand.Immediate) ops.get(2)).value()))),
                    registerIndex(instruction, ops.get(0)));
            case LOAD -> {
                Operand.MemoryReference ref = (Operand.MemoryReference) ops.get(1);
                yield new Resolution(
                        StationOperands.memory(OperandValue.UNUSED, value(instruction, ref.baseRegister()), ref.displacement()),
                        registerIndex(instruction, ops.get(0)));
            }
            case STORE -> {
                Operand.MemoryReference ref = (Operand.MemoryReference) ops.get(1);
                yield new Resolution(
                        StationOperands.memory(register(instruction, ops.get(0)),
                                value(instruction, ref.baseRegister()), ref.displacement()),
                        -1);
            }
            case BEQ -> new Resolution(
                    StationOperands.of(register(instruction, ops.get(0)), register(instruction, ops.get(1))),
                    -1);
            case CALL -> new Resolution(StationOperands.none(), Opcode.LINK_REGISTER);
            case RET -> new Resolution(
                    StationOperands.of(value(instruction, Opcode.LINK_REGISTER), OperandValue.UNUSED),
                    -1);
        };
    }

    /**
     * Resolves a single register read the way {@link #resolve(Instruction)} does.
     * @param reg A valid register index.
     * @return The value or the tag to wait for.
     */
    public OperandValue read(int reg) {
        Optional<ProducerTag> tag = registers.tag(reg);
        if (tag.isEmpty()) {
            return new OperandValue.Ready(registers.read(reg));
        }
        Optional<RobEntry> producer = reorderBuffer.lookup(tag.get());
        if (producer.isPresent() && producer.get().getState() == RobState.WRITTEN) {
            return new OperandValue.Ready(producer.get().getResult().value());
        }
        return new OperandValue.Pending(tag.get());
    }

    private OperandValue register(Instruction instruction, Operand operand) {
        return value(instruction, registerIndex(instruction, operand));
    }

    private OperandValue value(Instruction instruction, int reg) {
        checkRegister(instruction, reg);
        return read(reg);
    }

    private int registerIndex(Instruction instruction, Operand operand) {
        int reg = ((Operand.Register) operand).index();
        checkRegister(instruction, reg);
        return reg;
    }

    private void checkRegister(Instruction instruction, int reg) {
        if (!registers.isValid(reg)) {
            throw new OperandException(instruction.index(),
                    String.format("register R%d does not exist (machine has %d registers)", reg, registers.size()));
        }
    }

    private static void validateForm(Instruction instruction) {
        List<Operand.Kind> form = instruction.opcode().form();
        List<Operand> operands = instruction.operands();
        if (operands.size() != form.size()) {
            throw new OperandException(instruction.index(), String.format("%s expects %d operands but has %d",
                    instruction.opcode(), form.size(), operands.size()));
        }
        for (int i = 0; i < form.size(); i++) {
            if (operands.get(i).kind() != form.get(i)) {
                throw new OperandException(instruction.index(), String.format("%s operand %d must be %s but is %s",
                        instruction.opcode(), i + 1, form.get(i), operands.get(i)));
            }
        }
    }
}

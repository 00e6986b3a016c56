package org.tomasim.runtime.isa;

import java.util.List;

import static org.tomasim.runtime.isa.Operand.Kind.IMMEDIATE;
import static org.tomasim.runtime.isa.Operand.Kind.MEMORY;
import static org.tomasim.runtime.isa.Operand.Kind.REGISTER;

/**
 * The instruction set. Each opcode knows the functional unit that executes it and the
 * operand form it is written with.
 */
public enum Opcode {
    ADD(FunctionalUnit.ADD, List.of(REGISTER, REGISTER, REGISTER)),
    ADDI(FunctionalUnit.ADD, List.of(REGISTER, REGISTER, IMMEDIATE)),
    NAND(FunctionalUnit.NAND, List.of(REGISTER, REGISTER, REGISTER)),
    MUL(FunctionalUnit.MUL, List.of(REGISTER, REGISTER, REGISTER)),
    LOAD(FunctionalUnit.LOAD, List.of(REGISTER, MEMORY)),
    STORE(FunctionalUnit.STORE, List.of(REGISTER, MEMORY)),
    BEQ(FunctionalUnit.BEQ, List.of(REGISTER, REGISTER, IMMEDIATE)),
    CALL(FunctionalUnit.CALL_RET, List.of(IMMEDIATE)),
    RET(FunctionalUnit.CALL_RET, List.of());

    /**
     * The register that receives the return address of a CALL and supplies the target of a RET.
     */
    public static final int LINK_REGISTER = 1;

    private final FunctionalUnit unit;
    private final List<Operand.Kind> form;

    Opcode(FunctionalUnit unit, List<Operand.Kind> form) {
        this.unit = unit;
        this.form = form;
    }

    public FunctionalUnit unit() {
        return unit;
    }

    /**
     * @return The operand kinds, in the order they are written.
     */
    public List<Operand.Kind> form() {
        return form;
    }

    /**
     * @return true if the instruction writes a register when it commits.
     */
    public boolean writesRegister() {
        return switch (this) {
            case ADD, ADDI, NAND, MUL, LOAD, CALL -> true;
            case STORE, BEQ, RET -> false;
        };
    }

    /**
     * @return true if the instruction may change the program counter.
     */
    public boolean isControlTransfer() {
        return this == BEQ || this == CALL || this == RET;
    }

    public boolean isMemoryAccess() {
        return this == LOAD || this == STORE;
    }
}

package org.tomasim.runtime.isa;

/**
 * A decoded source or destination operand as written in the program.
 */
public sealed interface Operand permits Operand.Register, Operand.Immediate, Operand.MemoryReference {

    /**
     * The syntactic kinds of operands.
     */
    enum Kind { REGISTER, IMMEDIATE, MEMORY }

    Kind kind();

    /**
     * A register operand, e.g. {@code R3}.
     * @param index The register index.
     */
    record Register(int index) implements Operand {
        @Override
        public Kind kind() {
            return Kind.REGISTER;
        }

        @Override
        public String toString() {
            return "R" + index;
        }
    }

    /**
     * An immediate constant or a branch offset.
     * @param value The signed value.
     */
    record Immediate(int value) implements Operand {
        @Override
        public Kind kind() {
            return Kind.IMMEDIATE;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * A base plus displacement memory reference, e.g. {@code 4(R2)}.
     * @param displacement The signed displacement.
     * @param baseRegister The index of the base register.
     */
    record MemoryReference(int displacement, int baseRegister) implements Operand {
        @Override
        public Kind kind() {
            return Kind.MEMORY;
        }

        @Override
        public String toString() {
            return displacement + "(R" + baseRegister + ")";
        }
    }
}

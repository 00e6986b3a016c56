package org.tomasim.runtime.model;

/**
 * A source operand as a reservation station holds it: either a literal value or the tag of
 * the producer whose broadcast will supply the value.
 */
public sealed interface OperandValue permits OperandValue.Ready, OperandValue.Pending {

    /**
     * Placeholder for operand positions an opcode does not use.
     */
    OperandValue UNUSED = new Ready(0);

    /**
     * @return true if the operand holds a literal value.
     */
    boolean isReady();

    /**
     * A resolved operand.
     * @param value The literal word value.
     */
    record Ready(int value) implements OperandValue {
        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * An operand still waiting on the common data bus.
     * @param tag The producer to wait for.
     */
    record Pending(ProducerTag tag) implements OperandValue {
        @Override
        public boolean isReady() {
            return false;
        }

        @Override
        public String toString() {
            return tag.toString();
        }
    }

    /**
     * Returns the literal value of a ready operand.
     * @param operand The operand to read.
     * @return The value.
     * @throws IllegalStateException if the operand is still pending.
     */
    static int valueOf(OperandValue operand) {
        if (operand instanceof Ready ready) {
            return ready.value();
        }
        throw new IllegalStateException("Operand is still waiting on " + operand);
    }
}

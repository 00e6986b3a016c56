package org.tomasim.runtime.station;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.model.OperandValue;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.rob.RobEntry;

/**
 * One slot of a reservation station pool. Whether a slot holds anything meaningful is
 * expressed by its variant rather than by null fields.
 */
public sealed interface StationSlot permits StationSlot.Idle, StationSlot.Busy, StationSlot.Completed {

    StationSlot IDLE = new Idle();

    /**
     * Returns true if the slot belongs to the given reorder buffer entry.
     * @param entry The entry.
     * @return true if this slot works on behalf of {@code entry}.
     */
    boolean isOwnedBy(RobEntry entry);

    /**
     * A free slot.
     */
    record Idle() implements StationSlot {
        @Override
        public boolean isOwnedBy(RobEntry entry) {
            return false;
        }
    }

    /**
     * A dispatched instruction waiting for operands or counting down its latency.
     *
     * @param owner The reorder buffer entry that will receive the result.
     * @param operands The operands, literal or pending.
     * @param cyclesRemaining Execution cycles still to run.
     */
    record Busy(RobEntry owner, StationOperands operands, int cyclesRemaining) implements StationSlot {

        public Instruction instruction() {
            return owner.getInstruction();
        }

        public boolean started() {
            return owner.getStartExecCycle().isPresent();
        }

        /**
         * Replaces operands waiting on {@code tag} with {@code value}.
         * @return This slot if nothing was waiting on the tag, otherwise an updated copy.
         */
        Busy deliver(ProducerTag tag, int value) {
            OperandValue j = resolve(operands.j(), tag, value);
            OperandValue k = resolve(operands.k(), tag, value);
            OperandValue base = resolve(operands.base(), tag, value);
            if (j == operands.j() && k == operands.k() && base == operands.base()) {
                return this;
            }
            return new Busy(owner, new StationOperands(j, k, base, operands.displacement()), cyclesRemaining);
        }

        Busy countDown() {
            return new Busy(owner, operands, cyclesRemaining - 1);
        }

        private static OperandValue resolve(OperandValue operand, ProducerTag tag, int value) {
            if (operand instanceof OperandValue.Pending pending && pending.tag().equals(tag)) {
                return new OperandValue.Ready(value);
            }
            return operand;
        }

        @Override
        public boolean isOwnedBy(RobEntry entry) {
            return owner == entry;
        }
    }

    /**
     * Execution has finished; the result waits for the next broadcast.
     *
     * @param owner The reorder buffer entry that will receive the result.
     * @param result The computed result.
     */
    record Completed(RobEntry owner, ExecutionResult result) implements StationSlot {
        @Override
        public boolean isOwnedBy(RobEntry entry) {
            return owner == entry;
        }
    }
}

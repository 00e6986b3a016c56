package org.tomasim.runtime.model;

/**
 * Names the in-flight instruction that will produce a value, by the reorder buffer slot it occupies.
 * <p>
 * A slot is only reused after its previous occupant has committed or been squashed, and by then
 * no register or station operand refers to it any more, so the slot index is unique among live producers.
 *
 * @param robSlot The reorder buffer slot of the producing entry.
 */
public record ProducerTag(int robSlot) {

    @Override
    public String toString() {
        return "ROB#" + robSlot;
    }
}

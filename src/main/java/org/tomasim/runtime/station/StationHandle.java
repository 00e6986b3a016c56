package org.tomasim.runtime.station;

import org.tomasim.runtime.rob.RobEntry;

/**
 * Identifies the reservation station slot allocated for an instruction.
 *
 * @param pool The pool holding the slot.
 * @param index The slot index within the pool.
 */
public record StationHandle(ReservationStationPool pool, int index) {

    /**
     * Releases the slot if it still works for {@code owner}. A slot that was already released
     * after its broadcast, and possibly reused, is left alone.
     * @param owner The entry the slot was allocated for.
     * @return true if the slot was released.
     */
    public boolean release(RobEntry owner) {
        return pool.releaseIfOwnedBy(index, owner);
    }

    @Override
    public String toString() {
        return pool.getUnit() + "[" + index + "]";
    }
}

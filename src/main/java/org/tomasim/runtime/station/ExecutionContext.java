package org.tomasim.runtime.station;

import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.rob.RobEntry;

/**
 * What the reservation station pools may see of the machine while executing a cycle.
 */
public interface ExecutionContext {

    /**
     * @return The current cycle.
     */
    long cycle();

    /**
     * @return The data memory LOADs read from.
     */
    Memory memory();

    /**
     * Decides whether a LOAD with a known address may start executing this cycle.
     * @param load The reorder buffer entry of the load.
     * @return true if the memory ordering policy allows the load to run.
     */
    boolean mayStartLoad(RobEntry load);
}

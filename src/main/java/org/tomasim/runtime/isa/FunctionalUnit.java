package org.tomasim.runtime.isa;

import java.util.Locale;

/**
 * The functional-unit classes of the machine. Each class owns one reservation station pool.
 */
public enum FunctionalUnit {
    ADD,
    LOAD,
    STORE,
    NAND,
    MUL,
    BEQ,
    CALL_RET;

    /**
     * @return The key of this unit below {@code tomasim.machine.units} in the configuration.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

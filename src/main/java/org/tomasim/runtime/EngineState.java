package org.tomasim.runtime;

import org.tomasim.runtime.isa.FunctionalUnit;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.RegisterFile;
import org.tomasim.runtime.rob.ReorderBuffer;
import org.tomasim.runtime.rob.RobEntry;
import org.tomasim.runtime.station.ReservationStationPool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * All mutable state of one simulation run. The engine threads a single instance through
 * every step of a cycle; nothing else holds on to it.
 */
public final class EngineState {

    private final RegisterFile registers;
    private final Memory memory;
    private final ReorderBuffer reorderBuffer;
    private final Map<FunctionalUnit, ReservationStationPool> pools;
    private final List<RobEntry> history = new ArrayList<>();
    private int fetchPc = 0;
    private long cycle = 0L;

    /**
     * Builds the initial machine state, applying the configured register and memory presets.
     * @param config The machine configuration.
     */
    public EngineState(MachineConfig config) {
        this.registers = new RegisterFile(config.registerCount(), config.zeroRegister());
        this.memory = new Memory(config.memorySize());
        this.reorderBuffer = new ReorderBuffer(config.robCapacity());
        this.pools = new EnumMap<>(FunctionalUnit.class);
        for (FunctionalUnit unit : FunctionalUnit.values()) {
            UnitShape shape = config.shapeOf(unit);
            pools.put(unit, new ReservationStationPool(unit, shape.slots(), shape.latency()));
        }
        config.initialRegisters().forEach(registers::write);
        memory.initialize(config.initialMemory());
    }

    public RegisterFile registers() {
        return registers;
    }

    public Memory memory() {
        return memory;
    }

    public ReorderBuffer reorderBuffer() {
        return reorderBuffer;
    }

    public ReservationStationPool pool(FunctionalUnit unit) {
        return pools.get(unit);
    }

    public Collection<ReservationStationPool> pools() {
        return Collections.unmodifiableCollection(pools.values());
    }

    /**
     * @return Every reorder buffer entry allocated so far, in issue order.
     */
    public List<RobEntry> history() {
        return Collections.unmodifiableList(history);
    }

    void record(RobEntry entry) {
        history.add(entry);
    }

    public int fetchPc() {
        return fetchPc;
    }

    void redirectFetch(int pc) {
        this.fetchPc = pc;
    }

    public long cycle() {
        return cycle;
    }

    long advanceCycle() {
        return ++cycle;
    }
}

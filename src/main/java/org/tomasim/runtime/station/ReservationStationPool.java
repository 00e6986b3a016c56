package org.tomasim.runtime.station;

import org.tomasim.runtime.isa.FunctionalUnit;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.rob.RobEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The reservation stations of one functional-unit class.
 * <p>
 * A slot stays {@link StationSlot.Busy} while it waits for operands and while it counts
 * down its latency, turns {@link StationSlot.Completed} in the cycle its countdown reaches zero,
 * and goes back to {@link StationSlot.Idle} in the broadcast step that reads its result.
 * Waiting on the bus does not consume latency cycles.
 */
public class ReservationStationPool {

    private static final Logger LOG = LoggerFactory.getLogger(ReservationStationPool.class);

    private final FunctionalUnit unit;
    private final int latency;
    private final StationSlot[] slots;

    /**
     * @param unit The functional-unit class served by this pool.
     * @param slotCount The number of reservation stations.
     * @param latency The execution latency in cycles.
     */
    public ReservationStationPool(FunctionalUnit unit, int slotCount, int latency) {
        if (slotCount <= 0) {
            throw new IllegalArgumentException("Pool " + unit + " needs at least one slot");
        }
        if (latency <= 0) {
            throw new IllegalArgumentException("Pool " + unit + " needs a positive latency");
        }
        this.unit = unit;
        this.latency = latency;
        this.slots = new StationSlot[slotCount];
        for (int i = 0; i < slotCount; i++) {
            slots[i] = StationSlot.IDLE;
        }
    }

    public FunctionalUnit getUnit() {
        return unit;
    }

    public StationSlot slot(int index) {
        return slots[index];
    }

    public boolean hasFreeSlot() {
        return freeIndex() >= 0;
    }

    /**
     * @return The number of slots that are not idle.
     */
    public int busyCount() {
        int busy = 0;
        for (StationSlot slot : slots) {
            if (!(slot instanceof StationSlot.Idle)) {
                busy++;
            }
        }
        return busy;
    }

    /**
     * Dispatches an instruction into the first free slot.
     *
     * @param owner The reorder buffer entry allocated for the instruction.
     * @param operands Its operands as resolved at issue.
     * @return The slot handle, or empty without any state change if every slot is busy.
     */
    public Optional<StationHandle> allocate(RobEntry owner, StationOperands operands) {
        if (owner.getInstruction().opcode().unit() != unit) {
            throw new IllegalArgumentException(owner.getInstruction().opcode() + " cannot run on " + unit);
        }
        int index = freeIndex();
        if (index < 0) {
            return Optional.empty();
        }
        slots[index] = new StationSlot.Busy(owner, operands, latency);
        StationHandle handle = new StationHandle(this, index);
        owner.attachStation(handle);
        return Optional.of(handle);
    }

    /**
     * Advances every slot that is ready to run by one cycle.
     * <p>
     * A slot is ready once all of its operands are literal values and, for a LOAD, once the
     * memory ordering policy lets it go. The first counted cycle stamps the start of execution;
     * the cycle that reaches zero stamps its end and computes the result.
     *
     * @param context The machine state visible to execution.
     */
    public void tick(ExecutionContext context) {
        for (int i = 0; i < slots.length; i++) {
            if (!(slots[i] instanceof StationSlot.Busy busy) || !isReadyToRun(busy, context)) {
                continue;
            }
            RobEntry owner = busy.owner();
            if (!busy.started()) {
                owner.markExecutionStarted(context.cycle());
            }
            StationSlot.Busy next = busy.countDown();
            if (next.cyclesRemaining() > 0) {
                slots[i] = next;
                continue;
            }
            owner.markExecutionFinished(context.cycle());
            ExecutionResult result = OperationSemantics.compute(busy.instruction(), busy.operands(), context.memory());
            slots[i] = new StationSlot.Completed(owner, result);
            LOG.debug("Cycle {}: {}[{}] finished {} -> {}", context.cycle(), unit, i,
                    busy.instruction().sourceText(), result);
        }
    }

    /**
     * @return The slots whose results wait for the common data bus.
     */
    public List<CompletedResult> completed() {
        List<CompletedResult> result = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] instanceof StationSlot.Completed completed) {
                result.add(new CompletedResult(new StationHandle(this, i), completed.owner(), completed.result()));
            }
        }
        return result;
    }

    /**
     * Delivers a broadcast value to every operand in this pool waiting on {@code tag}.
     * @param tag The producer.
     * @param value The produced value.
     */
    public void deliver(ProducerTag tag, int value) {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] instanceof StationSlot.Busy busy) {
                slots[i] = busy.deliver(tag, value);
            }
        }
    }

    /**
     * Frees a slot if it still belongs to {@code owner}.
     * @param index The slot index.
     * @param owner The entry the slot was allocated for.
     * @return true if the slot was freed.
     */
    public boolean releaseIfOwnedBy(int index, RobEntry owner) {
        if (!slots[index].isOwnedBy(owner)) {
            return false;
        }
        slots[index] = StationSlot.IDLE;
        return true;
    }

    private boolean isReadyToRun(StationSlot.Busy busy, ExecutionContext context) {
        if (!busy.operands().isReady()) {
            return false;
        }
        return busy.instruction().opcode() != Opcode.LOAD || busy.started() || context.mayStartLoad(busy.owner());
    }

    private int freeIndex() {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] instanceof StationSlot.Idle) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return String.format("%s(slots=%d, latency=%d, busy=%d)", unit, slots.length, latency, busyCount());
    }
}

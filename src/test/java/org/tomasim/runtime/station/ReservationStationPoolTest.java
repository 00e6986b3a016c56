package org.tomasim.runtime.station;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tomasim.runtime.isa.FunctionalUnit;
import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.isa.Operand;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.OperandValue;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.rob.ReorderBuffer;
import org.tomasim.runtime.rob.RobEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReservationStationPoolTest {

    private ReorderBuffer rob;
    private Memory memory;

    @BeforeEach
    void setUp() {
        rob = new ReorderBuffer(8);
        memory = new Memory(64);
    }

    private RobEntry entry(Opcode opcode, Operand... operands) {
        Instruction instruction = Instruction.of(rob.size(), opcode, operands);
        return rob.allocate(instruction, -1, instruction.index() + 1).orElseThrow();
    }

    private RobEntry add() {
        return entry(Opcode.ADD, new Operand.Register(1), new Operand.Register(2), new Operand.Register(3));
    }

    private ExecutionContext context(long cycle, boolean loadsMayStart) {
        return new ExecutionContext() {
            @Override
            public long cycle() {
                return cycle;
            }

            @Override
            public Memory memory() {
                return memory;
            }

            @Override
            public boolean mayStartLoad(RobEntry load) {
                return loadsMayStart;
            }
        };
    }

    @Test
    void countsDownLatencyAndStampsStartAndFinish() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.ADD, 2, 3);
        RobEntry owner = add();
        pool.allocate(owner, StationOperands.of(new OperandValue.Ready(4), new OperandValue.Ready(5)));

        pool.tick(context(2, true));
        pool.tick(context(3, true));
        assertThat(pool.completed()).isEmpty();
        pool.tick(context(4, true));

        List<CompletedResult> completed = pool.completed();
        assertThat(completed).hasSize(1);
        assertThat(completed.get(0).owner()).isSameAs(owner);
        assertThat(completed.get(0).result().value()).isEqualTo(9);
        assertThat(owner.getStartExecCycle()).hasValue(2);
        assertThat(owner.getFinishExecCycle()).hasValue(4);
    }

    @Test
    void waitsForPendingOperandUntilDelivered() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.ADD, 1, 1);
        RobEntry owner = add();
        ProducerTag producer = new ProducerTag(5);
        pool.allocate(owner, StationOperands.of(new OperandValue.Pending(producer), new OperandValue.Ready(1)));

        pool.tick(context(2, true));
        assertThat(owner.getStartExecCycle()).isEmpty();

        pool.deliver(new ProducerTag(6), 100);
        pool.tick(context(3, true));
        assertThat(owner.getStartExecCycle()).isEmpty();

        pool.deliver(producer, 41);
        pool.tick(context(4, true));
        assertThat(owner.getStartExecCycle()).hasValue(4);
        assertThat(pool.completed()).singleElement()
                .satisfies(result -> assertThat(result.result().value()).isEqualTo(42));
    }

    @Test
    void fullPoolRefusesAllocationWithoutSideEffects() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.ADD, 1, 2);
        RobEntry first = add();
        RobEntry second = add();
        StationOperands operands = StationOperands.of(new OperandValue.Ready(1), new OperandValue.Ready(1));

        assertThat(pool.allocate(first, operands)).isPresent();
        assertThat(pool.allocate(second, operands)).isEmpty();
        assertThat(second.getStation()).isNull();
        assertThat(pool.busyCount()).isEqualTo(1);
    }

    @Test
    void slotIsBusyUntilReleasedAfterCompletion() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.ADD, 1, 1);
        RobEntry owner = add();
        StationHandle handle = pool.allocate(owner,
                StationOperands.of(new OperandValue.Ready(1), new OperandValue.Ready(1))).orElseThrow();

        pool.tick(context(2, true));
        assertThat(pool.hasFreeSlot()).isFalse();

        assertThat(handle.release(owner)).isTrue();
        assertThat(pool.hasFreeSlot()).isTrue();
        assertThat(pool.slot(0)).isInstanceOf(StationSlot.Idle.class);
    }

    @Test
    void releaseByStaleOwnerIsIgnored() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.ADD, 1, 1);
        RobEntry stale = add();
        RobEntry current = add();
        StationOperands operands = StationOperands.of(new OperandValue.Ready(1), new OperandValue.Ready(1));
        StationHandle staleHandle = pool.allocate(stale, operands).orElseThrow();
        staleHandle.release(stale);
        pool.allocate(current, operands);

        assertThat(staleHandle.release(stale)).isFalse();
        assertThat(pool.slot(0).isOwnedBy(current)).isTrue();
    }

    @Test
    void loadWaitsForOrderingPermissionOnlyBeforeItStarts() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.LOAD, 1, 2);
        memory.store(3, 17);
        RobEntry load = entry(Opcode.LOAD, new Operand.Register(1), new Operand.MemoryReference(3, 0));
        pool.allocate(load, StationOperands.memory(OperandValue.UNUSED, new OperandValue.Ready(0), 3));

        pool.tick(context(2, false));
        assertThat(load.getStartExecCycle()).isEmpty();

        pool.tick(context(3, true));
        pool.tick(context(4, false));

        assertThat(load.getStartExecCycle()).hasValue(3);
        assertThat(pool.completed()).singleElement()
                .satisfies(result -> assertThat(result.result().value()).isEqualTo(17));
    }

    @Test
    void loadOutsideMemoryRecordsAFault() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.LOAD, 1, 1);
        RobEntry load = entry(Opcode.LOAD, new Operand.Register(1), new Operand.MemoryReference(100, 0));
        pool.allocate(load, StationOperands.memory(OperandValue.UNUSED, new OperandValue.Ready(0), 100));

        pool.tick(context(2, true));

        ExecutionResult result = pool.completed().get(0).result();
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.fault().getAddress()).isEqualTo(100);
    }

    @Test
    void rejectsInstructionsOfAnotherUnit() {
        ReservationStationPool pool = new ReservationStationPool(FunctionalUnit.MUL, 1, 8);

        assertThatThrownBy(() -> pool.allocate(add(), StationOperands.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

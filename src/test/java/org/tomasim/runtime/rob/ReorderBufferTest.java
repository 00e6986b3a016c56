package org.tomasim.runtime.rob;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.isa.Operand;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.MemoryBoundsException;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.model.RegisterFile;
import org.tomasim.runtime.station.ExecutionResult;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReorderBufferTest {

    private RegisterFile registers;
    private Memory memory;

    @BeforeEach
    void setUp() {
        registers = new RegisterFile(8, true);
        memory = new Memory(64);
    }

    private static Instruction addi(int index, int dest, int value) {
        return Instruction.of(index, Opcode.ADDI, new Operand.Register(dest), new Operand.Register(0), new Operand.Immediate(value));
    }

    private static Instruction store(int index, int src, int displacement) {
        return Instruction.of(index, Opcode.STORE, new Operand.Register(src), new Operand.MemoryReference(displacement, 0));
    }

    private static Instruction load(int index, int dest, int displacement) {
        return Instruction.of(index, Opcode.LOAD, new Operand.Register(dest), new Operand.MemoryReference(displacement, 0));
    }

    private RobEntry allocate(ReorderBuffer rob, Instruction instruction, int destination) {
        RobEntry entry = rob.allocate(instruction, destination, instruction.index() + 1).orElseThrow();
        if (destination >= 0) {
            registers.setTag(destination, entry.tag());
        }
        return entry;
    }

    @Test
    void allocationStopsAtCapacity() {
        ReorderBuffer rob = new ReorderBuffer(2);

        assertThat(rob.allocate(addi(0, 1, 1), 1, 1)).isPresent();
        assertThat(rob.allocate(addi(1, 2, 1), 2, 2)).isPresent();
        assertThat(rob.hasFreeSlot()).isFalse();
        assertThat(rob.allocate(addi(2, 3, 1), 3, 3)).isEmpty();
        assertThat(rob.size()).isEqualTo(2);
    }

    @Test
    void commitsInAllocationOrderOnly() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry first = allocate(rob, addi(0, 1, 5), 1);
        RobEntry second = allocate(rob, addi(1, 2, 6), 2);

        rob.markWritten(second, ExecutionResult.ofValue(6), 3);
        assertThat(rob.commitReady(registers, memory, 4)).isEmpty();
        assertThat(registers.read(2)).isZero();

        rob.markWritten(first, ExecutionResult.ofValue(5), 4);
        Optional<CommittedEntry> committed = rob.commitReady(registers, memory, 5);
        assertThat(committed).isPresent();
        assertThat(committed.get().sequence()).isEqualTo(first.getSequence());
        assertThat(rob.commitReady(registers, memory, 5).map(CommittedEntry::sequence)).contains(second.getSequence());

        assertThat(registers.read(1)).isEqualTo(5);
        assertThat(registers.read(2)).isEqualTo(6);
        assertThat(registers.tag(1)).isEmpty();
        assertThat(registers.tag(2)).isEmpty();
        assertThat(first.getCommitCycle()).hasValue(5);
        assertThat(rob.isEmpty()).isTrue();
    }

    @Test
    void commitDoesNotClearYoungerTag() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry older = allocate(rob, addi(0, 3, 1), 3);
        RobEntry younger = allocate(rob, addi(1, 3, 2), 3);

        rob.markWritten(older, ExecutionResult.ofValue(1), 3);
        rob.commitReady(registers, memory, 4);

        assertThat(registers.read(3)).isEqualTo(1);
        assertThat(registers.tag(3)).contains(younger.tag());
    }

    @Test
    void storeWritesMemoryAtCommit() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry entry = allocate(rob, store(0, 2, 7), -1);

        rob.markWritten(entry, ExecutionResult.ofMemory(7, 99), 5);
        assertThat(memory.load(7)).isZero();

        CommittedEntry committed = rob.commitReady(registers, memory, 6).orElseThrow();
        assertThat(committed.address()).isEqualTo(7);
        assertThat(memory.load(7)).isEqualTo(99);
    }

    @Test
    void faultIsRaisedAtCommit() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry entry = allocate(rob, load(0, 2, 500), 2);
        MemoryBoundsException fault = new MemoryBoundsException(500, 64);

        rob.markWritten(entry, ExecutionResult.ofFault(500, fault), 7);

        assertThatThrownBy(() -> rob.commitReady(registers, memory, 8)).isSameAs(fault);
    }

    @Test
    void storeOutOfBoundsIsRaisedAtCommit() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry entry = allocate(rob, store(0, 2, 100), -1);

        rob.markWritten(entry, ExecutionResult.ofMemory(100, 1), 7);

        assertThatThrownBy(() -> rob.commitReady(registers, memory, 8)).isInstanceOf(MemoryBoundsException.class);
    }

    @Test
    void squashRepairsTagsToSurvivingProducers() {
        ReorderBuffer rob = new ReorderBuffer(6);
        RobEntry producer = allocate(rob, addi(0, 1, 1), 1);
        RobEntry branch = allocate(rob, Instruction.of(1, Opcode.BEQ, new Operand.Register(0),
                new Operand.Register(0), new Operand.Immediate(3)), -1);
        RobEntry wrongPath = allocate(rob, addi(2, 1, 9), 1);
        RobEntry otherWrongPath = allocate(rob, addi(3, 4, 9), 4);

        List<RobEntry> squashed = rob.squashYoungerThan(branch, registers, 5);

        assertThat(squashed).containsExactly(wrongPath, otherWrongPath);
        assertThat(wrongPath.getState()).isEqualTo(RobState.SQUASHED);
        assertThat(wrongPath.getSquashCycle()).hasValue(5);
        assertThat(registers.tag(1)).contains(producer.tag());
        assertThat(registers.tag(4)).isEmpty();
        assertThat(rob.entries()).containsExactly(producer, branch);
    }

    @Test
    void squashOfYoungestEntryIsANoOp() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry only = allocate(rob, addi(0, 1, 1), 1);

        assertThat(rob.squashYoungerThan(only, registers, 2)).isEmpty();
        assertThat(rob.size()).isEqualTo(1);
    }

    @Test
    void slotsAreReusedAfterWrapAround() {
        ReorderBuffer rob = new ReorderBuffer(2);
        RobEntry a = allocate(rob, addi(0, 1, 1), 1);
        rob.markWritten(a, ExecutionResult.ofValue(1), 2);
        rob.commitReady(registers, memory, 3);
        RobEntry b = allocate(rob, addi(1, 2, 2), 2);
        RobEntry c = allocate(rob, addi(2, 3, 3), 3);

        assertThat(c.getSlot()).isEqualTo(a.getSlot());
        assertThat(rob.lookup(new ProducerTag(c.getSlot()))).contains(c);
        assertThat(rob.head()).contains(b);
    }

    @Test
    void olderUncommittedStoreIsDetected() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry firstLoad = allocate(rob, load(0, 1, 0), 1);
        RobEntry storeEntry = allocate(rob, store(1, 2, 0), -1);
        RobEntry secondLoad = allocate(rob, load(2, 3, 0), 3);

        assertThat(rob.hasOlderUncommittedStore(firstLoad)).isFalse();
        assertThat(rob.hasOlderUncommittedStore(secondLoad)).isTrue();
        assertThat(storeEntry.isLive()).isTrue();
    }

    @Test
    void writingASquashedEntryIsRejected() {
        ReorderBuffer rob = new ReorderBuffer(4);
        RobEntry head = allocate(rob, addi(0, 1, 1), 1);
        RobEntry victim = allocate(rob, addi(1, 2, 1), 2);
        rob.squashYoungerThan(head, registers, 3);

        assertThatThrownBy(() -> rob.markWritten(victim, ExecutionResult.ofValue(1), 4))
                .isInstanceOf(IllegalStateException.class);
    }
}

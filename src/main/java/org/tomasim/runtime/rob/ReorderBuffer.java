package org.tomasim.runtime.rob;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.model.RegisterFile;
import org.tomasim.runtime.station.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity circular FIFO of in-flight instructions.
 * <p>
 * Entries are allocated at the tail in program (fetch) order and retire from the head only,
 * so commit order always equals allocation order even though results are written out of order.
 * The buffer owns the architectural side effects: register and memory writes happen in
 * {@link #commitReady(RegisterFile, Memory, long)} and nowhere else.
 */
public class ReorderBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(ReorderBuffer.class);

    private final RobEntry[] slots;
    private int head = 0;
    private int count = 0;
    private long nextSequence = 0L;

    /**
     * @param capacity The maximum number of in-flight instructions.
     */
    public ReorderBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("ROB capacity must be positive: " + capacity);
        }
        this.slots = new RobEntry[capacity];
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean hasFreeSlot() {
        return count < slots.length;
    }

    /**
     * Allocates the tail entry for a newly issued instruction.
     *
     * @param instruction The instruction being issued.
     * @param destination The register it writes at commit, or -1.
     * @param predictedNextPc The PC fetch continues at after this instruction.
     * @return The new entry, or empty if the buffer is full (the caller must stall).
     */
    public Optional<RobEntry> allocate(Instruction instruction, int destination, int predictedNextPc) {
        if (!hasFreeSlot()) {
            return Optional.empty();
        }
        int slot = physical(count);
        RobEntry entry = new RobEntry(slot, nextSequence++, instruction, destination, predictedNextPc);
        slots[slot] = entry;
        count++;
        return Optional.of(entry);
    }

    /**
     * Looks up the live entry a producer tag refers to.
     * @param tag The tag.
     * @return The entry, or empty if the slot is free.
     */
    public Optional<RobEntry> lookup(ProducerTag tag) {
        return Optional.ofNullable(slots[tag.robSlot()]);
    }

    public Optional<RobEntry> head() {
        return isEmpty() ? Optional.empty() : Optional.of(slots[head]);
    }

    /**
     * Records a broadcast result.
     * @param entry The producing entry.
     * @param result Its result.
     * @param cycle The broadcast cycle.
     */
    public void markWritten(RobEntry entry, ExecutionResult result, long cycle) {
        if (!entry.isLive()) {
            throw new IllegalStateException("Cannot write result of " + entry);
        }
        entry.markWritten(result, cycle);
    }

    /**
     * Retires the head entry if its result has been written.
     * <p>
     * ALU, LOAD and CALL entries write their destination register and release the register's
     * tag if it still names them; STOREs write memory here, so a store on a wrong path never
     * becomes visible. A memory fault recorded during execution is raised now.
     *
     * @param registers The register file.
     * @param memory The data memory.
     * @param cycle The current cycle.
     * @return The retired entry, or empty if the head is not ready (younger written entries wait).
     * @throws org.tomasim.runtime.model.MemoryBoundsException if the head accesses memory out of bounds.
     */
    public Optional<CommittedEntry> commitReady(RegisterFile registers, Memory memory, long cycle) {
        if (isEmpty()) {
            return Optional.empty();
        }
        RobEntry entry = slots[head];
        if (entry.getState() != RobState.WRITTEN) {
            return Optional.empty();
        }
        ExecutionResult result = entry.getResult();
        if (result.isFaulted()) {
            throw result.fault();
        }

        int address = -1;
        if (entry.getInstruction().opcode() == Opcode.STORE) {
            memory.store(result.address(), result.value());
            address = result.address();
        }
        if (entry.hasDestination()) {
            registers.write(entry.getDestination(), result.value());
            registers.clearTagIfOwnedBy(entry.getDestination(), entry.tag());
        }

        entry.markCommitted(cycle);
        slots[head] = null;
        head = physical(1);
        count--;
        return Optional.of(new CommittedEntry(entry.getSequence(), entry.getInstruction(),
                entry.getDestination(), result.value(), address));
    }

    /**
     * Squashes every entry younger than the given one.
     * @param entry The surviving entry, typically a mispredicted branch.
     * @param registers The register file whose tags are repaired.
     * @param cycle The current cycle.
     * @return The squashed entries, oldest first.
     */
    public List<RobEntry> squashYoungerThan(RobEntry entry, RegisterFile registers, long cycle) {
        int position = positionOf(entry);
        if (position + 1 >= count) {
            return List.of();
        }
        return squashFrom(slots[physical(position + 1)].getSlot(), registers, cycle);
    }

    /**
     * Invalidates the entry in {@code slot} and every entry allocated after it.
     * <p>
     * Their reservation station slots are released. A register whose tag names a squashed entry
     * is re-pointed at the youngest surviving producer of that register, or cleared if there is none,
     * so older in-flight producers are never forgotten. Entries older than {@code slot} are untouched.
     *
     * @param slot The ROB slot of the oldest entry to squash.
     * @param registers The register file whose tags are repaired.
     * @param cycle The current cycle.
     * @return The squashed entries, oldest first.
     */
    public List<RobEntry> squashFrom(int slot, RegisterFile registers, long cycle) {
        RobEntry first = slots[slot];
        if (first == null) {
            throw new IllegalArgumentException("ROB slot " + slot + " is not in use");
        }
        int position = positionOf(first);
        List<RobEntry> squashed = new ArrayList<>(count - position);
        for (int i = position; i < count; i++) {
            int physical = physical(i);
            RobEntry victim = slots[physical];
            victim.markSquashed(cycle);
            if (victim.getStation() != null) {
                victim.getStation().release(victim);
            }
            slots[physical] = null;
            squashed.add(victim);
        }
        count = position;

        for (RobEntry victim : squashed) {
            if (victim.hasDestination()) {
                repairTag(victim.getDestination(), victim.tag(), registers);
            }
        }
        LOG.debug("Squashed {} entries from ROB#{}: {}", squashed.size(), slot, squashed);
        return squashed;
    }

    /**
     * @param load A live entry.
     * @return true if a STORE allocated before {@code load} has not committed yet.
     */
    public boolean hasOlderUncommittedStore(RobEntry load) {
        int position = positionOf(load);
        for (int i = 0; i < position; i++) {
            if (slots[physical(i)].getInstruction().opcode() == Opcode.STORE) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The live entries from head (oldest) to tail (youngest).
     */
    public List<RobEntry> entries() {
        List<RobEntry> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(slots[physical(i)]);
        }
        return result;
    }

    private void repairTag(int register, ProducerTag squashedTag, RegisterFile registers) {
        if (!registers.tag(register).map(squashedTag::equals).orElse(false)) {
            return;
        }
        for (int i = count - 1; i >= 0; i--) {
            RobEntry survivor = slots[physical(i)];
            if (survivor.getDestination() == register) {
                registers.setTag(register, survivor.tag());
                return;
            }
        }
        registers.clearTag(register);
    }

    private int positionOf(RobEntry entry) {
        int position = Math.floorMod(entry.getSlot() - head, slots.length);
        if (position >= count || slots[entry.getSlot()] != entry) {
            throw new IllegalArgumentException(entry + " is not live in the reorder buffer");
        }
        return position;
    }

    private int physical(int position) {
        return (head + position) % slots.length;
    }
}

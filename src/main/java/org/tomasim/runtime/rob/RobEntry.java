package org.tomasim.runtime.rob;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.model.ProducerTag;
import org.tomasim.runtime.station.ExecutionResult;
import org.tomasim.runtime.station.StationHandle;

import java.util.OptionalLong;

/**
 * One in-flight instruction in the reorder buffer, plus the cycle stamps of its journey
 * through the pipeline. A new entry is created for every issue, so entries of a finished
 * run form the dynamic instruction trace.
 */
public final class RobEntry {

    private static final long NONE = 0L;

    private final int slot;
    private final long sequence;
    private final Instruction instruction;
    private final int destination;
    private final int predictedNextPc;

    private RobState state = RobState.ISSUED;
    private ExecutionResult result;
    private StationHandle station;

    private long issueCycle = NONE;
    private long startExecCycle = NONE;
    private long finishExecCycle = NONE;
    private long writeResultCycle = NONE;
    private long commitCycle = NONE;
    private long squashCycle = NONE;

    RobEntry(int slot, long sequence, Instruction instruction, int destination, int predictedNextPc) {
        this.slot = slot;
        this.sequence = sequence;
        this.instruction = instruction;
        this.destination = destination;
        this.predictedNextPc = predictedNextPc;
    }

    public int getSlot() {
        return slot;
    }

    /**
     * @return The allocation order of this entry; strictly increasing over a run.
     */
    public long getSequence() {
        return sequence;
    }

    public Instruction getInstruction() {
        return instruction;
    }

    /**
     * @return The register written at commit, or -1 if the instruction writes none.
     */
    public int getDestination() {
        return destination;
    }

    public boolean hasDestination() {
        return destination >= 0;
    }

    /**
     * @return The PC fetch continued at after this instruction was issued.
     */
    public int getPredictedNextPc() {
        return predictedNextPc;
    }

    public ProducerTag tag() {
        return new ProducerTag(slot);
    }

    public RobState getState() {
        return state;
    }

    public boolean isLive() {
        return state != RobState.COMMITTED && state != RobState.SQUASHED;
    }

    public ExecutionResult getResult() {
        return result;
    }

    public StationHandle getStation() {
        return station;
    }

    public void attachStation(StationHandle station) {
        this.station = station;
    }

    // --- state transitions, stamped with the cycle they happen in ---

    public void markIssued(long cycle) {
        this.issueCycle = cycle;
    }

    public void markExecutionStarted(long cycle) {
        this.state = RobState.EXECUTING;
        this.startExecCycle = cycle;
    }

    public void markExecutionFinished(long cycle) {
        this.finishExecCycle = cycle;
    }

    void markWritten(ExecutionResult result, long cycle) {
        this.result = result;
        this.state = RobState.WRITTEN;
        this.writeResultCycle = cycle;
    }

    void markCommitted(long cycle) {
        this.state = RobState.COMMITTED;
        this.commitCycle = cycle;
    }

    void markSquashed(long cycle) {
        this.state = RobState.SQUASHED;
        this.squashCycle = cycle;
    }

    public OptionalLong getIssueCycle() {
        return stamp(issueCycle);
    }

    public OptionalLong getStartExecCycle() {
        return stamp(startExecCycle);
    }

    public OptionalLong getFinishExecCycle() {
        return stamp(finishExecCycle);
    }

    public OptionalLong getWriteResultCycle() {
        return stamp(writeResultCycle);
    }

    public OptionalLong getCommitCycle() {
        return stamp(commitCycle);
    }

    public OptionalLong getSquashCycle() {
        return stamp(squashCycle);
    }

    private static OptionalLong stamp(long cycle) {
        return cycle == NONE ? OptionalLong.empty() : OptionalLong.of(cycle);
    }

    @Override
    public String toString() {
        return String.format("ROB#%d[seq=%d %s %s]", slot, sequence, instruction.sourceText(), state);
    }
}

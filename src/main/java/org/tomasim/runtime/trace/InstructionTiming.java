package org.tomasim.runtime.trace;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.rob.RobEntry;
import org.tomasim.runtime.rob.RobState;

import java.util.OptionalLong;

/**
 * Cycle stamps of one dynamic instruction, i.e. one issue of a static instruction.
 * An instruction that is fetched again, for example in a loop, gets one timing per issue.
 *
 * @param sequence The allocation order of the issue.
 * @param instruction The static instruction.
 * @param issue The cycle it entered a reservation station and the reorder buffer.
 * @param startExec The first cycle it counted down its latency.
 * @param finishExec The cycle its latency ran out.
 * @param writeResult The cycle its result was broadcast.
 * @param commit The cycle it retired.
 * @param squashed True if it was discarded on a mispredicted path.
 */
public record InstructionTiming(
        long sequence,
        Instruction instruction,
        OptionalLong issue,
        OptionalLong startExec,
        OptionalLong finishExec,
        OptionalLong writeResult,
        OptionalLong commit,
        boolean squashed) {

    /**
     * Takes a snapshot of an entry's stamps.
     * @param entry A reorder buffer entry.
     * @return Its timing.
     */
    public static InstructionTiming of(RobEntry entry) {
        return new InstructionTiming(
                entry.getSequence(),
                entry.getInstruction(),
                entry.getIssueCycle(),
                entry.getStartExecCycle(),
                entry.getFinishExecCycle(),
                entry.getWriteResultCycle(),
                entry.getCommitCycle(),
                entry.getState() == RobState.SQUASHED);
    }

    public boolean committed() {
        return commit.isPresent();
    }
}

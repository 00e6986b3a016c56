package org.tomasim.runtime;

/**
 * Thrown when a run halts on a fatal condition. Carries the cycle in which the condition
 * was detected and the program index of the instruction that caused it (-1 if none did).
 */
public class SimulationAbortedException extends RuntimeException {

    private final long cycle;
    private final int instructionIndex;

    public SimulationAbortedException(long cycle, int instructionIndex, String message, Throwable cause) {
        super(String.format("Simulation aborted in cycle %d%s: %s", cycle,
                instructionIndex >= 0 ? " at instruction " + instructionIndex : "", message), cause);
        this.cycle = cycle;
        this.instructionIndex = instructionIndex;
    }

    public SimulationAbortedException(long cycle, int instructionIndex, String message) {
        this(cycle, instructionIndex, message, null);
    }

    public long getCycle() {
        return cycle;
    }

    /**
     * @return The program index of the offending instruction, or -1.
     */
    public int getInstructionIndex() {
        return instructionIndex;
    }
}

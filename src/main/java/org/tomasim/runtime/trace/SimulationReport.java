package org.tomasim.runtime.trace;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The outcome of a finished run, handed to the reporting layer.
 *
 * @param timings One entry per issued instruction, in issue order, squashed ones included.
 * @param totalCycles The number of simulated cycles.
 * @param registers The final register values.
 * @param memory The final non-zero memory words, by address.
 */
public record SimulationReport(
        List<InstructionTiming> timings,
        long totalCycles,
        int[] registers,
        SortedMap<Integer, Integer> memory) {

    public SimulationReport {
        timings = List.copyOf(timings);
        registers = registers.clone();
        memory = Collections.unmodifiableSortedMap(new TreeMap<>(memory));
    }

    /**
     * @return The number of instructions that committed.
     */
    public long committedInstructions() {
        return timings.stream().filter(InstructionTiming::committed).count();
    }

    public long squashedInstructions() {
        return timings.stream().filter(InstructionTiming::squashed).count();
    }

    /**
     * @return Committed instructions per cycle, or 0 for an empty run.
     */
    public double ipc() {
        return totalCycles == 0 ? 0.0 : (double) committedInstructions() / totalCycles;
    }

    /**
     * @return The timings of committed instructions in commit order.
     */
    public List<InstructionTiming> committedTimings() {
        return timings.stream().filter(InstructionTiming::committed).toList();
    }

    @Override
    public int[] registers() {
        return registers.clone();
    }

    public int register(int reg) {
        return registers[reg];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimulationReport other)) {
            return false;
        }
        return totalCycles == other.totalCycles
                && timings.equals(other.timings)
                && Arrays.equals(registers, other.registers)
                && memory.equals(other.memory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timings, totalCycles, Arrays.hashCode(registers), memory);
    }

    @Override
    public String toString() {
        return "SimulationReport[totalCycles=" + totalCycles + ", timings=" + timings
                + ", registers=" + Arrays.toString(registers) + ", memory=" + memory + "]";
    }
}

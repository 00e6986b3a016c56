package org.tomasim.cli.rendering;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tomasim.assembler.ProgramParser;
import org.tomasim.runtime.MachineConfig;
import org.tomasim.runtime.SchedulingEngine;
import org.tomasim.runtime.trace.SimulationReport;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TimingTableRendererTest {

    static SimulationReport mispredictedBranch() {
        return new SchedulingEngine(MachineConfig.defaults(), new ProgramParser().parse(List.of(
                "ADDI R1, R0, 1",
                "ADDI R2, R0, 1",
                "BEQ R1, R2, 2",
                "ADDI R3, R0, 7",
                "ADDI R4, R0, 9",
                "ADDI R5, R0, 3"), "branch.s")).run();
    }

    @Test
    void rendersOneRowPerIssueAndTheTotals() {
        StringWriter buffer = new StringWriter();

        new TimingTableRenderer().render(mispredictedBranch(), new PrintWriter(buffer, true));

        List<String> lines = buffer.toString().lines().toList();
        assertThat(lines.get(0)).contains("PC", "Instruction", "Issue", "Commit", "Status");
        assertThat(lines.subList(2, 8)).hasSize(6);
        assertThat(lines.get(2)).contains("ADDI R1, R0, 1").endsWith("committed");
        assertThat(lines.get(5)).contains("ADDI R3, R0, 7").contains("-").endsWith("squashed");
        assertThat(buffer.toString())
                .contains("Total Cycles: 10")
                .contains("Committed: 4 (squashed: 2)")
                .contains("IPC: 0.40")
                .contains("R5=3");
    }
}

package org.tomasim.cli.rendering;

import org.tomasim.runtime.trace.InstructionTiming;
import org.tomasim.runtime.trace.SimulationReport;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Renders a report as a plain text table: one row per issued instruction with its
 * Issue, Start Exec, Finish Exec, Write Result and Commit cycles, followed by the
 * run totals and the final machine state.
 */
public class TimingTableRenderer {

    private static final String[] HEADERS = {"Issue", "Start Exec", "Finish Exec", "Write Result", "Commit"};
    private static final String NOT_REACHED = "-";

    /**
     * Writes the table to the given writer.
     * @param report The finished run.
     * @param out The destination.
     */
    public void render(SimulationReport report, PrintWriter out) {
        int instructionWidth = "Instruction".length();
        for (InstructionTiming timing : report.timings()) {
            instructionWidth = Math.max(instructionWidth, timing.instruction().sourceText().length());
        }

        StringBuilder header = new StringBuilder(String.format("%4s  %-" + instructionWidth + "s", "PC", "Instruction"));
        for (String column : HEADERS) {
            header.append("  ").append(String.format("%12s", column));
        }
        header.append("  Status");
        out.println(header);
        out.println("-".repeat(header.length()));

        for (InstructionTiming timing : report.timings()) {
            StringBuilder row = new StringBuilder(String.format("%4d  %-" + instructionWidth + "s",
                    timing.instruction().index(), timing.instruction().sourceText()));
            for (OptionalLong cycle : new OptionalLong[]{timing.issue(), timing.startExec(), timing.finishExec(),
                    timing.writeResult(), timing.commit()}) {
                row.append("  ").append(String.format("%12s", cell(cycle)));
            }
            row.append("  ").append(timing.squashed() ? "squashed" : timing.committed() ? "committed" : "in flight");
            out.println(row);
        }

        out.println();
        out.printf("Total Cycles: %d%n", report.totalCycles());
        out.printf("Committed: %d (squashed: %d)%n", report.committedInstructions(), report.squashedInstructions());
        out.printf(Locale.ROOT, "IPC: %.2f%n", report.ipc());

        StringBuilder registers = new StringBuilder("Registers:");
        int[] values = report.registers();
        for (int reg = 0; reg < values.length; reg++) {
            registers.append(' ').append('R').append(reg).append('=').append(values[reg]);
        }
        out.println(registers);
        if (!report.memory().isEmpty()) {
            out.println("Memory:");
            for (Map.Entry<Integer, Integer> word : report.memory().entrySet()) {
                out.printf("  [%d] = %d%n", word.getKey(), word.getValue());
            }
        }
    }

    private static String cell(OptionalLong cycle) {
        return cycle.isPresent() ? Long.toString(cycle.getAsLong()) : NOT_REACHED;
    }
}

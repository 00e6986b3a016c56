package org.tomasim.cli.rendering;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.tomasim.runtime.trace.InstructionTiming;
import org.tomasim.runtime.trace.SimulationReport;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Writes a report as a JSON document. Cycles that were never reached are {@code null}.
 */
public class JsonReportWriter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serializes the report.
     * @param report The finished run.
     * @param out The destination; left open.
     * @throws IOException if writing fails.
     */
    public void write(SimulationReport report, Writer out) throws IOException {
        out.write(toJson(report));
        out.write(System.lineSeparator());
    }

    /**
     * @param report The finished run.
     * @return The report as a JSON string.
     * @throws IOException if serialization fails.
     */
    public String toJson(SimulationReport report) throws IOException {
        return objectMapper.writeValueAsString(toDocument(report));
    }

    static ReportDocument toDocument(SimulationReport report) {
        List<TimingRow> rows = report.timings().stream().map(JsonReportWriter::toRow).toList();
        Map<String, Integer> registers = new LinkedHashMap<>();
        int[] values = report.registers();
        for (int reg = 0; reg < values.length; reg++) {
            registers.put("R" + reg, values[reg]);
        }
        Map<String, Integer> memory = new LinkedHashMap<>();
        report.memory().forEach((address, value) -> memory.put(Integer.toString(address), value));
        return new ReportDocument(report.totalCycles(), report.committedInstructions(),
                report.squashedInstructions(), report.ipc(), rows, registers, memory);
    }

    private static TimingRow toRow(InstructionTiming timing) {
        return new TimingRow(timing.sequence(), timing.instruction().index(), timing.instruction().sourceText(),
                box(timing.issue()), box(timing.startExec()), box(timing.finishExec()),
                box(timing.writeResult()), box(timing.commit()), timing.squashed());
    }

    private static Long box(OptionalLong cycle) {
        return cycle.isPresent() ? cycle.getAsLong() : null;
    }

    public record ReportDocument(long totalCycles, long committed, long squashed, double ipc,
                          List<TimingRow> instructions, Map<String, Integer> registers,
                          Map<String, Integer> memory) {}

    public record TimingRow(long sequence, int pc, String instruction, Long issue, Long startExec, Long finishExec,
                     Long writeResult, Long commit, boolean squashed) {}
}

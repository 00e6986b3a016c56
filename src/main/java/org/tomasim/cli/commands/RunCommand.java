package org.tomasim.cli.commands;

import com.typesafe.config.ConfigException;
import org.tomasim.assembler.ProgramParseException;
import org.tomasim.assembler.ProgramParser;
import org.tomasim.cli.CommandLineInterface;
import org.tomasim.cli.rendering.JsonReportWriter;
import org.tomasim.cli.rendering.TimingTableRenderer;
import org.tomasim.runtime.BranchResolution;
import org.tomasim.runtime.MachineConfig;
import org.tomasim.runtime.MemoryOrdering;
import org.tomasim.runtime.SchedulingEngine;
import org.tomasim.runtime.SimulationAbortedException;
import org.tomasim.runtime.isa.InstructionStream;
import org.tomasim.runtime.model.MemoryBoundsException;
import org.tomasim.runtime.trace.SimulationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs a program and prints its per-instruction timing."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The assembly file to run.")
    private File programFile;

    @Option(names = "--rob", description = "Reorder buffer capacity.")
    private Integer robCapacity;

    @Option(names = "--issue-width", description = "Instructions issued per cycle.")
    private Integer issueWidth;

    @Option(names = "--commit-width", description = "Instructions committed per cycle.")
    private Integer commitWidth;

    @Option(names = "--branch-resolution", description = "When branches resolve: ${COMPLETION-CANDIDATES}.")
    private BranchResolution branchResolution;

    @Option(names = "--memory-ordering", description = "Load/store ordering: ${COMPLETION-CANDIDATES}.")
    private MemoryOrdering memoryOrdering;

    @Option(names = "--max-cycles", description = "Abort after this many cycles.")
    private Long maxCycles;

    @Option(names = "--reg", description = "Initial register value, e.g. --reg R2=5 (repeatable).")
    private Map<String, Integer> registers = new LinkedHashMap<>();

    @Option(names = "--mem", description = "Initial memory word, e.g. --mem 10=123 (repeatable).")
    private Map<Integer, Integer> memoryWords = new LinkedHashMap<>();

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format = OutputFormat.TABLE;

    @Override
    public Integer call() {
        final MachineConfig machine;
        try {
            machine = machineConfig();
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_BAD_INPUT;
        }

        final InstructionStream program;
        try {
            program = new ProgramParser().parse(programFile.toPath());
        } catch (ProgramParseException e) {
            LOG.error("Cannot parse program:\n{}", e.getFormattedMessage());
            return EXIT_BAD_INPUT;
        } catch (IOException e) {
            LOG.error("Cannot read program file {}: {}", programFile, e.getMessage());
            return EXIT_BAD_INPUT;
        }

        final SimulationReport report;
        try {
            report = new SchedulingEngine(machine, program).run();
        } catch (SimulationAbortedException e) {
            LOG.error("Simulation aborted: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (MemoryBoundsException e) {
            LOG.error("Invalid initial memory: {}", e.getMessage());
            return EXIT_BAD_INPUT;
        }

        final PrintWriter out = spec.commandLine().getOut();
        try {
            switch (format) {
                case TABLE -> new TimingTableRenderer().render(report, out);
                case JSON -> new JsonReportWriter().write(report, out);
            }
        } catch (IOException e) {
            LOG.error("Cannot write report: {}", e.getMessage());
            return EXIT_FAILED;
        }
        out.flush();
        return 0;
    }

    private MachineConfig machineConfig() {
        final MachineConfig.Builder builder = MachineConfig.fromConfig(parent.getConfig()).toBuilder();
        if (robCapacity != null) {
            builder.robCapacity(robCapacity);
        }
        if (issueWidth != null) {
            builder.issueWidth(issueWidth);
        }
        if (commitWidth != null) {
            builder.commitWidth(commitWidth);
        }
        if (branchResolution != null) {
            builder.branchResolution(branchResolution);
        }
        if (memoryOrdering != null) {
            builder.memoryOrdering(memoryOrdering);
        }
        if (maxCycles != null) {
            builder.maxCycles(maxCycles);
        }
        registers.forEach((name, value) -> builder.register(MachineConfig.parseRegisterName(name), value));
        memoryWords.forEach(builder::memoryWord);
        return builder.build();
    }
}

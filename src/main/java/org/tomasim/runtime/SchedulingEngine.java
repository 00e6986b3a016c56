package org.tomasim.runtime;

import org.tomasim.runtime.isa.FunctionalUnit;
import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.InstructionStream;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.model.Memory;
import org.tomasim.runtime.model.MemoryBoundsException;
import org.tomasim.runtime.model.OperandValue;
import org.tomasim.runtime.rob.CommittedEntry;
import org.tomasim.runtime.rob.RobEntry;
import org.tomasim.runtime.station.CompletedResult;
import org.tomasim.runtime.station.ExecutionContext;
import org.tomasim.runtime.station.ExecutionResult;
import org.tomasim.runtime.station.OperationSemantics;
import org.tomasim.runtime.station.ReservationStationPool;
import org.tomasim.runtime.station.StationOperands;
import org.tomasim.runtime.trace.InstructionTiming;
import org.tomasim.runtime.trace.SimulationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Drives the out-of-order machine one cycle at a time.
 * <p>
 * Every cycle runs the same four steps in a fixed order:
 * <ol>
 *   <li><b>Commit</b> up to {@code commit-width} entries from the head of the reorder buffer.</li>
 *   <li><b>Broadcast</b> every result finished in the previous cycle to waiting stations and the
 *       reorder buffer; a mispredicted control transfer squashes all younger work here.</li>
 *   <li><b>Execute</b>: every pool counts down the latency of its ready slots.</li>
 *   <li><b>Issue</b> up to {@code issue-width} instructions in program order, each taking a station
 *       slot and a reorder buffer entry together or stalling without side effects.</li>
 * </ol>
 * The run ends once the fetch cursor has left the program and the reorder buffer is empty.
 */
public class SchedulingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchedulingEngine.class);

    private final MachineConfig config;
    private final InstructionStream program;
    private final EngineState state;
    private final OperandResolver resolver;

    /**
     * Creates an engine positioned before the first cycle.
     * @param config The machine configuration.
     * @param program The program to run.
     * @throws MemoryBoundsException if the configured memory preset lies outside the memory.
     */
    public SchedulingEngine(MachineConfig config, InstructionStream program) {
        this.config = config;
        this.program = program;
        this.state = new EngineState(config);
        this.resolver = new OperandResolver(state.registers(), state.reorderBuffer());
    }

    /**
     * Runs until quiescence.
     * @return The report of the finished run.
     * @throws SimulationAbortedException on a fatal operand or memory error, or if the program
     *         has not finished after {@code max-cycles} cycles.
     */
    public SimulationReport run() {
        LOG.info("Running {} instructions (ROB={}, issue-width={}, commit-width={}, branches={}, memory={})",
                program.size(), config.robCapacity(), config.issueWidth(), config.commitWidth(),
                config.branchResolution(), config.memoryOrdering());
        while (!isFinished()) {
            if (state.cycle() >= config.maxCycles()) {
                throw new SimulationAbortedException(state.cycle(), -1,
                        "program did not finish within " + config.maxCycles() + " cycles");
            }
            tick();
        }
        SimulationReport report = report();
        LOG.info("Finished after {} cycles: {} committed, {} squashed, IPC={}",
                report.totalCycles(), report.committedInstructions(), report.squashedInstructions(),
                String.format("%.2f", report.ipc()));
        return report;
    }

    /**
     * Simulates one cycle. Does nothing once the run is finished.
     * @throws SimulationAbortedException on a fatal operand or memory error.
     */
    public void tick() {
        if (isFinished()) {
            return;
        }
        long cycle = state.advanceCycle();
        commit(state, cycle);
        broadcast(state, cycle);
        execute(state, cycle);
        issue(state, cycle);
        if (LOG.isTraceEnabled()) {
            LOG.trace("End of cycle {}: pc={} rob={} {}", cycle, state.fetchPc(),
                    state.reorderBuffer().entries(), state.registers());
        }
    }

    /**
     * @return true if the fetch cursor has left the program and nothing is in flight.
     */
    public boolean isFinished() {
        return !program.contains(state.fetchPc()) && state.reorderBuffer().isEmpty();
    }

    /**
     * Reports the timing recorded so far; may be called after any cycle.
     * @return The current report.
     */
    public SimulationReport report() {
        List<InstructionTiming> timings = state.history().stream().map(InstructionTiming::of).toList();
        return new SimulationReport(timings, state.cycle(), state.registers().snapshot(),
                state.memory().nonZeroWords());
    }

    public EngineState getState() {
        return state;
    }

    public MachineConfig getConfig() {
        return config;
    }

    // --- 1. commit ---

    private void commit(EngineState state, long cycle) {
        for (int i = 0; i < config.commitWidth(); i++) {
            Optional<RobEntry> head = state.reorderBuffer().head();
            Optional<CommittedEntry> committed;
            try {
                committed = state.reorderBuffer().commitReady(state.registers(), state.memory(), cycle);
            } catch (MemoryBoundsException e) {
                int index = head.map(entry -> entry.getInstruction().index()).orElse(-1);
                throw new SimulationAbortedException(cycle, index, e.getMessage(), e);
            }
            if (committed.isEmpty()) {
                return;
            }
            LOG.debug("Cycle {}: commit {}", cycle, committed.get().instruction());
        }
    }

    // --- 2. broadcast ---

    private void broadcast(EngineState state, long cycle) {
        List<CompletedResult> completions = new ArrayList<>();
        for (ReservationStationPool pool : state.pools()) {
            completions.addAll(pool.completed());
        }
        completions.sort(Comparator.comparingLong(completion -> completion.owner().getSequence()));

        for (CompletedResult completion : completions) {
            RobEntry producer = completion.owner();
            if (!producer.isLive()) {
                // squashed earlier in this step by an older branch
                continue;
            }
            ExecutionResult result = completion.result();
            completion.handle().release(producer);
            state.reorderBuffer().markWritten(producer, result, cycle);
            for (ReservationStationPool pool : state.pools()) {
                pool.deliver(producer.tag(), result.value());
            }
            LOG.debug("Cycle {}: broadcast {}={} from {}", cycle, producer.tag(), result.value(),
                    producer.getInstruction());

            Opcode opcode = producer.getInstruction().opcode();
            if (opcode.isControlTransfer() && result.nextPc() != producer.getPredictedNextPc()) {
                squash(state, producer, result.nextPc(), cycle);
            }
        }
    }

    private void squash(EngineState state, RobEntry branch, int actualNextPc, long cycle) {
        List<RobEntry> squashed = state.reorderBuffer().squashYoungerThan(branch, state.registers(), cycle);
        state.redirectFetch(actualNextPc);
        LOG.info("Cycle {}: misprediction at {} (predicted PC {}, actual PC {}), squashed {} younger instruction(s)",
                cycle, branch.getInstruction(), branch.getPredictedNextPc(), actualNextPc, squashed.size());
    }

    // --- 3. execute ---

    private void execute(EngineState state, long cycle) {
        ExecutionContext context = new ExecutionContext() {
            @Override
            public long cycle() {
                return cycle;
            }

            @Override
            public Memory memory() {
                return state.memory();
            }

            @Override
            public boolean mayStartLoad(RobEntry load) {
                return config.memoryOrdering() == MemoryOrdering.RELAXED
                        || !state.reorderBuffer().hasOlderUncommittedStore(load);
            }
        };
        for (FunctionalUnit unit : FunctionalUnit.values()) {
            state.pool(unit).tick(context);
        }
    }

    // --- 4. issue ---

    private void issue(EngineState state, long cycle) {
        for (int issued = 0; issued < config.issueWidth(); issued++) {
            int pc = state.fetchPc();
            if (!program.contains(pc)) {
                return;
            }
            Instruction instruction = program.get(pc);
            ReservationStationPool pool = state.pool(instruction.opcode().unit());
            if (!pool.hasFreeSlot() || !state.reorderBuffer().hasFreeSlot()) {
                LOG.debug("Cycle {}: stall on {} (free {} slot: {}, free ROB entry: {})", cycle, instruction,
                        pool.getUnit(), pool.hasFreeSlot(), state.reorderBuffer().hasFreeSlot());
                return;
            }

            OperandResolver.Resolution resolution;
            try {
                resolution = resolver.resolve(instruction);
            } catch (OperandException e) {
                throw new SimulationAbortedException(cycle, e.getInstructionIndex(), e.getMessage(), e);
            }
            int nextPc = predictNextPc(instruction, resolution.operands());

            RobEntry entry = state.reorderBuffer()
                    .allocate(instruction, resolution.destination(), nextPc)
                    .orElseThrow(() -> new IllegalStateException("ROB full after free-slot check"));
            pool.allocate(entry, resolution.operands())
                    .orElseThrow(() -> new IllegalStateException(pool.getUnit() + " full after free-slot check"));
            entry.markIssued(cycle);
            if (resolution.destination() >= 0) {
                state.registers().setTag(resolution.destination(), entry.tag());
            }
            state.record(entry);
            state.redirectFetch(nextPc);
            LOG.debug("Cycle {}: issue {} as {} with {}", cycle, instruction, entry.tag(), resolution.operands());
        }
    }

    /**
     * Predicts where fetch continues after an instruction. CALL targets are static; BEQ and RET
     * fall through unless issue-time resolution is enabled and their operands are already known.
     */
    private int predictNextPc(Instruction instruction, StationOperands operands) {
        int fallThrough = instruction.index() + 1;
        switch (instruction.opcode()) {
            case CALL:
                return OperationSemantics.branchTarget(instruction);
            case BEQ:
                if (config.branchResolution() == BranchResolution.ISSUE && operands.isReady()) {
                    boolean taken = OperandValue.valueOf(operands.j()) == OperandValue.valueOf(operands.k());
                    LOG.debug("Branch {} resolved at issue: {}", instruction, taken ? "taken" : "not taken");
                    return taken ? OperationSemantics.branchTarget(instruction) : fallThrough;
                }
                return fallThrough;
            case RET:
                if (config.branchResolution() == BranchResolution.ISSUE && operands.isReady()) {
                    return OperandValue.valueOf(operands.j());
                }
                return fallThrough;
            default:
                return fallThrough;
        }
    }
}

package org.tomasim.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.tomasim.runtime.isa.FunctionalUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * The shape of the simulated machine: functional units, reorder buffer, register file,
 * memory, widths and policies, plus the register and memory contents a run starts from.
 * <p>
 * Defaults live in {@code reference.conf} below {@code tomasim.machine}:
 * <pre>
 * tomasim.machine {
 *   register-count = 8
 *   zero-register = true
 *   memory-size = 65536
 *   rob-capacity = 6
 *   issue-width = 1
 *   commit-width = 1
 *   max-cycles = 100000
 *   branch-resolution = EXECUTE   # or ISSUE
 *   memory-ordering = IN_ORDER    # or RELAXED
 *   units {
 *     add { slots = 4, latency = 2 }
 *     ...
 *   }
 *   initial-registers { R2 = 5 }
 *   initial-memory { "10" = 123 }
 * }
 * </pre>
 */
public record MachineConfig(
        int registerCount,
        boolean zeroRegister,
        int memorySize,
        int robCapacity,
        int issueWidth,
        int commitWidth,
        long maxCycles,
        BranchResolution branchResolution,
        MemoryOrdering memoryOrdering,
        Map<FunctionalUnit, UnitShape> units,
        Map<Integer, Integer> initialRegisters,
        Map<Integer, Integer> initialMemory) {

    /**
     * The configuration path of the machine section.
     */
    public static final String CONFIG_PATH = "tomasim.machine";

    public MachineConfig {
        requirePositive("register-count", registerCount);
        requirePositive("memory-size", memorySize);
        requirePositive("rob-capacity", robCapacity);
        requirePositive("issue-width", issueWidth);
        requirePositive("commit-width", commitWidth);
        requirePositive("max-cycles", maxCycles);
        for (FunctionalUnit unit : FunctionalUnit.values()) {
            if (!units.containsKey(unit)) {
                throw new IllegalArgumentException("No shape configured for functional unit " + unit);
            }
        }
        units = Collections.unmodifiableMap(new EnumMap<>(units));
        initialRegisters = Collections.unmodifiableMap(new TreeMap<>(initialRegisters));
        initialMemory = Collections.unmodifiableMap(new TreeMap<>(initialMemory));
        for (int reg : initialRegisters.keySet()) {
            if (reg < 0 || reg >= registerCount) {
                throw new IllegalArgumentException("Initial value for unknown register R" + reg);
            }
        }
    }

    /**
     * @return The defaults from the classpath {@code reference.conf}.
     */
    public static MachineConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Maps the {@value #CONFIG_PATH} section of an application configuration.
     * @param config The resolved application configuration.
     * @return The machine configuration.
     * @throws ConfigException if a setting is missing or has the wrong type.
     */
    public static MachineConfig fromConfig(Config config) {
        Config machine = config.getConfig(CONFIG_PATH);
        Map<FunctionalUnit, UnitShape> units = new EnumMap<>(FunctionalUnit.class);
        Config unitsConfig = machine.getConfig("units");
        for (FunctionalUnit unit : FunctionalUnit.values()) {
            Config unitConfig = unitsConfig.getConfig(unit.configKey());
            units.put(unit, new UnitShape(unitConfig.getInt("slots"), unitConfig.getInt("latency")));
        }

        Map<Integer, Integer> registers = new TreeMap<>();
        if (machine.hasPath("initial-registers")) {
            for (Map.Entry<String, ConfigValue> entry : machine.getConfig("initial-registers").root().entrySet()) {
                registers.put(parseRegisterName(entry.getKey()), toInt(entry.getValue()));
            }
        }
        Map<Integer, Integer> memory = new TreeMap<>();
        if (machine.hasPath("initial-memory")) {
            for (Map.Entry<String, ConfigValue> entry : machine.getConfig("initial-memory").root().entrySet()) {
                memory.put(Integer.parseInt(entry.getKey().trim()), toInt(entry.getValue()));
            }
        }

        return new MachineConfig(
                machine.getInt("register-count"),
                machine.hasPath("zero-register") ? machine.getBoolean("zero-register") : true,
                machine.getInt("memory-size"),
                machine.getInt("rob-capacity"),
                machine.hasPath("issue-width") ? machine.getInt("issue-width") : 1,
                machine.hasPath("commit-width") ? machine.getInt("commit-width") : 1,
                machine.hasPath("max-cycles") ? machine.getLong("max-cycles") : 100_000L,
                machine.hasPath("branch-resolution")
                        ? machine.getEnum(BranchResolution.class, "branch-resolution") : BranchResolution.EXECUTE,
                machine.hasPath("memory-ordering")
                        ? machine.getEnum(MemoryOrdering.class, "memory-ordering") : MemoryOrdering.IN_ORDER,
                units,
                registers,
                memory);
    }

    public UnitShape shapeOf(FunctionalUnit unit) {
        return units.get(unit);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Parses a register name such as {@code R3} or {@code 3}.
     * @param name The name.
     * @return The register index.
     * @throws NumberFormatException if the name is not a register name.
     */
    public static int parseRegisterName(String name) {
        String trimmed = name.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("R")) {
            trimmed = trimmed.substring(1);
        }
        return Integer.parseInt(trimmed);
    }

    private static int toInt(ConfigValue value) {
        Object raw = value.unwrapped();
        if (raw instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(raw.toString().trim());
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }

    /**
     * Copies a configuration with selected settings replaced, e.g. from command line options.
     */
    public static final class Builder {
        private int registerCount;
        private boolean zeroRegister;
        private int memorySize;
        private int robCapacity;
        private int issueWidth;
        private int commitWidth;
        private long maxCycles;
        private BranchResolution branchResolution;
        private MemoryOrdering memoryOrdering;
        private final Map<FunctionalUnit, UnitShape> units;
        private final Map<Integer, Integer> initialRegisters;
        private final Map<Integer, Integer> initialMemory;

        private Builder(MachineConfig base) {
            this.registerCount = base.registerCount;
            this.zeroRegister = base.zeroRegister;
            this.memorySize = base.memorySize;
            this.robCapacity = base.robCapacity;
            this.issueWidth = base.issueWidth;
            this.commitWidth = base.commitWidth;
            this.maxCycles = base.maxCycles;
            this.branchResolution = base.branchResolution;
            this.memoryOrdering = base.memoryOrdering;
            this.units = new EnumMap<>(base.units);
            this.initialRegisters = new TreeMap<>(base.initialRegisters);
            this.initialMemory = new TreeMap<>(base.initialMemory);
        }

        public Builder registerCount(int registerCount) {
            this.registerCount = registerCount;
            return this;
        }

        public Builder zeroRegister(boolean zeroRegister) {
            this.zeroRegister = zeroRegister;
            return this;
        }

        public Builder memorySize(int memorySize) {
            this.memorySize = memorySize;
            return this;
        }

        public Builder robCapacity(int robCapacity) {
            this.robCapacity = robCapacity;
            return this;
        }

        public Builder issueWidth(int issueWidth) {
            this.issueWidth = issueWidth;
            return this;
        }

        public Builder commitWidth(int commitWidth) {
            this.commitWidth = commitWidth;
            return this;
        }

        public Builder maxCycles(long maxCycles) {
            this.maxCycles = maxCycles;
            return this;
        }

        public Builder branchResolution(BranchResolution branchResolution) {
            this.branchResolution = branchResolution;
            return this;
        }

        public Builder memoryOrdering(MemoryOrdering memoryOrdering) {
            this.memoryOrdering = memoryOrdering;
            return this;
        }

        public Builder unit(FunctionalUnit unit, int slots, int latency) {
            this.units.put(unit, new UnitShape(slots, latency));
            return this;
        }

        public Builder register(int register, int value) {
            this.initialRegisters.put(register, value);
            return this;
        }

        public Builder memoryWord(int address, int value) {
            this.initialMemory.put(address, value);
            return this;
        }

        public MachineConfig build() {
            return new MachineConfig(registerCount, zeroRegister, memorySize, robCapacity, issueWidth, commitWidth,
                    maxCycles, branchResolution, memoryOrdering, units, initialRegisters, initialMemory);
        }
    }
}

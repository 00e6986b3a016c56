package org.tomasim.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tomasim.runtime.isa.FunctionalUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MachineConfigTest {

    @Test
    void defaultsComeFromReferenceConf() {
        MachineConfig config = MachineConfig.defaults();

        assertThat(config.registerCount()).isEqualTo(8);
        assertThat(config.zeroRegister()).isTrue();
        assertThat(config.robCapacity()).isEqualTo(6);
        assertThat(config.issueWidth()).isEqualTo(1);
        assertThat(config.commitWidth()).isEqualTo(1);
        assertThat(config.branchResolution()).isEqualTo(BranchResolution.EXECUTE);
        assertThat(config.memoryOrdering()).isEqualTo(MemoryOrdering.IN_ORDER);
        assertThat(config.shapeOf(FunctionalUnit.ADD)).isEqualTo(new UnitShape(4, 2));
        assertThat(config.shapeOf(FunctionalUnit.MUL)).isEqualTo(new UnitShape(1, 8));
        assertThat(config.shapeOf(FunctionalUnit.BEQ)).isEqualTo(new UnitShape(2, 1));
        assertThat(config.shapeOf(FunctionalUnit.CALL_RET)).isEqualTo(new UnitShape(2, 4));
        assertThat(config.initialRegisters()).isEmpty();
    }

    @Test
    void overridesAndPresetsAreMapped() {
        Config overrides = ConfigFactory.parseString("""
                tomasim.machine {
                  rob-capacity = 16
                  issue-width = 2
                  branch-resolution = ISSUE
                  memory-ordering = RELAXED
                  units.mul { slots = 2, latency = 10 }
                  initial-registers { R2 = 5, R3 = -1 }
                  initial-memory { "10" = 123 }
                }
                """);

        MachineConfig config = MachineConfig.fromConfig(overrides.withFallback(ConfigFactory.load()));

        assertThat(config.robCapacity()).isEqualTo(16);
        assertThat(config.issueWidth()).isEqualTo(2);
        assertThat(config.branchResolution()).isEqualTo(BranchResolution.ISSUE);
        assertThat(config.memoryOrdering()).isEqualTo(MemoryOrdering.RELAXED);
        assertThat(config.shapeOf(FunctionalUnit.MUL)).isEqualTo(new UnitShape(2, 10));
        assertThat(config.initialRegisters()).containsEntry(2, 5).containsEntry(3, -1);
        assertThat(config.initialMemory()).containsEntry(10, 123);
    }

    @Test
    void builderReplacesSelectedSettings() {
        MachineConfig config = MachineConfig.defaults().toBuilder()
                .robCapacity(2)
                .unit(FunctionalUnit.ADD, 1, 3)
                .register(4, 9)
                .build();

        assertThat(config.robCapacity()).isEqualTo(2);
        assertThat(config.shapeOf(FunctionalUnit.ADD)).isEqualTo(new UnitShape(1, 3));
        assertThat(config.initialRegisters()).containsEntry(4, 9);
        assertThat(config.memorySize()).isEqualTo(MachineConfig.defaults().memorySize());
    }

    @Test
    void rejectsNonPositiveShapes() {
        assertThatThrownBy(() -> MachineConfig.defaults().toBuilder().robCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UnitShape(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MachineConfig.defaults().toBuilder().register(8, 1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownPolicyIsAConfigError() {
        Config bad = ConfigFactory.parseString("tomasim.machine.memory-ordering = SOMETIMES")
                .withFallback(ConfigFactory.load());

        assertThatThrownBy(() -> MachineConfig.fromConfig(bad)).isInstanceOf(ConfigException.class);
    }

    @Test
    void parsesRegisterNames() {
        assertThat(MachineConfig.parseRegisterName("R7")).isEqualTo(7);
        assertThat(MachineConfig.parseRegisterName(" r2 ")).isEqualTo(2);
        assertThat(MachineConfig.parseRegisterName("3")).isEqualTo(3);
        assertThatThrownBy(() -> MachineConfig.parseRegisterName("X1")).isInstanceOf(NumberFormatException.class);
    }
}

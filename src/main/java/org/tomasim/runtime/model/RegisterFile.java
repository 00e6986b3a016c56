package org.tomasim.runtime.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The architectural register file together with the register status (rename) table.
 * <p>
 * Each register holds a committed word value and optionally the {@link ProducerTag} of the
 * youngest in-flight instruction that will write it. A later issue simply overwrites the tag,
 * which is how renaming resolves WAW hazards: only the last writer before a read matters.
 * Register indices are validated by the caller.
 */
public class RegisterFile {

    private final int[] values;
    private final ProducerTag[] tags;
    private final boolean zeroRegister;

    /**
     * Creates a register file with all registers zero and ready.
     * @param registerCount The number of registers.
     * @param zeroRegister If true, R0 always reads zero and ignores writes and tags.
     */
    public RegisterFile(int registerCount, boolean zeroRegister) {
        if (registerCount <= 0) {
            throw new IllegalArgumentException("Register count must be positive: " + registerCount);
        }
        this.values = new int[registerCount];
        this.tags = new ProducerTag[registerCount];
        this.zeroRegister = zeroRegister;
    }

    public int size() {
        return values.length;
    }

    /**
     * @param reg A register index.
     * @return true if the index names a register of this file.
     */
    public boolean isValid(int reg) {
        return reg >= 0 && reg < values.length;
    }

    public int read(int reg) {
        return values[reg];
    }

    /**
     * Writes a committed value. Writes to the hard-wired zero register are dropped.
     * @param reg The register index.
     * @param value The word value.
     */
    public void write(int reg, int value) {
        if (isHardWiredZero(reg)) {
            return;
        }
        values[reg] = Word.wrap(value);
    }

    public Optional<ProducerTag> tag(int reg) {
        return Optional.ofNullable(tags[reg]);
    }

    /**
     * Renames a register to a new producer, replacing any earlier tag.
     * @param reg The register index.
     * @param tag The new producer.
     */
    public void setTag(int reg, ProducerTag tag) {
        if (isHardWiredZero(reg)) {
            return;
        }
        tags[reg] = tag;
    }

    public void clearTag(int reg) {
        tags[reg] = null;
    }

    /**
     * Clears a register's tag only if it still names the given producer.
     * A register that has been renamed to a younger producer keeps the younger tag.
     * @param reg The register index.
     * @param tag The producer that is retiring.
     * @return true if the tag was cleared.
     */
    public boolean clearTagIfOwnedBy(int reg, ProducerTag tag) {
        if (tag.equals(tags[reg])) {
            tags[reg] = null;
            return true;
        }
        return false;
    }

    /**
     * @return A copy of all register values.
     */
    public int[] snapshot() {
        return values.clone();
    }

    private boolean isHardWiredZero(int reg) {
        return zeroRegister && reg == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RegisterFile");
        sb.append(Arrays.toString(values));
        for (int i = 0; i < tags.length; i++) {
            if (tags[i] != null) {
                sb.append(" R").append(i).append('=').append(tags[i]);
            }
        }
        return sb.toString();
    }
}

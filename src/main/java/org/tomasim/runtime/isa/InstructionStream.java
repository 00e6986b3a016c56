package org.tomasim.runtime.isa;

import java.util.Iterator;
import java.util.List;

/**
 * The read-only program the engine fetches from. Instruction {@code i} of the stream
 * always has program-order index {@code i}.
 */
public final class InstructionStream implements Iterable<Instruction> {

    private final List<Instruction> instructions;

    /**
     * @param instructions The decoded program, ordered by index.
     * @throws IllegalArgumentException if an instruction's index does not match its position.
     */
    public InstructionStream(List<Instruction> instructions) {
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i).index() != i) {
                throw new IllegalArgumentException(
                        "Instruction at position " + i + " has index " + instructions.get(i).index());
            }
        }
        this.instructions = List.copyOf(instructions);
    }

    public static InstructionStream of(Instruction... instructions) {
        return new InstructionStream(List.of(instructions));
    }

    public int size() {
        return instructions.size();
    }

    /**
     * @param pc A program counter value.
     * @return true if the fetch cursor at {@code pc} would find an instruction.
     */
    public boolean contains(int pc) {
        return pc >= 0 && pc < instructions.size();
    }

    public Instruction get(int pc) {
        return instructions.get(pc);
    }

    public List<Instruction> asList() {
        return instructions;
    }

    @Override
    public Iterator<Instruction> iterator() {
        return instructions.iterator();
    }
}

package org.tomasim.runtime.isa;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable, decoded instruction of the static program.
 *
 * @param index The zero-based program-order index (the instruction's PC).
 * @param opcode The operation.
 * @param operands The operands in written order, destination first where the form has one.
 * @param sourceText The original assembly text, used by reports.
 */
public record Instruction(int index, Opcode opcode, List<Operand> operands, String sourceText) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        operands = List.copyOf(operands);
        if (sourceText == null || sourceText.isBlank()) {
            sourceText = render(opcode, operands);
        }
    }

    /**
     * Creates an instruction whose source text is rendered from its operands.
     * @param index The program-order index.
     * @param opcode The operation.
     * @param operands The operands.
     * @return The instruction.
     */
    public static Instruction of(int index, Opcode opcode, Operand... operands) {
        return new Instruction(index, opcode, List.of(operands), null);
    }

    public Operand operand(int position) {
        return operands.get(position);
    }

    private static String render(Opcode opcode, List<Operand> operands) {
        if (operands.isEmpty()) {
            return opcode.name();
        }
        return opcode.name() + " " + operands.stream().map(Operand::toString).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return index + ": " + sourceText;
    }
}

package org.tomasim.assembler;

import org.tomasim.runtime.isa.Instruction;
import org.tomasim.runtime.isa.InstructionStream;
import org.tomasim.runtime.isa.Opcode;
import org.tomasim.runtime.isa.Operand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns assembly text into an {@link InstructionStream}.
 * <p>
 * One instruction per line. Operands are separated by commas or whitespace, registers are
 * written {@code R0}..{@code Rn}, memory references {@code disp(Rn)}. Everything after
 * {@code #} or {@code ;} is a comment. A line may start with a label {@code name:}; the
 * offset operand of {@code BEQ} and {@code CALL} may name a label instead of a number and
 * is then converted to an offset relative to the next instruction.
 * <p>
 * The parser runs two passes: the first assigns indices and collects labels, the second
 * decodes operands.
 */
public class ProgramParser {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramParser.class);

    private static final Pattern LABEL = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*:(.*)$");
    private static final Pattern REGISTER = Pattern.compile("^[Rr](\\d+)$");
    private static final Pattern MEMORY_REFERENCE = Pattern.compile("^([^()]*)\\(\\s*([Rr]\\d+)\\s*\\)$");
    private static final Pattern LABEL_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Parses a program file.
     * @param file The source file.
     * @return The decoded program.
     * @throws IOException if the file cannot be read.
     * @throws ProgramParseException if the source is malformed.
     */
    public InstructionStream parse(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        return parse(lines, file.getFileName().toString());
    }

    /**
     * Parses program source.
     * @param sourceLines The source lines.
     * @param fileName The name used in error messages.
     * @return The decoded program.
     * @throws ProgramParseException if the source is malformed.
     */
    public InstructionStream parse(List<String> sourceLines, String fileName) {
        List<SourceLine> lines = new ArrayList<>();
        for (int i = 0; i < sourceLines.size(); i++) {
            lines.add(new SourceLine(sourceLines.get(i), i + 1, fileName));
        }

        // pass 1: labels and instruction indices
        Map<String, Integer> labels = new HashMap<>();
        List<SourceLine> instructionLines = new ArrayList<>();
        List<String> instructionTexts = new ArrayList<>();
        for (SourceLine line : lines) {
            String text = stripComment(line.content());
            Matcher label = LABEL.matcher(text);
            if (label.matches()) {
                String name = label.group(1).toUpperCase(Locale.ROOT);
                if (isOpcode(name)) {
                    throw new ProgramParseException(line, "label '" + label.group(1) + "' collides with an opcode");
                }
                if (labels.putIfAbsent(name, instructionLines.size()) != null) {
                    throw new ProgramParseException(line, "label '" + label.group(1) + "' is declared twice");
                }
                text = label.group(2).strip();
            }
            if (!text.isEmpty()) {
                instructionLines.add(line);
                instructionTexts.add(text);
            }
        }

        // pass 2: decode
        List<Instruction> instructions = new ArrayList<>();
        for (int index = 0; index < instructionLines.size(); index++) {
            instructions.add(decode(index, instructionTexts.get(index), instructionLines.get(index), labels));
        }
        LOG.debug("Parsed {} instructions and {} labels from {}", instructions.size(), labels.size(), fileName);
        return new InstructionStream(instructions);
    }

    private Instruction decode(int index, String text, SourceLine line, Map<String, Integer> labels) {
        String[] parts = text.split("\\s+", 2);
        String mnemonic = parts[0].toUpperCase(Locale.ROOT);
        if (!isOpcode(mnemonic)) {
            throw new ProgramParseException(line, "unknown opcode '" + parts[0] + "'");
        }
        Opcode opcode = Opcode.valueOf(mnemonic);
        List<String> args = parts.length > 1 ? splitOperands(parts[1]) : List.of();
        List<Operand.Kind> form = opcode.form();
        if (args.size() != form.size()) {
            throw new ProgramParseException(line,
                    String.format("%s expects %d operand(s) but got %d", opcode, form.size(), args.size()));
        }

        List<Operand> operands = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            Operand operand = switch (form.get(i)) {
                case REGISTER -> new Operand.Register(parseRegister(arg, line));
                case MEMORY -> parseMemoryReference(arg, line);
                case IMMEDIATE -> opcode.isControlTransfer()
                        ? new Operand.Immediate(parseOffset(arg, index, labels, line))
                        : new Operand.Immediate(parseNumber(arg, line));
            };
            operands.add(operand);
        }
        return new Instruction(index, opcode, operands, text.replaceAll("\\s+", " "));
    }

    private static List<String> splitOperands(String text) {
        // operands themselves never contain commas or blanks
        return Arrays.stream(text.split("[,\\s]+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private static int parseRegister(String token, SourceLine line) {
        Matcher matcher = REGISTER.matcher(token.strip());
        if (!matcher.matches()) {
            throw new ProgramParseException(line, "expected a register but got '" + token + "'");
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new ProgramParseException(line, "register number out of range: '" + token + "'");
        }
    }

    private static Operand.MemoryReference parseMemoryReference(String token, SourceLine line) {
        Matcher matcher = MEMORY_REFERENCE.matcher(token.strip());
        if (!matcher.matches()) {
            throw new ProgramParseException(line, "expected a memory reference like 4(R2) but got '" + token + "'");
        }
        String displacement = matcher.group(1).strip();
        int value = displacement.isEmpty() ? 0 : parseNumber(displacement, line);
        return new Operand.MemoryReference(value, parseRegister(matcher.group(2), line));
    }

    private static int parseOffset(String token, int index, Map<String, Integer> labels, SourceLine line) {
        if (LABEL_NAME.matcher(token).matches()) {
            Integer target = labels.get(token.toUpperCase(Locale.ROOT));
            if (target == null) {
                throw new ProgramParseException(line, "unknown label '" + token + "'");
            }
            return target - (index + 1);
        }
        return parseNumber(token, line);
    }

    static int parseNumber(String token, SourceLine line) {
        String text = token.strip();
        boolean negative = text.startsWith("-");
        if (negative || text.startsWith("+")) {
            text = text.substring(1);
        }
        try {
            int value;
            if (text.startsWith("0x") || text.startsWith("0X")) {
                value = Integer.parseInt(text.substring(2), 16);
            } else {
                value = Integer.parseInt(text);
            }
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            throw new ProgramParseException(line, "expected a number but got '" + token + "'");
        }
    }

    private static String stripComment(String content) {
        String text = content;
        int hash = text.indexOf('#');
        if (hash >= 0) {
            text = text.substring(0, hash);
        }
        int semicolon = text.indexOf(';');
        if (semicolon >= 0) {
            text = text.substring(0, semicolon);
        }
        return text.strip();
    }

    private static boolean isOpcode(String name) {
        for (Opcode opcode : Opcode.values()) {
            if (opcode.name().equals(name)) {
                return true;
            }
        }
        return false;
    }
}

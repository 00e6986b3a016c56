package org.tomasim.assembler;

/**
 * One line of program source with its origin, passed through both parser passes.
 */
public record SourceLine(
        String content,
        int lineNumber,
        String fileName
) {}

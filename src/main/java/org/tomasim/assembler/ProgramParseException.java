package org.tomasim.assembler;

/**
 * Thrown when program source cannot be turned into instructions.
 * Carries the file name, line number and the offending line.
 */
public class ProgramParseException extends RuntimeException {
    private final String fileName;
    private final int lineNumber;
    private final String reason;
    private final String offendingLine;

    public ProgramParseException(String fileName, int lineNumber, String reason, String offendingLine) {
        super(String.format("Parse error [%s:%d]: %s", fileName, lineNumber, reason));
        this.fileName = fileName;
        this.lineNumber = lineNumber;
        this.reason = reason;
        this.offendingLine = offendingLine;
    }

    ProgramParseException(SourceLine line, String reason) {
        this(line.fileName(), line.lineNumber(), reason, line.content());
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return The reason without the location prefix.
     */
    public String getReason() {
        return reason;
    }

    public String getOffendingLine() {
        return offendingLine;
    }

    /**
     * Returns a multi-line message for console output.
     * @return The formatted message.
     */
    public String getFormattedMessage() {
        return String.format("%s:%d: %s%n    %s", fileName, lineNumber, reason, offendingLine.strip());
    }
}

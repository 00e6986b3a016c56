package org.tomasim.cli.commands;

/**
 * Report formats of the {@code run} command.
 */
public enum OutputFormat {
    TABLE,
    JSON
}

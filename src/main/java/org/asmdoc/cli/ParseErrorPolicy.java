package org.asmdoc.cli;

/**
 * What a run does when some input files cannot be read or parsed.
 */
public enum ParseErrorPolicy {
    /** Report every failure and write no documentation. */
    ABORT,
    /** Report every failure and document the files that loaded. */
    SKIP
}

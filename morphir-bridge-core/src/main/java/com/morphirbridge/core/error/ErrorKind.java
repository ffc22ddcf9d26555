package com.morphirbridge.core.error;

/**
 * Classification of every failure the IR pipeline can report.
 */
public enum ErrorKind {
    NOT_FOUND,
    UNRECOGNIZED_FORMAT,
    PARSE_ERROR,
    MIGRATION_UNSUPPORTED,
    INCOMPLETE_DEFINITION,
    IO_ERROR
}

package com.reasons.parser;

import java.util.Locale;

/**
 * A recorded front-end error.
 *
 * @param kind    Error category
 * @param message Human-readable message
 * @param line    1-based line
 * @param column  1-based column
 */
public record Diagnostic(ErrorKind kind, String message, int line, int column) {

    @Override
    public String toString() {
        return "[" + line + ":" + column + "] " + kind.name().toLowerCase(Locale.ROOT) + " error: " + message;
    }
}

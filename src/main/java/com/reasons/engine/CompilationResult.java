package com.reasons.engine;

import com.reasons.lexer.LexerStatistics;
import com.reasons.parser.Diagnostic;

import java.util.List;

/**
 * Result of loading a rules source.
 *
 * @param treeNames   Trees installed by the load, empty on failure
 * @param diagnostics Front-end errors, empty on success
 * @param statistics  Lexer statistics of the source
 */
public record CompilationResult(List<String> treeNames, List<Diagnostic> diagnostics, LexerStatistics statistics) {

    public CompilationResult {
        treeNames = List.copyOf(treeNames);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean succeeded() {
        return diagnostics.isEmpty();
    }
}

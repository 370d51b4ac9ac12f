package com.reasons.parser;

import com.reasons.ast.AstNode;
import com.reasons.lexer.LexerStatistics;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing a source text.
 *
 * @param root        Program node, null when any error was reported
 * @param diagnostics All reported errors in source order
 * @param statistics  Lexer statistics at the end of the parse
 */
public record ParseResult(AstNode root, List<Diagnostic> diagnostics, LexerStatistics statistics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<AstNode> program() {
        return Optional.ofNullable(root);
    }

    public boolean succeeded() {
        return root != null;
    }
}

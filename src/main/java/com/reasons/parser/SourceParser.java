package com.reasons.parser;

import com.reasons.ast.AstNode;
import com.reasons.lexer.Lexer;
import com.reasons.lexer.LexerOptions;

import java.util.Optional;

/**
 * Entry point for turning source text into a syntax tree.
 */
public final class SourceParser {

    private SourceParser() {
    }

    public static ParseResult parse(String source) {
        return parse(source, LexerOptions.defaults());
    }

    /**
     * Parse a complete program.
     *
     * @param source  Program text
     * @param options Lexer options
     * @return result holding the program or the diagnostics
     */
    public static ParseResult parse(String source, LexerOptions options) {
        Lexer lexer = new Lexer(source, options);
        Parser parser = new Parser(lexer);
        Optional<AstNode> program = parser.parse();
        return new ParseResult(program.orElse(null), parser.diagnostics(), lexer.statistics());
    }

    /**
     * Parse a single expression such as {@code a or b and c}.
     */
    public static ParseResult parseExpression(String source, LexerOptions options) {
        Lexer lexer = new Lexer(source, options);
        Parser parser = new Parser(lexer);
        Optional<AstNode> expression = parser.parseStandaloneExpression();
        return new ParseResult(expression.orElse(null), parser.diagnostics(), lexer.statistics());
    }
}

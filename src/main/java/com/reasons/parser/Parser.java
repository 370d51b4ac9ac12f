package com.reasons.parser;

import com.reasons.ast.AstNode;
import com.reasons.ast.AstNodeType;
import com.reasons.ast.AstValidator;
import com.reasons.ast.ChainType;
import com.reasons.ast.ConsequenceType;
import com.reasons.ast.Operator;
import com.reasons.lexer.Lexer;
import com.reasons.lexer.LexerContext;
import com.reasons.lexer.Token;
import com.reasons.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for rule programs with precedence climbing for
 * expressions.
 * <p>
 * Grammar:
 * <pre>
 * program     := (rule | statement | separator)*
 * rule        := 'rule' IDENT '{' (statement | separator)* '}'
 * statement   := decision | when | IDENT 'when' expression | consequence
 * decision    := 'if' expression ('then' | '=>') consequence ['else' consequence] 'end'
 * when        := 'when' expression 'do' consequence
 * consequence := decision | 'return' [expression] | item (('>>' | 'seq' | 'par') item)*
 * item        := shorthand | expression
 * separator   := ';' | NEWLINE
 * </pre>
 * Errors never escape as exceptions. The first error of a region switches on
 * panic mode, which suppresses further reports until a statement boundary
 * ({@code ;}, newline in golf mode, {@code end} or {@code }}) is reached.
 * A decision that fails skips ahead to its own {@code end}, so enclosing
 * decisions resume after it.
 */
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /**
     * Maximum number of nested expression parses.
     */
    public static final int MAX_EXPRESSION_DEPTH = 256;

    /**
     * Maximum number of decisions open at once.
     */
    public static final int MAX_DECISION_NESTING = 256;

    private final Lexer lexer;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private Token current;
    private Token previous;
    private boolean panicMode;
    private int depth;
    private int nesting;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Parse the whole token stream into a program node.
     *
     * @return the program, or empty if any error was reported
     */
    public Optional<AstNode> parse() {
        advance();
        AstNode program = AstNode.program().at(1, 1);

        skipSeparators();
        while (!check(TokenType.EOF)) {
            Token before = current;
            if (check(TokenType.RBRACE)) {
                errorAtCurrent(ErrorKind.SYNTAX, "Unexpected '}' outside of a rule");
                advance();
            } else {
                AstNode declaration = check(TokenType.RULE) ? parseRule() : parseStatement();
                if (declaration != null && checkDepth(declaration, AstValidator.MAX_DEPTH - 1)) {
                    program.addChild(declaration);
                }
            }
            if (panicMode) {
                synchronize();
            }
            ensureProgress(before);
            skipSeparators();
        }

        if (hadError()) {
            log.debug("Parse failed with {} error(s)", diagnostics.size());
            return Optional.empty();
        }
        log.debug("Parsed program with {} declaration(s)", program.childCount());
        return Optional.of(program);
    }

    /**
     * Parse the token stream as a single expression.
     *
     * @return the expression, or empty if any error was reported
     */
    public Optional<AstNode> parseStandaloneExpression() {
        advance();
        AstNode expression = parseExpression(Precedence.ASSIGNMENT);
        skipSeparators();
        if (expression != null && !check(TokenType.EOF)) {
            errorAtCurrent(ErrorKind.SYNTAX, "Unexpected '" + current.text() + "' after expression");
        }
        if (expression != null && !hadError()) {
            checkDepth(expression, AstValidator.MAX_DEPTH);
        }
        return hadError() ? Optional.empty() : Optional.ofNullable(expression);
    }

    public boolean hadError() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public Optional<Diagnostic> lastDiagnostic() {
        return diagnostics.isEmpty() ? Optional.empty() : Optional.of(diagnostics.get(diagnostics.size() - 1));
    }

    // ---- declarations and statements ----

    private AstNode parseRule() {
        Token keyword = advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected rule name after 'rule'");
        if (name == null) {
            return null;
        }
        skipNewlines();
        if (consume(TokenType.LBRACE, "Expected '{' after rule name") == null) {
            return null;
        }

        AstNode body = AstNode.block().at(previous.line(), previous.column());
        LexerContext saved = enterContext(LexerContext.RULE_BODY);
        try {
            skipSeparators();
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                Token before = current;
                AstNode statement = parseStatement();
                if (statement != null) {
                    body.addChild(statement);
                }
                if (panicMode) {
                    synchronize();
                }
                ensureProgress(before);
                skipSeparators();
            }
        } finally {
            restoreContext(saved);
        }

        if (consume(TokenType.RBRACE, "Expected '}' after rule body") == null) {
            return null;
        }
        log.trace("Parsed rule '{}' with {} statement(s)", name.text(), body.childCount());
        return AstNode.rule(name.text(), body).at(keyword.line(), keyword.column());
    }

    private AstNode parseStatement() {
        if (check(TokenType.IF)) {
            return parseDecision();
        }
        if (check(TokenType.WHEN)) {
            return parseWhen();
        }
        if (check(TokenType.IDENTIFIER) && lexer.peekToken(0).is(TokenType.WHEN)) {
            return parsePostfixWhen();
        }
        if (check(TokenType.RULE)) {
            errorAtCurrent(ErrorKind.SYNTAX, "Rule declarations cannot be nested");
            return null;
        }

        LexerContext saved = enterContext(LexerContext.CONSEQUENCE);
        try {
            return parseConsequence(null);
        } finally {
            restoreContext(saved);
        }
    }

    private AstNode parseDecision() {
        if (nesting >= MAX_DECISION_NESTING) {
            errorAtCurrent(ErrorKind.STRUCTURAL, "Decisions nested too deeply");
            skipDecision(0);
            return null;
        }
        nesting++;
        try {
            AstNode decision = parseDecisionBody();
            if (decision == null) {
                skipDecision(1);
            }
            return decision;
        } finally {
            nesting--;
        }
    }

    private AstNode parseDecisionBody() {
        Token keyword = current;
        LexerContext saved = enterContext(LexerContext.CONDITION);
        try {
            advance(); // 'if'
            AstNode condition = parseExpression(Precedence.ASSIGNMENT);
            if (condition == null) {
                return null;
            }
            skipNewlines();
            if (!check(TokenType.THEN) && !check(TokenType.IMPLIES)) {
                errorAtCurrent(ErrorKind.SYNTAX, "Expected 'then' after condition");
                return null;
            }

            enterContext(LexerContext.CONSEQUENCE);
            Token then = advance();
            skipNewlines();
            AstNode trueBranch = parseConsequence(then);
            if (trueBranch == null) {
                return null;
            }
            skipNewlines();

            AstNode falseBranch = null;
            if (check(TokenType.ELSE)) {
                Token otherwise = advance();
                skipNewlines();
                falseBranch = parseConsequence(otherwise);
                if (falseBranch == null) {
                    return null;
                }
                skipNewlines();
            }

            restoreContext(saved);
            if (consume(TokenType.END, "Expected 'end' to close 'if'") == null) {
                return null;
            }
            return AstNode.decision(condition, trueBranch, falseBranch).at(keyword.line(), keyword.column());
        } finally {
            restoreContext(saved);
        }
    }

    private AstNode parseWhen() {
        Token keyword = current;
        LexerContext saved = enterContext(LexerContext.CONDITION);
        nesting++;
        try {
            advance(); // 'when'
            AstNode condition = parseExpression(Precedence.ASSIGNMENT);
            if (condition == null) {
                return null;
            }
            skipNewlines();
            if (!check(TokenType.DO)) {
                errorAtCurrent(ErrorKind.SYNTAX, "Expected 'do' after condition");
                return null;
            }
            enterContext(LexerContext.CONSEQUENCE);
            Token doToken = advance();
            skipNewlines();
            AstNode action = parseConsequence(doToken);
            if (action == null) {
                return null;
            }
            return AstNode.decision(condition, action, null).at(keyword.line(), keyword.column());
        } finally {
            nesting--;
            restoreContext(saved);
        }
    }

    /**
     * {@code action when condition}
     */
    private AstNode parsePostfixWhen() {
        Token action = advance();
        LexerContext saved = enterContext(LexerContext.CONDITION);
        try {
            advance(); // 'when'
            AstNode condition = parseExpression(Precedence.ASSIGNMENT);
            if (condition == null) {
                return null;
            }
            AstNode consequence = AstNode.consequence(ConsequenceType.ACTION, action.text())
                    .at(action.line(), action.column());
            return AstNode.decision(condition, consequence, null).at(action.line(), action.column());
        } finally {
            restoreContext(saved);
        }
    }

    /**
     * Parse a consequence. The caller has put the lexer in consequence context.
     *
     * @param introducer Keyword that requires the consequence, or null at statement level
     */
    private AstNode parseConsequence(Token introducer) {
        if (check(TokenType.IF)) {
            return parseDecision();
        }
        if (check(TokenType.RETURN)) {
            Token keyword = advance();
            AstNode value = null;
            if (startsExpression(current.type())) {
                value = parseExpression(Precedence.ASSIGNMENT);
                if (value == null) {
                    return null;
                }
            }
            return AstNode.returnValue(value).at(keyword.line(), keyword.column());
        }
        if (!startsExpression(current.type())) {
            if (introducer != null) {
                errorAt(introducer, ErrorKind.SYNTAX, "Expected consequence after '" + introducer.text() + "'");
            } else {
                errorAtCurrent(ErrorKind.SYNTAX, "Expected statement");
            }
            return null;
        }

        AstNode first = parseConsequenceItem();
        if (first == null) {
            return null;
        }
        ChainType chainType = chainType(current.type());
        if (chainType == null) {
            return first;
        }

        AstNode chain = AstNode.chain(chainType).at(current.line(), current.column());
        chain.addChild(first);
        while (chainType(current.type()) != null) {
            if (chainType(current.type()) != chainType) {
                errorAtCurrent(ErrorKind.SYNTAX, "Cannot mix '" + chainType.symbol()
                        + "' with '" + current.text() + "' in one chain");
                return null;
            }
            advance();
            AstNode next = parseConsequenceItem();
            if (next == null) {
                return null;
            }
            chain.addChild(next);
        }
        return chain;
    }

    private AstNode parseConsequenceItem() {
        AstNode expression = parseExpression(Precedence.ASSIGNMENT);
        if (expression != null && expression.is(AstNodeType.IDENTIFIER)) {
            return AstNode.consequence(ConsequenceType.ACTION, expression.text())
                    .at(expression.line(), expression.column());
        }
        return expression;
    }

    // ---- expressions ----

    private AstNode parseExpression(Precedence minimum) {
        if (depth >= MAX_EXPRESSION_DEPTH) {
            errorAtCurrent(ErrorKind.STRUCTURAL, "Expression too complex");
            return null;
        }
        depth++;
        try {
            AstNode left = parsePrefix();
            while (left != null) {
                Precedence precedence = Precedence.of(current.type());
                if (precedence == Precedence.NONE || precedence.compareTo(minimum) < 0) {
                    break;
                }
                left = parseInfix(left, precedence);
            }
            return left;
        } finally {
            depth--;
        }
    }

    private AstNode parsePrefix() {
        Token token = current;
        switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                return AstNode.literal(token.literal()).at(token.line(), token.column());
            }
            case TRUE, FALSE -> {
                advance();
                return AstNode.literal(token.is(TokenType.TRUE)).at(token.line(), token.column());
            }
            case NULL -> {
                advance();
                return AstNode.literal(null).at(token.line(), token.column());
            }
            case IDENTIFIER -> {
                advance();
                return AstNode.identifier(token.text()).at(token.line(), token.column());
            }
            case LPAREN -> {
                advance();
                AstNode inner = parseExpression(Precedence.ASSIGNMENT);
                if (inner == null) {
                    return null;
                }
                if (consume(TokenType.RPAREN, "Expected ')' after expression") == null) {
                    return null;
                }
                return inner;
            }
            case NOT -> {
                advance();
                AstNode operand = parseExpression(Precedence.UNARY);
                return operand == null ? null : AstNode.not(operand).at(token.line(), token.column());
            }
            case MINUS -> {
                advance();
                AstNode operand = parseExpression(Precedence.UNARY);
                return operand == null ? null : AstNode.negate(operand).at(token.line(), token.column());
            }
            case WIN, LOSE, DRAW, SKIP, PASS, FAIL -> {
                if (lexer.getContext() != LexerContext.CONSEQUENCE) {
                    errorAtCurrent(ErrorKind.SYNTAX, "'" + token.text() + "' is only allowed as a consequence");
                    return null;
                }
                advance();
                return AstNode.consequence(shorthand(token.type()), null).at(token.line(), token.column());
            }
            default -> {
                errorAtCurrent(ErrorKind.SYNTAX, "Expected expression");
                return null;
            }
        }
    }

    private AstNode parseInfix(AstNode left, Precedence precedence) {
        Token operator = advance();
        switch (operator.type()) {
            case ASSIGN -> {
                if (!left.is(AstNodeType.IDENTIFIER)) {
                    errorAt(operator, ErrorKind.SYNTAX, "Invalid assignment target");
                    return null;
                }
                AstNode value = parseExpression(Precedence.ASSIGNMENT);
                return value == null ? null : AstNode.assignment(left.text(), value).at(left.line(), left.column());
            }
            case QUESTION -> {
                AstNode whenTrue = parseExpression(Precedence.ASSIGNMENT);
                if (whenTrue == null) {
                    return null;
                }
                if (consume(TokenType.COLON, "Expected ':' in conditional expression") == null) {
                    return null;
                }
                AstNode whenFalse = parseExpression(Precedence.TERNARY);
                if (whenFalse == null) {
                    return null;
                }
                return AstNode.decision(left, whenTrue, whenFalse).at(operator.line(), operator.column());
            }
            case LPAREN -> {
                return parseCall(left, operator);
            }
            case DOT -> {
                Token property = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
                if (property == null) {
                    return null;
                }
                return AstNode.propertyAccess(left, property.text()).at(operator.line(), operator.column());
            }
            default -> {
                AstNode right = parseExpression(precedence.next());
                if (right == null) {
                    return null;
                }
                return binary(operator, left, right);
            }
        }
    }

    private AstNode parseCall(AstNode callee, Token paren) {
        if (!callee.is(AstNodeType.IDENTIFIER)) {
            errorAt(paren, ErrorKind.SYNTAX, "Only named functions can be called");
            return null;
        }
        AstNode call = AstNode.call(callee.text()).at(callee.line(), callee.column());
        if (!check(TokenType.RPAREN)) {
            do {
                AstNode argument = parseExpression(Precedence.ASSIGNMENT);
                if (argument == null) {
                    return null;
                }
                call.addChild(argument);
            } while (match(TokenType.COMMA));
        }
        if (consume(TokenType.RPAREN, "Expected ')' after arguments") == null) {
            return null;
        }
        return call;
    }

    private AstNode binary(Token operator, AstNode left, AstNode right) {
        int line = operator.line();
        int column = operator.column();
        return switch (operator.type()) {
            case AND -> AstNode.logic(Operator.AND, left, right).at(line, column);
            case OR -> AstNode.logic(Operator.OR, left, right).at(line, column);
            case EQ -> AstNode.comparison(Operator.EQ, left, right).at(line, column);
            case NE -> AstNode.comparison(Operator.NE, left, right).at(line, column);
            case LT -> AstNode.comparison(Operator.LT, left, right).at(line, column);
            case LE -> AstNode.comparison(Operator.LE, left, right).at(line, column);
            case GT -> AstNode.comparison(Operator.GT, left, right).at(line, column);
            case GE -> AstNode.comparison(Operator.GE, left, right).at(line, column);
            case PLUS -> AstNode.arithmetic(Operator.ADD, left, right).at(line, column);
            case MINUS -> AstNode.arithmetic(Operator.SUBTRACT, left, right).at(line, column);
            case STAR -> AstNode.arithmetic(Operator.MULTIPLY, left, right).at(line, column);
            case SLASH -> AstNode.arithmetic(Operator.DIVIDE, left, right).at(line, column);
            case PERCENT -> AstNode.arithmetic(Operator.MODULO, left, right).at(line, column);
            case CARET -> AstNode.arithmetic(Operator.POWER, left, right).at(line, column);
            default -> throw new IllegalStateException("Not a binary operator: " + operator.type());
        };
    }

    private static ConsequenceType shorthand(TokenType type) {
        return switch (type) {
            case WIN -> ConsequenceType.WIN;
            case LOSE -> ConsequenceType.LOSE;
            case DRAW -> ConsequenceType.DRAW;
            case SKIP -> ConsequenceType.SKIP;
            case PASS -> ConsequenceType.PASS;
            case FAIL -> ConsequenceType.FAIL;
            default -> throw new IllegalStateException("Not a consequence keyword: " + type);
        };
    }

    private static ChainType chainType(TokenType type) {
        return switch (type) {
            case CHAIN, SEQUENCE -> ChainType.SEQUENTIAL;
            case PARALLEL -> ChainType.PARALLEL;
            default -> null;
        };
    }

    private static boolean startsExpression(TokenType type) {
        return switch (type) {
            case NUMBER, STRING, TRUE, FALSE, NULL, IDENTIFIER, LPAREN, NOT, MINUS,
                 WIN, LOSE, DRAW, SKIP, PASS, FAIL -> true;
            default -> false;
        };
    }

    // ---- context ----

    private LexerContext enterContext(LexerContext context) {
        LexerContext saved = lexer.getContext();
        lexer.setContext(context);
        current = lexer.interpret(current);
        return saved;
    }

    private void restoreContext(LexerContext saved) {
        lexer.setContext(saved);
    }

    // ---- recovery ----

    private void synchronize() {
        while (!check(TokenType.EOF)) {
            if (check(TokenType.SEMICOLON) || check(TokenType.NEWLINE) || check(TokenType.END)) {
                advance();
                break;
            }
            if (check(TokenType.RBRACE)) {
                break;
            }
            lexer.synchronize();
            advance();
        }
        panicMode = false;
    }

    /**
     * Skip past the {@code end} that closes a failed decision. Stops early at
     * {@code }}, at end of input, or at a {@code ;} outside any inner decision.
     *
     * @param open Number of decisions already entered whose {@code end} is pending
     */
    private void skipDecision(int open) {
        while (!check(TokenType.EOF) && !check(TokenType.RBRACE)) {
            if (check(TokenType.END)) {
                advance();
                if (--open <= 0) {
                    return;
                }
                continue;
            }
            if (check(TokenType.IF)) {
                open++;
            } else if (check(TokenType.SEMICOLON) && open == 1) {
                return;
            }
            advance();
        }
    }

    private boolean checkDepth(AstNode node, int maxDepth) {
        AstValidator.Result result = AstValidator.validate(node, maxDepth);
        if (result.valid()) {
            return true;
        }
        report(ErrorKind.STRUCTURAL, result.message(), node.line(), node.column());
        return false;
    }

    private void ensureProgress(Token before) {
        if (current == before && !check(TokenType.EOF)) {
            advance();
        }
    }

    private void skipSeparators() {
        while (match(TokenType.SEMICOLON, TokenType.NEWLINE)) {
            // separators carry no meaning between statements
        }
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // newlines inside a decision are layout
        }
    }

    // ---- token helpers ----

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        errorAtCurrent(ErrorKind.SYNTAX, message);
        return null;
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private Token advance() {
        previous = current;
        while (true) {
            current = lexer.nextToken();
            if (current.is(TokenType.ERROR)) {
                errorAt(current, ErrorKind.LEXICAL, current.text());
            } else if (!current.is(TokenType.COMMENT)) {
                break;
            }
        }
        return previous;
    }

    private void errorAtCurrent(ErrorKind kind, String message) {
        errorAt(current, kind, message);
    }

    private void errorAt(Token token, ErrorKind kind, String message) {
        if (panicMode) {
            return;
        }
        panicMode = true;
        report(kind, message, token.line(), token.column());
    }

    private void report(ErrorKind kind, String message, int line, int column) {
        Diagnostic diagnostic = new Diagnostic(kind, message, line, column);
        diagnostics.add(diagnostic);
        log.debug("{}", diagnostic);
    }
}

package com.reasons.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

import static com.reasons.lexer.LexerConfig.*;

/**
 * On-demand tokenizer for rule source text.
 * <p>
 * Tokens are scanned lazily; at most {@link LexerConfig#LOOKAHEAD} scanned but
 * undelivered tokens are buffered. Context-dependent promotions are applied at
 * delivery time, so the context set by the parser governs buffered tokens too.
 * Malformed input yields {@link TokenType#ERROR} tokens, never exceptions.
 */
public final class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final int length;
    private final LexerOptions options;

    private int pos;
    private int line = 1;
    private int column = 1;

    private LexerContext context = LexerContext.DEFAULT;

    private final Token[] ring = new Token[LOOKAHEAD];
    private int ringHead;
    private int ringSize;

    private long tokensProduced;
    private long errorCount;
    private String lastError;

    public Lexer(String source) {
        this(source, LexerOptions.defaults());
    }

    public Lexer(String source, LexerOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
        this.length = source.length();
    }

    /**
     * Consume and return the next token.
     */
    public Token nextToken() {
        Token raw;
        if (ringSize > 0) {
            raw = ring[ringHead];
            ring[ringHead] = null;
            ringHead = (ringHead + 1) % LOOKAHEAD;
            ringSize--;
        } else {
            raw = scan();
        }
        return interpret(raw);
    }

    /**
     * Inspect a token ahead of the current position without consuming it.
     *
     * @param offset 0 for the next token, up to {@code LOOKAHEAD - 1}
     */
    public Token peekToken(int offset) {
        if (offset < 0 || offset >= LOOKAHEAD) {
            throw new IllegalArgumentException("Lookahead offset must be between 0 and "
                    + (LOOKAHEAD - 1) + ": " + offset);
        }
        while (ringSize <= offset) {
            ring[(ringHead + ringSize) % LOOKAHEAD] = scan();
            ringSize++;
        }
        return interpret(ring[(ringHead + offset) % LOOKAHEAD]);
    }

    public boolean atEnd() {
        return peekToken(0).is(TokenType.EOF);
    }

    /**
     * Discard tokens until a statement boundary ({@code ;}, newline in golf
     * mode, {@code end}, {@code }}) or end of input is next.
     *
     * @return number of discarded tokens
     */
    public int synchronize() {
        int discarded = 0;
        while (!SYNC_TOKENS.contains(peekToken(0).type())) {
            nextToken();
            discarded++;
        }
        log.trace("Lexer resynchronized after discarding {} tokens", discarded);
        return discarded;
    }

    public LexerContext getContext() {
        return context;
    }

    public void setContext(LexerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public long errorCount() {
        return errorCount;
    }

    /**
     * Message of the most recent error token, or null.
     */
    public String lastError() {
        return lastError;
    }

    public LexerStatistics statistics() {
        return new LexerStatistics(tokensProduced, errorCount, pos, length, line, column);
    }

    /**
     * Apply the current context to an already delivered token. Used by the
     * parser when it switches context with a token in hand.
     */
    public Token interpret(Token token) {
        if (options.golfMode()
                && context == LexerContext.CONSEQUENCE
                && token.is(TokenType.IDENTIFIER)) {
            TokenType promoted = GOLF_CONSEQUENCES.get(token.text());
            if (promoted != null) {
                return token.withType(promoted);
            }
        }
        return token;
    }

    // ---- scanning ----

    private Token scan() {
        Token token = scanToken();
        tokensProduced++;
        return token;
    }

    private Token scanToken() {
        Token layout = skipWhitespaceAndComments();
        if (layout != null) {
            return layout;
        }

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, column, 0);
        }

        int start = pos;
        int startLine = line;
        int startColumn = column;
        char c = advance();

        switch (c) {
            case Operators.NEWLINE -> {
                return make(TokenType.NEWLINE, start, startLine, startColumn);
            }
            case Operators.LEFT_PAREN -> {
                return make(TokenType.LPAREN, start, startLine, startColumn);
            }
            case Operators.RIGHT_PAREN -> {
                return make(TokenType.RPAREN, start, startLine, startColumn);
            }
            case Operators.LEFT_BRACE -> {
                return make(TokenType.LBRACE, start, startLine, startColumn);
            }
            case Operators.RIGHT_BRACE -> {
                return make(TokenType.RBRACE, start, startLine, startColumn);
            }
            case Operators.COMMA -> {
                return make(TokenType.COMMA, start, startLine, startColumn);
            }
            case Operators.SEMICOLON -> {
                return make(TokenType.SEMICOLON, start, startLine, startColumn);
            }
            case Operators.QUESTION -> {
                return make(TokenType.QUESTION, start, startLine, startColumn);
            }
            case Operators.COLON -> {
                return make(TokenType.COLON, start, startLine, startColumn);
            }
            case Operators.PLUS -> {
                return make(TokenType.PLUS, start, startLine, startColumn);
            }
            case Operators.MINUS -> {
                return make(TokenType.MINUS, start, startLine, startColumn);
            }
            case Operators.STAR -> {
                return make(TokenType.STAR, start, startLine, startColumn);
            }
            case Operators.SLASH -> {
                return make(TokenType.SLASH, start, startLine, startColumn);
            }
            case Operators.PERCENT -> {
                return make(TokenType.PERCENT, start, startLine, startColumn);
            }
            case Operators.CARET -> {
                return make(TokenType.CARET, start, startLine, startColumn);
            }
            case Operators.EQUALS -> {
                if (match(Operators.EQUALS)) {
                    return make(TokenType.EQ, start, startLine, startColumn);
                }
                if (match(Operators.GREATER)) {
                    if (!options.golfMode()) {
                        return error("Shorthand operator '=>' requires golf mode",
                                start, startLine, startColumn);
                    }
                    return make(TokenType.IMPLIES, start, startLine, startColumn);
                }
                return make(TokenType.ASSIGN, start, startLine, startColumn);
            }
            case Operators.BANG -> {
                TokenType type = match(Operators.EQUALS) ? TokenType.NE : TokenType.NOT;
                return make(type, start, startLine, startColumn);
            }
            case Operators.LESS -> {
                TokenType type = match(Operators.EQUALS) ? TokenType.LE : TokenType.LT;
                return make(type, start, startLine, startColumn);
            }
            case Operators.GREATER -> {
                if (match(Operators.GREATER)) {
                    return make(TokenType.CHAIN, start, startLine, startColumn);
                }
                TokenType type = match(Operators.EQUALS) ? TokenType.GE : TokenType.GT;
                return make(type, start, startLine, startColumn);
            }
            case Operators.AMPERSAND -> {
                if (match(Operators.AMPERSAND)) {
                    return make(TokenType.AND, start, startLine, startColumn);
                }
                return unexpected(c, start, startLine, startColumn);
            }
            case Operators.PIPE -> {
                if (match(Operators.PIPE)) {
                    return make(TokenType.OR, start, startLine, startColumn);
                }
                return unexpected(c, start, startLine, startColumn);
            }
            case Operators.DOT -> {
                if (Character.isDigit(peek())) {
                    return readNumber(start, startLine, startColumn);
                }
                return make(TokenType.DOT, start, startLine, startColumn);
            }
            case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> {
                return readString(c, start, startLine, startColumn);
            }
            default -> {
                if (isIdentifierStart(c)) {
                    return readIdentifierOrKeyword(start, startLine, startColumn);
                }
                if (Character.isDigit(c)) {
                    return readNumber(start, startLine, startColumn);
                }
                return unexpected(c, start, startLine, startColumn);
            }
        }
    }

    /**
     * Skips insignificant layout. Returns a COMMENT token when comments are kept
     * or an ERROR token for an unterminated block comment, otherwise null.
     */
    private Token skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == Operators.NEWLINE) {
                if (options.golfMode()) {
                    return null;
                }
                advance();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else if (c == Operators.HASH
                    || (c == Operators.SLASH && peekNext() == Operators.SLASH)) {
                int start = pos;
                int startLine = line;
                int startColumn = column;
                while (!isAtEnd() && peek() != Operators.NEWLINE) {
                    advance();
                }
                if (!options.skipComments()) {
                    return make(TokenType.COMMENT, start, startLine, startColumn);
                }
            } else if (c == Operators.SLASH && peekNext() == Operators.STAR) {
                int start = pos;
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                boolean closed = false;
                while (!isAtEnd()) {
                    if (peek() == Operators.STAR && peekNext() == Operators.SLASH) {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    return error("Unterminated block comment", start, startLine, startColumn);
                }
                if (!options.skipComments()) {
                    return make(TokenType.COMMENT, start, startLine, startColumn);
                }
            } else {
                return null;
            }
        }
        return null;
    }

    private Token readIdentifierOrKeyword(int start, int startLine, int startColumn) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = source.substring(start, pos);
        String key = options.caseSensitive() ? text : text.toLowerCase(Locale.ROOT);

        TokenType keyword = KEYWORDS.get(key);
        if (keyword == null && options.golfMode()) {
            keyword = GOLF_KEYWORDS.get(text);
        }
        if (keyword != null) {
            return make(keyword, start, startLine, startColumn);
        }
        return new Token(TokenType.IDENTIFIER, text, text, startLine, startColumn, pos - start);
    }

    private Token readNumber(int start, int startLine, int startColumn) {
        char first = source.charAt(start);
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            return readRadixNumber(start, startLine, startColumn, 16);
        }
        if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            return readRadixNumber(start, startLine, startColumn, 2);
        }

        boolean seenDot = first == Operators.DOT;
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isDigit(c)) {
                advance();
            } else if (c == Operators.DOT && !seenDot && Character.isDigit(peekNext())) {
                seenDot = true;
                advance();
            } else {
                break;
            }
        }

        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            boolean signed = next == Operators.PLUS || next == Operators.MINUS;
            char digit = signed ? peekAt(2) : next;
            if (Character.isDigit(digit)) {
                advance();
                if (signed) {
                    advance();
                }
                while (!isAtEnd() && Character.isDigit(peek())) {
                    advance();
                }
            }
        }

        String text = source.substring(start, pos);
        try {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text),
                    startLine, startColumn, pos - start);
        } catch (NumberFormatException e) {
            return error("Invalid number '" + text + "'", start, startLine, startColumn);
        }
    }

    private Token readRadixNumber(int start, int startLine, int startColumn, int radix) {
        advance(); // x or b
        int digitsStart = pos;
        while (!isAtEnd() && Character.digit(peek(), radix) >= 0) {
            advance();
        }
        String text = source.substring(start, pos);
        if (pos == digitsStart) {
            return error("Invalid number '" + text + "'", start, startLine, startColumn);
        }
        try {
            long value = Long.parseLong(source.substring(digitsStart, pos), radix);
            return new Token(TokenType.NUMBER, text, (double) value, startLine, startColumn, pos - start);
        } catch (NumberFormatException e) {
            return error("Number out of range '" + text + "'", start, startLine, startColumn);
        }
    }

    private Token readString(char quote, int start, int startLine, int startColumn) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'v' -> sb.append('\u000B');
                    case '0' -> sb.append('\0');
                    case '\\', '"', '\'' -> sb.append(escaped);
                    default -> sb.append(c).append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            return error("Unterminated string", start, startLine, startColumn);
        }

        advance(); // closing quote
        String value = sb.toString();
        return new Token(TokenType.STRING, source.substring(start, pos), value,
                startLine, startColumn, pos - start);
    }

    private Token make(TokenType type, int start, int startLine, int startColumn) {
        return new Token(type, source.substring(start, pos), null, startLine, startColumn, pos - start);
    }

    private Token unexpected(char c, int start, int startLine, int startColumn) {
        String message = String.format("Unexpected character '%c' (0x%02X)", c, (int) c);
        return error(message, start, startLine, startColumn);
    }

    private Token error(String message, int start, int startLine, int startColumn) {
        String text = message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
        errorCount++;
        lastError = text;
        log.debug("Lexical error at {}:{}: {}", startLine, startColumn, text);
        return new Token(TokenType.ERROR, text, null, startLine, startColumn, pos - start);
    }

    // ---- character helpers ----

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = pos + distance;
        return index >= length ? '\0' : source.charAt(index);
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == Operators.NEWLINE) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }
}

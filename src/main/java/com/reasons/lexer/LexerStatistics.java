package com.reasons.lexer;

/**
 * Snapshot of lexer progress, used for diagnostics.
 */
public record LexerStatistics(
        long tokensProduced,
        long errors,
        int bytesProcessed,
        int totalBytes,
        int line,
        int column
) {
}

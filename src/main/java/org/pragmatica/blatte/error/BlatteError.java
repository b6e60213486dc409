package org.pragmatica.blatte.error;

import org.pragmatica.blatte.tree.SourceLocation;
import org.pragmatica.blatte.tree.SourceSpan;

/**
 * Compile-time error with source position, one record per failing stage.
 */
public sealed interface BlatteError {
    SourceSpan span();

    String reason();

    default SourceLocation location() {
        return span().start();
    }

    default String message() {
        return reason() + " at " + location();
    }

    /**
     * Lexical error: unterminated string, dangling escape, oversized input.
     */
    record LexError(SourceSpan span, String reason) implements BlatteError {}

    /**
     * Syntax error: malformed special form, unmatched brace, bad identifier, misplaced parameter.
     */
    record ParseError(SourceSpan span, String reason) implements BlatteError {}

    /**
     * Tree that passed parsing but cannot be translated. Indicates a bug in the parser.
     */
    record CodeGenError(SourceSpan span, String reason) implements BlatteError {
        @Override
        public String message() {
            return "Cannot generate code: " + reason + " at " + location();
        }
    }
}

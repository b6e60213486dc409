package org.pragmatica.blatte.error;

import org.pragmatica.blatte.tree.SourceSpan;

/**
 * Thrown when Blatte source cannot be lexed, parsed or translated.
 */
public final class BlatteException extends RuntimeException {
    private final BlatteError error;

    public BlatteException(BlatteError error) {
        super(error.message());
        this.error = error;
    }

    public static BlatteException lex(SourceSpan span, String reason) {
        return new BlatteException(new BlatteError.LexError(span, reason));
    }

    public static BlatteException parse(SourceSpan span, String reason) {
        return new BlatteException(new BlatteError.ParseError(span, reason));
    }

    public static BlatteException codeGen(SourceSpan span, String reason) {
        return new BlatteException(new BlatteError.CodeGenError(span, reason));
    }

    public BlatteError error() {
        return error;
    }

    public SourceSpan span() {
        return error.span();
    }
}

package org.pragmatica.blatte.syntax;

import org.pragmatica.blatte.error.BlatteException;
import org.pragmatica.blatte.tree.SourceLocation;
import org.pragmatica.blatte.tree.SourceSpan;

/**
 * Lexer for Blatte text.
 *
 * <p>Tokens are produced on demand so that a caller parsing one expression out of a larger buffer
 * never scans (or fails on) the text that follows it.
 */
public final class BlatteLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private SourceLocation location;

    private BlatteLexer(String input, SourceLocation origin) {
        this.input = input;
        this.pos = 0;
        this.location = origin;
    }

    /**
     * Create a lexer over {@code input} whose first character sits at {@code origin} of the enclosing document.
     */
    public static BlatteLexer over(String input, SourceLocation origin, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw BlatteException.lex(SourceSpan.at(origin),
                                      "Input exceeds maximum size of " + maxInputSize + " characters");
        }
        return new BlatteLexer(input, origin);
    }

    /**
     * Number of characters consumed so far.
     */
    public int consumed() {
        return pos;
    }

    public BlatteToken next() {
        var start = location;
        if (isAtEnd()) {
            return new BlatteToken.Eof(SourceSpan.at(start));
        }
        char c = peek();
        if (Character.isWhitespace(c)) {
            return scanWhitespace(start);
        }
        if (c == '{') {
            advance();
            return new BlatteToken.Open(span(start));
        }
        if (c == '}') {
            advance();
            return new BlatteToken.Close(span(start));
        }
        if (c == '\\' && !startsEscapedCharacter()) {
            return scanBackslash(start);
        }
        return scanWord(start);
    }

    private BlatteToken scanWhitespace(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            sb.append(advance());
        }
        return new BlatteToken.Whitespace(span(start), sb.toString());
    }

    private BlatteToken scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '{' || c == '}') {
                break;
            }
            if (c == '\\') {
                if (!startsEscapedCharacter()) {
                    break;
                }
                advance();
                // skip backslash
            }
            sb.append(advance());
        }
        return new BlatteToken.Word(span(start), sb.toString());
    }

    private BlatteToken scanBackslash(SourceLocation start) {
        advance();
        // skip backslash
        if (isAtEnd()) {
            throw BlatteException.lex(span(start), "Dangling '\\' at end of input");
        }
        char c = peek();
        return switch (c) {
            case '"' -> scanString(start);
            case ';' -> scanComment(start);
            case '/' -> {
                advance();
                yield new BlatteToken.ForgetWhitespace(span(start));
            }
            case '=' -> {
                advance();
                yield new BlatteToken.NamedParameter(span(start), scanIdentifier(start));
            }
            case '&' -> {
                advance();
                yield new BlatteToken.RestParameter(span(start), scanIdentifier(start));
            }
            default -> {
                var name = scanIdentifier(start);
                if (!isAtEnd() && peek() == '=') {
                    advance();
                    yield new BlatteToken.NamedArgument(span(start), name);
                }
                yield new BlatteToken.Variable(span(start), name);
            }
        };
    }

    private String scanIdentifier(SourceLocation start) {
        if (isAtEnd() || !isIdentifierStart(peek())) {
            var found = isAtEnd() ? "end of input" : "'" + peek() + "'";
            throw BlatteException.parse(span(start), "Bad identifier: expected a letter but found " + found);
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var name = sb.toString();
        // set! and let* are the only names with a trailing punctuation character
        if (!isAtEnd() && (("set".equals(name) && peek() == '!') || ("let".equals(name) && peek() == '*'))) {
            name = name + advance();
        }
        return name;
    }

    private BlatteToken scanString(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            char c = advance();
            if (c != '\\' || isAtEnd()) {
                sb.append(c);
                continue;
            }
            char escaped = peek();
            if (escaped == '"') {
                advance();
                return new BlatteToken.Str(span(start), sb.toString());
            }
            if (escaped == '\\') {
                advance();
            }
            sb.append(c);
        }
        throw BlatteException.lex(span(start), "Unterminated string");
    }

    private BlatteToken scanComment(SourceLocation start) {
        advance();
        // skip ;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            char c = advance();
            sb.append(c);
            if (c == '\n') {
                break;
            }
        }
        return new BlatteToken.Comment(span(start), sb.toString());
    }

    private boolean startsEscapedCharacter() {
        if (pos + 1 >= input.length()) {
            return false;
        }
        char next = input.charAt(pos + 1);
        return next == '\\' || next == '{' || next == '}';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        location = location.next(c);
        return c;
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '_';
    }
}

package org.pragmatica.blatte.error;

import org.pragmatica.blatte.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link BlatteError} against the source it came from.
 *
 * <p>Example output:
 * <pre>
 * parse error: unmatched '}'
 *   --> page.blt:3:15
 *    |
 *  3 | Hello {\b world}}
 *    |                 ^ unmatched '}'
 *    |
 *    = help: escape a literal brace as \}
 * </pre>
 *
 * @param kind    Stage that reported the error
 * @param message Primary message
 * @param span    Source span where the error occurred
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(String kind, String message, SourceSpan span, List<String> notes) {

    public static Diagnostic of(BlatteError error) {
        return new Diagnostic(kindOf(error), error.reason(), error.span(), List.of());
    }

    public static Diagnostic of(BlatteException exception) {
        return of(exception.error());
    }

    private static String kindOf(BlatteError error) {
        if (error instanceof BlatteError.LexError) {
            return "lex error";
        }
        if (error instanceof BlatteError.ParseError) {
            return "parse error";
        }
        return "internal error";
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(kind, message, span, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending line and a caret underline.
     *
     * @param source   The source text the error positions refer to
     * @param filename Optional filename for display, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(kind).append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int gutterWidth = String.valueOf(loc.line()).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineContent))
              .append(" ")
              .append(message)
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    private String underline(String lineContent) {
        int startCol = span.start().column();
        int endCol = span.end().line() == span.start().line()
                     ? span.end().column()
                     : lineContent.length() + 1;
        return " ".repeat(Math.max(0, startCol - 1)) + "^".repeat(Math.max(1, endCol - startCol));
    }

    /**
     * Single-line form: {@code file:line:column: kind: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename, loc.line(), loc.column(), kind, message);
    }
}

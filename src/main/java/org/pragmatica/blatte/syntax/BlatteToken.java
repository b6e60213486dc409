package org.pragmatica.blatte.syntax;

import org.pragmatica.blatte.tree.SourceSpan;

/**
 * Token types produced by {@link BlatteLexer}.
 */
public sealed interface BlatteToken {
    SourceSpan span();

    // Content
    record Whitespace(SourceSpan span, String text) implements BlatteToken {}

    record Word(SourceSpan span, String text) implements BlatteToken {}

    // \"...\"
    record Str(SourceSpan span, String text) implements BlatteToken {}

    // Backslash introducers
    // \name
    record Variable(SourceSpan span, String name) implements BlatteToken {}

    // \name=
    record NamedArgument(SourceSpan span, String name) implements BlatteToken {}

    // \=name
    record NamedParameter(SourceSpan span, String name) implements BlatteToken {}

    // \&name
    record RestParameter(SourceSpan span, String name) implements BlatteToken {}

    // \/
    record ForgetWhitespace(SourceSpan span) implements BlatteToken {}

    // \; up to and including the end of line
    record Comment(SourceSpan span, String text) implements BlatteToken {}

    // Delimiters
    record Open(SourceSpan span) implements BlatteToken {}

    record Close(SourceSpan span) implements BlatteToken {}

    record Eof(SourceSpan span) implements BlatteToken {}
}

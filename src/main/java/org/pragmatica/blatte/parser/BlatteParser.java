package org.pragmatica.blatte.parser;

import org.pragmatica.blatte.error.BlatteException;
import org.pragmatica.blatte.syntax.BlatteLexer;
import org.pragmatica.blatte.syntax.BlatteToken;
import org.pragmatica.blatte.syntax.SpecialForm;
import org.pragmatica.blatte.tree.Node;
import org.pragmatica.blatte.tree.Parameter;
import org.pragmatica.blatte.tree.SourceLocation;
import org.pragmatica.blatte.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for Blatte.
 *
 * <p>Instances hold only their configuration; all per-call state lives in a {@link Session}, so one
 * parser may be shared freely.
 */
public final class BlatteParser implements Parser {
    private static final Logger LOG = LoggerFactory.getLogger(BlatteParser.class);

    private final ParserConfig config;

    private BlatteParser(ParserConfig config) {
        this.config = config;
    }

    public static BlatteParser create() {
        return new BlatteParser(ParserConfig.DEFAULT);
    }

    public static BlatteParser create(ParserConfig config) {
        return new BlatteParser(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public Optional<Node> parse(String input) {
        return parse(SourceCursor.of(input));
    }

    @Override
    public Optional<Node> parse(SourceCursor cursor) {
        var origin = cursor.origin();
        var session = new Session(BlatteLexer.over(cursor.remaining(), origin, config.maxInputSize()));
        var result = session.parseTopLevel();

        result.ifPresent(node -> {
            cursor.consume(node.span().end().offset() - origin.offset());
            LOG.debug("Parsed {} at {}", node.bare().getClass().getSimpleName(), node.bare().span().start());
        });
        return result;
    }

    @Override
    public String skipWhitespace(SourceCursor cursor) {
        var origin = cursor.origin();
        var session = new Session(BlatteLexer.over(cursor.remaining(), origin, config.maxInputSize()));
        var leading = session.skipWhitespace();
        cursor.consume(session.peek().span().start().offset() - origin.offset());
        return leading.whitespace();
    }

    private record Leading(SourceLocation start, String whitespace) {}

    /**
     * State of a single parse call.
     */
    private final class Session {
        private final BlatteLexer lexer;
        private BlatteToken lookahead;
        private int depth;
        // whitespace skipped by peekPastWhitespace, still owed to the next expression
        private Leading pendingWhitespace;
        // span of the most recent closing brace consumed by expectClose
        private SourceSpan lastClose;

        private Session(BlatteLexer lexer) {
            this.lexer = lexer;
        }

        Optional<Node> parseTopLevel() {
            var leading = skipWhitespace();
            if (peek() instanceof BlatteToken.Eof) {
                return Optional.empty();
            }
            return Optional.of(wrap(leading, parseBare(false)));
        }

        // === Expressions ===

        private Node parseExpression() {
            return wrap(skipWhitespace(), parseBare(false));
        }

        private Node parseArgument() {
            return wrap(skipWhitespace(), parseBare(true));
        }

        private Node wrap(Leading leading, Node inner) {
            return new Node.Wrapped(SourceSpan.of(leading.start(), inner.span().end()), leading.whitespace(), inner);
        }

        private Node parseBare(boolean namedArgumentAllowed) {
            var token = advance();

            if (token instanceof BlatteToken.Word word) {
                return new Node.Word(word.span(), word.text());
            }
            if (token instanceof BlatteToken.Str str) {
                return new Node.Str(str.span(), str.text());
            }
            if (token instanceof BlatteToken.Variable variable) {
                return new Node.Variable(variable.span(), variable.name());
            }
            if (token instanceof BlatteToken.Open open) {
                return parseGroup(open);
            }
            if (token instanceof BlatteToken.NamedArgument named) {
                if (!namedArgumentAllowed) {
                    throw BlatteException.parse(named.span(),
                                                "Named argument '\\" + named.name() + "=' outside a call");
                }
                if (isGroupEnd(peekPastWhitespace())) {
                    throw BlatteException.parse(named.span(),
                                                "Missing value for named argument '\\" + named.name() + "='");
                }
                var value = parseExpression();
                return new Node.NamedArgument(named.span().to(value.span()), named.name(), value);
            }
            if (token instanceof BlatteToken.NamedParameter parameter) {
                throw BlatteException.parse(parameter.span(),
                                            "Parameter '\\=" + parameter.name() + "' outside a parameter list");
            }
            if (token instanceof BlatteToken.RestParameter parameter) {
                throw BlatteException.parse(parameter.span(),
                                            "Parameter '\\&" + parameter.name() + "' outside a parameter list");
            }
            if (token instanceof BlatteToken.Close close) {
                throw BlatteException.parse(close.span(), "Unmatched '}'");
            }
            throw BlatteException.parse(token.span(), "Unexpected end of input, expected expression");
        }

        // === Groups ===

        private Node parseGroup(BlatteToken.Open open) {
            enter(open);
            try {
                var leading = skipWhitespace();
                if (peek() instanceof BlatteToken.Eof) {
                    throw BlatteException.parse(open.span(), "Unmatched '{': missing '}'");
                }
                if (peek() instanceof BlatteToken.Close close) {
                    advance();
                    return new Node.Group(open.span().to(close.span()), List.of());
                }
                var head = wrap(leading, parseBare(false));
                if (head.bare() instanceof Node.Variable variable) {
                    var form = SpecialForm.forKeyword(variable.name())
                                          .filter(config::recognizes);
                    if (form.isPresent()) {
                        LOG.trace("Special form {} at {}", form.get().keyword(), open.span().start());
                        return parseSpecialForm(form.get(), open);
                    }
                }
                var elements = new ArrayList<Node>();
                elements.add(head);
                while (!isGroupEnd(peekPastWhitespace())) {
                    elements.add(parseArgument());
                }
                var close = expectClose(open);
                return new Node.Group(open.span().to(close.span()), List.copyOf(elements));
            } finally {
                depth--;
            }
        }

        private void enter(BlatteToken.Open open) {
            if (++depth > config.maxDepth()) {
                throw BlatteException.parse(open.span(), "Groups nested deeper than " + config.maxDepth());
            }
        }

        private Node parseSpecialForm(SpecialForm form, BlatteToken.Open open) {
            return switch (form) {
                case DEFINE -> parseDefine(open);
                case SET -> parseSet(open);
                case IF -> parseIf(open);
                case AND -> {
                    var operands = parseExpressions(open, form, 1);
                    yield new Node.And(open.span().to(lastClose), operands);
                }
                case OR -> {
                    var operands = parseExpressions(open, form, 1);
                    yield new Node.Or(open.span().to(lastClose), operands);
                }
                case COND -> parseCond(open);
                case WHILE -> {
                    var parts = parseExpressions(open, form, 1);
                    yield new Node.While(open.span().to(lastClose), parts.get(0), parts.subList(1, parts.size()));
                }
                case LAMBDA -> {
                    var parameters = parseParameterList("lambda");
                    var body = parseExpressions(open, form, 0);
                    yield new Node.Lambda(open.span().to(lastClose), parameters, body);
                }
                case LET -> parseLet(open, Node.Let.Kind.LET);
                case LET_STAR -> parseLet(open, Node.Let.Kind.LET_STAR);
                case LETREC -> parseLet(open, Node.Let.Kind.LETREC);
            };
        }

        private Node parseDefine(BlatteToken.Open open) {
            var target = peekPastWhitespace();
            if (target instanceof BlatteToken.Variable variable) {
                advance();
                var value = parseSingleValue(open, "define");
                return new Node.Define(open.span().to(lastClose), variable.name(), value);
            }
            if (target instanceof BlatteToken.Open signatureOpen) {
                advance();
                String name;
                List<Parameter> parameters;
                enter(signatureOpen);
                try {
                    name = expectVariable("function name in define");
                    parameters = parseParameters(signatureOpen, "define");
                } finally {
                    depth--;
                }
                var body = parseExpressions(open, SpecialForm.DEFINE, 0);
                var span = open.span().to(lastClose);
                return new Node.Define(span, name, new Node.Lambda(span, parameters, body));
            }
            throw BlatteException.parse(target.span(), "Malformed define: expected \\VAR or {\\NAME PARAM...}");
        }

        private Node parseSet(BlatteToken.Open open) {
            var target = peekPastWhitespace();
            if (!(target instanceof BlatteToken.Variable variable)) {
                throw BlatteException.parse(target.span(), "Malformed set!: target is not a variable reference");
            }
            advance();
            var value = parseSingleValue(open, "set!");
            return new Node.SetVariable(open.span().to(lastClose), variable.name(), value);
        }

        private Node parseSingleValue(BlatteToken.Open open, String form) {
            if (isGroupEnd(peekPastWhitespace())) {
                throw BlatteException.parse(peek().span(), "Malformed " + form + ": missing value");
            }
            var value = parseExpression();
            if (!(peekPastWhitespace() instanceof BlatteToken.Close)) {
                throw BlatteException.parse(peek().span(), "Malformed " + form + ": expected exactly one value");
            }
            expectClose(open);
            return value;
        }

        private Node parseIf(BlatteToken.Open open) {
            var parts = parseExpressions(open, SpecialForm.IF, 2);
            return new Node.If(open.span().to(lastClose), parts.get(0), parts.get(1), parts.subList(2, parts.size()));
        }

        private Node parseCond(BlatteToken.Open open) {
            var clauses = new ArrayList<Node.Cond.Clause>();
            while (!isGroupEnd(peekPastWhitespace())) {
                var token = advance();
                if (!(token instanceof BlatteToken.Open clauseOpen)) {
                    throw BlatteException.parse(token.span(), "Malformed cond: clause is not a group");
                }
                enter(clauseOpen);
                try {
                    var parts = parseExpressions(clauseOpen, SpecialForm.COND, 1);
                    clauses.add(new Node.Cond.Clause(clauseOpen.span().to(lastClose),
                                                     parts.get(0),
                                                     parts.subList(1, parts.size())));
                } finally {
                    depth--;
                }
            }
            expectClose(open);
            return new Node.Cond(open.span().to(lastClose), List.copyOf(clauses));
        }

        private Node parseLet(BlatteToken.Open open, Node.Let.Kind kind) {
            var keyword = switch (kind) {
                case LET -> "let";
                case LET_STAR -> "let*";
                case LETREC -> "letrec";
            };
            var listOpen = expectOpen("binding list in " + keyword);
            enter(listOpen);
            var bindings = new ArrayList<Node.Let.Binding>();
            var names = new HashSet<String>();
            try {
                while (!isGroupEnd(peekPastWhitespace())) {
                    var binding = parseBinding(keyword);
                    if (kind != Node.Let.Kind.LET_STAR && !names.add(binding.name())) {
                        throw BlatteException.parse(binding.span(),
                                                    "Duplicate binding '\\" + binding.name() + "' in " + keyword);
                    }
                    bindings.add(binding);
                }
                expectClose(listOpen);
            } finally {
                depth--;
            }
            var body = parseExpressions(open, SpecialForm.LET, 0);
            return new Node.Let(open.span().to(lastClose), kind, List.copyOf(bindings), body);
        }

        private Node.Let.Binding parseBinding(String keyword) {
            var token = advance();
            if (!(token instanceof BlatteToken.Open pairOpen)) {
                throw BlatteException.parse(token.span(),
                                            "Malformed binding pair in " + keyword + ": expected {\\VAR VAL}");
            }
            enter(pairOpen);
            try {
                var target = peekPastWhitespace();
                if (!(target instanceof BlatteToken.Variable variable)) {
                    throw BlatteException.parse(target.span(),
                                                "Malformed binding pair in " + keyword + ": expected {\\VAR VAL}");
                }
                advance();
                if (isGroupEnd(peekPastWhitespace())) {
                    throw BlatteException.parse(peek().span(),
                                                "Malformed binding pair in " + keyword + ": missing value");
                }
                var value = parseExpression();
                if (!(peekPastWhitespace() instanceof BlatteToken.Close)) {
                    throw BlatteException.parse(peek().span(),
                                                "Malformed binding pair in " + keyword + ": expected exactly {\\VAR VAL}");
                }
                var close = expectClose(pairOpen);
                return new Node.Let.Binding(pairOpen.span().to(close.span()), variable.name(), value);
            } finally {
                depth--;
            }
        }

        // === Parameters ===

        private List<Parameter> parseParameterList(String form) {
            var listOpen = expectOpen("parameter list in " + form);
            enter(listOpen);
            try {
                return parseParameters(listOpen, form);
            } finally {
                depth--;
            }
        }

        private List<Parameter> parseParameters(BlatteToken.Open listOpen, String form) {
            var parameters = new ArrayList<Parameter>();
            var names = new HashSet<String>();
            boolean restSeen = false;

            while (!isGroupEnd(peekPastWhitespace())) {
                var token = advance();
                Parameter parameter;
                if (token instanceof BlatteToken.Variable variable) {
                    parameter = Parameter.positional(variable.name());
                } else if (token instanceof BlatteToken.NamedParameter named) {
                    parameter = Parameter.named(named.name());
                } else if (token instanceof BlatteToken.RestParameter rest) {
                    if (restSeen) {
                        throw BlatteException.parse(token.span(), "Duplicate rest parameter in " + form);
                    }
                    parameter = Parameter.rest(rest.name());
                } else {
                    throw BlatteException.parse(token.span(),
                                                "Malformed parameter list in " + form + ": expected \\VAR, \\=VAR or \\&VAR");
                }
                if (restSeen) {
                    throw BlatteException.parse(token.span(), "Rest parameter must be the last parameter in " + form);
                }
                if (!names.add(parameter.name())) {
                    throw BlatteException.parse(token.span(),
                                                "Duplicate parameter '" + parameter.name() + "' in " + form);
                }
                restSeen = parameter.kind() == Parameter.Kind.REST;
                parameters.add(parameter);
            }
            expectClose(listOpen);
            return List.copyOf(parameters);
        }

        // === Helpers ===

        private List<Node> parseExpressions(BlatteToken.Open open, SpecialForm form, int minimum) {
            var expressions = new ArrayList<Node>();
            while (!isGroupEnd(peekPastWhitespace())) {
                expressions.add(parseExpression());
            }
            var close = expectClose(open);
            if (expressions.size() < minimum) {
                throw BlatteException.parse(open.span().to(close.span()),
                                            "Malformed " + form.keyword() + ": expected at least " + minimum
                                            + " sub-expression" + (minimum == 1 ? "" : "s"));
            }
            return List.copyOf(expressions);
        }

        private String expectVariable(String what) {
            var token = peekPastWhitespace();
            if (token instanceof BlatteToken.Variable variable) {
                advance();
                return variable.name();
            }
            throw BlatteException.parse(token.span(), "Expected " + what);
        }

        private BlatteToken.Open expectOpen(String what) {
            var token = peekPastWhitespace();
            if (token instanceof BlatteToken.Open open) {
                advance();
                return open;
            }
            throw BlatteException.parse(token.span(), "Expected " + what);
        }

        private BlatteToken.Close expectClose(BlatteToken.Open open) {
            var token = peekPastWhitespace();
            if (token instanceof BlatteToken.Close close) {
                advance();
                lastClose = close.span();
                return close;
            }
            if (token instanceof BlatteToken.Eof) {
                throw BlatteException.parse(open.span(), "Unmatched '{': missing '}'");
            }
            throw BlatteException.parse(token.span(), "Expected '}'");
        }

        private boolean isGroupEnd(BlatteToken token) {
            return token instanceof BlatteToken.Close || token instanceof BlatteToken.Eof;
        }

        private BlatteToken peekPastWhitespace() {
            var leading = skipWhitespace();
            if (!leading.whitespace().isEmpty()) {
                pendingWhitespace = leading;
            }
            return peek();
        }

        private Leading skipWhitespace() {
            var start = pendingWhitespace != null ? pendingWhitespace.start() : peek().span().start();
            var sb = new StringBuilder();
            if (pendingWhitespace != null) {
                sb.append(pendingWhitespace.whitespace());
                pendingWhitespace = null;
            }
            while (true) {
                var token = peek();
                if (token instanceof BlatteToken.Whitespace whitespace) {
                    sb.append(whitespace.text());
                } else if (token instanceof BlatteToken.ForgetWhitespace) {
                    sb.setLength(0);
                } else if (!(token instanceof BlatteToken.Comment)) {
                    break;
                }
                advance();
            }
            return new Leading(start, sb.toString());
        }

        private BlatteToken peek() {
            if (lookahead == null) {
                lookahead = lexer.next();
            }
            return lookahead;
        }

        private BlatteToken advance() {
            var token = peek();
            lookahead = null;
            // whitespace in front of a structural token is dropped
            pendingWhitespace = null;
            return token;
        }
    }
}

package org.pragmatica.blatte.generator;

import org.pragmatica.blatte.error.BlatteException;
import org.pragmatica.blatte.parser.ParserConfig;
import org.pragmatica.blatte.tree.Node;
import org.pragmatica.blatte.tree.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a Blatte syntax tree into a Java expression of type {@code Object}.
 *
 * <p>The generated code refers to the classes of {@code org.pragmatica.blatte.runtime} by simple name
 * and to the global {@code Environment} through a variable named by
 * {@link ParserConfig#environmentName()}. Each form has one fixed template:
 *
 * <pre>
 * ws-wrapped e          Values.wrapws("ws", e)
 * word, \"string\"      "text"
 * \x (lexical)          x_1.get()
 * \x (global)           env.get("x")
 * {\define \x e}        env.define("x", e)
 * {\set! \x e}          x_1.set(e)  /  env.set("x", e)
 * {\if t a b...}        (Values.isTrue(t) ? a : Forms.last(b...))
 * {\and e...}           Forms.and(() -> e, ...)
 * {\or e...}            Forms.or(() -> e, ...)
 * {\cond {t b...}...}   (Values.isTrue(t) ? Forms.last(b...) : ...)
 * {\while t b...}       Forms.block(() -> { while (Values.isTrue(t)) { Forms.last(b...); } return Forms.EMPTY; })
 * {\lambda {p...} b...} (BlatteFunction) (named_1, args_1) -> { ...bind p...; return Forms.last(b...); }
 * {\let {{\x v}...} b...}  Forms.block(() -> { final Var x_1 = new Var(v); ... return Forms.last(b...); })
 * {h a... \n=e}         Forms.apply(h, Forms.named("n", e), a...)
 * </pre>
 *
 * <p>Every Java local gets a fresh numeric suffix, so nested lambdas never redeclare a name that is
 * already in scope. An instance numbers its locals across calls and is meant for one compilation.
 */
public final class JavaGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(JavaGenerator.class);

    private final String env;
    private int counter;

    private JavaGenerator(String env) {
        this.env = env;
    }

    public static JavaGenerator create(ParserConfig config) {
        return new JavaGenerator(config.environmentName());
    }

    /**
     * Generate the Java expression computing the value of {@code node}.
     *
     * @throws BlatteException with a {@code CodeGenError} if the tree contains a node that is not
     *                         valid in expression position
     */
    public String generate(Node node) {
        var code = expression(node, LexicalScope.root());
        LOG.debug("Generated {} characters of Java for expression at {}", code.length(), node.span().start());
        return code;
    }

    private String expression(Node node, LexicalScope scope) {
        if (node instanceof Node.Wrapped wrapped) {
            return "Values.wrapws(" + JavaLiterals.string(wrapped.whitespace()) + ", "
                   + expression(wrapped.inner(), scope) + ")";
        }
        if (node instanceof Node.Word word) {
            return JavaLiterals.string(word.text());
        }
        if (node instanceof Node.Str str) {
            return JavaLiterals.string(str.text());
        }
        if (node instanceof Node.Variable variable) {
            return scope.resolve(variable.name())
                        .map(local -> local + ".get()")
                        .orElseGet(() -> env + ".get(" + JavaLiterals.string(variable.name()) + ")");
        }
        if (node instanceof Node.Group group) {
            return group(group, scope);
        }
        if (node instanceof Node.Define define) {
            var value = define.value() instanceof Node.Lambda lambda
                        ? lambda(lambda, scope, define.name())
                        : expression(define.value(), scope);
            return env + ".define(" + JavaLiterals.string(define.name()) + ", " + value + ")";
        }
        if (node instanceof Node.SetVariable set) {
            var value = expression(set.value(), scope);
            return scope.resolve(set.name())
                        .map(local -> local + ".set(" + value + ")")
                        .orElseGet(() -> env + ".set(" + JavaLiterals.string(set.name()) + ", " + value + ")");
        }
        if (node instanceof Node.If ifNode) {
            return "(Values.isTrue(" + expression(ifNode.test(), scope) + ") ? "
                   + expression(ifNode.then(), scope) + " : "
                   + body(ifNode.otherwise(), scope) + ")";
        }
        if (node instanceof Node.And and) {
            return "Forms.and(" + suppliers(and.operands(), scope) + ")";
        }
        if (node instanceof Node.Or or) {
            return "Forms.or(" + suppliers(or.operands(), scope) + ")";
        }
        if (node instanceof Node.Cond cond) {
            return cond(cond, scope);
        }
        if (node instanceof Node.While loop) {
            return "Forms.block(() -> { while (Values.isTrue(" + expression(loop.test(), scope) + ")) { "
                   + (loop.body().isEmpty() ? "" : "Forms.last(" + list(loop.body(), scope) + "); ")
                   + "} return Forms.EMPTY; })";
        }
        if (node instanceof Node.Lambda lambda) {
            return lambda(lambda, scope, "lambda");
        }
        if (node instanceof Node.Let let) {
            return let(let, scope);
        }
        if (node instanceof Node.NamedArgument named) {
            throw BlatteException.codeGen(named.span(), "named argument '\\" + named.name() + "=' outside a call");
        }
        throw BlatteException.codeGen(node.span(), "unsupported node " + node.getClass().getSimpleName());
    }

    // === Groups ===

    private String group(Node.Group group, LexicalScope scope) {
        if (group.elements().isEmpty()) {
            return "Forms.EMPTY";
        }
        var head = group.elements().get(0);
        if (head.bare() instanceof Node.NamedArgument named) {
            throw BlatteException.codeGen(named.span(), "named argument '\\" + named.name() + "=' in function position");
        }
        var named = new ArrayList<String>();
        var positional = new ArrayList<String>();
        for (var element : group.elements().subList(1, group.elements().size())) {
            if (element.bare() instanceof Node.NamedArgument argument) {
                named.add(JavaLiterals.string(argument.name()));
                named.add(expression(argument.value(), scope));
            } else {
                positional.add(expression(element, scope));
            }
        }
        var sb = new StringBuilder("Forms.apply(");
        sb.append(expression(head, scope))
          .append(", Forms.named(")
          .append(String.join(", ", named))
          .append(")");
        for (var argument : positional) {
            sb.append(", ").append(argument);
        }
        return sb.append(")").toString();
    }

    // === Special forms ===

    private String cond(Node.Cond cond, LexicalScope scope) {
        var code = "Forms.EMPTY";
        for (int i = cond.clauses().size() - 1; i >= 0; i--) {
            var clause = cond.clauses().get(i);
            var test = expression(clause.test(), scope);
            code = clause.body().isEmpty()
                   ? "Forms.or(() -> " + test + ", () -> " + code + ")"
                   : "(Values.isTrue(" + test + ") ? " + body(clause.body(), scope) + " : " + code + ")";
        }
        return code;
    }

    private String lambda(Node.Lambda lambda, LexicalScope scope, String name) {
        int id = ++counter;
        var named = "named_" + id;
        var args = "args_" + id;
        var arguments = "arguments_" + id;
        var inner = scope.child();

        long positionalCount = lambda.parameters()
                                     .stream()
                                     .filter(parameter -> parameter.kind() == Parameter.Kind.POSITIONAL)
                                     .count();
        boolean hasRest = lambda.parameters()
                                .stream()
                                .anyMatch(parameter -> parameter.kind() == Parameter.Kind.REST);

        var sb = new StringBuilder();
        sb.append("(BlatteFunction) (").append(named).append(", ").append(args).append(") -> { ")
          .append("var ").append(arguments).append(" = Arguments.bind(")
          .append(JavaLiterals.string(name)).append(", ")
          .append(named).append(", ")
          .append(args).append(", ")
          .append(positionalCount).append(", ")
          .append(hasRest).append("); ");

        int position = 0;
        for (var parameter : lambda.parameters()) {
            var local = local(parameter.name());
            var source = switch (parameter.kind()) {
                case POSITIONAL -> arguments + ".positional(" + position++ + ")";
                case NAMED -> arguments + ".named(" + JavaLiterals.string(parameter.name()) + ")";
                case REST -> arguments + ".rest()";
            };
            sb.append("final Var ").append(local).append(" = new Var(").append(source).append("); ");
            inner.bind(parameter.name(), local);
        }

        return sb.append("return ").append(body(lambda.body(), inner)).append("; }").toString();
    }

    private String let(Node.Let let, LexicalScope scope) {
        var inner = scope.child();
        var sb = new StringBuilder("Forms.block(() -> { ");

        switch (let.kind()) {
            case LET -> {
                var locals = new ArrayList<String>();
                for (var binding : let.bindings()) {
                    var local = local(binding.name());
                    sb.append("final Var ").append(local).append(" = new Var(")
                      .append(expression(binding.value(), scope)).append("); ");
                    locals.add(local);
                }
                for (int i = 0; i < locals.size(); i++) {
                    inner.bind(let.bindings().get(i).name(), locals.get(i));
                }
            }
            case LET_STAR -> {
                for (var binding : let.bindings()) {
                    var local = local(binding.name());
                    sb.append("final Var ").append(local).append(" = new Var(")
                      .append(expression(binding.value(), inner)).append("); ");
                    inner.bind(binding.name(), local);
                }
            }
            case LETREC -> {
                var locals = new ArrayList<String>();
                for (var binding : let.bindings()) {
                    var local = local(binding.name());
                    sb.append("final Var ").append(local).append(" = new Var(); ");
                    inner.bind(binding.name(), local);
                    locals.add(local);
                }
                if (!locals.isEmpty()) {
                    var values = "values_" + ++counter;
                    var initializers = new ArrayList<String>();
                    for (var binding : let.bindings()) {
                        initializers.add(expression(binding.value(), inner));
                    }
                    sb.append("final Object[] ").append(values).append(" = new Object[] {")
                      .append(String.join(", ", initializers)).append("}; ");
                    for (int i = 0; i < locals.size(); i++) {
                        sb.append(locals.get(i)).append(".set(").append(values).append("[").append(i).append("]); ");
                    }
                }
            }
        }

        return sb.append("return ").append(body(let.body(), inner)).append("; })").toString();
    }

    // === Helpers ===

    private String body(List<Node> expressions, LexicalScope scope) {
        if (expressions.isEmpty()) {
            return "Forms.EMPTY";
        }
        if (expressions.size() == 1) {
            return expression(expressions.get(0), scope);
        }
        return "Forms.last(" + list(expressions, scope) + ")";
    }

    private String list(List<Node> expressions, LexicalScope scope) {
        var parts = new ArrayList<String>(expressions.size());
        for (var expression : expressions) {
            parts.add(expression(expression, scope));
        }
        return String.join(", ", parts);
    }

    private String suppliers(List<Node> expressions, LexicalScope scope) {
        var parts = new ArrayList<String>(expressions.size());
        for (var expression : expressions) {
            parts.add("() -> " + expression(expression, scope));
        }
        return String.join(", ", parts);
    }

    private String local(String name) {
        var sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
        }
        return sb.append('_').append(++counter).toString();
    }
}

package org.pragmatica.blatte.generator;

import org.pragmatica.blatte.parser.Parser;
import org.pragmatica.blatte.parser.SourceCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a whole Blatte document into the source of a Java class implementing
 * {@link org.pragmatica.blatte.runtime.BlatteProgram}.
 *
 * <p>The program's {@code run} method returns one value per top-level expression, in document order.
 * Whitespace after the last expression is kept as a final wrapped empty string, so flattening the
 * result reproduces a document made of plain text exactly.
 *
 * <p>Expressions are emitted into private helper methods of at most {@link #CHUNK_SIZE} expressions
 * each, which {@code run} calls in order. A single method body is limited to 64 KB of bytecode.
 */
public final class ProgramGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(ProgramGenerator.class);

    static final int CHUNK_SIZE = 500;
    static final String RESULTS = "results_0";

    private final Parser parser;
    private final String packageName;
    private final String className;

    private ProgramGenerator(Parser parser, String packageName, String className) {
        this.parser = parser;
        this.packageName = packageName;
        this.className = className;
    }

    public static ProgramGenerator create(Parser parser, String packageName, String className) {
        return new ProgramGenerator(parser, packageName, className);
    }

    /**
     * Generate the complete Java source file for {@code document}.
     *
     * @throws org.pragmatica.blatte.error.BlatteException if the document cannot be parsed
     */
    public String generate(String document) {
        var env = parser.config().environmentName();
        var generator = JavaGenerator.create(parser.config());
        var cursor = SourceCursor.of(document);
        var expressions = new ArrayList<String>();

        while (true) {
            var node = parser.parse(cursor);
            if (node.isEmpty()) {
                break;
            }
            expressions.add(generator.generate(node.get()));
        }
        int topLevel = expressions.size();

        var trailing = parser.skipWhitespace(cursor);
        if (!trailing.isEmpty()) {
            expressions.add("Values.wrapws(" + JavaLiterals.string(trailing) + ", \"\")");
        }

        var sb = new StringBuilder();
        if (packageName != null && !packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
        sb.append("import java.util.ArrayList;\n");
        sb.append("import java.util.List;\n");
        sb.append("import org.pragmatica.blatte.runtime.*;\n\n");
        sb.append("/**\n");
        sb.append(" * Generated from Blatte source. Do not edit.\n");
        sb.append(" */\n");
        sb.append("public final class ").append(className).append(" implements BlatteProgram {\n");
        sb.append("    @Override\n");
        sb.append("    public List<Object> run(Environment ").append(env).append(") {\n");
        sb.append("        var ").append(RESULTS).append(" = new ArrayList<Object>();\n");

        var chunks = chunks(expressions);
        for (int i = 0; i < chunks.size(); i++) {
            sb.append("        run").append(i).append("(").append(env).append(", ").append(RESULTS).append(");\n");
        }
        sb.append("        return ").append(RESULTS).append(";\n");
        sb.append("    }\n");

        for (int i = 0; i < chunks.size(); i++) {
            sb.append("\n");
            sb.append("    private static void run").append(i)
              .append("(Environment ").append(env)
              .append(", List<Object> ").append(RESULTS).append(") {\n");
            for (var expression : chunks.get(i)) {
                sb.append("        ").append(RESULTS).append(".add(").append(expression).append(");\n");
            }
            sb.append("    }\n");
        }
        sb.append("}\n");

        LOG.debug("Generated class {} from {} top-level expressions in {} methods",
                  className, topLevel, chunks.size());
        return sb.toString();
    }

    private static List<List<String>> chunks(List<String> expressions) {
        var chunks = new ArrayList<List<String>>();
        for (int start = 0; start < expressions.size(); start += CHUNK_SIZE) {
            chunks.add(expressions.subList(start, Math.min(start + CHUNK_SIZE, expressions.size())));
        }
        return chunks;
    }
}

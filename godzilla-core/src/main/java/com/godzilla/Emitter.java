package com.godzilla;

import com.godzilla.ast.*;
import com.godzilla.source.Code;
import com.godzilla.source.StringCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles a tree to Go text, written into a {@link Code} sink in the same
 * order the {@link Stringifier} walks the tree.
 *
 * <p>Conventions applied:</p>
 * <ul>
 *   <li>identifiers get their first letter upper-cased (Go export visibility);</li>
 *   <li>member access keeps that rule for every name it navigates through, but
 *       the trailing property of a chain that is read rather than called is a
 *       field name and is written as is: {@code console.log("hi")} becomes
 *       {@code Console.Log("hi")}, {@code a.b.c} becomes {@code A.B.c};</li>
 *   <li>every call ends with a line terminator;</li>
 *   <li>{@code null} becomes {@code nil};</li>
 *   <li>declarations follow {@link EmitterOptions#declarations()}.</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared between threads; the sink may not.</p>
 */
public final class Emitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Emitter.class);

    private static final Emitter DEFAULT = new Emitter(EmitterOptions.defaults());

    private final EmitterOptions options;

    public Emitter(EmitterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public static Emitter defaultEmitter() {
        return DEFAULT;
    }

    public EmitterOptions options() {
        return options;
    }

    /**
     * Writes the Go form of {@code node} into {@code code}.
     *
     * @throws UnsupportedNodeException in {@code FAIL} mode when the tree holds a
     *         declaration; nothing is written to {@code code} in that case
     */
    public void compile(Node node, Code code) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(code, "code");
        LOGGER.debug("Compiling {} with {}", node.attr().describe(), options);

        if (options.declarations() == EmitterOptions.DeclarationMode.FAIL) {
            // Buffer so a rejected tree leaves the sink untouched.
            StringCode buffer = new StringCode();
            node.accept(new Pass(buffer));
            code.write(buffer.toString());
        } else {
            node.accept(new Pass(code));
        }
    }

    /**
     * Compiles into a fresh in-memory sink and returns its contents.
     */
    public String compileToString(Node node) {
        StringCode code = new StringCode();
        compile(node, code);
        return code.toString();
    }

    /**
     * Upper-cases the first code point of {@code name}, leaving the rest untouched.
     */
    static String exported(String name) {
        if (name.isEmpty()) {
            return name;
        }
        int first = name.codePointAt(0);
        return new StringBuilder(name.length())
            .appendCodePoint(Character.toUpperCase(first))
            .append(name, Character.charCount(first), name.length())
            .toString();
    }

    private final class Pass implements NodeVisitor<Void> {
        private final Code code;

        Pass(Code code) {
            this.code = code;
        }

        @Override
        public Void visit(File node) {
            return node.program().accept(this);
        }

        @Override
        public Void visit(Program node) {
            for (Statement s : node.body()) {
                s.accept(this);
            }
            return null;
        }

        @Override
        public Void visit(ExpressionStatement node) {
            return node.expression().accept(this);
        }

        @Override
        public Void visit(VariableDeclaration node) {
            switch (options.declarations()) {
                case SKIP -> LOGGER.warn("Skipping {}: declarations are not emitted in SKIP mode",
                    node.attr().describe());
                case FAIL -> throw new UnsupportedNodeException(node, "Declarations are not supported for compilation");
                case EMIT -> {
                    for (VariableDeclarator d : node.declarations()) {
                        declare(keyword(node.kind(), d), d);
                    }
                }
            }
            return null;
        }

        @Override
        public Void visit(VariableDeclarator node) {
            switch (options.declarations()) {
                case SKIP -> LOGGER.warn("Skipping {}: declarations are not emitted in SKIP mode",
                    node.attr().describe());
                case FAIL -> throw new UnsupportedNodeException(node, "Declarators are not supported for compilation");
                case EMIT -> declare("var", node);
            }
            return null;
        }

        @Override
        public Void visit(Identifier node) {
            code.write(exported(node.name()));
            return null;
        }

        @Override
        public Void visit(CallExpression node) {
            if (node.callee() instanceof MemberExpression member) {
                member(member, true);
            } else {
                node.callee().accept(this);
            }
            code.write("(");
            List<Expression> args = node.arguments();
            for (int i = 0; i < args.size(); i++) {
                args.get(i).accept(this);
                if (i != args.size() - 1) {
                    code.write(", ");
                }
            }
            code.write(")\n");
            return null;
        }

        @Override
        public Void visit(MemberExpression node) {
            member(node, false);
            return null;
        }

        @Override
        public Void visit(StringLiteral node) {
            code.write("\"" + node.value() + "\"");
            return null;
        }

        @Override
        public Void visit(NumericLiteral node) {
            code.write(node.text());
            return null;
        }

        @Override
        public Void visit(BooleanLiteral node) {
            code.write(Boolean.toString(node.value()));
            return null;
        }

        @Override
        public Void visit(NullLiteral node) {
            code.write("nil");
            return null;
        }

        /**
         * Object, then a literal dot and the property, or the property in
         * brackets for computed access. {@code navigated} is set when the
         * access is called or accessed further.
         */
        private void member(MemberExpression node, boolean navigated) {
            if (node.object() instanceof MemberExpression inner) {
                member(inner, true);
            } else {
                node.object().accept(this);
            }
            if (node.computed()) {
                code.write("[");
                node.property().accept(this);
                code.write("]");
            } else if (!navigated && node.property() instanceof Identifier field) {
                code.write(".");
                code.write(field.name());
            } else {
                code.write(".");
                node.property().accept(this);
            }
        }

        private void declare(String keyword, VariableDeclarator d) {
            code.write(keyword + " ");
            d.id().accept(this);
            if (d.init() == null) {
                code.write(" interface{}\n");
                return;
            }
            // A call initializer already ends its line.
            StringCode init = new StringCode();
            d.init().accept(new Pass(init));
            String value = init.toString();
            if (value.endsWith("\n")) {
                value = value.substring(0, value.length() - 1);
            }
            code.write(" = " + value + "\n");
        }
    }

    private static String keyword(String kind, VariableDeclarator d) {
        // Go has no nil constants.
        boolean constant = d.init() instanceof StringLiteral
            || d.init() instanceof NumericLiteral
            || d.init() instanceof BooleanLiteral;
        return "const".equals(kind) && constant ? "const" : "var";
    }
}

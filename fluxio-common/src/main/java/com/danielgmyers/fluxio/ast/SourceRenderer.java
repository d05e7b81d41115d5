/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.fluxio.ast;

import java.util.List;

/**
 * Renders script tree nodes back into canonical script text.
 *
 * The rendering is deterministic: strings are single-quoted unless they contain a single quote and no double quote,
 * nested blocks are indented by four spaces, and parentheses are only emitted where operator precedence needs them.
 * Content hashes, input-data path tokens and diagnostic messages are all derived from this text.
 */
public final class SourceRenderer implements StatementVisitor<Void>, ExpressionVisitor<Void> {

    private static final String INDENT = "    ";

    private static final int PRECEDENCE_OR = 1;
    private static final int PRECEDENCE_AND = 2;
    private static final int PRECEDENCE_NOT = 3;
    private static final int PRECEDENCE_COMPARE = 4;
    private static final int PRECEDENCE_ATOM = 10;

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private SourceRenderer() {}

    /**
     * Renders any node of the script tree.
     */
    public static String render(Node node) {
        SourceRenderer renderer = new SourceRenderer();
        if (node instanceof Statement) {
            ((Statement)node).accept(renderer);
        } else if (node instanceof Expression) {
            ((Expression)node).accept(renderer);
        } else if (node instanceof ModuleNode) {
            renderer.statements(((ModuleNode)node).getBody());
        } else if (node instanceof ExceptHandler) {
            renderer.handler((ExceptHandler)node);
        } else if (node instanceof Keyword) {
            renderer.keyword((Keyword)node);
        } else {
            throw new IllegalArgumentException("Cannot render node of type " + node.getClass().getSimpleName());
        }
        return renderer.out.toString().stripTrailing();
    }

    /**
     * Renders a string literal the way the host language's repr() would.
     */
    public static String quote(String value) {
        char quote = (value.indexOf('\'') >= 0 && value.indexOf('"') < 0) ? '"' : '\'';
        StringBuilder sb = new StringBuilder();
        sb.append(quote);
        for (char c : value.toCharArray()) {
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else {
                sb.append(c);
            }
        }
        sb.append(quote);
        return sb.toString();
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        out.append(text).append('\n');
    }

    private void startLine() {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }

    private void endLine() {
        out.append('\n');
    }

    private void block(List<Statement> body) {
        depth++;
        if (body.isEmpty()) {
            line("pass");
        } else {
            statements(body);
        }
        depth--;
    }

    private void statements(List<Statement> body) {
        for (Statement statement : body) {
            statement.accept(this);
        }
    }

    private void expression(Expression expression, int requiredPrecedence) {
        boolean parenthesize = precedenceOf(expression) < requiredPrecedence;
        if (parenthesize) {
            out.append('(');
        }
        expression.accept(this);
        if (parenthesize) {
            out.append(')');
        }
    }

    private static int precedenceOf(Expression expression) {
        if (expression instanceof BoolOp) {
            return ((BoolOp)expression).getOperator() == BoolOp.Operator.OR ? PRECEDENCE_OR : PRECEDENCE_AND;
        } else if (expression instanceof UnaryOp) {
            return PRECEDENCE_NOT;
        } else if (expression instanceof Compare) {
            return PRECEDENCE_COMPARE;
        }
        return PRECEDENCE_ATOM;
    }

    private void commaSeparated(List<Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            expressions.get(i).accept(this);
        }
    }

    private void handler(ExceptHandler handler) {
        startLine();
        out.append("except");
        if (handler.getType() != null) {
            out.append(' ');
            handler.getType().accept(this);
            if (handler.getName() != null) {
                out.append(" as ").append(handler.getName());
            }
        }
        out.append(':');
        endLine();
        block(handler.getBody());
    }

    private void keyword(Keyword keyword) {
        if (keyword.getArg() == null) {
            out.append("**");
        } else {
            out.append(keyword.getArg()).append('=');
        }
        keyword.getValue().accept(this);
    }

    @Override
    public Void visitClassDef(ClassDef node) {
        startLine();
        out.append("class ").append(node.getName());
        if (!node.getBases().isEmpty()) {
            out.append('(');
            commaSeparated(node.getBases());
            out.append(')');
        }
        out.append(':');
        endLine();
        block(node.getBody());
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        for (Expression decorator : node.getDecorators()) {
            startLine();
            out.append('@');
            decorator.accept(this);
            endLine();
        }
        startLine();
        if (node.isAsync()) {
            out.append("async ");
        }
        out.append("def ").append(node.getName()).append('(')
           .append(String.join(", ", node.getParameters())).append("):");
        endLine();
        block(node.getBody());
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        startLine();
        for (Expression target : node.getTargets()) {
            target.accept(this);
            out.append(" = ");
        }
        node.getValue().accept(this);
        endLine();
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        startLine();
        node.getValue().accept(this);
        endLine();
        return null;
    }

    @Override
    public Void visitIf(If node) {
        renderConditional(node, "if ");
        return null;
    }

    private void renderConditional(If node, String keyword) {
        startLine();
        out.append(keyword);
        node.getTest().accept(this);
        out.append(':');
        endLine();
        block(node.getBody());
        if (node.hasElifContinuation()) {
            renderConditional((If)node.getOrelse().get(0), "elif ");
        } else if (!node.getOrelse().isEmpty()) {
            line("else:");
            block(node.getOrelse());
        }
    }

    @Override
    public Void visitRaise(Raise node) {
        startLine();
        out.append("raise");
        if (node.getException() != null) {
            out.append(' ');
            node.getException().accept(this);
        }
        endLine();
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        startLine();
        out.append("return");
        if (node.getValue() != null) {
            out.append(' ');
            node.getValue().accept(this);
        }
        endLine();
        return null;
    }

    @Override
    public Void visitTry(Try node) {
        line("try:");
        block(node.getBody());
        for (ExceptHandler handler : node.getHandlers()) {
            handler(handler);
        }
        if (!node.getOrelse().isEmpty()) {
            line("else:");
            block(node.getOrelse());
        }
        if (!node.getFinalbody().isEmpty()) {
            line("finally:");
            block(node.getFinalbody());
        }
        return null;
    }

    @Override
    public Void visitWith(With node) {
        startLine();
        out.append("with ");
        commaSeparated(node.getItems());
        out.append(':');
        endLine();
        block(node.getBody());
        return null;
    }

    @Override
    public Void visitPass(Pass node) {
        line("pass");
        return null;
    }

    @Override
    public Void visitImport(Import node) {
        StringBuilder sb = new StringBuilder("import ");
        appendAliases(sb, node.getNames());
        line(sb.toString());
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        StringBuilder sb = new StringBuilder("from ");
        for (int i = 0; i < node.getLevel(); i++) {
            sb.append('.');
        }
        if (node.getModule() != null) {
            sb.append(node.getModule());
        }
        sb.append(" import ");
        appendAliases(sb, node.getNames());
        line(sb.toString());
        return null;
    }

    private static void appendAliases(StringBuilder sb, List<ImportAlias> aliases) {
        for (int i = 0; i < aliases.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(aliases.get(i));
        }
    }

    @Override
    public Void visitOpaqueStatement(OpaqueStatement node) {
        if (node.getSource() == null) {
            line("<" + node.getKind() + ">");
        } else {
            for (String sourceLine : node.getSource().split("\n")) {
                line(sourceLine);
            }
        }
        return null;
    }

    @Override
    public Void visitName(Name node) {
        out.append(node.getId());
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node) {
        expression(node.getValue(), PRECEDENCE_ATOM);
        out.append('.').append(node.getAttr());
        return null;
    }

    @Override
    public Void visitSubscript(Subscript node) {
        expression(node.getValue(), PRECEDENCE_ATOM);
        out.append('[');
        node.getSlice().accept(this);
        out.append(']');
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        expression(node.getFunc(), PRECEDENCE_ATOM);
        out.append('(');
        commaSeparated(node.getArgs());
        for (int i = 0; i < node.getKeywords().size(); i++) {
            if (i > 0 || !node.getArgs().isEmpty()) {
                out.append(", ");
            }
            keyword(node.getKeywords().get(i));
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitConstant(Constant node) {
        Object value = node.getValue();
        if (value == null) {
            out.append("None");
        } else if (value instanceof Boolean) {
            out.append((Boolean)value ? "True" : "False");
        } else if (value instanceof String) {
            out.append(quote((String)value));
        } else {
            out.append(value);
        }
        return null;
    }

    @Override
    public Void visitDict(DictExpr node) {
        out.append('{');
        for (int i = 0; i < node.getKeys().size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            node.getKeys().get(i).accept(this);
            out.append(": ");
            node.getValues().get(i).accept(this);
        }
        out.append('}');
        return null;
    }

    @Override
    public Void visitList(ListExpr node) {
        out.append('[');
        commaSeparated(node.getElements());
        out.append(']');
        return null;
    }

    @Override
    public Void visitTuple(TupleExpr node) {
        out.append('(');
        commaSeparated(node.getElements());
        if (node.getElements().size() == 1) {
            out.append(',');
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitBoolOp(BoolOp node) {
        int precedence = precedenceOf(node);
        for (int i = 0; i < node.getValues().size(); i++) {
            if (i > 0) {
                out.append(' ').append(node.getOperator().getSymbol()).append(' ');
            }
            expression(node.getValues().get(i), precedence + 1);
        }
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        out.append("not ");
        expression(node.getOperand(), PRECEDENCE_NOT);
        return null;
    }

    @Override
    public Void visitCompare(Compare node) {
        expression(node.getLeft(), PRECEDENCE_COMPARE + 1);
        for (int i = 0; i < node.getOperators().size(); i++) {
            out.append(' ').append(node.getOperators().get(i).getSymbol()).append(' ');
            if (i < node.getComparators().size()) {
                expression(node.getComparators().get(i), PRECEDENCE_COMPARE + 1);
            }
        }
        return null;
    }
}

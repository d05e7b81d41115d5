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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static factory for building script trees in code, for front ends that construct trees directly and for tests.
 * Nodes built here have no meaningful source position; they all report line 1, column 0.
 */
public final class ScriptTrees {

    private static final int LINE = 1;
    private static final int COLUMN = 0;

    private ScriptTrees() {}

    public static ModuleNode module(Statement... body) {
        return new ModuleNode(Arrays.asList(body));
    }

    public static ClassDef classDef(String name, String base, Statement... body) {
        return new ClassDef(LINE, COLUMN, name, Collections.singletonList(name(base)), Arrays.asList(body));
    }

    /**
     * A workflow function taking the single {@code data} parameter.
     */
    public static FunctionDef function(String name, Statement... body) {
        return function(name, Collections.emptyList(), body);
    }

    public static FunctionDef function(String name, List<Expression> decorators, Statement... body) {
        return new FunctionDef(LINE, COLUMN, name, Collections.singletonList("data"), decorators,
                               Arrays.asList(body), false);
    }

    public static FunctionDef method(String name, List<String> parameters, boolean async, Statement... body) {
        return new FunctionDef(LINE, COLUMN, name, parameters, Collections.emptyList(), Arrays.asList(body), async);
    }

    public static Assign assign(Expression target, Expression value) {
        return new Assign(LINE, COLUMN, Collections.singletonList(target), value);
    }

    public static ExprStatement expr(Expression value) {
        return new ExprStatement(LINE, COLUMN, value);
    }

    public static If ifThen(Expression test, Statement... body) {
        return new If(LINE, COLUMN, test, Arrays.asList(body), Collections.emptyList());
    }

    public static If ifElse(Expression test, List<Statement> body, List<Statement> orelse) {
        return new If(LINE, COLUMN, test, body, orelse);
    }

    public static Raise raise(Expression exception) {
        return new Raise(LINE, COLUMN, exception);
    }

    public static Return ret() {
        return new Return(LINE, COLUMN, null);
    }

    public static Try tryExcept(List<Statement> body, ExceptHandler... handlers) {
        return new Try(LINE, COLUMN, body, Arrays.asList(handlers), Collections.emptyList(), Collections.emptyList());
    }

    public static Try tryFull(List<Statement> body, List<ExceptHandler> handlers, List<Statement> orelse,
                              List<Statement> finalbody) {
        return new Try(LINE, COLUMN, body, handlers, orelse, finalbody);
    }

    /**
     * @param type The caught exception expression, or null for a bare {@code except:}.
     */
    public static ExceptHandler handler(Expression type, Statement... body) {
        return new ExceptHandler(LINE, COLUMN, type, null, Arrays.asList(body));
    }

    public static With with(Expression item, Statement... body) {
        return new With(LINE, COLUMN, Collections.singletonList(item), Arrays.asList(body));
    }

    public static Pass pass() {
        return new Pass(LINE, COLUMN);
    }

    public static Import importModules(String... modules) {
        List<ImportAlias> aliases = new ArrayList<>();
        for (String module : modules) {
            aliases.add(new ImportAlias(module, null));
        }
        return new Import(LINE, COLUMN, aliases);
    }

    public static ImportFrom importFrom(String module, String... names) {
        List<ImportAlias> aliases = new ArrayList<>();
        for (String name : names) {
            aliases.add(new ImportAlias(name, null));
        }
        return new ImportFrom(LINE, COLUMN, module, aliases, 0);
    }

    public static OpaqueStatement opaque(String kind, String source) {
        return new OpaqueStatement(LINE, COLUMN, kind, source);
    }

    public static Name name(String id) {
        return new Name(LINE, COLUMN, id);
    }

    public static Attribute attr(Expression value, String attr) {
        return new Attribute(LINE, COLUMN, value, attr);
    }

    /**
     * Builds {@code data['a']['b']...} for the given keys.
     */
    public static Expression data(String... keys) {
        Expression result = name("data");
        for (String key : keys) {
            result = new Subscript(LINE, COLUMN, result, str(key));
        }
        return result;
    }

    public static Call call(String func, Expression... args) {
        return new Call(LINE, COLUMN, name(func), Arrays.asList(args), Collections.emptyList());
    }

    public static Call call(Expression func, List<Expression> args, Keyword... keywords) {
        return new Call(LINE, COLUMN, func, args, Arrays.asList(keywords));
    }

    public static Call call(String func, List<Expression> args, Keyword... keywords) {
        return call(name(func), args, keywords);
    }

    public static Keyword keyword(String arg, Expression value) {
        return new Keyword(LINE, COLUMN, arg, value);
    }

    public static Constant str(String value) {
        return new Constant(LINE, COLUMN, value);
    }

    public static Constant num(long value) {
        return new Constant(LINE, COLUMN, value);
    }

    public static Constant num(double value) {
        return new Constant(LINE, COLUMN, value);
    }

    public static Constant bool(boolean value) {
        return new Constant(LINE, COLUMN, value);
    }

    public static Constant none() {
        return new Constant(LINE, COLUMN, null);
    }

    /**
     * Builds a dict literal from alternating keys and values.
     */
    public static DictExpr dict(Expression... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values.");
        }
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            keys.add(keysAndValues[i]);
            values.add(keysAndValues[i + 1]);
        }
        return new DictExpr(LINE, COLUMN, keys, values);
    }

    public static ListExpr list(Expression... elements) {
        return new ListExpr(LINE, COLUMN, Arrays.asList(elements));
    }

    public static TupleExpr tuple(Expression... elements) {
        return new TupleExpr(LINE, COLUMN, Arrays.asList(elements));
    }

    public static BoolOp and(Expression... values) {
        return new BoolOp(LINE, COLUMN, BoolOp.Operator.AND, Arrays.asList(values));
    }

    public static BoolOp or(Expression... values) {
        return new BoolOp(LINE, COLUMN, BoolOp.Operator.OR, Arrays.asList(values));
    }

    public static UnaryOp not(Expression operand) {
        return new UnaryOp(LINE, COLUMN, UnaryOp.Operator.NOT, operand);
    }

    public static Compare compare(Expression left, CompareOperator operator, Expression right) {
        return new Compare(LINE, COLUMN, left, Collections.singletonList(operator), Collections.singletonList(right));
    }
}

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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.danielgmyers.fluxio.ex.ScriptTreeFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a script tree from the json dump of the host language's abstract syntax tree.
 *
 * Every json object carries its node type in the {@code _type} field and its position in {@code lineno}
 * and {@code col_offset}. Both the current and the legacy literal forms ({@code Str}, {@code Num},
 * {@code NameConstant}, {@code Index}) are accepted. Statement types the compiler does not model are read as
 * {@link OpaqueStatement}s, taking their text from an optional {@code source} field.
 */
public final class ScriptTreeReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String TYPE_FIELD = "_type";

    private ScriptTreeReader() {}

    public static ModuleNode read(String json) {
        try {
            return readModule(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ScriptTreeFormatException("The script tree is not valid json.", e);
        }
    }

    public static ModuleNode read(InputStream json) {
        try {
            return readModule(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new ScriptTreeFormatException("Unable to read the script tree.", e);
        }
    }

    public static ModuleNode readModule(JsonNode root) {
        if (root == null || !root.isObject() || !"Module".equals(type(root))) {
            throw new ScriptTreeFormatException("The root of a script tree must be a Module node.");
        }
        return new ModuleNode(statements(root.get("body")));
    }

    private static String type(JsonNode node) {
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual()) {
            throw new ScriptTreeFormatException("Script tree node is missing its " + TYPE_FIELD + " field: " + node);
        }
        return type.asText();
    }

    private static int line(JsonNode node) {
        return node.path("lineno").asInt(1);
    }

    private static int column(JsonNode node) {
        return node.path("col_offset").asInt(0);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ScriptTreeFormatException(String.format("%s node is missing its %s field.", type(node), field));
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        return required(node, field).asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }

    private static List<Statement> statements(JsonNode array) {
        if (array == null || array.isNull()) {
            return Collections.emptyList();
        }
        List<Statement> result = new ArrayList<>();
        for (JsonNode element : array) {
            result.add(statement(element));
        }
        return result;
    }

    private static List<Expression> expressions(JsonNode array) {
        if (array == null || array.isNull()) {
            return Collections.emptyList();
        }
        List<Expression> result = new ArrayList<>();
        for (JsonNode element : array) {
            result.add(expression(element));
        }
        return result;
    }

    private static Expression optionalExpression(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : expression(value);
    }

    private static Statement statement(JsonNode node) {
        int line = line(node);
        int column = column(node);
        String type = type(node);
        switch (type) {
            case "ClassDef":
                return new ClassDef(line, column, text(node, "name"), expressions(node.get("bases")),
                                    statements(node.get("body")));
            case "FunctionDef":
            case "AsyncFunctionDef":
                return new FunctionDef(line, column, text(node, "name"), parameters(node.get("args")),
                                       expressions(node.get("decorator_list")), statements(node.get("body")),
                                       "AsyncFunctionDef".equals(type));
            case "Assign":
                return new Assign(line, column, expressions(required(node, "targets")),
                                  expression(required(node, "value")));
            case "Expr":
                return new ExprStatement(line, column, expression(required(node, "value")));
            case "If":
                return new If(line, column, expression(required(node, "test")), statements(node.get("body")),
                              statements(node.get("orelse")));
            case "Raise":
                return new Raise(line, column, optionalExpression(node, "exc"));
            case "Return":
                return new Return(line, column, optionalExpression(node, "value"));
            case "Try":
                return new Try(line, column, statements(node.get("body")), handlers(node.get("handlers")),
                               statements(node.get("orelse")), statements(node.get("finalbody")));
            case "With":
                return new With(line, column, withItems(node.get("items")), statements(node.get("body")));
            case "Pass":
                return new Pass(line, column);
            case "Import":
                return new Import(line, column, aliases(node.get("names")));
            case "ImportFrom":
                return new ImportFrom(line, column, optionalText(node, "module"), aliases(node.get("names")),
                                      node.path("level").asInt(0));
            default:
                return new OpaqueStatement(line, column, type, optionalText(node, "source"));
        }
    }

    private static List<String> parameters(JsonNode arguments) {
        List<String> result = new ArrayList<>();
        if (arguments == null || arguments.isNull()) {
            return result;
        }
        for (String field : new String[] {"posonlyargs", "args"}) {
            for (JsonNode arg : arguments.path(field)) {
                result.add(text(arg, "arg"));
            }
        }
        return result;
    }

    private static List<ExceptHandler> handlers(JsonNode array) {
        List<ExceptHandler> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (JsonNode handler : array) {
            result.add(new ExceptHandler(line(handler), column(handler), optionalExpression(handler, "type"),
                                         optionalText(handler, "name"), statements(handler.get("body"))));
        }
        return result;
    }

    private static List<Expression> withItems(JsonNode array) {
        List<Expression> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (JsonNode item : array) {
            // {"context_expr": ...} wrappers on current parsers, bare expressions on older ones.
            result.add(expression(item.has("context_expr") ? item.get("context_expr") : item));
        }
        return result;
    }

    private static List<ImportAlias> aliases(JsonNode array) {
        List<ImportAlias> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (JsonNode alias : array) {
            result.add(new ImportAlias(text(alias, "name"), optionalText(alias, "asname")));
        }
        return result;
    }

    private static Expression expression(JsonNode node) {
        int line = line(node);
        int column = column(node);
        String type = type(node);
        switch (type) {
            case "Name":
                return new Name(line, column, text(node, "id"));
            case "Attribute":
                return new Attribute(line, column, expression(required(node, "value")), text(node, "attr"));
            case "Subscript":
                return new Subscript(line, column, expression(required(node, "value")),
                                     expression(required(node, "slice")));
            case "Index":
                return expression(required(node, "value"));
            case "Call":
                return new Call(line, column, expression(required(node, "func")), expressions(node.get("args")),
                                keywords(node.get("keywords")));
            case "Constant":
            case "NameConstant":
                return new Constant(line, column, literal(node.get("value")));
            case "Str":
                return new Constant(line, column, text(node, "s"));
            case "Num":
                return new Constant(line, column, literal(required(node, "n")));
            case "Dict":
                return new DictExpr(line, column, expressions(node.get("keys")), expressions(node.get("values")));
            case "List":
                return new ListExpr(line, column, expressions(node.get("elts")));
            case "Tuple":
                return new TupleExpr(line, column, expressions(node.get("elts")));
            case "BoolOp":
                return new BoolOp(line, column, boolOperator(required(node, "op")), expressions(node.get("values")));
            case "UnaryOp":
                return unaryOp(node, line, column);
            case "Compare":
                return new Compare(line, column, expression(required(node, "left")), compareOperators(node.get("ops")),
                                   expressions(node.get("comparators")));
            default:
                throw new ScriptTreeFormatException(String.format("Unsupported expression type %s at line %d, column %d.",
                                                                  type, line, column));
        }
    }

    private static List<Keyword> keywords(JsonNode array) {
        List<Keyword> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (JsonNode keyword : array) {
            result.add(new Keyword(line(keyword), column(keyword), optionalText(keyword, "arg"),
                                   expression(required(keyword, "value"))));
        }
        return result;
    }

    private static Object literal(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        } else if (value.isTextual()) {
            return value.asText();
        } else if (value.isBoolean()) {
            return value.asBoolean();
        } else if (value.isIntegralNumber()) {
            return value.asLong();
        } else if (value.isNumber()) {
            return value.asDouble();
        }
        throw new ScriptTreeFormatException("Unsupported constant value: " + value);
    }

    private static BoolOp.Operator boolOperator(JsonNode op) {
        String type = type(op);
        if ("And".equals(type)) {
            return BoolOp.Operator.AND;
        } else if ("Or".equals(type)) {
            return BoolOp.Operator.OR;
        }
        throw new ScriptTreeFormatException("Unsupported boolean operator: " + type);
    }

    private static Expression unaryOp(JsonNode node, int line, int column) {
        String op = type(required(node, "op"));
        Expression operand = expression(required(node, "operand"));
        if ("Not".equals(op)) {
            return new UnaryOp(line, column, UnaryOp.Operator.NOT, operand);
        }
        if (("USub".equals(op) || "UAdd".equals(op)) && operand instanceof Constant
                && ((Constant)operand).isNumber()) {
            Object value = ((Constant)operand).getValue();
            if ("UAdd".equals(op)) {
                return new Constant(line, column, value);
            } else if (value instanceof Long) {
                return new Constant(line, column, -(Long)value);
            }
            return new Constant(line, column, -(Double)value);
        }
        throw new ScriptTreeFormatException(String.format("Unsupported unary operator %s at line %d, column %d.",
                                                          op, line, column));
    }

    private static List<CompareOperator> compareOperators(JsonNode array) {
        List<CompareOperator> result = new ArrayList<>();
        if (array == null) {
            return result;
        }
        for (JsonNode op : array) {
            String type = type(op);
            switch (type) {
                case "Eq": result.add(CompareOperator.EQ); break;
                case "NotEq": result.add(CompareOperator.NOT_EQ); break;
                case "Lt": result.add(CompareOperator.LT); break;
                case "LtE": result.add(CompareOperator.LT_E); break;
                case "Gt": result.add(CompareOperator.GT); break;
                case "GtE": result.add(CompareOperator.GT_E); break;
                case "In": result.add(CompareOperator.IN); break;
                case "NotIn": result.add(CompareOperator.NOT_IN); break;
                case "Is": result.add(CompareOperator.IS); break;
                case "IsNot": result.add(CompareOperator.IS_NOT); break;
                default:
                    throw new ScriptTreeFormatException("Unsupported comparison operator: " + type);
            }
        }
        return result;
    }
}

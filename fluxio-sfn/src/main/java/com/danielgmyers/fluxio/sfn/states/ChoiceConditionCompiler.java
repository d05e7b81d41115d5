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

package com.danielgmyers.fluxio.sfn.states;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.BoolOp;
import com.danielgmyers.fluxio.ast.Call;
import com.danielgmyers.fluxio.ast.Compare;
import com.danielgmyers.fluxio.ast.CompareOperator;
import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.UnaryOp;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.util.InputDataReferences;

/**
 * Lowers the test of a conditional into a Choice rule.
 *
 * Boolean logic maps onto And/Or/Not rules. A comparison must have an input data reference on its left side
 * and a literal on its right side; the literal's type (or an explicit cast on either side) selects the typed
 * comparison operator, e.g. {@code data["foo"] > 10} becomes
 * {@code {"Variable": "$['foo']", "NumericGreaterThan": 10}}. Inequality is expressed as a negated equality,
 * and {@code bool(data["x"])} tests the value for equality with true.
 */
public final class ChoiceConditionCompiler {

    public static final String VARIABLE = "Variable";

    private static final Map<CompareOperator, String> OPERATOR_NAMES = new EnumMap<>(CompareOperator.class);

    static {
        OPERATOR_NAMES.put(CompareOperator.EQ, "Equals");
        OPERATOR_NAMES.put(CompareOperator.NOT_EQ, "Equals");
        OPERATOR_NAMES.put(CompareOperator.LT, "LessThan");
        OPERATOR_NAMES.put(CompareOperator.GT, "GreaterThan");
        OPERATOR_NAMES.put(CompareOperator.LT_E, "LessThanEquals");
        OPERATOR_NAMES.put(CompareOperator.GT_E, "GreaterThanEquals");
    }

    private static final String INVALID_CONDITION
            = "Invalid conditional statement. Most likely there is no comparison or boolean logic present.";

    private enum ValueType {
        STRING("String"),
        NUMERIC("Numeric"),
        BOOLEAN("Boolean");

        private final String rulePrefix;

        ValueType(String rulePrefix) {
            this.rulePrefix = rulePrefix;
        }
    }

    private enum Cast {
        STR("str", ValueType.STRING),
        INT("int", ValueType.NUMERIC),
        FLOAT("float", ValueType.NUMERIC),
        BOOL("bool", ValueType.BOOLEAN);

        private final String function;
        private final ValueType type;

        Cast(String function, ValueType type) {
            this.function = function;
            this.type = type;
        }

        static Cast forFunction(String function) {
            for (Cast cast : values()) {
                if (cast.function.equals(function)) {
                    return cast;
                }
            }
            return null;
        }
    }

    private ChoiceConditionCompiler() {}

    public static Map<String, Object> compile(Expression test) {
        if (test instanceof BoolOp) {
            BoolOp boolOp = (BoolOp)test;
            List<Object> rules = new ArrayList<>();
            for (Expression value : boolOp.getValues()) {
                rules.add(compile(value));
            }
            Map<String, Object> rule = new LinkedHashMap<>();
            rule.put(boolOp.getOperator() == BoolOp.Operator.AND ? "And" : "Or", rules);
            return rule;
        } else if (test instanceof UnaryOp) {
            Expression operand = ((UnaryOp)test).getOperand();
            Map<String, Object> rule = new LinkedHashMap<>();
            rule.put("Not", compile(operand));
            return rule;
        } else if (test instanceof Compare) {
            return compileComparison((Compare)test);
        } else if (test instanceof Call) {
            Call call = (Call)test;
            Cast cast = checkCast(call);
            if (cast == Cast.BOOL) {
                return rule(variablePath(call.getArgs().get(0), test), ValueType.BOOLEAN, CompareOperator.EQ, true);
            }
        }
        throw new WorkflowGraphBuildException(INVALID_CONDITION, test);
    }

    private static Map<String, Object> compileComparison(Compare compare) {
        WorkflowGraphBuildException.check(compare.getOperators().size() == 1,
                                          "Only 1 comparison operator at a time is allowed", compare);
        WorkflowGraphBuildException.check(compare.getComparators().size() == 1,
                                          "Only 1 comparator at a time is allowed", compare);

        CompareOperator operator = compare.getOperators().get(0);
        if (!OPERATOR_NAMES.containsKey(operator)) {
            throw new WorkflowGraphBuildException(
                    String.format("The `%s` operator is not supported in Choice states", operator.getSymbol()),
                    compare);
        }

        Expression left = compare.getLeft();
        Cast leftCast = null;
        if (left instanceof Call) {
            leftCast = checkCast((Call)left);
            left = ((Call)left).getArgs().get(0);
        }
        String variable = variablePath(left, compare);

        Expression right = compare.getComparators().get(0);
        Cast rightCast = null;
        if (right instanceof Call) {
            rightCast = checkCast((Call)right);
            right = ((Call)right).getArgs().get(0);
        }
        if (InputDataReferences.isReference(right) || InputDataReferences.isInputObject(right)) {
            throw new WorkflowGraphBuildException("Input data cannot be used as the comparator (right side of operation)",
                                                  compare);
        }
        if (!(right instanceof Constant)) {
            throw new WorkflowGraphBuildException("Could not determine data type for choice variable", right);
        }
        Constant literal = (Constant)right;
        if (literal.isNone()) {
            throw new WorkflowGraphBuildException("The value `None` is not allowed in Choice states", compare);
        }

        Object value = rightCast == null ? literal.getValue() : convert(rightCast, literal);
        ValueType type = typeOf(value);
        String typeName = rightCast == null ? scriptTypeName(value) : rightCast.function;
        if (leftCast != null && leftCast.type != type) {
            throw new WorkflowGraphBuildException(
                    String.format("Value types must match. Found: %s and %s", leftCast.function, typeName), compare);
        }
        if (type == ValueType.BOOLEAN && operator != CompareOperator.EQ && operator != CompareOperator.NOT_EQ) {
            throw new WorkflowGraphBuildException("Boolean values can only be compared with == and !=", compare);
        }

        Map<String, Object> rule = rule(variable, type, operator, value);
        if (operator == CompareOperator.NOT_EQ) {
            Map<String, Object> negated = new LinkedHashMap<>();
            negated.put("Not", rule);
            return negated;
        }
        return rule;
    }

    private static Map<String, Object> rule(String variable, ValueType type, CompareOperator operator, Object value) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put(VARIABLE, variable);
        rule.put(type.rulePrefix + OPERATOR_NAMES.get(operator), value);
        return rule;
    }

    private static String variablePath(Expression expression, Expression context) {
        if (!InputDataReferences.isReference(expression)) {
            throw new WorkflowGraphBuildException(
                    "The left side of a comparison must be a reference to a key on `data`", context);
        }
        return InputDataReferences.toPath(expression);
    }

    private static Cast checkCast(Call call) {
        String function = call.getFuncName();
        Cast cast = Cast.forFunction(function);
        if (cast == null) {
            throw new WorkflowGraphBuildException(
                    String.format("Function %s is not supported. Allowed built-ins: str, int, float, bool",
                                  function == null ? call.getFunc() : function), call);
        }
        WorkflowGraphBuildException.check(call.getArgs().size() == 1 && call.getKeywords().isEmpty(),
                                          "Data type casting functions only accept 1 positional argument", call);
        return cast;
    }

    private static Object convert(Cast cast, Constant literal) {
        Object value = literal.getValue();
        try {
            switch (cast) {
                case STR:
                    return value instanceof Boolean ? ((Boolean)value ? "True" : "False") : String.valueOf(value);
                case INT:
                    if (value instanceof String) {
                        return Long.parseLong(((String)value).trim());
                    } else if (value instanceof Boolean) {
                        return (Boolean)value ? 1L : 0L;
                    }
                    return ((Number)value).longValue();
                case FLOAT:
                    if (value instanceof String) {
                        return Double.parseDouble(((String)value).trim());
                    } else if (value instanceof Boolean) {
                        return (Boolean)value ? 1.0 : 0.0;
                    }
                    return ((Number)value).doubleValue();
                case BOOL:
                default:
                    if (value instanceof String) {
                        return !((String)value).isEmpty();
                    } else if (value instanceof Number) {
                        return ((Number)value).doubleValue() != 0.0;
                    }
                    return value;
            }
        } catch (NumberFormatException e) {
            throw new WorkflowGraphBuildException(String.format("Could not convert %s using %s()",
                                                                literal, cast.function), literal, e);
        }
    }

    private static ValueType typeOf(Object value) {
        if (value instanceof String) {
            return ValueType.STRING;
        } else if (value instanceof Boolean) {
            return ValueType.BOOLEAN;
        }
        return ValueType.NUMERIC;
    }

    private static String scriptTypeName(Object value) {
        if (value instanceof String) {
            return "str";
        } else if (value instanceof Boolean) {
            return "bool";
        } else if (value instanceof Long) {
            return "int";
        }
        return "float";
    }
}

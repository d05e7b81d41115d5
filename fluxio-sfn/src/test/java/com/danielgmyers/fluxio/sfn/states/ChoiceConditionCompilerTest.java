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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Compare;
import com.danielgmyers.fluxio.ast.CompareOperator;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class ChoiceConditionCompilerTest {

    private static Map<String, Object> rule(String variable, String operator, Object value) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put(ChoiceConditionCompiler.VARIABLE, variable);
        rule.put(operator, value);
        return rule;
    }

    private static void assertError(String expectedReason, Expression test) {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                                                                () -> ChoiceConditionCompiler.compile(test));
        Assertions.assertEquals(expectedReason, e.getReason());
    }

    @Test
    public void testTypedComparisons() {
        Assertions.assertEquals(rule("$['count']", "NumericGreaterThan", 10L),
                                ChoiceConditionCompiler.compile(compare(data("count"), CompareOperator.GT, num(10))));
        Assertions.assertEquals(rule("$['ratio']", "NumericLessThanEquals", 0.5),
                                ChoiceConditionCompiler.compile(compare(data("ratio"), CompareOperator.LT_E,
                                                                        num(0.5))));
        Assertions.assertEquals(rule("$['order']['status']", "StringEquals", "paid"),
                                ChoiceConditionCompiler.compile(compare(data("order", "status"), CompareOperator.EQ,
                                                                        str("paid"))));
        Assertions.assertEquals(rule("$['ready']", "BooleanEquals", true),
                                ChoiceConditionCompiler.compile(compare(data("ready"), CompareOperator.EQ,
                                                                        bool(true))));
    }

    @Test
    public void testInequalityIsNegated() {
        Assertions.assertEquals(Collections.singletonMap("Not", rule("$['state']", "StringEquals", "done")),
                                ChoiceConditionCompiler.compile(compare(data("state"), CompareOperator.NOT_EQ,
                                                                        str("done"))));
    }

    @Test
    public void testBooleanLogic() {
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("And", Arrays.asList(
                rule("$['a']", "NumericGreaterThanEquals", 1L),
                Collections.singletonMap("Or", Arrays.asList(
                        rule("$['b']", "BooleanEquals", true),
                        Collections.singletonMap("Not", rule("$['c']", "StringLessThan", "m"))))));

        Assertions.assertEquals(expected, ChoiceConditionCompiler.compile(
                and(compare(data("a"), CompareOperator.GT_E, num(1)),
                    or(call("bool", data("b")),
                       not(compare(data("c"), CompareOperator.LT, str("m")))))));
    }

    @Test
    public void testCasts() {
        Assertions.assertEquals(rule("$['n']", "NumericGreaterThan", 5L),
                                ChoiceConditionCompiler.compile(compare(call("int", data("n")), CompareOperator.GT,
                                                                        call("int", str(" 5 ")))));
        Assertions.assertEquals(rule("$['n']", "NumericEquals", 1.5),
                                ChoiceConditionCompiler.compile(compare(data("n"), CompareOperator.EQ,
                                                                        call("float", str("1.5")))));
        Assertions.assertEquals(rule("$['flag']", "StringEquals", "True"),
                                ChoiceConditionCompiler.compile(compare(data("flag"), CompareOperator.EQ,
                                                                        call("str", bool(true)))));
        Assertions.assertEquals(rule("$['n']", "BooleanEquals", false),
                                ChoiceConditionCompiler.compile(compare(data("n"), CompareOperator.EQ,
                                                                        call("bool", num(0)))));
    }

    @Test
    public void testCastErrors() {
        assertError("Value types must match. Found: int and str",
                    compare(call("int", data("n")), CompareOperator.EQ, str("5")));
        assertError("Function len is not supported. Allowed built-ins: str, int, float, bool",
                    compare(call("len", data("items")), CompareOperator.GT, num(0)));
        assertError("Data type casting functions only accept 1 positional argument",
                    compare(call("int", data("n"), num(10)), CompareOperator.GT, num(0)));
        Assertions.assertTrue(Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> ChoiceConditionCompiler.compile(compare(data("n"), CompareOperator.EQ, call("int", str("x")))))
                .getReason().startsWith("Could not convert"));
    }

    @Test
    public void testComparisonErrors() {
        assertError("The `in` operator is not supported in Choice states",
                    compare(str("a"), CompareOperator.IN, data("letters")));
        assertError("The `is not` operator is not supported in Choice states",
                    compare(data("a"), CompareOperator.IS_NOT, none()));
        assertError("The value `None` is not allowed in Choice states",
                    compare(data("a"), CompareOperator.EQ, none()));
        assertError("Input data cannot be used as the comparator (right side of operation)",
                    compare(data("a"), CompareOperator.EQ, data("b")));
        assertError("The left side of a comparison must be a reference to a key on `data`",
                    compare(name("limit"), CompareOperator.LT, num(3)));
        assertError("Could not determine data type for choice variable",
                    compare(data("a"), CompareOperator.EQ, list(num(1))));
        assertError("Boolean values can only be compared with == and !=",
                    compare(data("a"), CompareOperator.GT, bool(false)));
        assertError("Only 1 comparison operator at a time is allowed",
                    new Compare(1, 0, num(1), Arrays.asList(CompareOperator.LT, CompareOperator.LT),
                                Arrays.asList(data("a"), num(3))));
    }

    @Test
    public void testTestsWithoutComparison() {
        String reason = "Invalid conditional statement. Most likely there is no comparison or boolean logic present.";
        assertError(reason, data("flag"));
        assertError(reason, call("int", data("flag")));
    }
}

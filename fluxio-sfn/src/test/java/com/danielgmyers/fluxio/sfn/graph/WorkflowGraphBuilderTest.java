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

package com.danielgmyers.fluxio.sfn.graph;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.CompareOperator;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.sfn.CompiledScript;
import com.danielgmyers.fluxio.util.NodeHashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;
import static com.danielgmyers.fluxio.sfn.TestScripts.*;

public class WorkflowGraphBuilderTest {

    private static String passKey(Assign node) {
        return "Pass-" + NodeHashing.hash(node, "main");
    }

    private static Map<String, Object> state(Map<String, Object> document, String key) {
        Map<String, Object> state = asMap(states(document).get(key));
        Assertions.assertNotNull(state, "Missing state " + key);
        return state;
    }

    private static List<Map<String, Object>> entries(Map<String, Object> state, String field) {
        return asMapList(state.get(field));
    }

    @Test
    public void testIfReturnFollowedByAssignment() {
        Assign assignment = assign(data("x"), num(1));
        Map<String, Object> document = document("main", main(
                ifThen(compare(data("foo"), CompareOperator.EQ, str("ok")), ret()),
                assignment));

        String choiceKey = keyWithPrefix(document, "Choice-");
        String succeedKey = keyWithPrefix(document, "Succeed-");
        Assertions.assertEquals(choiceKey, document.get("StartAt"));
        Assertions.assertEquals(3, states(document).size());

        Map<String, Object> choice = state(document, choiceKey);
        Assertions.assertEquals(passKey(assignment), choice.get("Default"));
        List<Map<String, Object>> choices = entries(choice, "Choices");
        Assertions.assertEquals(1, choices.size());
        Assertions.assertEquals("$['foo']", choices.get(0).get("Variable"));
        Assertions.assertEquals("ok", choices.get(0).get("StringEquals"));
        Assertions.assertEquals(succeedKey, choices.get(0).get("Next"));

        Map<String, Object> pass = state(document, passKey(assignment));
        Assertions.assertEquals(1L, pass.get("Result"));
        Assertions.assertEquals("$['x']", pass.get("ResultPath"));
        Assertions.assertEquals(true, pass.get("End"));
    }

    @Test
    public void testRaiseWithMessage() {
        Map<String, Object> document = document("main", main(
                raise(call("CustomError", str("Something went wrong")))));

        Map<String, Object> fail = stateWithPrefix(document, "Fail-");
        Assertions.assertEquals("Fail", fail.get("Type"));
        Assertions.assertEquals("CustomError", fail.get("Error"));
        Assertions.assertEquals("Something went wrong", fail.get("Cause"));
        Assertions.assertFalse(fail.containsKey("End"));
    }

    @Test
    public void testRaiseWithoutMessageUsesErrorAsCause() {
        Map<String, Object> fail = stateWithPrefix(document("main", main(raise(name("CustomError")))), "Fail-");
        Assertions.assertEquals("CustomError", fail.get("Error"));
        Assertions.assertEquals("CustomError", fail.get("Cause"));

        fail = stateWithPrefix(document("main", main(raise(call(attr(name("States"), "Timeout"),
                                                               Collections.emptyList())))), "Fail-");
        Assertions.assertEquals("States.Timeout", fail.get("Error"));
        Assertions.assertEquals("States.Timeout", fail.get("Cause"));
    }

    @Test
    public void testRaiseRejectsNonStringCause() {
        assertCompileError("The exception message must be a string literal",
                           main(raise(call("CustomError", num(1)))));
    }

    @Test
    public void testStatementAfterReturn() {
        assertCompileError("Statements cannot follow a return or raise statement",
                           main(ret(), assign(data("x"), num(1))));
    }

    @Test
    public void testEmptyFunction() {
        assertCompileError("A state machine function must contain at least one state",
                           main(expr(str("Only a docstring."))));
    }

    @Test
    public void testReservedKey() {
        assertCompileError("$['__trace'] is a reserved key", main(assign(data("__trace"), num(1))));
    }

    @Test
    public void testAssignmentTargetMustBeData() {
        assertCompileError("Assignment target must be a key on `data`", main(assign(name("x"), num(1))));
    }

    @Test
    public void testAssignmentFromReferenceAndDict() {
        Assign copy = assign(data("copy"), data("original"));
        Assign build = assign(data("built"), dict(str("a"), data("original"), str("b"), num(2)));
        Map<String, Object> document = document("main", main(copy, build));

        Map<String, Object> copyState = state(document, passKey(copy));
        Assertions.assertEquals("$['original']", copyState.get("InputPath"));
        Assertions.assertEquals("$['copy']", copyState.get("ResultPath"));
        Assertions.assertEquals(passKey(build), copyState.get("Next"));

        Map<String, Object> buildState = state(document, passKey(build));
        Map<String, Object> parameters = asMap(buildState.get("Parameters"));
        Assertions.assertEquals("$['original']", parameters.get("a.$"));
        Assertions.assertEquals(2L, parameters.get("b"));
        Assertions.assertFalse(buildState.containsKey("Result"));
    }

    @Test
    public void testDataUpdate() {
        ExprStatement update = expr(call(attr(name("data"), "update"), Arrays.asList(dict(str("a"), num(1)))));
        Map<String, Object> pass = stateWithPrefix(document("main", main(update)), "Pass-");
        Assertions.assertEquals(Collections.singletonMap("a", 1L), pass.get("Result"));
        Assertions.assertEquals("$", pass.get("ResultPath"));

        assertCompileError("`data.update()` requires exactly one dict argument",
                           main(expr(call(attr(name("data"), "update"), Arrays.asList(str("a"))))));
        assertCompileError("The only supported method call is `data.update()`",
                           main(expr(call(attr(name("data"), "pop"), Arrays.asList(str("a"))))));
    }

    @Test
    public void testPassValuesMustBeLiterals() {
        assertCompileError("Value must be JSON-serializeable",
                           main(assign(data("array"), call("range", num(10)))));
        assertCompileError("Value must be JSON-serializeable",
                           main(expr(call(attr(name("data"), "update"),
                                          Arrays.asList(dict(str("hello"), call("range", num(10))))))));
    }

    @Test
    public void testWaitSecondsAndPath() {
        Map<String, Object> wait = stateWithPrefix(document("main", main(
                expr(call("wait", Collections.emptyList(), keyword("seconds", num(10)))))), "Wait-");
        Assertions.assertEquals(10L, wait.get("Seconds"));
        Assertions.assertEquals(true, wait.get("End"));

        wait = stateWithPrefix(document("main", main(
                expr(call("wait", Collections.emptyList(), keyword("timestamp", data("when")))))), "Wait-");
        Assertions.assertEquals("$['when']", wait.get("TimestampPath"));
    }

    @Test
    public void testWaitRequiresExactlyOneOption() {
        assertCompileError("The wait state requires exactly one of the seconds or timestamp options",
                           main(expr(call("wait", Collections.emptyList()))));
        assertCompileError("The wait state requires exactly one of the seconds or timestamp options",
                           main(expr(call("wait", Collections.emptyList(), keyword("seconds", num(1)),
                                          keyword("timestamp", str("2020-01-01T00:00:00Z"))))));
    }

    @Test
    public void testWaitRejectsOtherArguments() {
        assertCompileError("Valid keyword", main(expr(call("wait", Collections.emptyList(),
                                                          keyword("bad", data("ts"))))));
        assertCompileError("Valid keyword", main(expr(call("wait", num(10)))));
    }

    @Test
    public void testUnsupportedExpression() {
        assertCompileError("Supported expressions include:", main(expr(call("print", str("hello")))));
    }

    @Test
    public void testElifChainIsFlattened() {
        If chain = ifElse(compare(data("a"), CompareOperator.EQ, num(1)),
                          Collections.singletonList(ret()),
                          Collections.singletonList(ifElse(compare(data("a"), CompareOperator.EQ, num(2)),
                                                           Collections.singletonList(raise(name("Oops"))),
                                                           Collections.singletonList(assign(data("z"), num(0))))));
        Map<String, Object> document = document("main", main(chain));

        Map<String, Object> choice = stateWithPrefix(document, "Choice-");
        List<Map<String, Object>> choices = entries(choice, "Choices");
        Assertions.assertEquals(2, choices.size());
        Assertions.assertEquals(1L, choices.get(0).get("NumericEquals"));
        Assertions.assertEquals(keyWithPrefix(document, "Succeed-"), choices.get(0).get("Next"));
        Assertions.assertEquals(2L, choices.get(1).get("NumericEquals"));
        Assertions.assertEquals(keyWithPrefix(document, "Fail-"), choices.get(1).get("Next"));
        Assertions.assertEquals(keyWithPrefix(document, "Pass-"), choice.get("Default"));
    }

    @Test
    public void testElseMayContainOneStatement() {
        assertCompileError("A maximum of 1 state can be included in an `else` clause",
                           main(ifElse(compare(data("a"), CompareOperator.EQ, num(1)),
                                       Collections.singletonList(ret()),
                                       Arrays.asList(assign(data("x"), num(1)), assign(data("y"), num(2))))));
    }

    @Test
    public void testNestedConditionalsConverge() {
        Assign x = assign(data("x"), num(1));
        Assign y = assign(data("y"), num(2));
        Assign z = assign(data("z"), num(3));
        If inner = ifThen(compare(data("b"), CompareOperator.EQ, num(2)), x);
        If outer = ifElse(compare(data("a"), CompareOperator.EQ, num(1)), Arrays.asList(inner, y),
                          Collections.emptyList());
        Map<String, Object> document = document("main", main(outer, z));

        String outerKey = (String)document.get("StartAt");
        String innerKey = null;
        for (Map.Entry<String, Object> entry : states(document).entrySet()) {
            if (!entry.getKey().equals(outerKey) && entry.getKey().startsWith("Choice-")) {
                innerKey = entry.getKey();
            }
        }
        Assertions.assertNotNull(innerKey);

        Map<String, Object> outerChoice = state(document, outerKey);
        Assertions.assertEquals(innerKey, entries(outerChoice, "Choices").get(0).get("Next"));
        Assertions.assertEquals(passKey(z), outerChoice.get("Default"));

        Map<String, Object> innerChoice = state(document, innerKey);
        Assertions.assertEquals(passKey(x), entries(innerChoice, "Choices").get(0).get("Next"));
        Assertions.assertEquals(passKey(y), innerChoice.get("Default"));

        Assertions.assertEquals(passKey(y), state(document, passKey(x)).get("Next"));
        Assertions.assertEquals(passKey(z), state(document, passKey(y)).get("Next"));
        Assertions.assertEquals(true, state(document, passKey(z)).get("End"));
        Assertions.assertEquals(5, states(document).size());
    }

    @Test
    public void testConditionalAtEndKeepsPlaceholder() {
        Map<String, Object> document = document("main", main(
                ifThen(compare(data("a"), CompareOperator.GT, num(1)), ret())));

        Map<String, Object> pass = stateWithPrefix(document, "Pass-");
        Assertions.assertEquals("Pass", pass.get("Type"));
        Assertions.assertEquals(true, pass.get("End"));
        Assertions.assertEquals(keyWithPrefix(document, "Pass-"), stateWithPrefix(document, "Choice-").get("Default"));
    }

    @Test
    public void testPassPlaceholderIsCollapsed() {
        Assign x = assign(data("x"), num(1));
        Map<String, Object> document = document("main", main(pass(), x));
        Assertions.assertEquals(passKey(x), document.get("StartAt"));
        Assertions.assertEquals(1, states(document).size());
    }

    @Test
    public void testSucceedKeysDifferAcrossFunctions() {
        Return first = ret();
        Return second = ret();
        CompiledScript script = compile(function("first", first), function("second", second));
        Assertions.assertEquals("Succeed-" + NodeHashing.hash(first, "first"),
                                script.toDocument("first").get("StartAt"));
        Assertions.assertNotEquals(script.toDocument("first").get("StartAt"),
                                   script.toDocument("second").get("StartAt"));
    }

    @Test
    public void testCompilationIsDeterministic() {
        String first = compile(task("Action"), main(assign(data("out"), call("Action", data("in"))),
                                                    ifThen(compare(data("out"), CompareOperator.EQ, bool(true)),
                                                           ret()))).toJson("main");
        String second = compile(task("Action"), main(assign(data("out"), call("Action", data("in"))),
                                                     ifThen(compare(data("out"), CompareOperator.EQ, bool(true)),
                                                            ret()))).toJson("main");
        Assertions.assertEquals(first, second);
    }

    @Test
    public void testTopLevelStatementsInsideFunction() {
        assertCompileError("Imports are not supported in state machine functions",
                           main(importModules("os")));
        assertCompileError("State machine functions must be declared at the top level",
                           main(function("inner", ret())));
        assertCompileError("while statements are not supported in state machine functions",
                           main(opaque("while", "while True:\n    pass")));
    }

    @Test
    public void testGraphCanOnlyBeSetOnce() {
        CompiledScript script = compile(main(ret()));
        Assertions.assertThrows(IllegalStateException.class,
                                () -> script.getStateMachine("main").setGraph(new WorkflowGraph()));
    }
}

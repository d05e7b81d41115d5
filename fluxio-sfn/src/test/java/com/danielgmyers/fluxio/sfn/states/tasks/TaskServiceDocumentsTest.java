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

package com.danielgmyers.fluxio.sfn.states.tasks;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Call;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Statement;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;
import static com.danielgmyers.fluxio.sfn.TestScripts.*;

/**
 * Compares whole rendered documents against the expected documents in task_services.json,
 * one per task service kind plus the call options every service shares.
 */
public class TaskServiceDocumentsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // 300 and 300L, or 2 and 2.0, are the same json number.
    private static final Comparator<JsonNode> NUMERIC_EQUALITY = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private static JsonNode expectedDocuments;

    @BeforeAll
    public static void loadExpectedDocuments() throws IOException {
        try (InputStream in = TaskServiceDocumentsTest.class.getResourceAsStream("/task_services.json")) {
            expectedDocuments = MAPPER.readTree(in);
        }
    }

    private static void assertDocument(String expectedName, Map<String, Object> actual) {
        JsonNode expected = expectedDocuments.get(expectedName);
        Assertions.assertNotNull(expected, "No expected document named " + expectedName);
        JsonNode rendered = MAPPER.valueToTree(actual);
        Assertions.assertTrue(expected.equals(NUMERIC_EQUALITY, rendered),
                              String.format("Expected %s%nbut got %s", expected, rendered));
    }

    private static Map<String, Object> compileAction(Statement call, Statement... attributes) {
        return document("main", task("Action", attributes), main(call));
    }

    private static Call action(Expression... args) {
        return call("Action", Arrays.asList(args), keyword("key", str("action")));
    }

    private static Statement service(String kind) {
        return assign(name("service"), str(kind));
    }

    @Test
    public void testDefaultServiceIsLambda() {
        assertDocument("default", compileAction(expr(call("Action"))));
    }

    @Test
    public void testLambda() {
        assertDocument("lambda", compileAction(expr(call("Action")), service("lambda")));
    }

    @Test
    public void testLambdaContainer() {
        assertDocument("lambda:container", compileAction(expr(call("Action")), service("lambda:container")));
    }

    @Test
    public void testLambdaPexpmRunner() {
        assertDocument("lambda:pexpm-runner", compileAction(expr(action()), service("lambda:pexpm-runner")));
    }

    @Test
    public void testEcs() {
        assertDocument("ecs", compileAction(expr(call("Action")), service("ecs")));
    }

    @Test
    public void testEcsWorker() {
        assertDocument("ecs:worker", compileAction(expr(call("Action")), service("ecs:worker")));
    }

    @Test
    public void testCodeBuild() {
        assertDocument("codebuild", compileAction(expr(call("Action")), service("codebuild")));
    }

    @Test
    public void testNestedStateMachine() {
        assertDocument("nested", document("main", function("nested", ret()),
                                          main(expr(call("nested", Collections.emptyList(),
                                                         keyword("key", str("nested")))))));
    }

    @Test
    public void testTimeoutOption() {
        assertDocument("timeout", compileAction(expr(call("Action", Collections.emptyList(),
                                                          keyword("key", str("action")),
                                                          keyword("timeout", num(10))))));
    }

    @Test
    public void testInputData() {
        assertDocument("input", compileAction(expr(action(data("input")))));
    }

    @Test
    public void testResultPath() {
        assertDocument("result_path", compileAction(assign(data("output"), action(data("input")))));
    }
}

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

package com.danielgmyers.fluxio.sfn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.testutil.StateMachineValidator;
import org.junit.jupiter.api.Assertions;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

/**
 * Shared helpers for building and compiling scripts in tests.
 */
public final class TestScripts {

    private TestScripts() {}

    /**
     * A work unit class with the given attribute assignments and an empty async run method.
     */
    public static ClassDef task(String name, Statement... attributes) {
        List<Statement> body = new ArrayList<>(Arrays.asList(attributes));
        body.add(method("run", Arrays.asList("event", "context"), true, ret()));
        return classDef(name, "Task", body.toArray(new Statement[0]));
    }

    public static FunctionDef main(Statement... body) {
        return function("main", body);
    }

    public static CompiledScript compile(Statement... declarations) {
        return new ScriptCompiler().compile(module(declarations));
    }

    /**
     * Compiles the script and returns the validated document of the named state machine.
     */
    public static Map<String, Object> document(String name, Statement... declarations) {
        Map<String, Object> document = compile(declarations).toDocument(name);
        StateMachineValidator.validate(document);
        return document;
    }

    /**
     * Views a rendered JSON object as a string-keyed map. Returns null for null.
     */
    public static Map<String, Object> asMap(Object value) {
        if (value == null) {
            return null;
        }
        Assertions.assertTrue(value instanceof Map, "Expected a JSON object but got " + value);
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
            Assertions.assertTrue(entry.getKey() instanceof String, "Non-string key " + entry.getKey());
            result.put((String)entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Views a rendered JSON array of objects as a list of string-keyed maps. Returns null for null.
     */
    public static List<Map<String, Object>> asMapList(Object value) {
        if (value == null) {
            return null;
        }
        Assertions.assertTrue(value instanceof List, "Expected a JSON array but got " + value);
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object element : (List<?>)value) {
            result.add(asMap(element));
        }
        return result;
    }

    public static Map<String, Object> states(Map<String, Object> document) {
        return asMap(document.get("States"));
    }

    /**
     * The key of the only state whose key starts with the prefix.
     */
    public static String keyWithPrefix(Map<String, Object> document, String prefix) {
        String found = null;
        for (String key : states(document).keySet()) {
            if (key.startsWith(prefix)) {
                Assertions.assertNull(found, "More than one state starts with " + prefix);
                found = key;
            }
        }
        Assertions.assertNotNull(found, "No state starts with " + prefix);
        return found;
    }

    public static Map<String, Object> stateWithPrefix(Map<String, Object> document, String prefix) {
        return asMap(states(document).get(keyWithPrefix(document, prefix)));
    }

    /**
     * Asserts that compiling the script fails with a message starting with the expected reason.
     */
    public static WorkflowGraphBuildException assertCompileError(String expectedReason, Statement... declarations) {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                                                                () -> compile(declarations));
        Assertions.assertTrue(e.getReason().startsWith(expectedReason),
                              "Unexpected reason: " + e.getReason());
        return e;
    }
}

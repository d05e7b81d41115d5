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

package com.danielgmyers.fluxio.testutil;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StateMachineValidatorTest {

    private static Map<String, Object> state(Object... keysAndValues) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            state.put((String)keysAndValues[i], keysAndValues[i + 1]);
        }
        return state;
    }

    private static Map<String, Object> document(String startAt, Map<String, Object> states) {
        return state("StartAt", startAt, "States", states);
    }

    @Test
    public void testValidDocument() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Choice", state("Type", "Choice",
                                   "Choices", Collections.singletonList(state("Variable", "$.foo", "Next", "Done")),
                                   "Default", "Pass"));
        states.put("Pass", state("Type", "Pass", "Next", "Done"));
        states.put("Done", state("Type", "Succeed"));

        StateMachineValidator.validate(document("Choice", states));
    }

    @Test
    public void testRejectsUnknownStartAt() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Done", state("Type", "Succeed"));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Missing", states)));
    }

    @Test
    public void testRejectsMissingType() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Pass", state("End", true));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Pass", states)));
    }

    @Test
    public void testRejectsNextAndEnd() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Pass", state("Type", "Pass", "Next", "Done", "End", true));
        states.put("Done", state("Type", "Succeed"));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Pass", states)));
    }

    @Test
    public void testRejectsTerminalWithEnd() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Fail", state("Type", "Fail", "Error", "Oops", "End", true));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Fail", states)));
    }

    @Test
    public void testRejectsUnknownCatchTarget() {
        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Task", state("Type", "Task", "End", true,
                                 "Catch", Collections.singletonList(state("ErrorEquals",
                                                                          Arrays.asList("States.ALL"),
                                                                          "Next", "Handler"))));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Task", states)));
    }

    @Test
    public void testValidatesMapIterator() {
        Map<String, Object> iteratorStates = new LinkedHashMap<>();
        iteratorStates.put("Pass", state("Type", "Pass", "Next", "Elsewhere"));

        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Map", state("Type", "Map", "Iterator", document("Pass", iteratorStates), "End", true));

        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Map", states)));
        Assertions.assertTrue(e.getMessage().contains("Elsewhere"));
    }

    @Test
    public void testValidatesParallelBranches() {
        Map<String, Object> branchStates = new LinkedHashMap<>();
        branchStates.put("Pass", state("Type", "Pass", "End", true));

        Map<String, Object> states = new LinkedHashMap<>();
        states.put("Parallel", state("Type", "Parallel",
                                     "Branches", Arrays.asList(document("Pass", branchStates),
                                                               document("Missing", branchStates)),
                                     "End", true));

        Assertions.assertThrows(RuntimeException.class,
                                () -> StateMachineValidator.validate(document("Parallel", states)));
    }
}

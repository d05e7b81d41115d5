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

package com.danielgmyers.fluxio.util;

import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class ErrorNamesTest {

    @Test
    public void testSerialize() {
        Assertions.assertEquals("KeyError", ErrorNames.serialize(name("KeyError")));
        Assertions.assertEquals("States.Timeout", ErrorNames.serialize(attr(name("States"), "Timeout")));
        Assertions.assertEquals("CustomError", ErrorNames.serialize(str("CustomError")));
    }

    @Test
    public void testRejectsOtherAttributes() {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> ErrorNames.serialize(attr(name("errors"), "Custom")));
        Assertions.assertTrue(e.getReason().startsWith("Error handler must be a tuple of exception classes"));
    }

    @Test
    public void testRejectsCalls() {
        Assertions.assertThrows(WorkflowGraphBuildException.class, () -> ErrorNames.serialize(call("KeyError")));
    }
}

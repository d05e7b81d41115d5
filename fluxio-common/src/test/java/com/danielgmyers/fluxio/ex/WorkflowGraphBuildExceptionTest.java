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

package com.danielgmyers.fluxio.ex;

import java.util.Collections;

import com.danielgmyers.fluxio.ast.Call;
import com.danielgmyers.fluxio.ast.Name;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class WorkflowGraphBuildExceptionTest {

    @Test
    public void testMessageIncludesPositionAndSource() {
        Call node = new Call(4, 8, new Name(4, 8, "map"), Collections.emptyList(), Collections.emptyList());
        WorkflowGraphBuildException e = new WorkflowGraphBuildException("Map state requires two arguments.", node);

        Assertions.assertEquals("Map state requires two arguments.\n\nProvided (Line 4, Column 8):\n\nmap()",
                                e.getMessage());
        Assertions.assertEquals("Map state requires two arguments.", e.getReason());
        Assertions.assertEquals(4, e.getLine());
        Assertions.assertEquals(8, e.getColumn());
        Assertions.assertEquals("map()", e.getSource());
    }

    @Test
    public void testMessageWithoutNode() {
        WorkflowGraphBuildException e = new WorkflowGraphBuildException("Something went wrong");
        Assertions.assertEquals("Something went wrong", e.getMessage());
        Assertions.assertEquals(-1, e.getLine());
        Assertions.assertNull(e.getSource());
    }

    @Test
    public void testCheck() {
        Name node = new Name(1, 0, "x");
        WorkflowGraphBuildException.check(true, "never thrown", node);
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> WorkflowGraphBuildException.check(false, "Bad name", node));
        Assertions.assertTrue(e.getMessage().startsWith("Bad name.\n\nProvided (Line 1, Column 0):"));
    }
}

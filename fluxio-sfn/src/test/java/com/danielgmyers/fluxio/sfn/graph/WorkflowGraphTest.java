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

import com.danielgmyers.fluxio.sfn.states.PassState;
import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;
import com.danielgmyers.fluxio.sfn.states.SucceedState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class WorkflowGraphTest {

    private WorkflowGraph graph;

    @BeforeEach
    public void setup() {
        graph = new WorkflowGraph();
    }

    private PassState placeholder(String key) {
        return graph.add(PassState.placeholder(key, pass()));
    }

    @Test
    public void testEmptyGraph() {
        Assertions.assertNull(graph.startTarget());
        Assertions.assertTrue(graph.getFragments().isEmpty());
        Assertions.assertEquals(0, graph.getStart().getIndex());
    }

    @Test
    public void testAddAssignsIndexes() {
        PassState first = placeholder("first");
        PassState second = placeholder("second");

        Assertions.assertEquals(1, first.getIndex());
        Assertions.assertEquals(2, second.getIndex());
        Assertions.assertSame(second, graph.get(2));
        Assertions.assertEquals(Arrays.asList(first, second), graph.getFragments());

        Assertions.assertThrows(IllegalStateException.class, () -> new WorkflowGraph().add(first));
    }

    @Test
    public void testDuplicateEdgesAreIgnored() {
        PassState first = placeholder("first");
        PassState second = placeholder("second");
        graph.addEdge(graph.getStart(), first, false);
        graph.addEdge(first, second, false);
        graph.addEdge(first, second, false);

        Assertions.assertEquals(1, graph.outEdges(first).size());
        Assertions.assertEquals(1, graph.inEdges(second).size());
        Assertions.assertSame(first, graph.startTarget());
        Assertions.assertSame(second, graph.next(first));
        Assertions.assertNull(graph.next(second));
    }

    @Test
    public void testElseEdgesAreSeparate() {
        PassState first = placeholder("first");
        PassState second = placeholder("second");
        graph.addEdge(first, second, true);

        Assertions.assertTrue(graph.successors(first).isEmpty());
        Assertions.assertEquals(Collections.singletonList(second), graph.elseSuccessors(first));
        Assertions.assertEquals(1, graph.outEdges(first).size());
    }

    @Test
    public void testNextRejectsMultipleSuccessors() {
        PassState first = placeholder("first");
        graph.addEdge(first, placeholder("second"), false);
        graph.addEdge(first, placeholder("third"), false);

        Assertions.assertThrows(IllegalStateException.class, () -> graph.next(first));
    }

    @Test
    public void testForeignFragmentsAreRejected() {
        PassState foreign = new WorkflowGraph().add(PassState.placeholder("foreign", pass()));
        PassState local = placeholder("local");
        Assertions.assertThrows(IllegalArgumentException.class, () -> graph.addEdge(local, foreign, false));
    }

    @Test
    public void testReachable() {
        PassState first = placeholder("first");
        PassState second = placeholder("second");
        PassState third = placeholder("third");
        PassState unrelated = placeholder("unrelated");
        graph.addEdge(graph.getStart(), first, false);
        graph.addEdge(first, second, false);
        graph.addEdge(first, third, true);

        Assertions.assertEquals(Arrays.asList(first, second, third), graph.reachable(first));
        Assertions.assertEquals(Collections.singletonList(unrelated), graph.reachable(unrelated));
    }

    @Test
    public void testBypass() {
        PassState first = placeholder("first");
        PassState placeholder = placeholder("placeholder");
        StateMachineFragment last = graph.add(new SucceedState("last", ret()));
        graph.addEdge(graph.getStart(), first, false);
        graph.addEdge(first, placeholder, true);
        graph.addEdge(placeholder, last, false);

        graph.bypass(placeholder);

        Assertions.assertFalse(graph.contains(placeholder));
        Assertions.assertEquals(Arrays.asList(first, last), graph.getFragments());
        Assertions.assertEquals(Collections.singletonList(last), graph.elseSuccessors(first));
        Assertions.assertEquals(1, graph.inEdges(last).size());
        Assertions.assertTrue(graph.inEdges(last).get(0).isInElse());
    }

    @Test
    public void testBypassRequiresSuccessor() {
        PassState first = placeholder("first");
        Assertions.assertThrows(IllegalStateException.class, () -> graph.bypass(first));
    }
}

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

import java.util.Map;

import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

/**
 * A fragment that is rendered as an entry of the document's {@code States} map.
 */
public abstract class State extends StateMachineFragment {

    public static final String TYPE = "Type";
    public static final String NEXT = "Next";
    public static final String END = "End";

    protected State(String key, Node node) {
        super(key, node);
    }

    /**
     * Terminal states end their path. Nothing may follow them.
     */
    public boolean isTerminal() {
        return false;
    }

    public abstract Map<String, Object> render(WorkflowGraph graph);

    /**
     * Adds {@code Next} when the state has a successor in the graph, or {@code End} when it does not.
     */
    protected void putTransition(Map<String, Object> document, WorkflowGraph graph) {
        StateMachineFragment next = graph.next(this);
        if (next == null) {
            document.put(END, true);
        } else {
            document.put(NEXT, next.getKey());
        }
    }
}

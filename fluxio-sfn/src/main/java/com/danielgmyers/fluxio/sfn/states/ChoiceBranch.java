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

import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

/**
 * One if/elif clause of a Choice. Heads the chain of states compiled from the clause's body.
 */
public final class ChoiceBranch extends StateMachineFragment {

    private final Expression test;

    public ChoiceBranch(String key, If node) {
        super(key, node);
        this.test = node.getTest();
    }

    public Expression getTest() {
        return test;
    }

    public Map<String, Object> render(WorkflowGraph graph) {
        StateMachineFragment next = graph.next(this);
        if (next == null) {
            throw new WorkflowGraphBuildException("A conditional branch must contain at least one statement",
                                                  getNode());
        }
        Map<String, Object> document = new LinkedHashMap<>(ChoiceConditionCompiler.compile(test));
        document.put(State.NEXT, next.getKey());
        return document;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

/**
 * A flattened if/elif/else chain. Each if/elif clause is a {@link ChoiceBranch}; the else clause is linked
 * from the choice through an else edge and becomes the {@code Default}.
 *
 * The choice's regular successor in the graph is never rendered; the branches are wired to it instead
 * when the graph is shaped.
 */
public final class ChoiceState extends State {

    private final List<ChoiceBranch> branches = new ArrayList<>();

    public ChoiceState(String key, If node) {
        super(key, node);
    }

    public void addBranch(ChoiceBranch branch) {
        branches.add(branch);
    }

    public List<ChoiceBranch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    @Override
    public List<StateMachineFragment> getOwnedHeads() {
        return Collections.unmodifiableList(new ArrayList<>(branches));
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        List<Object> choices = new ArrayList<>();
        for (ChoiceBranch branch : branches) {
            choices.add(branch.render(graph));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Choice");
        document.put("Choices", choices);

        List<StateMachineFragment> defaults = graph.elseSuccessors(this);
        if (defaults.size() > 1) {
            throw new WorkflowGraphBuildException("A maximum of 1 state can be included in an `else` clause", getNode());
        } else if (!defaults.isEmpty()) {
            document.put("Default", defaults.get(0).getKey());
        }
        return document;
    }
}

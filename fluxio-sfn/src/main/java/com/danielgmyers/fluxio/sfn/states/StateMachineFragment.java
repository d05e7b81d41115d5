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

import java.util.Collections;
import java.util.List;

import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.util.NodeHashing;

/**
 * A node of a workflow graph: either a state that is rendered into the state machine document,
 * or a graph-internal helper (a choice branch or a catch clause) that heads a chain of states.
 *
 * A fragment is added to exactly one graph, which assigns its index.
 */
public abstract class StateMachineFragment {

    private static final int UNASSIGNED = -1;

    private final String key;
    private final Node node;
    private String hash;
    private int index = UNASSIGNED;

    protected StateMachineFragment(String key, Node node) {
        this.key = key;
        this.node = node;
    }

    public String getKey() {
        return key;
    }

    /**
     * The script node this fragment was compiled from.
     */
    public Node getNode() {
        return node;
    }

    /**
     * Content hash of the originating node.
     */
    public String getHash() {
        if (hash == null) {
            hash = NodeHashing.hash(node);
        }
        return hash;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Called by the owning graph when the fragment is added.
     */
    public void assignIndex(int newIndex) {
        if (index != UNASSIGNED) {
            throw new IllegalStateException(String.format("Fragment %s already belongs to a graph.", key));
        }
        index = newIndex;
    }

    /**
     * Heads of the chains this fragment owns but does not link to through regular edges,
     * e.g. the branches of a choice or the handlers of a task.
     */
    public List<StateMachineFragment> getOwnedHeads() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return key;
    }
}

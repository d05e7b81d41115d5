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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;

/**
 * The directed graph of fragments compiled from one state machine function.
 *
 * Fragments live in an arena and are addressed by the index assigned when they are added; index 0 is the
 * start sentinel. Edges are kept in per-fragment adjacency lists in insertion order, so every traversal
 * of the graph is deterministic.
 */
public class WorkflowGraph {

    private final List<StateMachineFragment> fragments = new ArrayList<>();
    private final List<List<GraphEdge>> outgoing = new ArrayList<>();
    private final List<List<GraphEdge>> incoming = new ArrayList<>();
    private final StateMachineFragment start;

    public WorkflowGraph() {
        start = new StartFragment();
        add(start);
    }

    public StateMachineFragment getStart() {
        return start;
    }

    /**
     * Adds a fragment to the arena and assigns its index.
     */
    public <T extends StateMachineFragment> T add(T fragment) {
        fragment.assignIndex(fragments.size());
        fragments.add(fragment);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return fragment;
    }

    private void checkLive(StateMachineFragment fragment) {
        int index = fragment.getIndex();
        if (index < 0 || index >= fragments.size() || fragments.get(index) != fragment) {
            throw new IllegalArgumentException(String.format("Fragment %s is not part of this graph.", fragment));
        }
    }

    /**
     * Adds an edge unless an identical one already exists.
     */
    public void addEdge(StateMachineFragment from, StateMachineFragment to, boolean inElse) {
        checkLive(from);
        checkLive(to);
        GraphEdge edge = new GraphEdge(from.getIndex(), to.getIndex(), inElse);
        if (!outgoing.get(edge.getFrom()).contains(edge)) {
            outgoing.get(edge.getFrom()).add(edge);
            incoming.get(edge.getTo()).add(edge);
        }
    }

    public List<GraphEdge> outEdges(StateMachineFragment fragment) {
        checkLive(fragment);
        return Collections.unmodifiableList(outgoing.get(fragment.getIndex()));
    }

    public List<GraphEdge> inEdges(StateMachineFragment fragment) {
        checkLive(fragment);
        return Collections.unmodifiableList(incoming.get(fragment.getIndex()));
    }

    public StateMachineFragment get(int index) {
        return fragments.get(index);
    }

    private List<StateMachineFragment> targets(StateMachineFragment fragment, boolean inElse) {
        Set<StateMachineFragment> result = new LinkedHashSet<>();
        for (GraphEdge edge : outEdges(fragment)) {
            if (edge.isInElse() == inElse) {
                result.add(fragments.get(edge.getTo()));
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * The targets of the fragment's regular (non-else) edges.
     */
    public List<StateMachineFragment> successors(StateMachineFragment fragment) {
        return targets(fragment, false);
    }

    /**
     * The targets of the fragment's else edges. Only a choice has these.
     */
    public List<StateMachineFragment> elseSuccessors(StateMachineFragment fragment) {
        return targets(fragment, true);
    }

    /**
     * The fragment's single successor, or null if it has none.
     *
     * @throws IllegalStateException if the fragment has more than one successor
     */
    public StateMachineFragment next(StateMachineFragment fragment) {
        List<StateMachineFragment> successors = successors(fragment);
        if (successors.size() > 1) {
            throw new IllegalStateException(String.format("Fragment %s has %d successors.", fragment,
                                                          successors.size()));
        }
        return successors.isEmpty() ? null : successors.get(0);
    }

    /**
     * The first state of the graph, or null if nothing was added after the start sentinel.
     */
    public StateMachineFragment startTarget() {
        List<StateMachineFragment> successors = successors(start);
        return successors.isEmpty() ? null : successors.get(0);
    }

    /**
     * Every fragment reachable from the head (inclusive), following regular edges, else edges and owned heads,
     * in breadth-first order.
     */
    public List<StateMachineFragment> reachable(StateMachineFragment head) {
        checkLive(head);
        Set<StateMachineFragment> seen = new LinkedHashSet<>();
        Deque<StateMachineFragment> queue = new ArrayDeque<>();
        queue.add(head);
        while (!queue.isEmpty()) {
            StateMachineFragment current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            for (GraphEdge edge : outgoing.get(current.getIndex())) {
                queue.add(fragments.get(edge.getTo()));
            }
            queue.addAll(current.getOwnedHeads());
        }
        return new ArrayList<>(seen);
    }

    /**
     * Removes a fragment that has exactly one successor, re-pointing its incoming edges at that successor.
     * The re-pointed edges keep their else flags.
     */
    public void bypass(StateMachineFragment fragment) {
        StateMachineFragment successor = next(fragment);
        if (successor == null || !elseSuccessors(fragment).isEmpty()) {
            throw new IllegalStateException(String.format("Fragment %s cannot be bypassed.", fragment));
        }
        int index = fragment.getIndex();

        for (GraphEdge edge : new ArrayList<>(incoming.get(index))) {
            outgoing.get(edge.getFrom()).remove(edge);
            GraphEdge replacement = edge.withTo(successor.getIndex());
            if (!outgoing.get(edge.getFrom()).contains(replacement)) {
                outgoing.get(edge.getFrom()).add(replacement);
                incoming.get(successor.getIndex()).add(replacement);
            }
        }
        for (GraphEdge edge : outgoing.get(index)) {
            incoming.get(edge.getTo()).remove(edge);
        }
        incoming.get(index).clear();
        outgoing.get(index).clear();
        fragments.set(index, null);
    }

    /**
     * Every fragment still in the graph, excluding the start sentinel, in the order they were added.
     */
    public List<StateMachineFragment> getFragments() {
        List<StateMachineFragment> result = new ArrayList<>();
        for (StateMachineFragment fragment : fragments) {
            if (fragment != null && fragment != start) {
                result.add(fragment);
            }
        }
        return result;
    }

    /**
     * True if the fragment is still part of this graph.
     */
    public boolean contains(StateMachineFragment fragment) {
        int index = fragment.getIndex();
        return index >= 0 && index < fragments.size() && fragments.get(index) == fragment;
    }
}

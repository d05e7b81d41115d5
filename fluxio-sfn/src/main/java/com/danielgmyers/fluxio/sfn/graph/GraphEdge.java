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

/**
 * A transition between two fragments of a {@link WorkflowGraph}, addressed by fragment index.
 */
public final class GraphEdge {

    private final int from;
    private final int to;
    private final boolean inElse;

    public GraphEdge(int from, int to, boolean inElse) {
        this.from = from;
        this.to = to;
        this.inElse = inElse;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    /**
     * True if this edge leads into the else clause of a choice, i.e. it is the choice's Default transition.
     */
    public boolean isInElse() {
        return inElse;
    }

    GraphEdge withFrom(int newFrom) {
        return new GraphEdge(newFrom, to, inElse);
    }

    GraphEdge withTo(int newTo) {
        return new GraphEdge(from, newTo, inElse);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GraphEdge)) {
            return false;
        }
        GraphEdge edge = (GraphEdge)other;
        return from == edge.from && to == edge.to && inElse == edge.inElse;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * from + to) + (inElse ? 1 : 0);
    }

    @Override
    public String toString() {
        return String.format("%d -> %d%s", from, to, inElse ? " (else)" : "");
    }
}

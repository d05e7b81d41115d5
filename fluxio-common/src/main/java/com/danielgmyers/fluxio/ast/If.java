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

package com.danielgmyers.fluxio.ast;

import java.util.List;

/**
 * A conditional. An elif chain is represented as an {@code orelse} holding exactly one nested If.
 */
public final class If extends Statement {

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public If(int line, int column, Expression test, List<Statement> body, List<Statement> orelse) {
        super(line, column);
        this.test = test;
        this.body = List.copyOf(body);
        this.orelse = List.copyOf(orelse);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    /**
     * Returns true if the alternate branch is itself a single conditional, i.e. this is an if/elif chain.
     */
    public boolean hasElifContinuation() {
        return orelse.size() == 1 && orelse.get(0) instanceof If;
    }

    public If with(List<Statement> newBody, List<Statement> newOrelse) {
        return new If(getLine(), getColumn(), test, newBody, newOrelse);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}

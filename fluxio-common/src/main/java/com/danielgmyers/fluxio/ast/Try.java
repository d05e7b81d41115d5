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

public final class Try extends Statement {

    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orelse;
    private final List<Statement> finalbody;

    public Try(int line, int column, List<Statement> body, List<ExceptHandler> handlers, List<Statement> orelse,
               List<Statement> finalbody) {
        super(line, column);
        this.body = List.copyOf(body);
        this.handlers = List.copyOf(handlers);
        this.orelse = List.copyOf(orelse);
        this.finalbody = List.copyOf(finalbody);
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    public List<Statement> getFinalbody() {
        return finalbody;
    }

    public Try with(List<Statement> newBody, List<ExceptHandler> newHandlers, List<Statement> newOrelse,
                    List<Statement> newFinalbody) {
        return new Try(getLine(), getColumn(), newBody, newHandlers, newOrelse, newFinalbody);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTry(this);
    }
}

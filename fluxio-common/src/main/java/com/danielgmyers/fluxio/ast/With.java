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
 * A scoped-resource statement. The compiler only accepts {@code with retry(...):} wrapping a single statement.
 */
public final class With extends Statement {

    private final List<Expression> items;
    private final List<Statement> body;

    public With(int line, int column, List<Expression> items, List<Statement> body) {
        super(line, column);
        this.items = List.copyOf(items);
        this.body = List.copyOf(body);
    }

    public List<Expression> getItems() {
        return items;
    }

    public List<Statement> getBody() {
        return body;
    }

    public With withBody(List<Statement> newBody) {
        return new With(getLine(), getColumn(), items, newBody);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWith(this);
    }
}

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
 * One {@code except} clause of a {@link Try}. Handlers are visited through their owning Try statement.
 */
public final class ExceptHandler extends Node {

    private final Expression type;
    private final String name;
    private final List<Statement> body;

    /**
     * @param type The matched exception class(es), or null for a bare {@code except:}.
     * @param name The bound variable name, or null.
     */
    public ExceptHandler(int line, int column, Expression type, String name, List<Statement> body) {
        super(line, column);
        this.type = type;
        this.name = name;
        this.body = List.copyOf(body);
    }

    public Expression getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    public ExceptHandler with(Expression newType, List<Statement> newBody) {
        return new ExceptHandler(getLine(), getColumn(), newType, name, newBody);
    }
}

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
 * A function or method declaration. Asynchronous declarations are flagged rather than modelled as a separate class.
 */
public final class FunctionDef extends Statement {

    private final String name;
    private final List<String> parameters;
    private final List<Expression> decorators;
    private final List<Statement> body;
    private final boolean async;

    public FunctionDef(int line, int column, String name, List<String> parameters, List<Expression> decorators,
                       List<Statement> body, boolean async) {
        super(line, column);
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.decorators = List.copyOf(decorators);
        this.body = List.copyOf(body);
        this.async = async;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    public FunctionDef withBody(List<Statement> newBody) {
        return new FunctionDef(getLine(), getColumn(), name, parameters, decorators, newBody, async);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}

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

public final class Call extends Expression {

    private final Expression func;
    private final List<Expression> args;
    private final List<Keyword> keywords;

    public Call(int line, int column, Expression func, List<Expression> args, List<Keyword> keywords) {
        super(line, column);
        this.func = func;
        this.args = List.copyOf(args);
        this.keywords = List.copyOf(keywords);
    }

    public Expression getFunc() {
        return func;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    /**
     * Returns the called name when the callee is a plain name, otherwise null.
     */
    public String getFuncName() {
        return func instanceof Name ? ((Name)func).getId() : null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}

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

/**
 * An expression evaluated for its effect, e.g. a bare call or a docstring.
 */
public final class ExprStatement extends Statement {

    private final Expression value;

    public ExprStatement(int line, int column, Expression value) {
        super(line, column);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    /**
     * Docstrings are bare string constants; they carry no behavior.
     */
    public boolean isDocstring() {
        return value instanceof Constant && ((Constant)value).isString();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExprStatement(this);
    }
}

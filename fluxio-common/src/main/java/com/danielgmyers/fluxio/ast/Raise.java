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

public final class Raise extends Statement {

    private final Expression exception;

    /**
     * @param exception The raised expression, or null for a bare re-raise.
     */
    public Raise(int line, int column, Expression exception) {
        super(line, column);
        this.exception = exception;
    }

    public Expression getException() {
        return exception;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRaise(this);
    }
}

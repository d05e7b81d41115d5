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
 * A statement form the compiler does not model (loops, augmented assignment, etc.).
 * It is legal only inside a work unit's action body, where it is carried through verbatim.
 */
public final class OpaqueStatement extends Statement {

    private final String kind;
    private final String source;

    public OpaqueStatement(int line, int column, String kind, String source) {
        super(line, column);
        this.kind = kind;
        this.source = source;
    }

    /**
     * The host parser's name for the statement, e.g. "For".
     */
    public String getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpaqueStatement(this);
    }
}

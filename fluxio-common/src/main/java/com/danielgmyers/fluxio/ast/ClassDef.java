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

public final class ClassDef extends Statement {

    private final String name;
    private final List<Expression> bases;
    private final List<Statement> body;

    public ClassDef(int line, int column, String name, List<Expression> bases, List<Statement> body) {
        super(line, column);
        this.name = name;
        this.bases = List.copyOf(bases);
        this.body = List.copyOf(body);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<Statement> getBody() {
        return body;
    }

    /**
     * Returns a copy of this class declaration with a different body.
     */
    public ClassDef withBody(List<Statement> newBody) {
        return new ClassDef(getLine(), getColumn(), name, bases, newBody);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClassDef(this);
    }
}

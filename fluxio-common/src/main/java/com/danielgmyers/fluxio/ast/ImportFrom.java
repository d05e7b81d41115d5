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

public final class ImportFrom extends Statement {

    private final String module;
    private final List<ImportAlias> names;
    private final int level;

    /**
     * @param module The imported module, or null for {@code from . import x}.
     * @param level  The number of leading dots of a relative import.
     */
    public ImportFrom(int line, int column, String module, List<ImportAlias> names, int level) {
        super(line, column);
        this.module = module;
        this.names = List.copyOf(names);
        this.level = level;
    }

    public String getModule() {
        return module;
    }

    public List<ImportAlias> getNames() {
        return names;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImportFrom(this);
    }
}

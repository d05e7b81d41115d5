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
 * A single {@code name [as alias]} entry of an import statement.
 */
public final class ImportAlias {

    private final String name;
    private final String asName;

    public ImportAlias(String name, String asName) {
        this.name = name;
        this.asName = asName;
    }

    public String getName() {
        return name;
    }

    public String getAsName() {
        return asName;
    }

    @Override
    public String toString() {
        return asName == null ? name : name + " as " + asName;
    }
}

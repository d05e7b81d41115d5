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

package com.danielgmyers.fluxio.util;

import com.danielgmyers.fluxio.ast.Subscript;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class InputDataReferencesTest {

    @Test
    public void testIsReference() {
        Assertions.assertTrue(InputDataReferences.isReference(data("foo")));
        Assertions.assertTrue(InputDataReferences.isReference(data("foo", "bar")));
        Assertions.assertFalse(InputDataReferences.isReference(name("data")));
        Assertions.assertFalse(InputDataReferences.isReference(str("data")));
        Assertions.assertFalse(InputDataReferences.isReference(new Subscript(1, 0, name("other"), str("foo"))));
    }

    @Test
    public void testToPath() {
        Assertions.assertEquals("$['foo']", InputDataReferences.toPath(data("foo")));
        Assertions.assertEquals("$['foo']['bar']", InputDataReferences.toPath(data("foo", "bar")));
    }

    @Test
    public void testToPathRejectsNonReferences() {
        Assertions.assertThrows(WorkflowGraphBuildException.class, () -> InputDataReferences.toPath(name("foo")));
    }

    @Test
    public void testReservedPath() {
        Assertions.assertTrue(InputDataReferences.isReservedPath("$['__trace']"));
        Assertions.assertTrue(InputDataReferences.isReservedPath("$['__trace']['id']"));
        Assertions.assertFalse(InputDataReferences.isReservedPath("$['trace']"));
    }
}

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

package com.danielgmyers.fluxio.sfn.transform;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class DataDictTransformerTest {

    @Test
    public void testContainsReferences() {
        Assertions.assertTrue(DataDictTransformer.containsReferences(dict(str("a"), data("a"))));
        Assertions.assertTrue(DataDictTransformer.containsReferences(
                dict(str("a"), list(dict(str("b"), name("data"))))));
        Assertions.assertFalse(DataDictTransformer.containsReferences(dict(str("a"), num(1), str("b"), str("x"))));
        Assertions.assertFalse(DataDictTransformer.containsReferences(name("other")));
    }

    @Test
    public void testNestedReferences() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("bar.$", "$['a']['b']");
        nested.put("n", 1L);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("foo.$", "$['foo']");
        expected.put("nested", nested);
        expected.put("everything.$", "$");

        Assertions.assertEquals(expected, DataDictTransformer.transform(
                dict(str("foo"), data("foo"),
                     str("nested"), dict(str("bar"), data("a", "b"), str("n"), num(1)),
                     str("everything"), name("data"))));
    }

    @Test
    public void testDictsInsideLists() {
        Map<String, Object> element = Collections.singletonMap("id.$", "$['id']");
        Map<String, Object> result = DataDictTransformer.transform(
                dict(str("items"), list(dict(str("id"), data("id")), str("plain"))));

        Assertions.assertEquals(Arrays.asList(element, "plain"), result.get("items"));
    }

    @Test
    public void testBareReferenceInsideList() {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> DataDictTransformer.transform(dict(str("items"), list(data("id")))));
        Assertions.assertEquals("References to `data` inside a list can only appear within a nested dict",
                                e.getReason());
    }

    @Test
    public void testNonStringKey() {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> DataDictTransformer.transform(dict(num(1), data("id"))));
        Assertions.assertEquals("Dictionary keys must be strings", e.getReason());
    }
}

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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class LiteralValuesTest {

    @Test
    public void testEvaluateNestedLiteral() {
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("b", 1L);
        expected.put("a", Arrays.asList("x", true, null, 2.5));

        Object actual = LiteralValues.evaluate(dict(str("b"), num(1),
                                                    str("a"), list(str("x"), bool(true), none(), num(2.5))));
        Assertions.assertEquals(expected, actual);
        Assertions.assertEquals(Arrays.asList("b", "a"), Arrays.asList(((Map<?, ?>)actual).keySet().toArray()));
    }

    @Test
    public void testTuplesBecomeLists() {
        Assertions.assertEquals(Arrays.asList(1L, 2L), LiteralValues.evaluate(tuple(num(1), num(2))));
    }

    @Test
    public void testRejectsNonLiterals() {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                () -> LiteralValues.evaluate(call("range", num(10))));
        Assertions.assertTrue(e.getMessage().contains("JSON-serializeable"));

        Assertions.assertFalse(LiteralValues.isLiteral(dict(str("a"), data("b"))));
        Assertions.assertFalse(LiteralValues.isLiteral(list(name("x"))));
    }
}

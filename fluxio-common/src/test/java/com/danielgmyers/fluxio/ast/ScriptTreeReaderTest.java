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

import java.io.InputStream;

import com.danielgmyers.fluxio.ex.ScriptTreeFormatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ScriptTreeReaderTest {

    @Test
    public void testReadsFixture() throws Exception {
        ModuleNode module;
        try (InputStream in = ScriptTreeReaderTest.class.getResourceAsStream("/example_script.json")) {
            module = ScriptTreeReader.read(in);
        }

        Assertions.assertEquals(2, module.getBody().size());

        ClassDef task = (ClassDef)module.getBody().get(0);
        Assertions.assertEquals("ExampleTask", task.getName());
        Assertions.assertEquals(3, task.getLine());
        FunctionDef run = (FunctionDef)task.getBody().get(1);
        Assertions.assertTrue(run.isAsync());
        Assertions.assertEquals("run", run.getName());
        Assertions.assertTrue(run.getBody().get(0) instanceof Import);
        OpaqueStatement loop = (OpaqueStatement)run.getBody().get(1);
        Assertions.assertEquals("For", loop.getKind());
        Assertions.assertEquals("for x in event:\n    print(x)", loop.getSource());

        FunctionDef main = (FunctionDef)module.getBody().get(1);
        Assertions.assertFalse(main.isAsync());
        Assertions.assertEquals(1, main.getDecorators().size());
        Assertions.assertEquals("data", main.getParameters().get(0));

        Assign assign = (Assign)main.getBody().get(0);
        Assertions.assertEquals("data['result'] = ExampleTask(data['input'])", SourceRenderer.render(assign));

        If conditional = (If)main.getBody().get(1);
        Assertions.assertEquals("data['count'] > -5", SourceRenderer.render(conditional.getTest()));
        Assertions.assertTrue(conditional.getOrelse().isEmpty());
        Assertions.assertTrue(conditional.getBody().get(0) instanceof Return);
    }

    @Test
    public void testLegacyLiteralForms() {
        String json = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\", \"lineno\": 4, \"col_offset\": 2,"
                + " \"value\": {\"_type\": \"Subscript\", \"value\": {\"_type\": \"Name\", \"id\": \"data\"},"
                + " \"slice\": {\"_type\": \"Index\", \"value\": {\"_type\": \"Str\", \"s\": \"foo\"}}}},"
                + " {\"_type\": \"Expr\", \"value\": {\"_type\": \"List\", \"elts\": ["
                + "{\"_type\": \"Num\", \"n\": 1.5}, {\"_type\": \"NameConstant\", \"value\": null}]}}]}";
        ModuleNode module = ScriptTreeReader.read(json);

        ExprStatement first = (ExprStatement)module.getBody().get(0);
        Assertions.assertEquals(4, first.getLine());
        Assertions.assertEquals(2, first.getColumn());
        Assertions.assertEquals("data['foo']", SourceRenderer.render(first.getValue()));
        Assertions.assertEquals("[1.5, None]", SourceRenderer.render(module.getBody().get(1)));
    }

    @Test
    public void testRejectsInvalidJson() {
        Assertions.assertThrows(ScriptTreeFormatException.class, () -> ScriptTreeReader.read("{not json"));
    }

    @Test
    public void testRejectsNonModuleRoot() {
        Assertions.assertThrows(ScriptTreeFormatException.class,
                                () -> ScriptTreeReader.read("{\"_type\": \"Pass\"}"));
    }

    @Test
    public void testRejectsUnknownExpression() {
        String json = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\","
                + " \"value\": {\"_type\": \"Lambda\", \"lineno\": 7}}]}";
        ScriptTreeFormatException e = Assertions.assertThrows(ScriptTreeFormatException.class,
                                                              () -> ScriptTreeReader.read(json));
        Assertions.assertTrue(e.getMessage().contains("Lambda"));
        Assertions.assertTrue(e.getMessage().contains("line 7"));
    }
}

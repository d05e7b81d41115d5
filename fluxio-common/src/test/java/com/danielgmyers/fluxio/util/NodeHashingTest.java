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

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.Subscript;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class NodeHashingTest {

    @Test
    public void testHashIsMd5OfWhitespaceFreeSource() {
        Assign assign = assign(data("foo"), call("ExampleTask"));
        Assertions.assertEquals(DigestUtils.md5Hex("data['foo']=ExampleTask()"), NodeHashing.hash(assign));
    }

    @Test
    public void testNamespaceIsPrefixed() {
        Assertions.assertEquals(DigestUtils.md5Hex("mainpass"), NodeHashing.hash(pass(), "main"));
        Assertions.assertNotEquals(NodeHashing.hash(pass(), "main"), NodeHashing.hash(pass(), "other"));
    }

    @Test
    public void testPositionDoesNotAffectHash() {
        Expression first = new Subscript(3, 4, new Name(3, 4, "data"), new Constant(3, 9, "foo"));
        Expression second = new Subscript(10, 0, new Name(10, 0, "data"), new Constant(10, 5, "foo"));
        Assertions.assertEquals(NodeHashing.hash(first), NodeHashing.hash(second));
    }

    @Test
    public void testHashIsStable() {
        Assign assign = assign(data("a"), dict(str("x"), list(num(1), num(2))));
        Assertions.assertEquals(NodeHashing.hash(assign, "ns"), NodeHashing.hash(assign, "ns"));
        Assertions.assertEquals(32, NodeHashing.hash(assign).length());
        Assertions.assertEquals(NodeHashing.hash(assign), NodeHashing.hash(assign, null));
        Assertions.assertEquals(DigestUtils.md5Hex("data['a']={'x':[1,2]}"), NodeHashing.hash(assign));
    }
}

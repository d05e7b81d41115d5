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

import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.ast.SourceRenderer;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Content hashes for script nodes. Fragment keys are built from these, so they must be stable across runs:
 * the hash only depends on the rendered source (whitespace removed) and an optional namespace.
 */
public final class NodeHashing {

    private NodeHashing() {}

    public static String hash(Node node) {
        return hash(node, "");
    }

    public static String hash(Node node, String namespace) {
        String source = SourceRenderer.render(node).replace("\n", "").replace(" ", "");
        return DigestUtils.md5Hex((namespace == null ? "" : namespace) + source);
    }
}

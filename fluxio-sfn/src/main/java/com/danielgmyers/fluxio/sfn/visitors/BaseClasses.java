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

package com.danielgmyers.fluxio.sfn.visitors;

import com.danielgmyers.fluxio.ast.Attribute;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Name;

/**
 * The base classes that give a script class its meaning.
 */
public final class BaseClasses {

    public static final String TASK = "Task";
    public static final String EVENT_PROCESSOR = "EventProcessor";

    private BaseClasses() {}

    public static boolean isTask(ClassDef node) {
        return derivesFrom(node, TASK);
    }

    public static boolean isEventProcessor(ClassDef node) {
        return derivesFrom(node, EVENT_PROCESSOR);
    }

    private static boolean derivesFrom(ClassDef node, String baseName) {
        for (Expression base : node.getBases()) {
            if (baseName.equals(simpleName(base))) {
                return true;
            }
        }
        return false;
    }

    // Allows both `Task` and `fluxio.Task`.
    private static String simpleName(Expression base) {
        if (base instanceof Name) {
            return ((Name)base).getId();
        } else if (base instanceof Attribute) {
            return ((Attribute)base).getAttr();
        }
        return null;
    }
}

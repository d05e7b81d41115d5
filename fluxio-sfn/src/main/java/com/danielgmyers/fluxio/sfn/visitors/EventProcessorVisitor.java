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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Import;
import com.danielgmyers.fluxio.ast.ImportFrom;
import com.danielgmyers.fluxio.ast.OpaqueStatement;
import com.danielgmyers.fluxio.ast.Pass;
import com.danielgmyers.fluxio.ast.Raise;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ast.StatementVisitor;
import com.danielgmyers.fluxio.ast.Try;
import com.danielgmyers.fluxio.ast.With;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.sfn.definitions.EventProcessorDefinition;

/**
 * Reads an event processor class. The only members allowed are custom tag methods:
 * <pre>
 * async def get_custom_tags_&lt;tag&gt;(message, input_data, state_data_client)
 * </pre>
 */
public class EventProcessorVisitor implements StatementVisitor<Void> {

    public static final List<String> CUSTOM_TAG_PARAMETERS
            = Arrays.asList("message", "input_data", "state_data_client");

    private static final String SELF = "self";
    private static final String UNSUPPORTED_MEMBER = "Event processor classes may only contain custom tag methods";

    private final List<String> customTags = new ArrayList<>();

    public EventProcessorDefinition visit(ClassDef node) {
        for (Statement statement : node.getBody()) {
            statement.accept(this);
        }
        return new EventProcessorDefinition(node.getName(), node, customTags);
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        if (!node.isAsync()) {
            throw new WorkflowGraphBuildException("Event processor methods must be declared with `async def`", node);
        }
        String prefix = EventProcessorDefinition.CUSTOM_TAG_PREFIX;
        if (!node.getName().startsWith(prefix) || node.getName().length() == prefix.length()) {
            throw new WorkflowGraphBuildException(
                    String.format("Event processor methods must be named %s<tag>", prefix), node);
        }

        List<String> parameters = node.getParameters();
        if (!parameters.isEmpty() && SELF.equals(parameters.get(0))) {
            parameters = parameters.subList(1, parameters.size());
        }
        if (!CUSTOM_TAG_PARAMETERS.equals(parameters)) {
            throw new WorkflowGraphBuildException(
                    String.format("Custom tag methods must accept exactly these arguments: %s",
                                  String.join(", ", CUSTOM_TAG_PARAMETERS)), node);
        }
        customTags.add(node.getName().substring(prefix.length()));
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        if (!node.isDocstring()) {
            throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
        }
        return null;
    }

    @Override
    public Void visitPass(Pass node) {
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitClassDef(ClassDef node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitIf(If node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitRaise(Raise node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitReturn(Return node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitTry(Try node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitWith(With node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitImport(Import node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }

    @Override
    public Void visitOpaqueStatement(OpaqueStatement node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_MEMBER, node);
    }
}

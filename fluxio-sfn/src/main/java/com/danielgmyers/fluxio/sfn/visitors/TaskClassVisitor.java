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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Import;
import com.danielgmyers.fluxio.ast.ImportAlias;
import com.danielgmyers.fluxio.ast.ImportFrom;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.OpaqueStatement;
import com.danielgmyers.fluxio.ast.Pass;
import com.danielgmyers.fluxio.ast.Raise;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ast.StatementVisitor;
import com.danielgmyers.fluxio.ast.Try;
import com.danielgmyers.fluxio.ast.With;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.OptionSchema;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;

/**
 * Reads a work unit class: its attribute assignments and its async {@code run} method.
 */
public class TaskClassVisitor implements StatementVisitor<Void> {

    public static final String RUN_METHOD = "run";

    private static final String UNSUPPORTED_MEMBER = "Task classes may only contain class attributes and a `run` method";

    private final OptionSchema attributeSchema;
    private final Map<String, Expression> attributes = new LinkedHashMap<>();
    private FunctionDef runMethod;

    public TaskClassVisitor(OptionSchema attributeSchema) {
        this.attributeSchema = attributeSchema;
    }

    public TaskDefinition visit(ClassDef node) {
        for (Statement statement : node.getBody()) {
            statement.accept(this);
        }
        if (runMethod == null) {
            throw new WorkflowGraphBuildException("Task classes must define an async `run` method", node);
        }

        ResolvedOptions resolved = attributeSchema.resolveAttributes(attributes, node);

        List<Statement> imports = new ArrayList<>();
        List<Statement> body = new ArrayList<>();
        Set<String> dependencies = new LinkedHashSet<>();
        for (Statement statement : runMethod.getBody()) {
            if (statement instanceof Import) {
                imports.add(statement);
                for (ImportAlias alias : ((Import)statement).getNames()) {
                    dependencies.add(rootModule(alias.getName()));
                }
            } else if (statement instanceof ImportFrom) {
                imports.add(statement);
                ImportFrom importFrom = (ImportFrom)statement;
                // relative imports refer to the project itself
                if (importFrom.getModule() != null && importFrom.getLevel() == 0) {
                    dependencies.add(rootModule(importFrom.getModule()));
                }
            } else {
                body.add(statement);
            }
        }

        return new TaskDefinition(node.getName(), node, resolved, runMethod.withBody(body), imports,
                                  new ArrayList<>(dependencies));
    }

    private static String rootModule(String module) {
        int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        if (!RUN_METHOD.equals(node.getName()) || !node.isAsync()) {
            throw new WorkflowGraphBuildException("Task classes should only define a `run` method", node);
        }
        if (runMethod != null) {
            throw new WorkflowGraphBuildException("Task classes can only define one `run` method", node);
        }
        runMethod = node;
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        if (node.getTargets().size() != 1 || !(node.getTargets().get(0) instanceof Name)) {
            throw new WorkflowGraphBuildException("Task class attributes must be assigned to a single name", node);
        }
        attributes.put(((Name)node.getTargets().get(0)).getId(), node.getValue());
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

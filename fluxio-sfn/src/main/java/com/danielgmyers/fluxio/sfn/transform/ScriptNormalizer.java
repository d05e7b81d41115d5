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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.Attribute;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.ExceptHandler;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Import;
import com.danielgmyers.fluxio.ast.ImportFrom;
import com.danielgmyers.fluxio.ast.ModuleNode;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.OpaqueStatement;
import com.danielgmyers.fluxio.ast.Pass;
import com.danielgmyers.fluxio.ast.Raise;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ast.StatementVisitor;
import com.danielgmyers.fluxio.ast.Try;
import com.danielgmyers.fluxio.ast.With;
import com.danielgmyers.fluxio.sfn.visitors.BaseClasses;
import com.danielgmyers.fluxio.util.ErrorNames;

/**
 * Rewrites a parsed script so later passes can rely on two properties:
 * every if statement has a non-empty else clause (an empty one gets a {@code pass}), and,
 * unless disabled, every bare {@code except:} handler names {@code States.ALL} explicitly.
 *
 * Work unit classes are returned untouched; their run method is opaque payload.
 */
public class ScriptNormalizer implements StatementVisitor<Statement> {

    private final boolean replaceEmptyExcept;

    public ScriptNormalizer(boolean replaceEmptyExcept) {
        this.replaceEmptyExcept = replaceEmptyExcept;
    }

    public ModuleNode normalize(ModuleNode module) {
        return new ModuleNode(statements(module.getBody()));
    }

    private List<Statement> statements(List<Statement> body) {
        List<Statement> result = new ArrayList<>(body.size());
        for (Statement statement : body) {
            result.add(statement.accept(this));
        }
        return result;
    }

    @Override
    public Statement visitClassDef(ClassDef node) {
        if (BaseClasses.isTask(node)) {
            return node;
        }
        return node.withBody(statements(node.getBody()));
    }

    @Override
    public Statement visitFunctionDef(FunctionDef node) {
        return node.withBody(statements(node.getBody()));
    }

    @Override
    public Statement visitIf(If node) {
        List<Statement> orelse = node.getOrelse().isEmpty()
                ? Collections.singletonList(new Pass(node.getLine(), node.getColumn()))
                : statements(node.getOrelse());
        return node.with(statements(node.getBody()), orelse);
    }

    @Override
    public Statement visitTry(Try node) {
        List<ExceptHandler> handlers = new ArrayList<>();
        for (ExceptHandler handler : node.getHandlers()) {
            Expression type = handler.getType();
            if (type == null && replaceEmptyExcept) {
                type = new Attribute(handler.getLine(), handler.getColumn(),
                                     new Name(handler.getLine(), handler.getColumn(), ErrorNames.STATES_PREFIX), "ALL");
            }
            handlers.add(handler.with(type, statements(handler.getBody())));
        }
        return node.with(statements(node.getBody()), handlers, statements(node.getOrelse()),
                         statements(node.getFinalbody()));
    }

    @Override
    public Statement visitWith(With node) {
        return node.withBody(statements(node.getBody()));
    }

    @Override
    public Statement visitAssign(Assign node) {
        return node;
    }

    @Override
    public Statement visitExprStatement(ExprStatement node) {
        return node;
    }

    @Override
    public Statement visitRaise(Raise node) {
        return node;
    }

    @Override
    public Statement visitReturn(Return node) {
        return node;
    }

    @Override
    public Statement visitPass(Pass node) {
        return node;
    }

    @Override
    public Statement visitImport(Import node) {
        return node;
    }

    @Override
    public Statement visitImportFrom(ImportFrom node) {
        return node;
    }

    @Override
    public Statement visitOpaqueStatement(OpaqueStatement node) {
        return node;
    }
}

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

/**
 * Visits the closed set of statement forms. Adding a statement class requires adding a method here,
 * so every implementation is forced to decide how to handle it.
 *
 * @param <R> The result type of the visit.
 */
public interface StatementVisitor<R> {

    R visitClassDef(ClassDef node);

    R visitFunctionDef(FunctionDef node);

    R visitAssign(Assign node);

    R visitExprStatement(ExprStatement node);

    R visitIf(If node);

    R visitRaise(Raise node);

    R visitReturn(Return node);

    R visitTry(Try node);

    R visitWith(With node);

    R visitPass(Pass node);

    R visitImport(Import node);

    R visitImportFrom(ImportFrom node);

    R visitOpaqueStatement(OpaqueStatement node);
}

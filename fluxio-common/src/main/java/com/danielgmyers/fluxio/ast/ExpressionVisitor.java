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
 * Visits the closed set of expression forms.
 *
 * @param <R> The result type of the visit.
 */
public interface ExpressionVisitor<R> {

    R visitName(Name node);

    R visitAttribute(Attribute node);

    R visitSubscript(Subscript node);

    R visitCall(Call node);

    R visitConstant(Constant node);

    R visitDict(DictExpr node);

    R visitList(ListExpr node);

    R visitTuple(TupleExpr node);

    R visitBoolOp(BoolOp node);

    R visitUnaryOp(UnaryOp node);

    R visitCompare(Compare node);
}

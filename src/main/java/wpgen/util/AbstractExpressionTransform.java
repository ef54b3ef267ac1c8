// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wpgen.util;

import wpgen.core.Logic;
import wpgen.core.Logic.Expr;

/**
 * An expression visitor which rebuilds the tree it visits. Nodes whose operands
 * are unchanged are returned as they are, so a transform which changes nothing
 * allocates nothing.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructBoolean(Expr.BooleanLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructBitVector(Expr.BitVector expr) {
        return expr;
    }

    @Override
    protected Expr constructVariableMapping(Expr.VariableMapping expr) {
        return expr;
    }

    @Override
    protected Expr constructUnaryExpression(Expr.UnaryExpression expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return Logic.UNARY(expr.getOperator(), operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructBinaryExpression(Expr.BinaryExpression expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.BINARY(expr.getOperator(), lhs, rhs, expr.getAttributes());
        }
    }
}

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

import wpgen.core.Logic.Expr;

/**
 * Generic traversal over expression trees. Composite expressions are visited
 * bottom-up: operands are visited first, and the results handed to the
 * corresponding <code>construct</code> method.
 *
 * @param <E> the result of visiting an expression
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.BooleanLiteral) {
            return constructBoolean((Expr.BooleanLiteral) expr);
        } else if(expr instanceof Expr.BitVector) {
            return constructBitVector((Expr.BitVector) expr);
        } else if(expr instanceof Expr.VariableMapping) {
            return constructVariableMapping((Expr.VariableMapping) expr);
        } else if(expr instanceof Expr.UnaryExpression) {
            return visitUnaryExpression((Expr.UnaryExpression) expr);
        } else if(expr instanceof Expr.BinaryExpression) {
            return visitBinaryExpression((Expr.BinaryExpression) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected E visitUnaryExpression(Expr.UnaryExpression expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnaryExpression(expr, operand);
    }

    protected E visitBinaryExpression(Expr.BinaryExpression expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinaryExpression(expr, lhs, rhs);
    }

    protected abstract E constructBoolean(Expr.BooleanLiteral expr);
    protected abstract E constructBitVector(Expr.BitVector expr);
    protected abstract E constructVariableMapping(Expr.VariableMapping expr);
    protected abstract E constructUnaryExpression(Expr.UnaryExpression expr, E operand);
    protected abstract E constructBinaryExpression(Expr.BinaryExpression expr, E lhs, E rhs);
}

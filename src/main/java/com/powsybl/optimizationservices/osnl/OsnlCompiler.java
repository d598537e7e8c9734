/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.osnl;

import com.powsybl.optimizationservices.ShapeException;
import com.powsybl.optimizationservices.expression.ArityClass;
import com.powsybl.optimizationservices.expression.Call;
import com.powsybl.optimizationservices.expression.Constant;
import com.powsybl.optimizationservices.expression.Expression;
import com.powsybl.optimizationservices.expression.OperatorTables;
import com.powsybl.optimizationservices.expression.VariableRef;

/**
 * Converts a symbolic expression tree to an OSnL nonlinear expression tree.
 * <p>
 * Calls are dispatched on their argument count (unary, binary, variadic). Binary calls get a few rewrites before
 * the generic form: {@code x ^ 2} becomes {@code <square>}, and a variable multiplied or divided by a constant
 * becomes a single {@code <variable>} carrying a {@code coef} attribute.
 * <p>
 * The compiler holds no state and may be shared.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsnlCompiler {

    private OsnlCompiler() {
    }

    /**
     * Appends exactly one node representing the expression to the parent.
     *
     * @param parent the node receiving the translation
     * @param expression the expression to translate, left untouched
     * @return the appended node
     */
    public static NonlinearNode compile(NonlinearNode parent, Expression expression) {
        return switch (expression.getKind()) {
            case CONSTANT -> number(parent, (Constant) expression);
            case VARIABLE -> variable(parent, (VariableRef) expression);
            case CALL -> compileCall(parent, (Call) expression);
        };
    }

    private static NonlinearNode number(NonlinearNode parent, Constant constant) {
        return parent.addChild(NonlinearNode.NUMBER)
                .setAttribute(NonlinearNode.VALUE_ATTRIBUTE, constant.value());
    }

    private static NonlinearNode variable(NonlinearNode parent, VariableRef variable) {
        return parent.addChild(NonlinearNode.VARIABLE)
                .setAttribute(NonlinearNode.IDX_ATTRIBUTE, variable.index());
    }

    private static NonlinearNode scaledVariable(NonlinearNode parent, VariableRef variable, double coef) {
        return variable(parent, variable).setAttribute(NonlinearNode.COEF_ATTRIBUTE, coef);
    }

    private static NonlinearNode compileCall(NonlinearNode parent, Call call) {
        ArityClass arityClass = ArityClass.of(call.getArgumentCount());
        if (arityClass == null) {
            throw new ShapeException("Do not know how to handle call expression " + call + " without argument");
        }
        String operator = call.operator();
        return switch (arityClass) {
            case UNARY -> {
                NonlinearNode child = parent.addChild(OperatorTables.lookup(ArityClass.UNARY, operator));
                compile(child, call.getArgument(0));
                yield child;
            }
            case BINARY -> compileBinary(parent, operator, OperatorTables.lookup(ArityClass.BINARY, operator),
                    call.getArgument(0), call.getArgument(1));
            case VARIADIC -> {
                NonlinearNode child = parent.addChild(OperatorTables.lookup(ArityClass.VARIADIC, operator));
                for (Expression argument : call.arguments()) {
                    compile(child, argument);
                }
                yield child;
            }
        };
    }

    private static NonlinearNode compileBinary(NonlinearNode parent, String operator, String tag, Expression left, Expression right) {
        return switch (left.getKind()) {
            case CONSTANT -> switch (right.getKind()) {
                case VARIABLE -> OperatorTables.MULTIPLY_TOKENS.contains(operator)
                        ? scaledVariable(parent, (VariableRef) right, ((Constant) left).value())
                        : generic(parent, tag, left, right);
                case CONSTANT, CALL -> generic(parent, tag, left, right);
            };
            case VARIABLE -> switch (right.getKind()) {
                case CONSTANT -> variableByConstant(parent, operator, tag, (VariableRef) left, (Constant) right);
                case VARIABLE, CALL -> generic(parent, tag, left, right);
            };
            case CALL -> switch (right.getKind()) {
                case CONSTANT -> isSquare(operator, (Constant) right)
                        ? square(parent, left)
                        : generic(parent, tag, left, right);
                case VARIABLE, CALL -> generic(parent, tag, left, right);
            };
        };
    }

    private static NonlinearNode variableByConstant(NonlinearNode parent, String operator, String tag, VariableRef variable, Constant constant) {
        if (isSquare(operator, constant)) {
            return square(parent, variable);
        } else if (OperatorTables.MULTIPLY_TOKENS.contains(operator)) {
            return scaledVariable(parent, variable, constant.value());
        } else if (OperatorTables.DIVIDE_TOKENS.contains(operator)) {
            return scaledVariable(parent, variable, 1 / constant.value());
        }
        return generic(parent, tag, variable, constant);
    }

    private static boolean isSquare(String operator, Constant exponent) {
        return exponent.value() == 2 && OperatorTables.POWER_TOKENS.contains(operator);
    }

    private static NonlinearNode square(NonlinearNode parent, Expression base) {
        NonlinearNode child = parent.addChild(NonlinearNode.SQUARE);
        compile(child, base);
        return child;
    }

    private static NonlinearNode generic(NonlinearNode parent, String tag, Expression left, Expression right) {
        NonlinearNode child = parent.addChild(tag);
        compile(child, left);
        compile(child, right);
        return child;
    }
}

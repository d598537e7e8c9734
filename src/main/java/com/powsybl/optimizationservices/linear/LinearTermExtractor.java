/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.linear;

import com.powsybl.optimizationservices.ShapeException;
import com.powsybl.optimizationservices.expression.Call;
import com.powsybl.optimizationservices.expression.Constant;
import com.powsybl.optimizationservices.expression.Expression;
import com.powsybl.optimizationservices.expression.VariableRef;

import java.util.List;

/**
 * Reads the terms of a linear expression already normalized as {@code +(c0, c1 * x[i1], c2 * x[i2], ...)}.
 * No simplification is attempted: a term of any other shape is rejected.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class LinearTermExtractor {

    public static final String SUM_OPERATOR = "+";
    public static final String MULTIPLY_OPERATOR = "*";

    private LinearTermExtractor() {
    }

    /**
     * Adds a {@code coefficient * x[index]} term to the accumulator, or returns the value of a constant term.
     *
     * @return the constant contribution of the term, 0 for a variable term
     * @throws ShapeException if the term is neither a constant nor {@code *(constant, variable)}
     */
    public static double addTerm(LinearAccumulator accumulator, Expression term) {
        return switch (term.getKind()) {
            case CONSTANT -> ((Constant) term).value();
            case VARIABLE -> throw new ShapeException("Expected a constant or a coefficient * variable term, got bare variable " + term);
            case CALL -> {
                Call call = (Call) term;
                if (!MULTIPLY_OPERATOR.equals(call.operator()) || call.getArgumentCount() != 2) {
                    throw new ShapeException("Expected a coefficient * variable term, got " + term);
                }
                Expression coefficient = call.getArgument(0);
                Expression variable = call.getArgument(1);
                if (coefficient.getKind() != Expression.Kind.CONSTANT) {
                    throw new ShapeException("Expected a constant coefficient in linear term " + term);
                }
                if (variable.getKind() != Expression.Kind.VARIABLE) {
                    throw new ShapeException("Expected a variable reference in linear term " + term);
                }
                accumulator.add(((VariableRef) variable).index(), ((Constant) coefficient).value());
                yield 0.0;
            }
        };
    }

    /**
     * Adds every term of a {@code +} call to the accumulator.
     *
     * @return the sum of the constant terms
     */
    public static double addTerms(LinearAccumulator accumulator, Expression sum) {
        double constant = 0.0;
        for (Expression term : terms(sum)) {
            constant += addTerm(accumulator, term);
        }
        return constant;
    }

    /**
     * @return the terms of a {@code +} call
     * @throws ShapeException if the expression is not a {@code +} call
     */
    public static List<Expression> terms(Expression sum) {
        if (sum.getKind() != Expression.Kind.CALL || !SUM_OPERATOR.equals(((Call) sum).operator())) {
            throw new ShapeException("Expected a sum of linear terms, got " + sum);
        }
        return ((Call) sum).arguments();
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.expression.Expression;

/**
 * Source of the algebraic form of a nonlinear model.
 * <p>
 * Linear parts are expected as a sum of {@code coefficient * x[i]} terms and constants; constraint expressions
 * are the body of the constraint, its bounds being given separately. Linear constraints come first.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public interface NlpEvaluator {

    boolean isObjectiveLinear();

    boolean isConstraintLinear(int row);

    Expression getObjectiveExpression();

    Expression getConstraintExpression(int row);
}

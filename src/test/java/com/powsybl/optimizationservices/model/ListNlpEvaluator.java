/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.expression.Expression;

import java.util.List;
import java.util.Set;

/**
 * Evaluator over fixed expressions, linearity flags given explicitly.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
record ListNlpEvaluator(Expression objective, boolean objectiveLinear, List<Expression> constraints,
                        Set<Integer> linearRows) implements NlpEvaluator {

    @Override
    public boolean isObjectiveLinear() {
        return objectiveLinear;
    }

    @Override
    public boolean isConstraintLinear(int row) {
        return linearRows.contains(row);
    }

    @Override
    public Expression getObjectiveExpression() {
        return objective;
    }

    @Override
    public Expression getConstraintExpression(int row) {
        return constraints.get(row);
    }
}

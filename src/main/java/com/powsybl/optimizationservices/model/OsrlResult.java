/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.status.OptimizationOutcome;
import com.powsybl.optimizationservices.status.SolutionStatus;

import java.util.Objects;
import java.util.Optional;

/**
 * Content of an OSrL results document once decoded.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsrlResult {

    private final SolutionStatus status;
    private final double[] solution;
    private final double[] dualValues;
    private final double objectiveValue;

    public OsrlResult(SolutionStatus status, double[] solution, double[] dualValues, double objectiveValue) {
        this.status = Objects.requireNonNull(status);
        this.solution = Objects.requireNonNull(solution).clone();
        this.dualValues = dualValues != null ? dualValues.clone() : null;
        this.objectiveValue = objectiveValue;
    }

    public SolutionStatus getStatus() {
        return status;
    }

    public OptimizationOutcome getOutcome() {
        return status.outcome();
    }

    /**
     * @return variable values, NaN for variables the solver did not report
     */
    public double[] getSolution() {
        return solution.clone();
    }

    /**
     * @return constraint dual values, if the solver reported them
     */
    public Optional<double[]> getDualValues() {
        return Optional.ofNullable(dualValues).map(double[]::clone);
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }
}

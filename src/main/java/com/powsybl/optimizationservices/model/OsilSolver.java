/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import java.util.Objects;

/**
 * Entry point creating {@link OsilModel} instances sharing the same solver parameters.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class OsilSolver {

    private final OsSolverParameters parameters;
    private final SolverRunner solverRunner;

    public OsilSolver() {
        this(new OsSolverParameters());
    }

    public OsilSolver(OsSolverParameters parameters) {
        this(parameters, new OsSolverService());
    }

    public OsilSolver(OsSolverParameters parameters, SolverRunner solverRunner) {
        this.parameters = Objects.requireNonNull(parameters);
        this.solverRunner = Objects.requireNonNull(solverRunner);
    }

    public OsSolverParameters getParameters() {
        return parameters;
    }

    public OsilModel createModel() {
        return new OsilModel(parameters, solverRunner);
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import java.nio.file.Path;

/**
 * Runs a solver on a written problem and options document, producing a results document.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
@FunctionalInterface
public interface SolverRunner {

    /**
     * @throws com.powsybl.optimizationservices.SolverProcessException if the solver fails
     */
    void run(OsSolverParameters parameters, Path problemFile, Path optionsFile, Path resultsFile);
}

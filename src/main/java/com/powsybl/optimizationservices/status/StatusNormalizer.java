/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.status;

import org.apache.commons.lang3.StringUtils;

/**
 * Maps the status type and description of an OSrL results document to an {@link OptimizationOutcome}.
 * Some solvers report limits only in the description (for instance {@code other} with
 * {@code LIMIT_EXCEEDED ...}), so a description starting with {@value #LIMIT_PREFIX} forces
 * {@link OptimizationOutcome#USER_LIMIT}.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class StatusNormalizer {

    public static final String LIMIT_PREFIX = "LIMIT";

    private StatusNormalizer() {
    }

    /**
     * @param type the {@code type} attribute of the status element
     * @param description the {@code description} attribute of the status element, may be null
     * @throws com.powsybl.optimizationservices.UnknownStatusException if the type is unknown
     */
    public static SolutionStatus normalize(String type, String description) {
        OsrlStatusType statusType = OsrlStatusType.fromToken(type);
        OptimizationOutcome outcome = statusType.toOutcome();
        String warning = null;
        if (StringUtils.startsWith(description, LIMIT_PREFIX) && outcome != OptimizationOutcome.USER_LIMIT) {
            warning = "Status type was " + type + " (" + outcome + ") but description was '" + description
                    + "', so outcome is set to " + OptimizationOutcome.USER_LIMIT;
            outcome = OptimizationOutcome.USER_LIMIT;
        }
        return new SolutionStatus(statusType, description, outcome, warning);
    }
}

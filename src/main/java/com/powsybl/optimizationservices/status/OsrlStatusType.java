/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.status;

import com.powsybl.optimizationservices.UnknownStatusException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enum representing the solution status types an OSrL results document may report,
 * each mapped to the corresponding {@link OptimizationOutcome}.
 * The mapping is conservative: statuses that do not guarantee an optimal solution are reported as errors.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public enum OsrlStatusType {

    UNBOUNDED("unbounded", OptimizationOutcome.UNBOUNDED),
    GLOBALLY_OPTIMAL("globallyOptimal", OptimizationOutcome.OPTIMAL),
    LOCALLY_OPTIMAL("locallyOptimal", OptimizationOutcome.OPTIMAL),
    OPTIMAL("optimal", OptimizationOutcome.OPTIMAL),

    /**
     * Best solution found so far, optimality not proven.
     */
    BEST_SO_FAR("bestSoFar", OptimizationOutcome.ERROR),

    /**
     * Feasible point without optimality guarantee, seen with problems having no objective.
     */
    FEASIBLE("feasible", OptimizationOutcome.ERROR),
    INFEASIBLE("infeasible", OptimizationOutcome.INFEASIBLE),
    UNSURE("unsure", OptimizationOutcome.ERROR),
    ERROR("error", OptimizationOutcome.ERROR),

    /**
     * Bonmin and Couenne report iteration or time limits as "other" with a LIMIT_EXCEEDED description.
     */
    OTHER("other", OptimizationOutcome.ERROR),
    STOPPED_BY_LIMIT("stoppedByLimit", OptimizationOutcome.USER_LIMIT),
    STOPPED_BY_BOUNDS("stoppedByBounds", OptimizationOutcome.ERROR),

    /**
     * Spellings of acceptable-level convergence emitted by the Ipopt and Bonmin OS wrappers, typos included.
     */
    IPOPT_ACCETABLE("IpoptAccetable", OptimizationOutcome.OPTIMAL),
    IPOPT_ACCEPTABLE("IpoptAcceptable", OptimizationOutcome.OPTIMAL),
    BONMIN_ACCETABLE("BonminAccetable", OptimizationOutcome.OPTIMAL),
    BONMIN_ACCEPTABLE("BonminAcceptable", OptimizationOutcome.OPTIMAL);

    private static final Map<String, OsrlStatusType> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OsrlStatusType::getToken, Function.identity()));

    private final String token;
    private final OptimizationOutcome mappedOutcome;

    OsrlStatusType(String token, OptimizationOutcome mappedOutcome) {
        this.token = token;
        this.mappedOutcome = mappedOutcome;
    }

    /**
     * Returns the status type written as the given token in the {@code type} attribute of an OSrL status.
     *
     * @throws UnknownStatusException if the token is not a known status type
     */
    public static OsrlStatusType fromToken(String token) {
        OsrlStatusType type = token != null ? BY_TOKEN.get(token) : null;
        if (type == null) {
            throw new UnknownStatusException(token);
        }
        return type;
    }

    public String getToken() {
        return token;
    }

    public OptimizationOutcome toOutcome() {
        return mappedOutcome;
    }
}

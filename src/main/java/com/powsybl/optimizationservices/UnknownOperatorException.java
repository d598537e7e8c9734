/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices;

import com.powsybl.optimizationservices.expression.ArityClass;

import java.util.Objects;

/**
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class UnknownOperatorException extends OptimizationServicesException {

    private final String operator;
    private final ArityClass arityClass;

    public UnknownOperatorException(String operator, ArityClass arityClass) {
        super("Do not know how to convert " + arityClass.getLabel() + " operator '" + operator + "' to OSnL");
        this.operator = Objects.requireNonNull(operator);
        this.arityClass = Objects.requireNonNull(arityClass);
    }

    public String getOperator() {
        return operator;
    }

    public ArityClass getArityClass() {
        return arityClass;
    }
}

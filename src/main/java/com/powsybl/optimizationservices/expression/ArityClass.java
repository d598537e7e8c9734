/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.expression;

/**
 * Operator tables are partitioned by the number of arguments of the call.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public enum ArityClass {
    UNARY("unary"),
    BINARY("binary"),
    VARIADIC("varargs");

    private final String label;

    ArityClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the arity class of a call with the given number of arguments, or null for a call without argument
     */
    public static ArityClass of(int argumentCount) {
        if (argumentCount < 1) {
            return null;
        }
        return switch (argumentCount) {
            case 1 -> UNARY;
            case 2 -> BINARY;
            default -> VARIADIC;
        };
    }
}

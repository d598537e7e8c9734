/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.expression;

/**
 * Reference to a model variable, by zero-based index.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public record VariableRef(int index) implements Expression {

    public VariableRef {
        if (index < 0) {
            throw new IllegalArgumentException("Variable index must be positive or zero: " + index);
        }
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }

    @Override
    public String toString() {
        return "x[" + index + "]";
    }
}

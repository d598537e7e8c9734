/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.expression;

import java.util.List;

/**
 * Node of a symbolic expression tree, as supplied by the model for an objective or a constraint body.
 * The tree is a tagged union over {@link Constant}, {@link VariableRef} and {@link Call}; code dispatching on it
 * switches over {@link #getKind()} so that every case is handled explicitly.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public sealed interface Expression permits Constant, VariableRef, Call {

    enum Kind {
        CONSTANT,
        VARIABLE,
        CALL
    }

    Kind getKind();

    static Constant constant(double value) {
        return new Constant(value);
    }

    static VariableRef variable(int index) {
        return new VariableRef(index);
    }

    static Call call(String operator, Expression... arguments) {
        return new Call(operator, List.of(arguments));
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Operator applied to an ordered list of arguments. The number of arguments selects the operator table.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public record Call(String operator, List<Expression> arguments) implements Expression {

    public Call {
        Objects.requireNonNull(operator);
        arguments = List.copyOf(arguments);
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public Expression getArgument(int i) {
        return arguments.get(i);
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }

    @Override
    public String toString() {
        return arguments.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", operator + "(", ")"));
    }
}

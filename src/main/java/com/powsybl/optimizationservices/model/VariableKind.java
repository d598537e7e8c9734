/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.UnknownVariableKindException;

/**
 * Kinds of variables a model may declare, with the one-character type code OSiL uses for each of them.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public enum VariableKind {
    CONTINUOUS("Cont", 'C'),
    INTEGER("Int", 'I'),
    BINARY("Bin", 'B'),
    SEMI_CONTINUOUS("SemiCont", 'D'),
    SEMI_INTEGER("SemiInt", 'J'),

    /**
     * Written as continuous, the variable being expected to have equal lower and upper bounds.
     */
    FIXED("Fixed", 'C');

    private final String token;
    private final char typeCode;

    VariableKind(String token, char typeCode) {
        this.token = token;
        this.typeCode = typeCode;
    }

    public String getToken() {
        return token;
    }

    public char getTypeCode() {
        return typeCode;
    }

    public static VariableKind fromToken(String token) {
        for (VariableKind kind : values()) {
            if (kind.token.equals(token)) {
                return kind;
            }
        }
        throw new UnknownVariableKindException(token);
    }
}

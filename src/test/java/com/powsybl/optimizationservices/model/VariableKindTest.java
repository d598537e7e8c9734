/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.UnknownVariableKindException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
class VariableKindTest {

    @ParameterizedTest
    @CsvSource({
        "Cont, CONTINUOUS, C",
        "Int, INTEGER, I",
        "Bin, BINARY, B",
        "SemiCont, SEMI_CONTINUOUS, D",
        "SemiInt, SEMI_INTEGER, J",
        "Fixed, FIXED, C"
    })
    void testTypeCodes(String token, VariableKind expected, char typeCode) {
        VariableKind kind = VariableKind.fromToken(token);
        assertSame(expected, kind);
        assertEquals(typeCode, kind.getTypeCode());
        assertEquals(token, kind.getToken());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Continuous", "cont", "", "C"})
    void testUnknownKind(String token) {
        UnknownVariableKindException e = assertThrows(UnknownVariableKindException.class, () -> VariableKind.fromToken(token));
        assertEquals("Unrecognized variable kind " + token, e.getMessage());
    }
}

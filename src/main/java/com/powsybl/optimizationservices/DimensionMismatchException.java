/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices;

/**
 * Raised when array lengths or counts supplied by the caller (or reported by the solver) disagree.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class DimensionMismatchException extends OptimizationServicesException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    public static void checkLength(String what, int expected, int actual) {
        if (expected != actual) {
            throw new DimensionMismatchException("Expected " + what + " of length " + expected + ", got " + actual);
        }
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices;

/**
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class UnknownStatusException extends OptimizationServicesException {

    private final String statusType;

    public UnknownStatusException(String statusType) {
        super("Unknown solution status type " + statusType);
        this.statusType = statusType;
    }

    public String getStatusType() {
        return statusType;
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices;

import com.powsybl.commons.PowsyblException;

/**
 * Base class of every fatal error raised while translating a model to the Optimization Services
 * documents, running the solver service or reading its results back.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class OptimizationServicesException extends PowsyblException {

    public OptimizationServicesException(String message) {
        super(message);
    }

    public OptimizationServicesException(String message, Throwable cause) {
        super(message, cause);
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.status;

import java.util.Objects;
import java.util.Optional;

/**
 * Status of a solve once normalized: the raw status type and description read from the results document,
 * the resulting outcome, and the inconsistency warning raised when the description overrode the type.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public record SolutionStatus(OsrlStatusType type, String description, OptimizationOutcome outcome, String warning) {

    public SolutionStatus {
        Objects.requireNonNull(type);
        Objects.requireNonNull(outcome);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getWarning() {
        return Optional.ofNullable(warning);
    }

    public boolean isOverridden() {
        return outcome != type.toOutcome();
    }
}

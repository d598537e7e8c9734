/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Results documents as returned by the solver service.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
final class OsrlDocuments {

    private OsrlDocuments() {
    }

    static String results(int numberOfVariables, int numberOfConstraints, String solution) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<osrl xmlns=\"os.optimizationservices.org\">\n"
                + "  <general><generalStatus type=\"normal\"/></general>\n"
                + "  <optimization numberOfSolutions=\"1\" numberOfVariables=\"" + numberOfVariables
                + "\" numberOfConstraints=\"" + numberOfConstraints + "\" numberOfObjectives=\"1\">\n"
                + solution
                + "  </optimization>\n"
                + "</osrl>\n";
    }

    static String solution(String statusType, String values, String objectiveValue) {
        return "    <solution>\n"
                + "      <status type=\"" + statusType + "\"/>\n"
                + "      <variables>" + values + "</variables>\n"
                + "      <objectives><values numberOfObj=\"1\"><obj idx=\"-1\">" + objectiveValue + "</obj></values></objectives>\n"
                + "    </solution>\n";
    }

    static Path write(Path file, String content) {
        try {
            return Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

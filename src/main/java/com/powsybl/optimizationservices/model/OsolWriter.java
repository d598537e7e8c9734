/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the OSoL options document: initial variable values and solver options.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsolWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsolWriter.class);

    private OsolWriter() {
    }

    /**
     * @param initialValues warm start values, one per variable, may be empty
     * @param solverOptions solver option values by name, in the order they are written
     */
    public static Document createDocument(double[] initialValues, Map<String, String> solverOptions) {
        Objects.requireNonNull(initialValues);
        Objects.requireNonNull(solverOptions);
        Document document = OsXml.newDocument("osol", "OSoL.xsd");
        Element optimization = OsXml.addChild(document.getDocumentElement(), "optimization");

        if (initialValues.length > 0) {
            Element variables = OsXml.addChild(optimization, "variables");
            Element initialVariableValues = OsXml.addChild(variables, "initialVariableValues");
            initialVariableValues.setAttribute("numberOfVar", Integer.toString(initialValues.length));
            for (int idx = 0; idx < initialValues.length; idx++) {
                Element variable = OsXml.addChild(initialVariableValues, "var");
                variable.setAttribute("idx", Integer.toString(idx));
                variable.setAttribute("value", OsXml.format(initialValues[idx]));
            }
        }

        if (!solverOptions.isEmpty()) {
            Element options = OsXml.addChild(optimization, "solverOptions");
            options.setAttribute("numberOfSolverOptions", Integer.toString(solverOptions.size()));
            solverOptions.forEach((name, value) -> {
                Element option = OsXml.addChild(options, "solverOption");
                option.setAttribute("name", name);
                option.setAttribute("value", value);
            });
        }
        return document;
    }

    public static void write(Path file, double[] initialValues, Map<String, String> solverOptions) {
        OsXml.write(createDocument(initialValues, solverOptions), file);
        LOGGER.info("OSoL options written to {} ({} initial values, {} solver options)",
                file, initialValues.length, solverOptions.size());
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.DimensionMismatchException;
import com.powsybl.optimizationservices.codec.SparseVectorCodec;
import com.powsybl.optimizationservices.status.SolutionStatus;
import com.powsybl.optimizationservices.status.StatusNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads an OSrL results document. The document must describe the problem that was sent (same numbers of variables
 * and constraints); a number of solutions or of objectives other than one only raises a warning, the first one
 * being read.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsrlReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsrlReader.class);

    private OsrlReader() {
    }

    public static OsrlResult read(Path file, int numberOfVariables, int numberOfConstraints) {
        LOGGER.info("Reading OSrL results from {}", file);
        return read(OsXml.parse(file), numberOfVariables, numberOfConstraints);
    }

    public static OsrlResult read(Document document, int numberOfVariables, int numberOfConstraints) {
        Element optimization = OsXml.getElement(document.getDocumentElement(), "optimization");
        checkCount(optimization, "numberOfVariables", numberOfVariables);
        checkCount(optimization, "numberOfConstraints", numberOfConstraints);
        warnIfNotOne(OsXml.getAttribute(optimization, "numberOfSolutions"), "numberOfSolutions");

        Element solution = OsXml.getElement(optimization, "solution");
        Element statusElement = OsXml.getElement(solution, "status");
        SolutionStatus status = StatusNormalizer.normalize(statusElement.getAttribute("type"),
                OsXml.getAttribute(statusElement, "description").orElse(null));
        status.getWarning().ifPresent(LOGGER::warn);
        LOGGER.info("Solution status: {} -> {}", status.type().getToken(), status.outcome());

        double[] values = readVariableValues(solution, numberOfVariables);
        double[] dualValues = readDualValues(solution, numberOfConstraints);
        double objectiveValue = readObjectiveValue(solution);
        return new OsrlResult(status, values, dualValues, objectiveValue);
    }

    private static void checkCount(Element element, String attribute, int expected) {
        int actual = OsXml.getIntAttribute(element, attribute);
        if (actual != expected) {
            throw new DimensionMismatchException("Results document reports " + attribute + "=" + actual + ", expected " + expected);
        }
    }

    private static void warnIfNotOne(Optional<String> count, String attribute) {
        String value = count.map(String::trim).orElse(null);
        if (!"1".equals(value)) {
            LOGGER.warn("{} expected to be 1, was {}", attribute, value);
        }
    }

    private static double[] readVariableValues(Element solution, int numberOfVariables) {
        Optional<Element> values = OsXml.findElement(solution, "variables")
                .flatMap(variables -> OsXml.findElement(variables, "values"));
        if (values.isEmpty()) {
            LOGGER.warn("No variable values in results document");
            return SparseVectorCodec.decode(numberOfVariables, Double.NaN, List.of());
        }
        checkCount(values.get(), "numberOfVar", numberOfVariables);
        return SparseVectorCodec.decode(values.get(), numberOfVariables, Double.NaN);
    }

    private static double[] readDualValues(Element solution, int numberOfConstraints) {
        return OsXml.findElement(solution, "constraints")
                .flatMap(constraints -> OsXml.findElement(constraints, "dualValues"))
                .map(dualValues -> SparseVectorCodec.decode(dualValues, numberOfConstraints, Double.NaN))
                .orElse(null);
    }

    private static double readObjectiveValue(Element solution) {
        Optional<Element> values = OsXml.findElement(solution, "objectives")
                .flatMap(objectives -> OsXml.findElement(objectives, "values"));
        if (values.isEmpty()) {
            LOGGER.warn("No objective value in results document");
            return Double.NaN;
        }
        warnIfNotOne(OsXml.getAttribute(values.get(), "numberOfObj"), "numberOfObj");
        return OsXml.findElement(values.get(), "obj")
                .map(obj -> OsXml.parseDouble(obj.getTextContent()))
                .orElse(Double.NaN);
    }
}

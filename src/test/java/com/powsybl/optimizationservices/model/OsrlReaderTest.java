/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.DimensionMismatchException;
import com.powsybl.optimizationservices.SolverProcessException;
import com.powsybl.optimizationservices.UnknownStatusException;
import com.powsybl.optimizationservices.status.OptimizationOutcome;
import com.powsybl.optimizationservices.status.OsrlStatusType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
class OsrlReaderTest {

    @TempDir
    Path tmp;

    private OsrlResult read(String content, int numberOfVariables, int numberOfConstraints) {
        Path file = OsrlDocuments.write(tmp.resolve("results.osrl"), content);
        return OsrlReader.read(file, numberOfVariables, numberOfConstraints);
    }

    @Test
    void testOptimalSolution() {
        String values = "<values numberOfVar=\"3\"><var idx=\"0\">1.5</var><var idx=\"2\">-2</var><var idx=\"1\">0</var></values>";
        OsrlResult result = read(OsrlDocuments.results(3, 0, OsrlDocuments.solution("locallyOptimal", values, "4.25")), 3, 0);
        assertEquals(OsrlStatusType.LOCALLY_OPTIMAL, result.getStatus().type());
        assertEquals(OptimizationOutcome.OPTIMAL, result.getOutcome());
        assertArrayEquals(new double[] {1.5, 0.0, -2.0}, result.getSolution());
        assertEquals(4.25, result.getObjectiveValue());
        assertTrue(result.getDualValues().isEmpty());
    }

    @Test
    void testInfiniteValues() {
        String solution = "<solution>"
                + "<status type=\"unbounded\"/>"
                + "<variables><values numberOfVar=\"2\"><var idx=\"0\">INF</var><var idx=\"1\">-INF</var></values></variables>"
                + "<constraints><dualValues numberOfCon=\"1\"><con idx=\"0\">INF</con></dualValues></constraints>"
                + "<objectives><values numberOfObj=\"1\"><obj idx=\"-1\">-INF</obj></values></objectives>"
                + "</solution>";
        OsrlResult result = read(OsrlDocuments.results(2, 1, solution), 2, 1);
        assertEquals(OptimizationOutcome.UNBOUNDED, result.getOutcome());
        assertArrayEquals(new double[] {Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}, result.getSolution());
        assertArrayEquals(new double[] {Double.POSITIVE_INFINITY}, result.getDualValues().orElseThrow());
        assertEquals(Double.NEGATIVE_INFINITY, result.getObjectiveValue());
    }

    @Test
    void testLimitDescriptionAndDuals() {
        String solution = "<solution>"
                + "<status type=\"other\" description=\"LIMIT_EXCEEDED[IPOPT]: Maximum Number of Iterations Exceeded.\"/>"
                + "<variables><values numberOfVar=\"2\"><var idx=\"0\">1</var><var idx=\"1\">2</var></values></variables>"
                + "<constraints><dualValues numberOfCon=\"1\"><con idx=\"1\">0.5</con></dualValues></constraints>"
                + "<objectives><values numberOfObj=\"1\"><obj idx=\"-1\">3</obj></values></objectives>"
                + "</solution>";
        OsrlResult result = read(OsrlDocuments.results(2, 2, solution), 2, 2);
        assertEquals(OptimizationOutcome.USER_LIMIT, result.getOutcome());
        assertTrue(result.getStatus().isOverridden());
        assertThat(result.getDualValues()).hasValueSatisfying(duals -> {
            assertTrue(Double.isNaN(duals[0]));
            assertEquals(0.5, duals[1]);
        });
    }

    @Test
    void testInfeasibleWithoutValues() {
        String solution = "<solution><status type=\"infeasible\"/></solution>";
        OsrlResult result = read(OsrlDocuments.results(2, 1, solution), 2, 1);
        assertEquals(OptimizationOutcome.INFEASIBLE, result.getOutcome());
        assertTrue(Arrays.stream(result.getSolution()).allMatch(Double::isNaN));
        assertTrue(Double.isNaN(result.getObjectiveValue()));
    }

    @Test
    void testSeveralSolutionsOnlyWarns() {
        String values = "<values numberOfVar=\"1\"><var idx=\"0\">7</var></values>";
        String content = OsrlDocuments.results(1, 0, OsrlDocuments.solution("optimal", values, "7"))
                .replace("numberOfSolutions=\"1\"", "numberOfSolutions=\"2\"")
                .replace("numberOfObj=\"1\"", "numberOfObj=\"3\"");
        OsrlResult result = read(content, 1, 0);
        assertEquals(OptimizationOutcome.OPTIMAL, result.getOutcome());
        assertArrayEquals(new double[] {7.0}, result.getSolution());
    }

    @Test
    void testCountMismatch() {
        String values = "<values numberOfVar=\"2\"><var idx=\"0\">1</var><var idx=\"1\">2</var></values>";
        String content = OsrlDocuments.results(2, 0, OsrlDocuments.solution("optimal", values, "0"));
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class, () -> read(content, 3, 0));
        assertEquals("Results document reports numberOfVariables=2, expected 3", e.getMessage());
        assertThrows(DimensionMismatchException.class, () -> read(content, 2, 1));
    }

    @Test
    void testUnknownStatus() {
        String content = OsrlDocuments.results(0, 0, OsrlDocuments.solution("solved", "", "0"));
        UnknownStatusException e = assertThrows(UnknownStatusException.class, () -> read(content, 0, 0));
        assertEquals("solved", e.getStatusType());
    }

    @Test
    void testMalformedDocument() {
        Path file = OsrlDocuments.write(tmp.resolve("broken.osrl"), "<osrl><optimization>");
        assertThrows(SolverProcessException.class, () -> OsrlReader.read(file, 0, 0));
        Path missing = tmp.resolve("missing.osrl");
        assertThrows(SolverProcessException.class, () -> OsrlReader.read(missing, 0, 0));
    }
}

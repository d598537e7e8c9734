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
import com.powsybl.optimizationservices.UnknownVariableKindException;
import com.powsybl.optimizationservices.status.OptimizationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.powsybl.optimizationservices.expression.Expression.call;
import static com.powsybl.optimizationservices.expression.Expression.constant;
import static com.powsybl.optimizationservices.expression.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
class OsilModelTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    @TempDir
    Path tmp;

    private OsSolverParameters parameters;

    private final List<List<String>> commands = new ArrayList<>();

    @BeforeEach
    void setUp() {
        parameters = new OsSolverParameters()
                .setWorkingDirectory(tmp.resolve("work"))
                .setSolverName("ipopt")
                .addSolverOption("max_iter", "10");
    }

    /**
     * Stands for the solver service: records the command and answers with the given solution.
     */
    private SolverRunner answering(String results) {
        return (params, problemFile, optionsFile, resultsFile) -> {
            assertTrue(Files.exists(problemFile));
            assertTrue(Files.exists(optionsFile));
            commands.add(OsSolverService.buildCommand(params, problemFile, optionsFile, resultsFile));
            OsrlDocuments.write(resultsFile, results);
        };
    }

    private static OsilModel loadLinear(OsilModel model) {
        LinearConstraintMatrix a = LinearConstraintMatrix.fromDense(new double[][] {{1, 1}}, 2);
        return model.loadLinearProblem(a, new double[] {0, 0}, new double[] {INF, INF}, new double[] {1, 2},
                new double[] {1}, new double[] {INF}, ObjectiveSense.MIN);
    }

    @Test
    void testLinearSolve() {
        String values = "<values numberOfVar=\"2\"><var idx=\"0\">1</var><var idx=\"1\">0</var></values>";
        OsilModel model = new OsilSolver(parameters, answering(OsrlDocuments.results(2, 1,
                OsrlDocuments.solution("optimal", values, "1")))).createModel();
        loadLinear(model).setVariableTypes(List.of("Int", "Cont")).setWarmStart(new double[] {0.5, 0.5});

        assertEquals(OptimizationOutcome.OPTIMAL, model.optimize());
        assertEquals(OptimizationOutcome.OPTIMAL, model.getOutcome());
        assertArrayEquals(new double[] {1.0, 0.0}, model.getSolution());
        assertEquals(1.0, model.getObjectiveValue());
        assertEquals(ObjectiveSense.MIN, model.getSense());
        assertEquals(List.of(VariableKind.INTEGER, VariableKind.CONTINUOUS), model.getVariableKinds());
        assertEquals(2, model.getNumberOfVariables());
        assertEquals(1, model.getNumberOfConstraints());
        assertEquals(1, model.getNumberOfLinearConstraints());
        assertEquals(0, model.getNumberOfQuadraticConstraints());

        assertEquals(1, commands.size());
        assertEquals(List.of("-solver", "ipopt"), commands.get(0).subList(7, 9));

        // documents are kept by default
        Element options = OsXml.parse(parameters.getOptionsFile()).getDocumentElement();
        Element optimization = OsXml.getElement(options, "optimization");
        assertEquals("2", OsXml.getElement(OsXml.getElement(optimization, "variables"), "initialVariableValues")
                .getAttribute("numberOfVar"));
        assertEquals("max_iter", OsXml.getElement(OsXml.getElement(optimization, "solverOptions"), "solverOption")
                .getAttribute("name"));
        assertTrue(Files.exists(parameters.getProblemFile()));
        assertTrue(Files.exists(parameters.getResultsFile()));
    }

    @Test
    void testNonlinearSolveWithoutKeepingFiles() {
        parameters.setKeepFiles(false);
        String values = "<values numberOfVar=\"1\"><var idx=\"0\">0.7390851</var></values>";
        OsilModel model = new OsilModel(parameters, answering(OsrlDocuments.results(1, 1,
                OsrlDocuments.solution("stoppedByLimit", values, "0.5"))));
        // min (x - cos(x))^2 subject to 0 <= x <= 1
        NlpEvaluator evaluator = new ListNlpEvaluator(
                call("^", call("-", variable(0), call("cos", variable(0))), constant(2)), false,
                List.of(call("+", call("*", constant(1), variable(0)))), Set.of(0));
        model.loadNonlinearProblem(1, 1, new double[] {-INF}, new double[] {INF}, new double[] {0}, new double[] {1},
                ObjectiveSense.MIN, evaluator);

        assertEquals(OptimizationOutcome.USER_LIMIT, model.optimize());
        assertEquals(0.7390851, model.getSolution()[0]);
        assertFalse(Files.exists(parameters.getProblemFile()));
        assertFalse(Files.exists(parameters.getOptionsFile()));
        assertFalse(Files.exists(parameters.getResultsFile()));
    }

    @Test
    void testMaximizationIsSent() {
        String values = "<values numberOfVar=\"2\"><var idx=\"0\">0</var><var idx=\"1\">0</var></values>";
        OsilModel model = new OsilModel(parameters, answering(OsrlDocuments.results(2, 1,
                OsrlDocuments.solution("unbounded", values, "INF"))));
        loadLinear(model).setSense(ObjectiveSense.MAX);
        assertEquals(OptimizationOutcome.UNBOUNDED, model.optimize());
        assertEquals(INF, model.getObjectiveValue());
        Element instanceData = OsXml.getElement(OsXml.parse(parameters.getProblemFile()).getDocumentElement(), "instanceData");
        assertEquals("max", OsXml.getElement(OsXml.getElement(instanceData, "objectives"), "obj").getAttribute("maxOrMin"));
    }

    @Test
    void testSolverFailure() {
        OsilModel model = new OsilModel(parameters, (params, p, o, r) -> {
            throw new SolverProcessException("OSSolverService exited with code 1");
        });
        loadLinear(model);
        assertThrows(SolverProcessException.class, model::optimize);
        IllegalStateException e = assertThrows(IllegalStateException.class, model::getSolution);
        assertEquals("Model has not been optimized", e.getMessage());
    }

    @Test
    void testInvalidUse() {
        OsilModel model = new OsilModel(parameters, answering(""));
        IllegalStateException e = assertThrows(IllegalStateException.class, model::optimize);
        assertEquals("No problem loaded", e.getMessage());

        loadLinear(model);
        double[] warmStart = {1.0};
        assertThrows(DimensionMismatchException.class, () -> model.setWarmStart(warmStart));
        List<String> kinds = List.of("Int", "Real");
        assertThrows(UnknownVariableKindException.class, () -> model.setVariableTypes(kinds));
    }
}

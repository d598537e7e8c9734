/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.DimensionMismatchException;
import com.powsybl.optimizationservices.OptimizationServicesException;
import com.powsybl.optimizationservices.status.OptimizationOutcome;
import com.powsybl.optimizationservices.status.SolutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Optimization model solved through Optimization Services documents.
 * <p>
 * A problem is loaded (linear or nonlinear), optionally completed with variable kinds and a warm start, then
 * {@link #optimize()} writes the OSiL and OSoL documents, runs the solver and reads the OSrL results back.
 * Loading a new problem discards the previous one.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class OsilModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsilModel.class);

    private final OsSolverParameters parameters;
    private final SolverRunner solverRunner;

    private OsilProblem problem;
    private ObjectiveSense sense;
    private List<VariableKind> variableKinds;
    private double[] warmStart;
    private OsrlResult result;

    public OsilModel(OsSolverParameters parameters, SolverRunner solverRunner) {
        this.parameters = Objects.requireNonNull(parameters);
        this.solverRunner = Objects.requireNonNull(solverRunner);
    }

    public OsilModel loadLinearProblem(LinearConstraintMatrix a, double[] xl, double[] xu, double[] f,
                                       double[] cl, double[] cu, ObjectiveSense sense) {
        setProblem(OsilProblem.linear(a, xl, xu, f, cl, cu, sense), sense);
        return this;
    }

    public OsilModel loadNonlinearProblem(int numberOfVariables, int numberOfConstraints, double[] xl, double[] xu,
                                          double[] cl, double[] cu, ObjectiveSense sense, NlpEvaluator evaluator) {
        setProblem(OsilProblem.nonlinear(numberOfVariables, numberOfConstraints, xl, xu, cl, cu, sense, evaluator), sense);
        return this;
    }

    private void setProblem(OsilProblem problem, ObjectiveSense sense) {
        this.problem = problem;
        this.sense = sense;
        this.variableKinds = null;
        this.warmStart = null;
        this.result = null;
    }

    private OsilProblem getProblem() {
        if (problem == null) {
            throw new IllegalStateException("No problem loaded");
        }
        return problem;
    }

    private OsrlResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Model has not been optimized");
        }
        return result;
    }

    public OsilModel setVariableKinds(List<VariableKind> kinds) {
        getProblem().setVariableKinds(kinds);
        this.variableKinds = List.copyOf(kinds);
        return this;
    }

    /**
     * @param kindTokens variable kinds as written by the modeling layer ({@code Cont}, {@code Int}, {@code Bin}, ...)
     */
    public OsilModel setVariableTypes(List<String> kindTokens) {
        return setVariableKinds(kindTokens.stream().map(VariableKind::fromToken).toList());
    }

    public OsilModel setSense(ObjectiveSense sense) {
        getProblem().setSense(sense);
        this.sense = sense;
        return this;
    }

    public OsilModel setWarmStart(double[] initialValues) {
        DimensionMismatchException.checkLength("warm start", getProblem().getNumberOfVariables(), initialValues.length);
        this.warmStart = initialValues.clone();
        return this;
    }

    public OptimizationOutcome optimize() {
        OsilProblem osil = getProblem();
        if (sense == ObjectiveSense.MAX) {
            LOGGER.warn("Maximization problems are known to be unreliable with OSSolverService and MINLP solvers, "
                    + "formulate the problem as a minimization for more reliable results");
        }
        Path problemFile = parameters.getProblemFile();
        Path optionsFile = parameters.getOptionsFile();
        Path resultsFile = parameters.getResultsFile();
        try {
            Files.createDirectories(parameters.getWorkingDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        osil.write(problemFile);
        OsolWriter.write(optionsFile, warmStart != null ? warmStart : new double[0], parameters.getSolverOptions());
        solverRunner.run(parameters, problemFile, optionsFile, resultsFile);
        result = OsrlReader.read(resultsFile, osil.getNumberOfVariables(), osil.getNumberOfConstraints());
        logSolution(result);

        if (!parameters.isKeepFiles()) {
            deleteFiles(problemFile, optionsFile, resultsFile);
        }
        return result.getOutcome();
    }

    private static void logSolution(OsrlResult result) {
        LOGGER.info("==== Solution Summary ====");
        LOGGER.info("Outcome                  = {}", result.getOutcome());
        LOGGER.info("Objective value          = {}", result.getObjectiveValue());
        if (LOGGER.isDebugEnabled()) {
            double[] x = result.getSolution();
            for (int i = 0; i < x.length; i++) {
                LOGGER.debug(" x[{}] = {}", i, x[i]);
            }
            result.getDualValues().ifPresent(duals -> {
                for (int i = 0; i < duals.length; i++) {
                    LOGGER.debug(" lambda[{}] = {}", i, duals[i]);
                }
            });
        }
    }

    private static void deleteFiles(Path... files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new OptimizationServicesException("Failed to delete " + file, e);
            }
        }
    }

    public SolutionStatus getStatus() {
        return getResult().getStatus();
    }

    public OptimizationOutcome getOutcome() {
        return getResult().getOutcome();
    }

    public double[] getSolution() {
        return getResult().getSolution();
    }

    public Optional<double[]> getDualValues() {
        return getResult().getDualValues();
    }

    public double getObjectiveValue() {
        return getResult().getObjectiveValue();
    }

    public ObjectiveSense getSense() {
        return sense;
    }

    public List<VariableKind> getVariableKinds() {
        return variableKinds;
    }

    public int getNumberOfVariables() {
        return getProblem().getNumberOfVariables();
    }

    public int getNumberOfConstraints() {
        return getProblem().getNumberOfConstraints();
    }

    public int getNumberOfLinearConstraints() {
        return getProblem().getNumberOfLinearConstraints();
    }

    /**
     * Quadratic problems are not supported.
     */
    public int getNumberOfQuadraticConstraints() {
        return 0;
    }

    public OsSolverParameters getParameters() {
        return parameters;
    }
}

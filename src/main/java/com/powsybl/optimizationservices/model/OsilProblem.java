/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.DimensionMismatchException;
import com.powsybl.optimizationservices.ShapeException;
import com.powsybl.optimizationservices.codec.SparseEntry;
import com.powsybl.optimizationservices.codec.SparseVectorCodec;
import com.powsybl.optimizationservices.expression.Expression;
import com.powsybl.optimizationservices.linear.LinearAccumulator;
import com.powsybl.optimizationservices.linear.LinearTermExtractor;
import com.powsybl.optimizationservices.osnl.NonlinearNode;
import com.powsybl.optimizationservices.osnl.OsnlCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * OSiL problem instance document.
 * <p>
 * The variables, objective and constraints sections are common to linear and nonlinear problems. A linear problem
 * then stores its matrix column-wise in {@code linearConstraintCoefficients}; a nonlinear problem stores its leading
 * linear constraints row-wise in the same section, and every nonlinear part in {@code nonlinearExpressions}, the
 * objective using the row index {@value #OBJECTIVE_NL_INDEX}.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsilProblem {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsilProblem.class);

    public static final int OBJECTIVE_NL_INDEX = -1;

    private static final DateTimeFormatter DESCRIPTION_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd 'at' HH:mm:ss");

    private final Document document;
    private final Element instanceData;
    private final Element objective;
    private final Element[] variables;
    private final Element[] constraints;
    private int numberOfLinearConstraints;

    private OsilProblem(double[] xl, double[] xu, double[] cl, double[] cu, ObjectiveSense sense) {
        DimensionMismatchException.checkLength("variable upper bounds", xl.length, xu.length);
        DimensionMismatchException.checkLength("constraint upper bounds", cl.length, cu.length);
        Objects.requireNonNull(sense);

        document = OsXml.newDocument("osil", "OSiL.xsd");
        Element root = document.getDocumentElement();

        Element instanceHeader = OsXml.addChild(root, "instanceHeader");
        OsXml.addTextChild(instanceHeader, "description",
                "generated by powsybl-optimization-services on " + LocalDateTime.now().format(DESCRIPTION_DATE_FORMAT));

        instanceData = OsXml.addChild(root, "instanceData");

        Element variablesElement = OsXml.addChild(instanceData, "variables");
        variablesElement.setAttribute("numberOfVariables", Integer.toString(xl.length));
        variables = new Element[xl.length];
        for (int i = 0; i < xl.length; i++) {
            Element variable = OsXml.addChild(variablesElement, "var");
            // lb defaults to 0 when absent, so it is always written
            variable.setAttribute("lb", OsXml.format(xl[i]));
            if (Double.isFinite(xu[i])) {
                variable.setAttribute("ub", OsXml.format(xu[i]));
            }
            variables[i] = variable;
        }

        Element objectives = OsXml.addChild(instanceData, "objectives");
        objectives.setAttribute("numberOfObjectives", "1");
        objective = OsXml.addChild(objectives, "obj");
        objective.setAttribute("maxOrMin", sense.getMaxOrMin());

        Element constraintsElement = OsXml.addChild(instanceData, "constraints");
        constraintsElement.setAttribute("numberOfConstraints", Integer.toString(cl.length));
        constraints = new Element[cl.length];
        for (int i = 0; i < cl.length; i++) {
            Element constraint = OsXml.addChild(constraintsElement, "con");
            if (Double.isFinite(cl[i])) {
                constraint.setAttribute("lb", OsXml.format(cl[i]));
            }
            if (Double.isFinite(cu[i])) {
                constraint.setAttribute("ub", OsXml.format(cu[i]));
            }
            constraints[i] = constraint;
        }
    }

    /**
     * Builds the document of a linear problem {@code min/max f.x} subject to {@code cl <= A.x <= cu}, {@code xl <= x <= xu}.
     */
    public static OsilProblem linear(LinearConstraintMatrix a, double[] xl, double[] xu, double[] f,
                                     double[] cl, double[] cu, ObjectiveSense sense) {
        Objects.requireNonNull(a);
        DimensionMismatchException.checkLength("constraint lower bounds", a.rowCount(), cl.length);
        DimensionMismatchException.checkLength("variable lower bounds", a.columnCount(), xl.length);
        DimensionMismatchException.checkLength("objective coefficients", a.columnCount(), f.length);

        OsilProblem problem = new OsilProblem(xl, xu, cl, cu, sense);

        List<SparseEntry> objectiveCoefficients = SparseVectorCodec.encode(f);
        for (SparseEntry entry : objectiveCoefficients) {
            problem.addObjectiveCoefficient(entry.index(), entry.value());
        }
        problem.objective.setAttribute("numberOfObjCoef", Integer.toString(objectiveCoefficients.size()));

        if (a.getValueCount() > 0) {
            Element coefficients = OsXml.addChild(problem.instanceData, "linearConstraintCoefficients");
            coefficients.setAttribute("numberOfValues", Integer.toString(a.getValueCount()));
            Element starts = OsXml.addChild(coefficients, "start");
            Element rowIdx = OsXml.addChild(coefficients, "rowIdx");
            Element values = OsXml.addChild(coefficients, "value");
            for (int start : a.columnStart()) {
                OsXml.addTextChild(starts, "el", Integer.toString(start));
            }
            int[] rowIndices = a.rowIndices();
            double[] matrixValues = a.values();
            for (int i = 0; i < rowIndices.length; i++) {
                OsXml.addTextChild(rowIdx, "el", Integer.toString(rowIndices[i]));
                OsXml.addTextChild(values, "el", OsXml.format(matrixValues[i]));
            }
        }
        problem.numberOfLinearConstraints = cl.length;

        LOGGER.info("Linear problem with {} variables, {} constraints and {} non zero coefficients",
                xl.length, cl.length, a.getValueCount());
        return problem;
    }

    /**
     * Builds the document of a nonlinear problem described by its evaluator. Linear constraints are expected
     * before nonlinear ones: the first nonlinear row ends the linear section.
     */
    public static OsilProblem nonlinear(int numberOfVariables, int numberOfConstraints, double[] xl, double[] xu,
                                        double[] cl, double[] cu, ObjectiveSense sense, NlpEvaluator evaluator) {
        Objects.requireNonNull(evaluator);
        DimensionMismatchException.checkLength("variable lower bounds", numberOfVariables, xl.length);
        DimensionMismatchException.checkLength("constraint lower bounds", numberOfConstraints, cl.length);

        OsilProblem problem = new OsilProblem(xl, xu, cl, cu, sense);
        LinearAccumulator accumulator = new LinearAccumulator(numberOfVariables);

        boolean nonlinearObjective = !evaluator.isObjectiveLinear();
        if (nonlinearObjective) {
            problem.objective.setAttribute("numberOfObjCoef", "0");
        } else {
            problem.addLinearObjective(accumulator, evaluator);
        }

        problem.numberOfLinearConstraints = problem.addLinearConstraints(accumulator, evaluator, numberOfConstraints);

        int numberOfNonlinearExpressions = numberOfConstraints - problem.numberOfLinearConstraints + (nonlinearObjective ? 1 : 0);
        if (numberOfNonlinearExpressions > 0) {
            Element nonlinearExpressions = OsXml.addChild(problem.instanceData, "nonlinearExpressions");
            nonlinearExpressions.setAttribute("numberOfNonlinearExpressions", Integer.toString(numberOfNonlinearExpressions));
            if (nonlinearObjective) {
                addNonlinearExpression(nonlinearExpressions, OBJECTIVE_NL_INDEX, evaluator.getObjectiveExpression());
            }
            for (int row = problem.numberOfLinearConstraints; row < numberOfConstraints; row++) {
                addNonlinearExpression(nonlinearExpressions, row, evaluator.getConstraintExpression(row));
            }
        }

        LOGGER.info("Nonlinear problem with {} variables, {} linear and {} nonlinear constraints, {} objective",
                numberOfVariables, problem.numberOfLinearConstraints, numberOfConstraints - problem.numberOfLinearConstraints,
                nonlinearObjective ? "nonlinear" : "linear");
        return problem;
    }

    private void addObjectiveCoefficient(int idx, double value) {
        Element coef = OsXml.addTextChild(objective, "coef", OsXml.format(value));
        coef.setAttribute("idx", Integer.toString(idx));
    }

    private void addLinearObjective(LinearAccumulator accumulator, NlpEvaluator evaluator) {
        double constant = LinearTermExtractor.addTerms(accumulator, evaluator.getObjectiveExpression());
        if (constant != 0.0) {
            objective.setAttribute("constant", OsXml.format(constant));
        }
        int numberOfObjCoef = accumulator.drain(this::addObjectiveCoefficient);
        objective.setAttribute("numberOfObjCoef", Integer.toString(numberOfObjCoef));
    }

    /**
     * @return the number of leading linear constraints
     */
    private int addLinearConstraints(LinearAccumulator accumulator, NlpEvaluator evaluator, int numberOfConstraints) {
        int row = 0;
        if (numberOfConstraints == 0 || !evaluator.isConstraintLinear(row)) {
            return row;
        }
        Element coefficients = OsXml.addChild(instanceData, "linearConstraintCoefficients");
        Element starts = OsXml.addChild(coefficients, "start");
        Element colIdx = OsXml.addChild(coefficients, "colIdx");
        Element values = OsXml.addChild(coefficients, "value");
        OsXml.addTextChild(starts, "el", "0");
        int numberOfValues = 0;
        while (row < numberOfConstraints && evaluator.isConstraintLinear(row)) {
            for (Expression term : LinearTermExtractor.terms(evaluator.getConstraintExpression(row))) {
                // checked per term: constants cancelling out are rejected too
                if (LinearTermExtractor.addTerm(accumulator, term) != 0.0) {
                    accumulator.clear();
                    throw new ShapeException("Unexpected constant term in linear constraint " + row);
                }
            }
            numberOfValues += accumulator.drain((idx, value) -> {
                OsXml.addTextChild(colIdx, "el", Integer.toString(idx));
                OsXml.addTextChild(values, "el", OsXml.format(value));
            });
            OsXml.addTextChild(starts, "el", Integer.toString(numberOfValues));
            LOGGER.trace("Linear constraint {} written, {} coefficients so far", row, numberOfValues);
            row++;
        }
        // nonlinear rows have no linear coefficient
        for (int nonlinearRow = row; nonlinearRow < numberOfConstraints; nonlinearRow++) {
            OsXml.addTextChild(starts, "el", Integer.toString(numberOfValues));
        }
        coefficients.setAttribute("numberOfValues", Integer.toString(numberOfValues));
        return row;
    }

    private static void addNonlinearExpression(Element nonlinearExpressions, int idx, Expression expression) {
        NonlinearNode nl = new NonlinearNode("nl").setAttribute(NonlinearNode.IDX_ATTRIBUTE, idx);
        OsnlCompiler.compile(nl, expression);
        nl.appendTo(nonlinearExpressions);
        LOGGER.debug("Nonlinear expression {}: {}", idx, expression);
    }

    public void setVariableKinds(List<VariableKind> kinds) {
        DimensionMismatchException.checkLength("variable kinds", variables.length, kinds.size());
        for (int i = 0; i < kinds.size(); i++) {
            variables[i].setAttribute("type", String.valueOf(kinds.get(i).getTypeCode()));
        }
    }

    public void setSense(ObjectiveSense sense) {
        objective.setAttribute("maxOrMin", Objects.requireNonNull(sense).getMaxOrMin());
    }

    public int getNumberOfVariables() {
        return variables.length;
    }

    public int getNumberOfConstraints() {
        return constraints.length;
    }

    public int getNumberOfLinearConstraints() {
        return numberOfLinearConstraints;
    }

    public Element getConstraintElement(int row) {
        return constraints[row];
    }

    public Document getDocument() {
        return document;
    }

    public void write(Path file) {
        OsXml.write(document, file);
        LOGGER.info("OSiL problem written to {}", file);
    }
}

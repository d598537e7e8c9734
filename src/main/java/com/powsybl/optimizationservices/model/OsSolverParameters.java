/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.commons.config.ModuleConfig;
import com.powsybl.commons.config.PlatformConfig;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of a solve through the Optimization Services solver service.
 * Can be loaded from the {@value #MODULE_NAME} module of the platform configuration.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class OsSolverParameters {

    public static final String MODULE_NAME = "optimization-services";

    public static final String DEFAULT_SOLVER_NAME = ""; // empty means the service default solver
    public static final String DEFAULT_SOLVER_SERVICE_PATH = "OSSolverService";
    public static final String DEFAULT_PROBLEM_FILE_NAME = "problem.osil";
    public static final String DEFAULT_OPTIONS_FILE_NAME = "options.osol";
    public static final String DEFAULT_RESULTS_FILE_NAME = "results.osrl";
    public static final boolean DEFAULT_KEEP_FILES = true;

    private String solverName = DEFAULT_SOLVER_NAME;

    private String solverServicePath = DEFAULT_SOLVER_SERVICE_PATH;

    private Path workingDirectory = Path.of(System.getProperty("java.io.tmpdir"), ".osil");

    private String problemFileName = DEFAULT_PROBLEM_FILE_NAME;

    private String optionsFileName = DEFAULT_OPTIONS_FILE_NAME;

    private String resultsFileName = DEFAULT_RESULTS_FILE_NAME;

    private final Map<String, String> solverOptions = new LinkedHashMap<>();

    private boolean keepFiles = DEFAULT_KEEP_FILES;

    public static OsSolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OsSolverParameters load(PlatformConfig platformConfig) {
        OsSolverParameters parameters = new OsSolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME).ifPresent(config -> load(parameters, config));
        return parameters;
    }

    private static void load(OsSolverParameters parameters, ModuleConfig config) {
        config.getOptionalStringProperty("solver").ifPresent(parameters::setSolverName);
        config.getOptionalStringProperty("solver-service-path").ifPresent(parameters::setSolverServicePath);
        config.getOptionalPathProperty("working-directory").ifPresent(parameters::setWorkingDirectory);
        config.getOptionalStringProperty("problem-file").ifPresent(parameters::setProblemFileName);
        config.getOptionalStringProperty("options-file").ifPresent(parameters::setOptionsFileName);
        config.getOptionalStringProperty("results-file").ifPresent(parameters::setResultsFileName);
        config.getOptionalStringListProperty("solver-options").ifPresent(parameters::addSolverOptions);
        parameters.setKeepFiles(config.getBooleanProperty("keep-files", DEFAULT_KEEP_FILES));
    }

    public String getSolverName() {
        return solverName;
    }

    public OsSolverParameters setSolverName(String solverName) {
        this.solverName = Objects.requireNonNull(solverName).trim();
        return this;
    }

    public String getSolverServicePath() {
        return solverServicePath;
    }

    public OsSolverParameters setSolverServicePath(String solverServicePath) {
        if (Objects.requireNonNull(solverServicePath).isBlank()) {
            throw new IllegalArgumentException("Solver service path must not be empty");
        }
        this.solverServicePath = solverServicePath;
        return this;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public OsSolverParameters setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory);
        return this;
    }

    public String getProblemFileName() {
        return problemFileName;
    }

    public OsSolverParameters setProblemFileName(String problemFileName) {
        this.problemFileName = checkFileName(problemFileName);
        return this;
    }

    public String getOptionsFileName() {
        return optionsFileName;
    }

    public OsSolverParameters setOptionsFileName(String optionsFileName) {
        this.optionsFileName = checkFileName(optionsFileName);
        return this;
    }

    public String getResultsFileName() {
        return resultsFileName;
    }

    public OsSolverParameters setResultsFileName(String resultsFileName) {
        this.resultsFileName = checkFileName(resultsFileName);
        return this;
    }

    private static String checkFileName(String fileName) {
        if (Objects.requireNonNull(fileName).isBlank()) {
            throw new IllegalArgumentException("Document file name must not be empty");
        }
        return fileName;
    }

    public Path getProblemFile() {
        return workingDirectory.resolve(problemFileName);
    }

    public Path getOptionsFile() {
        return workingDirectory.resolve(optionsFileName);
    }

    public Path getResultsFile() {
        return workingDirectory.resolve(resultsFileName);
    }

    public Map<String, String> getSolverOptions() {
        return Collections.unmodifiableMap(solverOptions);
    }

    public OsSolverParameters addSolverOption(String name, String value) {
        if (Objects.requireNonNull(name).isBlank()) {
            throw new IllegalArgumentException("Solver option name must not be empty");
        }
        solverOptions.put(name, Objects.requireNonNull(value));
        return this;
    }

    /**
     * @param options solver options written {@code name=value}
     */
    public OsSolverParameters addSolverOptions(List<String> options) {
        for (String option : options) {
            int separator = option.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Solver option must be written name=value: '" + option + "'");
            }
            addSolverOption(option.substring(0, separator).trim(), option.substring(separator + 1).trim());
        }
        return this;
    }

    public boolean isKeepFiles() {
        return keepFiles;
    }

    public OsSolverParameters setKeepFiles(boolean keepFiles) {
        this.keepFiles = keepFiles;
        return this;
    }

    @Override
    public String toString() {
        return "OsSolverParameters(" +
                "solverName=" + solverName +
                ", solverServicePath=" + solverServicePath +
                ", workingDirectory=" + workingDirectory +
                ", problemFileName=" + problemFileName +
                ", optionsFileName=" + optionsFileName +
                ", resultsFileName=" + resultsFileName +
                ", solverOptions=" + solverOptions +
                ", keepFiles=" + keepFiles +
                ')';
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.SolverProcessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the {@code OSSolverService} executable of the COIN-OR Optimization Services project, once per solve.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class OsSolverService implements SolverRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsSolverService.class);

    public static List<String> buildCommand(OsSolverParameters parameters, Path problemFile, Path optionsFile, Path resultsFile) {
        List<String> command = new ArrayList<>(List.of(parameters.getSolverServicePath(),
                "-osil", problemFile.toString(),
                "-osol", optionsFile.toString(),
                "-osrl", resultsFile.toString()));
        if (!parameters.getSolverName().isEmpty()) {
            command.add("-solver");
            command.add(parameters.getSolverName());
        }
        return command;
    }

    @Override
    public void run(OsSolverParameters parameters, Path problemFile, Path optionsFile, Path resultsFile) {
        List<String> command = buildCommand(parameters, problemFile, optionsFile, resultsFile);
        LOGGER.info("Running {}", String.join(" ", command));
        int exitCode;
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    LOGGER.debug("{}", line);
                }
            }
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new SolverProcessException("Failed to run " + parameters.getSolverServicePath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverProcessException("Interrupted while waiting for " + parameters.getSolverServicePath(), e);
        }
        if (exitCode != 0) {
            throw new SolverProcessException(parameters.getSolverServicePath() + " exited with code " + exitCode);
        }
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.linear;

import com.powsybl.optimizationservices.ShapeException;

import java.util.Arrays;

/**
 * Scratch storage for the coefficients of one linear row (a constraint or the objective).
 * <p>
 * {@code indicator[i]} is set iff {@code coefficients[i]} holds a value accumulated during the current row.
 * The same accumulator is reused from row to row: {@link #drain(LinearTermConsumer)} empties it after each row.
 * It is not thread safe, one row extraction owns it at a time.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public class LinearAccumulator {

    private final boolean[] indicator;
    private final double[] coefficients;
    private int setCount;

    public LinearAccumulator(int numberOfVariables) {
        if (numberOfVariables < 0) {
            throw new IllegalArgumentException("Number of variables must be positive or zero");
        }
        this.indicator = new boolean[numberOfVariables];
        this.coefficients = new double[numberOfVariables];
    }

    public int size() {
        return indicator.length;
    }

    public void add(int index, double coefficient) {
        if (index < 0 || index >= indicator.length) {
            throw new ShapeException("Variable index " + index + " out of range [0, " + indicator.length + ")");
        }
        if (!indicator[index]) {
            indicator[index] = true;
            setCount++;
        }
        coefficients[index] += coefficient;
    }

    public boolean isSet(int index) {
        return indicator[index];
    }

    public double get(int index) {
        return coefficients[index];
    }

    public boolean isEmpty() {
        return setCount == 0;
    }

    /**
     * Number of distinct variables seen in the current row.
     */
    public int getSetCount() {
        return setCount;
    }

    /**
     * Passes every accumulated coefficient to the consumer in ascending variable index, resetting each slot
     * once it has been consumed.
     *
     * @return the number of coefficients drained
     */
    public int drain(LinearTermConsumer consumer) {
        int drained = 0;
        for (int i = 0; i < indicator.length && setCount > 0; i++) {
            if (indicator[i]) {
                consumer.accept(i, coefficients[i]);
                indicator[i] = false;
                coefficients[i] = 0.0;
                setCount--;
                drained++;
            }
        }
        return drained;
    }

    public void clear() {
        Arrays.fill(indicator, false);
        Arrays.fill(coefficients, 0.0);
        setCount = 0;
    }
}

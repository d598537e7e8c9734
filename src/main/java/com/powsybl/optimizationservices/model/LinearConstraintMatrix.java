/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.powsybl.optimizationservices.DimensionMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Constraint matrix in compressed sparse column form: the entries of column j are stored at positions
 * {@code columnStart[j]} (inclusive) to {@code columnStart[j + 1]} (exclusive) of {@code rowIndices} and {@code values}.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public record LinearConstraintMatrix(int rowCount, int columnCount, int[] columnStart, int[] rowIndices, double[] values) {

    public LinearConstraintMatrix {
        columnStart = Objects.requireNonNull(columnStart).clone();
        rowIndices = Objects.requireNonNull(rowIndices).clone();
        values = Objects.requireNonNull(values).clone();
        DimensionMismatchException.checkLength("column start array", columnCount + 1, columnStart.length);
        DimensionMismatchException.checkLength("value array", rowIndices.length, values.length);
        if (columnStart[columnCount] != values.length) {
            throw new DimensionMismatchException("Last column start " + columnStart[columnCount]
                    + " does not match the number of values " + values.length);
        }
        for (int row : rowIndices) {
            if (row < 0 || row >= rowCount) {
                throw new DimensionMismatchException("Row index " + row + " out of range [0, " + rowCount + ")");
            }
        }
    }

    @Override
    public int[] columnStart() {
        return columnStart.clone();
    }

    @Override
    public int[] rowIndices() {
        return rowIndices.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int getValueCount() {
        return values.length;
    }

    /**
     * Compresses a dense row-major matrix, dropping zero entries.
     */
    public static LinearConstraintMatrix fromDense(double[][] dense, int columnCount) {
        int[] columnStart = new int[columnCount + 1];
        List<Integer> rows = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int j = 0; j < columnCount; j++) {
            columnStart[j] = values.size();
            for (int i = 0; i < dense.length; i++) {
                DimensionMismatchException.checkLength("matrix row " + i, columnCount, dense[i].length);
                if (dense[i][j] != 0.0) {
                    rows.add(i);
                    values.add(dense[i][j]);
                }
            }
        }
        columnStart[columnCount] = values.size();
        return new LinearConstraintMatrix(dense.length, columnCount, columnStart,
                Ints.toArray(rows), Doubles.toArray(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinearConstraintMatrix other)) {
            return false;
        }
        return rowCount == other.rowCount
                && columnCount == other.columnCount
                && Arrays.equals(columnStart, other.columnStart)
                && Arrays.equals(rowIndices, other.rowIndices)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(rowCount, columnCount);
        result = 31 * result + Arrays.hashCode(columnStart);
        result = 31 * result + Arrays.hashCode(rowIndices);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "LinearConstraintMatrix(rowCount=" + rowCount +
                ", columnCount=" + columnCount +
                ", columnStart=" + Arrays.toString(columnStart) +
                ", rowIndices=" + Arrays.toString(rowIndices) +
                ", values=" + Arrays.toString(values) +
                ')';
    }
}

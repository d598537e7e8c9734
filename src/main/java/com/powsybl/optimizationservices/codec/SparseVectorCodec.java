/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.codec;

import com.powsybl.optimizationservices.DimensionMismatchException;
import com.powsybl.optimizationservices.ShapeException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Conversions between dense vectors and the sparse (index, value) lists of the Optimization Services documents.
 * Used both to write coefficient and initial value lists and to read solution and dual values back.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class SparseVectorCodec {

    public static final String IDX_ATTRIBUTE = "idx";

    private SparseVectorCodec() {
    }

    /**
     * Builds a dense vector of length n. Indices never listed keep the default value; an index listed several
     * times gets the sum of its values.
     */
    public static double[] decode(int n, double defaultValue, Iterable<SparseEntry> entries) {
        double[] dense = new double[n];
        Arrays.fill(dense, defaultValue);
        boolean[] seen = new boolean[n];
        for (SparseEntry entry : entries) {
            int idx = entry.index();
            if (idx < 0 || idx >= n) {
                throw new DimensionMismatchException("Index " + idx + " out of range [0, " + n + ")");
            }
            if (seen[idx]) {
                dense[idx] += entry.value();
            } else {
                seen[idx] = true;
                dense[idx] = entry.value();
            }
        }
        return dense;
    }

    /**
     * Decodes the child elements of an OSrL/OSiL list, each child holding an {@code idx} attribute and its value
     * as text content.
     */
    public static double[] decode(Element list, int n, double defaultValue) {
        return decode(n, defaultValue, readEntries(list));
    }

    public static List<SparseEntry> readEntries(Element list) {
        List<SparseEntry> entries = new ArrayList<>();
        for (Node child = list.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                Element element = (Element) child;
                String idx = element.getAttribute(IDX_ATTRIBUTE);
                String value = element.getTextContent().trim();
                try {
                    entries.add(new SparseEntry(Integer.parseInt(idx), parseValue(value)));
                } catch (NumberFormatException e) {
                    throw new ShapeException("Malformed <" + element.getTagName() + "> entry: idx='" + idx + "', value='" + value + "'");
                }
            }
        }
        return entries;
    }

    /**
     * Parses a value as written in the Optimization Services documents, infinite values being {@code INF} and
     * {@code -INF}.
     *
     * @throws NumberFormatException if the text is not a number
     */
    public static double parseValue(String text) {
        String trimmed = text.trim();
        return switch (trimmed) {
            case "INF", "Infinity" -> Double.POSITIVE_INFINITY;
            case "-INF", "-Infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(trimmed);
        };
    }

    /**
     * @return one entry per component other than {@code +0.0}, in ascending index order
     */
    public static List<SparseEntry> encode(double[] dense) {
        List<SparseEntry> entries = new ArrayList<>();
        for (int i = 0; i < dense.length; i++) {
            // only +0.0 is implicit, -0.0 is listed
            if (Double.compare(dense[i], 0.0) != 0) {
                entries.add(new SparseEntry(i, dense[i]));
            }
        }
        return entries;
    }
}

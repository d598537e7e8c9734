/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.expression;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.powsybl.optimizationservices.UnknownOperatorException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static mapping from operator tokens of the symbolic tree to OSnL element names.
 * A token may appear in several tables ("-" is binary minus and unary negate), the argument count
 * of the call decides which one applies.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OperatorTables {

    public static final Set<String> POWER_TOKENS = ImmutableSet.of("^", ".^");
    public static final Set<String> MULTIPLY_TOKENS = ImmutableSet.of("*", ".*");
    public static final Set<String> DIVIDE_TOKENS = ImmutableSet.of("/", "./");

    private static final Map<String, String> VARIADIC = ImmutableMap.of(
            "+", "sum",
            "*", "product");

    private static final Map<String, String> BINARY = ImmutableMap.<String, String>builder()
            .put("+", "plus")
            .put(".+", "plus")
            .put("-", "minus")
            .put(".-", "minus")
            .put("*", "times")
            .put(".*", "times")
            .put("/", "divide")
            .put("./", "divide")
            .put("div", "quotient")
            .put("÷", "quotient")
            .put("rem", "rem")
            .put("^", "power")
            .put(".^", "power")
            .put("log", "log")
            .build();

    private static final Map<String, String> UNARY;

    static {
        ImmutableMap.Builder<String, String> unary = ImmutableMap.<String, String>builder()
                .put("-", "negate")
                .put("√", "sqrt")
                .put("abs2", "square")
                .put("ceil", "ceiling")
                .put("log", "ln")
                .put("log10", "log10")
                .put("asin", "arcsin")
                .put("asinh", "arcsinh")
                .put("acos", "arccos")
                .put("acosh", "arccosh")
                .put("atan", "arctan")
                .put("atanh", "arctanh")
                .put("acot", "arccot")
                .put("acoth", "arccoth")
                .put("asec", "arcsec")
                .put("asech", "arcsech")
                .put("acsc", "arccsc")
                .put("acsch", "arccsch");
        // functions whose OSnL element has the same name
        for (String op : new String[] {"abs", "sqrt", "floor", "factorial", "exp", "sign", "erf",
                                       "sin", "sinh", "cos", "cosh", "tan", "tanh",
                                       "cot", "coth", "sec", "sech", "csc", "csch"}) {
            unary.put(op, op);
        }
        UNARY = unary.build();
    }

    private OperatorTables() {
    }

    private static Map<String, String> table(ArityClass arityClass) {
        return switch (arityClass) {
            case UNARY -> UNARY;
            case BINARY -> BINARY;
            case VARIADIC -> VARIADIC;
        };
    }

    public static Optional<String> find(ArityClass arityClass, String operator) {
        return Optional.ofNullable(table(arityClass).get(operator));
    }

    /**
     * @throws UnknownOperatorException if the operator is not in the table of the given arity class
     */
    public static String lookup(ArityClass arityClass, String operator) {
        return find(arityClass, operator).orElseThrow(() -> new UnknownOperatorException(operator, arityClass));
    }

    public static boolean contains(ArityClass arityClass, String operator) {
        return table(arityClass).containsKey(operator);
    }
}

/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.osnl;

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Element of an OSnL nonlinear expression tree: a tag name, ordered attributes and ordered children.
 * Two nodes are equal when their whole subtrees are structurally identical.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class NonlinearNode {

    public static final String NUMBER = "number";
    public static final String VARIABLE = "variable";
    public static final String SQUARE = "square";

    public static final String VALUE_ATTRIBUTE = "value";
    public static final String IDX_ATTRIBUTE = "idx";
    public static final String COEF_ATTRIBUTE = "coef";

    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<NonlinearNode> children = new ArrayList<>();

    public NonlinearNode(String tag) {
        this.tag = Objects.requireNonNull(tag);
    }

    public String getTag() {
        return tag;
    }

    public NonlinearNode addChild(String childTag) {
        NonlinearNode child = new NonlinearNode(childTag);
        children.add(child);
        return child;
    }

    public List<NonlinearNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public NonlinearNode getChild(int i) {
        return children.get(i);
    }

    public NonlinearNode setAttribute(String name, String value) {
        attributes.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
        return this;
    }

    public NonlinearNode setAttribute(String name, double value) {
        return setAttribute(name, Double.toString(value));
    }

    public NonlinearNode setAttribute(String name, int value) {
        return setAttribute(name, Integer.toString(value));
    }

    public Optional<String> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Writes this subtree as a new child element of the given DOM element.
     *
     * @return the element created for this node
     */
    public Element appendTo(Element parent) {
        Element element = parent.getOwnerDocument().createElement(tag);
        attributes.forEach(element::setAttribute);
        parent.appendChild(element);
        for (NonlinearNode child : children) {
            child.appendTo(element);
        }
        return element;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NonlinearNode other)) {
            return false;
        }
        return tag.equals(other.tag) && attributes.equals(other.attributes) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, attributes, children);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("<").append(tag);
        attributes.forEach((name, value) -> builder.append(' ').append(name).append("=\"").append(value).append('"'));
        if (children.isEmpty()) {
            return builder.append("/>").toString();
        }
        builder.append('>');
        children.forEach(builder::append);
        return builder.append("</").append(tag).append('>').toString();
    }
}

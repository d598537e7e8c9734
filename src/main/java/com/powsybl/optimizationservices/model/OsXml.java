/**
 * Copyright (c) 2024, Artelys (http://www.artelys.com/)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.optimizationservices.model;

import com.powsybl.optimizationservices.ShapeException;
import com.powsybl.optimizationservices.SolverProcessException;
import com.powsybl.optimizationservices.codec.SparseVectorCodec;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers shared by the OSiL, OSoL and OSrL documents.
 *
 * @author Artelys {@literal <http://www.artelys.com/>}
 */
public final class OsXml {

    public static final String NAMESPACE = "os.optimizationservices.org";
    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String SCHEMA_BASE_URL = "http://www.optimizationservices.org/schemas/2.0/";

    private OsXml() {
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setCoalescing(true);
            factory.setIgnoringComments(true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Creates a document whose root element declares the Optimization Services namespace and the given schema.
     */
    public static Document newDocument(String rootName, String schemaFile) {
        Document document = newDocumentBuilder().newDocument();
        Element root = document.createElement(rootName);
        root.setAttribute("xmlns", NAMESPACE);
        root.setAttribute("xmlns:xsi", XSI_NAMESPACE);
        root.setAttribute("xsi:schemaLocation", NAMESPACE + " " + SCHEMA_BASE_URL + schemaFile);
        document.appendChild(root);
        return document;
    }

    public static Element addChild(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    public static Element addTextChild(Element parent, String name, String text) {
        Element child = addChild(parent, name);
        child.setTextContent(text);
        return child;
    }

    /**
     * Formats a number the way OS documents expect, infinite values being written {@code INF} and {@code -INF}.
     */
    public static String format(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return "INF";
        } else if (value == Double.NEGATIVE_INFINITY) {
            return "-INF";
        }
        return Double.toString(value);
    }

    public static double parseDouble(String text) {
        try {
            return SparseVectorCodec.parseValue(text);
        } catch (NumberFormatException e) {
            throw new ShapeException("Malformed number '" + text + "'");
        }
    }

    public static Optional<Element> findElement(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(child.getNodeName())) {
                return Optional.of((Element) child);
            }
        }
        return Optional.empty();
    }

    public static Element getElement(Element parent, String name) {
        return findElement(parent, name)
                .orElseThrow(() -> new ShapeException("Missing <" + name + "> element in <" + parent.getNodeName() + ">"));
    }

    public static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    /**
     * @return the attribute value, or empty when the attribute is absent
     */
    public static Optional<String> getAttribute(Element element, String name) {
        return element.hasAttribute(name) ? Optional.of(element.getAttribute(name)) : Optional.empty();
    }

    public static int getIntAttribute(Element element, String name) {
        String value = getAttribute(element, name)
                .orElseThrow(() -> new ShapeException("Missing attribute " + name + " in <" + element.getNodeName() + ">"));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ShapeException("Malformed integer attribute " + name + "='" + value + "' in <" + element.getNodeName() + ">");
        }
    }

    public static void write(Document document, Writer writer) {
        transform(document, new StreamResult(writer));
    }

    public static void write(Document document, Path file) {
        try (OutputStream os = Files.newOutputStream(file)) {
            transform(document, new StreamResult(os));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void transform(Document document, StreamResult result) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute("indent-number", 2);
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.transform(new DOMSource(document), result);
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize <" + document.getDocumentElement().getNodeName() + "> document", e);
        }
    }

    /**
     * Parses a document produced by the solver service.
     *
     * @throws SolverProcessException if the file cannot be read or is not well-formed XML
     */
    public static Document parse(Path file) {
        try (var is = Files.newInputStream(file)) {
            return newDocumentBuilder().parse(is);
        } catch (IOException | SAXException e) {
            throw new SolverProcessException("Failed to parse " + file, e);
        }
    }
}

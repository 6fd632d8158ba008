package com.codelogickeep.coverage.util;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers for project descriptors and coverage reports.
 */
public final class XmlDocuments {

    private XmlDocuments() {
    }

    /**
     * Parses an XML file. DOCTYPE declarations are tolerated but external DTDs and
     * entities are never loaded.
     */
    public static Document parse(Path file) throws IOException {
        try {
            DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
            dbFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
            dbFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            dbFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            dbFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            dbFactory.setExpandEntityReferences(false);
            DocumentBuilder dBuilder = dbFactory.newDocumentBuilder();
            Document doc = dBuilder.parse(file.toFile());
            doc.getDocumentElement().normalize();
            return doc;
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Invalid XML in " + file + ": " + e.getMessage(), e);
        }
    }

    /** Direct child elements with the given tag name. */
    public static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /** First direct child element with the given tag name, or null. */
    public static Element child(Element parent, String tagName) {
        List<Element> matches = children(parent, tagName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /** Trimmed text of the first direct child with the given tag name, or null. */
    public static String childText(Element parent, String tagName) {
        Element child = child(parent, tagName);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent();
        return text == null ? null : text.trim();
    }

    /** All descendant elements with the given tag name, in document order. */
    public static List<Element> descendants(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getElementsByTagName(tagName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    // Descriptors such as pom.xml declare a default namespace
    private static String localName(Node node) {
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}

package org.dxworks.mathrules.tree;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads already-normalized MathML into a {@link Node} tree.
 * No repair is attempted: whitespace between elements is dropped and any other mixed
 * content is rejected.
 */
public final class XmlTreeReader {

    private XmlTreeReader() {
        // utility class
    }

    public static Node read(Path path) throws IOException {
        String xml = Files.readString(path, StandardCharsets.UTF_8);
        // Remove BOM if present
        if (xml.startsWith("﻿")) {
            xml = xml.substring(1);
        }
        return parse(xml);
    }

    public static Node parse(String xml) throws IOException {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Invalid MathML: " + e.getMessage(), e);
        }
        return convert(doc.getDocumentElement());
    }

    private static Node convert(Element element) {
        String name = element.getLocalName() != null ? element.getLocalName() : element.getTagName();

        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            String attrName = attr.getName();
            if (attrName.equals("xmlns") || attrName.startsWith("xmlns:")) continue;
            attributes.put(attr.getLocalName() != null ? attr.getLocalName() : attrName, attr.getValue());
        }

        List<Node> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            org.w3c.dom.Node n = nodes.item(i);
            switch (n.getNodeType()) {
                case org.w3c.dom.Node.ELEMENT_NODE:
                    children.add(convert((Element) n));
                    break;
                case org.w3c.dom.Node.TEXT_NODE:
                case org.w3c.dom.Node.CDATA_SECTION_NODE:
                    text.append(n.getNodeValue());
                    break;
                default:
                    break;
            }
        }

        if (children.isEmpty()) {
            return Node.leaf(name, attributes, text.toString().trim());
        }
        if (!text.toString().isBlank()) {
            throw new IllegalArgumentException("Mixed content is not supported in <" + name + ">: '"
                    + TreeHelper.normalizeInline(text.toString()) + "'");
        }
        return Node.element(name, attributes, children);
    }
}

package org.fpbjs.amlmapper.aml;

import org.fpbjs.amlmapper.MappingException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Text and DOM plumbing for CAEX documents.
 */
public class AmlXmlHelper {
    public static final String CAEX_NS = "http://www.dke.de/CAEX";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";

    public static Document newDocument() {
        try {
            return newDocumentBuilder().newDocument();
        } catch (Exception e) {
            throw new MappingException("Failed to create XML document", e);
        }
    }

    /**
     * Parses CAEX text into a DOM document.
     *
     * @param xml the AML document text
     * @return the parsed document
     * @throws MappingException if the text is not well-formed XML
     */
    public static Document parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MappingException("AML document is empty");
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (Exception e) {
            throw new MappingException("Failed to parse AML document: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a document with two-space indentation and an XML declaration without the standalone flag.
     * Formatting whitespace of a parsed document is dropped first; text content is written unchanged.
     */
    public static String toXmlString(Document doc) {
        try {
            Document copy = (Document) doc.cloneNode(true);
            removeFormattingWhitespace(copy.getDocumentElement());

            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(copy), new StreamResult(stringWriter));

            String xmlContent = stringWriter.toString();
            xmlContent = xmlContent.replaceFirst("^(<\\?xml[^>]*?) standalone=\"(?:yes|no)\"", "$1");
            // some transformers glue the root element to the declaration
            return xmlContent.replaceFirst("^(<\\?xml[^>]*\\?>)<", "$1\n<");
        } catch (Exception e) {
            throw new MappingException("Failed to write AML document", e);
        }
    }

    /**
     * Creates an element in the CAEX namespace and appends it to the parent.
     */
    public static Element appendElement(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElementNS(CAEX_NS, name);
        parent.appendChild(child);
        return child;
    }

    public static Element appendTextElement(Element parent, String name, String text) {
        Element child = appendElement(parent, name);
        child.setTextContent(text);
        return child;
    }

    /**
     * Direct child elements with the given local name, in document order.
     */
    public static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            if (localName.equals(localNameOf(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static Element findDirectChild(Element parent, String localName) {
        List<Element> children = childElements(parent, localName);
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Attribute value or null when the attribute is absent. DOM returns "" for absent attributes.
     */
    public static String attributeOrNull(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    /**
     * Removes whitespace-only text nodes that sit between child elements.
     */
    private static void removeFormattingWhitespace(Element element) {
        boolean hasElementChildren = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                hasElementChildren = true;
                break;
            }
        }

        Node child = element.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeFormattingWhitespace((Element) child);
            } else if (hasElementChildren && child.getNodeType() == Node.TEXT_NODE
                    && child.getNodeValue().isBlank()) {
                element.removeChild(child);
            }
            child = next;
        }
    }

    private static String localNameOf(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static DocumentBuilder newDocumentBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newDocumentBuilder();
    }
}

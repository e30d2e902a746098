package com.vrecdat.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM based reader and writer for DAT catalogs.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Parsing never resolves external DTDs (DAT files usually reference the Logiqx DTD by URL).</li>
 *   <li>Every {@code <game>} element below the root becomes a {@link CatalogEntry} keeping its element.</li>
 *   <li>Writing builds a fresh {@code <datafile>} with the rewritten header and deep copies of the kept elements,
 *       then serializes it indented as UTF-8 with an XML declaration.</li>
 * </ul>
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public class DatFileService implements DatFileServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(DatFileService.class);

    static final String ROOT_TAG = "datafile";
    static final String HEADER_TAG = "header";
    static final String ENTRY_TAG = "game";

    @Override
    public DatCatalog parse(Path path) throws IOException {
        Element root = readRoot(path);
        Element header = null;
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && HEADER_TAG.equals(((Element) node).getTagName())) {
                header = (Element) node;
                logger.debug("Found existing <header> element.");
                break;
            }
        }
        NodeList games = root.getElementsByTagName(ENTRY_TAG);
        List<CatalogEntry> entries = new ArrayList<>(games.getLength());
        for (int i = 0; i < games.getLength(); i++) {
            Element game = (Element) games.item(i);
            entries.add(new CatalogEntry(game.getAttribute("name"), game));
        }
        if (entries.isEmpty()) {
            logger.warn("No <game> elements found in the input DAT file.");
        }
        logger.debug("Parsed {} <game> elements from {}", entries.size(), path);
        return new DatCatalog(header, entries);
    }

    @Override
    public void write(Path path, DatHeader header, List<CatalogEntry> entries) throws IOException {
        Document doc;
        try {
            doc = newBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser configuration error: " + e.getMessage(), e);
        }
        Element root = doc.createElement(ROOT_TAG);
        doc.appendChild(root);
        root.appendChild(headerElement(doc, header));
        for (CatalogEntry entry : entries) {
            if (entry.element() == null) {
                logger.warn("Entry '{}' has no XML element, skipping it in output.", entry.displayName());
                continue;
            }
            Node copy = doc.importNode(entry.element(), true);
            removeWhitespaceText(copy);
            root.appendChild(copy);
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream os = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.setOutputProperty(OutputKeys.INDENT, "yes");
            t.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "1");
            t.transform(new DOMSource(doc), new StreamResult(os));
        } catch (TransformerException e) {
            throw new IOException("Failed to serialize DAT file '" + path + "': " + e.getMessage(), e);
        }
        logger.debug("Successfully wrote filtered DAT to {}", path);
    }

    @Override
    public int countEntries(Path path) throws IOException {
        return readRoot(path).getElementsByTagName(ENTRY_TAG).getLength();
    }

    private Element readRoot(Path path) throws IOException {
        Document doc;
        try (InputStream in = Files.newInputStream(path)) {
            doc = newBuilder().parse(in);
        } catch (SAXException e) {
            throw new DatFileException("Error parsing DAT file '" + path + "': " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser configuration error: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (root == null || !ROOT_TAG.equals(root.getTagName())) {
            String tag = root == null ? "none" : root.getTagName();
            throw new DatFileException("DAT file '" + path + "' has wrong root '<" + tag + ">', expected <" + ROOT_TAG + ">");
        }
        logger.debug("Successfully parsed DAT file. Root element is '<{}>'.", root.getTagName());
        return root;
    }

    private static Element headerElement(Document doc, DatHeader header) {
        Element el = doc.createElement(HEADER_TAG);
        appendText(doc, el, "name", header.name());
        appendText(doc, el, "description", header.description());
        appendText(doc, el, "version", header.version());
        appendText(doc, el, "date", header.date());
        appendText(doc, el, "author", header.author());
        appendText(doc, el, "homepage", header.homepage());
        for (Element copied : header.copiedElements()) {
            Node copy = doc.importNode(copied, true);
            removeWhitespaceText(copy);
            el.appendChild(copy);
        }
        return el;
    }

    private static void appendText(Document doc, Element parent, String tag, String text) {
        Element child = doc.createElement(tag);
        child.setTextContent(text);
        parent.appendChild(child);
    }

    // Original indentation would otherwise be mixed into the transformer's own
    private static void removeWhitespaceText(Node node) {
        NodeList children = node.getChildNodes();
        for (int i = children.getLength() - 1; i >= 0; i--) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().isBlank()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceText(child);
            }
        }
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(false);
        dbf.setValidating(false);
        dbf.setExpandEntityReferences(false);
        dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        DocumentBuilder db = dbf.newDocumentBuilder();
        db.setErrorHandler(new DefaultHandler());
        return db;
    }
}

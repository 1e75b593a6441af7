package io.github.yok.roomlink.writer;

import io.github.yok.roomlink.model.QueryResult;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Implementation of {@link ResultWriter} that writes a result as an XML document (the markup
 * format).
 *
 * <pre>
 * &lt;data&gt;
 *   &lt;row&gt;
 *     &lt;id&gt;1&lt;/id&gt;
 *     &lt;name&gt;Room #1&lt;/name&gt;
 *   &lt;/row&gt;
 * &lt;/data&gt;
 * </pre>
 *
 * <p>
 * Element text is the string form of the value ({@link BigDecimal#toPlainString()} for decimals);
 * {@code null} produces an empty element. Column labels that are not valid XML names are escaped
 * with {@link XmlNames#toElementName(String)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class XmlResultWriter implements ResultWriter {

    static final String ROOT_ELEMENT = "data";
    static final String ROW_ELEMENT = "row";
    private static final String INDENT_AMOUNT = "2";

    /**
     * {@inheritDoc}
     */
    @Override
    public void write(QueryResult result, Path destination) throws IOException {
        Document doc = toDocument(result);
        try (Writer out = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            Transformer transformer = newTransformer();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IOException("Failed to write XML: " + destination, e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ExportFormat getFormat() {
        return ExportFormat.MARKUP;
    }

    /**
     * Builds the DOM document for a result.
     *
     * @param result query result
     * @return document with one {@code row} element per row
     * @throws IOException if no XML document builder is available
     */
    Document toDocument(QueryResult result) throws IOException {
        Document doc;
        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML document builder is not available", e);
        }

        Map<String, String> elementNames = resolveElementNames(result);
        Element root = doc.createElement(ROOT_ELEMENT);
        doc.appendChild(root);
        for (Map<String, Object> row : result.getRows()) {
            Element rowElement = doc.createElement(ROW_ELEMENT);
            row.forEach((col, val) -> {
                Element colElement = doc.createElement(elementNames.get(col));
                String text = toText(val);
                if (text != null) {
                    colElement.setTextContent(text);
                }
                rowElement.appendChild(colElement);
            });
            root.appendChild(rowElement);
        }
        return doc;
    }

    private Map<String, String> resolveElementNames(QueryResult result) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> warned = new HashSet<>();
        for (String col : result.getColumns()) {
            String name = XmlNames.toElementName(col);
            if (!name.equals(col) && warned.add(col)) {
                log.warn("Column label [{}] is not a valid XML element name; written as <{}>", col,
                        name);
            }
            names.put(col, name);
        }
        return names;
    }

    /**
     * Returns the element text for a value.
     *
     * @param value value from the result row
     * @return string form, or {@code null} for a {@code null} value
     */
    static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return String.valueOf(value);
    }

    private Transformer newTransformer() throws TransformerException {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer transformer = factory.newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", INDENT_AMOUNT);
        return transformer;
    }
}

package io.github.granulefilter.metadata;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * A parsed metadata document with the path lookups the extractor needs.
 *
 * <p>Parsing is namespace-unaware: the product schemas qualify only the root and its direct
 * children, so lookups step over them with {@code /*}/{@code /*}.
 */
final class MetadataDocument {

  private final Document document;
  private final XPath xpath;

  private MetadataDocument(final Document document) {
    this.document = document;
    this.xpath = XPathFactory.newInstance().newXPath();
  }

  /**
   * Parses a document.
   *
   * @param content the raw XML
   * @return the document
   * @throws IOException  if the content is not well-formed XML
   */
  static MetadataDocument parse(final byte[] content) throws IOException {
    try {
      final DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      dbf.setNamespaceAware(false);
      final Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(content));
      dom.getDocumentElement().normalize();
      return new MetadataDocument(dom);
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Unparsable metadata document: " + e.getMessage(), e);
    }
  }

  /**
   * Trimmed text of the first element matching the expression.
   *
   * @param expression the XPath expression
   * @return the text, or empty if nothing matches or the text is blank
   */
  Optional<String> text(final String expression) {
    final List<Element> elements = elements(expression);
    if (elements.isEmpty()) {
      return Optional.empty();
    }
    final String text = elements.get(0).getTextContent().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * Elements matching the expression, in document order.
   *
   * @param expression the XPath expression
   * @return the elements, possibly empty
   */
  List<Element> elements(final String expression) {
    final NodeList nodes;
    try {
      nodes = (NodeList) xpath.evaluate(expression, document, XPathConstants.NODESET);
    } catch (XPathExpressionException e) {
      throw new IllegalArgumentException("Invalid expression " + expression, e);
    }
    final List<Element> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      final Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        result.add((Element) node);
      }
    }
    return result;
  }
}

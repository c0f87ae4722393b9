package work.citeproc.engine.shared;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * SAX handler that builds an {@link XmlElement} tree. Element and attribute names are namespace-local,
 * except {@code xml:lang} which keeps its prefix.
 */
public final class XmlTreeReader extends DefaultHandler {
    private final Deque<XmlElement> stack = new ArrayDeque<>();
    private XmlElement root;

    private XmlTreeReader() {}

    public static XmlElement read(InputStream in) throws IOException, SAXException {
        return read(new InputSource(in));
    }

    public static XmlElement read(String xml) throws IOException, SAXException {
        return read(new InputSource(new StringReader(xml)));
    }

    public static XmlElement read(InputSource source) throws IOException, SAXException {
        var handler = new XmlTreeReader();
        newParser().parse(source, handler);
        if (handler.root == null) {
            throw new SAXException("Document has no root element");
        }
        return handler.root;
    }

    private static SAXParser newParser() throws SAXException {
        try {
            var factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return factory.newSAXParser();
        } catch (ParserConfigurationException ex) {
            throw new SAXException("Unable to configure XML parser", ex);
        }
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts) {
        var attributes = new LinkedHashMap<String, String>();
        for (int i = 0; i < atts.getLength(); i++) {
            String key = atts.getLocalName(i);
            if (key == null || key.isEmpty()) {
                key = atts.getQName(i);
            }
            if ("lang".equals(key) && XMLConstants.XML_NS_URI.equals(atts.getURI(i))) {
                key = "xml:lang";
            }
            attributes.put(key, atts.getValue(i));
        }
        String name = localName == null || localName.isEmpty() ? qName : localName;
        var element = new XmlElement(name, attributes);
        if (stack.isEmpty()) {
            root = element;
        } else {
            stack.peek().addChild(element);
        }
        stack.push(element);
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        stack.pop();
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        if (!stack.isEmpty()) {
            stack.peek().appendText(ch, start, length);
        }
    }
}

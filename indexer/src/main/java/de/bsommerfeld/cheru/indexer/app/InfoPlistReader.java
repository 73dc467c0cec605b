package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.util.SearchPaths;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reads the string values of a bundle's {@code Info.plist} top-level
 * dictionary.
 *
 * <p>
 * Property lists come in two encodings. XML plists are parsed directly with
 * the JDK DOM parser (external DTDs and entities disabled, since every Apple
 * plist references {@code PropertyList-1.0.dtd}). Binary plists, recognized by
 * their {@code bplist} magic, are first converted to XML through a
 * {@link PlistConverter}, by default {@code plutil -convert xml1}.
 *
 * <p>
 * Only {@code <string>} values are returned; other value types are skipped.
 */
public final class InfoPlistReader {

    private static final byte[] BINARY_MAGIC = "bplist".getBytes(StandardCharsets.US_ASCII);

    private final PlistConverter converter;

    public InfoPlistReader(PlistConverter converter) {
        this.converter = converter;
    }

    public InfoPlistReader() {
        this(InfoPlistReader::convertWithPlutil);
    }

    /**
     * Converts a binary property list into its XML form.
     */
    @FunctionalInterface
    public interface PlistConverter {
        byte[] toXml(Path binaryPlist) throws IOException;
    }

    /**
     * Returns the top-level string entries of the property list at
     * {@code plist}.
     *
     * @throws IOException if the file cannot be read, converted or parsed
     */
    public Map<String, String> readStrings(Path plist) throws IOException {
        byte[] bytes = Files.readAllBytes(plist);
        if (isBinary(bytes)) {
            bytes = converter.toXml(plist);
        }
        return parseXml(bytes);
    }

    static Map<String, String> parseXml(byte[] xml) throws IOException {
        Document document;
        try (InputStream in = new ByteArrayInputStream(xml)) {
            document = newBuilder().parse(in);
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Malformed property list", e);
        }

        Element dict = firstChildElement(document.getDocumentElement(), "dict");
        if (dict == null) {
            throw new IOException("Property list has no top-level dict");
        }

        Map<String, String> values = new LinkedHashMap<>();
        List<Element> children = childElements(dict);
        for (int i = 0; i + 1 < children.size(); i++) {
            Element key = children.get(i);
            if (!"key".equals(key.getTagName()))
                continue;

            Element value = children.get(i + 1);
            if ("string".equals(value.getTagName())) {
                values.putIfAbsent(key.getTextContent().strip(), value.getTextContent().strip());
            }
            i++;
        }
        return values;
    }

    private static boolean isBinary(byte[] bytes) {
        if (bytes.length < BINARY_MAGIC.length)
            return false;
        for (int i = 0; i < BINARY_MAGIC.length; i++) {
            if (bytes[i] != BINARY_MAGIC[i])
                return false;
        }
        return true;
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }

    private static Element firstChildElement(Element parent, String tag) {
        if (parent == null)
            return null;
        for (Element child : childElements(parent)) {
            if (tag.equals(child.getTagName()))
                return child;
        }
        return null;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) n);
            }
        }
        return elements;
    }

    private static byte[] convertWithPlutil(Path binaryPlist) throws IOException {
        Path plutil = SearchPaths.find("plutil")
                .orElseThrow(() -> new IOException("plutil not available to convert " + binaryPlist));

        Process process = new ProcessBuilder(plutil.toString(), "-convert", "xml1", "-o", "-",
                binaryPlist.toString())
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();

        byte[] xml;
        try (InputStream in = process.getInputStream()) {
            xml = in.readAllBytes();
        }
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("plutil timed out on " + binaryPlist);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while converting " + binaryPlist, e);
        }
        if (process.exitValue() != 0) {
            throw new IOException("plutil exited with code " + process.exitValue() + " for " + binaryPlist);
        }
        return xml;
    }
}

package NfseBot.xml;

import NfseBot.model.ExtractionFailure;
import NfseBot.model.NfseExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Leitor tolerante de XML de NFS-e.
 * Cada prefeitura usa (ou não) namespaces diferentes, por isso os prefixos são descartados.
 *
 * Tolerant XML reader for NFS-e documents.
 * Issuing authorities declare namespaces inconsistently, so prefixes are dropped and
 * undeclared prefixes are accepted. Every kind of bad input ends as a MALFORMED_XML failure.
 */
@Component
public class XmlTreeParser {

    private static final Logger log = LoggerFactory.getLogger(XmlTreeParser.class);

    private static final Pattern PROLOG_ENCODING =
            Pattern.compile("^\\s*<\\?xml[^>]*?encoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']");
    private static final int PROLOG_SCAN_BYTES = 256;

    public XmlNode parse(byte[] content) throws NfseExtractionException {
        if (content == null || content.length == 0) {
            throw malformed("empty document");
        }

        int offset = 0;
        Charset charset;
        if (startsWith(content, 0xEF, 0xBB, 0xBF)) {
            offset = 3;
            charset = StandardCharsets.UTF_8;
        } else if (startsWith(content, 0xFE, 0xFF)) {
            offset = 2;
            charset = StandardCharsets.UTF_16BE;
        } else if (startsWith(content, 0xFF, 0xFE)) {
            offset = 2;
            charset = StandardCharsets.UTF_16LE;
        } else if (startsWith(content, 0x00, 0x3C)) {
            charset = StandardCharsets.UTF_16BE;
        } else if (startsWith(content, 0x3C, 0x00)) {
            charset = StandardCharsets.UTF_16LE;
        } else {
            charset = declaredCharset(content);
        }

        String text = decode(content, offset, charset);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return buildTree(text);
    }

    // =====================
    // Encoding
    // =====================

    private Charset declaredCharset(byte[] content) {
        String prolog = new String(content, 0, Math.min(content.length, PROLOG_SCAN_BYTES), StandardCharsets.ISO_8859_1);
        Matcher m = PROLOG_ENCODING.matcher(prolog);
        if (!m.find()) {
            return StandardCharsets.UTF_8;
        }
        String name = m.group(1);
        try {
            Charset declared = Charset.forName(name);
            // a UTF-16 declaration without BOM or UTF-16 byte pattern cannot be right
            return declared.name().startsWith("UTF-16") ? StandardCharsets.UTF_8 : declared;
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("Unknown declared encoding '{}', falling back to UTF-8", name);
            return StandardCharsets.UTF_8;
        }
    }

    private String decode(byte[] content, int offset, Charset charset) throws NfseExtractionException {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(content, offset, content.length - offset);
        try {
            return decoder.decode(in).toString();
        } catch (CharacterCodingException e) {
            throw malformed("invalid " + charset.name() + " byte sequence near byte offset " + in.position(), e);
        }
    }

    private static boolean startsWith(byte[] content, int... prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((content[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    // =====================
    // Tree
    // =====================

    private XmlNode buildTree(String text) throws NfseExtractionException {
        XMLStreamReader reader = null;
        try {
            reader = newFactory().createXMLStreamReader(new StringReader(text));
            XmlNode root = null;
            Deque<XmlNode> open = new ArrayDeque<>();

            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        XmlNode node = new XmlNode(stripPrefix(reader.getLocalName()));
                        for (int i = 0; i < reader.getAttributeCount(); i++) {
                            String name = reader.getAttributeLocalName(i);
                            if (isNamespaceDeclaration(name)) {
                                continue;
                            }
                            node.putAttribute(stripPrefix(name), reader.getAttributeValue(i));
                        }
                        if (open.isEmpty()) {
                            root = node;
                        } else {
                            open.peek().addChild(node);
                        }
                        open.push(node);
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
                        String chunk = reader.getText();
                        if (!open.isEmpty() && !chunk.isBlank()) {
                            open.peek().appendText(chunk);
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> open.pop();
                    default -> {
                        // comments, processing instructions, DTD
                    }
                }
            }

            if (root == null) {
                throw malformed("no root element");
            }
            if (!open.isEmpty()) {
                throw malformed("unclosed element <" + open.peek().getLocalName() + ">");
            }
            return root;
        } catch (XMLStreamException e) {
            throw malformed(describe(e), e);
        } catch (RuntimeException e) {
            throw malformed("parser error: " + e.getMessage(), e);
        } finally {
            closeQuietly(reader);
        }
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    static String stripPrefix(String name) {
        int colon = name.lastIndexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static boolean isNamespaceDeclaration(String name) {
        return name.equals("xmlns") || name.startsWith("xmlns:");
    }

    private static String describe(XMLStreamException e) {
        Location location = e.getLocation();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        // the JDK reader already prefixes "ParseError at [row,col]:..." to its messages
        if (location == null || message.startsWith("ParseError")) {
            return message;
        }
        return "line " + location.getLineNumber() + ", column " + location.getColumnNumber() + ": " + message;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.debug("Could not close XML reader: {}", e.getMessage());
        }
    }

    private static NfseExtractionException malformed(String message) {
        return new NfseExtractionException(ExtractionFailure.malformedXml(message));
    }

    private static NfseExtractionException malformed(String message, Throwable cause) {
        return new NfseExtractionException(ExtractionFailure.malformedXml(message), cause);
    }
}

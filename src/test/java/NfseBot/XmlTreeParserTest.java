package NfseBot;

import NfseBot.model.FailureKind;
import NfseBot.model.NfseExtractionException;
import NfseBot.xml.XmlNode;
import NfseBot.xml.XmlTreeParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static NfseBot.NfseSamples.bytes;
import static NfseBot.NfseSamples.deeplyNested;
import static org.junit.jupiter.api.Assertions.*;

class XmlTreeParserTest {

    private final XmlTreeParser parser = new XmlTreeParser();

    // ==========================================
    // Tree structure
    // ==========================================

    @Test
    @DisplayName("PREFIX: namespace prefixes are stripped from element and attribute names")
    void testPrefixesAreStripped() throws Exception {
        String xml = "<ns2:Nfse xmlns:ns2=\"http://example.org\"><ns2:InfNfse ns2:Id=\"A1\">"
                + "<ns2:Numero>42</ns2:Numero><Numero>43</Numero></ns2:InfNfse></ns2:Nfse>";

        XmlNode root = parser.parse(bytes(xml));

        assertEquals("Nfse", root.getLocalName());
        XmlNode inf = root.getChildren().get(0);
        assertEquals("InfNfse", inf.getLocalName());
        assertEquals("A1", inf.getAttribute("Id"));
        assertFalse(root.getAttributes().containsKey("ns2"), "xmlns declarations are not attributes");
        assertEquals(List.of("Numero", "Numero"),
                inf.getChildren().stream().map(XmlNode::getLocalName).toList());
        assertEquals("42", inf.getChildren().get(0).getText());
    }

    @Test
    @DisplayName("PREFIX: undeclared prefixes are accepted")
    void testUndeclaredPrefix() throws Exception {
        XmlNode root = parser.parse(bytes("<tc:Nfse><tc:Numero>9</tc:Numero></tc:Nfse>"));

        assertEquals("9", root.findFirst("Numero").getText());
    }

    @Test
    @DisplayName("TEXT: entities are unescaped, CDATA is plain text, whitespace-only text is dropped")
    void testTextContent() throws Exception {
        String xml = "<Servico>\n   <Discriminacao><![CDATA[Linha 1\nLinha <2>]]></Discriminacao>\n"
                + "   <Nome>Beta &amp; Filhos &lt;ME&gt;</Nome>\n</Servico>";

        XmlNode root = parser.parse(bytes(xml));

        assertEquals("", root.getText());
        assertEquals("Linha 1\nLinha <2>", root.findFirst("Discriminacao").getText());
        assertEquals("Beta & Filhos <ME>", root.findFirst("Nome").getText());
    }

    @Test
    @DisplayName("SEARCH: findFirst is depth-first in document order")
    void testFindFirstDocumentOrder() throws Exception {
        XmlNode root = parser.parse(bytes("<a><b><c>1</c></b><c>2</c></a>"));

        assertEquals("1", root.findFirst("c").getText());
        assertSame(root, root.findFirst("a"));
        assertNull(root.findFirst("d"));
    }

    // ==========================================
    // Encoding
    // ==========================================

    @Test
    @DisplayName("ENCODING: a UTF-8 byte-order mark is stripped")
    void testUtf8Bom() throws Exception {
        byte[] body = bytes("<?xml version=\"1.0\" encoding=\"UTF-8\"?><Nome>São Paulo</Nome>");
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        assertEquals("São Paulo", parser.parse(withBom).getText());
    }

    @Test
    @DisplayName("ENCODING: the encoding declared in the prolog is honoured")
    void testDeclaredLatin1() throws Exception {
        byte[] latin1 = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><Nome>Serviços Ótimos</Nome>"
                .getBytes(StandardCharsets.ISO_8859_1);

        assertEquals("Serviços Ótimos", parser.parse(latin1).getText());
    }

    @Test
    @DisplayName("ENCODING: UTF-16 with byte-order mark")
    void testUtf16() throws Exception {
        byte[] utf16 = "<?xml version=\"1.0\" encoding=\"UTF-16\"?><Nome>Tomé</Nome>"
                .getBytes(StandardCharsets.UTF_16);

        assertEquals("Tomé", parser.parse(utf16).getText());
    }

    // ==========================================
    // Malformed input
    // ==========================================

    @Test
    @DisplayName("ERROR: invalid UTF-8 byte sequences are reported as MALFORMED_XML")
    void testInvalidBytes() {
        byte[] invalid = { '<', 'a', '>', (byte) 0xC3, (byte) 0x28, '<', '/', 'a', '>' };

        NfseExtractionException e = assertThrows(NfseExtractionException.class, () -> parser.parse(invalid));

        assertEquals(FailureKind.MALFORMED_XML, e.getFailure().kind());
        assertTrue(e.getFailure().message().contains("byte"));
    }

    @Test
    @DisplayName("ERROR: every kind of broken document ends as MALFORMED_XML, never as another exception")
    void testBrokenDocuments() {
        List<byte[]> inputs = List.of(
                new byte[0],
                bytes("   "),
                bytes("<a><b></a>"),
                bytes("<a>"),
                bytes("<?xml version=\"1.0\"?>\n<CompNfse><Nfse><InfNfse><Numero>1</Numero>\n"),
                bytes("<a></a><b></b>"),
                bytes("just text"),
                bytes("<a attr=\"unterminated></a>"),
                new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0x00, 0x3C },
                NfseSamples.fixture("truncated.xml"));

        for (byte[] input : inputs) {
            NfseExtractionException e = assertThrows(NfseExtractionException.class, () -> parser.parse(input),
                    "expected failure for: " + new String(input, StandardCharsets.ISO_8859_1));
            assertEquals(FailureKind.MALFORMED_XML, e.getFailure().kind());
        }
    }

    @Test
    @DisplayName("SECURITY: external entities are never resolved")
    void testExternalEntityIgnored() {
        byte[] xxe = bytes("<!DOCTYPE a [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><a>&x;</a>");

        try {
            XmlNode root = parser.parse(xxe);
            assertFalse(root.getText().contains("root:"));
        } catch (NfseExtractionException e) {
            assertEquals(FailureKind.MALFORMED_XML, e.getFailure().kind());
        }
    }

    @Test
    @DisplayName("ERROR: the failure carries the position when the parser knows it")
    void testErrorPosition() {
        NfseExtractionException e = assertThrows(NfseExtractionException.class,
                () -> parser.parse(bytes("<a>\n<b>\n</a>")));

        assertFalse(e.getFailure().message().isBlank());
    }

    // ==========================================
    // Deep documents
    // ==========================================

    @Test
    @DisplayName("DEPTH: a 200,000-level document parses and can be searched without exhausting the stack")
    void testVeryDeepDocument() throws Exception {
        XmlNode root = parser.parse(bytes(deeplyNested(200_000, "<Numero>7</Numero><Numero> </Numero>")));

        assertEquals("a", root.getLocalName());
        assertEquals("7", root.findFirst("Numero").getText());
        assertEquals("7", root.findFirstWithText("Numero").getText());
        assertNull(root.findFirst("InfNfse"));
        assertEquals(200_000, root.countAll("a"));
        assertEquals(2, root.countAll("Numero"));
    }

    @Test
    @DisplayName("SEARCH: findFirstWithText skips blank elements and keeps document order")
    void testSearchOrder() throws Exception {
        XmlNode root = parser.parse(bytes(
                "<r><x><Cpf/></x><y><Cpf>111</Cpf></y><Cpf>222</Cpf></r>"));

        assertEquals("", root.findFirst("Cpf").getText());
        assertEquals("111", root.findFirstWithText("Cpf").getText());
        assertEquals(3, root.countAll("Cpf"));
    }
}

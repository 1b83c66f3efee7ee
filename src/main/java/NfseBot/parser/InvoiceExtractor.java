package NfseBot.parser;

import NfseBot.model.ExtractionFailure;
import NfseBot.model.Invoice;
import NfseBot.model.NfseExtractionException;
import NfseBot.model.Party;
import NfseBot.model.TaxId;
import NfseBot.model.TaxIdType;
import NfseBot.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Pattern;

/*

Extração dos campos da NFS-e a partir da árvore XML genérica.
 * Cada campo é procurado por uma lista de aliases em ordem de prioridade.

Extraction of NFS-e fields from the generic XML tree.
 * Each field is looked up through an ordered alias list; the first failing required field
 * ends the extraction, so exactly one reason is reported per file.

*/
@Service
public class InvoiceExtractor {

    private static final Logger log = LoggerFactory.getLogger(InvoiceExtractor.class);

    static final String NUMBER = "number";
    static final String ISSUE_DATE = "issueDate";
    static final String TOTAL_SERVICE_VALUE = "totalServiceValue";
    static final String PROVIDER = "provider";
    static final String RECIPIENT = "recipient";

    private static final DateTimeFormatter BRAZILIAN_DATE =
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern DIGITS_AND_SEPARATORS = Pattern.compile("\\d+([.,]\\d+)*");

    private final SchemaAliases aliases;

    public InvoiceExtractor(SchemaAliases aliases) {
        this.aliases = aliases;
    }

    public SchemaAliases getAliases() {
        return aliases;
    }

    public Invoice extract(XmlNode document) throws NfseExtractionException {
        XmlNode invoiceNode = findByPriority(document, aliases.invoiceRoot(), false);
        if (invoiceNode == null) {
            throw missing("invoice");
        }

        String number = requireText(invoiceNode, aliases.number(), NUMBER);
        LocalDate issueDate = parseDate(requireText(invoiceNode, aliases.issueDate(), ISSUE_DATE));
        Party provider = extractParty(invoiceNode, aliases.provider(), PROVIDER);
        Party recipient = extractParty(invoiceNode, aliases.recipient(), RECIPIENT);
        BigDecimal total = parseAmount(requireText(invoiceNode, aliases.totalServiceValue(), TOTAL_SERVICE_VALUE));
        String description = optionalText(invoiceNode, aliases.serviceDescription());

        int invoicesInDocument = document.countAll(invoiceNode.getLocalName());
        if (invoicesInDocument > 1) {
            log.warn("Document holds {} <{}> invoices; only the first (number {}) is extracted",
                    invoicesInDocument, invoiceNode.getLocalName(), number);
        }

        return new Invoice(number, issueDate, provider, recipient, total, description);
    }

    // =====================
    // Alias lookup
    // =====================

    private static XmlNode findByPriority(XmlNode scope, List<String> names, boolean withText) {
        for (String name : names) {
            XmlNode match = withText ? scope.findFirstWithText(name) : scope.findFirst(name);
            if (match != null) {
                return match;
            }
        }
        return null;
    }

    private static String optionalText(XmlNode scope, List<String> names) {
        XmlNode node = findByPriority(scope, names, true);
        return node != null ? node.getText().trim() : "";
    }

    private static String requireText(XmlNode scope, List<String> names, String field) throws NfseExtractionException {
        String value = optionalText(scope, names);
        if (value.isEmpty()) {
            throw missing(field);
        }
        return value;
    }

    private Party extractParty(XmlNode invoiceNode, List<String> nodeNames, String role) throws NfseExtractionException {
        String nameField = role + ".legalName";
        String taxIdField = role + ".taxId";

        XmlNode partyNode = findByPriority(invoiceNode, nodeNames, false);
        if (partyNode == null) {
            throw missing(nameField);
        }
        String legalName = requireText(partyNode, aliases.legalName(), nameField);
        TaxId taxId = parseTaxId(requireText(partyNode, aliases.taxId(), taxIdField), taxIdField);
        return new Party(legalName, taxId);
    }

    // =====================
    // Field parsing
    // =====================

    static LocalDate parseDate(String raw) throws NfseExtractionException {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException ignored) {
            // not a plain ISO date
        }
        try {
            return LocalDateTime.parse(raw).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // not an ISO local date-time
        }
        try {
            return OffsetDateTime.parse(raw).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // not an ISO offset date-time
        }
        try {
            return LocalDate.parse(raw, BRAZILIAN_DATE);
        } catch (DateTimeParseException e) {
            throw new NfseExtractionException(ExtractionFailure.dateFormat(ISSUE_DATE, raw), e);
        }
    }

    /**
     * Accepts "1500,00", "1.500,00", "1,500.00", "1500.00" and "R$ 1.500,00".
     * When both separators occur the right-most one is the decimal separator; a separator that
     * occurs more than once is a thousands separator.
     */
    static BigDecimal parseAmount(String raw) throws NfseExtractionException {
        String value = raw.replace("R$", "").replaceAll("\\s+", "");
        if (value.startsWith("-")) {
            throw new NfseExtractionException(
                    ExtractionFailure.numberFormat(TOTAL_SERVICE_VALUE, raw, "negative amount"));
        }
        if (!DIGITS_AND_SEPARATORS.matcher(value).matches()) {
            throw new NfseExtractionException(
                    ExtractionFailure.numberFormat(TOTAL_SERVICE_VALUE, raw, "not a number"));
        }

        int lastDot = value.lastIndexOf('.');
        int lastComma = value.lastIndexOf(',');
        char decimal;
        if (lastDot >= 0 && lastComma >= 0) {
            decimal = lastDot > lastComma ? '.' : ',';
        } else if (lastComma >= 0) {
            decimal = value.indexOf(',') == lastComma ? ',' : 0;
        } else if (lastDot >= 0) {
            decimal = value.indexOf('.') == lastDot ? '.' : 0;
        } else {
            decimal = 0;
        }

        StringBuilder normalized = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                normalized.append(c);
            } else if (c == decimal) {
                normalized.append('.');
            }
        }

        try {
            return new BigDecimal(normalized.toString());
        } catch (NumberFormatException e) {
            throw new NfseExtractionException(
                    ExtractionFailure.numberFormat(TOTAL_SERVICE_VALUE, raw, "not a number"), e);
        }
    }

    static TaxId parseTaxId(String raw, String field) throws NfseExtractionException {
        String digits = raw.replaceAll("\\D", "");
        TaxIdType type = TaxIdType.forDigitCount(digits.length());
        if (type == null) {
            throw new NfseExtractionException(ExtractionFailure.taxIdFormat(field, raw,
                    "expected 11 (CPF) or 14 (CNPJ) digits, found " + digits.length()));
        }
        return new TaxId(type, digits);
    }

    private static NfseExtractionException missing(String field) {
        return new NfseExtractionException(ExtractionFailure.missingField(field));
    }
}

package NfseBot.model;

/**
 * Typed failure for one file. {@code field} and {@code rawValue} are null when they do not apply.
 */
public record ExtractionFailure(FailureKind kind, String field, String rawValue, String message) {

    public ExtractionFailure {
        if (kind == null) {
            throw new IllegalArgumentException("failure kind is required");
        }
        if (message == null) {
            message = "";
        }
    }

    public static ExtractionFailure ioError(String message) {
        return new ExtractionFailure(FailureKind.IO_ERROR, null, null, message);
    }

    public static ExtractionFailure malformedXml(String message) {
        return new ExtractionFailure(FailureKind.MALFORMED_XML, null, null, message);
    }

    public static ExtractionFailure missingField(String field) {
        return new ExtractionFailure(FailureKind.MISSING_FIELD, field, null, "field '" + field + "' not found");
    }

    public static ExtractionFailure dateFormat(String field, String rawValue) {
        return new ExtractionFailure(FailureKind.DATE_FORMAT, field, rawValue, "unparseable date");
    }

    public static ExtractionFailure numberFormat(String field, String rawValue, String message) {
        return new ExtractionFailure(FailureKind.NUMBER_FORMAT, field, rawValue, message);
    }

    public static ExtractionFailure taxIdFormat(String field, String rawValue, String message) {
        return new ExtractionFailure(FailureKind.TAX_ID_FORMAT, field, rawValue, message);
    }

    /**
     * Human-readable reason: kind, then field and offending value where present.
     * e.g. {@code Data inválida [issueDate='31-02-2024']: unparseable date}
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.getLabel());
        if (field != null) {
            sb.append(" [").append(field);
            if (rawValue != null) {
                sb.append("='").append(rawValue).append('\'');
            }
            sb.append(']');
        }
        if (!message.isEmpty()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}

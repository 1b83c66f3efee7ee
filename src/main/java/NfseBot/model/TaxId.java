package NfseBot.model;

/**
 * CPF (11 digits) or CNPJ (14 digits). Stores raw digits only.
 */
public record TaxId(TaxIdType type, String digits) {

    public TaxId {
        if (type == null) {
            throw new IllegalArgumentException("tax id type is required");
        }
        if (digits == null || !digits.matches("\\d+") || digits.length() != type.getDigitCount()) {
            throw new IllegalArgumentException(type + " requires exactly " + type.getDigitCount() + " digits");
        }
    }

    public static TaxId cpf(String digits) {
        return new TaxId(TaxIdType.CPF, digits);
    }

    public static TaxId cnpj(String digits) {
        return new TaxId(TaxIdType.CNPJ, digits);
    }

    /**
     * Punctuated form for display, e.g. 12.345.678/0001-95 or 123.456.789-09.
     */
    public String formatted() {
        if (type == TaxIdType.CNPJ) {
            return digits.substring(0, 2) + "." + digits.substring(2, 5) + "." + digits.substring(5, 8)
                    + "/" + digits.substring(8, 12) + "-" + digits.substring(12);
        }
        return digits.substring(0, 3) + "." + digits.substring(3, 6) + "." + digits.substring(6, 9)
                + "-" + digits.substring(9);
    }

    @Override
    public String toString() {
        return type + " " + formatted();
    }
}

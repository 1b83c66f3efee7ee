package NfseBot.model;

/**
 * Tipo de documento fiscal.
 *
 * Kind of Brazilian tax identifier, determined by the digit count.
 */
public enum TaxIdType {

    CPF(11),
    CNPJ(14);

    private final int digitCount;

    TaxIdType(int digitCount) {
        this.digitCount = digitCount;
    }

    public int getDigitCount() {
        return digitCount;
    }

    /**
     * Returns the type whose digit count matches, or null if none does.
     */
    public static TaxIdType forDigitCount(int count) {
        for (TaxIdType type : values()) {
            if (type.digitCount == count) {
                return type;
            }
        }
        return null;
    }
}

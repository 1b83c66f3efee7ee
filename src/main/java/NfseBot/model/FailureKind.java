package NfseBot.model;

/**
 * Reason a single file could not be turned into an {@link Invoice}.
 */
public enum FailureKind {

    IO_ERROR("Erro de leitura"),
    MALFORMED_XML("XML malformado"),
    MISSING_FIELD("Campo obrigatório ausente"),
    DATE_FORMAT("Data inválida"),
    NUMBER_FORMAT("Valor inválido"),
    TAX_ID_FORMAT("CPF/CNPJ inválido");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

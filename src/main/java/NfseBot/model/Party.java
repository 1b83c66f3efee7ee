package NfseBot.model;

/**
 * Prestador ou tomador do serviço.
 *
 * Provider or recipient of the service.
 */
public record Party(String legalName, TaxId taxId) {

    public Party {
        if (legalName == null || legalName.isBlank()) {
            throw new IllegalArgumentException("legal name must not be empty");
        }
        if (taxId == null) {
            throw new IllegalArgumentException("tax id is required");
        }
    }
}

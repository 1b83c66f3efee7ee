package NfseBot.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Modelo normalizado de uma NFS-e.
 * Contém número, data de emissão, prestador, tomador, valor dos serviços e discriminação.
 *
 * Normalized service invoice, independent of the municipal XML layout it was read from.
 */
public record Invoice(String number,
                      LocalDate issueDate,
                      Party provider,
                      Party recipient,
                      BigDecimal totalServiceValue,
                      String serviceDescription) {

    public Invoice {
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("invoice number must not be empty");
        }
        if (issueDate == null) {
            throw new IllegalArgumentException("issue date is required");
        }
        if (provider == null || recipient == null) {
            throw new IllegalArgumentException("provider and recipient are required");
        }
        if (totalServiceValue == null || totalServiceValue.signum() < 0) {
            throw new IllegalArgumentException("total service value must be non-negative");
        }
        if (serviceDescription == null) {
            serviceDescription = "";
        }
    }
}

package NfseBot.parser;

import java.util.List;

/**
 * Tabela de aliases dos elementos por leiaute municipal.
 *
 * Element-name alias table covering the municipal NFS-e layouts. Every list is in priority
 * order: an earlier alias always wins over a later one, wherever each sits in the document.
 *
 * Immutable; built once and handed to {@link InvoiceExtractor} at construction.
 */
public record SchemaAliases(List<String> invoiceRoot,
                            List<String> number,
                            List<String> issueDate,
                            List<String> totalServiceValue,
                            List<String> serviceDescription,
                            List<String> provider,
                            List<String> recipient,
                            List<String> legalName,
                            List<String> taxId) {

    public SchemaAliases {
        invoiceRoot = requireAliases("invoiceRoot", invoiceRoot);
        number = requireAliases("number", number);
        issueDate = requireAliases("issueDate", issueDate);
        totalServiceValue = requireAliases("totalServiceValue", totalServiceValue);
        serviceDescription = requireAliases("serviceDescription", serviceDescription);
        provider = requireAliases("provider", provider);
        recipient = requireAliases("recipient", recipient);
        legalName = requireAliases("legalName", legalName);
        taxId = requireAliases("taxId", taxId);
    }

    /**
     * Aliases seen in ABRASF 1.x / 2.x, GINFES, ISSNet and the national (Sefin) layout.
     */
    public static SchemaAliases defaults() {
        return new SchemaAliases(
                List.of("InfNfse", "InfDeclaracaoPrestacaoServico", "Nfse", "infNFSe"),
                List.of("Numero", "NumeroNota", "NumeroNfse", "nNFSe"),
                List.of("DataEmissao", "DataEmissaoNfse", "DtEmissao", "dhEmi", "dhProc"),
                List.of("ValorServicos", "ValorServico", "ValorTotalServicos", "vServ"),
                List.of("Discriminacao", "DescricaoServico", "xDescServ"),
                List.of("PrestadorServico", "Prestador", "DadosPrestador", "emit"),
                List.of("TomadorServico", "Tomador", "DadosTomador", "toma"),
                List.of("RazaoSocial", "NomeRazaoSocial", "Nome", "xNome"),
                List.of("Cnpj", "CNPJ", "Cpf", "CPF", "CpfCnpj"));
    }

    private static List<String> requireAliases(String name, List<String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            throw new IllegalArgumentException("alias list '" + name + "' must not be empty");
        }
        return List.copyOf(aliases);
    }
}

package NfseBot.config;

import NfseBot.export.ExcelExporter;
import NfseBot.parser.SchemaAliases;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans that are plain values rather than services.
 */
@Configuration
public class NfseBotConfiguration {

    @Bean
    public SchemaAliases schemaAliases() {
        return SchemaAliases.defaults();
    }

    @Bean
    public ExcelExporter excelExporter() {
        return new ExcelExporter();
    }
}

package NfseBot;

import javax.swing.SwingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import NfseBot.batch.BatchProcessor;
import NfseBot.collector.CollectionResult;
import NfseBot.collector.PathCollector;
import NfseBot.export.ExcelExporter;
import NfseBot.gui.NfseBotGui;
import NfseBot.model.Batch;
import NfseBot.model.ProcessingResult;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/*
 * Without arguments the Swing window opens.
 * With arguments (files or folders) the batch runs headless and the results are logged.
 */
@SpringBootApplication
public class NfseBotApplication {

    private static final Logger log = LoggerFactory.getLogger(NfseBotApplication.class);

    public static void main(String[] args) {
        boolean headless = args.length > 0;
        System.setProperty("java.awt.headless", String.valueOf(headless));

        SpringApplication app = new SpringApplication(NfseBotApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = app.run(args);

        PathCollector collector = context.getBean(PathCollector.class);
        BatchProcessor processor = context.getBean(BatchProcessor.class);

        if (headless) {
            List<Path> entries = Arrays.stream(args).map(Path::of).toList();
            int exitCode = runHeadless(collector, processor, entries);
            System.exit(SpringApplication.exit(context, () -> exitCode));
        }

        ExcelExporter exporter = context.getBean(ExcelExporter.class);
        SwingUtilities.invokeLater(() -> {
            NfseBotGui gui = new NfseBotGui(collector, processor, exporter);
            gui.setVisible(true);
        });
    }

    /**
     * Collects and processes the given entries, logging one line per file.
     *
     * @return 0 when every file produced an invoice, 1 otherwise
     */
    static int runHeadless(PathCollector collector, BatchProcessor processor, List<Path> entries) {
        CollectionResult collected = collector.collectPaths(entries);
        Batch batch = processor.processBatch(collected.files());

        for (ProcessingResult result : batch.results()) {
            if (result.isSuccess()) {
                log.info("{}: NFS-e {} de {} - {} - R$ {}", result.sourcePath(), result.invoice().number(),
                        result.invoice().issueDate(), result.invoice().provider().legalName(),
                        result.invoice().totalServiceValue());
            } else {
                log.warn("{}: {}", result.sourcePath(), result.failure().describe());
            }
        }
        log.info("Notas Fiscais Processadas: {} | Erros: {} | Valor total: R$ {}",
                batch.successCount(), batch.failureCount(), batch.totalServiceValue());

        return batch.failureCount() == 0 && !collected.hasDiagnostics() ? 0 : 1;
    }
}

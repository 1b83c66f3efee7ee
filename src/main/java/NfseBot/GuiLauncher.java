package NfseBot;

import NfseBot.batch.BatchProcessor;
import NfseBot.collector.PathCollector;
import NfseBot.export.ExcelExporter;
import NfseBot.gui.NfseBotGui;
import NfseBot.parser.InvoiceExtractor;
import NfseBot.parser.SchemaAliases;
import NfseBot.xml.XmlTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;


/* Inicializador da interface sem Spring.
 * Monta as dependências manualmente e abre a janela.

GUI Launcher without Spring Boot.
 * Wires the core by hand and opens the window.
 */
public class GuiLauncher {

    private static final Logger log = LoggerFactory.getLogger(GuiLauncher.class);

    public static void main(String[] args) {
        // macOS Settings
        System.setProperty("apple.awt.application.name", "NfseBot");

        Thread.setDefaultUncaughtExceptionHandler((t, e) -> {
            log.error("Uncaught exception in thread {}", t.getName(), e);

            JOptionPane.showMessageDialog(null,
                "Ocorreu um erro inesperado:\n" + e.getMessage(),
                "Erro crítico",
                JOptionPane.ERROR_MESSAGE);
        });

        // Manual wiring, same defaults as application.properties
        PathCollector collector = new PathCollector(false);
        InvoiceExtractor extractor = new InvoiceExtractor(SchemaAliases.defaults());
        BatchProcessor processor = new BatchProcessor(new XmlTreeParser(), extractor, 0);
        ExcelExporter exporter = new ExcelExporter();

        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            } catch (Exception e) {
                log.debug("System look and feel not available, using default: {}", e.getMessage());
            }

            NfseBotGui gui = new NfseBotGui(collector, processor, exporter);
            gui.setVisible(true);
        });
    }
}

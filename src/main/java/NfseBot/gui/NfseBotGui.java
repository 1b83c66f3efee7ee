package NfseBot.gui;

import NfseBot.batch.BatchProcessor;
import NfseBot.batch.CancellationSignal;
import NfseBot.collector.CollectionDiagnostic;
import NfseBot.collector.CollectionResult;
import NfseBot.collector.PathCollector;
import NfseBot.export.ExcelExporter;
import NfseBot.model.Batch;
import NfseBot.model.Invoice;
import NfseBot.model.ProcessingResult;

// Swing/AWT Imports
import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;

// Java IO/NIO Imports
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.text.NumberFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

// Java Util Imports
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/*
 * NfseBotGui.java
 *
 * Janela principal do NfseBot.
 * Permite selecionar arquivos XML ou pastas, processar o lote, acompanhar o log e exportar para Excel.
 *
 *
 * Main window of NfseBot.
 * Lets the user pick XML files or folders, run the batch, follow the log and export to Excel.
 * All extraction work is delegated to the core (PathCollector, BatchProcessor).
*/

public class NfseBotGui extends JFrame {

    private final PathCollector pathCollector;
    private final BatchProcessor batchProcessor;
    private final ExcelExporter excelExporter;

    private JTextArea logArea;
    private JButton selectFilesButton;
    private JButton selectFolderButton;
    private JButton startButton;
    private JButton cancelButton;
    private JButton exportButton;
    private JProgressBar progressBar;
    private JLabel statusLabel;

    private final List<Path> selectedEntries = new ArrayList<>();
    private CancellationSignal cancellation;
    private Batch lastBatch;

    private static final NumberFormat BRL = NumberFormat.getCurrencyInstance(new Locale("pt", "BR"));
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public NfseBotGui(PathCollector pathCollector, BatchProcessor batchProcessor, ExcelExporter excelExporter) {
        this.pathCollector = pathCollector;
        this.batchProcessor = batchProcessor;
        this.excelExporter = excelExporter;

        initializeUI();
    }

    private void initializeUI() {
        setTitle("NfseBot - Processador de Notas Fiscais");
        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setSize(900, 700);
        setLocationRelativeTo(null);

        JPanel mainPanel = new JPanel(new BorderLayout(10, 10));
        mainPanel.setBorder(new EmptyBorder(15, 15, 15, 15));

        mainPanel.add(createControlPanel(), BorderLayout.NORTH);
        mainPanel.add(createLogPanel(), BorderLayout.CENTER);
        mainPanel.add(createStatusPanel(), BorderLayout.SOUTH);

        add(mainPanel);
    }

    private JPanel createControlPanel() {
        JPanel panel = new JPanel(new BorderLayout(10, 10));

        JPanel buttonPanel = new JPanel(new FlowLayout(FlowLayout.LEFT));

        selectFilesButton = createButton("📄 Selecionar Arquivos XML");
        selectFilesButton.addActionListener(e -> selectFiles());
        buttonPanel.add(selectFilesButton);

        selectFolderButton = createButton("📁 Selecionar Pasta");
        selectFolderButton.addActionListener(e -> selectFolder());
        buttonPanel.add(selectFolderButton);

        startButton = createButton("🚀 Processar");
        startButton.setEnabled(false);
        startButton.addActionListener(e -> startProcessing());
        buttonPanel.add(startButton);

        cancelButton = createButton("⏹ Cancelar");
        cancelButton.setEnabled(false);
        cancelButton.addActionListener(e -> cancelProcessing());
        buttonPanel.add(cancelButton);

        exportButton = createButton("📊 Exportar Excel");
        exportButton.setEnabled(false);
        exportButton.addActionListener(e -> exportResults());
        buttonPanel.add(exportButton);

        panel.add(buttonPanel, BorderLayout.NORTH);

        progressBar = new JProgressBar(0, 100);
        progressBar.setStringPainted(true);
        progressBar.setPreferredSize(new Dimension(800, 25));
        panel.add(progressBar, BorderLayout.SOUTH);

        return panel;
    }

    private JButton createButton(String label) {
        JButton button = new JButton(label);
        button.setFont(new Font("SansSerif", Font.BOLD, 13));
        return button;
    }

    private JPanel createLogPanel() {
        JPanel panel = new JPanel(new BorderLayout());
        panel.setBorder(BorderFactory.createTitledBorder("Notas Fiscais Processadas"));

        logArea = new JTextArea();
        logArea.setEditable(false);
        logArea.setFont(new Font("Monospaced", Font.PLAIN, 12));
        logArea.setBackground(new Color(240, 240, 240));

        JScrollPane scrollPane = new JScrollPane(logArea);
        scrollPane.setPreferredSize(new Dimension(850, 500));
        panel.add(scrollPane, BorderLayout.CENTER);

        return panel;
    }

    private JPanel createStatusPanel() {
        JPanel panel = new JPanel(new FlowLayout(FlowLayout.LEFT));
        statusLabel = new JLabel("Pronto");
        statusLabel.setFont(new Font("SansSerif", Font.BOLD, 12));
        panel.add(statusLabel);
        return panel;
    }

    // =====================
    // Selection
    // =====================

    private void selectFiles() {
        JFileChooser fileChooser = new JFileChooser();
        fileChooser.setDialogTitle("Selecione os arquivos XML");
        fileChooser.setMultiSelectionEnabled(true);
        fileChooser.setFileFilter(new javax.swing.filechooser.FileNameExtensionFilter("Arquivos XML", "xml"));

        if (fileChooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            replaceSelection(fileChooser.getSelectedFiles());
        }
    }

    private void selectFolder() {
        JFileChooser folderChooser = new JFileChooser();
        folderChooser.setDialogTitle("Selecione uma pasta");
        folderChooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        folderChooser.setMultiSelectionEnabled(true);

        if (folderChooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            File[] folders = folderChooser.getSelectedFiles();
            if (folders.length == 0 && folderChooser.getSelectedFile() != null) {
                folders = new File[] { folderChooser.getSelectedFile() };
            }
            replaceSelection(folders);
        }
    }

    private void replaceSelection(File[] entries) {
        selectedEntries.clear();
        log("📁 " + entries.length + " item(ns) selecionado(s):");
        for (File entry : entries) {
            selectedEntries.add(entry.toPath());
            log("   - " + entry.getAbsolutePath());
        }
        startButton.setEnabled(!selectedEntries.isEmpty());
    }

    // =====================
    // Processing
    // =====================

    private void startProcessing() {
        if (selectedEntries.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Selecione primeiro arquivos XML ou uma pasta.",
                "Nenhum arquivo", JOptionPane.WARNING_MESSAGE);
            return;
        }

        setSelectionEnabled(false);
        startButton.setEnabled(false);
        exportButton.setEnabled(false);
        cancelButton.setEnabled(true);
        cancellation = new CancellationSignal();
        List<Path> entries = List.copyOf(selectedEntries);
        CancellationSignal signal = cancellation;

        log("\n========================================");
        log("🚀 INICIANDO PROCESSAMENTO");
        log("========================================\n");

        SwingWorker<Batch, String> worker = new SwingWorker<>() {
            @Override
            protected Batch doInBackground() {
                CollectionResult collected = pathCollector.collectPaths(entries);
                for (CollectionDiagnostic diagnostic : collected.diagnostics()) {
                    publish("⚠️ Pasta ignorada: " + diagnostic);
                }
                publish("🔍 " + collected.files().size() + " arquivo(s) XML encontrado(s)");

                return batchProcessor.processBatch(collected.files(), signal, (completed, total, result) -> {
                    setProgress(total == 0 ? 100 : (int) ((completed / (double) total) * 100));
                    publish("--- (" + completed + "/" + total + ") " + result.getFileName()
                        + (result.isSuccess() ? " ✅" : " ❌"));
                });
            }

            @Override
            protected void process(List<String> chunks) {
                for (String message : chunks) {
                    log(message);
                }
            }

            @Override
            protected void done() {
                try {
                    finishProcessing(get());
                } catch (Exception e) {
                    log("❌ Erro no processamento: " + e.getMessage());
                    resetControls();
                }
            }
        };

        worker.addPropertyChangeListener(evt -> {
            if ("progress".equals(evt.getPropertyName())) {
                int progress = (Integer) evt.getNewValue();
                progressBar.setValue(progress);
                statusLabel.setText("Processando... " + progress + "%");
            }
        });

        worker.execute();
    }

    private void cancelProcessing() {
        if (cancellation != null) {
            cancellation.cancel();
            cancelButton.setEnabled(false);
            log("⏹ Cancelamento solicitado...");
        }
    }

    private void finishProcessing(Batch batch) {
        lastBatch = batch;

        log("\n========================================");
        log(batch.cancelled() ? "⏹ PROCESSAMENTO CANCELADO" : "✅ PROCESSAMENTO CONCLUÍDO");
        log("========================================\n");

        for (ProcessingResult result : batch.results()) {
            if (result.isSuccess()) {
                logInvoice(result);
            } else {
                log("❌ " + result.sourcePath());
                log("   " + result.failure().describe());
            }
            log("");
        }

        log("📊 Notas Fiscais Processadas: " + batch.successCount());
        if (batch.failureCount() > 0) {
            log("   ❌ Arquivos com erro: " + batch.failureCount());
        }
        log("   💰 Valor total: " + BRL.format(batch.totalServiceValue()));

        statusLabel.setText(batch.cancelled() ? "⏹ Cancelado" : "✅ Concluído");
        statusLabel.setForeground(new Color(0, 128, 0));
        resetControls();
        exportButton.setEnabled(batch.size() > 0);
    }

    private void logInvoice(ProcessingResult result) {
        Invoice invoice = result.invoice();
        log("✅ " + result.sourcePath());
        log("   Número: " + invoice.number());
        log("   Data de Emissão: " + invoice.issueDate().format(DISPLAY_DATE));
        log("   Prestador: " + invoice.provider().legalName());
        log("   " + invoice.provider().taxId().type() + " Prestador: " + invoice.provider().taxId().formatted());
        log("   Tomador: " + invoice.recipient().legalName());
        log("   " + invoice.recipient().taxId().type() + " Tomador: " + invoice.recipient().taxId().formatted());
        log("   Valor: " + BRL.format(invoice.totalServiceValue()));
        if (!invoice.serviceDescription().isEmpty()) {
            log("   Descrição: " + invoice.serviceDescription());
        }
    }

    private void resetControls() {
        setSelectionEnabled(true);
        startButton.setEnabled(!selectedEntries.isEmpty());
        cancelButton.setEnabled(false);
        progressBar.setValue(0);
    }

    private void setSelectionEnabled(boolean enabled) {
        selectFilesButton.setEnabled(enabled);
        selectFolderButton.setEnabled(enabled);
    }

    // =====================
    // Export
    // =====================

    private void exportResults() {
        if (lastBatch == null || lastBatch.size() == 0) {
            JOptionPane.showMessageDialog(this, "Nenhum resultado para exportar.",
                "Sem dados", JOptionPane.WARNING_MESSAGE);
            return;
        }

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Salvar planilha");
        chooser.setSelectedFile(new File(System.getProperty("user.home"), "notas_fiscais_" + timestamp + ".xlsx"));

        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }

        File target = chooser.getSelectedFile();
        if (!target.getName().toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            target = new File(target.getParentFile(), target.getName() + ".xlsx");
        }

        try {
            excelExporter.export(lastBatch, target);
            log("\n✅ Planilha criada: " + target.getAbsolutePath());
            openFileExplorer(target.getParentFile());
        } catch (IOException | RuntimeException e) {
            log("❌ Erro ao exportar: " + e.getMessage());
            JOptionPane.showMessageDialog(this, "Erro ao exportar:\n" + e.getMessage(),
                "Erro de exportação", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void openFileExplorer(File directory) {
        try {
            if (directory != null && Desktop.isDesktopSupported()) {
                Desktop.getDesktop().open(directory);
            }
        } catch (IOException e) {
            log("⚠️ Não foi possível abrir a pasta: " + e.getMessage());
        }
    }

    private void log(String message) {
        SwingUtilities.invokeLater(() -> {
            logArea.append(message + "\n");
            logArea.setCaretPosition(logArea.getDocument().getLength());
        });
    }
}

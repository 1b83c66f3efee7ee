package NfseBot;

import NfseBot.export.ExcelExporter;
import NfseBot.model.Batch;
import NfseBot.model.ExtractionFailure;
import NfseBot.model.Invoice;
import NfseBot.model.Party;
import NfseBot.model.ProcessingResult;
import NfseBot.model.TaxId;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExcelExporterTest {

    // JUnit creates and removes this folder
    @TempDir
    Path tempDir;

    private final ExcelExporter exporter = new ExcelExporter();

    private static Invoice invoice(String number, String value) {
        return new Invoice(number, LocalDate.of(2024, 3, 10),
                new Party("Alfa Consultoria Ltda", TaxId.cnpj("12345678000195")),
                new Party("Maria da Silva", TaxId.cpf("12345678909")),
                new BigDecimal(value), "Consultoria\nmarço");
    }

    @Test
    void testExport_CreatesValidXlsxFile() throws IOException {
        // 1. ARRANGE
        File targetFile = tempDir.resolve("notas.xlsx").toFile();
        Batch batch = new Batch(List.of(
                ProcessingResult.success(tempDir.resolve("nota-123.xml"), invoice("123", "1500.00")),
                ProcessingResult.failure(tempDir.resolve("quebrada.xml"), ExtractionFailure.malformedXml("unexpected EOF"))),
                false);

        // 2. ACT
        exporter.export(batch, targetFile);

        // 3. ASSERT
        assertTrue(targetFile.exists(), "workbook was not written");
        assertTrue(targetFile.length() > 0, "workbook is empty");

        try (FileInputStream fis = new FileInputStream(targetFile);
             Workbook workbook = new XSSFWorkbook(fis)) {

            Sheet sheet = workbook.getSheet(ExcelExporter.INVOICE_SHEET);
            assertNotNull(sheet, "invoice sheet missing");

            // --- header ---
            Row headerRow = sheet.getRow(0);
            assertEquals("Número", headerRow.getCell(1).getStringCellValue());
            assertEquals("Valor dos Serviços", headerRow.getCell(7).getStringCellValue());

            // --- success row ---
            Row row1 = sheet.getRow(1);
            assertEquals("nota-123.xml", row1.getCell(0).getStringCellValue());
            assertNotNull(row1.getCell(0).getHyperlink(), "hyperlink to source file missing");
            assertEquals("123", row1.getCell(1).getStringCellValue());
            assertEquals("10/03/2024", row1.getCell(2).getStringCellValue());
            assertEquals("Alfa Consultoria Ltda", row1.getCell(3).getStringCellValue());
            assertEquals("12.345.678/0001-95", row1.getCell(4).getStringCellValue());
            assertEquals("123.456.789-09", row1.getCell(6).getStringCellValue());
            assertEquals(1500.00, row1.getCell(7).getNumericCellValue(), 0.001);
            assertEquals("Consultoria\nmarço", row1.getCell(8).getStringCellValue());

            // --- failure row ---
            Row row2 = sheet.getRow(2);
            assertEquals("quebrada.xml", row2.getCell(0).getStringCellValue());
            String errorMsg = row2.getCell(1).getStringCellValue();
            assertTrue(errorMsg.startsWith("ERRO:"), "error marker missing");
            assertTrue(errorMsg.contains("unexpected EOF"), "error message missing");
        }
    }

    @Test
    void testExport_SummarySheet() throws IOException {
        File targetFile = tempDir.resolve("resumo.xlsx").toFile();
        Batch batch = new Batch(List.of(
                ProcessingResult.success(tempDir.resolve("a.xml"), invoice("1", "100.50")),
                ProcessingResult.success(tempDir.resolve("b.xml"), invoice("2", "200.25")),
                ProcessingResult.failure(tempDir.resolve("c.xml"), ExtractionFailure.missingField("number"))),
                true);

        exporter.export(batch, targetFile);

        try (Workbook workbook = new XSSFWorkbook(new FileInputStream(targetFile))) {
            Sheet summary = workbook.getSheet(ExcelExporter.SUMMARY_SHEET);
            assertNotNull(summary);

            assertEquals(3, summary.getRow(1).getCell(1).getNumericCellValue(), 0.001);
            assertEquals(2, summary.getRow(2).getCell(1).getNumericCellValue(), 0.001);
            assertEquals(1, summary.getRow(3).getCell(1).getNumericCellValue(), 0.001);
            assertEquals(300.75, summary.getRow(4).getCell(1).getNumericCellValue(), 0.001);
            assertEquals("Sim", summary.getRow(5).getCell(1).getStringCellValue());
        }
    }

    @Test
    void testExport_EmptyBatch() throws IOException {
        File targetFile = tempDir.resolve("vazio.xlsx").toFile();

        exporter.export(new Batch(List.of(), false), targetFile);

        try (Workbook workbook = new XSSFWorkbook(new FileInputStream(targetFile))) {
            Sheet sheet = workbook.getSheet(ExcelExporter.INVOICE_SHEET);
            assertEquals(0, sheet.getLastRowNum());
            assertEquals(0, workbook.getSheet(ExcelExporter.SUMMARY_SHEET).getRow(4).getCell(1).getNumericCellValue(), 0.001);
        }
    }

    @Test
    void testExport_LongTextIsCutToCellLimit() throws IOException {
        File targetFile = tempDir.resolve("longa.xlsx").toFile();
        String description = "x".repeat(40_000);
        Invoice longInvoice = new Invoice("7", LocalDate.of(2024, 3, 10),
                new Party("Alfa Consultoria Ltda", TaxId.cnpj("12345678000195")),
                new Party("Maria da Silva", TaxId.cpf("12345678909")),
                new BigDecimal("10.00"), description);
        Batch batch = new Batch(List.of(
                ProcessingResult.success(tempDir.resolve("longa.xml"), longInvoice),
                ProcessingResult.failure(tempDir.resolve("erro.xml"),
                        ExtractionFailure.numberFormat("totalServiceValue", "9".repeat(40_000), "not a number"))),
                false);

        exporter.export(batch, targetFile);

        try (Workbook workbook = new XSSFWorkbook(new FileInputStream(targetFile))) {
            Sheet sheet = workbook.getSheet(ExcelExporter.INVOICE_SHEET);
            String written = sheet.getRow(1).getCell(8).getStringCellValue();
            assertEquals(32_767, written.length());
            assertTrue(written.startsWith("xxxx"));
            assertTrue(written.endsWith("[...]"), "cut text is marked");

            String error = sheet.getRow(2).getCell(1).getStringCellValue();
            assertTrue(error.startsWith("ERRO:"));
            assertTrue(error.length() <= 32_767);
        }
    }

    @Test
    void testExport_LargeBatchSharesCellStyles() throws IOException {
        File targetFile = tempDir.resolve("grande.xlsx").toFile();
        List<ProcessingResult> results = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            results.add(ProcessingResult.success(tempDir.resolve("nota-" + i + ".xml"), invoice(String.valueOf(i), "1.00")));
        }

        exporter.export(new Batch(results, false), targetFile);

        try (Workbook workbook = new XSSFWorkbook(new FileInputStream(targetFile))) {
            assertEquals(500, workbook.getSheet(ExcelExporter.INVOICE_SHEET).getLastRowNum());
            assertTrue(workbook.getNumCellStyles() < 10, "styles are created per workbook, not per row");
            Cell link = workbook.getSheet(ExcelExporter.INVOICE_SHEET).getRow(500).getCell(0);
            assertNotNull(link.getHyperlink());
            assertEquals(workbook.getSheet(ExcelExporter.INVOICE_SHEET).getRow(1).getCell(0).getCellStyle().getIndex(),
                    link.getCellStyle().getIndex());
        }
    }
}

package NfseBot.export;

import NfseBot.model.Batch;
import NfseBot.model.Invoice;
import NfseBot.model.ProcessingResult;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;

/**
 * Exporta o resultado de um lote para Excel.
 * Cria uma planilha com uma linha por arquivo e uma aba de resumo.
 *
 * Exports a processed batch to an XLSX workbook: one row per file (failures flagged "ERRO:")
 * plus a summary sheet.
 */
public class ExcelExporter {

    private static final Logger log = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String INVOICE_SHEET = "Notas Fiscais";
    public static final String SUMMARY_SHEET = "Resumo";

    private static final String[] COLUMN_HEADERS = {
        "Arquivo",
        "Número",
        "Data de Emissão",
        "Prestador",
        "CPF/CNPJ Prestador",
        "Tomador",
        "CPF/CNPJ Tomador",
        "Valor dos Serviços",
        "Discriminação"
    };

    private static final int VALUE_COLUMN = 7;
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    private static final String TRUNCATION_MARK = " [...]";

    public void export(Batch batch, File targetFile) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(INVOICE_SHEET);

            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle dataStyle = createDataStyle(workbook);
            CellStyle amountStyle = createAmountStyle(workbook, dataStyle);
            CellStyle linkStyle = createLinkStyle(workbook, dataStyle);

            createHeaderRow(sheet, headerStyle);
            fillDataRows(sheet, batch, dataStyle, amountStyle, linkStyle);
            autoSizeColumns(sheet);

            createSummarySheet(workbook, batch, headerStyle, dataStyle, amountStyle);

            writeToFile(workbook, targetFile);
        }
        log.info("Exported {} result(s) to {}", batch.size(), targetFile);
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();

        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 12);
        style.setFont(font);

        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        setThinBorders(style);

        return style;
    }

    private CellStyle createDataStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        setThinBorders(style);
        return style;
    }

    private CellStyle createAmountStyle(Workbook workbook, CellStyle base) {
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(base);
        style.setDataFormat(workbook.createDataFormat().getFormat("#,##0.00"));
        return style;
    }

    private CellStyle createLinkStyle(Workbook workbook, CellStyle base) {
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(base);
        Font font = workbook.createFont();
        font.setUnderline(Font.U_SINGLE);
        font.setColor(IndexedColors.BLUE.getIndex());
        style.setFont(font);
        return style;
    }

    private void setThinBorders(CellStyle style) {
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }

    private void createHeaderRow(Sheet sheet, CellStyle headerStyle) {
        Row headerRow = sheet.createRow(0);

        for (int i = 0; i < COLUMN_HEADERS.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(COLUMN_HEADERS[i]);
            cell.setCellStyle(headerStyle);
        }
    }

    private void fillDataRows(Sheet sheet, Batch batch, CellStyle dataStyle, CellStyle amountStyle,
                              CellStyle linkStyle) {
        int rowNum = 1;

        for (ProcessingResult result : batch.results()) {
            Row row = sheet.createRow(rowNum++);

            if (result.isSuccess()) {
                fillSuccessRow(row, result, dataStyle, amountStyle, linkStyle);
            } else {
                fillErrorRow(row, result, dataStyle, linkStyle);
            }
        }
    }

    private void fillSuccessRow(Row row, ProcessingResult result, CellStyle dataStyle, CellStyle amountStyle,
                                CellStyle linkStyle) {
        Invoice invoice = result.invoice();

        createCellWithHyperlink(row, 0, result, dataStyle, linkStyle);
        createCell(row, 1, invoice.number(), dataStyle);
        createCell(row, 2, invoice.issueDate().format(DISPLAY_DATE), dataStyle);
        createCell(row, 3, invoice.provider().legalName(), dataStyle);
        createCell(row, 4, invoice.provider().taxId().formatted(), dataStyle);
        createCell(row, 5, invoice.recipient().legalName(), dataStyle);
        createCell(row, 6, invoice.recipient().taxId().formatted(), dataStyle);

        Cell value = row.createCell(VALUE_COLUMN);
        value.setCellValue(invoice.totalServiceValue().doubleValue());
        value.setCellStyle(amountStyle);

        createCell(row, 8, invoice.serviceDescription(), dataStyle);
    }

    private void fillErrorRow(Row row, ProcessingResult result, CellStyle dataStyle, CellStyle linkStyle) {
        createCellWithHyperlink(row, 0, result, dataStyle, linkStyle);
        createCell(row, 1, "ERRO: " + result.failure().describe(), dataStyle);

        for (int i = 2; i < COLUMN_HEADERS.length; i++) {
            createCell(row, i, "", dataStyle);
        }
    }

    private void createSummarySheet(Workbook workbook, Batch batch, CellStyle headerStyle,
                                    CellStyle dataStyle, CellStyle amountStyle) {
        Sheet sheet = workbook.createSheet(SUMMARY_SHEET);

        Row header = sheet.createRow(0);
        createCell(header, 0, "Resumo", headerStyle);
        createCell(header, 1, "", headerStyle);

        addSummaryRow(sheet, 1, "Arquivos processados", batch.size(), dataStyle);
        addSummaryRow(sheet, 2, "Notas extraídas", batch.successCount(), dataStyle);
        addSummaryRow(sheet, 3, "Arquivos com erro", batch.failureCount(), dataStyle);

        Row totalRow = sheet.createRow(4);
        createCell(totalRow, 0, "Valor total dos serviços", dataStyle);
        Cell total = totalRow.createCell(1);
        total.setCellValue(batch.totalServiceValue().doubleValue());
        total.setCellStyle(amountStyle);

        Row cancelledRow = sheet.createRow(5);
        createCell(cancelledRow, 0, "Lote cancelado", dataStyle);
        createCell(cancelledRow, 1, batch.cancelled() ? "Sim" : "Não", dataStyle);

        sheet.autoSizeColumn(0);
        sheet.autoSizeColumn(1);
    }

    private void addSummaryRow(Sheet sheet, int rowIndex, String label, long value, CellStyle style) {
        Row row = sheet.createRow(rowIndex);
        createCell(row, 0, label, style);
        Cell cell = row.createCell(1);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private void createCell(Row row, int columnIndex, String value, CellStyle style) {
        Cell cell = row.createCell(columnIndex);
        cell.setCellValue(fitToCell(value));
        cell.setCellStyle(style);
    }

    /** XLSX cells hold at most 32,767 characters; longer text is cut and marked. */
    static String fitToCell(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= MAX_CELL_TEXT) {
            return value;
        }
        return value.substring(0, MAX_CELL_TEXT - TRUNCATION_MARK.length()) + TRUNCATION_MARK;
    }

    private void createCellWithHyperlink(Row row, int columnIndex, ProcessingResult result, CellStyle style,
                                         CellStyle linkStyle) {
        Cell cell = row.createCell(columnIndex);
        cell.setCellValue(fitToCell(result.getFileName()));

        try {
            Workbook workbook = row.getSheet().getWorkbook();
            Hyperlink link = workbook.getCreationHelper().createHyperlink(HyperlinkType.FILE);
            link.setAddress(result.sourcePath().toUri().toString());
            cell.setHyperlink(link);
            cell.setCellStyle(linkStyle);
        } catch (RuntimeException e) {
            cell.setCellStyle(style);
            log.warn("Could not create hyperlink for {}: {}", result.sourcePath(), e.getMessage());
        }
    }

    private void autoSizeColumns(Sheet sheet) {
        for (int i = 0; i < COLUMN_HEADERS.length; i++) {
            sheet.autoSizeColumn(i);
            int currentWidth = sheet.getColumnWidth(i);
            sheet.setColumnWidth(i, Math.min(currentWidth + 1000, 255 * 256));
        }
    }

    private void writeToFile(Workbook workbook, File targetFile) throws IOException {
        try (FileOutputStream fileOut = new FileOutputStream(targetFile)) {
            workbook.write(fileOut);
        }
    }
}

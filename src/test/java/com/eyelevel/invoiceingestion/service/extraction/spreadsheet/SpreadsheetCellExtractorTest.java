package com.eyelevel.invoiceingestion.service.extraction.spreadsheet;

import com.eyelevel.invoiceingestion.model.CellReference;
import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FieldDefinition;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SpreadsheetCellExtractorTest {

    @TempDir
    Path tempDir;

    private final SpreadsheetCellExtractor extractor = new SpreadsheetCellExtractor();
    private Path workbook;

    @BeforeEach
    void setUp() throws IOException {
        workbook = tempDir.resolve("statement.xlsx");
        try (Workbook book = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(workbook)) {
            final Sheet summary = book.createSheet("Summary");
            cell(summary, 0, 0, "Invoice");
            cell(summary, 1, 0, "Account");
            cell(summary, 1, 1, "ACC-7781");
            cell(summary, 2, 0, "Date");
            cell(summary, 2, 1, "05/01/2024");
            final Row total = summary.createRow(4);
            total.createCell(0).setCellValue("Total");
            total.createCell(1).setCellFormula("100+23.45");
            final Sheet lines = book.createSheet("Lines");
            cell(lines, 0, 0, "PO-991");
            book.write(out);
        }
    }

    @Test
    void readsCellsByAddressAcrossSheets() throws IOException {
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("account_number", cellAt("b", 2, null));
        fields.put("date", cellAt("B", 3, ""));
        fields.put("grand_total", cellAt("B", 5, "Summary"));
        fields.put("po_number", cellAt("A", 1, "Lines"));

        final ExtractionResult result = extractor.extract(workbook, template(fields), context());

        assertThat(result.fields()).containsEntry("accountNumber", "ACC-7781")
                                   .containsEntry("invoiceDate", "05/01/2024")
                                   .containsEntry("totalAmount", "123.45")
                                   .containsEntry("customerPO", "PO-991");
        assertThat(result.processingMethod()).isEqualTo(ProcessingMethod.SPREADSHEET_CELLS);
    }

    @Test
    void unknownSheetIsWarnedAndEmptyCellIsLeftOut() throws IOException {
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("vatAmount", cellAt("B", 5, "Taxes"));
        fields.put("customerName", cellAt("Z", 40, null));

        final ExtractionResult result = extractor.extract(workbook, template(fields), context());

        assertThat(result.fields()).isEmpty();
        assertThat(result.warnings()).containsExactly("sheet_not_found:vatAmount");
    }

    @Test
    void readTextJoinsEveryNonEmptyRow() throws IOException {
        final String text = extractor.readText(workbook);

        assertThat(text).contains("Invoice").contains("Account ACC-7781").contains("PO-991");
    }

    private static void cell(final Sheet sheet, final int row, final int column, final String value) {
        final Row target = sheet.getRow(row) == null ? sheet.createRow(row) : sheet.getRow(row);
        target.createCell(column).setCellValue(value);
    }

    private static FieldDefinition cellAt(final String column, final int row, final String sheet) {
        return FieldDefinition.builder()
                              .cell(CellReference.builder().column(column).row(row).sheet(sheet).build())
                              .build();
    }

    private static ExtractionTemplate template(final Map<String, FieldDefinition> fields) {
        return ExtractionTemplate.builder()
                                 .id(3L)
                                 .name("Statement sheet")
                                 .code("stmt-sheet")
                                 .documentType(DocumentType.STATEMENT)
                                 .fileKind(FileKind.SPREADSHEET)
                                 .fieldDefinitions(fields)
                                 .build();
    }

    private static ExtractionContext context() {
        return new ExtractionContext("statement.xlsx", "abc", DocumentType.STATEMENT);
    }
}

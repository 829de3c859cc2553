package com.eyelevel.invoiceingestion.service.extraction.spreadsheet;

import com.eyelevel.invoiceingestion.model.CellReference;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.service.extraction.DocumentExtractor;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.TemplateFieldCollector;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts template fields from XLS/XLSX workbooks by cell address, formatting each cell the way it is
 * displayed in the spreadsheet.
 */
@Slf4j
@Component
public class SpreadsheetCellExtractor implements DocumentExtractor {

    @Override
    public boolean supports(FileKind fileKind) {
        return fileKind == FileKind.SPREADSHEET;
    }

    @Override
    public String readText(Path file) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            final DataFormatter formatter = new DataFormatter();
            final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            final StringBuilder text = new StringBuilder();
            for (Sheet sheet : workbook) {
                for (Row row : sheet) {
                    final List<String> values = new ArrayList<>();
                    for (Cell cell : row) {
                        final String value = formatter.formatCellValue(cell, evaluator).trim();
                        if (!value.isEmpty()) {
                            values.add(value);
                        }
                    }
                    if (!values.isEmpty()) {
                        text.append(String.join(" ", values)).append('\n');
                    }
                }
            }
            return text.toString();
        }
    }

    @Override
    public ExtractionResult extract(Path file, ExtractionTemplate template, ExtractionContext context)
            throws IOException {
        log.info("[Template: {}] Reading {} cell(s) from '{}'.", template.getCode(),
                 template.getFieldDefinitions().size(), context.fileName());
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            final DataFormatter formatter = new DataFormatter();
            final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            final TemplateFieldCollector.Collected collected = TemplateFieldCollector.collect(
                    template, (name, definition, warnings) -> {
                        final CellReference reference = definition.getCell();
                        if (reference == null || !reference.isWellFormed()) {
                            log.debug("[Template: {}] Field '{}' has no usable cell. Skipping.",
                                      template.getCode(), name);
                            return null;
                        }
                        final Sheet sheet = sheetFor(workbook, reference);
                        if (sheet == null) {
                            warnings.add("sheet_not_found:" + name);
                            return null;
                        }
                        final Row row = sheet.getRow(reference.getRow() - 1);
                        if (row == null) {
                            return null;
                        }
                        final int column = org.apache.poi.ss.util.CellReference
                                .convertColStringToIndex(reference.getColumn().toUpperCase());
                        final Cell cell = row.getCell(column);
                        return cell == null ? null : formatter.formatCellValue(cell, evaluator);
                    });
            return new ExtractionResult(collected.fields(), collected.fullText(), ProcessingMethod.SPREADSHEET_CELLS,
                                        collected.warnings(), template.getId(), context.detectedType());
        }
    }

    private static Sheet sheetFor(final Workbook workbook, final CellReference reference) {
        if (reference.getSheet() == null || reference.getSheet().isBlank()) {
            return workbook.getNumberOfSheets() > 0 ? workbook.getSheetAt(0) : null;
        }
        return workbook.getSheet(reference.getSheet());
    }
}

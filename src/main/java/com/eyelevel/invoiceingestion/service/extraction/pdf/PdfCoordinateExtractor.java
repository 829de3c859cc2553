package com.eyelevel.invoiceingestion.service.extraction.pdf;

import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.model.TemplateRegion;
import com.eyelevel.invoiceingestion.service.extraction.DocumentExtractor;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.TemplateFieldCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts template fields from a PDF by selecting the words that fall inside each field's region.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfCoordinateExtractor implements DocumentExtractor {

    private final PageLayoutCache pageLayoutCache;

    @Override
    public boolean supports(FileKind fileKind) {
        return fileKind == FileKind.PDF;
    }

    @Override
    public String readText(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document);
        }
    }

    @Override
    public ExtractionResult extract(Path file, ExtractionTemplate template, ExtractionContext context)
            throws IOException {
        log.info("[Template: {}] Extracting {} field(s) from '{}'.", template.getCode(),
                 template.getFieldDefinitions().size(), context.fileName());
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            final int pageCount = document.getNumberOfPages();
            final TemplateFieldCollector.Collected collected = TemplateFieldCollector.collect(
                    template, (name, definition, warnings) -> {
                        final TemplateRegion region = definition.getRegion();
                        if (region == null) {
                            log.debug("[Template: {}] Field '{}' has no region. Skipping.", template.getCode(), name);
                            return null;
                        }
                        final int page = pageFor(name, region, pageCount);
                        if (page > pageCount) {
                            warnings.add("page_out_of_range:" + name);
                            return null;
                        }
                        final PageLayout layout = context.contentDigest() == null
                                ? PdfTextLayoutReader.readPage(document, page)
                                : pageLayoutCache.getOrLoad(PageLayoutCache.key(context.contentDigest(), page),
                                                            () -> PdfTextLayoutReader.readPage(document, page));
                        return RegionSelector.select(layout, region);
                    });
            log.debug("[Template: {}] Extracted {} value(s) from '{}'.", template.getCode(),
                      collected.fields().size(), context.fileName());
            return new ExtractionResult(collected.fields(), collected.fullText(), ProcessingMethod.LOCAL_COORDINATES,
                                        collected.warnings(), template.getId(), context.detectedType());
        }
    }

    /**
     * Totals usually sit on the final page of multi-page documents, so amount regions flagged
     * {@code lastPage} are read there rather than on page 1.
     */
    static int pageFor(final String fieldName, final TemplateRegion region, final int pageCount) {
        if (region.isLastPage() && region.getPage() == 1 && pageCount > 1
            && TemplateFieldCollector.isAmountField(fieldName)) {
            return pageCount;
        }
        return region.getPage();
    }
}

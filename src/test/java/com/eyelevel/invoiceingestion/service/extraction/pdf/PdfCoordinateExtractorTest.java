package com.eyelevel.invoiceingestion.service.extraction.pdf;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FieldDefinition;
import com.eyelevel.invoiceingestion.model.FieldTransformations;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.model.TemplateRegion;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.TemplateFieldCollector;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfCoordinateExtractorTest {

    // 1000 x 1000 pages: a word drawn at (x, y) normalises to (x / 1000, 1 - y / 1000)
    private static final PDRectangle PAGE = new PDRectangle(1000, 1000);

    @TempDir
    Path tempDir;

    private PageLayoutCache cache;
    private PdfCoordinateExtractor extractor;

    @BeforeEach
    void setUp() {
        cache = new PageLayoutCache(8);
        extractor = new PdfCoordinateExtractor(cache);
    }

    @Test
    void readsFieldsFromRegions() throws IOException {
        final Path pdf = writePdf("invoice.pdf", List.of(List.of(
                new Word("INVOICE", 100, 950),
                new Word("ACC-12345", 700, 900),
                new Word("12/03/2024", 700, 850),
                new Word("£1,234.50", 700, 200))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("total", region(0.6, 0.75, 0.95, 0.85, 1, false));
        fields.put("Account No", region(0.6, 0.05, 0.95, 0.12, 1, false));
        fields.put("invoice_date", FieldDefinition.builder()
                                                  .region(TemplateRegion.builder().left(0.6).top(0.12).right(0.95)
                                                                        .bottom(0.18).build())
                                                  .transformations(FieldTransformations.builder().reformatDate(true)
                                                                                       .build())
                                                  .build());

        final ExtractionResult result = extractor.extract(pdf, template(fields), context());

        assertThat(result.fields()).containsEntry("accountNumber", "ACC-12345")
                                   .containsEntry("invoiceDate", "2024-03-12")
                                   .containsEntry("totalAmount", "1234.50");
        assertThat(result.processingMethod()).isEqualTo(ProcessingMethod.LOCAL_COORDINATES);
        assertThat(result.templateId()).isEqualTo(7L);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void lastPageAmountRegionReadsFinalPage() throws IOException {
        final Path pdf = writePdf("two-pages.pdf", List.of(
                List.of(new Word("Carried", 700, 200)),
                List.of(new Word("99.00", 700, 200))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("totalAmount", region(0.6, 0.75, 0.95, 0.85, 1, true));

        final ExtractionResult result = extractor.extract(pdf, template(fields), context());

        assertThat(result.fields()).containsEntry("totalAmount", "99.00");
    }

    @Test
    void pageBeyondDocumentIsWarnedAndSkipped() throws IOException {
        final Path pdf = writePdf("one-page.pdf", List.of(List.of(new Word("ACC-1", 700, 900))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("vatAmount", region(0.6, 0.75, 0.95, 0.85, 3, false));

        final ExtractionResult result = extractor.extract(pdf, template(fields), context());

        assertThat(result.fields()).doesNotContainKey("vatAmount");
        assertThat(result.warnings()).contains("page_out_of_range:vatAmount");
    }

    @Test
    void missingCrucialFieldStopsExtraction() throws IOException {
        final Path pdf = writePdf("blank-account.pdf", List.of(List.of(new Word("£50.00", 700, 200))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("accountNumber", region(0.6, 0.05, 0.95, 0.12, 1, false));
        fields.put("totalAmount", region(0.6, 0.75, 0.95, 0.85, 1, false));

        final ExtractionResult result = extractor.extract(pdf, template(fields), context());

        assertThat(result.fields()).isEmpty();
        assertThat(result.warnings()).containsExactly(TemplateFieldCollector.MISSING_CRUCIAL_FIELDS + ": accountNumber");
    }

    @Test
    void pagesAreParsedOncePerDocument() throws IOException {
        final Path pdf = writePdf("cached.pdf", List.of(List.of(new Word("ACC-9", 700, 900),
                                                                 new Word("10.00", 700, 200))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("accountNumber", region(0.6, 0.05, 0.95, 0.12, 1, false));
        fields.put("totalAmount", region(0.6, 0.75, 0.95, 0.85, 1, false));

        extractor.extract(pdf, template(fields), context());

        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void documentsWithoutFingerprintAreReadFresh() throws IOException {
        final Path first = writePdf("a.pdf", List.of(List.of(new Word("ACC-AAAA", 700, 900))));
        final Path second = writePdf("b.pdf", List.of(List.of(new Word("ACC-BBBB", 700, 900))));
        final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("accountNumber", region(0.6, 0.05, 0.95, 0.12, 1, false));
        final ExtractionContext unfingerprinted = new ExtractionContext("upload.pdf", null, DocumentType.INVOICE);

        final ExtractionResult a = extractor.extract(first, template(fields), unfingerprinted);
        final ExtractionResult b = extractor.extract(second, template(fields), unfingerprinted);

        assertThat(a.fields()).containsEntry("accountNumber", "ACC-AAAA");
        assertThat(b.fields()).containsEntry("accountNumber", "ACC-BBBB");
        assertThat(cache.size()).isZero();
    }

    @Test
    void cacheKeyRequiresFingerprint() {
        assertThat(PageLayoutCache.key("abc", 2)).isEqualTo("abc-2");
        assertThatThrownBy(() -> PageLayoutCache.key(null, 1)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void readsPlainTextForClassification() throws IOException {
        final Path pdf = writePdf("text.pdf", List.of(List.of(new Word("CREDIT", 100, 900),
                                                               new Word("NOTE", 300, 900))));

        assertThat(extractor.readText(pdf)).contains("CREDIT").contains("NOTE");
    }

    private Path writePdf(final String name, final List<List<Word>> pages) throws IOException {
        final Path file = tempDir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            final PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<Word> words : pages) {
                final PDPage page = new PDPage(PAGE);
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    for (Word word : words) {
                        stream.beginText();
                        stream.setFont(font, 12);
                        stream.newLineAtOffset(word.x(), word.y());
                        stream.showText(word.text());
                        stream.endText();
                    }
                }
            }
            document.save(file.toFile());
        }
        return file;
    }

    private static FieldDefinition region(double left, double top, double right, double bottom, int page,
                                          boolean lastPage) {
        return FieldDefinition.builder()
                              .region(TemplateRegion.builder().left(left).top(top).right(right).bottom(bottom)
                                                    .page(page).lastPage(lastPage).build())
                              .build();
    }

    private static ExtractionTemplate template(final Map<String, FieldDefinition> fields) {
        return ExtractionTemplate.builder()
                                 .id(7L)
                                 .name("Acme invoice")
                                 .code("acme-inv")
                                 .documentType(DocumentType.INVOICE)
                                 .fileKind(FileKind.PDF)
                                 .fieldDefinitions(fields)
                                 .build();
    }

    private static ExtractionContext context() {
        return new ExtractionContext("invoice.pdf", "digest-" + System.nanoTime(), DocumentType.INVOICE);
    }

    private record Word(String text, float x, float y) {
    }
}

package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionContext;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionOutcome;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.FieldExtractionService;
import com.eyelevel.invoiceingestion.service.hash.ContentHasher;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.BulkParsingTestPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkParsingTestJobHandlerTest {

    @Mock
    private FieldExtractionService fieldExtractionService;

    @TempDir
    Path tempDir;

    private final ContentHasher contentHasher = new ContentHasher();
    private BulkParsingTestJobHandler handler;

    @BeforeEach
    void setUp() {
        handler = new BulkParsingTestJobHandler(fieldExtractionService, contentHasher);
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportsExtractedFieldsWithoutPersisting() throws Exception {
        final Path file = Files.writeString(tempDir.resolve("acme.pdf"), "%PDF");
        final ExtractionResult extracted = new ExtractionResult(Map.of("accountNumber", "ACC-1"), "Invoice ACC-1",
                                                                ProcessingMethod.LOCAL_COORDINATES, List.of(), 8L,
                                                                DocumentType.INVOICE);
        final ExtractionContext fingerprinted = new ExtractionContext("acme.pdf", contentHasher.digest(file), null);
        when(fieldExtractionService.extract(file, FileKind.PDF, fingerprinted, true))
                .thenReturn(new ExtractionOutcome(DocumentType.INVOICE, null, extracted, 72, "Invoice ACC-1 total"));

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload(file, "acme.pdf"));

        assertThat(result).containsEntry("success", true)
                          .containsEntry("testId", "t-1")
                          .containsEntry("documentType", "invoice")
                          .containsEntry("processingMethod", "local_coordinates")
                          .containsEntry("templateId", 8L)
                          .containsEntry("confidence", 72)
                          .containsEntry("wordCount", 4);
        assertThat((Map<String, String>) result.get("fields")).containsEntry("accountNumber", "ACC-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingFileIsReportedAsFailure() {
        final Map<String, Object> result = (Map<String, Object>) handler.handle(
                context(), payload(tempDir.resolve("nope.pdf"), "nope.pdf"));

        assertThat(result).containsEntry("success", false);
        assertThat((String) result.get("error")).startsWith("File not found");
        verifyNoInteractions(fieldExtractionService);
    }

    @Test
    @SuppressWarnings("unchecked")
    void unsupportedTypeIsReportedAsFailure() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("memo.docx"), "x");

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload(file, "memo.docx"));

        assertThat(result).containsEntry("error", "Unsupported file type: memo.docx");
    }

    @Test
    @SuppressWarnings("unchecked")
    void extractionErrorIsReportedNotThrown() throws Exception {
        final Path file = Files.writeString(tempDir.resolve("broken.pdf"), "garbage");
        when(fieldExtractionService.extract(eq(file), eq(FileKind.PDF), any(ExtractionContext.class), eq(true)))
                .thenThrow(new IOException("Header doesn't contain versioninfo"));

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload(file, "broken.pdf"));

        assertThat(result).containsEntry("success", false)
                          .containsEntry("error", "Header doesn't contain versioninfo");
    }

    @Test
    void eachFileIsExtractedUnderItsOwnFingerprint() throws Exception {
        final Path first = Files.writeString(tempDir.resolve("a.pdf"), "%PDF first");
        final Path second = Files.writeString(tempDir.resolve("b.pdf"), "%PDF second");
        final ExtractionResult extracted = new ExtractionResult(Map.of(), "", ProcessingMethod.BASIC_REGEX, List.of(),
                                                                null, DocumentType.INVOICE);
        when(fieldExtractionService.extract(any(Path.class), eq(FileKind.PDF), any(ExtractionContext.class),
                                            eq(true)))
                .thenReturn(new ExtractionOutcome(DocumentType.INVOICE, null, extracted, 0, ""));

        handler.handle(context(), payload(first, "a.pdf"));
        handler.handle(context(), payload(second, "b.pdf"));

        final ArgumentCaptor<ExtractionContext> contexts = ArgumentCaptor.forClass(ExtractionContext.class);
        verify(fieldExtractionService, times(2)).extract(any(Path.class), eq(FileKind.PDF), contexts.capture(),
                                                         eq(true));
        assertThat(contexts.getAllValues()).extracting(ExtractionContext::contentDigest)
                                           .containsExactly(contentHasher.digest(first),
                                                            contentHasher.digest(second))
                                           .doesNotHaveDuplicates();
    }

    private static BulkParsingTestPayload payload(final Path file, final String name) {
        return new BulkParsingTestPayload(file.toString(), name, "t-1");
    }

    private static JobContext context() {
        return new JobContext(2L, QueueName.BULK_PARSING_TEST, "parsing-test", 1, 2, null);
    }
}

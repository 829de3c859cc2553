package com.eyelevel.invoiceingestion.service.pipeline;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import com.eyelevel.invoiceingestion.model.Company;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.FailureReason;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.model.ProcessingMethod;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionOutcome;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import com.eyelevel.invoiceingestion.service.extraction.FieldExtractionService;
import com.eyelevel.invoiceingestion.service.matching.CompanyDocumentService;
import com.eyelevel.invoiceingestion.service.matching.EntityMatcher;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import com.eyelevel.invoiceingestion.service.routing.FileRouter;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettings;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.LocalSourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import com.eyelevel.invoiceingestion.service.template.TemplateResolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvoiceImportPipelineTest {

    private static final String DIGEST = "ab".repeat(32);

    @TempDir
    Path root;

    @Mock
    private PipelineSettingsProvider settingsProvider;
    @Mock
    private DocumentRecordService documentRecordService;
    @Mock
    private FieldExtractionService fieldExtractionService;
    @Mock
    private EntityMatcher entityMatcher;
    @Mock
    private CompanyDocumentService companyDocumentService;
    @Mock
    private SourceConnectorFactory connectorFactory;
    @Mock
    private ImportBatchService importBatchService;

    private InvoiceImportPipeline pipeline;
    private SourceLayout layout;
    private final DocumentRecord processing = DocumentRecord.builder().id(11L).status(DocumentStatus.PROCESSING)
                                                            .build();

    @BeforeEach
    void setUp() throws IOException {
        pipeline = new InvoiceImportPipeline(settingsProvider, documentRecordService, fieldExtractionService,
                                             entityMatcher, companyDocumentService, new FileRouter(),
                                             connectorFactory, importBatchService);
        layout = SourceLayout.of(root.toString().replace('\\', '/'), null, new IngestionProperties.FolderStructure());
        Files.createDirectories(Path.of(layout.unprocessed()));
        lenient().when(settingsProvider.current()).thenReturn(
                new PipelineSettings(SourceKind.LOCAL, List.of(layout), Set.of("pdf"), Duration.ZERO,
                                     Duration.ZERO, null, root.resolve("staging").toString()));
        lenient().when(connectorFactory.getConnector(SourceKind.LOCAL)).thenReturn(new LocalSourceConnector());
    }

    @Test
    void parsedDocumentIsLinkedToCompanyAndRouted() throws IOException {
        final InvoiceImportPayload payload = payload("inv-1.pdf");
        final ExtractionOutcome outcome = outcome(Map.of("accountNumber", "0042", "totalAmount", "10.00",
                                                         "invoiceNumber", "INV-1", "vatAmount", "2.00",
                                                         "customerPO", "PO-1"));
        final Company company = Company.builder().id(5L).name("Globex").build();
        givenProcessing(payload);
        when(fieldExtractionService.extract(any(), eq(FileKind.PDF), any(), eq(false))).thenReturn(outcome);
        when(entityMatcher.match("0042")).thenReturn(Optional.of(company));
        when(documentRecordService.markParsed(11L, outcome, 5L, null))
                .thenReturn(DocumentRecord.builder().id(11L).status(DocumentStatus.PARSED).build());

        final ImportOutcome result = pipeline.run(context(1, 2), payload);

        assertThat(result.status()).isEqualTo(DocumentStatus.PARSED);
        assertThat(result.fileLocation()).isEqualTo(layout.processed() + "/" + LocalDate.now() + "/inv-1.pdf");
        verify(companyDocumentService).upsert(processing, company, DocumentType.INVOICE, outcome.result());
        verify(documentRecordService).updateFileLocation(11L, result.fileLocation());
    }

    @Test
    void missingAccountNumberSettlesUnallocated() throws IOException {
        final InvoiceImportPayload payload = payload("inv-2.pdf");
        final ExtractionOutcome outcome = outcome(Map.of("invoiceNumber", "INV-2"));
        givenProcessing(payload);
        when(fieldExtractionService.extract(any(), any(), any(), eq(false))).thenReturn(outcome);
        when(documentRecordService.markUnallocated(11L, outcome, FailureReason.MISSING_FIELDS,
                                                   "Missing accountNumber, totalAmount, vatAmount, customerPO"))
                .thenReturn(DocumentRecord.builder().id(11L).status(DocumentStatus.UNALLOCATED)
                                          .failureReason(FailureReason.MISSING_FIELDS).build());

        final ImportOutcome result = pipeline.run(context(1, 2), payload);

        assertThat(result.status()).isEqualTo(DocumentStatus.UNALLOCATED);
        assertThat(result.failureReason()).isEqualTo(FailureReason.MISSING_FIELDS);
        verifyNoInteractions(entityMatcher, companyDocumentService);
    }

    @Test
    void unknownCompanySettlesUnallocated() throws IOException {
        final InvoiceImportPayload payload = payload("inv-3.pdf");
        final ExtractionOutcome outcome = outcome(Map.of("accountNumber", "9999"));
        givenProcessing(payload);
        when(fieldExtractionService.extract(any(), any(), any(), eq(false))).thenReturn(outcome);
        when(entityMatcher.match("9999")).thenReturn(Optional.empty());
        when(documentRecordService.markUnallocated(eq(11L), eq(outcome), eq(FailureReason.NO_COMPANY_MATCH),
                                                   anyString()))
                .thenReturn(DocumentRecord.builder().id(11L).status(DocumentStatus.UNALLOCATED)
                                          .failureReason(FailureReason.NO_COMPANY_MATCH).build());

        assertThat(pipeline.run(context(1, 2), payload).failureReason()).isEqualTo(FailureReason.NO_COMPANY_MATCH);
    }

    @Test
    void failureBeforeLastAttemptLeavesFileForRetry() throws IOException {
        final InvoiceImportPayload payload = payload("inv-4.pdf");
        givenProcessing(payload);
        when(fieldExtractionService.extract(any(), any(), any(), eq(false))).thenThrow(new IOException("corrupt xref"));

        assertThatThrownBy(() -> pipeline.run(context(1, 2), payload)).isInstanceOf(IOException.class);

        verify(documentRecordService).markFailed(11L, "corrupt xref");
        assertThat(Path.of(payload.localPath())).exists();
    }

    @Test
    void failureOnLastAttemptRoutesToFailedFolder() throws IOException {
        final InvoiceImportPayload payload = payload("inv-5.pdf");
        givenProcessing(payload);
        when(fieldExtractionService.extract(any(), any(), any(), eq(false))).thenThrow(new IOException("corrupt xref"));

        assertThatThrownBy(() -> pipeline.run(context(2, 2), payload)).isInstanceOf(IOException.class);

        final Path failed = Path.of(layout.failed(), LocalDate.now().toString(), "inv-5.pdf");
        assertThat(failed).exists();
        assertThat(Path.of(failed + ".error.txt")).content().contains("corrupt xref");
    }

    @Test
    void unsupportedFileTypeFailsImmediately() throws IOException {
        final InvoiceImportPayload payload = payload("notes.docx");
        givenProcessing(payload);

        assertThatThrownBy(() -> pipeline.run(context(1, 3), payload)).isInstanceOf(UnrecoverableJobException.class);

        assertThat(Path.of(layout.failed(), LocalDate.now().toString(), "notes.docx")).exists();
    }

    @Test
    void replayOfSettledFileOnlyFinishesRouting() throws IOException {
        final InvoiceImportPayload payload = payload("inv-6.pdf");
        when(documentRecordService.findSettled(DIGEST, "inv-6.pdf"))
                .thenReturn(Optional.of(DocumentRecord.builder().id(3L).status(DocumentStatus.PARSED).build()));

        final ImportOutcome result = pipeline.run(context(1, 2), payload);

        assertThat(result.skipped()).isTrue();
        assertThat(result.documentId()).isEqualTo(3L);
        verify(documentRecordService, never()).createProcessing(any(), any(), any(), any(), any());
        verify(documentRecordService).updateFileLocation(3L, layout.processed() + "/" + LocalDate.now()
                                                             + "/inv-6.pdf");
    }

    @Test
    void losingTheDigestRaceRecordsDuplicate() throws IOException {
        final InvoiceImportPayload payload = payload("inv-7.pdf");
        final DocumentRecord original = DocumentRecord.builder().id(1L).status(DocumentStatus.PARSED).build();
        when(documentRecordService.createProcessing(any(), any(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_document_live_digest"));
        when(documentRecordService.findLiveOriginal(DIGEST)).thenReturn(Optional.of(original));
        when(documentRecordService.recordDuplicate(eq("inv-7.pdf"), eq(DIGEST), eq(SourceKind.LOCAL), eq(original),
                                                   anyString(), any()))
                .thenReturn(DocumentRecord.builder().id(2L).build());

        final ImportOutcome result = pipeline.run(context(1, 2), payload);

        assertThat(result.status()).isEqualTo(DocumentStatus.DUPLICATE);
        assertThat(result.fileLocation()).contains("/duplicates/");
        verifyNoInteractions(fieldExtractionService);
    }

    @Test
    void cancelledBatchIsSkipped() throws IOException {
        final InvoiceImportPayload payload = payload("inv-8.pdf");
        when(importBatchService.isCancelled("batch-1")).thenReturn(true);

        assertThat(pipeline.run(context(1, 2), payload).skipped()).isTrue();
        verifyNoInteractions(documentRecordService, fieldExtractionService);
    }

    @Test
    void reportsMissingReviewedFieldsInOrder() {
        final ExtractionResult result = new ExtractionResult(Map.of("totalAmount", "1.00", "customerPO", " "), "",
                                                             ProcessingMethod.BASIC_REGEX, List.of(), null,
                                                             DocumentType.INVOICE);

        assertThat(InvoiceImportPipeline.missingFields(result))
                .containsExactly("accountNumber", "invoiceNumber", "vatAmount", "customerPO");
    }

    private void givenProcessing(final InvoiceImportPayload payload) {
        when(documentRecordService.createProcessing(payload.fileName(), DIGEST, SourceKind.LOCAL, payload.localPath(),
                                                    "batch-1"))
                .thenReturn(processing);
    }

    private InvoiceImportPayload payload(final String fileName) throws IOException {
        final Path file = Files.writeString(Path.of(layout.unprocessed(), fileName), "content of " + fileName);
        return new InvoiceImportPayload(file.toString().replace('\\', '/'), fileName, DIGEST, SourceKind.LOCAL, null,
                                        null, "batch-1");
    }

    private static JobContext context(final int attempt, final int maxAttempts) {
        return new JobContext(100L, QueueName.INVOICE_IMPORT, "import-invoice", attempt, maxAttempts, "batch-1");
    }

    private static ExtractionOutcome outcome(final Map<String, String> fields) {
        final ExtractionResult result = new ExtractionResult(fields, "text", ProcessingMethod.LOCAL_COORDINATES,
                                                             List.of(), 4L, DocumentType.INVOICE);
        return new ExtractionOutcome(DocumentType.INVOICE, new TemplateResolution(null, List.of(), List.of()), result,
                                     80, "text");
    }
}

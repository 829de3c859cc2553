package com.eyelevel.invoiceingestion.service.cleanup;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.LocalSourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileCleanupServiceTest {

    @Mock
    private DocumentRecordRepository documentRecordRepository;
    @Mock
    private SourceConnectorFactory connectorFactory;

    @TempDir
    Path tempDir;

    private IngestionProperties properties;
    private FileCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.setRetentionDays(30);
        cleanupService = new FileCleanupService(documentRecordRepository, new PipelineSettingsProvider(properties),
                                                connectorFactory);
        lenient().when(connectorFactory.getConnector(SourceKind.LOCAL)).thenReturn(new LocalSourceConnector());
    }

    @Test
    void unlimitedRetentionDeletesNothing() {
        properties.setRetentionDays(null);

        assertThat(cleanupService.cleanup()).isZero();

        verifyNoInteractions(documentRecordRepository, connectorFactory);
    }

    @Test
    void expiredDocumentsAreSoftDeletedAndFilesRemoved() throws IOException {
        final Path stored = Files.writeString(tempDir.resolve("inv-1.pdf"), "%PDF");
        final DocumentRecord expired = document(1L, stored.toString());
        final DocumentRecord missingFile = document(2L, tempDir.resolve("gone.pdf").toString());
        when(documentRecordRepository.findExpired(any(LocalDateTime.class), any(Pageable.class)))
                .thenReturn(List.of(expired, missingFile));

        assertThat(cleanupService.cleanup()).isEqualTo(2);

        assertThat(stored).doesNotExist();
        assertThat(expired.getDeletedAt()).isNotNull();
        assertThat(expired.getLiveDigest()).isNull();
        assertThat(expired.getContentDigest()).isEqualTo("digest-1");
        verify(documentRecordRepository).save(expired);
        verify(documentRecordRepository).save(missingFile);
    }

    @Test
    void cutoffIsRetentionDaysAgo() {
        when(documentRecordRepository.findExpired(any(LocalDateTime.class), any(Pageable.class)))
                .thenReturn(List.of());

        cleanupService.cleanup();

        final ArgumentCaptor<LocalDateTime> cutoff = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(documentRecordRepository).findExpired(cutoff.capture(), any(Pageable.class));
        assertThat(cutoff.getValue()).isCloseTo(LocalDateTime.now().minusDays(30), within(5, ChronoUnit.SECONDS));
    }

    private static DocumentRecord document(final Long id, final String location) {
        return DocumentRecord.builder()
                             .id(id)
                             .fileName("inv-" + id + ".pdf")
                             .contentDigest("digest-" + id)
                             .liveDigest("digest-" + id)
                             .status(DocumentStatus.PARSED)
                             .sourceKind(SourceKind.LOCAL)
                             .fileLocation(location)
                             .build();
    }
}

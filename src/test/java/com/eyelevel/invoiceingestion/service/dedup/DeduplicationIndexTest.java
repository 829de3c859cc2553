package com.eyelevel.invoiceingestion.service.dedup;

import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeduplicationIndexTest {

    private static final String DIGEST = "a".repeat(64);

    @Mock
    private DocumentRecordRepository repository;

    @InjectMocks
    private DeduplicationIndex index;

    @Test
    void liveDocumentIsAlwaysADuplicate() {
        final DocumentRecord live = DocumentRecord.builder().id(4L).status(DocumentStatus.PARSED).build();
        when(repository.findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(eq(DIGEST), anyCollection()))
                .thenReturn(Optional.of(live));

        assertThat(index.findDuplicate(DIGEST, 30)).contains(live);
        verify(repository, never()).findFirstByContentDigestAndStatusNotInAndDeletedAtAfterOrderByIdAsc(anyString(),
                                                                                                        anyCollection(),
                                                                                                        any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void duplicateAndFailedRecordsNeverCountAsOriginal() {
        index.findDuplicate(DIGEST, 30);

        final ArgumentCaptor<Collection<DocumentStatus>> excluded = ArgumentCaptor.forClass(Collection.class);
        verify(repository).findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(eq(DIGEST),
                                                                                                excluded.capture());
        assertThat(excluded.getValue()).containsExactlyInAnyOrder(DocumentStatus.DUPLICATE, DocumentStatus.FAILED);
    }

    @Test
    void softDeletedInsideRetentionWindowStillBlocks() {
        final DocumentRecord deleted = DocumentRecord.builder().id(9L).deletedAt(LocalDateTime.now().minusDays(2))
                                                     .build();
        when(repository.findFirstByContentDigestAndStatusNotInAndDeletedAtAfterOrderByIdAsc(eq(DIGEST), anyCollection(),
                                                                                            any()))
                .thenReturn(Optional.of(deleted));

        assertThat(index.findDuplicate(DIGEST, 30)).contains(deleted);

        final ArgumentCaptor<LocalDateTime> windowStart = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(repository).findFirstByContentDigestAndStatusNotInAndDeletedAtAfterOrderByIdAsc(eq(DIGEST),
                                                                                               anyCollection(),
                                                                                               windowStart.capture());
        assertThat(windowStart.getValue()).isCloseTo(LocalDateTime.now().minusDays(30),
                                                     within(5, ChronoUnit.SECONDS));
    }

    @Test
    void softDeletedOutsideWindowMayBeIngestedAgain() {
        assertThat(index.findDuplicate(DIGEST, 30)).isEmpty();
    }

    @Test
    void unlimitedRetentionKeepsSoftDeletedRecordsBlocking() {
        final DocumentRecord ancient = DocumentRecord.builder().id(1L).deletedAt(LocalDateTime.now().minusYears(3))
                                                     .build();
        when(repository.findFirstByContentDigestAndStatusNotInOrderByIdAsc(eq(DIGEST), anyCollection()))
                .thenReturn(Optional.of(ancient));

        assertThat(index.findDuplicate(DIGEST, null)).contains(ancient);
        assertThat(index.findDuplicate(DIGEST, 0)).contains(ancient);
    }
}

package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.model.FileKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds the {@link DocumentExtractor} for a file kind among all registered extractors.
 */
@Slf4j
@Service
public class DocumentExtractorFactory {

    private final List<DocumentExtractor> extractors;

    public DocumentExtractorFactory(List<DocumentExtractor> extractors) {
        this.extractors = extractors;
        log.info("DocumentExtractorFactory initialized with {} available extractors.", extractors.size());
    }

    public Optional<DocumentExtractor> getExtractor(FileKind fileKind) {
        Optional<DocumentExtractor> extractor = extractors.stream()
                .filter(e -> e.supports(fileKind))
                .findFirst();
        log.debug("Searching for extractor for {}. Found: {}", fileKind,
                  extractor.map(e -> e.getClass().getSimpleName()).orElse("None"));
        return extractor;
    }
}

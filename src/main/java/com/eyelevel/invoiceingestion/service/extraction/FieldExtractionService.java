package com.eyelevel.invoiceingestion.service.extraction;

import com.eyelevel.invoiceingestion.exception.TemplateExtractionException;
import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.service.classify.DocumentClassifier;
import com.eyelevel.invoiceingestion.service.extraction.basic.BasicFieldExtractor;
import com.eyelevel.invoiceingestion.service.scoring.ConfidenceScorer;
import com.eyelevel.invoiceingestion.service.template.TemplateResolution;
import com.eyelevel.invoiceingestion.service.template.TemplateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs classify, resolve, extract and score for one local file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldExtractionService {

    public static final String DOCUMENT_TYPE_MISMATCH = "document_type_mismatch";

    private final DocumentExtractorFactory extractorFactory;
    private final DocumentClassifier classifier;
    private final TemplateResolver templateResolver;
    private final BasicFieldExtractor basicFieldExtractor;
    private final ConfidenceScorer confidenceScorer;

    /**
     * @param exactTemplateOnly when {@code true} only templates of the classified type are considered
     */
    public ExtractionOutcome extract(final Path file, final FileKind fileKind, final ExtractionContext context,
                                     final boolean exactTemplateOnly) throws IOException {
        final DocumentExtractor extractor = extractorFactory.getExtractor(fileKind)
                                                            .orElseThrow(() -> new TemplateExtractionException(
                                                                    "No extractor registered for " + fileKind));
        final String rawText = extractor.readText(file);
        final DocumentType documentType = classifier.classify(rawText);
        log.info("[File: {}] Classified as {} ({} characters of text).", context.fileName(), documentType,
                 rawText.length());

        final TemplateResolution resolution = exactTemplateOnly
                ? templateResolver.resolveExact(fileKind, documentType)
                : templateResolver.resolve(fileKind, documentType);
        log.debug("[File: {}] Template resolution steps: {}", context.fileName(), resolution.steps());

        final ExtractionContext typed = new ExtractionContext(context.fileName(), context.contentDigest(), documentType);
        final List<String> warnings = new ArrayList<>(resolution.warnings());
        ExtractionResult result;
        final ExtractionTemplate template = resolution.template();
        if (template != null) {
            result = extractor.extract(file, template, typed);
            if (template.getDocumentType() != documentType) {
                log.warn("[File: {}] Template '{}' is for {} but the document is {}. Keeping the extracted data.",
                         context.fileName(), template.getCode(), template.getDocumentType(), documentType);
                warnings.add(DOCUMENT_TYPE_MISMATCH);
            }
        } else {
            result = basicFieldExtractor.extract(rawText, documentType);
        }
        result = result.withWarnings(warnings);

        final int score = confidenceScorer.score(result, template);
        log.info("[File: {}] Extracted {} field(s) via {} with confidence {}.", context.fileName(),
                 result.fields().size(), result.processingMethod().getTag(), score);
        return new ExtractionOutcome(documentType, resolution, result, score, rawText);
    }
}

package com.eyelevel.invoiceingestion.service.template;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.repository.ExtractionTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Selects the extraction template for a (file kind, document type) pair through a strict fallback chain:
 * <ol>
 *     <li>the default template of exactly that type; a default whose declared type differs is rejected</li>
 *     <li>any enabled non-default template of that type</li>
 *     <li>PDF only: the default invoice template</li>
 *     <li>any enabled template of the file kind</li>
 * </ol>
 * Every step and every cross-type fallback is recorded so that mismatches stay auditable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateResolver {

    public static final String NO_TEMPLATE_WARNING = "no_template_found";

    private final ExtractionTemplateRepository templateRepository;

    @Transactional(readOnly = true)
    public TemplateResolution resolve(final FileKind fileKind, final DocumentType documentType) {
        return resolve(fileKind, documentType, false);
    }

    /**
     * Resolves using only the exact-type steps. Used where a wrong-type template must never be applied,
     * such as bulk parsing tests.
     */
    @Transactional(readOnly = true)
    public TemplateResolution resolveExact(final FileKind fileKind, final DocumentType documentType) {
        return resolve(fileKind, documentType, true);
    }

    private TemplateResolution resolve(final FileKind fileKind, final DocumentType documentType,
                                       final boolean exactOnly) {
        final List<String> steps = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        final Optional<ExtractionTemplate> defaultTemplate = templateRepository
                .findFirstByFileKindAndDocumentTypeAndDefaultTemplateTrueAndEnabledTrueOrderByPriorityDescCreatedAtDesc(
                        fileKind, documentType);
        if (defaultTemplate.isPresent()) {
            final ExtractionTemplate candidate = defaultTemplate.get();
            if (candidate.getDocumentType() == documentType) {
                steps.add("default_template:" + candidate.getCode());
                return new TemplateResolution(candidate, steps, warnings);
            }
            log.error("Default template '{}' declares type {} but {} was requested. Rejecting it.",
                      candidate.getCode(), candidate.getDocumentType(), documentType);
            steps.add("default_template_rejected:" + candidate.getCode());
            warnings.add("template_type_mismatch_rejected:" + candidate.getCode());
        } else {
            steps.add("no_default_template");
        }

        final Optional<ExtractionTemplate> sameType = templateRepository
                .findFirstByFileKindAndDocumentTypeAndDefaultTemplateFalseAndEnabledTrueOrderByPriorityDescCreatedAtDesc(
                        fileKind, documentType);
        if (sameType.isPresent()) {
            steps.add("non_default_template:" + sameType.get().getCode());
            log.info("Using non-default {} template '{}' for {}.", fileKind, sameType.get().getCode(), documentType);
            return new TemplateResolution(sameType.get(), steps, warnings);
        }
        steps.add("no_template_of_type");

        if (exactOnly) {
            warnings.add(NO_TEMPLATE_WARNING);
            return new TemplateResolution(null, steps, warnings);
        }

        if (fileKind == FileKind.PDF && documentType != DocumentType.INVOICE) {
            final Optional<ExtractionTemplate> invoiceDefault = templateRepository
                    .findFirstByFileKindAndDocumentTypeAndDefaultTemplateTrueAndEnabledTrueOrderByPriorityDescCreatedAtDesc(
                            fileKind, DocumentType.INVOICE);
            if (invoiceDefault.isPresent()) {
                steps.add("invoice_default_fallback:" + invoiceDefault.get().getCode());
                warnings.add("fallback_invoice_template:" + invoiceDefault.get().getCode());
                return new TemplateResolution(invoiceDefault.get(), steps, warnings);
            }
            steps.add("no_invoice_default");
        }

        final Optional<ExtractionTemplate> anyOfKind = templateRepository
                .findFirstByFileKindAndEnabledTrueOrderByDefaultTemplateDescPriorityDescCreatedAtDesc(fileKind);
        if (anyOfKind.isPresent()) {
            final ExtractionTemplate candidate = anyOfKind.get();
            steps.add("any_template_fallback:" + candidate.getCode());
            if (candidate.getDocumentType() != documentType) {
                warnings.add("fallback_any_template:" + candidate.getCode());
            }
            return new TemplateResolution(candidate, steps, warnings);
        }

        log.warn("No {} template available for {}. Falling back to basic extraction.", fileKind, documentType);
        steps.add("basic_extraction");
        warnings.add(NO_TEMPLATE_WARNING);
        return new TemplateResolution(null, steps, warnings);
    }
}

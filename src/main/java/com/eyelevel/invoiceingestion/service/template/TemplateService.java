package com.eyelevel.invoiceingestion.service.template;

import com.eyelevel.invoiceingestion.exception.InvalidTemplateException;
import com.eyelevel.invoiceingestion.exception.ResourceNotFoundException;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FieldDefinition;
import com.eyelevel.invoiceingestion.model.FileKind;
import com.eyelevel.invoiceingestion.repository.ExtractionTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Maintains templates and the single-default invariant per (supplier scope, document type, file kind).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateService {

    private final ExtractionTemplateRepository templateRepository;

    @Transactional
    public ExtractionTemplate save(final ExtractionTemplate template) {
        validate(template);
        final ExtractionTemplate saved = templateRepository.save(template);
        if (saved.isDefaultTemplate()) {
            unsetSiblingDefaults(saved);
        }
        return saved;
    }

    /**
     * Marks a template as the default for its type and unsets every sibling default in the same scope.
     */
    @Transactional
    public ExtractionTemplate setAsDefault(final Long templateId) {
        final ExtractionTemplate template = templateRepository.findById(templateId)
                                                              .orElseThrow(() -> new ResourceNotFoundException(
                                                                      "Template " + templateId + " not found."));
        unsetSiblingDefaults(template);
        template.setDefaultTemplate(true);
        log.info("Template '{}' is now the default {} {} template.", template.getCode(), template.getFileKind(),
                 template.getDocumentType());
        return templateRepository.save(template);
    }

    private void unsetSiblingDefaults(final ExtractionTemplate template) {
        final int cleared = templateRepository.clearSiblingDefaults(template.getSupplierId(),
                                                                    template.getDocumentType(),
                                                                    template.getFileKind(), template.getId());
        if (cleared > 0) {
            log.info("Unset {} sibling default template(s) for {} {}.", cleared, template.getFileKind(),
                     template.getDocumentType());
        }
    }

    void validate(final ExtractionTemplate template) {
        if (template.getDocumentType() == null || template.getFileKind() == null) {
            throw new InvalidTemplateException("Template must declare a document type and a file kind.");
        }
        for (Map.Entry<String, FieldDefinition> entry : template.getFieldDefinitions().entrySet()) {
            final FieldDefinition definition = entry.getValue();
            if (template.getFileKind() == FileKind.PDF) {
                if (definition.getRegion() == null || !definition.getRegion().isWellFormed()) {
                    throw new InvalidTemplateException("Field '" + entry.getKey()
                                                       + "' needs a region with 0 <= left < right <= 1, "
                                                       + "0 <= top < bottom <= 1 and page >= 1.");
                }
            } else if (definition.getCell() == null || !definition.getCell().isWellFormed()) {
                throw new InvalidTemplateException("Field '" + entry.getKey()
                                                   + "' needs a cell reference with a column letter and row >= 1.");
            }
        }
    }
}

package com.eyelevel.invoiceingestion.service.template;

import com.eyelevel.invoiceingestion.model.ExtractionTemplate;

import java.util.List;

/**
 * The template chosen for a document together with an audit trail of the resolution steps taken.
 *
 * @param template the resolved template, or {@code null} when extraction must fall back to basic parsing
 * @param steps    every resolution step attempted, in order
 * @param warnings fallbacks and rejections worth surfacing on the extraction result
 */
public record TemplateResolution(ExtractionTemplate template, List<String> steps, List<String> warnings) {

    public boolean isResolved() {
        return template != null;
    }
}

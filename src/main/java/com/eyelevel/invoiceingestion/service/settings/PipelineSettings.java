package com.eyelevel.invoiceingestion.service.settings;

import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable snapshot of the settings one job runs with. Taken when the job starts so that a configuration
 * refresh never changes the rules halfway through a file.
 *
 * @param retentionDays       re-upload window for soft-deleted documents; {@code null} means unlimited
 */
public record PipelineSettings(SourceKind sourceKind,
                               List<SourceLayout> layouts,
                               Set<String> extensions,
                               Duration minimumFileAge,
                               Duration recentlyProcessedWindow,
                               Integer retentionDays,
                               String stagingDir) {

    public boolean hasRetention() {
        return retentionDays != null && retentionDays > 0;
    }

    public boolean acceptsExtension(String extension) {
        return extension != null && extensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public SourceLayout layoutFor(String folderTag) {
        return layouts.stream()
                      .filter(layout -> folderTag == null ? layout.folderTag() == null
                                                          : folderTag.equals(layout.folderTag()))
                      .findFirst()
                      .orElse(layouts.get(0));
    }
}

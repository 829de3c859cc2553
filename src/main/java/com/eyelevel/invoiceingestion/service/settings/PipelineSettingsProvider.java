package com.eyelevel.invoiceingestion.service.settings;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds {@link PipelineSettings} snapshots from the bound application properties.
 */
@Component
@RequiredArgsConstructor
public class PipelineSettingsProvider {

    private final IngestionProperties properties;

    public PipelineSettings current() {
        final IngestionProperties.Source source = properties.getSource();
        final List<SourceLayout> layouts = source.isMultiFolder() && !source.getSubFolders().isEmpty()
                ? source.getSubFolders().stream()
                        .map(tag -> SourceLayout.of(source.getRootPath(), tag, source.getFolders()))
                        .toList()
                : List.of(SourceLayout.of(source.getRootPath(), null, source.getFolders()));

        return new PipelineSettings(source.getKind(),
                                    layouts,
                                    source.getExtensions().stream()
                                          .map(ext -> ext.toLowerCase(Locale.ROOT))
                                          .collect(Collectors.toUnmodifiableSet()),
                                    Duration.ofMillis(source.getMinimumFileAgeMs()),
                                    Duration.ofMillis(source.getRecentlyProcessedWindowMs()),
                                    properties.getRetentionDays(),
                                    properties.getStagingDir());
    }
}

package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.config.IngestionProperties;

/**
 * The folder structure of one drop folder: where new files arrive and where terminal files go.
 *
 * @param folderTag     the sub-folder name in multi-folder mode, {@code null} otherwise
 */
public record SourceLayout(String folderTag, String unprocessed, String processed, String duplicates,
                           String failed) {

    public static SourceLayout of(String root, String folderTag, IngestionProperties.FolderStructure folders) {
        String base = folderTag == null ? root : SourcePaths.join(root, folderTag);
        String processed = SourcePaths.join(base, folders.getProcessed());
        return new SourceLayout(folderTag,
                                SourcePaths.join(base, folders.getUnprocessed()),
                                processed,
                                SourcePaths.join(processed, "duplicates"),
                                SourcePaths.join(base, folders.getFailed()));
    }
}

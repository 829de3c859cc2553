package com.eyelevel.invoiceingestion.service.scan;

import java.util.List;

/**
 * Counts and per-file outcomes of one source scan.
 *
 * @param scanned    files with an accepted extension that were looked at
 * @param queued     files handed to an import queue
 * @param duplicates files whose content was already ingested
 * @param skipped    files left alone for now: too young, already queued or processed recently
 * @param errors     one message per file that failed
 */
public record ScanResult(String importBatchId,
                         int scanned,
                         int queued,
                         int duplicates,
                         int skipped,
                         List<String> errors,
                         List<FileOutcome> files) {

    public enum Outcome {
        QUEUED,
        DUPLICATE,
        SKIPPED,
        FAILED
    }

    public record FileOutcome(String fileName, String folderTag, Outcome outcome, String detail) {
    }
}

package com.claimrules.domain.extraction.model;

/**
 * A recovered failure or notable event during one extraction run.
 *
 * @param stage    pipeline stage that produced the entry
 * @param severity ERROR for failed units of work, WARNING for dropped or empty input
 * @param batchId  related batch (nullable)
 * @param message  human-readable description
 */
public record ProcessingLogEntry(
        Stage stage,
        Severity severity,
        Integer batchId,
        String message
) {
    public enum Stage {
        SEGMENTATION,
        ANALYSIS,
        PARSING,
        PIPELINE
    }

    public enum Severity {
        WARNING,
        ERROR
    }

    public static ProcessingLogEntry warning(Stage stage, String message) {
        return new ProcessingLogEntry(stage, Severity.WARNING, null, message);
    }

    public static ProcessingLogEntry error(Stage stage, Integer batchId, String message) {
        return new ProcessingLogEntry(stage, Severity.ERROR, batchId, message);
    }
}

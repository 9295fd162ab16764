package com.claimrules.domain.extraction.model;

/**
 * How a document is fed to the reasoning capability.
 */
public enum AnalysisMode {
    /** All claims analyzed together in one batch. */
    SINGLE_PASS,
    /** Claims split into complexity-bounded batches. */
    CHUNKED
}

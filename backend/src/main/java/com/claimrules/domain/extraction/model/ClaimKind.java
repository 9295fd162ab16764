package com.claimrules.domain.extraction.model;

public enum ClaimKind {
    INDEPENDENT,
    DEPENDENT
}

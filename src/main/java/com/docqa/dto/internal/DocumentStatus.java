package com.docqa.dto.internal;

/**
 * Processing status of a stored document. Only READY documents are queryable.
 */
public enum DocumentStatus {
    UPLOADED,
    PROCESSING,
    READY,
    FAILED
}

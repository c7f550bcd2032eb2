package com.kbsearch.common.constants;

/**
 * Lifecycle of a knowledge document. READY and ERROR are both re-enterable through reprocessing.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    READY,
    ERROR
}

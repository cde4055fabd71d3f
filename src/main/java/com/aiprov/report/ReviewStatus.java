package com.aiprov.report;

public enum ReviewStatus {
    NO_TESTS,
    NEEDS_REVIEW,
    REVIEWED,
    // tested, no AI involvement
    COMPLETE
}

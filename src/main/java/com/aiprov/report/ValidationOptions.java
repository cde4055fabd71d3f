package com.aiprov.report;

public record ValidationOptions(boolean requireReview, boolean requireTests) {

    public static ValidationOptions lenient() {
        return new ValidationOptions(false, false);
    }
}

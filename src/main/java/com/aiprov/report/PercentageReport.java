package com.aiprov.report;

import java.math.BigDecimal;
import java.util.List;

public record PercentageReport(
        int fileCount,
        long countedLines,
        long aiLines,
        Double aiPercentage,
        BigDecimal display,
        List<FilePercentage> files) {

    public PercentageReport {
        files = List.copyOf(files);
    }
}

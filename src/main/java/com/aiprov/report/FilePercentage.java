package com.aiprov.report;

import java.math.BigDecimal;

public record FilePercentage(
        String path,
        int countedLines,
        int aiLines,
        Double aiPercentage,
        BigDecimal display) {
}

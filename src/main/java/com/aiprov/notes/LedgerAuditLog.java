package com.aiprov.notes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class LedgerAuditLog {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public void append(Path auditLogPath, LedgerAuditEntry entry) throws IOException {
        if (auditLogPath.getParent() != null) {
            Files.createDirectories(auditLogPath.getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<LedgerAuditEntry> readAll(Path auditLogPath) throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<String> lines = Files.readAllLines(auditLogPath);
        List<LedgerAuditEntry> entries = new ArrayList<>();
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, LedgerAuditEntry.class));
        }
        return entries;
    }
}

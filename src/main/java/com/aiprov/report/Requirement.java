package com.aiprov.report;

import java.util.Objects;

public record Requirement(String id, String title, String status) {

    public Requirement {
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
    }
}

package com.aiprov.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockKind {
    FUNCTION("function"),
    METHOD("method"),
    CLASS("class"),
    MODULE("module"),
    GENERIC("block");

    private final String code;

    BlockKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}

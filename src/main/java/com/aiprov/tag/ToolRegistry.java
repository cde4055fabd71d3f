package com.aiprov.tag;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import com.aiprov.model.AiTool;

public class ToolRegistry {
    private final Set<AiTool> additional;

    public ToolRegistry(Collection<String> additionalToolIds) {
        Set<AiTool> tools = new LinkedHashSet<>();
        if (additionalToolIds != null) {
            additionalToolIds.stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(AiTool::of)
                    .forEach(tools::add);
        }
        this.additional = Set.copyOf(tools);
    }

    public static ToolRegistry builtIn() {
        return new ToolRegistry(Set.of());
    }

    public boolean isRegistered(AiTool tool) {
        return tool.isKnown() || additional.contains(tool);
    }
}

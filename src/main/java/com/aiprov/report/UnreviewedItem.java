package com.aiprov.report;

import com.aiprov.model.AiTool;
import com.aiprov.model.Confidence;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnreviewedItem(
        Kind kind,
        String commitId,
        String path,
        Integer startLine,
        Integer endLine,
        AiTool tool,
        Confidence confidence) {

    public enum Kind {
        COMMIT,
        BLOCK
    }

    public static UnreviewedItem commit(String commitId, AiTool tool, Confidence confidence) {
        return new UnreviewedItem(Kind.COMMIT, commitId, null, null, null, tool, confidence);
    }

    public static UnreviewedItem block(String path, int startLine, int endLine, AiTool tool, Confidence confidence) {
        return new UnreviewedItem(Kind.BLOCK, null, path, startLine, endLine, tool, confidence);
    }
}

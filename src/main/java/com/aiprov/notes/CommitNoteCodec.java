package com.aiprov.notes;

import java.time.Instant;
import java.util.List;

import com.aiprov.model.AiTool;
import com.aiprov.model.CommitRecord;
import com.aiprov.model.Confidence;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Canonical note text for a {@link CommitRecord}: one line of JSON with a fixed
 * key order, empty fields omitted. The commit id is the note's key and is not
 * repeated in the payload.
 */
public class CommitNoteCodec {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public String encode(CommitRecord record) {
        NotePayload payload = new NotePayload(
                record.aiTool(),
                record.confidence(),
                record.trace(),
                record.tests(),
                record.reviewedBy(),
                record.reviewedAt(),
                record.files());
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Commit record for " + record.commitId() + " cannot be encoded", e);
        }
    }

    public CommitRecord decode(String commitId, String text) throws MalformedNoteException {
        if (text == null || text.isBlank()) {
            throw new MalformedNoteException(commitId, text, null);
        }
        try {
            NotePayload payload = mapper.readValue(text.strip(), NotePayload.class);
            if (payload == null) {
                throw new MalformedNoteException(commitId, text, null);
            }
            return new CommitRecord(
                    commitId,
                    payload.aiTool(),
                    payload.confidence(),
                    payload.trace(),
                    payload.tests(),
                    payload.reviewedBy(),
                    payload.reviewedAt(),
                    payload.files());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedNoteException(commitId, text, e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "ai_tool", "confidence", "trace", "tests", "reviewed_by", "reviewed_at", "files" })
    record NotePayload(
            @JsonProperty("ai_tool") AiTool aiTool,
            @JsonProperty("confidence") Confidence confidence,
            @JsonProperty("trace") List<String> trace,
            @JsonProperty("tests") List<String> tests,
            @JsonProperty("reviewed_by") String reviewedBy,
            @JsonProperty("reviewed_at") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant reviewedAt,
            @JsonProperty("files") List<String> files) {
    }
}

package com.aiprov.tag;

public class MalformedTagException extends Exception {
    private final String path;
    private final int lineNumber;
    private final String rawText;
    private final String reason;

    public MalformedTagException(String path, int lineNumber, String rawText, String reason) {
        super(location(path, lineNumber) + ": " + reason + ": " + rawText.strip());
        this.path = path;
        this.lineNumber = lineNumber;
        this.rawText = rawText;
        this.reason = reason;
    }

    private static String location(String path, int lineNumber) {
        return (path == null ? "<text>" : path) + ":" + lineNumber;
    }

    public String path() {
        return path;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String rawText() {
        return rawText;
    }

    public String reason() {
        return reason;
    }
}

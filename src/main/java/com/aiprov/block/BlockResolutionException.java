package com.aiprov.block;

public class BlockResolutionException extends Exception {
    private final String path;
    private final int lineNumber;

    public BlockResolutionException(String path, int lineNumber, String reason) {
        super(path + ":" + lineNumber + ": " + reason);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public String path() {
        return path;
    }

    public int lineNumber() {
        return lineNumber;
    }
}

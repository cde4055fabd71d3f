package com.aiprov.tag;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextLinesTest {

    @Test
    void shouldNotOpenLineAfterFinalTerminator() {
        assertEquals(List.of("a", "b"), TextLines.split("a\nb\n"));
        assertEquals(List.of("a", "b"), TextLines.split("a\r\nb"));
        assertEquals(List.of("a", "", ""), TextLines.split("a\n\n\n"));
    }

    @Test
    void shouldHandleEmptyTextAndByteOrderMark() {
        assertEquals(List.of(), TextLines.split(""));
        assertEquals(List.of(""), TextLines.split("\n"));
        assertEquals(List.of("# ai:claude:high"), TextLines.split("\uFEFF# ai:claude:high\n"));
    }
}

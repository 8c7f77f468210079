package com.aero.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TextChunker.
 */
class TextChunkerTest {

    @Test
    void testChunksConcatenateToOriginal() {
        String text = "Gradient descent iteratively minimizes loss by stepping against the gradient.\n"
                + "Smaller learning rates converge more slowly.";

        List<String> chunks = TextChunker.split(text);

        assertTrue(chunks.size() > 1);
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void testPrefersWordBoundaries() {
        List<String> chunks = TextChunker.split("The quick brown fox jumps over the lazy dog", 10);

        assertEquals("The quick brown ", chunks.get(0));
        assertEquals("fox jumps over ", chunks.get(1));
    }

    @Test
    void testShortTextIsSingleChunk() {
        assertEquals(List.of("Hello"), TextChunker.split("Hello"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(TextChunker.split("").isEmpty());
        assertTrue(TextChunker.split(null).isEmpty());
    }
}

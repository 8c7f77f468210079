package com.aero.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits finished text into stream-sized pieces whose concatenation is the original text.
 */
public final class TextChunker {

    static final int DEFAULT_CHUNK_SIZE = 24;

    private static final int BOUNDARY_LOOKAHEAD = 8;

    private TextChunker() {
    }

    public static List<String> split(String content) {
        return split(content, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Split content into deterministic chunks.
     * Uses word boundaries to avoid splitting words when possible.
     */
    public static List<String> split(String content, int chunkSize) {
        List<String> chunks = new ArrayList<>();

        if (content == null || content.isEmpty()) {
            return chunks;
        }

        int size = Math.max(1, chunkSize);
        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + size, content.length());

            // Extend to the next whitespace if it is close
            if (endPos < content.length()) {
                for (int i = endPos; i < Math.min(endPos + BOUNDARY_LOOKAHEAD, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }

            chunks.add(content.substring(pos, endPos));
            pos = endPos;
        }

        return chunks;
    }
}

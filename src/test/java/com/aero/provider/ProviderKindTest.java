package com.aero.provider;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProviderKind id and alias lookup.
 */
class ProviderKindTest {

    @Test
    void testExactIds() {
        for (ProviderKind kind : ProviderKind.values()) {
            assertEquals(Optional.of(kind), ProviderKind.fromId(kind.getId()));
        }
    }

    @Test
    void testIdsAreNormalized() {
        assertEquals(Optional.of(ProviderKind.OPENAI), ProviderKind.fromId("  OpenAI "));
    }

    @Test
    void testModelAliases() {
        assertEquals(Optional.of(ProviderKind.OPENAI), ProviderKind.fromId("gpt-4o-mini"));
        assertEquals(Optional.of(ProviderKind.GEMINI), ProviderKind.fromId("gemini-2.5-flash"));
        assertEquals(Optional.of(ProviderKind.DEEPSEEK), ProviderKind.fromId("deepseek-chat"));
        assertEquals(Optional.of(ProviderKind.GROQ), ProviderKind.fromId("llama-3.3-70b-versatile"));
        assertEquals(Optional.of(ProviderKind.ANTHROPIC), ProviderKind.fromId("claude-3-5-haiku-latest"));
        assertEquals(Optional.of(ProviderKind.SEARCH), ProviderKind.fromId("sonar"));
    }

    @Test
    void testUnknownAndBlank() {
        assertTrue(ProviderKind.fromId("primary").isEmpty());
        assertTrue(ProviderKind.fromId("").isEmpty());
        assertTrue(ProviderKind.fromId(null).isEmpty());
    }

    @Test
    void testOnlySearchFallsBack() {
        assertTrue(ProviderKind.SEARCH.fallsBackToDefault());
        assertFalse(ProviderKind.GEMINI.fallsBackToDefault());
    }
}

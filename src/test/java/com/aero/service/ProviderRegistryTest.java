package com.aero.service;

import com.aero.config.GatewayProperties;
import com.aero.provider.ProviderKind;
import com.aero.provider.ProviderStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for ProviderRegistry.
 */
class ProviderRegistryTest {

    private ProviderStrategy gemini;
    private ProviderStrategy openai;
    private ProviderStrategy search;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        gemini = strategy(ProviderKind.GEMINI, true);
        openai = strategy(ProviderKind.OPENAI, true);
        search = strategy(ProviderKind.SEARCH, false);
        properties = new GatewayProperties();
    }

    @Test
    void testKnownIdResolvesToItsStrategy() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        ProviderRegistry.ResolvedProvider resolved = registry.resolve("openai");

        assertSame(openai, resolved.getStrategy());
        assertEquals("openai", resolved.getRequestedId());
    }

    @Test
    void testModelAliasResolves() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        assertSame(openai, registry.resolve("gpt-4o-mini").getStrategy());
        assertSame(gemini, registry.resolve("gemini-2.5-flash").getStrategy());
    }

    @Test
    void testUnknownIdFallsBackToDefault() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        ProviderRegistry.ResolvedProvider resolved = registry.resolve("primary");

        assertSame(gemini, resolved.getStrategy());
        assertEquals("primary", resolved.getRequestedId());
    }

    @Test
    void testMissingIdUsesDefaultId() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        assertEquals("gemini", registry.resolve(null).getRequestedId());
        assertEquals("gemini", registry.resolve("  ").getRequestedId());
        assertSame(gemini, registry.resolve(null).getStrategy());
    }

    @Test
    void testKnownKindWithoutStrategyUsesDefault() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        assertSame(gemini, registry.resolve("groq").getStrategy());
    }

    @Test
    void testUnavailableSearchFallsBackToDefault() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        ProviderRegistry.ResolvedProvider resolved = registry.resolve("search");

        assertSame(gemini, resolved.getStrategy());
        assertEquals("search", resolved.getRequestedId());
    }

    @Test
    void testAvailableSearchIsUsed() {
        ProviderStrategy configuredSearch = strategy(ProviderKind.SEARCH, true);
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, configuredSearch), properties);

        assertSame(configuredSearch, registry.resolve("sonar").getStrategy());
    }

    @Test
    void testUnavailableProviderWithoutFallbackIsKept() {
        ProviderStrategy unconfiguredOpenai = strategy(ProviderKind.OPENAI, false);
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, unconfiguredOpenai), properties);

        assertSame(unconfiguredOpenai, registry.resolve("openai").getStrategy());
    }

    @Test
    void testConfiguredDefaultProvider() {
        properties.setDefaultProvider("openai");
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        assertEquals("openai", registry.getDefaultProviderId());
        assertSame(openai, registry.resolve("unknown-model").getStrategy());
    }

    @Test
    void testUnknownDefaultProviderUsesGemini() {
        properties.setDefaultProvider("nonexistent");
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai), properties);

        assertEquals("gemini", registry.getDefaultProviderId());
    }

    @Test
    void testDefaultProviderMustBeRegistered() {
        properties.setDefaultProvider("anthropic");

        assertThrows(IllegalStateException.class,
                () -> new ProviderRegistry(List.of(gemini, openai), properties));
    }

    @Test
    void testDuplicateStrategiesRejected() {
        ProviderStrategy secondGemini = strategy(ProviderKind.GEMINI, true);

        assertThrows(IllegalStateException.class,
                () -> new ProviderRegistry(List.of(gemini, secondGemini), properties));
    }

    @Test
    void testAvailability() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai, search), properties);

        Map<String, Boolean> availability = registry.availability();

        assertEquals(Boolean.TRUE, availability.get("gemini"));
        assertEquals(Boolean.FALSE, availability.get("search"));
        assertEquals(3, availability.size());
    }

    private static ProviderStrategy strategy(ProviderKind kind, boolean available) {
        ProviderStrategy strategy = mock(ProviderStrategy.class);
        when(strategy.getKind()).thenReturn(kind);
        when(strategy.isAvailable()).thenReturn(available);
        return strategy;
    }
}

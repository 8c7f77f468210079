package com.aero.provider;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of supported text generation providers.
 *
 * <p>Besides its canonical id, each kind accepts the model names the UI sends
 * (for example {@code gpt-4o-mini} or {@code llama-3.3-70b-versatile}) as aliases.
 */
public enum ProviderKind {

    OPENAI("openai", "OPENAI_API_KEY",
            "https://api.openai.com/v1", "gpt-4o-mini",
            List.of("gpt-", "chatgpt"), false),

    GEMINI("gemini", "GEMINI_API_KEY",
            "https://generativelanguage.googleapis.com/v1beta", "gemini-2.5-flash",
            List.of("gemini"), false),

    DEEPSEEK("deepseek", "DEEPSEEK_API_KEY",
            "https://api.deepseek.com/v1", "deepseek-chat",
            List.of("deepseek"), false),

    GROQ("groq", "GROQ_API_KEY",
            "https://api.groq.com/openai/v1", "llama-3.3-70b-versatile",
            List.of("llama", "groq"), false),

    ANTHROPIC("anthropic", "ANTHROPIC_API_KEY",
            "https://api.anthropic.com", "claude-3-5-haiku-latest",
            List.of("claude"), false),

    /**
     * Search-answering provider; reroutes to the default text provider when unavailable.
     */
    SEARCH("search", "PERPLEXITY_API_KEY",
            "https://api.perplexity.ai", "sonar",
            List.of("sonar", "perplexity"), true);

    private final String id;
    private final String credentialEnv;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final List<String> aliasPrefixes;
    private final boolean fallsBackToDefault;

    ProviderKind(String id, String credentialEnv, String defaultBaseUrl, String defaultModel,
                 List<String> aliasPrefixes, boolean fallsBackToDefault) {
        this.id = id;
        this.credentialEnv = credentialEnv;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.aliasPrefixes = aliasPrefixes;
        this.fallsBackToDefault = fallsBackToDefault;
    }

    public String getId() {
        return id;
    }

    public String getCredentialEnv() {
        return credentialEnv;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public boolean fallsBackToDefault() {
        return fallsBackToDefault;
    }

    /**
     * Look up a kind by canonical id first, then by model alias prefix.
     *
     * @param providerId identifier from the request, may be null
     * @return the matching kind, or empty for unknown identifiers
     */
    public static Optional<ProviderKind> fromId(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return Optional.empty();
        }

        String normalized = providerId.trim().toLowerCase(Locale.ROOT);

        Optional<ProviderKind> exact = Arrays.stream(values())
                .filter(kind -> kind.id.equals(normalized))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }

        return Arrays.stream(values())
                .filter(kind -> kind.aliasPrefixes.stream().anyMatch(normalized::startsWith))
                .findFirst();
    }
}

package com.coderag.embedding;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.runtime.AppConfig;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Resolves the active provider. An explicit choice ({@code CODERAG_EMBEDDING_PROVIDER} or
 * {@code embedding.provider}) wins; otherwise the order is a reachable Ollama, then Google, OpenAI and
 * Voyage keys, then the offline hashing provider when local fallback is allowed.
 */
public final class EmbeddingProviders {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviders.class);

    public static final List<String> KNOWN_PROVIDERS = List.of("ollama", "local", "google", "openai", "voyage");
    private static final Map<String, Integer> DEFAULT_DIMENSIONS = Map.of(
            "ollama", 768,
            "google", 768,
            "openai", 1536,
            "voyage", 512);

    private EmbeddingProviders() {
    }

    public static OkHttpClient httpClient(AppConfig.EmbeddingConfig config) {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build();
    }

    /**
     * Resolves like {@link #resolve} but reports a failure as an inactive status instead of throwing.
     */
    public static EmbeddingStatus status(AppConfig.EmbeddingConfig config, Map<String, String> env, OkHttpClient httpClient) {
        try {
            return EmbeddingStatus.of(resolve(config, env, httpClient));
        } catch (EmbeddingProviderUnavailableException e) {
            log.warn("embedding.status.unavailable reason={}", e.getMessage());
            return EmbeddingStatus.unavailable(e.getMessage());
        }
    }

    public static EmbeddingProvider resolve(AppConfig.EmbeddingConfig config, Map<String, String> env, OkHttpClient httpClient)
            throws EmbeddingProviderUnavailableException {
        String explicit = env.getOrDefault("CODERAG_EMBEDDING_PROVIDER", config.getProvider());
        explicit = explicit == null ? "" : explicit.strip().toLowerCase(Locale.ROOT);

        String name;
        if (!explicit.isEmpty()) {
            if (!KNOWN_PROVIDERS.contains(explicit)) {
                throw new EmbeddingProviderUnavailableException("Unknown embedding provider: '" + explicit
                        + "'. Valid options: " + String.join(", ", KNOWN_PROVIDERS));
            }
            verifyCredentials(explicit, env);
            name = explicit;
        } else {
            name = autoDetect(config, env, httpClient);
        }

        EmbeddingProvider provider = create(name, config, env, httpClient);
        log.info("embedding.provider.resolved name={} model={} dimensions={} explicit={}",
                provider.name(), provider.model(), provider.dimensions(), !explicit.isEmpty());
        return provider;
    }

    static EmbeddingProvider create(String name, AppConfig.EmbeddingConfig config, Map<String, String> env, OkHttpClient httpClient) {
        RetryPolicy retryPolicy = new RetryPolicy(
                Math.max(1, config.getMaxAttempts()),
                Duration.ofMillis(Math.max(0, config.getRetryBaseDelayMs())));
        switch (name) {
            case "local":
                return new HashingEmbeddingProvider(config.getLocalDimensions());
            case "ollama":
                return new OllamaEmbeddingProvider(httpClient, retryPolicy, ollamaHost(config, env),
                        model(name, config.getOllamaModel(), env), DEFAULT_DIMENSIONS.get(name));
            case "google":
                return new GoogleEmbeddingProvider(httpClient, retryPolicy, googleKey(env),
                        model(name, config.getGoogleModel(), env), DEFAULT_DIMENSIONS.get(name));
            case "openai":
                return new OpenAiCompatibleEmbeddingProvider(httpClient, retryPolicy, name,
                        OpenAiCompatibleEmbeddingProvider.OPENAI_URL, env.getOrDefault("OPENAI_API_KEY", ""),
                        model(name, config.getOpenaiModel(), env), DEFAULT_DIMENSIONS.get(name));
            case "voyage":
                return new OpenAiCompatibleEmbeddingProvider(httpClient, retryPolicy, name,
                        OpenAiCompatibleEmbeddingProvider.VOYAGE_URL, env.getOrDefault("VOYAGE_API_KEY", ""),
                        model(name, config.getVoyageModel(), env), DEFAULT_DIMENSIONS.get(name));
            default:
                throw new IllegalArgumentException("Unknown embedding provider: " + name);
        }
    }

    private static String autoDetect(AppConfig.EmbeddingConfig config, Map<String, String> env, OkHttpClient httpClient)
            throws EmbeddingProviderUnavailableException {
        if (isOllamaReachable(ollamaHost(config, env), httpClient)) {
            return "ollama";
        }
        if (!googleKey(env).isEmpty()) {
            return "google";
        }
        if (hasText(env.get("OPENAI_API_KEY"))) {
            return "openai";
        }
        if (hasText(env.get("VOYAGE_API_KEY"))) {
            return "voyage";
        }
        if (config.isAllowLocalFallback()) {
            return "local";
        }
        throw new EmbeddingProviderUnavailableException("No embedding provider available. Options:\n"
                + "  1. Start Ollama locally: ollama serve\n"
                + "  2. Set GOOGLE_API_KEY or GEMINI_API_KEY for Google embeddings\n"
                + "  3. Set OPENAI_API_KEY for OpenAI embeddings\n"
                + "  4. Set VOYAGE_API_KEY for Voyage embeddings\n"
                + "  5. Enable embedding.allowLocalFallback for offline hashing embeddings\n"
                + "  Or set CODERAG_EMBEDDING_PROVIDER explicitly.");
    }

    private static void verifyCredentials(String name, Map<String, String> env) throws EmbeddingProviderUnavailableException {
        boolean missing = switch (name) {
            case "google" -> googleKey(env).isEmpty();
            case "openai" -> !hasText(env.get("OPENAI_API_KEY"));
            case "voyage" -> !hasText(env.get("VOYAGE_API_KEY"));
            default -> false;
        };
        if (missing) {
            throw new EmbeddingProviderUnavailableException("Provider '" + name + "' requires an API key: "
                    + ("google".equals(name) ? "GOOGLE_API_KEY or GEMINI_API_KEY" : name.toUpperCase(Locale.ROOT) + "_API_KEY"));
        }
    }

    static boolean isOllamaReachable(String host, OkHttpClient httpClient) {
        OkHttpClient probe = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(2))
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        Request request = new Request.Builder().url(host).get().build();
        try (Response response = probe.newCall(request).execute()) {
            return response.code() == 200;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("embedding.ollama.unreachable host={} reason={}", host, e.toString());
            return false;
        }
    }

    private static String ollamaHost(AppConfig.EmbeddingConfig config, Map<String, String> env) {
        String host = env.get("OLLAMA_HOST");
        return hasText(host) ? host : config.getOllamaHost();
    }

    private static String googleKey(Map<String, String> env) {
        String key = env.get("GOOGLE_API_KEY");
        if (!hasText(key)) {
            key = env.get("GEMINI_API_KEY");
        }
        return hasText(key) ? key : "";
    }

    private static String model(String provider, String configured, Map<String, String> env) {
        String override = env.get("CODERAG_" + provider.toUpperCase(Locale.ROOT) + "_MODEL");
        return hasText(override) ? override : configured;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

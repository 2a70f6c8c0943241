package com.coderag.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

class HttpEmbeddingProvidersTest {

    private static final RetryPolicy NO_WAIT = new RetryPolicy(3, Duration.ZERO);

    private static OpenAiCompatibleEmbeddingProvider openAi(StubHttp http) {
        return new OpenAiCompatibleEmbeddingProvider(http.client, NO_WAIT, "openai",
                OpenAiCompatibleEmbeddingProvider.OPENAI_URL, "sk-test", "text-embedding-3-small", 3);
    }

    @Test
    void shouldReturnVectorsInInputOrderWithBearerAuth() throws Exception {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 200, """
                {"data": [
                  {"index": 1, "embedding": [0.0, 1.0, 0.0]},
                  {"index": 0, "embedding": [1.0, 0.0, 0.0]}
                ]}
                """));

        List<float[]> vectors = openAi(http).embed(List.of("first", "second"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 1f, 0f, 0f }, vectors.get(0));
        assertArrayEquals(new float[] { 0f, 1f, 0f }, vectors.get(1));
        assertEquals("Bearer sk-test", http.requests.get(0).header("Authorization"));
        assertEquals(OpenAiCompatibleEmbeddingProvider.OPENAI_URL, http.requests.get(0).url().toString());
    }

    @Test
    void shouldRetryTransientStatusesWithBackoff() throws Exception {
        StubHttp http = new StubHttp((chain, call) -> call < 3
                ? StubHttp.json(chain, 503, "{\"error\":\"busy\"}")
                : StubHttp.json(chain, 200, "{\"data\":[{\"index\":0,\"embedding\":[0.5,0.5,0.5]}]}"));

        List<float[]> vectors = openAi(http).embed(List.of("retry me"));

        assertEquals(1, vectors.size());
        assertEquals(3, http.calls());
    }

    @Test
    void shouldSurfaceStatusOnceRetriesAreExhausted() {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 429, "{\"error\":\"rate limited\"}"));

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> openAi(http).embed(List.of("x")));

        assertEquals(429, error.statusCode());
        assertEquals(3, http.calls());
    }

    @Test
    void shouldNotRetryClientErrors() {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 401, "{\"error\":\"bad key\"}"));

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> openAi(http).embed(List.of("x")));

        assertEquals(401, error.statusCode());
        assertEquals(1, http.calls());
    }

    @Test
    void shouldReportConnectionFailureAsUnavailable() {
        StubHttp http = new StubHttp((chain, call) -> {
            throw new ConnectException("Connection refused");
        });

        assertThrows(EmbeddingProviderUnavailableException.class, () -> openAi(http).embed(List.of("x")));
        assertEquals(1, http.calls());
    }

    @Test
    void shouldRejectResponsesWithWrongVectorCount() {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 200,
                "{\"data\":[{\"index\":0,\"embedding\":[1,0,0]}]}"));

        assertThrows(EmbeddingException.class, () -> openAi(http).embed(List.of("a", "b")));
    }

    @Test
    void shouldCallGoogleBatchEndpointWithApiKeyHeader() throws Exception {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 200, """
                {"embeddings": [{"values": [0.1, 0.2]}, {"values": [0.3, 0.4]}]}
                """));
        GoogleEmbeddingProvider provider = new GoogleEmbeddingProvider(
                http.client, NO_WAIT, "http://google.test/v1beta/models/", "g-key", "text-embedding-004", 2);

        List<float[]> vectors = provider.embed(List.of("a", " "));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 0.3f, 0.4f }, vectors.get(1));
        assertEquals("g-key", http.requests.get(0).header("x-goog-api-key"));
        assertEquals("http://google.test/v1beta/models/text-embedding-004:batchEmbedContents",
                http.requests.get(0).url().toString());
    }

    @Test
    void shouldHalveOllamaInputOnContextLengthRejection() throws Exception {
        StubHttp http = new StubHttp((chain, call) -> chain.request().body().contentLength() > 2000
                ? StubHttp.json(chain, 400, "{\"error\":\"the input length exceeds the context length\"}")
                : StubHttp.json(chain, 200, "{\"embeddings\":[[0.25,0.75]]}"));
        OllamaEmbeddingProvider provider = new OllamaEmbeddingProvider(
                http.client, NO_WAIT, "http://ollama.test:11434/", "nomic-embed-text", 2);

        List<float[]> vectors = provider.embed(List.of("y".repeat(9000)));

        assertArrayEquals(new float[] { 0.25f, 0.75f }, vectors.get(0));
        assertEquals(3, http.calls());
        assertEquals("http://ollama.test:11434/api/embed", http.requests.get(0).url().toString());
    }

    @Test
    void shouldFailOllamaWhenModelReturnsNoEmbeddings() {
        StubHttp http = new StubHttp((chain, call) -> StubHttp.json(chain, 200, "{\"embeddings\":[]}"));
        OllamaEmbeddingProvider provider = new OllamaEmbeddingProvider(
                http.client, NO_WAIT, "http://ollama.test:11434", "missing-model", 2);

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> provider.embed(List.of("x")));

        assertTrue(error.getMessage().contains("ollama pull missing-model"));
    }
}

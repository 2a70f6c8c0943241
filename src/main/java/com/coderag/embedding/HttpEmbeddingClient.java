package com.coderag.embedding;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * JSON-over-HTTP transport shared by the remote providers. Rate limiting and 5xx replies are retried with
 * exponential backoff; connection failures surface as {@link EmbeddingProviderUnavailableException}.
 */
class HttpEmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final RetryPolicy retryPolicy;
    private final String providerName;

    HttpEmbeddingClient(OkHttpClient httpClient, RetryPolicy retryPolicy, String providerName) {
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
        this.providerName = providerName;
    }

    JsonNode postJson(String url, Object payload, Map<String, String> headers) throws EmbeddingException {
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new EmbeddingException("Cannot serialize " + providerName + " request", e);
        }

        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Request.Builder request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(body, JSON));
            headers.forEach(request::header);

            boolean lastAttempt = attempt == maxAttempts - 1;
            try (Response response = httpClient.newCall(request.build()).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody == null ? "" : responseBody.string();
                if (response.isSuccessful()) {
                    return mapper.readTree(text);
                }
                if (retryPolicy.isRetryable(response.code()) && !lastAttempt) {
                    backoff(attempt, "HTTP " + response.code());
                    continue;
                }
                throw new EmbeddingException(
                        providerName + " API error: " + response.code() + " - " + abbreviate(text),
                        response.code(),
                        null);
            } catch (ConnectException | UnknownHostException e) {
                throw new EmbeddingProviderUnavailableException(
                        "Cannot connect to " + providerName + " at " + url + ". Check that the service is running and reachable.", e);
            } catch (EmbeddingException e) {
                throw e;
            } catch (InterruptedIOException e) {
                // socket and call timeouts
                if (lastAttempt) {
                    throw new EmbeddingException(providerName + " request timed out after " + maxAttempts + " attempts", e);
                }
                backoff(attempt, "timeout");
            } catch (IOException e) {
                throw new EmbeddingException(providerName + " request failed: " + e.getMessage(), e);
            }
        }
        throw new EmbeddingException(providerName + " request failed after " + maxAttempts + " attempts");
    }

    private void backoff(int attempt, String reason) throws EmbeddingException {
        Duration wait = retryPolicy.delayBeforeRetry(attempt);
        log.warn("embedding.retry provider={} reason={} attempt={}/{} waitMs={}",
                providerName, reason, attempt + 1, retryPolicy.maxAttempts(), wait.toMillis());
        if (wait.isZero()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException(providerName + " retry interrupted", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}

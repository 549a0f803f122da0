package com.crossvenue.arb.infra;

import com.crossvenue.arb.exception.RateLimitedException;
import com.crossvenue.arb.exception.RejectedOrderException;
import com.crossvenue.arb.exception.TransientVenueException;
import com.crossvenue.arb.exception.VenueException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * One venue's HTTP plumbing: rate limiting, the status-code to exception mapping and JSON
 * decoding. Retries are left to the caller's {@link RetryPolicy}.
 */
@Slf4j
public class JsonHttpTransport {

    public static final MediaType JSON = MediaType.parse("application/json");
    private static final String USER_AGENT = "cross-venue-arb/0.1";
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    public record JsonResponse(int code, JsonNode body, Headers headers) {
    }

    private final String venueId;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RequestRateLimiter rateLimiter;
    private final RequestAuthenticator authenticator;

    public JsonHttpTransport(String venueId, OkHttpClient httpClient, ObjectMapper objectMapper,
                             RequestRateLimiter rateLimiter, RequestAuthenticator authenticator) {
        this.venueId = venueId;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
    }

    public JsonResponse get(String url) {
        Request request = baseRequest(url).get().build();
        return execute(request, false);
    }

    public JsonResponse postOrder(String url, JsonNode payload) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = baseRequest(url).post(RequestBody.create(json, JSON)).build();
            return execute(request, true);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new VenueException(venueId, "could not encode order payload", e);
        }
    }

    public JsonResponse delete(String url) {
        Request request = baseRequest(url).delete().build();
        return execute(request, false);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private Request.Builder baseRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
    }

    private JsonResponse execute(Request request, boolean orderRequest) {
        rateLimiter.acquire();
        Request signed = authenticator.authenticate(request);

        try (Response response = httpClient.newCall(signed).execute()) {
            String body = readBody(response.body());
            int code = response.code();

            if (response.isSuccessful()) {
                JsonNode node = body.isEmpty() ? objectMapper.nullNode() : objectMapper.readTree(body);
                return new JsonResponse(code, node, response.headers());
            }

            log.debug("[{}] {} {} -> {} {}", venueId, request.method(), request.url().encodedPath(), code, body);
            if (code == 429) {
                throw new RateLimitedException(venueId, retryAfter(response.header("Retry-After")));
            }
            if (code >= 500) {
                throw new TransientVenueException(venueId, "HTTP " + code + " from " + request.url().encodedPath());
            }
            if (code == 401 || code == 403) {
                throw new VenueException(venueId, "authentication failed (HTTP " + code + ")");
            }
            if (orderRequest) {
                throw new RejectedOrderException(venueId, "order rejected (HTTP " + code + "): " + body);
            }
            throw new VenueException(venueId, "HTTP " + code + " from " + request.url().encodedPath() + ": " + body);
        } catch (IOException e) {
            throw new TransientVenueException(venueId, "I/O failure calling " + request.url().encodedPath(), e);
        }
    }

    private static String readBody(ResponseBody body) throws IOException {
        return body == null ? "" : body.string();
    }

    static Duration retryAfter(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_RETRY_AFTER;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
        } catch (NumberFormatException e) {
            // HTTP-date form is not worth parsing for a one-second hint
            return DEFAULT_RETRY_AFTER;
        }
    }
}

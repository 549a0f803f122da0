package com.crossvenue.arb.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Map;

/**
 * Posts alerts to a Discord/Slack style incoming webhook. Both accept a JSON body with a
 * text field ({@code content} for Discord, {@code text} for Slack), so both are sent.
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private final String webhookUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookAlertSink(String webhookUrl, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.webhookUrl = webhookUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void notify(AlertSeverity severity, String message, Map<String, Object> context) {
        String text = format(severity, message, context);
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("content", text);
        payload.put("text", text);

        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(payload.toString(), JsonHttpTransport.JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Webhook alert rejected: HTTP {}", response.code());
            }
        } catch (IOException e) {
            log.warn("Webhook alert failed: {}", e.getMessage());
        }
    }

    static String format(AlertSeverity severity, String message, Map<String, Object> context) {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severity).append("] ")
                .append(message);
        context.forEach((k, v) -> sb.append("\n").append(k).append(": ").append(v));
        return sb.toString();
    }
}

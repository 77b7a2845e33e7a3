package com.ewsmon.service.core.notify;

import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.config.HttpClientConfig;
import com.ewsmon.service.core.support.JsonUtil;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Posts an Adaptive Card (schema 1.4) to the operators' Teams Workflows webhook.
 *
 * <p>Best effort: a blank webhook URL disables the channel, oversized cards are dropped, and delivery failures are
 * logged and swallowed.
 */
@Component
@Slf4j
public class TeamsCardSender {

    static final MediaType JSON = MediaType.parse("application/json");
    static final String CARD_CONTENT_TYPE = "application/vnd.microsoft.card.adaptive";
    static final int MAX_FACT_CHARS = 500;

    private final OkHttpClient client;
    private final EwsmonProperties properties;

    public TeamsCardSender(@Qualifier(HttpClientConfig.ALERT_CLIENT) OkHttpClient client, EwsmonProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    /** @return {@code true} when the webhook accepted the card */
    public boolean send(String title, String subtitle, Map<String, String> facts) {
        String webhookUrl = properties.getAlerts().getTeamsWebhookUrl();
        if (webhookUrl.isBlank()) {
            return false;
        }
        byte[] payload = JsonUtil.toJsonBytes(buildPayload(title, subtitle, facts));
        int maxBytes = properties.getAlerts().getMaxCardBytes();
        if (payload.length > maxBytes) {
            log.warn("Teams card payload too large, skipping send size={} max={}", payload.length, maxBytes);
            return false;
        }

        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(payload, JSON))
                .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody body = response.body();
                log.warn(
                        "Teams webhook request failed status={} response={}",
                        response.code(),
                        head(body != null ? body.string() : "", 200));
                return false;
            }
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Teams webhook request error type={} error={}", ex.getClass().getSimpleName(), ex.getMessage());
            return false;
        }
    }

    public boolean send(AlertMessage message) {
        return send(message.title(), message.subtitle(), message.facts());
    }

    static ObjectNode buildPayload(String title, String subtitle, Map<String, String> facts) {
        ObjectNode card = JsonUtil.createObject();
        card.put("$schema", "http://adaptivecards.io/schemas/adaptive-card.json");
        card.put("type", "AdaptiveCard");
        card.put("version", "1.4");
        ArrayNode body = card.putArray("body");
        body.addObject()
                .put("type", "TextBlock")
                .put("text", title)
                .put("size", "Large")
                .put("weight", "Bolder")
                .put("wrap", true);
        body.addObject()
                .put("type", "TextBlock")
                .put("text", subtitle)
                .put("wrap", true)
                .put("spacing", "Small");
        ArrayNode factSet = body.addObject().put("type", "FactSet").putArray("facts");
        facts.forEach((name, value) ->
                factSet.addObject().put("title", name).put("value", head(String.valueOf(value), MAX_FACT_CHARS)));

        ObjectNode root = JsonUtil.createObject();
        root.putArray("attachments")
                .addObject()
                .put("contentType", CARD_CONTENT_TYPE)
                .set("content", card);
        return root;
    }

    static String head(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}

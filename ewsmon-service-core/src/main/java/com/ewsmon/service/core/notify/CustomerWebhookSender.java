package com.ewsmon.service.core.notify;

import com.ewsmon.model.AlertEventType;
import com.ewsmon.model.WebhookSubscription;
import com.ewsmon.service.core.config.HttpClientConfig;
import com.ewsmon.service.core.repo.WebhookSubscriptionRepository;
import com.ewsmon.service.core.support.JsonUtil;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Delivers availability events to every active subscription that lists the event.
 *
 * <p>The payload is serialised once and each subscription signs those exact bytes with its own secret. Delivery is
 * fire-and-forget: one attempt per subscription, outcomes are only logged.
 */
@Component
@Slf4j
public class CustomerWebhookSender {

    static final MediaType JSON = MediaType.parse("application/json");

    private final WebhookSubscriptionRepository subscriptions;
    private final OkHttpClient client;

    public CustomerWebhookSender(
            WebhookSubscriptionRepository subscriptions,
            @Qualifier(HttpClientConfig.ALERT_CLIENT) OkHttpClient client) {
        this.subscriptions = subscriptions;
        this.client = client;
    }

    /** @return number of subscriptions that accepted the event */
    public int fire(AlertEventType eventType, Map<String, Object> payload) {
        List<WebhookSubscription> active;
        try {
            active = subscriptions.findActive();
        } catch (DataAccessException ex) {
            log.warn("Webhook subscriptions unavailable event={} error={}", eventType.wireValue(), ex.getMessage());
            return 0;
        }
        List<WebhookSubscription> subscribed =
                active.stream().filter(s -> s.subscribesTo(eventType)).toList();
        log.info(
                "Firing customer webhooks event={} active={} subscribed={}",
                eventType.wireValue(),
                active.size(),
                subscribed.size());
        if (subscribed.isEmpty()) {
            return 0;
        }

        byte[] body = JsonUtil.toJsonBytes(payload);
        int delivered = 0;
        for (WebhookSubscription sub : subscribed) {
            if (deliver(sub, eventType, body)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(WebhookSubscription sub, AlertEventType eventType, byte[] body) {
        try {
            String secret = sub.secret() == null ? "" : sub.secret();
            Request request = new Request.Builder()
                    .url(sub.url())
                    .header(WebhookSigner.HEADER, WebhookSigner.sign(body, secret))
                    .post(RequestBody.create(body, JSON))
                    .build();
            try (Response response = client.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info(
                            "Webhook delivered webhookId={} event={} status={}",
                            sub.id(),
                            eventType.wireValue(),
                            response.code());
                    return true;
                }
                ResponseBody responseBody = response.body();
                String snippet = responseBody != null ? responseBody.string() : "";
                log.warn(
                        "Webhook delivery failed webhookId={} event={} status={} response={}",
                        sub.id(),
                        eventType.wireValue(),
                        response.code(),
                        snippet.length() > 200 ? snippet.substring(0, 200) : snippet);
                return false;
            }
        } catch (IOException | RuntimeException ex) {
            log.warn(
                    "Webhook delivery error webhookId={} event={} type={} error={}",
                    sub.id(),
                    eventType.wireValue(),
                    ex.getClass().getSimpleName(),
                    ex.getMessage());
            return false;
        }
    }
}

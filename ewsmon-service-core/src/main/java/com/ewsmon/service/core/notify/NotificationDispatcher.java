package com.ewsmon.service.core.notify;

import com.ewsmon.service.core.alert.Alert;
import com.ewsmon.service.core.config.ClockConfig;
import com.ewsmon.service.core.config.EwsmonProperties;
import jakarta.annotation.PreDestroy;
import java.time.ZoneId;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Hands alerts to the Teams and customer webhook channels on a dedicated worker pool so that slow receivers never
 * run on the probe scheduling thread. The returned futures always complete normally.
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final TeamsCardSender teams;
    private final CustomerWebhookSender webhooks;
    private final ExecutorService executor;
    private final ZoneId zone;

    @Autowired
    public NotificationDispatcher(
            TeamsCardSender teams,
            CustomerWebhookSender webhooks,
            EwsmonProperties properties,
            @Qualifier(ClockConfig.ALERT_ZONE) ZoneId zone) {
        this(teams, webhooks, Executors.newFixedThreadPool(properties.getAlerts().getWorkers(), namedThreads()), zone);
    }

    NotificationDispatcher(
            TeamsCardSender teams, CustomerWebhookSender webhooks, ExecutorService executor, ZoneId zone) {
        this.teams = teams;
        this.webhooks = webhooks;
        this.executor = executor;
        this.zone = zone;
    }

    public CompletableFuture<Void> dispatch(Alert alert) {
        AlertMessage message = AlertMessage.from(alert, zone);
        try {
            CompletableFuture<Void> card = CompletableFuture.runAsync(() -> teams.send(message), executor);
            CompletableFuture<Void> hooks =
                    CompletableFuture.runAsync(() -> webhooks.fire(message.type(), message.webhookPayload()), executor);
            return CompletableFuture.allOf(card, hooks).handle((ignored, ex) -> {
                if (ex != null) {
                    log.warn("Alert delivery failed targetId={} event={}", message.targetId(), message.type(), ex);
                } else {
                    log.info("Alert sent targetId={} title=\"{}\"", message.targetId(), message.title());
                }
                return null;
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Alert dropped, notification pool is shut down targetId={}", message.targetId());
            return CompletableFuture.completedFuture(null);
        }
    }

    @PreDestroy
    void stop() {
        executor.shutdown();
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ewsmon-notify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

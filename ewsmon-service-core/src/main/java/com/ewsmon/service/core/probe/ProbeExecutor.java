package com.ewsmon.service.core.probe;

import com.ewsmon.model.Environment;
import com.ewsmon.model.ProbeOutcome;
import com.ewsmon.model.Target;
import com.ewsmon.service.core.config.EwsmonProperties;
import com.ewsmon.service.core.config.EwsmonProperties.EnvironmentCredentials;
import com.ewsmon.service.core.config.HttpClientConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Performs one timed SOAP call per target and classifies the result.
 *
 * <p>Never throws: unsupported operations, missing credentials, non-200 answers and transport errors all come back
 * as a failed {@link ProbeOutcome} with a diagnostic message.
 */
@Component
@Slf4j
public class ProbeExecutor {

    static final int BODY_SNIPPET_CHARS = 800;

    private final ProbeRequestBuilder requestBuilder;
    private final EwsmonProperties properties;
    private final OkHttpClient client;
    private final Clock clock;

    public ProbeExecutor(
            ProbeRequestBuilder requestBuilder,
            EwsmonProperties properties,
            @Qualifier(HttpClientConfig.PROBE_CLIENT) OkHttpClient client,
            Clock clock) {
        this.requestBuilder = requestBuilder;
        this.properties = properties;
        this.client = client;
        this.clock = clock;
    }

    public ProbeOutcome probe(Target target) {
        Optional<ProbeRequest> built;
        try {
            built = requestBuilder.build(target, LocalDate.now(clock));
        } catch (RuntimeException ex) {
            log.warn("Probe request could not be built target={} apiType={}", target.name(), target.apiType(), ex);
            return ProbeOutcome.notAttempted("request build failed for api_type=%s: %s"
                    .formatted(target.apiType(), ex.getMessage()));
        }
        if (built.isEmpty()) {
            return ProbeOutcome.notAttempted("payload not implemented for api_type=" + target.apiType());
        }

        Environment environment = target.environment();
        EnvironmentCredentials credentials = properties.getCredentials().forEnvironment(environment);
        if (!credentials.isComplete()) {
            return ProbeOutcome.notAttempted("missing creds for " + environment.label() + " (PUROLATOR_* env vars)");
        }

        ProbeRequest request = built.get();
        long start = System.nanoTime();
        try {
            Request.Builder http = new Request.Builder()
                    .url(target.url())
                    .header("Authorization", Credentials.basic(credentials.getKey(), credentials.getPassword()))
                    .post(RequestBody.create(
                            request.body().getBytes(StandardCharsets.UTF_8),
                            MediaType.parse(request.contentType())));
            for (Map.Entry<String, String> header : request.headers().entrySet()) {
                if (!ProbeRequestBuilder.CONTENT_TYPE_HEADER.equalsIgnoreCase(header.getKey())) {
                    http.header(header.getKey(), header.getValue());
                }
            }

            try (Response response = client.newCall(http.build()).execute()) {
                int status = response.code();
                if (status == 200) {
                    return ProbeOutcome.success(status, elapsedMs(start));
                }
                String contentType = response.header("Content-Type", "");
                ResponseBody body = response.body();
                String text = body != null ? body.string() : "";
                double ms = elapsedMs(start);
                String error = "[%s] http %d ct=%s body_snip=%s"
                        .formatted(environment.label(), status, contentType, snippet(text));
                return ProbeOutcome.failure(status, ms, error);
            }
        } catch (IOException | RuntimeException ex) {
            double ms = elapsedMs(start);
            if (log.isDebugEnabled()) {
                log.debug("Probe transport failure target={} url={}", target.name(), target.url(), ex);
            }
            return ProbeOutcome.failure(
                    null,
                    ms,
                    "[%s] %s: %s".formatted(environment.label(), ex.getClass().getSimpleName(), ex.getMessage()));
        }
    }

    static String snippet(String text) {
        if (text == null) {
            return "";
        }
        String head = text.length() > BODY_SNIPPET_CHARS ? text.substring(0, BODY_SNIPPET_CHARS) : text;
        return head.replace("\n", "\\n");
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}

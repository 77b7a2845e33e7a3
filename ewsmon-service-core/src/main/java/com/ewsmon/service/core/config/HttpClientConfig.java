package com.ewsmon.service.core.config;

import java.net.Inet4Address;
import java.util.ArrayList;
import okhttp3.Dns;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** OkHttp clients for probe traffic and for alert delivery; both share one connection pool and dispatcher. */
@Configuration
public class HttpClientConfig {

    public static final String PROBE_CLIENT = "probeHttpClient";
    public static final String ALERT_CLIENT = "alertHttpClient";

    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient base = new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build();

    // 3xx answers count as failed probes, so redirects are never followed
    @Bean(PROBE_CLIENT)
    public OkHttpClient probeHttpClient(EwsmonProperties properties) {
        return base.newBuilder()
                .callTimeout(properties.getProbe().getTimeout())
                .followRedirects(false)
                .followSslRedirects(false)
                .build();
    }

    @Bean(ALERT_CLIENT)
    public OkHttpClient alertHttpClient(EwsmonProperties properties) {
        return base.newBuilder()
                .callTimeout(properties.getAlerts().getRequestTimeout())
                .build();
    }
}

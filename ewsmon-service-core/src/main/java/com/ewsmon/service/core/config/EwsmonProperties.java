package com.ewsmon.service.core.config;

import com.ewsmon.model.Environment;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component("ewsmonProperties")
@ConfigurationProperties(prefix = "ewsmon")
public class EwsmonProperties {

    private Duration pollInterval = Duration.ofSeconds(10);
    private Probe probe = new Probe();
    private Retention retention = new Retention();
    private Alerts alerts = new Alerts();
    private Credentials credentials = new Credentials();

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public static class Probe {
        private Duration timeout = Duration.ofSeconds(20);
        private int maxConcurrency = 32;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(1, maxConcurrency);
        }
    }

    public static class Retention {
        private int days = 14;
        private Duration cleanupInterval = Duration.ofHours(1);

        public int getDays() {
            return days;
        }

        public void setDays(int days) {
            this.days = days;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    public static class Alerts {
        private Duration cooldown = Duration.ofSeconds(300);
        private String teamsWebhookUrl = "";
        private Duration requestTimeout = Duration.ofSeconds(5);
        private int maxCardBytes = 256 * 1024;
        private int workers = 4;
        private String timeZone = "America/Toronto";

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public String getTeamsWebhookUrl() {
            return teamsWebhookUrl;
        }

        public void setTeamsWebhookUrl(String teamsWebhookUrl) {
            this.teamsWebhookUrl = teamsWebhookUrl == null ? "" : teamsWebhookUrl.trim();
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxCardBytes() {
            return maxCardBytes;
        }

        public void setMaxCardBytes(int maxCardBytes) {
            this.maxCardBytes = maxCardBytes;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }
    }

    public static class Credentials {
        private EnvironmentCredentials prod = EnvironmentCredentials.withDefaults();
        private EnvironmentCredentials uat = EnvironmentCredentials.withDefaults();

        public EnvironmentCredentials getProd() {
            return prod;
        }

        public void setProd(EnvironmentCredentials prod) {
            this.prod = prod;
        }

        public EnvironmentCredentials getUat() {
            return uat;
        }

        public void setUat(EnvironmentCredentials uat) {
            this.uat = uat;
        }

        public EnvironmentCredentials forEnvironment(Environment environment) {
            return environment == Environment.UAT ? uat : prod;
        }
    }

    /** Basic-auth key pair, billing accounts and known-good test identifiers for one environment. */
    public static class EnvironmentCredentials {
        static final String DEFAULT_TRACK_PIN = "335258857374";
        static final String DEFAULT_FREIGHT_TRACK_PIN = "8889768050";
        static final String DEFAULT_SHIPTRACK_ID = "520111990344";
        static final String DEFAULT_FREIGHT_ACCOUNT = "5553761";

        private String key = "";
        private String password = "";
        private String account = "";
        private String freightAccount = DEFAULT_FREIGHT_ACCOUNT;
        private String trackPin = DEFAULT_TRACK_PIN;
        private String freightTrackPin = DEFAULT_FREIGHT_TRACK_PIN;
        private String shiptrackId = DEFAULT_SHIPTRACK_ID;

        public static EnvironmentCredentials withDefaults() {
            return new EnvironmentCredentials();
        }

        public boolean isComplete() {
            return !key.isEmpty() && !password.isEmpty();
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = nullToEmpty(key);
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = nullToEmpty(password);
        }

        public String getAccount() {
            return account;
        }

        public void setAccount(String account) {
            this.account = nullToEmpty(account);
        }

        public String getFreightAccount() {
            return freightAccount;
        }

        public void setFreightAccount(String freightAccount) {
            this.freightAccount = orDefault(freightAccount, DEFAULT_FREIGHT_ACCOUNT);
        }

        public String getTrackPin() {
            return trackPin;
        }

        public void setTrackPin(String trackPin) {
            this.trackPin = orDefault(trackPin, DEFAULT_TRACK_PIN);
        }

        public String getFreightTrackPin() {
            return freightTrackPin;
        }

        public void setFreightTrackPin(String freightTrackPin) {
            this.freightTrackPin = orDefault(freightTrackPin, DEFAULT_FREIGHT_TRACK_PIN);
        }

        public String getShiptrackId() {
            return shiptrackId;
        }

        public void setShiptrackId(String shiptrackId) {
            this.shiptrackId = orDefault(shiptrackId, DEFAULT_SHIPTRACK_ID);
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value.trim();
        }

        private static String orDefault(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value.trim();
        }
    }
}

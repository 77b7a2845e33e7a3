package com.ewsmon.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.ewsmon.model.Target;
import com.ewsmon.model.WebhookSubscription;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

class JdbcTargetRegistryTest {

    private EmbeddedDatabase db;
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:db/schema.sql")
                .build();
        jdbc = new NamedParameterJdbcTemplate(db);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void findEnabledSkipsDisabledAndOrdersById() {
        insertTarget("Track", "track", "urn:track", true);
        insertTarget("Locator", "locate", null, false);
        insertTarget("Validate", "validate", "urn:validate", true);

        List<Target> targets = new JdbcTargetRegistry(jdbc).findEnabled();

        assertThat(targets).extracting(Target::name).containsExactly("Track", "Validate");
        assertThat(targets.get(0).soapAction()).isEqualTo("urn:track");
        assertThat(targets.get(0).apiType()).isEqualTo("track");
        assertThat(targets.get(0).id()).isLessThan(targets.get(1).id());
    }

    @Test
    void findActiveReturnsOnlyActiveSubscriptions() {
        insertSubscription("https://hooks.example.com/a", "s1", "up,down", true);
        insertSubscription("https://hooks.example.com/b", "s2", "down", false);

        List<WebhookSubscription> active = new JdbcWebhookSubscriptionRepository(jdbc).findActive();

        assertThat(active).singleElement().satisfies(sub -> {
            assertThat(sub.url()).isEqualTo("https://hooks.example.com/a");
            assertThat(sub.secret()).isEqualTo("s1");
            assertThat(sub.subscribesTo("down")).isTrue();
        });
    }

    private void insertTarget(String name, String apiType, String soapAction, boolean enabled) {
        jdbc.update(
                """
            insert into api_target(name, url, soap_action, api_type, enabled)
            values (:name, :url, :soap_action, :api_type, :enabled)
            """,
                new MapSqlParameterSource()
                        .addValue("name", name)
                        .addValue("url", "https://webservices.purolator.com/" + name)
                        .addValue("soap_action", soapAction)
                        .addValue("api_type", apiType)
                        .addValue("enabled", enabled));
    }

    private void insertSubscription(String url, String secret, String events, boolean active) {
        jdbc.update(
                """
            insert into webhook_subscription(url, secret, events, active)
            values (:url, :secret, :events, :active)
            """,
                new MapSqlParameterSource()
                        .addValue("url", url)
                        .addValue("secret", secret)
                        .addValue("events", events)
                        .addValue("active", active));
    }
}

package com.ewsmon.service.storage.impl;

import com.ewsmon.model.WebhookSubscription;
import com.ewsmon.service.core.repo.WebhookSubscriptionRepository;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcWebhookSubscriptionRepository implements WebhookSubscriptionRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcWebhookSubscriptionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<WebhookSubscription> findActive() {
        return jdbc.query(
                """
            select id, url, secret, events, active
            from webhook_subscription
            where active = true
            order by id
            """,
                new MapSqlParameterSource(),
                (rs, rowNum) -> new WebhookSubscription(
                        rs.getLong("id"),
                        rs.getString("url"),
                        rs.getString("secret"),
                        rs.getString("events"),
                        rs.getBoolean("active")));
    }
}

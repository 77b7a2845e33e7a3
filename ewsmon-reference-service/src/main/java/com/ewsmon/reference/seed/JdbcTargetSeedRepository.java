package com.ewsmon.reference.seed;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
class JdbcTargetSeedRepository implements TargetSeedRepository {

    private final NamedParameterJdbcTemplate jdbc;

    JdbcTargetSeedRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Set<String> existingNames() {
        return new HashSet<>(
                jdbc.queryForList("select name from api_target", new MapSqlParameterSource(), String.class));
    }

    @Override
    public int insert(List<TargetSeed> seeds) {
        if (seeds == null || seeds.isEmpty()) {
            return 0;
        }
        String sql =
                """
                insert into api_target (name, url, soap_action, api_type, enabled)
                values (:name, :url, :soap_action, :api_type, true)
                """;
        MapSqlParameterSource[] batch = seeds.stream()
                .map(seed -> new MapSqlParameterSource()
                        .addValue("name", seed.name())
                        .addValue("url", seed.url())
                        .addValue("soap_action", seed.soapAction())
                        .addValue("api_type", seed.apiType()))
                .toArray(MapSqlParameterSource[]::new);
        int inserted = 0;
        for (int result : jdbc.batchUpdate(sql, batch)) {
            inserted += result < 0 ? 1 : result;
        }
        return inserted;
    }
}

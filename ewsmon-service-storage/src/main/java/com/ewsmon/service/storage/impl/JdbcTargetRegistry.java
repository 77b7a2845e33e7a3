package com.ewsmon.service.storage.impl;

import com.ewsmon.model.Target;
import com.ewsmon.service.core.repo.TargetRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTargetRegistry implements TargetRegistry {

    private static final String FIND_ENABLED =
            """
            select id, name, url, soap_action, api_type, enabled
            from api_target
            where enabled = true
            order by id
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTargetRegistry(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Target> findEnabled() {
        return jdbc.query(FIND_ENABLED, new MapSqlParameterSource(), (rs, rowNum) -> mapTarget(rs));
    }

    static Target mapTarget(ResultSet rs) throws SQLException {
        return new Target(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("url"),
                rs.getString("soap_action"),
                rs.getString("api_type"),
                rs.getBoolean("enabled"));
    }
}

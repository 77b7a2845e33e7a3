package com.ewsmon.service.storage.impl;

import com.ewsmon.model.ProbeResult;
import com.ewsmon.service.core.repo.ProbeResultRepository;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@code api_probe} access. Timestamps are always bound from the caller, never defaulted by the database, so every
 * row of one cycle carries the same instant. A cycle's batch insert is a single transaction.
 */
@Repository
public class JdbcProbeResultRepository implements ProbeResultRepository {

    // ties on ts are broken by id so the most recently inserted row wins
    private static final String LATEST_STATES =
            """
            select target_id, ok
            from (
                select target_id,
                       ok,
                       row_number() over (partition by target_id order by ts desc, id desc) as rn
                from api_probe
                where target_id in (:target_ids)
            ) latest
            where rn = 1
            """;

    private static final String INSERT =
            """
            insert into api_probe(target_id, ts, ok, http_status, duration_ms, error)
            values (:target_id, :ts, :ok, :http_status, :duration_ms, :error)
            """;

    private static final String DELETE_OLDER_THAN = "delete from api_probe where ts < :cutoff";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcProbeResultRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Map<Long, Boolean> latestStates(Collection<Long> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, Boolean> states = new HashMap<>();
        jdbc.query(
                LATEST_STATES,
                new MapSqlParameterSource("target_ids", targetIds),
                rs -> {
                    states.put(rs.getLong("target_id"), rs.getBoolean("ok"));
                });
        return states;
    }

    /** All rows of one cycle are written together or not at all. */
    @Override
    @Transactional
    public int insertAll(List<ProbeResult> results) {
        if (results == null || results.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = results.stream()
                .map(JdbcProbeResultRepository::params)
                .toArray(SqlParameterSource[]::new);
        int[] counts = jdbc.batchUpdate(INSERT, batch);
        // drivers may report SUCCESS_NO_INFO (-2) for batched rows
        return Arrays.stream(counts).map(c -> c < 0 ? 1 : c).sum();
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbc.update(DELETE_OLDER_THAN, new MapSqlParameterSource("cutoff", Timestamp.from(cutoff)));
    }

    private static SqlParameterSource params(ProbeResult result) {
        return new MapSqlParameterSource()
                .addValue("target_id", result.targetId())
                .addValue("ts", Timestamp.from(result.timestamp()))
                .addValue("ok", result.ok())
                .addValue("http_status", result.httpStatus(), Types.INTEGER)
                .addValue("duration_ms", result.durationMs(), Types.DOUBLE)
                .addValue("error", result.error(), Types.VARCHAR);
    }
}

package com.ewsmon.service.core.repo;

import com.ewsmon.model.ProbeResult;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Append-only store of probe rows. */
public interface ProbeResultRepository {

    /**
     * Latest stored {@code ok} flag per target, most recent by timestamp then id.
     * Targets without any stored probe are absent from the map.
     */
    Map<Long, Boolean> latestStates(Collection<Long> targetIds);

    /** Inserts every result as a new row and returns the number of rows written. */
    int insertAll(List<ProbeResult> results);

    /** Deletes rows with a timestamp strictly before {@code cutoff}. */
    int deleteOlderThan(Instant cutoff);
}

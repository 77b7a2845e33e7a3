package com.ewsmon.service.core.repo;

import com.ewsmon.model.Target;
import java.util.List;

/** Read access to the monitored targets. Writes belong to the admin surface. */
public interface TargetRegistry {

    /** Enabled targets ordered by id. */
    List<Target> findEnabled();
}

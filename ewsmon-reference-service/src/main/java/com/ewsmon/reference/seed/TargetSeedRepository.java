package com.ewsmon.reference.seed;

import java.util.List;
import java.util.Set;

public interface TargetSeedRepository {

    Set<String> existingNames();

    int insert(List<TargetSeed> seeds);
}

package com.entitygraph.core.integrity;

import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.NormalizedEntities;

/**
 * Caller-supplied repair for one violation type, replacing the built-in action.
 */
@FunctionalInterface
public interface RepairHandler {

    /**
     * @param violation violation to repair
     * @param entities store as repaired so far
     * @return store after this repair
     */
    NormalizedEntities handle(IntegrityViolation violation, NormalizedEntities entities);
}

package com.platform.clonegovernance.compliance;

import java.util.List;

/**
 * Read access to the live clones owned by the clone management component.
 */
public interface CloneRegistry {

    /**
     * Number of live clones owned by the actor, across all scopes.
     */
    long countLiveClones(String actor);

    /**
     * One page of live clones, optionally limited to a scope. Pages are ordered stably.
     */
    List<LiveClone> findLiveClones(String scope, int page, int size);
}

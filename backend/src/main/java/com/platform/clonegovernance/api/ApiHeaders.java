package com.platform.clonegovernance.api;

import com.platform.clonegovernance.evaluation.ActorIdentity;

/**
 * Headers that identify the caller of administrative endpoints.
 */
final class ApiHeaders {

    static final String ACTOR = "X-Actor";
    static final String ACTOR_ROLE = "X-Actor-Role";

    private ApiHeaders() {
    }

    static ActorIdentity actor(String user, String role) {
        return new ActorIdentity(user.trim(), role, null, null);
    }
}

package com.platform.clonegovernance.evaluation;

import jakarta.validation.constraints.NotBlank;

/**
 * Identity of the actor performing an operation, supplied by the caller.
 *
 * @param user      user name
 * @param role      active role
 * @param sessionId session identifier, if known
 * @param clientIp  client address, if known
 */
public record ActorIdentity(
    @NotBlank String user,
    String role,
    String sessionId,
    String clientIp
) {

    public static ActorIdentity system() {
        return new ActorIdentity("system", null, null, null);
    }

    public static ActorIdentity of(String user) {
        return new ActorIdentity(user, null, null, null);
    }
}

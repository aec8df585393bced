package ai.pipestream.workspace.identity;

import java.time.Instant;
import java.util.Objects;

/**
 * An authenticated principal, already verified by the authentication boundary.
 * The engine trusts it completely and performs no credential checks of its own.
 *
 * @param userId          stable user identifier
 * @param authMethod      native or federated login
 * @param sessionIssuedAt when the session backing this identity was issued
 */
public record Identity(String userId, AuthMethod authMethod, Instant sessionIssuedAt) {

    public Identity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        Objects.requireNonNull(authMethod, "authMethod");
        Objects.requireNonNull(sessionIssuedAt, "sessionIssuedAt");
    }

    public static Identity nativeUser(String userId) {
        return new Identity(userId, AuthMethod.nativeLogin(), Instant.now());
    }

    public static Identity federated(String userId, String provider) {
        return new Identity(userId, AuthMethod.oidc(provider), Instant.now());
    }
}

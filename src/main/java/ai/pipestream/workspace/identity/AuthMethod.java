package ai.pipestream.workspace.identity;

import java.util.Objects;

/**
 * How a principal authenticated. Federated logins carry the identity provider name.
 *
 * @param kind     native credential or OIDC federation
 * @param provider OIDC provider name, {@code null} for native logins
 */
public record AuthMethod(Kind kind, String provider) {

    public enum Kind {
        NATIVE,
        OIDC
    }

    private static final AuthMethod NATIVE = new AuthMethod(Kind.NATIVE, null);

    public AuthMethod {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OIDC && (provider == null || provider.isBlank())) {
            throw new IllegalArgumentException("OIDC auth method requires a provider");
        }
        if (kind == Kind.NATIVE && provider != null) {
            throw new IllegalArgumentException("Native auth method has no provider");
        }
    }

    public static AuthMethod nativeLogin() {
        return NATIVE;
    }

    public static AuthMethod oidc(String provider) {
        return new AuthMethod(Kind.OIDC, provider);
    }

    public boolean isFederated() {
        return kind == Kind.OIDC;
    }
}

package com.modelgateway.provider;

/**
 * Failure reported by a provider adapter.
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorKind kind;
    private final String provider;

    public ProviderException(ProviderErrorKind kind, String provider, String message) {
        super(message);
        this.kind = kind;
        this.provider = provider;
    }

    public ProviderException(ProviderErrorKind kind, String provider, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
    }

    public static ProviderException transientError(String provider, String message) {
        return new ProviderException(ProviderErrorKind.TRANSIENT, provider, message);
    }

    public static ProviderException permanentError(String provider, String message) {
        return new ProviderException(ProviderErrorKind.PERMANENT, provider, message);
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isTransient() {
        return kind == ProviderErrorKind.TRANSIENT;
    }
}

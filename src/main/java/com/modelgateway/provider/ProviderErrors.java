package com.modelgateway.provider;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw client failures onto {@link ProviderException} kinds.
 */
public final class ProviderErrors {

    private ProviderErrors() {
    }

    /**
     * Classify an error raised while calling {@code provider}.
     *
     * Timeouts, connection failures, 408, 429 and 5xx are transient; any other
     * 4xx is permanent. Anything unrecognised is treated as transient so it is
     * charged to provider health rather than to the caller.
     */
    public static ProviderException classify(String provider, Throwable error) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }

        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            String message = provider + " returned HTTP " + status;
            if (status == 408 || status == 429 || status >= 500) {
                return new ProviderException(ProviderErrorKind.TRANSIENT, provider, message, error);
            }
            return new ProviderException(ProviderErrorKind.PERMANENT, provider,
                    message + ": " + truncate(response.getResponseBodyAsString()), error);
        }

        if (error instanceof TimeoutException) {
            return new ProviderException(ProviderErrorKind.TRANSIENT, provider,
                    provider + " timed out", error);
        }

        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new ProviderException(ProviderErrorKind.TRANSIENT, provider,
                    provider + " connection failed: " + error.getMessage(), error);
        }

        return new ProviderException(ProviderErrorKind.TRANSIENT, provider,
                provider + " call failed: " + error.getMessage(), error);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}

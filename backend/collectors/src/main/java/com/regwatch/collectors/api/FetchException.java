package com.regwatch.collectors.api;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

public class FetchException extends Exception {
    private final FetchFailure kind;
    private final int statusCode;

    public FetchException(FetchFailure kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(FetchFailure.TIMEOUT, "Timeout while fetching " + url, 0, cause);
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(FetchFailure.HTTP_STATUS, "HTTP " + statusCode + " from " + url, statusCode, null);
    }

    /**
     * Classifies a transport failure. Timeouts anywhere in the cause chain win over
     * the generic network kind.
     */
    public static FetchException fromTransport(String url, Throwable error) {
        Throwable root = rootCause(error);
        if (error instanceof HttpTimeoutException || root instanceof HttpTimeoutException) {
            return timeout(url, error);
        }
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (lowered.contains("timed out")) {
            return timeout(url, error);
        }
        if (root instanceof UnknownHostException || isReservedInvalidHost(url) || lowered.contains("unknown host")) {
            return new FetchException(FetchFailure.NETWORK, "DNS/unknown host while fetching " + url + ": " + rootText, 0, error);
        }
        return new FetchException(FetchFailure.NETWORK, "Fetch failure for " + url + ": " + rootText, 0, error);
    }

    public FetchFailure kind() {
        return kind;
    }

    /**
     * @return the HTTP status for {@link FetchFailure#HTTP_STATUS}, otherwise 0
     */
    public int statusCode() {
        return statusCode;
    }

    private static boolean isReservedInvalidHost(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null && host.endsWith(".invalid");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}

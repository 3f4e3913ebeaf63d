package com.storesync.resilience;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary failures to {@link ErrorKind}. Never throws: anything it cannot read is UNCLASSIFIED.
 * Rate limiting is checked before network failures, network before GraphQL.
 */
@Slf4j
public class ErrorClassifier {

    static final String RETRY_AFTER_HEADER = "Retry-After";
    static final String TOO_MANY_REQUESTS_CODE = "TOO_MANY_REQUESTS";

    private static final List<String> RATE_LIMIT_PATTERNS = List.of(
            "429", "rate limit", "too many requests", "throttl");
    private static final List<String> NETWORK_PATTERNS = List.of(
            "network", "econnrefused", "etimedout", "enotfound", "econnreset", "fetch failed",
            "connection refused", "connection reset", "timed out");
    private static final int MAX_CAUSE_DEPTH = 16;
    // hints beyond a day are treated as a day
    private static final BigDecimal MAX_RETRY_AFTER_MS = BigDecimal.valueOf(Duration.ofDays(1).toMillis());

    public ClassifiedError classify(Throwable error) {
        if (error == null) {
            return new ClassifiedError(ErrorKind.UNCLASSIFIED, null, "Unknown error", null);
        }
        try {
            return doClassify(error);
        } catch (RuntimeException e) {
            log.debug("Error classification failed for {}: {}", error.getClass().getName(), e.getMessage());
            return new ClassifiedError(ErrorKind.UNCLASSIFIED, null, messageOf(error), error);
        }
    }

    private ClassifiedError doClassify(Throwable error) {
        String message = messageOf(error);
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        int depth = 0;
        for (Throwable t = error; t != null && depth < MAX_CAUSE_DEPTH && seen.put(t, Boolean.TRUE) == null; t = t.getCause(), depth++) {
            if (t instanceof RateLimitException r) {
                return new ClassifiedError(ErrorKind.RATE_LIMITED, r.getRetryAfterMs(), message, error);
            }
            if (t instanceof NetworkException) {
                return new ClassifiedError(ErrorKind.NETWORK, null, message, error);
            }
            if (t instanceof GraphQLApplicationException) {
                return new ClassifiedError(ErrorKind.GRAPHQL, null, message, error);
            }
            if (t instanceof RemoteCallException remote) {
                ErrorKind kind = classifyRemote(remote);
                if (kind != null) {
                    Long retryAfter = kind == ErrorKind.RATE_LIMITED
                            ? parseRetryAfter(remote.getHeader(RETRY_AFTER_HEADER))
                            : null;
                    return new ClassifiedError(kind, retryAfter, message, error);
                }
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException
                    || t instanceof SocketTimeoutException || t instanceof TimeoutException) {
                return new ClassifiedError(ErrorKind.NETWORK, null, message, error);
            }
        }
        if (anyMessageContains(error, RATE_LIMIT_PATTERNS)) {
            return new ClassifiedError(ErrorKind.RATE_LIMITED, null, message, error);
        }
        if (anyMessageContains(error, NETWORK_PATTERNS)) {
            return new ClassifiedError(ErrorKind.NETWORK, null, message, error);
        }
        return new ClassifiedError(ErrorKind.UNCLASSIFIED, null, message, error);
    }

    private static ErrorKind classifyRemote(RemoteCallException e) {
        Integer status = e.getStatus();
        if (status != null && status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        for (GraphQLErrorDetail detail : e.getGraphQLErrors()) {
            if (TOO_MANY_REQUESTS_CODE.equals(detail.code()) || containsAny(detail.message(), RATE_LIMIT_PATTERNS)) {
                return ErrorKind.RATE_LIMITED;
            }
        }
        if (e.isNetworkError()) {
            return ErrorKind.NETWORK;
        }
        if (status != null && (status == 502 || status == 503 || status == 504)) {
            return ErrorKind.NETWORK;
        }
        if (!e.getGraphQLErrors().isEmpty()) {
            return ErrorKind.GRAPHQL;
        }
        return null;
    }

    /**
     * Retry-After header value in decimal seconds, converted to milliseconds.
     *
     * @return null when the header is missing, blank, negative or not a number
     */
    public static Long parseRetryAfter(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        try {
            BigDecimal seconds = new BigDecimal(headerValue.trim());
            if (seconds.signum() < 0) {
                return null;
            }
            BigDecimal millis = seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP);
            return millis.compareTo(MAX_RETRY_AFTER_MS) > 0 ? MAX_RETRY_AFTER_MS.longValue() : millis.longValue();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static boolean anyMessageContains(Throwable error, List<String> patterns) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        int depth = 0;
        for (Throwable t = error; t != null && depth < MAX_CAUSE_DEPTH && seen.put(t, Boolean.TRUE) == null; t = t.getCause(), depth++) {
            if (containsAny(t.getMessage(), patterns)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String message, List<String> patterns) {
        if (message == null) {
            return false;
        }
        String msg = message.toLowerCase(Locale.ROOT);
        for (String p : patterns) {
            if (msg.contains(p)) {
                return true;
            }
        }
        return false;
    }

    private static String messageOf(Throwable e) {
        if (e.getMessage() == null || e.getMessage().isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getMessage();
    }
}

package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.exception.NotificationDeliveryException;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a failed delivery is worth retrying. Provider throttling is recognised first, then SMTP
 * response classes (5xx permanent, 4xx temporary), then transport error codes and finally well-known phrases.
 * Anything unrecognised is UNKNOWN and retried.
 */
@Component
public class DeliveryErrorClassifier {

    private static final Pattern RESPONSE_CODE = Pattern.compile("\\b([45]\\d{2})\\b");

    private static final List<Pattern> RATE_LIMIT_PATTERNS = List.of(
            Pattern.compile("exceeded", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rate.?limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("messages.per.*hour", Pattern.CASE_INSENSITIVE),
            Pattern.compile("too many", Pattern.CASE_INSENSITIVE),
            Pattern.compile("quota exceeded", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sending.?limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("throttl", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b429\\b"),
            Pattern.compile("daily.?limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("4\\.7\\.1"));

    private static final Set<String> TRANSIENT_CODES = Set.of("ETIMEDOUT", "ECONNRESET", "EAI_AGAIN", "ENOTFOUND",
                                                              "ECONNREFUSED", "ESOCKET", "EPIPE", "EHOSTUNREACH",
                                                              "ENETUNREACH", "EPROTO", "ECONNABORTED");

    private static final List<String> TRANSIENT_PHRASES = List.of(
            "timeout", "connection", "network", "temporarily", "try again", "service unavailable", "busy",
            "overload", "please retry", "server too busy", "temporary failure", "system not available",
            "resources temporarily unavailable", "connection refused");

    private static final List<String> PERMANENT_PHRASES = List.of(
            "user unknown", "mailbox not found", "does not exist", "invalid recipient", "rejected", "blocked",
            "blacklisted", "authentication failed", "relay denied", "not allowed", "invalid api key", "unauthorized",
            "forbidden", "domain not verified", "sender not verified", "unsubscribed", "invalid_email",
            "email_invalid", "bounced", "complaint", "recipient rejected", "mailbox unavailable",
            "action not allowed", "permanent", "fatal", "bad address", "mailbox disabled", "no such user",
            "user disabled", "account disabled");

    public DeliveryErrorClassification classify(final Throwable error) {
        if (error instanceof NotificationDeliveryException delivery) {
            return classify(delivery.getErrorCode(), delivery.getResponseCode(), fullMessage(error));
        }
        return classify(transportCode(error), null, fullMessage(error));
    }

    /**
     * @param errorCode    transport error code such as {@code ECONNRESET}, may be {@code null}
     * @param responseCode SMTP or HTTP response code; parsed from the message when {@code null}
     */
    public DeliveryErrorClassification classify(final String errorCode, final Integer responseCode,
                                                final String message) {
        final String text = message == null ? "" : message;
        final String lower = text.toLowerCase(Locale.ROOT);
        final Integer code = responseCode != null ? responseCode : extractResponseCode(text);

        for (Pattern pattern : RATE_LIMIT_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return DeliveryErrorClassification.of(DeliveryErrorType.RATE_LIMITED, code != null ? code : 450);
            }
        }
        if (code != null && code == 450 && (lower.contains("exceeded") || lower.contains("rate"))) {
            return DeliveryErrorClassification.of(DeliveryErrorType.RATE_LIMITED, 450);
        }
        if (code != null && code >= 500 && code < 600) {
            return DeliveryErrorClassification.of(DeliveryErrorType.PERMANENT, code);
        }
        if (code != null && code >= 400 && code < 500) {
            return DeliveryErrorClassification.of(DeliveryErrorType.TEMPORARY, code);
        }
        if (errorCode != null && TRANSIENT_CODES.contains(errorCode.toUpperCase(Locale.ROOT))) {
            return DeliveryErrorClassification.of(DeliveryErrorType.TEMPORARY, errorCode);
        }
        for (String phrase : TRANSIENT_PHRASES) {
            if (lower.contains(phrase)) {
                return DeliveryErrorClassification.of(DeliveryErrorType.TEMPORARY,
                                                      errorCode != null ? errorCode : "NETWORK");
            }
        }
        for (String phrase : PERMANENT_PHRASES) {
            if (lower.contains(phrase)) {
                return DeliveryErrorClassification.of(DeliveryErrorType.PERMANENT, code != null ? code : 550);
            }
        }
        return DeliveryErrorClassification.of(DeliveryErrorType.UNKNOWN, null);
    }

    static Integer extractResponseCode(final String message) {
        if (message == null) {
            return null;
        }
        final Matcher matcher = RESPONSE_CODE.matcher(message);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * Maps the socket exceptions found in the cause chain to the transport error codes mail providers report.
     */
    static String transportCode(final Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return "ETIMEDOUT";
            }
            if (current instanceof ConnectException) {
                return "ECONNREFUSED";
            }
            if (current instanceof UnknownHostException) {
                return "ENOTFOUND";
            }
            if (current instanceof NoRouteToHostException) {
                return "EHOSTUNREACH";
            }
            if (current instanceof SocketException) {
                return "ESOCKET";
            }
            current = current.getCause();
        }
        return null;
    }

    private static String fullMessage(final Throwable error) {
        final StringBuilder text = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            if (current.getMessage() != null) {
                if (text.length() > 0) {
                    text.append("; ");
                }
                text.append(current.getMessage());
            }
            current = current.getCause();
        }
        return text.toString();
    }
}

package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.exception.NotificationDeliveryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryErrorClassifierTest {

    private final DeliveryErrorClassifier classifier = new DeliveryErrorClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', nullValues = "null", value = {
            "null       | 550  | mailbox unavailable                      | PERMANENT    | 550",
            "null       | 550  | <user14290@example.com>: mailbox unavailable | PERMANENT | 550",
            "null       | null | 421 Service not available                | TEMPORARY    | 421",
            "null       | null | Daily sending quota exceeded             | RATE_LIMITED | 450",
            "null       | 554  | 5.7.1 Message rejected: rate limit       | RATE_LIMITED | 554",
            "ECONNRESET | null | socket hang up                           | TEMPORARY    | ECONNRESET",
            "null       | null | Connection closed unexpectedly           | TEMPORARY    | NETWORK",
            "null       | null | Recipient address rejected: user unknown | PERMANENT    | 550",
            "null       | null | something odd happened                   | UNKNOWN      | null"
    })
    void classifiesInPrecedenceOrder(String errorCode, Integer responseCode, String message,
                                     DeliveryErrorType expectedType, String expectedCode) {
        final DeliveryErrorClassification classification = classifier.classify(errorCode, responseCode, message);

        assertThat(classification.type()).isEqualTo(expectedType);
        assertThat(classification.code()).isEqualTo(expectedCode);
        assertThat(classification.retryable()).isEqualTo(expectedType != DeliveryErrorType.PERMANENT);
    }

    @Test
    void readsTransportCodeFromCauseChain() {
        final RuntimeException error = new RuntimeException("send failed", new SocketTimeoutException("Read timed out"));

        final DeliveryErrorClassification classification = classifier.classify(error);

        assertThat(classification.type()).isEqualTo(DeliveryErrorType.TEMPORARY);
        assertThat(classification.code()).isEqualTo("ETIMEDOUT");
    }

    @Test
    void localRateLimitTimeoutIsRetriedAsRateLimited() {
        final NotificationDeliveryException error = new NotificationDeliveryException(
                "Rate limit slot for smtp not acquired in time", null, 429);

        final DeliveryErrorClassification classification = classifier.classify(error);

        assertThat(classification.type()).isEqualTo(DeliveryErrorType.RATE_LIMITED);
        assertThat(classification.retryable()).isTrue();
        assertThat(classification.code()).isEqualTo("429");
    }

    @Test
    void mapsSocketExceptionsToTransportCodes() {
        assertThat(DeliveryErrorClassifier.transportCode(new UnknownHostException("smtp.example"))).isEqualTo("ENOTFOUND");
        assertThat(DeliveryErrorClassifier.transportCode(new IllegalStateException("x"))).isNull();
    }

    @Test
    void extractsFirstThreeDigitResponseCode() {
        assertThat(DeliveryErrorClassifier.extractResponseCode("Error 4.7.1 at 452 mailbox full")).isEqualTo(452);
        assertThat(DeliveryErrorClassifier.extractResponseCode("no code here")).isNull();
    }
}

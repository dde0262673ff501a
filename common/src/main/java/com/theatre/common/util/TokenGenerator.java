package com.theatre.common.util;

import java.util.UUID;

public class TokenGenerator {

    private TokenGenerator() {
    }

    /**
     * Generate a request trace id (32 hex chars, same shape as a W3C trace id)
     */
    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Generate a Kafka message key for a reservation event
     */
    public static String reservationEventKey(Long reservationId) {
        return "RSV_" + reservationId;
    }
}

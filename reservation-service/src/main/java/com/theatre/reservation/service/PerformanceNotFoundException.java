package com.theatre.reservation.service;

import java.util.Map;

public class PerformanceNotFoundException extends ReservationException {

    private final Long performanceId;

    public PerformanceNotFoundException(Long performanceId) {
        super("Performance not found: " + performanceId);
        this.performanceId = performanceId;
    }

    public Long getPerformanceId() {
        return performanceId;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("performanceId", performanceId);
    }
}

package com.theatre.reservation.service;

import java.util.LinkedHashMap;
import java.util.Map;

public class SeatOutOfRangeException extends ReservationException {

    private final SeatViolation violation;
    private final Long performanceId;

    public SeatOutOfRangeException(SeatViolation violation, Long performanceId) {
        super(performanceId != null
            ? "Invalid seat for performance " + performanceId + ": " + violation.describe()
            : "Invalid seat: " + violation.describe());
        this.violation = violation;
        this.performanceId = performanceId;
    }

    public SeatViolation getViolation() {
        return violation;
    }

    public Long getPerformanceId() {
        return performanceId;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (performanceId != null) {
            details.put("performanceId", performanceId);
        }
        details.put("coordinate", violation.getCoordinate().name());
        details.put("value", violation.getValue());
        details.put("minValue", 1);
        details.put("maxValue", violation.getMaxValue());
        return details;
    }
}

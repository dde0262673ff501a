package com.theatre.reservation.service;

import java.util.LinkedHashMap;
import java.util.Map;

public class SeatAlreadyTakenException extends ReservationException {

    private final Long performanceId;
    private final int row;
    private final int seat;

    public SeatAlreadyTakenException(Long performanceId, int row, int seat) {
        this(performanceId, row, seat, null);
    }

    public SeatAlreadyTakenException(Long performanceId, int row, int seat, Throwable cause) {
        super(String.format("Seat already taken for performance %d: row %d, seat %d", performanceId, row, seat), cause);
        this.performanceId = performanceId;
        this.row = row;
        this.seat = seat;
    }

    public Long getPerformanceId() {
        return performanceId;
    }

    public int getRow() {
        return row;
    }

    public int getSeat() {
        return seat;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("performanceId", performanceId);
        details.put("row", row);
        details.put("seat", seat);
        return details;
    }
}

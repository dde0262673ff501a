package com.theatre.catalog.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when moving a performance to a hall whose grid does not contain every sold seat.
 */
public class HallChangeConflictException extends CatalogException {

    private final Long performanceId;
    private final long ticketsOutside;

    public HallChangeConflictException(Long performanceId, long ticketsOutside) {
        super(String.format("Performance %d has %d sold ticket(s) outside the new hall", performanceId, ticketsOutside));
        this.performanceId = performanceId;
        this.ticketsOutside = ticketsOutside;
    }

    public Long getPerformanceId() {
        return performanceId;
    }

    public long getTicketsOutside() {
        return ticketsOutside;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("performanceId", performanceId);
        details.put("ticketsOutside", ticketsOutside);
        return details;
    }
}

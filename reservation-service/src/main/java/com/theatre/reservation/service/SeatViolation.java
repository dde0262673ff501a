package com.theatre.reservation.service;

import lombok.Value;

/**
 * A (row, seat) coordinate that falls outside a hall's grid.
 * Row is reported before seat; the smallest valid value is always 1.
 */
@Value
public class SeatViolation {

    public enum Coordinate {
        ROW, SEAT
    }

    Coordinate coordinate;
    int value;
    int maxValue;

    public String describe() {
        String name = coordinate.name().toLowerCase();
        return String.format("%s %d is out of range, valid %ss are 1..%d", name, value, name, maxValue);
    }
}

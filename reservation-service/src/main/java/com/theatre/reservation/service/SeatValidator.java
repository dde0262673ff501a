package com.theatre.reservation.service;

import com.theatre.common.entity.TheatreHall;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks that a (row, seat) pair lies within a hall's physical grid.
 * Stateless; called once per requested ticket before anything is written.
 */
@Component
public class SeatValidator {

    public Optional<SeatViolation> check(int row, int seat, TheatreHall hall) {
        if (row < 1 || row > hall.getRows()) {
            return Optional.of(new SeatViolation(SeatViolation.Coordinate.ROW, row, hall.getRows()));
        }
        if (seat < 1 || seat > hall.getSeatsInRow()) {
            return Optional.of(new SeatViolation(SeatViolation.Coordinate.SEAT, seat, hall.getSeatsInRow()));
        }
        return Optional.empty();
    }

    public void validate(int row, int seat, TheatreHall hall) {
        Optional<SeatViolation> violation = check(row, seat, hall);
        if (violation.isPresent()) {
            throw new SeatOutOfRangeException(violation.get(), null);
        }
    }
}

package com.theatre.common.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReservationRequestTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void validRequest_NoViolations() {
        ReservationRequest request = new ReservationRequest(1L, List.of(new TicketRequest(1L, 2, 3)));

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void nullTicketEntry_IsRejected() {
        ReservationRequest request = new ReservationRequest(1L, Arrays.asList(new TicketRequest(1L, 2, 3), null));

        Set<ConstraintViolation<ReservationRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        ConstraintViolation<ReservationRequest> violation = violations.iterator().next();
        assertTrue(violation.getPropertyPath().toString().startsWith("tickets[1]"));
        assertEquals("Ticket entries must not be null", violation.getMessage());
    }

    @Test
    void invalidTicketEntry_IsCascaded() {
        ReservationRequest request = new ReservationRequest(1L, List.of(new TicketRequest(null, 2, 3)));

        assertFalse(validator.validate(request).isEmpty());
    }

    @Test
    void emptyTicketList_LeftToTheService() {
        ReservationRequest request = new ReservationRequest(1L, List.of());

        assertTrue(validator.validate(request).isEmpty());
    }
}

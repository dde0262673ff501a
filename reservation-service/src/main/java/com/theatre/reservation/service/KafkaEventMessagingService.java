package com.theatre.reservation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theatre.common.dto.ReservationDto;
import com.theatre.common.dto.TicketDto;
import com.theatre.common.util.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
@RequiredArgsConstructor
public class KafkaEventMessagingService implements EventMessagingService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.reservation-created:reservation-created}")
    private String reservationCreatedTopic;

    /**
     * Publish reservation created event
     */
    @Override
    public void publishReservationCreated(ReservationDto reservation) {
        String key = TokenGenerator.reservationEventKey(reservation.getId());
        try {
            Map<String, Object> event = new HashMap<>();
            event.put("eventType", "RESERVATION_CREATED");
            event.put("reservationId", reservation.getId());
            event.put("userId", reservation.getUserId());
            event.put("createdAt", reservation.getCreatedAt());
            event.put("tickets", createTicketInfo(reservation.getTickets()));
            event.put("ticketCount", reservation.getTicketCount());
            event.put("timestamp", System.currentTimeMillis());
            event.put("source", "reservation-service");

            String eventJson = objectMapper.writeValueAsString(event);

            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(reservationCreatedTopic, key, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish reservation created event: {}", key, throwable);
                } else {
                    log.debug("Published reservation created event: {} to partition: {}",
                             key, result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating reservation created event: {}", key, e);
        }
    }

    private List<Map<String, Object>> createTicketInfo(List<TicketDto> tickets) {
        if (tickets == null) {
            return List.of();
        }
        return tickets.stream()
            .map(ticket -> {
                Map<String, Object> info = new HashMap<>();
                info.put("ticketId", ticket.getId());
                info.put("performanceId", ticket.getPerformanceId());
                info.put("row", ticket.getRow());
                info.put("seat", ticket.getSeat());
                return info;
            })
            .toList();
    }
}

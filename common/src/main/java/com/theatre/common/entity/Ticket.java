package com.theatre.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * A single seat claim for one performance. The unique constraint over
 * (performance, row, seat) is what keeps two reservations from selling
 * the same seat; it is checked by the database in the inserting transaction.
 */
@Entity
@Table(name = "tickets",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_ticket_performance_row_seat",
        columnNames = {"performance_id", "seat_row", "seat_number"}
    ),
    indexes = {
        @Index(name = "idx_ticket_reservation", columnList = "reservation_id")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Positive
    @Column(name = "seat_row", nullable = false)
    private Integer row;

    @NotNull
    @Positive
    @Column(name = "seat_number", nullable = false)
    private Integer seat;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "performance_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Performance performance;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reservation_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Reservation reservation;
}

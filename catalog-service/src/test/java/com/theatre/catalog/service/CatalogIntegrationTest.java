package com.theatre.catalog.service;

import com.theatre.catalog.repository.TicketRepository;
import com.theatre.common.dto.AvailabilityDto;
import com.theatre.common.dto.GenreDto;
import com.theatre.common.dto.PerformanceDetailDto;
import com.theatre.common.dto.PerformanceListDto;
import com.theatre.common.dto.PerformanceRequest;
import com.theatre.common.dto.PlayListDto;
import com.theatre.common.entity.Artist;
import com.theatre.common.entity.Genre;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.Play;
import com.theatre.common.entity.Reservation;
import com.theatre.common.entity.TheatreHall;
import com.theatre.common.entity.Ticket;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogIntegrationTest {

    @Autowired
    private PerformanceService performanceService;

    @Autowired
    private PlayService playService;

    @Autowired
    private GenreService genreService;

    @Autowired
    private TicketRepository ticketRepository;

    @Autowired
    private EntityManager entityManager;

    private TheatreHall hall;
    private Play seagull;
    private Play vanya;
    private Genre drama;
    private Performance performance;

    @BeforeEach
    void setUp() {
        drama = Genre.builder().name("Drama").build();
        Genre comedy = Genre.builder().name("Comedy").build();
        entityManager.persist(drama);
        entityManager.persist(comedy);

        Artist artist = Artist.builder().firstName("Olga").lastName("Knipper").build();
        entityManager.persist(artist);

        hall = TheatreHall.builder().name("Small Hall").rows(5).seatsInRow(10).build();
        entityManager.persist(hall);

        seagull = Play.builder()
            .title("The Seagull")
            .description("Comedy in four acts")
            .acts(4)
            .genres(new LinkedHashSet<>(List.of(comedy, drama)))
            .artists(new LinkedHashSet<>(List.of(artist)))
            .build();
        vanya = Play.builder()
            .title("Uncle Vanya")
            .description("Scenes from country life")
            .acts(4)
            .genres(new LinkedHashSet<>(List.of(drama)))
            .build();
        entityManager.persist(seagull);
        entityManager.persist(vanya);

        performance = Performance.builder()
            .play(seagull)
            .theatreHall(hall)
            .showTime(LocalDateTime.of(2026, 11, 20, 19, 0))
            .build();
        entityManager.persist(performance);

        entityManager.flush();
        entityManager.clear();
    }

    private void sellSeats(int... rowSeatPairs) {
        Performance attached = entityManager.find(Performance.class, performance.getId());
        Reservation reservation = Reservation.builder().userId(1L).build();
        for (int i = 0; i < rowSeatPairs.length; i += 2) {
            reservation.addTicket(Ticket.builder()
                .row(rowSeatPairs[i])
                .seat(rowSeatPairs[i + 1])
                .performance(attached)
                .build());
        }
        entityManager.persist(reservation);
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void availability_CapacityFiftyThenThreeSold() {
        AvailabilityDto before = performanceService.getAvailability(performance.getId()).orElseThrow();
        assertEquals(50, before.getCapacity());
        assertEquals(50, before.getTicketsAvailable());

        sellSeats(1, 1, 1, 2, 2, 5);

        AvailabilityDto after = performanceService.getAvailability(performance.getId()).orElseThrow();
        assertEquals(3L, after.getTicketsSold());
        assertEquals(47, after.getTicketsAvailable());

        Page<PerformanceListDto> listing = performanceService.getPerformances(null, null, 0, 10);
        assertEquals(47, listing.getContent().get(0).getTicketsAvailable());
    }

    @Test
    void getPerformanceById_ListsTakenPlacesInSeatOrder() {
        sellSeats(2, 5, 1, 2);

        PerformanceDetailDto detail = performanceService.getPerformanceById(performance.getId()).orElseThrow();

        assertEquals(2, detail.getTakenPlaces().size());
        assertEquals(1, detail.getTakenPlaces().get(0).getRow());
        assertEquals(List.of("Comedy", "Drama"), detail.getPlay().getGenres());
    }

    @Test
    void getPerformances_FiltersByPlayAndDay() {
        PerformanceListDto later = performanceService.createPerformance(
            new PerformanceRequest(vanya.getId(), hall.getId(), LocalDateTime.of(2026, 11, 21, 23, 30)));

        assertEquals(1, performanceService.getPerformances(vanya.getId(), null, 0, 10).getTotalElements());
        assertEquals(1, performanceService.getPerformances(null, LocalDate.of(2026, 11, 21), 0, 10).getTotalElements());
        assertEquals(0, performanceService.getPerformances(seagull.getId(), LocalDate.of(2026, 11, 21), 0, 10)
            .getTotalElements());

        List<PerformanceListDto> all = performanceService.getPerformances(null, null, 0, 10).getContent();
        assertEquals(later.getId(), all.get(0).getId());
    }

    @Test
    void getPlays_FiltersByTitleAndGenre() {
        Page<PlayListDto> dramas = playService.getPlays(null, List.of(drama.getId()), null, 0, 10);
        assertEquals(2, dramas.getTotalElements());
        assertEquals("The Seagull", dramas.getContent().get(0).getTitle());

        Page<PlayListDto> byTitle = playService.getPlays("VANYA", null, null, 0, 10);
        assertEquals(1, byTitle.getTotalElements());
        assertEquals(List.of("Drama"), byTitle.getContent().get(0).getGenres());

        assertEquals(0, playService.getPlays("Hamlet", null, null, 0, 10).getTotalElements());
    }

    @Test
    void createGenre_DuplicateIgnoringCase_Throws() {
        assertThrows(DuplicateResourceException.class,
            () -> genreService.createGenre(GenreDto.builder().name("drama").build()));
    }

    @Test
    void deletePerformance_RemovesItsTickets() {
        sellSeats(3, 3, 3, 4);
        assertEquals(2, ticketRepository.countByPerformanceId(performance.getId()));

        assertTrue(performanceService.deletePerformance(performance.getId()));
        entityManager.flush();

        assertEquals(0, ticketRepository.countByPerformanceId(performance.getId()));
        assertTrue(performanceService.getAvailability(performance.getId()).isEmpty());
    }

    @Test
    void deleteHall_RemovesItsPerformancesAndTickets() {
        sellSeats(1, 1, 2, 2);
        assertEquals(2, ticketRepository.countByPerformanceId(performance.getId()));

        int deleted = entityManager.createQuery("DELETE FROM TheatreHall h WHERE h.id = :id")
            .setParameter("id", hall.getId())
            .executeUpdate();
        entityManager.clear();

        assertEquals(1, deleted);
        assertNull(entityManager.find(Performance.class, performance.getId()));
        assertEquals(0, ticketRepository.countByPerformanceId(performance.getId()));
        assertTrue(performanceService.getAvailability(performance.getId()).isEmpty());
        assertNotNull(entityManager.find(Play.class, seagull.getId()));
    }

    @Test
    void updatePerformance_HallTooSmallForSoldSeats_Refused() {
        sellSeats(5, 10);
        TheatreHall studio = TheatreHall.builder().name("Studio").rows(4).seatsInRow(10).build();
        entityManager.persist(studio);
        entityManager.flush();

        PerformanceRequest move = new PerformanceRequest(seagull.getId(), studio.getId(), performance.getShowTime());

        HallChangeConflictException exception = assertThrows(HallChangeConflictException.class,
            () -> performanceService.updatePerformance(performance.getId(), move));

        assertEquals(1L, exception.getTicketsOutside());
    }
}

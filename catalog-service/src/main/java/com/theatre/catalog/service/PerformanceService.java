package com.theatre.catalog.service;

import com.theatre.catalog.repository.PerformanceRepository;
import com.theatre.catalog.repository.PlayRepository;
import com.theatre.catalog.repository.TheatreHallRepository;
import com.theatre.catalog.repository.TicketRepository;
import com.theatre.catalog.repository.TicketRepository.PerformanceTicketCount;
import com.theatre.common.dto.AvailabilityDto;
import com.theatre.common.dto.PerformanceDetailDto;
import com.theatre.common.dto.PerformanceListDto;
import com.theatre.common.dto.PerformanceRequest;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.Play;
import com.theatre.common.entity.TheatreHall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Performances and their live availability. Nothing here is cached: ticket counts
 * change with every reservation and are always read from the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PerformanceService {

    private static final LocalDateTime EARLIEST = LocalDateTime.of(1900, 1, 1, 0, 0);
    private static final LocalDateTime LATEST = LocalDateTime.of(3000, 1, 1, 0, 0);

    private final PerformanceRepository performanceRepository;
    private final PlayRepository playRepository;
    private final TheatreHallRepository theatreHallRepository;
    private final TicketRepository ticketRepository;
    private final AvailabilityCalculator availabilityCalculator;

    /**
     * Performances, newest show time first, optionally for one play and one calendar day
     */
    @Transactional(readOnly = true)
    public Page<PerformanceListDto> getPerformances(Long playId, LocalDate date, int page, int size) {
        log.debug("Searching performances: play={}, date={}, page={}, size={}", playId, date, page, size);

        LocalDateTime from = date != null ? date.atStartOfDay() : EARLIEST;
        LocalDateTime to = date != null ? date.plusDays(1).atStartOfDay() : LATEST;

        Page<Performance> performances = performanceRepository.findWithFilters(
            playId, from, to, PageRequest.of(page, size));

        List<Long> ids = performances.getContent().stream().map(Performance::getId).toList();
        Map<Long, Long> sold = ids.isEmpty()
            ? Map.of()
            : ticketRepository.countByPerformanceIds(ids).stream()
                .collect(Collectors.toMap(PerformanceTicketCount::getPerformanceId,
                                          PerformanceTicketCount::getTicketsSold));

        return performances.map(performance -> CatalogMapper.toPerformanceListDto(
            performance,
            availabilityCalculator.availableSeats(performance.getTheatreHall(),
                                                  sold.getOrDefault(performance.getId(), 0L))));
    }

    /**
     * Performance with its play, hall and the seats already sold
     */
    @Transactional(readOnly = true)
    public Optional<PerformanceDetailDto> getPerformanceById(Long performanceId) {
        log.debug("Fetching performance details for ID: {}", performanceId);

        return performanceRepository.findByIdWithDetails(performanceId)
            .map(performance -> CatalogMapper.toPerformanceDetailDto(
                performance, ticketRepository.findByPerformanceIdOrderByRowAscSeatAsc(performanceId)));
    }

    /**
     * Live seat availability for one performance
     */
    @Transactional(readOnly = true)
    public Optional<AvailabilityDto> getAvailability(Long performanceId) {
        log.debug("Computing availability for performance: {}", performanceId);

        return performanceRepository.findByIdWithDetails(performanceId)
            .map(performance -> availabilityCalculator.availability(
                performance, ticketRepository.countByPerformanceId(performanceId)));
    }

    @Transactional
    public PerformanceListDto createPerformance(PerformanceRequest request) {
        log.info("Creating performance: play={}, hall={}, showTime={}",
                request.getPlayId(), request.getTheatreHallId(), request.getShowTime());

        Performance performance = Performance.builder()
            .play(findPlay(request.getPlayId()))
            .theatreHall(findHall(request.getTheatreHallId()))
            .showTime(request.getShowTime())
            .build();

        Performance saved = performanceRepository.save(performance);

        log.info("Performance created: ID={}", saved.getId());

        return CatalogMapper.toPerformanceListDto(saved, saved.getTheatreHall().getCapacity());
    }

    /**
     * Update play, hall and show time. A hall change is refused while sold tickets would fall outside it.
     */
    @Transactional
    public Optional<PerformanceListDto> updatePerformance(Long performanceId, PerformanceRequest request) {
        log.info("Updating performance: {}", performanceId);

        Optional<Performance> existingOpt = performanceRepository.findByIdWithDetails(performanceId);
        if (existingOpt.isEmpty()) {
            return Optional.empty();
        }

        Performance existing = existingOpt.get();
        TheatreHall hall = existing.getTheatreHall();

        if (!Objects.equals(hall.getId(), request.getTheatreHallId())) {
            hall = findHall(request.getTheatreHallId());
            long outside = ticketRepository.countOutsideGrid(performanceId, hall.getRows(), hall.getSeatsInRow());
            if (outside > 0) {
                log.warn("Refusing hall change for performance {}: {} ticket(s) outside hall {}",
                        performanceId, outside, hall.getId());
                throw new HallChangeConflictException(performanceId, outside);
            }
        }

        if (!Objects.equals(existing.getPlay().getId(), request.getPlayId())) {
            existing.setPlay(findPlay(request.getPlayId()));
        }
        existing.setTheatreHall(hall);
        existing.setShowTime(request.getShowTime());

        Performance saved = performanceRepository.save(existing);

        log.info("Performance updated successfully: ID={}", performanceId);

        return Optional.of(CatalogMapper.toPerformanceListDto(
            saved,
            availabilityCalculator.availableSeats(hall, ticketRepository.countByPerformanceId(performanceId))));
    }

    /**
     * Delete a performance; its tickets go with it through the foreign key cascade
     */
    @Transactional
    public boolean deletePerformance(Long performanceId) {
        log.info("Deleting performance: {}", performanceId);

        if (!performanceRepository.existsById(performanceId)) {
            return false;
        }

        performanceRepository.deleteById(performanceId);

        log.info("Performance deleted: {}", performanceId);
        return true;
    }

    private Play findPlay(Long playId) {
        return playRepository.findById(playId)
            .orElseThrow(() -> new ResourceNotFoundException("Play", playId));
    }

    private TheatreHall findHall(Long hallId) {
        return theatreHallRepository.findById(hallId)
            .orElseThrow(() -> new ResourceNotFoundException("Theatre hall", hallId));
    }
}

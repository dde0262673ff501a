package com.theatre.catalog.service;

import com.theatre.catalog.repository.TheatreHallRepository;
import com.theatre.common.dto.TheatreHallDto;
import com.theatre.common.entity.TheatreHall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TheatreHallService {

    private final TheatreHallRepository theatreHallRepository;

    @Transactional(readOnly = true)
    public List<TheatreHallDto> getAllTheatreHalls() {
        log.debug("Fetching all theatre halls");

        return theatreHallRepository.findAllByOrderByNameAsc().stream()
            .map(CatalogMapper::toTheatreHallDto)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<TheatreHallDto> getTheatreHallById(Long hallId) {
        log.debug("Fetching theatre hall: {}", hallId);

        return theatreHallRepository.findById(hallId)
            .map(CatalogMapper::toTheatreHallDto);
    }

    @Transactional
    public TheatreHallDto createTheatreHall(TheatreHallDto hallDto) {
        log.info("Creating theatre hall: {} ({}x{})", hallDto.getName(), hallDto.getRows(), hallDto.getSeatsInRow());

        TheatreHall hall = TheatreHall.builder()
            .name(hallDto.getName().trim())
            .rows(hallDto.getRows())
            .seatsInRow(hallDto.getSeatsInRow())
            .build();

        TheatreHall saved = theatreHallRepository.save(hall);

        log.info("Theatre hall created: ID={}, capacity={}", saved.getId(), saved.getCapacity());

        return CatalogMapper.toTheatreHallDto(saved);
    }
}

package com.theatre.catalog.service;

import com.theatre.common.dto.*;
import com.theatre.common.entity.*;

import java.util.Comparator;
import java.util.List;

/**
 * One output shape per view: list DTOs flatten relations to names, detail DTOs embed them.
 */
final class CatalogMapper {

    private CatalogMapper() {
    }

    static GenreDto toGenreDto(Genre genre) {
        return GenreDto.builder()
            .id(genre.getId())
            .name(genre.getName())
            .build();
    }

    static ArtistDto toArtistDto(Artist artist) {
        return ArtistDto.builder()
            .id(artist.getId())
            .firstName(artist.getFirstName())
            .lastName(artist.getLastName())
            .fullName(artist.getFullName())
            .about(artist.getAbout())
            .build();
    }

    static ArtistDetailDto toArtistDetailDto(Artist artist, List<Play> plays) {
        return ArtistDetailDto.builder()
            .id(artist.getId())
            .firstName(artist.getFirstName())
            .lastName(artist.getLastName())
            .fullName(artist.getFullName())
            .about(artist.getAbout())
            .plays(plays.stream()
                .map(play -> PlaySummaryDto.builder().id(play.getId()).title(play.getTitle()).build())
                .toList())
            .build();
    }

    static PlayListDto toPlayListDto(Play play) {
        return PlayListDto.builder()
            .id(play.getId())
            .title(play.getTitle())
            .acts(play.getActs())
            .genres(play.getGenres().stream()
                .map(Genre::getName)
                .sorted()
                .toList())
            .build();
    }

    static PlayDetailDto toPlayDetailDto(Play play) {
        return PlayDetailDto.builder()
            .id(play.getId())
            .title(play.getTitle())
            .description(play.getDescription())
            .acts(play.getActs())
            .genres(play.getGenres().stream()
                .sorted(Comparator.comparing(Genre::getName))
                .map(CatalogMapper::toGenreDto)
                .toList())
            .artists(play.getArtists().stream()
                .sorted(Comparator.comparing(Artist::getLastName).thenComparing(Artist::getFirstName))
                .map(Artist::getFullName)
                .toList())
            .build();
    }

    static TheatreHallDto toTheatreHallDto(TheatreHall hall) {
        return TheatreHallDto.builder()
            .id(hall.getId())
            .name(hall.getName())
            .rows(hall.getRows())
            .seatsInRow(hall.getSeatsInRow())
            .capacity(hall.getCapacity())
            .build();
    }

    static PerformanceListDto toPerformanceListDto(Performance performance, Integer ticketsAvailable) {
        return PerformanceListDto.builder()
            .id(performance.getId())
            .showTime(performance.getShowTime())
            .playTitle(performance.getPlay().getTitle())
            .theatreHallName(performance.getTheatreHall().getName())
            .theatreHallCapacity(performance.getTheatreHall().getCapacity())
            .ticketsAvailable(ticketsAvailable)
            .build();
    }

    static PerformanceDetailDto toPerformanceDetailDto(Performance performance, List<Ticket> tickets) {
        return PerformanceDetailDto.builder()
            .id(performance.getId())
            .showTime(performance.getShowTime())
            .play(toPlayListDto(performance.getPlay()))
            .theatreHall(toTheatreHallDto(performance.getTheatreHall()))
            .takenPlaces(tickets.stream()
                .map(ticket -> SeatDto.builder().row(ticket.getRow()).seat(ticket.getSeat()).build())
                .toList())
            .build();
    }
}

package com.regatta.service;

import com.regatta.dto.CompetitionResponses;
import com.regatta.model.Club;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventMedal;
import com.regatta.model.EventStatus;
import com.regatta.repository.ClubRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.scoring.MedalTally;
import com.regatta.scoring.ScoringPolicy;
import com.regatta.web.ResourceNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Medal table per club over the completed events of a competition, in
 * gold, silver, bronze order. Clubs with identical counts share a rank.
 */
@Service
public class MedalStandingsService {

    private static final Comparator<Standing> OLYMPIC_ORDER = Comparator
            .comparingInt((Standing standing) -> standing.tally().gold()).reversed()
            .thenComparing(Comparator.comparingInt((Standing standing) -> standing.tally().silver()).reversed())
            .thenComparing(Comparator.comparingInt((Standing standing) -> standing.tally().bronze()).reversed());

    private final CompetitionRepository competitionRepository;
    private final CompetitionEventRepository competitionEventRepository;
    private final ClubRepository clubRepository;

    public MedalStandingsService(
            CompetitionRepository competitionRepository,
            CompetitionEventRepository competitionEventRepository,
            ClubRepository clubRepository
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionEventRepository = competitionEventRepository;
        this.clubRepository = clubRepository;
    }

    @Transactional(readOnly = true)
    public List<CompetitionResponses.MedalStanding> getMedalStandings(UUID competitionId) {
        if (!competitionRepository.existsById(competitionId)) {
            throw ResourceNotFoundException.of("Competition", competitionId);
        }

        Map<UUID, List<Integer>> placesByClub = new HashMap<>();
        for (CompetitionEvent event : competitionEventRepository
                .findByCompetitionIdAndStatus(competitionId, EventStatus.COMPLETED)) {
            for (EventMedal medal : event.getMedals()) {
                if (medal.getClubId() == null) {
                    continue;
                }
                placesByClub.computeIfAbsent(medal.getClubId(), id -> new ArrayList<>())
                        .add(medal.getMedalType().ordinal() + 1);
            }
        }
        if (placesByClub.isEmpty()) {
            return List.of();
        }

        Map<UUID, Club> clubs = clubRepository.findAllById(placesByClub.keySet()).stream()
                .collect(Collectors.toMap(Club::getClubId, Function.identity()));
        List<Standing> standings = new ArrayList<>(placesByClub.size());
        placesByClub.forEach((clubId, places) -> {
            Club club = clubs.get(clubId);
            standings.add(new Standing(clubId, club != null ? club.getName() : null, ScoringPolicy.tallyMedals(places)));
        });
        standings.sort(OLYMPIC_ORDER
                .thenComparing(Standing::clubName, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Standing::clubId));

        List<CompetitionResponses.MedalStanding> rows = new ArrayList<>(standings.size());
        int rank = 0;
        for (int i = 0; i < standings.size(); i++) {
            Standing standing = standings.get(i);
            if (i == 0 || OLYMPIC_ORDER.compare(standings.get(i - 1), standing) != 0) {
                rank = i + 1;
            }
            MedalTally tally = standing.tally();
            rows.add(new CompetitionResponses.MedalStanding(
                    rank,
                    standing.clubId(),
                    standing.clubName(),
                    tally.gold(),
                    tally.silver(),
                    tally.bronze(),
                    tally.total()
            ));
        }
        return rows;
    }

    private record Standing(UUID clubId, String clubName, MedalTally tally) {
    }
}

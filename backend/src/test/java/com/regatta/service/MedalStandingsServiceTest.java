package com.regatta.service;

import com.regatta.dto.CompetitionResponses;
import com.regatta.model.Club;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventMedal;
import com.regatta.model.EventStatus;
import com.regatta.model.MedalType;
import com.regatta.repository.ClubRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.web.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MedalStandingsServiceTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000d01");
    private static final UUID ATLAS = UUID.fromString("00000000-0000-0000-0000-000000000d11");
    private static final UUID BOREAL = UUID.fromString("00000000-0000-0000-0000-000000000d12");
    private static final UUID CORSAIR = UUID.fromString("00000000-0000-0000-0000-000000000d13");

    @Mock
    private CompetitionRepository competitionRepository;

    @Mock
    private CompetitionEventRepository competitionEventRepository;

    @Mock
    private ClubRepository clubRepository;

    @InjectMocks
    private MedalStandingsService medalStandingsService;

    @Test
    void getMedalStandings_ordersByGoldThenSilverAndSharesTiedRanks() {
        when(competitionRepository.existsById(COMPETITION_ID)).thenReturn(true);
        when(competitionEventRepository.findByCompetitionIdAndStatus(COMPETITION_ID, EventStatus.COMPLETED))
                .thenReturn(List.of(
                        event(medal(MedalType.GOLD, BOREAL), medal(MedalType.SILVER, CORSAIR), medal(MedalType.BRONZE, ATLAS)),
                        event(medal(MedalType.GOLD, ATLAS), medal(MedalType.SILVER, CORSAIR), medal(MedalType.BRONZE, BOREAL)),
                        event(medal(MedalType.GOLD, null))
                ));
        when(clubRepository.findAllById(anyCollection())).thenReturn(List.of(
                club(ATLAS, "Atlas RC"), club(BOREAL, "Boreal RC"), club(CORSAIR, "Corsair RC")));

        List<CompetitionResponses.MedalStanding> standings = medalStandingsService.getMedalStandings(COMPETITION_ID);

        assertEquals(3, standings.size());
        assertEquals(ATLAS, standings.get(0).clubId());
        assertEquals(1, standings.get(0).rank());
        assertEquals(BOREAL, standings.get(1).clubId());
        assertEquals(1, standings.get(1).rank());
        assertEquals(CORSAIR, standings.get(2).clubId());
        assertEquals(3, standings.get(2).rank());
        assertEquals(2, standings.get(2).silver());
        assertEquals(2, standings.get(0).total());
        assertEquals(1, standings.get(0).gold());
        assertEquals(1, standings.get(0).bronze());
    }

    @Test
    void getMedalStandings_withoutCompletedEventsIsEmpty() {
        when(competitionRepository.existsById(COMPETITION_ID)).thenReturn(true);
        when(competitionEventRepository.findByCompetitionIdAndStatus(COMPETITION_ID, EventStatus.COMPLETED))
                .thenReturn(List.of());

        assertTrue(medalStandingsService.getMedalStandings(COMPETITION_ID).isEmpty());
    }

    @Test
    void getMedalStandings_unknownCompetitionIsNotFound() {
        when(competitionRepository.existsById(COMPETITION_ID)).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> medalStandingsService.getMedalStandings(COMPETITION_ID));
    }

    private static CompetitionEvent event(EventMedal... medals) {
        CompetitionEvent event = new CompetitionEvent();
        event.setEventId(UUID.randomUUID());
        event.setCompetitionId(COMPETITION_ID);
        event.setStatus(EventStatus.COMPLETED);
        event.setMedals(new ArrayList<>(List.of(medals)));
        return event;
    }

    private static EventMedal medal(MedalType type, UUID clubId) {
        return new EventMedal(type, UUID.randomUUID(), UUID.randomUUID(), clubId, 420_000L);
    }

    private static Club club(UUID clubId, String name) {
        Club club = new Club();
        club.setClubId(clubId);
        club.setName(name);
        return club;
    }
}

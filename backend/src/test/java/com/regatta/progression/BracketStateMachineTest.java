package com.regatta.progression;

import com.regatta.model.EventStatus;
import com.regatta.model.LaneStatus;
import com.regatta.model.MedalType;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.StateConflictException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BracketStateMachineTest {

    private static final UUID EVENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000801");

    private static final ProgressionSettings NO_REPECHAGE = new ProgressionSettings(false, 4, 0, 1, 1, 1, 1, 2);
    private static final ProgressionSettings WITH_REPECHAGE = new ProgressionSettings(true, 4, 4, 1, 1, 1, 1, 2);

    private final BracketStateMachine machine = new BracketStateMachine();

    @Test
    void seedTimeTrialSplitsEntrantsIntoBalancedHeats() {
        Transition transition = machine.seedTimeTrial(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), entrants(5));

        assertEquals(EventStatus.IN_PROGRESS, transition.nextStatus());
        assertEquals(RacePhase.TIME_TRIAL, transition.nextPhase());
        assertEquals(2, transition.races().size());
        assertEquals(3, transition.races().get(0).lanes().size());
        assertEquals(2, transition.races().get(1).lanes().size());
        assertEquals("TT1", transition.races().get(0).raceCode());
        assertEquals("TT2", transition.races().get(1).raceCode());
        assertEquals(5, transition.advancedCount());
    }

    @Test
    void seedTimeTrialTwiceIsRejected() {
        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.seedTimeTrial(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), entrants(3)));

        assertEquals(StateConflictException.ALREADY_PROCESSED, ex.getCode());
    }

    @Test
    void seedTimeTrialRejectsRepeatedEntries() {
        Entrant entrant = entrant(1);

        assertThrows(RegattaValidationException.class, () -> machine.seedTimeTrial(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), List.of(entrant, entrant)));
    }

    @Test
    void fiveSinglesWithTwoDirectAndNoRepechageSendTwoToTheFinal() {
        ProgressionSettings settings = new ProgressionSettings(false, 2, 0, 1, 1, 1, 1, 2);
        List<Entrant> field = entrants(5);
        List<RaceSnapshot> timeTrial = List.of(
                completed(RacePhase.TIME_TRIAL, 1, field.subList(0, 3), 410_000L, 405_000L, 420_000L),
                completed(RacePhase.TIME_TRIAL, 2, field.subList(3, 5), 401_000L, 430_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, settings, 4), RacePhase.TIME_TRIAL, timeTrial);

        assertEquals(RacePhase.FINAL_A, transition.nextPhase());
        assertEquals(2, transition.advancedCount());
        assertEquals(List.of(field.get(3), field.get(1)), transition.advanced());
        assertEquals(3, transition.eliminated().size());
        assertEquals(1, transition.races().size());
        assertEquals(List.of(field.get(3), field.get(1)), transition.races().get(0).lanes());
    }

    @Test
    void directAdvanceLargerThanTheFieldAdvancesEveryone() {
        List<Entrant> field = entrants(3);
        List<RaceSnapshot> timeTrial = List.of(
                completed(RacePhase.TIME_TRIAL, 1, field, 402_000L, 401_000L, 403_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), RacePhase.TIME_TRIAL, timeTrial);

        assertEquals(3, transition.advancedCount());
        assertTrue(transition.eliminated().isEmpty());
        assertEquals(RacePhase.FINAL_A, transition.nextPhase());
        assertEquals(List.of(field.get(1), field.get(0), field.get(2)), transition.races().get(0).lanes());
    }

    @Test
    void nonFinishersOfTheTimeTrialRankBehindEveryFinisher() {
        ProgressionSettings settings = new ProgressionSettings(false, 2, 0, 1, 1, 1, 1, 2);
        List<Entrant> field = entrants(3);
        List<RaceSnapshot> timeTrial = List.of(new RaceSnapshot(UUID.randomUUID(), RacePhase.TIME_TRIAL, 1,
                RaceStatus.COMPLETED, List.of(
                        new LaneSnapshot(1, field.get(0), LaneStatus.DNS, null),
                        new LaneSnapshot(2, field.get(1), LaneStatus.OK, 420_000L),
                        new LaneSnapshot(3, field.get(2), LaneStatus.OK, 410_000L))));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, settings, 4), RacePhase.TIME_TRIAL, timeTrial);

        assertEquals(List.of(field.get(2), field.get(1)), transition.advanced());
        assertEquals(List.of(field.get(0)), transition.eliminated());
    }

    @Test
    void processingWithResultsOutstandingIsNotReady() {
        List<Entrant> field = entrants(2);
        List<RaceSnapshot> timeTrial = List.of(new RaceSnapshot(UUID.randomUUID(), RacePhase.TIME_TRIAL, 1,
                RaceStatus.SCHEDULED, List.of(
                        new LaneSnapshot(1, field.get(0), null, null),
                        new LaneSnapshot(2, field.get(1), null, null))));

        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), RacePhase.TIME_TRIAL, timeTrial));

        assertEquals(StateConflictException.PHASE_NOT_READY, ex.getCode());
    }

    @Test
    void processingAPhaseAheadOfTheEventIsNotReady() {
        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), RacePhase.SEMIFINAL, List.of()));

        assertEquals(StateConflictException.PHASE_NOT_READY, ex.getCode());
    }

    @Test
    void processingAPhaseTwiceIsAlreadyProcessed() {
        List<RaceSnapshot> timeTrial = List.of(
                completed(RacePhase.TIME_TRIAL, 1, entrants(2), 400_000L, 401_000L));

        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.FINAL_A, NO_REPECHAGE, 4), RacePhase.TIME_TRIAL, timeTrial));

        assertEquals(StateConflictException.ALREADY_PROCESSED, ex.getCode());
    }

    @Test
    void repechageOfAnEventWithoutOneDoesNotApply() {
        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), RacePhase.REPECHAGE, List.of()));

        assertEquals(StateConflictException.PHASE_NOT_APPLICABLE, ex.getCode());
    }

    @Test
    void phaseSkippedByTheBracketDoesNotApply() {
        List<RaceSnapshot> races = List.of(
                completed(RacePhase.TIME_TRIAL, 1, entrants(2), 400_000L, 401_000L),
                new RaceSnapshot(UUID.randomUUID(), RacePhase.FINAL_A, 1, RaceStatus.SCHEDULED, List.of()));

        StateConflictException ex = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.FINAL_A, NO_REPECHAGE, 4), RacePhase.SEMIFINAL, races));

        assertEquals(StateConflictException.PHASE_NOT_APPLICABLE, ex.getCode());
    }

    @Test
    void completedAndUnseededEventsRejectProcessing() {
        StateConflictException completed = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.COMPLETED, RacePhase.FINAL_A, NO_REPECHAGE, 4), RacePhase.FINAL_A, List.of()));
        StateConflictException pending = assertThrows(StateConflictException.class, () -> machine.process(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, NO_REPECHAGE, 4), RacePhase.TIME_TRIAL, List.of()));

        assertEquals(StateConflictException.EVENT_COMPLETED, completed.getCode());
        assertEquals(StateConflictException.EVENT_NOT_STARTED, pending.getCode());
    }

    @Test
    void timeTrialWithRepechageHoldsDirectQualifiers() {
        List<Entrant> field = entrants(10);
        List<RaceSnapshot> timeTrial = List.of(
                completed(RacePhase.TIME_TRIAL, 1, field.subList(0, 4), 400_000L, 401_000L, 402_000L, 403_000L),
                completed(RacePhase.TIME_TRIAL, 2, field.subList(4, 7), 404_000L, 405_000L, 406_000L),
                completed(RacePhase.TIME_TRIAL, 3, field.subList(7, 10), 407_000L, 408_000L, 409_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL, WITH_REPECHAGE, 4),
                RacePhase.TIME_TRIAL, timeTrial);

        assertEquals(RacePhase.REPECHAGE, transition.nextPhase());
        assertEquals(field.subList(0, 4), transition.heldQualifiers());
        assertEquals(8, transition.advancedCount());
        assertEquals(field.subList(8, 10), transition.eliminated());
        assertEquals(2, transition.races().size());
        assertEquals(List.of("REP1", "REP2"), transition.races().stream().map(PlannedRace::raceCode).toList());
        assertEquals(field.subList(4, 6), transition.races().get(0).lanes());
        assertEquals(field.subList(6, 8), transition.races().get(1).lanes());
    }

    @Test
    void repechageWinnersJoinHeldQualifiersInTheNextRound() {
        List<Entrant> field = entrants(8);
        List<Entrant> held = field.subList(0, 4);
        List<RaceSnapshot> repechage = List.of(
                completed(RacePhase.REPECHAGE, 1, List.of(field.get(4), field.get(5)), 412_000L, 409_000L),
                completed(RacePhase.REPECHAGE, 2, List.of(field.get(6), field.get(7)), 408_000L, 415_000L));

        EventSnapshot event = new EventSnapshot(EVENT_ID, EventStatus.IN_PROGRESS, RacePhase.REPECHAGE,
                WITH_REPECHAGE, 4, held);
        Transition transition = machine.process(event, RacePhase.REPECHAGE, repechage);

        assertEquals(RacePhase.SEMIFINAL, transition.nextPhase());
        assertEquals(List.of(field.get(6), field.get(5)), transition.advanced());
        assertEquals(List.of(field.get(4), field.get(7)), transition.eliminated());
        assertEquals(2, transition.races().size());
        // Seeds 1..6 are held qualifiers 0-3 then repechage winners 6 and 5, dealt serpentine.
        assertEquals(List.of(field.get(0), field.get(3), field.get(6)), transition.races().get(0).lanes());
        assertEquals(List.of(field.get(1), field.get(2), field.get(5)), transition.races().get(1).lanes());
    }

    @Test
    void eightSeedsMeetInQuarterfinalsPairedForTheSemifinals() {
        List<Entrant> seeds = entrants(8);

        List<PlannedRace> quarterfinals = machine.buildKnockout(seeds, 4);

        assertEquals(4, quarterfinals.size());
        assertEquals(List.of(seeds.get(0), seeds.get(7)), quarterfinals.get(0).lanes());
        assertEquals(List.of(seeds.get(3), seeds.get(4)), quarterfinals.get(1).lanes());
        assertEquals(List.of(seeds.get(1), seeds.get(6)), quarterfinals.get(2).lanes());
        assertEquals(List.of(seeds.get(2), seeds.get(5)), quarterfinals.get(3).lanes());
        assertEquals(List.of("QF1", "QF2", "QF3", "QF4"),
                quarterfinals.stream().map(PlannedRace::raceCode).toList());
    }

    @Test
    void fieldWiderThanTheLanesRacesSemifinalsFirst() {
        List<Entrant> seeds = entrants(3);

        List<PlannedRace> semifinals = machine.buildKnockout(seeds, 2);

        assertEquals(List.of("SF1", "SF2"), semifinals.stream().map(PlannedRace::raceCode).toList());
        assertEquals(List.of(seeds.get(0)), semifinals.get(0).lanes());
        assertEquals(List.of(seeds.get(1), seeds.get(2)), semifinals.get(1).lanes());
    }

    @Test
    void largeFieldAddsQuarterfinalHeatsInPairs() {
        List<Entrant> seeds = entrants(30);

        List<PlannedRace> quarterfinals = machine.buildKnockout(seeds, 6);

        assertEquals(List.of("QF1", "QF2", "QF3", "QF4", "QF5", "QF6"),
                quarterfinals.stream().map(PlannedRace::raceCode).toList());
        assertTrue(quarterfinals.stream().allMatch(race -> race.lanes().size() == 5));
        assertEquals(List.of(seeds.get(0), seeds.get(11), seeds.get(12), seeds.get(23), seeds.get(24)),
                quarterfinals.get(0).lanes());
        assertEquals(List.of(seeds.get(5), seeds.get(6), seeds.get(17), seeds.get(18), seeds.get(29)),
                quarterfinals.get(1).lanes());
    }

    @Test
    void seedingAcceptsAFieldTheBracketCanCarry() {
        ProgressionSettings settings = new ProgressionSettings(false, 30, 0, 1, 1, 1, 1, 2);

        Transition transition = machine.seedTimeTrial(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, settings, 6), entrants(30));

        assertEquals(5, transition.races().size());
    }

    @Test
    void seedingRejectsFinalsTheLanesCannotHold() {
        ProgressionSettings fixedOverflow = new ProgressionSettings(false, 8, 0, 1, 2, 4, 0, 2);
        ProgressionSettings fieldOverflow = new ProgressionSettings(false, 30, 0, 1, 2, 3, 0, 2);

        RegattaValidationException fixed = assertThrows(RegattaValidationException.class, () -> machine.seedTimeTrial(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, fixedOverflow, 6), entrants(8)));
        RegattaValidationException byField = assertThrows(RegattaValidationException.class, () -> machine.seedTimeTrial(
                event(EventStatus.PENDING, RacePhase.TIME_TRIAL, fieldOverflow, 6), entrants(30)));

        assertEquals("invalid_configuration", fixed.getCode());
        assertEquals("Final A heat of 8 entrants exceeds the lane capacity of 6", fixed.getMessage());
        assertEquals("invalid_configuration", byField.getCode());
        assertEquals("Final A heat of 9 entrants exceeds the lane capacity of 6", byField.getMessage());
    }

    @Test
    void quarterfinalWinnersArePairedIntoTwoSemifinals() {
        List<Entrant> s = entrants(8);
        List<RaceSnapshot> quarterfinals = List.of(
                completed(RacePhase.QUARTERFINAL, 1, List.of(s.get(0), s.get(7)), 400_000L, 405_000L),
                completed(RacePhase.QUARTERFINAL, 2, List.of(s.get(3), s.get(4)), 406_000L, 402_000L),
                completed(RacePhase.QUARTERFINAL, 3, List.of(s.get(1), s.get(6)), 401_000L, 409_000L),
                completed(RacePhase.QUARTERFINAL, 4, List.of(s.get(2), s.get(5)), 403_000L, 404_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.QUARTERFINAL, NO_REPECHAGE, 4),
                RacePhase.QUARTERFINAL, quarterfinals);

        assertEquals(RacePhase.SEMIFINAL, transition.nextPhase());
        assertEquals(List.of(s.get(0), s.get(4)), transition.races().get(0).lanes());
        assertEquals(List.of(s.get(1), s.get(2)), transition.races().get(1).lanes());
        assertEquals(4, transition.eliminated().size());
    }

    @Test
    void semifinalsFeedFinalAAndFinalB() {
        List<Entrant> s = entrants(6);
        List<RaceSnapshot> semifinals = List.of(
                completed(RacePhase.SEMIFINAL, 1, List.of(s.get(0), s.get(3), s.get(4)), 400_000L, 404_000L, 410_000L),
                completed(RacePhase.SEMIFINAL, 2, List.of(s.get(1), s.get(2), s.get(5)), 402_000L, 401_000L, 411_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.SEMIFINAL, NO_REPECHAGE, 4),
                RacePhase.SEMIFINAL, semifinals);

        assertEquals(RacePhase.FINAL_A, transition.nextPhase());
        assertEquals(2, transition.races().size());
        assertEquals("FA", transition.races().get(0).raceCode());
        assertEquals(List.of(s.get(0), s.get(2)), transition.races().get(0).lanes());
        assertEquals("FB", transition.races().get(1).raceCode());
        assertEquals(List.of(s.get(1), s.get(3)), transition.races().get(1).lanes());
        assertEquals(List.of(s.get(4), s.get(5)), transition.eliminated());
    }

    @Test
    void finalsAwardMedalsAndTakeBronzeFromFinalB() {
        List<Entrant> s = entrants(4);
        List<RaceSnapshot> finals = List.of(
                completed(RacePhase.FINAL_A, 1, List.of(s.get(0), s.get(1)), 402_000L, 399_000L),
                completed(RacePhase.FINAL_B, 1, List.of(s.get(2), s.get(3)), 405_000L, 404_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.FINAL_A, NO_REPECHAGE, 4), RacePhase.FINAL_B, finals);

        assertEquals(EventStatus.COMPLETED, transition.nextStatus());
        assertTrue(transition.races().isEmpty());
        assertEquals(3, transition.medals().size());
        assertEquals(MedalType.GOLD, transition.medals().get(0).medalType());
        assertEquals(s.get(1), transition.medals().get(0).entrant());
        assertEquals(399_000L, transition.medals().get(0).elapsedMs());
        assertEquals(s.get(0), transition.medals().get(1).entrant());
        assertEquals(MedalType.BRONZE, transition.medals().get(2).medalType());
        assertEquals(s.get(3), transition.medals().get(2).entrant());
    }

    @Test
    void finalWithThreeFinishersAwardsAllMedalsInFinalA() {
        List<Entrant> s = entrants(3);
        List<RaceSnapshot> finals = List.of(
                completed(RacePhase.FINAL_A, 1, s, 402_000L, 399_000L, 401_000L));

        Transition transition = machine.process(
                event(EventStatus.IN_PROGRESS, RacePhase.FINAL_A, NO_REPECHAGE, 4), RacePhase.FINAL_A, finals);

        assertEquals(List.of(s.get(1), s.get(2), s.get(0)),
                transition.medals().stream().map(MedalAward::entrant).toList());
        assertEquals(List.of(MedalType.GOLD, MedalType.SILVER, MedalType.BRONZE),
                transition.medals().stream().map(MedalAward::medalType).toList());
    }

    private static EventSnapshot event(EventStatus status, RacePhase phase, ProgressionSettings settings, int capacity) {
        return new EventSnapshot(EVENT_ID, status, phase, settings, capacity, List.of());
    }

    private static Entrant entrant(int n) {
        return new Entrant(new UUID(0L, n), new UUID(1L, n), new UUID(2L, n % 3));
    }

    private static List<Entrant> entrants(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(BracketStateMachineTest::entrant).toList();
    }

    private static RaceSnapshot completed(RacePhase phase, int heat, List<Entrant> lanes, Long... times) {
        List<LaneSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < lanes.size(); i++) {
            snapshots.add(new LaneSnapshot(i + 1, lanes.get(i), LaneStatus.OK, times[i]));
        }
        return new RaceSnapshot(UUID.randomUUID(), phase, heat, RaceStatus.COMPLETED, snapshots);
    }
}

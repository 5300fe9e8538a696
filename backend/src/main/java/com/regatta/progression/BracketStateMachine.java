package com.regatta.progression;

import com.regatta.model.EventStatus;
import com.regatta.model.MedalType;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;
import com.regatta.scoring.LaneOutcome;
import com.regatta.scoring.PlacedLane;
import com.regatta.scoring.ScoringPolicy;
import com.regatta.web.DataInconsistencyException;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Knockout progression of one event as a closed transition table. Every
 * method takes a snapshot and returns the next state with the races it
 * generates; nothing here touches persistence.
 */
@Component
public class BracketStateMachine {

    private static final Map<RacePhase, Set<RacePhase>> TRANSITIONS = new EnumMap<>(RacePhase.class);

    static {
        TRANSITIONS.put(RacePhase.TIME_TRIAL, EnumSet.of(
                RacePhase.REPECHAGE, RacePhase.QUARTERFINAL, RacePhase.SEMIFINAL, RacePhase.FINAL_A));
        TRANSITIONS.put(RacePhase.REPECHAGE, EnumSet.of(
                RacePhase.QUARTERFINAL, RacePhase.SEMIFINAL, RacePhase.FINAL_A));
        TRANSITIONS.put(RacePhase.QUARTERFINAL, EnumSet.of(RacePhase.SEMIFINAL, RacePhase.FINAL_A));
        TRANSITIONS.put(RacePhase.SEMIFINAL, EnumSet.of(RacePhase.FINAL_A));
        TRANSITIONS.put(RacePhase.FINAL_B, EnumSet.noneOf(RacePhase.class));
        TRANSITIONS.put(RacePhase.FINAL_A, EnumSet.noneOf(RacePhase.class));
    }

    static final int QUARTERFINAL_FIELD = 8;
    static final int SEMIFINAL_FIELD = 4;

    private static final Comparator<HeatPlacing> ACROSS_HEATS = Comparator
            .comparing(HeatPlacing::position, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(HeatPlacing::elapsedMs, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(HeatPlacing::heatNumber)
            .thenComparingInt(HeatPlacing::laneNumber);

    public Transition seedTimeTrial(EventSnapshot event, List<Entrant> seededEntrants) {
        if (event.status() == EventStatus.COMPLETED) {
            throw StateConflictException.eventCompleted("Event is already completed: " + event.eventId());
        }
        if (event.status() != EventStatus.PENDING) {
            throw StateConflictException.alreadyProcessed("Time trial is already seeded for event " + event.eventId());
        }
        if (seededEntrants == null || seededEntrants.isEmpty()) {
            throw new RegattaValidationException("Time trial requires at least one entry");
        }
        requireDistinctEntries(seededEntrants);
        int laneCapacity = requireLaneCapacity(event);
        requireBracketFits(event.settings(), seededEntrants.size(), laneCapacity);

        List<PlannedRace> heats = partitionIntoHeats(seededEntrants, laneCapacity);
        return new Transition(
                EventStatus.IN_PROGRESS,
                RacePhase.TIME_TRIAL,
                heats,
                List.copyOf(seededEntrants),
                List.of(),
                List.of(),
                List.of(),
                "Seeded " + seededEntrants.size() + " entries into " + heats.size() + " time trial heat(s)"
        );
    }

    public Transition process(EventSnapshot event, RacePhase requestedPhase, List<RaceSnapshot> races) {
        RacePhase phase = requestedPhase == RacePhase.FINAL_B ? RacePhase.FINAL_A : requestedPhase;
        List<RaceSnapshot> phaseRaces = racesOf(races, phase);
        requireProcessable(event, phase, phaseRaces);
        requireCompleted(phase, phaseRaces);

        Transition transition = switch (phase) {
            case TIME_TRIAL -> processTimeTrial(event, phaseRaces);
            case REPECHAGE, QUARTERFINAL, SEMIFINAL -> processKnockout(event, phase, phaseRaces);
            case FINAL_A, FINAL_B -> {
                List<RaceSnapshot> finalB = racesOf(races, RacePhase.FINAL_B);
                if (!finalB.isEmpty()) {
                    requireCompleted(RacePhase.FINAL_B, finalB);
                }
                yield processFinals(event, phaseRaces, finalB);
            }
        };
        requireAllowed(event.currentPhase(), transition);
        return transition;
    }

    Transition processTimeTrial(EventSnapshot event, List<RaceSnapshot> timeTrialRaces) {
        List<HeatPlacing> ranked = new ArrayList<>();
        for (RaceSnapshot race : timeTrialRaces) {
            ranked.addAll(finishOrder(race));
        }
        // Across heats only the clock counts, so heat positions are ignored here.
        ranked.sort(Comparator
                .comparing(HeatPlacing::elapsedMs, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(HeatPlacing::heatNumber)
                .thenComparingInt(HeatPlacing::laneNumber));
        List<Entrant> field = ranked.stream().map(HeatPlacing::entrant).toList();

        ProgressionSettings settings = event.settings();
        int directCount = clamp(settings.timeTrialDirectAdvance(), field.size());
        int repechageCount = settings.hasRepechage()
                ? clamp(settings.timeTrialToRepechage(), field.size() - directCount)
                : 0;

        List<Entrant> direct = field.subList(0, directCount);
        List<Entrant> repechage = field.subList(directCount, directCount + repechageCount);
        List<Entrant> eliminated = field.subList(directCount + repechageCount, field.size());

        List<Entrant> advanced = new ArrayList<>(direct);
        advanced.addAll(repechage);

        if (!repechage.isEmpty()) {
            int lanesPerHeat = Math.min(
                    Math.max(settings.repechageLanesPerHeat(), 1),
                    requireLaneCapacity(event)
            );
            List<PlannedRace> heats = chunk(RacePhase.REPECHAGE, repechage, lanesPerHeat);
            return new Transition(
                    EventStatus.IN_PROGRESS,
                    RacePhase.REPECHAGE,
                    heats,
                    List.copyOf(advanced),
                    List.copyOf(eliminated),
                    List.copyOf(direct),
                    List.of(),
                    "Time trial processed: " + direct.size() + " direct, " + repechage.size()
                            + " to repechage, " + eliminated.size() + " eliminated"
            );
        }

        if (direct.isEmpty()) {
            throw new RegattaValidationException(
                    "invalid_configuration",
                    "No entrant qualifies from the time trial of event " + event.eventId()
            );
        }
        List<PlannedRace> bracket = buildKnockout(direct, requireLaneCapacity(event));
        return new Transition(
                EventStatus.IN_PROGRESS,
                bracket.get(0).phase(),
                bracket,
                List.copyOf(direct),
                List.copyOf(eliminated),
                List.of(),
                List.of(),
                "Time trial processed: " + direct.size() + " advance to "
                        + bracket.get(0).phase().getDisplayName() + ", " + eliminated.size() + " eliminated"
        );
    }

    Transition processKnockout(EventSnapshot event, RacePhase phase, List<RaceSnapshot> phaseRaces) {
        ProgressionSettings settings = event.settings();
        int laneCapacity = requireLaneCapacity(event);

        return switch (phase) {
            case REPECHAGE -> {
                HeatSplit split = splitHeats(phaseRaces, settings.repechageAdvance(), 0);
                List<HeatPlacing> winners = new ArrayList<>(split.flatAdvancing());
                winners.sort(ACROSS_HEATS);

                List<Entrant> seeded = new ArrayList<>(event.directQualifiers());
                winners.forEach(placing -> seeded.add(placing.entrant()));
                if (seeded.isEmpty()) {
                    throw new RegattaValidationException(
                            "invalid_configuration",
                            "No entrant qualifies from the repechage of event " + event.eventId()
                    );
                }
                List<PlannedRace> bracket = buildKnockout(seeded, laneCapacity);
                yield new Transition(
                        EventStatus.IN_PROGRESS,
                        bracket.get(0).phase(),
                        bracket,
                        winners.stream().map(HeatPlacing::entrant).toList(),
                        split.eliminated(),
                        List.of(),
                        List.of(),
                        "Repechage processed: " + winners.size() + " join " + event.directQualifiers().size()
                                + " direct qualifiers in " + bracket.get(0).phase().getDisplayName()
                );
            }
            case QUARTERFINAL -> {
                HeatSplit split = splitHeats(phaseRaces, settings.quarterfinalAdvance(), 0);
                List<List<Entrant>> perHeat = split.advancingPerHeat();
                List<List<Entrant>> semifinalHeats = new ArrayList<>();
                for (int i = 0; i < perHeat.size(); i += 2) {
                    List<Entrant> heat = new ArrayList<>(perHeat.get(i));
                    if (i + 1 < perHeat.size()) {
                        heat.addAll(perHeat.get(i + 1));
                    }
                    if (!heat.isEmpty()) {
                        semifinalHeats.add(heat);
                    }
                }
                List<PlannedRace> races = toRaces(RacePhase.SEMIFINAL, semifinalHeats, laneCapacity);
                List<Entrant> advanced = semifinalHeats.stream().flatMap(List::stream).toList();
                yield new Transition(
                        EventStatus.IN_PROGRESS,
                        RacePhase.SEMIFINAL,
                        races,
                        advanced,
                        split.eliminated(),
                        List.of(),
                        List.of(),
                        "Quarterfinals processed: " + advanced.size() + " advance to semifinals"
                );
            }
            case SEMIFINAL -> {
                HeatSplit split = splitHeats(phaseRaces, settings.semifinalAdvance(), settings.semifinalToFinalB());
                List<Entrant> finalA = split.flatAdvancing().stream()
                        .sorted(ACROSS_HEATS)
                        .map(HeatPlacing::entrant)
                        .toList();
                List<Entrant> finalB = split.flatSecondary().stream()
                        .sorted(ACROSS_HEATS)
                        .map(HeatPlacing::entrant)
                        .toList();

                List<PlannedRace> races = new ArrayList<>(toRaces(RacePhase.FINAL_A, List.of(finalA), laneCapacity));
                if (!finalB.isEmpty()) {
                    races.addAll(toRaces(RacePhase.FINAL_B, List.of(finalB), laneCapacity));
                }
                List<Entrant> advanced = new ArrayList<>(finalA);
                advanced.addAll(finalB);
                yield new Transition(
                        EventStatus.IN_PROGRESS,
                        RacePhase.FINAL_A,
                        List.copyOf(races),
                        List.copyOf(advanced),
                        split.eliminated(),
                        List.of(),
                        List.of(),
                        "Semifinals processed: " + finalA.size() + " to Final A, " + finalB.size() + " to Final B"
                );
            }
            default -> throw new IllegalArgumentException("Not a knockout phase: " + phase);
        };
    }

    Transition processFinals(EventSnapshot event, List<RaceSnapshot> finalA, List<RaceSnapshot> finalB) {
        if (finalA.size() != 1) {
            throw new DataInconsistencyException(
                    "Event " + event.eventId() + " has " + finalA.size() + " Final A races");
        }
        List<MedalAward> medals = new ArrayList<>();
        boolean bronzeAwarded = false;
        for (HeatPlacing placing : finishOrder(finalA.get(0))) {
            MedalType medal = medalFor(placing.position());
            if (medal != null) {
                medals.add(new MedalAward(medal, placing.entrant(), placing.elapsedMs()));
                bronzeAwarded |= medal == MedalType.BRONZE;
            }
        }
        if (!bronzeAwarded && !finalB.isEmpty()) {
            for (HeatPlacing placing : finishOrder(finalB.get(0))) {
                if (placing.position() != null && placing.position() == 1) {
                    medals.add(new MedalAward(MedalType.BRONZE, placing.entrant(), placing.elapsedMs()));
                }
            }
        }
        return new Transition(
                EventStatus.COMPLETED,
                RacePhase.FINAL_A,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.copyOf(medals),
                "Finals processed: " + medals.size() + " medal(s) awarded"
        );
    }

    /**
     * Seeds n entrants into the first knockout round. Eight or more race
     * quarterfinals, at least four (or more than one heat can hold) race
     * semifinals, otherwise they go straight to Final A. Heat counts grow
     * with the field so no heat exceeds the lane capacity. Seeds are dealt
     * serpentine so the top seeds meet last.
     */
    List<PlannedRace> buildKnockout(List<Entrant> seeded, int laneCapacity) {
        FirstRound round = firstRound(seeded.size(), laneCapacity);
        List<List<Entrant>> heats = serpentine(seeded, round.heatCount());
        if (round.phase() == RacePhase.QUARTERFINAL) {
            heats = bracketOrder(heats);
        }
        return toRaces(round.phase(), heats, laneCapacity);
    }

    /**
     * Rejects settings whose quarterfinal pairs or finals could never fit the
     * lanes, whatever the size of the field.
     */
    public static void requireRoundsFit(ProgressionSettings settings, int laneCapacity) {
        requireFits("Semifinal", 2 * settings.quarterfinalAdvance(), laneCapacity);
        requireFits("Final A", 2 * settings.semifinalAdvance(), laneCapacity);
        requireFits("Final B", 2 * settings.semifinalToFinalB(), laneCapacity);
    }

    /**
     * Walks the bracket a seeded field of {@code entrants} produces and fails
     * before any race is run when a later round would not fit the lanes.
     */
    static void requireBracketFits(ProgressionSettings settings, int entrants, int laneCapacity) {
        requireRoundsFit(settings, laneCapacity);

        int direct = clamp(settings.timeTrialDirectAdvance(), entrants);
        int field = direct;
        if (settings.hasRepechage()) {
            int repechage = clamp(settings.timeTrialToRepechage(), entrants - direct);
            int lanesPerHeat = Math.min(Math.max(settings.repechageLanesPerHeat(), 1), laneCapacity);
            for (int from = 0; from < repechage; from += lanesPerHeat) {
                field += clamp(settings.repechageAdvance(), Math.min(lanesPerHeat, repechage - from));
            }
        }
        if (field == 0) {
            throw new RegattaValidationException(
                    "invalid_configuration", "No entrant can qualify from a time trial of " + entrants);
        }

        FirstRound round = firstRound(field, laneCapacity);
        if (round.phase() == RacePhase.FINAL_A) {
            return;
        }
        int[] sizes = new int[round.heatCount()];
        for (int i = 0; i < field; i++) {
            sizes[serpentineHeat(i, round.heatCount())]++;
        }

        List<Integer> semifinals = new ArrayList<>();
        if (round.phase() == RacePhase.QUARTERFINAL) {
            for (int i = 0; i < sizes.length / 2; i++) {
                int paired = clamp(settings.quarterfinalAdvance(), sizes[i])
                        + clamp(settings.quarterfinalAdvance(), sizes[sizes.length - 1 - i]);
                requireFits("Semifinal", paired, laneCapacity);
                semifinals.add(paired);
            }
        } else {
            for (int size : sizes) {
                semifinals.add(size);
            }
        }

        int finalA = 0;
        int finalB = 0;
        for (int size : semifinals) {
            int advancing = clamp(settings.semifinalAdvance(), size);
            finalA += advancing;
            finalB += clamp(settings.semifinalToFinalB(), size - advancing);
        }
        requireFits("Final A", finalA, laneCapacity);
        requireFits("Final B", finalB, laneCapacity);
    }

    private static FirstRound firstRound(int entrants, int laneCapacity) {
        int needed = (entrants + laneCapacity - 1) / laneCapacity;
        if (entrants >= QUARTERFINAL_FIELD) {
            int heatCount = Math.max(4, needed);
            // Quarterfinals meet in pairs.
            return new FirstRound(RacePhase.QUARTERFINAL, heatCount % 2 == 0 ? heatCount : heatCount + 1);
        }
        if (entrants >= SEMIFINAL_FIELD || entrants > laneCapacity) {
            return new FirstRound(RacePhase.SEMIFINAL, Math.max(2, needed));
        }
        return new FirstRound(RacePhase.FINAL_A, 1);
    }

    // 1v8 and 4v5 feed the first semifinal, 2v7 and 3v6 the second.
    private static List<List<Entrant>> bracketOrder(List<List<Entrant>> heats) {
        List<List<Entrant>> ordered = new ArrayList<>(heats.size());
        for (int i = 0; i < heats.size() / 2; i++) {
            ordered.add(heats.get(i));
            ordered.add(heats.get(heats.size() - 1 - i));
        }
        return ordered;
    }

    private static List<PlannedRace> partitionIntoHeats(List<Entrant> entrants, int laneCapacity) {
        int heatCount = (entrants.size() + laneCapacity - 1) / laneCapacity;
        int baseSize = entrants.size() / heatCount;
        int larger = entrants.size() % heatCount;

        List<PlannedRace> heats = new ArrayList<>(heatCount);
        int from = 0;
        for (int heat = 1; heat <= heatCount; heat++) {
            int size = baseSize + (heat <= larger ? 1 : 0);
            heats.add(new PlannedRace(
                    RacePhase.TIME_TRIAL,
                    heat,
                    RacePhase.TIME_TRIAL.raceCode(heat),
                    List.copyOf(entrants.subList(from, from + size))
            ));
            from += size;
        }
        return heats;
    }

    private static List<PlannedRace> chunk(RacePhase phase, List<Entrant> entrants, int lanesPerHeat) {
        List<List<Entrant>> heats = new ArrayList<>();
        for (int i = 0; i < entrants.size(); i += lanesPerHeat) {
            heats.add(entrants.subList(i, Math.min(i + lanesPerHeat, entrants.size())));
        }
        return toRaces(phase, heats, lanesPerHeat);
    }

    private static List<List<Entrant>> serpentine(List<Entrant> seeded, int heatCount) {
        List<List<Entrant>> heats = new ArrayList<>(heatCount);
        for (int i = 0; i < heatCount; i++) {
            heats.add(new ArrayList<>());
        }
        for (int i = 0; i < seeded.size(); i++) {
            heats.get(serpentineHeat(i, heatCount)).add(seeded.get(i));
        }
        return heats;
    }

    private static int serpentineHeat(int seedIndex, int heatCount) {
        int round = seedIndex / heatCount;
        int offset = seedIndex % heatCount;
        return round % 2 == 0 ? offset : heatCount - 1 - offset;
    }

    private static List<PlannedRace> toRaces(RacePhase phase, List<List<Entrant>> heats, int laneCapacity) {
        List<PlannedRace> races = new ArrayList<>(heats.size());
        int heatNumber = 1;
        for (List<Entrant> heat : heats) {
            requireFits(phase.getDisplayName(), heat.size(), laneCapacity);
            races.add(new PlannedRace(phase, heatNumber, phase.raceCode(heatNumber), List.copyOf(heat)));
            heatNumber++;
        }
        return List.copyOf(races);
    }

    private static void requireFits(String round, int entrants, int laneCapacity) {
        if (entrants > laneCapacity) {
            throw new RegattaValidationException(
                    "invalid_configuration",
                    round + " heat of " + entrants + " entrants exceeds the lane capacity of " + laneCapacity
            );
        }
    }

    private static HeatSplit splitHeats(List<RaceSnapshot> races, int advancePerHeat, int secondaryPerHeat) {
        List<List<HeatPlacing>> advancing = new ArrayList<>();
        List<List<HeatPlacing>> secondary = new ArrayList<>();
        List<Entrant> eliminated = new ArrayList<>();
        for (RaceSnapshot race : races) {
            List<HeatPlacing> order = finishOrder(race);
            int advanceCount = clamp(advancePerHeat, order.size());
            int secondaryCount = clamp(secondaryPerHeat, order.size() - advanceCount);
            advancing.add(order.subList(0, advanceCount));
            secondary.add(order.subList(advanceCount, advanceCount + secondaryCount));
            order.subList(advanceCount + secondaryCount, order.size())
                    .forEach(placing -> eliminated.add(placing.entrant()));
        }
        return new HeatSplit(advancing, secondary, List.copyOf(eliminated));
    }

    private static List<HeatPlacing> finishOrder(RaceSnapshot race) {
        Map<Integer, LaneSnapshot> byLane = new HashMap<>();
        List<LaneOutcome> outcomes = new ArrayList<>(race.lanes().size());
        for (LaneSnapshot lane : race.lanes()) {
            if (byLane.put(lane.laneNumber(), lane) != null) {
                throw new DataInconsistencyException(
                        "Race " + race.raceId() + " has lane " + lane.laneNumber() + " twice");
            }
            outcomes.add(new LaneOutcome(lane.laneNumber(), lane.status(), lane.elapsedMs()));
        }

        List<HeatPlacing> order = new ArrayList<>(outcomes.size());
        for (PlacedLane placed : ScoringPolicy.resolveFinishOrder(outcomes, outcomes.size(), false)) {
            LaneSnapshot lane = byLane.get(placed.lane().laneNumber());
            order.add(new HeatPlacing(
                    lane.entrant(),
                    race.heatNumber(),
                    lane.laneNumber(),
                    placed.position(),
                    placed.isPlaced() ? lane.elapsedMs() : null
            ));
        }
        return order;
    }

    private static void requireProcessable(EventSnapshot event, RacePhase phase, List<RaceSnapshot> phaseRaces) {
        if (event.status() == EventStatus.COMPLETED) {
            throw StateConflictException.eventCompleted("Event is already completed: " + event.eventId());
        }
        if (event.status() == EventStatus.PENDING) {
            throw StateConflictException.eventNotStarted("Event has not been seeded yet: " + event.eventId());
        }
        RacePhase current = event.currentPhase();
        boolean skipped = phase.isBefore(current) && phaseRaces.isEmpty();
        if (skipped || (phase == RacePhase.REPECHAGE && !event.settings().hasRepechage())) {
            throw StateConflictException.phaseNotApplicable(
                    "Event " + event.eventId() + " has no " + phase.getDisplayName());
        }
        if (phase.isBefore(current)) {
            throw StateConflictException.alreadyProcessed(
                    phase.getDisplayName() + " of event " + event.eventId() + " is already processed");
        }
        if (current.isBefore(phase)) {
            throw StateConflictException.phaseNotReady(
                    "Event " + event.eventId() + " is in " + current.getDisplayName()
                            + ", not " + phase.getDisplayName());
        }
    }

    private static void requireCompleted(RacePhase phase, List<RaceSnapshot> phaseRaces) {
        if (phaseRaces.isEmpty()) {
            throw new DataInconsistencyException("No " + phase.getDisplayName() + " races found");
        }
        long pending = phaseRaces.stream()
                .filter(race -> race.status() != RaceStatus.COMPLETED)
                .count();
        if (pending > 0) {
            throw StateConflictException.phaseNotReady(
                    pending + " " + phase.getDisplayName() + " race(s) still awaiting results");
        }
    }

    private static void requireAllowed(RacePhase current, Transition transition) {
        if (transition.nextStatus() == EventStatus.COMPLETED && transition.nextPhase() == current) {
            return;
        }
        if (!TRANSITIONS.get(current).contains(transition.nextPhase())) {
            throw new IllegalStateException(
                    "Transition " + current + " -> " + transition.nextPhase() + " is not allowed");
        }
    }

    private static void requireDistinctEntries(List<Entrant> entrants) {
        Set<UUID> seen = new HashSet<>();
        for (Entrant entrant : entrants) {
            if (!seen.add(entrant.entryId())) {
                throw new RegattaValidationException("Entry listed twice: " + entrant.entryId());
            }
        }
    }

    private static int requireLaneCapacity(EventSnapshot event) {
        if (event.laneCapacity() < 1) {
            throw new RegattaValidationException(
                    "invalid_configuration", "Lane capacity must be positive for event " + event.eventId());
        }
        return event.laneCapacity();
    }

    private static List<RaceSnapshot> racesOf(List<RaceSnapshot> races, RacePhase phase) {
        return races.stream()
                .filter(race -> race.phase() == phase)
                .sorted(Comparator.comparingInt(RaceSnapshot::heatNumber))
                .toList();
    }

    private static int clamp(int requested, int available) {
        return Math.max(0, Math.min(requested, available));
    }

    private static MedalType medalFor(Integer position) {
        if (position == null) {
            return null;
        }
        return switch (position) {
            case 1 -> MedalType.GOLD;
            case 2 -> MedalType.SILVER;
            case 3 -> MedalType.BRONZE;
            default -> null;
        };
    }

    private record HeatPlacing(
            Entrant entrant,
            int heatNumber,
            int laneNumber,
            Integer position,
            Long elapsedMs
    ) {
    }

    private record FirstRound(RacePhase phase, int heatCount) {
    }

    private record HeatSplit(
            List<List<HeatPlacing>> advancing,
            List<List<HeatPlacing>> secondary,
            List<Entrant> eliminated
    ) {

        List<HeatPlacing> flatAdvancing() {
            return advancing.stream().flatMap(List::stream).toList();
        }

        List<HeatPlacing> flatSecondary() {
            return secondary.stream().flatMap(List::stream).toList();
        }

        List<List<Entrant>> advancingPerHeat() {
            List<List<Entrant>> perHeat = new ArrayList<>(advancing.size());
            for (List<HeatPlacing> heat : advancing) {
                perHeat.add(heat.stream().map(HeatPlacing::entrant).toList());
            }
            return Collections.unmodifiableList(perHeat);
        }
    }
}

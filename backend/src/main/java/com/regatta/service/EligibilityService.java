package com.regatta.service;

import com.regatta.model.Athlete;
import com.regatta.model.AthleteStatus;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEntry;
import com.regatta.model.EntryStatus;
import com.regatta.model.Gender;
import com.regatta.repository.AthleteRepository;
import com.regatta.web.NotEligibleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks that entries may race in a given category and boat class. Problems
 * are collected per entry so callers can report all of them at once.
 */
@Service
public class EligibilityService {

    private static final Logger log = LoggerFactory.getLogger(EligibilityService.class);

    private final AthleteRepository athleteRepository;

    public EligibilityService(AthleteRepository athleteRepository) {
        this.athleteRepository = athleteRepository;
    }

    public Map<UUID, Athlete> loadCrews(Collection<CompetitionEntry> entries) {
        List<UUID> athleteIds = entries.stream()
                .flatMap(entry -> entry.getCrew().stream())
                .distinct()
                .toList();
        return athleteRepository.findAllById(athleteIds).stream()
                .collect(Collectors.toMap(Athlete::getAthleteId, Function.identity()));
    }

    /**
     * @param eventGender gender of the event or race the entry goes into; null skips that check
     * @param requireApproved whether the entry must already be approved
     */
    public List<String> findProblems(
            CompetitionEntry entry,
            Competition competition,
            Category category,
            BoatClass boatClass,
            Gender eventGender,
            Map<UUID, Athlete> athletes,
            boolean requireApproved
    ) {
        List<String> problems = new ArrayList<>();
        String prefix = "entry " + entry.getEntryId() + ": ";

        if (requireApproved && entry.getStatus() != EntryStatus.APPROVED) {
            problems.add(prefix + "status is " + entry.getStatus());
        }
        if (!competition.getCompetitionId().equals(entry.getCompetitionId())) {
            problems.add(prefix + "belongs to another competition");
        }
        if (!category.getCategoryId().equals(entry.getCategoryId())) {
            problems.add(prefix + "is entered in another category");
        }
        if (!boatClass.getBoatClassId().equals(entry.getBoatClassId())) {
            problems.add(prefix + "is entered in another boat class");
        }
        int crewSize = entry.getCrew() == null ? 0 : entry.getCrew().size();
        if (crewSize != boatClass.getCrewSize()) {
            problems.add(prefix + "crew of " + crewSize + " does not fit " + boatClass.getCode()
                    + " (crew of " + boatClass.getCrewSize() + ")");
        }

        int seasonYear = competition.getStartDate().getYear();
        for (UUID athleteId : entry.getCrew()) {
            Athlete athlete = athletes.get(athleteId);
            if (athlete == null) {
                problems.add(prefix + "athlete " + athleteId + " does not exist");
                continue;
            }
            String who = prefix + athlete.getDisplayName() + " ";
            if (athlete.getStatus() != AthleteStatus.ACTIVE) {
                problems.add(who + "is " + athlete.getStatus());
            }
            if (!category.getGenderScope().admits(athlete.getGender())) {
                problems.add(who + "is not admitted by category " + category.getCode());
            }
            if (!boatClass.allowsGender(athlete.getGender())) {
                problems.add(who + "is not allowed in " + boatClass.getCode());
            }
            if (eventGender != null && eventGender != Gender.MIXED && athlete.getGender() != eventGender) {
                problems.add(who + "does not match event gender " + eventGender);
            }
            int seasonAge = seasonYear - athlete.getBirthDate().getYear();
            if (!category.admitsAge(seasonAge)) {
                problems.add(who + "is outside the age range of " + category.getCode());
            }
        }
        return problems;
    }

    public void requireEligible(
            List<CompetitionEntry> entries,
            Competition competition,
            Category category,
            BoatClass boatClass,
            Gender eventGender
    ) {
        Map<UUID, Athlete> athletes = loadCrews(entries);
        List<String> problems = new ArrayList<>();
        for (CompetitionEntry entry : entries) {
            problems.addAll(findProblems(entry, competition, category, boatClass, eventGender, athletes, true));
        }
        if (!problems.isEmpty()) {
            log.warn("Rejected {} entries for {} {}: {} problem(s)",
                    entries.size(), category.getCode(), boatClass.getCode(), problems.size());
            throw new NotEligibleException("Some entries are not eligible", problems);
        }
    }
}

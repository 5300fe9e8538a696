package com.regatta.service;

import com.regatta.dto.CompetitionRequests;
import com.regatta.dto.CompetitionResponses;
import com.regatta.model.Athlete;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEntry;
import com.regatta.model.EntryStatus;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.CompetitionEntryRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.web.NotEligibleException;
import com.regatta.web.RegattaException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bulk entry approval. Items are handled one at a time; a failing item is
 * reported and the rest still go through.
 */
@Service
public class EntryApprovalService {

    private static final Logger log = LoggerFactory.getLogger(EntryApprovalService.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionEntryRepository competitionEntryRepository;
    private final CategoryRepository categoryRepository;
    private final BoatClassRepository boatClassRepository;
    private final EligibilityService eligibilityService;

    public EntryApprovalService(
            CompetitionRepository competitionRepository,
            CompetitionEntryRepository competitionEntryRepository,
            CategoryRepository categoryRepository,
            BoatClassRepository boatClassRepository,
            EligibilityService eligibilityService
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionEntryRepository = competitionEntryRepository;
        this.categoryRepository = categoryRepository;
        this.boatClassRepository = boatClassRepository;
        this.eligibilityService = eligibilityService;
    }

    @Transactional
    public CompetitionResponses.ApprovalOutcome approveEntries(
            UUID competitionId,
            CompetitionRequests.ApproveEntriesRequest request
    ) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", competitionId));

        List<UUID> approved = new ArrayList<>();
        List<CompetitionResponses.ApprovalFailure> failed = new ArrayList<>();
        for (UUID entryId : new LinkedHashSet<>(request.entryIds())) {
            try {
                approveOne(competition, entryId);
                approved.add(entryId);
            } catch (RegattaException ex) {
                failed.add(new CompetitionResponses.ApprovalFailure(entryId, ex.getCode(), describe(ex)));
            }
        }

        if (!failed.isEmpty()) {
            log.warn("Approved {} of {} entries for competition {}; {} failed",
                    approved.size(), approved.size() + failed.size(), competition.getCode(), failed.size());
        } else {
            log.info("Approved {} entries for competition {}", approved.size(), competition.getCode());
        }
        return new CompetitionResponses.ApprovalOutcome(approved, failed);
    }

    private void approveOne(Competition competition, UUID entryId) {
        CompetitionEntry entry = competitionEntryRepository.findById(entryId)
                .orElseThrow(() -> ResourceNotFoundException.of("Entry", entryId));
        if (!competition.getCompetitionId().equals(entry.getCompetitionId())) {
            throw ResourceNotFoundException.of("Entry", entryId);
        }
        if (entry.getStatus() == EntryStatus.APPROVED) {
            throw StateConflictException.alreadyProcessed("Entry " + entryId + " is already approved");
        }

        Category category = categoryRepository.findById(entry.getCategoryId())
                .orElseThrow(() -> ResourceNotFoundException.of("Category", entry.getCategoryId()));
        BoatClass boatClass = boatClassRepository.findById(entry.getBoatClassId())
                .orElseThrow(() -> ResourceNotFoundException.of("Boat class", entry.getBoatClassId()));
        Map<UUID, Athlete> athletes = eligibilityService.loadCrews(List.of(entry));
        List<String> problems = eligibilityService.findProblems(
                entry, competition, category, boatClass, null, athletes, false);
        if (!problems.isEmpty()) {
            throw new NotEligibleException("Entry " + entryId + " is not eligible", problems);
        }

        entry.setStatus(EntryStatus.APPROVED);
        entry.setRejectionReason(null);
        entry.setUpdatedAt(OffsetDateTime.now());
        competitionEntryRepository.save(entry);
    }

    private static String describe(RegattaException ex) {
        if (ex.getDetails().isEmpty()) {
            return ex.getMessage();
        }
        return ex.getMessage() + ": " + String.join("; ", ex.getDetails());
    }
}

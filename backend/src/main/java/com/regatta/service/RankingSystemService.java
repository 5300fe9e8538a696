package com.regatta.service;

import com.regatta.dto.RankingRequests;
import com.regatta.dto.RankingResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.JourneyMode;
import com.regatta.model.LocalizedTitle;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.RankingSystem;
import com.regatta.model.ScoringMode;
import com.regatta.ranking.RankingPreset;
import com.regatta.ranking.RankingPresets;
import com.regatta.repository.RankingSystemRepository;
import com.regatta.scoring.PointTable;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class RankingSystemService {

    private static final Logger log = LoggerFactory.getLogger(RankingSystemService.class);

    private final RankingSystemRepository rankingSystemRepository;
    private final RegattaResponseMapper regattaResponseMapper;

    public RankingSystemService(
            RankingSystemRepository rankingSystemRepository,
            RegattaResponseMapper regattaResponseMapper
    ) {
        this.rankingSystemRepository = rankingSystemRepository;
        this.regattaResponseMapper = regattaResponseMapper;
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.RankingSystemDetail> listSystems() {
        return rankingSystemRepository.findAllByOrderBySortOrderAscCodeAsc().stream()
                .map(regattaResponseMapper::toRankingSystemDetail)
                .toList();
    }

    @Transactional(readOnly = true)
    public RankingResponses.RankingSystemDetail getSystem(UUID systemId) {
        return regattaResponseMapper.toRankingSystemDetail(findSystem(systemId));
    }

    @Transactional
    public RankingResponses.RankingSystemDetail createSystem(RankingRequests.RankingSystemRequest request) {
        if (rankingSystemRepository.existsByCode(request.code())) {
            throw StateConflictException.duplicateCode("Ranking system code already in use: " + request.code());
        }
        OffsetDateTime now = OffsetDateTime.now();
        RankingSystem system = new RankingSystem();
        system.setRankingSystemId(UUID.randomUUID());
        system.setPreset(false);
        system.setCreatedAt(now);
        applyRequest(system, request, now);

        RankingSystem saved = rankingSystemRepository.save(system);
        log.info("Created ranking system {}", saved.getCode());
        return regattaResponseMapper.toRankingSystemDetail(saved);
    }

    @Transactional
    public RankingResponses.RankingSystemDetail updateSystem(UUID systemId, RankingRequests.RankingSystemRequest request) {
        RankingSystem system = findSystem(systemId);
        if (!system.getCode().equals(request.code()) && rankingSystemRepository.existsByCode(request.code())) {
            throw StateConflictException.duplicateCode("Ranking system code already in use: " + request.code());
        }
        applyRequest(system, request, OffsetDateTime.now());

        RankingSystem saved = rankingSystemRepository.save(system);
        log.info("Updated ranking system {}", saved.getCode());
        return regattaResponseMapper.toRankingSystemDetail(saved);
    }

    @Transactional
    public void deleteSystem(UUID systemId) {
        RankingSystem system = findSystem(systemId);
        if (system.isPreset()) {
            throw StateConflictException.presetProtected(
                    "Preset " + system.getCode() + " cannot be deleted; deactivate it instead");
        }
        rankingSystemRepository.delete(system);
        log.info("Deleted ranking system {}", system.getCode());
    }

    @Transactional(readOnly = true)
    public List<RankingResponses.PresetSummary> listPresets() {
        Set<String> installed = rankingSystemRepository.findAll().stream()
                .map(RankingSystem::getCode)
                .collect(Collectors.toSet());
        return RankingPresets.ALL.stream()
                .map(preset -> regattaResponseMapper.toPresetSummary(preset, installed.contains(preset.code())))
                .toList();
    }

    /**
     * Creates missing presets and resets installed ones to their defaults.
     */
    @Transactional
    public RankingResponses.PresetSyncResult syncPresets() {
        OffsetDateTime now = OffsetDateTime.now();
        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        for (RankingPreset preset : RankingPresets.ALL) {
            RankingSystem system = rankingSystemRepository.findByCode(preset.code()).orElse(null);
            if (system == null) {
                system = new RankingSystem();
                system.setRankingSystemId(UUID.randomUUID());
                system.setCreatedAt(now);
                created.add(preset.code());
            } else {
                updated.add(preset.code());
            }
            preset.applyTo(system, now);
            rankingSystemRepository.save(system);
        }
        log.info("Synced ranking presets: {} created, {} updated", created.size(), updated.size());
        return new RankingResponses.PresetSyncResult(created, updated);
    }

    private RankingSystem findSystem(UUID systemId) {
        return rankingSystemRepository.findById(systemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Ranking system", systemId));
    }

    private static void applyRequest(RankingSystem system, RankingRequests.RankingSystemRequest request, OffsetDateTime now) {
        system.setCode(request.code());
        system.setTitles(new LocalizedTitle(request.titleEn(), request.titleFr(), request.titleAr()));
        system.setDescription(request.description());
        system.setGroupBy(request.groupBy());
        system.setEntityType(request.entityType() != null ? request.entityType() : RankingEntityType.CLUB);
        system.setScoringMode(request.scoringMode() != null ? request.scoringMode() : ScoringMode.POINTS);
        system.setJourneyMode(request.journeyMode() != null ? request.journeyMode() : JourneyMode.ALL);
        system.setBestNCount(request.bestNCount());
        system.setPointMode(request.pointMode() != null ? request.pointMode() : PointMode.MIXED);
        system.setPointTable(new TreeMap<>(
                request.pointTable() == null || request.pointTable().isEmpty()
                        ? PointTable.DEFAULT_POINTS
                        : request.pointTable()));
        system.setMaxScoringPosition(request.maxScoringPosition() != null
                ? request.maxScoringPosition()
                : PointTable.DEFAULT_MAX_SCORING_POSITION);
        system.setDnfGetsPointsIfFewFinishers(
                request.dnfGetsPointsIfFewFinishers() == null || request.dnfGetsPointsIfFewFinishers());
        system.setDiscipline(request.discipline());
        system.setAllowedBoatClassIds(request.allowedBoatClassIds() == null
                ? new HashSet<>()
                : new HashSet<>(request.allowedBoatClassIds()));
        system.setTieBreakers(request.tieBreakers() == null
                ? new ArrayList<>()
                : new ArrayList<>(request.tieBreakers()));
        system.setActive(request.active() == null || request.active());
        system.setSortOrder(request.sortOrder() != null ? request.sortOrder() : 0);
        system.setUpdatedAt(now);
    }
}

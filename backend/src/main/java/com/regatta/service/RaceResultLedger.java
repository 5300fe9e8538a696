package com.regatta.service;

import com.regatta.model.Race;
import com.regatta.model.RaceResultRecord;
import com.regatta.model.RaceStatus;
import com.regatta.model.RecordedLaneResult;
import com.regatta.repository.RaceResultRecordRepository;
import com.regatta.web.DataInconsistencyException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to race results. The latest revision of a race is its
 * effective result.
 */
@Component
public class RaceResultLedger {

    private final RaceResultRecordRepository raceResultRecordRepository;

    public RaceResultLedger(RaceResultRecordRepository raceResultRecordRepository) {
        this.raceResultRecordRepository = raceResultRecordRepository;
    }

    public Optional<RaceResultRecord> latest(UUID raceId) {
        return raceResultRecordRepository.findFirstByRaceIdOrderByRevisionDesc(raceId);
    }

    /**
     * Effective results of the given races. A completed race without any
     * recorded revision is inconsistent.
     */
    public Map<UUID, RaceResultRecord> latestByRace(Collection<Race> races) {
        Map<UUID, RaceResultRecord> latest = new HashMap<>();
        if (races.isEmpty()) {
            return latest;
        }
        List<UUID> raceIds = races.stream().map(Race::getRaceId).toList();
        for (RaceResultRecord record : raceResultRecordRepository.findByRaceIdIn(raceIds)) {
            latest.merge(record.getRaceId(), record,
                    (current, candidate) -> candidate.getRevision() > current.getRevision() ? candidate : current);
        }
        for (Race race : races) {
            if (race.getStatus() == RaceStatus.COMPLETED && !latest.containsKey(race.getRaceId())) {
                throw new DataInconsistencyException("Completed race " + race.getRaceId() + " has no recorded results");
            }
        }
        return latest;
    }

    public List<RaceResultRecord> history(UUID raceId) {
        return raceResultRecordRepository.findByRaceIdOrderByRevisionAsc(raceId);
    }

    public RaceResultRecord append(UUID raceId, List<RecordedLaneResult> lanes, String reason, OffsetDateTime now) {
        int revision = latest(raceId).map(record -> record.getRevision() + 1).orElse(1);

        RaceResultRecord record = new RaceResultRecord();
        record.setRecordId(UUID.randomUUID());
        record.setRaceId(raceId);
        record.setRevision(revision);
        record.setReason(reason);
        record.setLanes(lanes);
        record.setRecordedAt(now);
        return raceResultRecordRepository.save(record);
    }
}

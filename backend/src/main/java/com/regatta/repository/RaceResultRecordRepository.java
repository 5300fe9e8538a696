package com.regatta.repository;

import com.regatta.model.RaceResultRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RaceResultRecordRepository extends JpaRepository<RaceResultRecord, UUID> {
    Optional<RaceResultRecord> findFirstByRaceIdOrderByRevisionDesc(UUID raceId);

    List<RaceResultRecord> findByRaceIdOrderByRevisionAsc(UUID raceId);

    List<RaceResultRecord> findByRaceIdIn(Collection<UUID> raceIds);
}

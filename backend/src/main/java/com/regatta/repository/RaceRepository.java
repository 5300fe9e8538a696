package com.regatta.repository;

import com.regatta.model.Race;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RaceRepository extends JpaRepository<Race, UUID> {
    List<Race> findByEventIdOrderByHeatNumberAsc(UUID eventId);

    List<Race> findByCompetitionIdAndStatusOrderByStageIndexAscRaceCodeAsc(UUID competitionId, RaceStatus status);

    List<Race> findByCompetitionIdAndEventIdIsNullOrderByStageIndexAscRaceCodeAsc(UUID competitionId);

    boolean existsByEventIdAndPhase(UUID eventId, RacePhase phase);

    boolean existsByCompetitionIdAndRaceCodeAndStageIndex(UUID competitionId, String raceCode, Integer stageIndex);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Race r where r.raceId = :raceId")
    Optional<Race> findByRaceIdForUpdate(@Param("raceId") UUID raceId);
}

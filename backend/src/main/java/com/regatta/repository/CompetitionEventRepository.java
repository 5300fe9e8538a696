package com.regatta.repository;

import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventStatus;
import com.regatta.model.Gender;
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
public interface CompetitionEventRepository extends JpaRepository<CompetitionEvent, UUID> {
    List<CompetitionEvent> findByCompetitionIdOrderByStageIndexAscCreatedAtAsc(UUID competitionId);

    List<CompetitionEvent> findByCompetitionIdAndStatus(UUID competitionId, EventStatus status);

    boolean existsByCompetitionIdAndBoatClassIdAndCategoryIdAndGenderAndStageIndex(
            UUID competitionId,
            UUID boatClassId,
            UUID categoryId,
            Gender gender,
            Integer stageIndex
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from CompetitionEvent e where e.eventId = :eventId")
    Optional<CompetitionEvent> findByEventIdForUpdate(@Param("eventId") UUID eventId);
}

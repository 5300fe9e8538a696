package com.regatta.repository;

import com.regatta.model.CompetitionEntry;
import com.regatta.model.EntryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CompetitionEntryRepository extends JpaRepository<CompetitionEntry, UUID> {
    List<CompetitionEntry> findByCompetitionIdAndCategoryIdAndBoatClassIdAndStatusOrderBySubmittedAtAscEntryIdAsc(
            UUID competitionId,
            UUID categoryId,
            UUID boatClassId,
            EntryStatus status
    );
}

package com.regatta.repository;

import com.regatta.model.RankingSystem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RankingSystemRepository extends JpaRepository<RankingSystem, UUID> {
    Optional<RankingSystem> findByCode(String code);

    boolean existsByCode(String code);

    List<RankingSystem> findAllByOrderBySortOrderAscCodeAsc();

    List<RankingSystem> findByActiveTrueOrderBySortOrderAscCodeAsc();
}

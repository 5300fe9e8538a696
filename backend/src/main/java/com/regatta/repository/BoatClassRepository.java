package com.regatta.repository;

import com.regatta.model.BoatClass;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface BoatClassRepository extends JpaRepository<BoatClass, UUID> {
}

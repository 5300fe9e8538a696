package com.regatta.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "races")
public class Race {

    @Id
    @Column(name = "race_id", nullable = false, updatable = false)
    private UUID raceId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    /**
     * Null for stage races that are not part of a knockout event.
     */
    @Column(name = "event_id", updatable = false)
    private UUID eventId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "boat_class_id", nullable = false, updatable = false)
    private UUID boatClassId;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 8)
    private Gender gender;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", length = 16, updatable = false)
    private RacePhase phase;

    @Column(name = "heat_number", nullable = false)
    private Integer heatNumber = 1;

    @Column(name = "race_code", nullable = false, length = 32)
    private String raceCode;

    @Column(name = "stage_index", nullable = false)
    private Integer stageIndex = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RaceStatus status = RaceStatus.SCHEDULED;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "race_lanes", joinColumns = @JoinColumn(name = "race_id"))
    @OrderBy("laneNumber ASC")
    private List<RaceLane> lanes = new ArrayList<>();

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}

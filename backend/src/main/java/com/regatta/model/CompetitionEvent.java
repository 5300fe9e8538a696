package com.regatta.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One boat class / category / gender knockout within a competition.
 */
@Getter
@Setter
@Entity
@Table(name = "competition_events")
public class CompetitionEvent {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "boat_class_id", nullable = false, updatable = false)
    private UUID boatClassId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 8, updatable = false)
    private Gender gender;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    @Column(name = "stage_index", nullable = false)
    private Integer stageIndex = 1;

    @Embedded
    private ProgressionConfig progressionConfig = new ProgressionConfig();

    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", nullable = false, length = 16)
    private RacePhase currentPhase = RacePhase.TIME_TRIAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EventStatus status = EventStatus.PENDING;

    /**
     * Time-trial qualifiers waiting for the repechage to finish, in seed order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_direct_qualifiers", joinColumns = @JoinColumn(name = "event_id"))
    @OrderColumn(name = "seed_order")
    @Column(name = "entry_id", nullable = false)
    private List<UUID> directQualifiers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_medals", joinColumns = @JoinColumn(name = "event_id"))
    private List<EventMedal> medals = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}

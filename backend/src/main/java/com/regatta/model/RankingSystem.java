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
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "ranking_systems")
public class RankingSystem {

    @Id
    @Column(name = "ranking_system_id", nullable = false, updatable = false)
    private UUID rankingSystemId;

    @Column(name = "code", nullable = false, unique = true, length = 32)
    private String code;

    @Embedded
    private LocalizedTitle titles = new LocalizedTitle();

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "group_by", nullable = false, length = 16)
    private GroupBy groupBy = GroupBy.CATEGORY_GENDER;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 16)
    private RankingEntityType entityType = RankingEntityType.CLUB;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_mode", nullable = false, length = 16)
    private ScoringMode scoringMode = ScoringMode.POINTS;

    @Enumerated(EnumType.STRING)
    @Column(name = "journey_mode", nullable = false, length = 16)
    private JourneyMode journeyMode = JourneyMode.ALL;

    @Column(name = "best_n_count")
    private Integer bestNCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "point_mode", nullable = false, length = 16)
    private PointMode pointMode = PointMode.MIXED;

    /**
     * Position to points. Empty means the default table.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ranking_system_points", joinColumns = @JoinColumn(name = "ranking_system_id"))
    @MapKeyColumn(name = "position")
    @Column(name = "points", nullable = false)
    private Map<Integer, Integer> pointTable = new TreeMap<>();

    @Column(name = "max_scoring_position", nullable = false)
    private Integer maxScoringPosition = 8;

    @Column(name = "dnf_gets_points_if_few_finishers", nullable = false)
    private boolean dnfGetsPointsIfFewFinishers = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "discipline", length = 16)
    private Discipline discipline;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ranking_system_boat_classes", joinColumns = @JoinColumn(name = "ranking_system_id"))
    @Column(name = "boat_class_id", nullable = false)
    private Set<UUID> allowedBoatClassIds = new HashSet<>();

    /**
     * Applied in order to entries with equal scores. Empty means the default order.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "ranking_system_tie_breakers", joinColumns = @JoinColumn(name = "ranking_system_id"))
    @OrderColumn(name = "priority")
    @Column(name = "tie_breaker", nullable = false, length = 32)
    private List<TieBreaker> tieBreakers = new ArrayList<>();

    @Column(name = "preset", nullable = false)
    private boolean preset;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}

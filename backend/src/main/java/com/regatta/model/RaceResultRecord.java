package com.regatta.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One append-only revision of a race's results. Revision 1 is the original
 * recording; every correction adds a new revision and leaves older ones as they were.
 */
@Getter
@Setter
@Entity
@Table(
        name = "race_result_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_race_result_revision", columnNames = {"race_id", "revision"})
)
public class RaceResultRecord {

    @Id
    @Column(name = "record_id", nullable = false, updatable = false)
    private UUID recordId;

    @Column(name = "race_id", nullable = false, updatable = false)
    private UUID raceId;

    @Column(name = "revision", nullable = false, updatable = false)
    private Integer revision;

    @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "race_result_lanes", joinColumns = @JoinColumn(name = "record_id"))
    @OrderBy("laneNumber ASC")
    private List<RecordedLaneResult> lanes = new ArrayList<>();

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt = OffsetDateTime.now();
}

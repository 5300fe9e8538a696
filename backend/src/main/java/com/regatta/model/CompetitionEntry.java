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
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An approved or pending registration: one athlete for a single, an ordered
 * crew otherwise. The first crew member is the entry's primary athlete.
 */
@Getter
@Setter
@Entity
@Table(name = "competition_entries")
public class CompetitionEntry {

    @Id
    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "category_id", nullable = false)
    private UUID categoryId;

    @Column(name = "boat_class_id", nullable = false)
    private UUID boatClassId;

    @Column(name = "club_id", nullable = false)
    private UUID clubId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "competition_entry_crew", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "seat")
    @Column(name = "athlete_id", nullable = false)
    private List<UUID> crew = new ArrayList<>();

    @Column(name = "seed")
    private Integer seed;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EntryStatus status = EntryStatus.PENDING;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private OffsetDateTime submittedAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public UUID getPrimaryAthleteId() {
        return crew == null || crew.isEmpty() ? null : crew.get(0);
    }
}

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
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "boat_classes")
public class BoatClass {

    @Id
    @Column(name = "boat_class_id", nullable = false, updatable = false)
    private UUID boatClassId;

    @Column(name = "code", nullable = false, unique = true, length = 16)
    private String code;

    @Column(name = "crew_size", nullable = false)
    private Integer crewSize = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "discipline", length = 16)
    private Discipline discipline;

    @Column(name = "lightweight", nullable = false)
    private boolean lightweight;

    /**
     * Lanes per heat. Null falls back to {@code regatta.default-lane-capacity}.
     */
    @Column(name = "lane_capacity")
    private Integer laneCapacity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "boat_class_genders", joinColumns = @JoinColumn(name = "boat_class_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 8)
    private Set<Gender> allowedGenders = EnumSet.noneOf(Gender.class);

    public boolean isSkiff() {
        return crewSize != null && crewSize == 1;
    }

    public boolean allowsGender(Gender gender) {
        return allowedGenders == null || allowedGenders.isEmpty() || allowedGenders.contains(gender);
    }
}

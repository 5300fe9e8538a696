package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Lane assignment of a race. Results are kept in {@link RaceResultRecord}.
 */
@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class RaceLane {

    @Column(name = "lane_number", nullable = false)
    private Integer laneNumber;

    @Column(name = "entry_id", nullable = false)
    private UUID entryId;

    @Column(name = "athlete_id")
    private UUID athleteId;

    @Column(name = "club_id")
    private UUID clubId;

    public RaceLane(Integer laneNumber, UUID entryId, UUID athleteId, UUID clubId) {
        this.laneNumber = laneNumber;
        this.entryId = entryId;
        this.athleteId = athleteId;
        this.clubId = clubId;
    }
}

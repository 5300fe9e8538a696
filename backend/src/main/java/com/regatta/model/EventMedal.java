package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class EventMedal {

    @Enumerated(EnumType.STRING)
    @Column(name = "medal_type", nullable = false, length = 8)
    private MedalType medalType;

    @Column(name = "entry_id", nullable = false)
    private UUID entryId;

    @Column(name = "athlete_id")
    private UUID athleteId;

    @Column(name = "club_id")
    private UUID clubId;

    @Column(name = "elapsed_ms")
    private Long elapsedMs;

    public EventMedal(MedalType medalType, UUID entryId, UUID athleteId, UUID clubId, Long elapsedMs) {
        this.medalType = medalType;
        this.entryId = entryId;
        this.athleteId = athleteId;
        this.clubId = clubId;
        this.elapsedMs = elapsedMs;
    }
}

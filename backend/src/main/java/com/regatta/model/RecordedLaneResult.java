package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class RecordedLaneResult {

    @Column(name = "lane_number", nullable = false)
    private Integer laneNumber;

    @Column(name = "elapsed_ms")
    private Long elapsedMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 8)
    private LaneStatus status;

    @Column(name = "position")
    private Integer position;

    public RecordedLaneResult(Integer laneNumber, Long elapsedMs, LaneStatus status, Integer position) {
        this.laneNumber = laneNumber;
        this.elapsedMs = elapsedMs;
        this.status = status;
        this.position = position;
    }
}

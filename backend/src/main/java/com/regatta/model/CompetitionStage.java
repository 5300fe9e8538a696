package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class CompetitionStage {

    @Column(name = "stage_index", nullable = false)
    private Integer stageIndex;

    @Column(name = "label", length = 64)
    private String label;

    @Column(name = "final_day", nullable = false)
    private boolean finalDay;

    public CompetitionStage(Integer stageIndex, String label, boolean finalDay) {
        this.stageIndex = stageIndex;
        this.label = label;
        this.finalDay = finalDay;
    }
}

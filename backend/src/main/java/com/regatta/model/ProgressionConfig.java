package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

/**
 * Advancement counts of a knockout event.
 */
@Getter
@Setter
@Embeddable
public class ProgressionConfig {

    @Column(name = "has_repechage", nullable = false)
    private boolean hasRepechage = true;

    @Column(name = "time_trial_direct_advance", nullable = false)
    private int timeTrialDirectAdvance = 4;

    @Column(name = "time_trial_to_repechage", nullable = false)
    private int timeTrialToRepechage = 4;

    @Column(name = "repechage_advance", nullable = false)
    private int repechageAdvance = 2;

    @Column(name = "quarterfinal_advance", nullable = false)
    private int quarterfinalAdvance = 1;

    @Column(name = "semifinal_advance", nullable = false)
    private int semifinalAdvance = 1;

    @Column(name = "semifinal_to_final_b", nullable = false)
    private int semifinalToFinalB = 1;

    @Column(name = "repechage_lanes_per_heat", nullable = false)
    private int repechageLanesPerHeat = 2;
}

package com.regatta.progression;

import com.regatta.model.ProgressionConfig;

public record ProgressionSettings(
        boolean hasRepechage,
        int timeTrialDirectAdvance,
        int timeTrialToRepechage,
        int repechageAdvance,
        int quarterfinalAdvance,
        int semifinalAdvance,
        int semifinalToFinalB,
        int repechageLanesPerHeat
) {

    public static ProgressionSettings from(ProgressionConfig config) {
        return new ProgressionSettings(
                config.isHasRepechage(),
                config.getTimeTrialDirectAdvance(),
                config.getTimeTrialToRepechage(),
                config.getRepechageAdvance(),
                config.getQuarterfinalAdvance(),
                config.getSemifinalAdvance(),
                config.getSemifinalToFinalB(),
                config.getRepechageLanesPerHeat()
        );
    }
}

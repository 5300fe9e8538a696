package com.regatta.config;

import com.regatta.model.GroupBy;
import com.regatta.model.ProgressionConfig;
import com.regatta.scoring.PointTable;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Engine defaults. Stored events and ranking systems carry their own values;
 * these apply where a request or a boat class leaves one out.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "regatta")
public class RegattaRuntimeProperties {

    /**
     * Lanes per heat for boat classes that do not declare a capacity.
     */
    private int defaultLaneCapacity = 4;

    private Progression progression = new Progression();
    private Ranking ranking = new Ranking();

    public int resolveLaneCapacity(Integer declared) {
        return declared == null || declared < 1 ? defaultLaneCapacity : declared;
    }

    @Getter
    @Setter
    public static class Progression {
        private boolean hasRepechage = true;
        private int timeTrialDirectAdvance = 4;
        private int timeTrialToRepechage = 4;
        private int repechageAdvance = 2;
        private int quarterfinalAdvance = 1;
        private int semifinalAdvance = 1;
        private int semifinalToFinalB = 1;
        private int repechageLanesPerHeat = 2;

        public ProgressionConfig toConfig() {
            ProgressionConfig config = new ProgressionConfig();
            config.setHasRepechage(hasRepechage);
            config.setTimeTrialDirectAdvance(timeTrialDirectAdvance);
            config.setTimeTrialToRepechage(timeTrialToRepechage);
            config.setRepechageAdvance(repechageAdvance);
            config.setQuarterfinalAdvance(quarterfinalAdvance);
            config.setSemifinalAdvance(semifinalAdvance);
            config.setSemifinalToFinalB(semifinalToFinalB);
            config.setRepechageLanesPerHeat(repechageLanesPerHeat);
            return config;
        }
    }

    @Getter
    @Setter
    public static class Ranking {
        private Map<Integer, Integer> pointTable = new TreeMap<>(PointTable.DEFAULT_POINTS);
        private int maxScoringPosition = PointTable.DEFAULT_MAX_SCORING_POSITION;
        private boolean dnfGetsPointsIfFewFinishers = true;
        private GroupBy defaultGroupBy = GroupBy.CATEGORY_GENDER;

        public PointTable toPointTable() {
            return new PointTable(pointTable, maxScoringPosition);
        }
    }
}

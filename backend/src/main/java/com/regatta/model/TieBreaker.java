package com.regatta.model;

import java.util.List;

/**
 * Orders entries with equal points or medals. Applied in list order; entries
 * still tied after every tie-breaker fall back to name order.
 */
public enum TieBreaker {
    MORE_FIRST_PLACES,
    MORE_SECOND_PLACES,
    /** Lower summed elapsed time of counted races wins. No timed race sorts last. */
    TOTAL_TIME,
    BEST_TIME,
    ALPHABETICAL;

    public static final List<TieBreaker> DEFAULT_ORDER =
            List.of(MORE_FIRST_PLACES, MORE_SECOND_PLACES, TOTAL_TIME, ALPHABETICAL);
}

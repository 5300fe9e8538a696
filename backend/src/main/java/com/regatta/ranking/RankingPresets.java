package com.regatta.ranking;

import com.regatta.model.Discipline;
import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;

import java.util.List;
import java.util.Optional;

public final class RankingPresets {

    private static final List<TieBreaker> PLACES_THEN_TIME = TieBreaker.DEFAULT_ORDER;
    private static final List<TieBreaker> TIME_FIRST =
            List.of(TieBreaker.TOTAL_TIME, TieBreaker.MORE_FIRST_PLACES, TieBreaker.ALPHABETICAL);
    private static final List<TieBreaker> WINS_THEN_TIME =
            List.of(TieBreaker.MORE_FIRST_PLACES, TieBreaker.TOTAL_TIME, TieBreaker.ALPHABETICAL);

    public static final List<RankingPreset> ALL = List.of(
            new RankingPreset(
                    "CLASSIC_CUP",
                    "Classic Cup",
                    "Coupe Classique",
                    "الكأس الكلاسيكية",
                    "Men's and women's cups across all categories, points to clubs",
                    GroupBy.GENDER,
                    RankingEntityType.CLUB,
                    ScoringMode.POINTS,
                    JourneyMode.ALL,
                    PointMode.CREW_CLUB,
                    Discipline.CLASSIC,
                    PLACES_THEN_TIME,
                    1
            ),
            new RankingPreset(
                    "BEACH_CUP",
                    "Beach Cup",
                    "Coupe de Beach",
                    "كأس الشاطئ",
                    "One cup per age category with both genders combined",
                    GroupBy.CATEGORY,
                    RankingEntityType.CLUB,
                    ScoringMode.POINTS,
                    JourneyMode.ALL,
                    PointMode.MIXED,
                    Discipline.BEACH,
                    PLACES_THEN_TIME,
                    2
            ),
            new RankingPreset(
                    "CHAMPIONSHIP_CAT",
                    "Championship by Category",
                    "Championnat par Catégorie",
                    "البطولة حسب الفئة",
                    "Each category and gender ranked separately on final results only",
                    GroupBy.CATEGORY_GENDER,
                    RankingEntityType.CLUB,
                    ScoringMode.POINTS,
                    JourneyMode.FINAL_ONLY,
                    PointMode.MIXED,
                    null,
                    TIME_FIRST,
                    3
            ),
            new RankingPreset(
                    "COASTAL_CUP",
                    "Coastal Cup",
                    "Coupe Coastal",
                    "كأس الساحل",
                    "Coastal cup grouped by gender",
                    GroupBy.GENDER,
                    RankingEntityType.CLUB,
                    ScoringMode.POINTS,
                    JourneyMode.ALL,
                    PointMode.MIXED,
                    Discipline.COASTAL,
                    PLACES_THEN_TIME,
                    4
            ),
            new RankingPreset(
                    "CLUB_CHAMP",
                    "Club Championship",
                    "Championnat des Clubs",
                    "بطولة الأندية",
                    "All points go to clubs, grouped by gender",
                    GroupBy.GENDER,
                    RankingEntityType.CLUB,
                    ScoringMode.POINTS,
                    JourneyMode.ALL,
                    PointMode.CREW_CLUB,
                    null,
                    PLACES_THEN_TIME,
                    5
            ),
            new RankingPreset(
                    "ATHLETE_CHAMP",
                    "Athlete Championship",
                    "Championnat des Athlètes",
                    "بطولة الرياضيين",
                    "All points go to individual athletes, grouped by category and gender",
                    GroupBy.CATEGORY_GENDER,
                    RankingEntityType.ATHLETE,
                    ScoringMode.POINTS,
                    JourneyMode.ALL,
                    PointMode.SKIFF_ATHLETE,
                    null,
                    WINS_THEN_TIME,
                    6
            ),
            new RankingPreset(
                    "BEACH_SPRINT_MEDALS",
                    "Beach Sprint Medal Table",
                    "Tableau des Médailles Beach Sprint",
                    "جدول ميداليات السرعة الشاطئية",
                    "Club medal table from beach sprint knockout events",
                    GroupBy.CATEGORY_GENDER,
                    RankingEntityType.CLUB,
                    ScoringMode.MEDALS,
                    JourneyMode.ALL,
                    PointMode.CREW_CLUB,
                    Discipline.BEACH,
                    PLACES_THEN_TIME,
                    7
            )
    );

    private RankingPresets() {
    }

    public static Optional<RankingPreset> byCode(String code) {
        return ALL.stream()
                .filter(preset -> preset.code().equalsIgnoreCase(code))
                .findFirst();
    }

    public static List<RankingPreset> forDiscipline(Discipline discipline) {
        return ALL.stream()
                .filter(preset -> preset.appliesTo(discipline))
                .toList();
    }
}
